package com.gentoro.flowplan.converter;

import com.gentoro.flowplan.exception.ConfigException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;

/**
 * Tunables of the compiler.
 *
 * <p>Expected YAML structure:
 *
 * <pre>
 * converter:
 *   graph:
 *     max-depth: 100000
 *     strict-boundaries: true
 *   resources:
 *     always-keep: [server, web]
 * </pre>
 */
public final class ConverterSettings {
  public static final int DEFAULT_MAX_DEPTH = 100_000;
  public static final List<String> DEFAULT_ALWAYS_KEEP = List.of("server", "web");

  private final int maxDepth;
  private final boolean strictBoundaries;
  private final Set<String> alwaysKeptResourceKinds;

  public ConverterSettings(
      int maxDepth, boolean strictBoundaries, List<String> alwaysKeptResourceKinds) {
    if (maxDepth <= 0) {
      throw new ConfigException("converter.graph.max-depth must be positive, got " + maxDepth);
    }
    this.maxDepth = maxDepth;
    this.strictBoundaries = strictBoundaries;
    Set<String> kinds = new LinkedHashSet<>();
    for (String kind : Objects.requireNonNull(alwaysKeptResourceKinds, "alwaysKeptResourceKinds")) {
      if (kind != null && !kind.isBlank()) kinds.add(kind.trim().toLowerCase(Locale.ROOT));
    }
    this.alwaysKeptResourceKinds = Set.copyOf(kinds);
  }

  public static ConverterSettings defaults() {
    return new ConverterSettings(DEFAULT_MAX_DEPTH, true, DEFAULT_ALWAYS_KEEP);
  }

  public static ConverterSettings from(Configuration cfg) {
    if (cfg == null) return defaults();
    try {
      int maxDepth = cfg.getInt("converter.graph.max-depth", DEFAULT_MAX_DEPTH);
      boolean strict = cfg.getBoolean("converter.graph.strict-boundaries", true);
      List<String> keep =
          cfg.containsKey("converter.resources.always-keep")
              ? new ArrayList<>(cfg.getList(String.class, "converter.resources.always-keep"))
              : DEFAULT_ALWAYS_KEEP;
      return new ConverterSettings(maxDepth, strict, keep);
    } catch (org.apache.commons.configuration2.ex.ConversionException e) {
      throw new ConfigException("Invalid converter configuration", e);
    }
  }

  /** Upper bound of the backward edge walk, guarding against runaway recursion. */
  public int maxDepth() {
    return maxDepth;
  }

  /** When set, a second start or end node fails compilation instead of replacing the first. */
  public boolean strictBoundaries() {
    return strictBoundaries;
  }

  /** Lower-cased resource kinds that survive pruning even when no node references them. */
  public Set<String> alwaysKeptResourceKinds() {
    return alwaysKeptResourceKinds;
  }

  public boolean isAlwaysKept(String kind) {
    return kind != null && alwaysKeptResourceKinds.contains(kind.toLowerCase(Locale.ROOT));
  }

  @Override
  public String toString() {
    return "ConverterSettings{maxDepth="
        + maxDepth
        + ", strictBoundaries="
        + strictBoundaries
        + ", alwaysKeep="
        + alwaysKeptResourceKinds
        + '}';
  }
}

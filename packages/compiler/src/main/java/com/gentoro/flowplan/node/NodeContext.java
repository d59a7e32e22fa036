package com.gentoro.flowplan.node;

import com.gentoro.flowplan.converter.ConverterSettings;
import java.util.Objects;

/** Collaborators shared by every node a factory creates. */
public record NodeContext(
    NodeFactory factory, ReferenceResolver resolver, ConverterSettings settings) {
  public NodeContext {
    Objects.requireNonNull(factory, "factory");
    Objects.requireNonNull(resolver, "resolver");
    Objects.requireNonNull(settings, "settings");
  }
}

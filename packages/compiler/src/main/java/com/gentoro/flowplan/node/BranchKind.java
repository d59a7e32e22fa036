package com.gentoro.flowplan.node;

/** How a fork node lays out its cases in the plan. */
public enum BranchKind {
  /** Two lists under {@code args.true} and {@code args.false}. */
  IFS,
  /** Keyed lists under {@code args.nodes}, {@code default} case last. */
  SWITCH,
  /** Keyed lists under {@code args.nodes}, declared order. */
  INTENTION
}

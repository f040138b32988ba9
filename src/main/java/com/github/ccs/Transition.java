package com.github.ccs;

import java.util.Objects;

/**
 * One derived move of a process term: the action it performs and the term it becomes. The source
 * term is implicit, it is whatever {@link Semantics#step(Process, Environment)} was called with.
 */
public final class Transition {
  private final Action label;
  private final Process target;

  public Transition(final Action label, final Process target) {
    this.label = Objects.requireNonNull(label, "label");
    this.target = Objects.requireNonNull(target, "target");
  }

  public Action getLabel() {
    return label;
  }

  public Process getTarget() {
    return target;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + label.hashCode();
    result = prime * result + target.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    Transition other = (Transition) obj;
    return label.equals(other.label) && target.equals(other.target);
  }

  @Override
  public String toString() {
    return "--" + label + "--> " + target;
  }
}

package com.github.ccs;

import java.util.regex.Pattern;

/**
 * This object represents an immutable action label: either a visible name with a polarity (plain
 * {@code a} or co-action {@code a'}) or the distinguished silent action τ.
 *
 * Notes:<br>
 * 1. the co-action of {@code a} is {@code a'} and the co-action of {@code a'} is {@code a}<br>
 * 2. τ has no co-action and is never restricted or renamed<br>
 */
public final class Action {
  public static final String TAU_SYMBOL = "τ";
  public static final String TAU_KEYWORD = "tau";

  public static final Action TAU = new Action(TAU_SYMBOL, false, true);

  private static final Pattern namePattern = Pattern.compile("[a-z][A-Za-z0-9_]*");

  private final String name;
  private final boolean complement;
  private final boolean silent;

  private Action(final String name, final boolean complement, final boolean silent) {
    this.name = name;
    this.complement = complement;
    this.silent = silent;
  }

  /**
   * Parse a label as written in a specification, eg. {@code a}, {@code a'}, {@code tau}.
   */
  public static Action of(final String label) {
    if (label == null) {
      throw new IllegalArgumentException("Action label cannot be null");
    }
    if (TAU_KEYWORD.equals(label) || TAU_SYMBOL.equals(label)) {
      return TAU;
    }
    if (label.endsWith("'")) {
      return named(label.substring(0, label.length() - 1), true);
    }
    return named(label, false);
  }

  public static Action named(final String name, final boolean complement) {
    if (!isValidName(name)) {
      throw new IllegalArgumentException("Illegal action name: " + name);
    }
    return new Action(name, complement, false);
  }

  public static boolean isValidName(final String name) {
    return name != null && !TAU_KEYWORD.equals(name) && namePattern.matcher(name).matches();
  }

  public String getName() {
    return name;
  }

  public boolean isComplement() {
    return complement;
  }

  public boolean isSilent() {
    return silent;
  }

  public Action complement() {
    if (silent) {
      throw new IllegalStateException("The silent action has no co-action");
    }
    return new Action(name, !complement, false);
  }

  /**
   * True iff both labels are visible, share the same name and have opposite polarity.
   */
  public boolean complements(final Action other) {
    return other != null && !silent && !other.silent && name.equals(other.name)
        && complement != other.complement;
  }

  /**
   * Same polarity, different name. τ stays τ.
   */
  public Action rename(final String newName) {
    if (silent) {
      return this;
    }
    return named(newName, complement);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + name.hashCode();
    result = prime * result + (complement ? 1231 : 1237);
    result = prime * result + (silent ? 1231 : 1237);
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
    Action other = (Action) obj;
    return complement == other.complement && silent == other.silent && name.equals(other.name);
  }

  @Override
  public String toString() {
    return complement ? name + "'" : name;
  }
}

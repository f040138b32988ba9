package com.github.ccs;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Immutable CCS process term. The set of variants is fixed by the calculus and closed: the only
 * subclasses are the nested ones below and all case analysis goes through {@link Visitor}, so
 * adding a variant breaks every consumer at compile time rather than at runtime.
 *
 * Notes for users:<br>
 * 1. terms are compared structurally and cache their hash code, which is what lets the explorer
 * intern them as states<br>
 *
 * 2. a {@link Reference} is not a semantic form by itself, it is looked up in an
 * {@link Environment} at each derivation step and never inlined, so cyclic definitions never
 * materialize as cyclic object graphs<br>
 *
 * 3. {@link #toString()} prints the term in the input language and parsing the printed form yields
 * an equal term<br>
 */
public abstract class Process {
  public static final String ANONYMOUS_NAME = "_";

  private static final Pattern processNamePattern = Pattern.compile("[A-Z][A-Za-z0-9_]*");

  private final Kind kind;

  public static enum Kind {
    DEADLOCK, PREFIX, CHOICE, PARALLEL, RESTRICTION, RELABEL, REFERENCE;
  }

  /**
   * Exhaustive case analysis over the term variants.
   */
  public interface Visitor<R> {
    R visitDeadlock(Deadlock deadlock) throws CcsException;

    R visitPrefix(Prefix prefix) throws CcsException;

    R visitChoice(Choice choice) throws CcsException;

    R visitParallel(Parallel parallel) throws CcsException;

    R visitRestriction(Restriction restriction) throws CcsException;

    R visitRelabel(Relabel relabel) throws CcsException;

    R visitReference(Reference reference) throws CcsException;
  }

  // closed hierarchy
  private Process(final Kind kind) {
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }

  public abstract <R> R accept(final Visitor<R> visitor) throws CcsException;

  ///// Factories /////
  public static Process deadlock() {
    return Deadlock.INSTANCE;
  }

  public static Process prefix(final Action action, final Process continuation) {
    return new Prefix(action, continuation);
  }

  public static Process prefix(final String action, final Process continuation) {
    return new Prefix(Action.of(action), continuation);
  }

  public static Process choice(final Process left, final Process right) {
    return new Choice(left, right);
  }

  /**
   * Right-nested choice over all operands, eg. choice(p, q, r) = p + (q + r).
   */
  public static Process choice(final Process... operands) {
    return foldRight(Kind.CHOICE, operands);
  }

  public static Process parallel(final Process left, final Process right) {
    return new Parallel(left, right);
  }

  public static Process parallel(final Process... operands) {
    return foldRight(Kind.PARALLEL, operands);
  }

  public static Process restrict(final Process inner, final Collection<String> names) {
    return new Restriction(inner, names);
  }

  public static Process restrict(final Process inner, final String... names) {
    final List<String> restricted = new ArrayList<>();
    Collections.addAll(restricted, names);
    return new Restriction(inner, restricted);
  }

  /**
   * @param renaming K=old action name, V=new action name
   */
  public static Process relabel(final Process inner, final Map<String, String> renaming) {
    return new Relabel(inner, renaming);
  }

  /**
   * Single renaming in the notation of the input language: P[newName/oldName].
   */
  public static Process relabel(final Process inner, final String newName, final String oldName) {
    return new Relabel(inner, Collections.singletonMap(oldName, newName));
  }

  public static Process reference(final String name) {
    return new Reference(name);
  }

  public static boolean isValidProcessName(final String name) {
    return name != null
        && (ANONYMOUS_NAME.equals(name) || processNamePattern.matcher(name).matches());
  }

  private static Process foldRight(final Kind kind, final Process... operands) {
    if (operands == null || operands.length == 0) {
      throw new IllegalArgumentException(kind + " needs at least one operand");
    }
    Process folded = operands[operands.length - 1];
    for (int iter = operands.length - 2; iter >= 0; iter--) {
      folded = kind == Kind.CHOICE ? new Choice(operands[iter], folded)
          : new Parallel(operands[iter], folded);
    }
    return folded;
  }

  // postfix operators bind tighter than prefix, so a prefix operand needs parentheses
  private static String postfixOperand(final Process inner) {
    final String printed = inner.toString();
    if (inner.kind == Kind.PREFIX || inner.kind == Kind.RESTRICTION) {
      return "(" + printed + ")";
    }
    return printed;
  }

  private static String printRightSpine(final Process process, final Kind kind,
      final String operator) {
    final StringBuilder builder = new StringBuilder("(");
    Process current = process;
    while (current.kind == kind) {
      if (kind == Kind.CHOICE) {
        builder.append(((Choice) current).left).append(operator);
        current = ((Choice) current).right;
      } else {
        builder.append(((Parallel) current).left).append(operator);
        current = ((Parallel) current).right;
      }
    }
    return builder.append(current).append(')').toString();
  }

  ///// Variants /////
  public static final class Deadlock extends Process {
    private static final Deadlock INSTANCE = new Deadlock();

    private Deadlock() {
      super(Kind.DEADLOCK);
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) throws CcsException {
      return visitor.visitDeadlock(this);
    }

    @Override
    public int hashCode() {
      return 0;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Deadlock;
    }

    @Override
    public String toString() {
      return "0";
    }
  }

  public static final class Prefix extends Process {
    private final Action action;
    private final Process continuation;
    private final int hash;

    private Prefix(final Action action, final Process continuation) {
      super(Kind.PREFIX);
      this.action = Objects.requireNonNull(action, "action");
      this.continuation = Objects.requireNonNull(continuation, "continuation");
      this.hash = Objects.hash(Kind.PREFIX.ordinal(), action, continuation);
    }

    public Action getAction() {
      return action;
    }

    public Process getContinuation() {
      return continuation;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) throws CcsException {
      return visitor.visitPrefix(this);
    }

    @Override
    public int hashCode() {
      return hash;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Prefix)) {
        return false;
      }
      final Prefix other = (Prefix) obj;
      return hash == other.hash && action.equals(other.action)
          && continuation.equals(other.continuation);
    }

    @Override
    public String toString() {
      return action + "." + continuation;
    }
  }

  public static final class Choice extends Process {
    private final Process left;
    private final Process right;
    private final int hash;

    private Choice(final Process left, final Process right) {
      super(Kind.CHOICE);
      this.left = Objects.requireNonNull(left, "left");
      this.right = Objects.requireNonNull(right, "right");
      this.hash = Objects.hash(Kind.CHOICE.ordinal(), left, right);
    }

    public Process getLeft() {
      return left;
    }

    public Process getRight() {
      return right;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) throws CcsException {
      return visitor.visitChoice(this);
    }

    @Override
    public int hashCode() {
      return hash;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Choice)) {
        return false;
      }
      final Choice other = (Choice) obj;
      return hash == other.hash && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public String toString() {
      return printRightSpine(this, Kind.CHOICE, " + ");
    }
  }

  public static final class Parallel extends Process {
    private final Process left;
    private final Process right;
    private final int hash;

    private Parallel(final Process left, final Process right) {
      super(Kind.PARALLEL);
      this.left = Objects.requireNonNull(left, "left");
      this.right = Objects.requireNonNull(right, "right");
      this.hash = Objects.hash(Kind.PARALLEL.ordinal(), left, right);
    }

    public Process getLeft() {
      return left;
    }

    public Process getRight() {
      return right;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) throws CcsException {
      return visitor.visitParallel(this);
    }

    @Override
    public int hashCode() {
      return hash;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Parallel)) {
        return false;
      }
      final Parallel other = (Parallel) obj;
      return hash == other.hash && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public String toString() {
      return printRightSpine(this, Kind.PARALLEL, " | ");
    }
  }

  public static final class Restriction extends Process {
    private final Process inner;
    private final SortedSet<String> restricted;
    private final int hash;

    private Restriction(final Process inner, final Collection<String> names) {
      super(Kind.RESTRICTION);
      this.inner = Objects.requireNonNull(inner, "inner");
      if (names == null || names.isEmpty()) {
        throw new IllegalArgumentException("Restriction needs at least one action name");
      }
      final SortedSet<String> sorted = new TreeSet<>();
      for (final String name : names) {
        if (!Action.isValidName(name)) {
          throw new IllegalArgumentException("Cannot restrict illegal action name: " + name);
        }
        sorted.add(name);
      }
      this.restricted = Collections.unmodifiableSortedSet(sorted);
      this.hash = Objects.hash(Kind.RESTRICTION.ordinal(), inner, restricted);
    }

    public Process getInner() {
      return inner;
    }

    public Set<String> getRestricted() {
      return restricted;
    }

    /**
     * True iff the label is visible and its name, in either polarity, is restricted.
     */
    public boolean blocks(final Action action) {
      return !action.isSilent() && restricted.contains(action.getName());
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) throws CcsException {
      return visitor.visitRestriction(this);
    }

    @Override
    public int hashCode() {
      return hash;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Restriction)) {
        return false;
      }
      final Restriction other = (Restriction) obj;
      return hash == other.hash && inner.equals(other.inner)
          && restricted.equals(other.restricted);
    }

    @Override
    public String toString() {
      final StringBuilder builder = new StringBuilder(postfixOperand(inner));
      for (final String name : restricted) {
        builder.append('\\').append(name);
      }
      return builder.toString();
    }
  }

  public static final class Relabel extends Process {
    private final Process inner;
    // K=old name, V=new name
    private final SortedMap<String, String> renaming;
    private final int hash;

    private Relabel(final Process inner, final Map<String, String> renaming) {
      super(Kind.RELABEL);
      this.inner = Objects.requireNonNull(inner, "inner");
      if (renaming == null || renaming.isEmpty()) {
        throw new IllegalArgumentException("Relabeling needs at least one renaming");
      }
      final SortedMap<String, String> sorted = new TreeMap<>();
      for (final Map.Entry<String, String> entry : renaming.entrySet()) {
        if (!Action.isValidName(entry.getKey()) || !Action.isValidName(entry.getValue())) {
          throw new IllegalArgumentException("Illegal renaming: " + entry);
        }
        sorted.put(entry.getKey(), entry.getValue());
      }
      this.renaming = Collections.unmodifiableSortedMap(sorted);
      this.hash = Objects.hash(Kind.RELABEL.ordinal(), inner, this.renaming);
    }

    public Process getInner() {
      return inner;
    }

    public Map<String, String> getRenaming() {
      return renaming;
    }

    /**
     * Rewrite a visible label per the renaming, keeping its polarity. τ passes through untouched.
     */
    public Action apply(final Action action) {
      if (action.isSilent()) {
        return action;
      }
      final String renamed = renaming.get(action.getName());
      return renamed == null ? action : action.rename(renamed);
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) throws CcsException {
      return visitor.visitRelabel(this);
    }

    @Override
    public int hashCode() {
      return hash;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Relabel)) {
        return false;
      }
      final Relabel other = (Relabel) obj;
      return hash == other.hash && inner.equals(other.inner) && renaming.equals(other.renaming);
    }

    @Override
    public String toString() {
      final StringBuilder builder = new StringBuilder(postfixOperand(inner)).append('[');
      boolean first = true;
      for (final Map.Entry<String, String> entry : renaming.entrySet()) {
        if (!first) {
          builder.append(',');
        }
        builder.append(entry.getValue()).append('/').append(entry.getKey());
        first = false;
      }
      return builder.append(']').toString();
    }
  }

  public static final class Reference extends Process {
    private final String name;

    private Reference(final String name) {
      super(Kind.REFERENCE);
      if (!isValidProcessName(name)) {
        throw new IllegalArgumentException("Illegal process name: " + name);
      }
      this.name = name;
    }

    public String getName() {
      return name;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) throws CcsException {
      return visitor.visitReference(this);
    }

    @Override
    public int hashCode() {
      return 31 * Kind.REFERENCE.ordinal() + name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Reference)) {
        return false;
      }
      return name.equals(((Reference) obj).name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

}

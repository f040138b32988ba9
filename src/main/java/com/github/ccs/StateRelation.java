package com.github.ccs;

import java.util.BitSet;

import com.github.ccs.CcsException.Code;

/**
 * A relation between the states of two transition systems, kept as one bit per state pair. Pair
 * (p, q) relates state p of the left system to state q of the right system. When both sides are the
 * same system the bisimulation algorithms keep the relation symmetric.
 */
public final class StateRelation {
  private final int leftCount;
  private final int rightCount;
  private final BitSet pairs;

  private StateRelation(final int leftCount, final int rightCount, final BitSet pairs) {
    this.leftCount = leftCount;
    this.rightCount = rightCount;
    this.pairs = pairs;
  }

  /**
   * Every pair related, the starting point of refinement.
   */
  static StateRelation full(final int leftCount, final int rightCount) throws CcsException {
    final int size = pairSpace(leftCount, rightCount);
    final BitSet pairs = new BitSet(size);
    pairs.set(0, size);
    return new StateRelation(leftCount, rightCount, pairs);
  }

  static StateRelation empty(final int leftCount, final int rightCount) throws CcsException {
    return new StateRelation(leftCount, rightCount, new BitSet(pairSpace(leftCount, rightCount)));
  }

  private static int pairSpace(final int leftCount, final int rightCount) throws CcsException {
    final long size = (long) leftCount * (long) rightCount;
    if (size > Integer.MAX_VALUE) {
      throw new CcsException(Code.STATE_SPACE_TOO_LARGE, String.format(
          "%d x %d state pairs exceed the capacity of a relation", leftCount, rightCount));
    }
    return (int) size;
  }

  public boolean contains(final int left, final int right) {
    return pairs.get(pairIndex(left, right));
  }

  public int getLeftCount() {
    return leftCount;
  }

  public int getRightCount() {
    return rightCount;
  }

  /**
   * Number of related pairs.
   */
  public int size() {
    return pairs.cardinality();
  }

  /**
   * Right states related to the given left state, ascending.
   */
  public int[] relatedTo(final int left) {
    final int from = pairIndex(left, 0);
    final int to = from + rightCount;
    final int[] related = new int[pairs.get(from, to).cardinality()];
    int found = 0;
    for (int index = pairs.nextSetBit(from); index >= 0 && index < to; index =
        pairs.nextSetBit(index + 1)) {
      related[found++] = index - from;
    }
    return related;
  }

  int pairIndex(final int left, final int right) {
    return left * rightCount + right;
  }

  int leftOf(final int pairIndex) {
    return pairIndex / rightCount;
  }

  int rightOf(final int pairIndex) {
    return pairIndex % rightCount;
  }

  void add(final int left, final int right) {
    pairs.set(pairIndex(left, right));
  }

  void remove(final int left, final int right) {
    pairs.clear(pairIndex(left, right));
  }

  void removeIndex(final int pairIndex) {
    pairs.clear(pairIndex);
  }

  StateRelation copy() {
    return new StateRelation(leftCount, rightCount, (BitSet) pairs.clone());
  }

  @Override
  public int hashCode() {
    return 31 * (31 * leftCount + rightCount) + pairs.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof StateRelation)) {
      return false;
    }
    final StateRelation other = (StateRelation) obj;
    return leftCount == other.leftCount && rightCount == other.rightCount
        && pairs.equals(other.pairs);
  }

  @Override
  public String toString() {
    return "StateRelation [leftCount=" + leftCount + ", rightCount=" + rightCount + ", size="
        + size() + "]";
  }
}

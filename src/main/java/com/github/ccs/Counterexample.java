package com.github.ccs;

/**
 * Witness of non-bisimilarity: a move of one state that the other state cannot answer. Either the
 * other state offers no move with the same label at all, or every such move ends in a pair that is
 * itself distinguishable.
 */
public final class Counterexample {
  private final int leftState;
  private final int rightState;
  private final Side side;
  private final Action label;
  private final int target;
  private final Process mover;
  private final Process moveTarget;
  private final boolean labelOffered;

  // which state performs the unmatched move
  public static enum Side {
    LEFT, RIGHT;
  }

  Counterexample(final int leftState, final int rightState, final Side side, final Action label,
      final int target, final Process mover, final Process moveTarget,
      final boolean labelOffered) {
    this.leftState = leftState;
    this.rightState = rightState;
    this.side = side;
    this.label = label;
    this.target = target;
    this.mover = mover;
    this.moveTarget = moveTarget;
    this.labelOffered = labelOffered;
  }

  public int getLeftState() {
    return leftState;
  }

  public int getRightState() {
    return rightState;
  }

  public Side getSide() {
    return side;
  }

  /**
   * Label of the unmatched move.
   */
  public Action getLabel() {
    return label;
  }

  /**
   * Target state of the unmatched move, numbered in the transition system of {@link #getSide()}.
   */
  public int getTarget() {
    return target;
  }

  public Process getMover() {
    return mover;
  }

  public Process getMoveTarget() {
    return moveTarget;
  }

  /**
   * True if the other state offers the label but none of its moves leads to a bisimilar state.
   */
  public boolean isLabelOffered() {
    return labelOffered;
  }

  public String getMessage() {
    final String other = side == Side.LEFT ? "right" : "left";
    if (labelOffered) {
      return String.format("%s --%s--> %s cannot be matched by the %s state: every %s move leads "
          + "to a distinguishable state", mover, label, moveTarget, other, label);
    }
    return String.format("%s --%s--> %s cannot be matched: the %s state offers no %s move", mover,
        label, moveTarget, other, label);
  }

  @Override
  public String toString() {
    return "Counterexample [leftState=" + leftState + ", rightState=" + rightState + ", side="
        + side + ", label=" + label + ", target=" + target + ", labelOffered=" + labelOffered
        + "]";
  }
}

package com.github.ccs;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Structural operational semantics of CCS: derives the one-step transitions of a term.
 *
 * {@link #step(Process, Environment)} is deterministic and free of side effects. Its result is a
 * set, so a (label, term) pair derivable through more than one rule application, eg. two different
 * synchronizing sub-pairs that end up in the same parallel term, is a single transition. The
 * iteration order of the returned set is deterministic for a given term.
 */
public final class Semantics {

  /**
   * Derive all transitions of the given term. Compound terms first derive the transitions of their
   * immediate subterms and combine them per the rule of their operator.
   *
   * @throws CcsException with {@link CcsException.Code#UNDEFINED_PROCESS} if the term refers to a
   *         name the environment does not define
   */
  public static Set<Transition> step(final Process term, final Environment environment)
      throws CcsException {
    return term.accept(new StepVisitor(environment));
  }

  private static final class StepVisitor implements Process.Visitor<Set<Transition>> {
    private final Environment environment;

    private StepVisitor(final Environment environment) {
      this.environment = environment;
    }

    @Override
    public Set<Transition> visitDeadlock(final Process.Deadlock deadlock) {
      return Collections.emptySet();
    }

    @Override
    public Set<Transition> visitPrefix(final Process.Prefix prefix) {
      return Collections.singleton(new Transition(prefix.getAction(), prefix.getContinuation()));
    }

    @Override
    public Set<Transition> visitChoice(final Process.Choice choice) throws CcsException {
      final Set<Transition> transitions = new LinkedHashSet<>(choice.getLeft().accept(this));
      transitions.addAll(choice.getRight().accept(this));
      return transitions;
    }

    @Override
    public Set<Transition> visitParallel(final Process.Parallel parallel) throws CcsException {
      final Process left = parallel.getLeft();
      final Process right = parallel.getRight();
      final Set<Transition> leftMoves = left.accept(this);
      final Set<Transition> rightMoves = right.accept(this);

      final Set<Transition> transitions = new LinkedHashSet<>();
      // 1. left moves alone
      for (final Transition move : leftMoves) {
        transitions.add(new Transition(move.getLabel(), Process.parallel(move.getTarget(), right)));
      }
      // 2. right moves alone
      for (final Transition move : rightMoves) {
        transitions.add(new Transition(move.getLabel(), Process.parallel(left, move.getTarget())));
      }
      // 3. both move together on complementary actions
      for (final Transition leftMove : leftMoves) {
        for (final Transition rightMove : rightMoves) {
          if (leftMove.getLabel().complements(rightMove.getLabel())) {
            transitions.add(new Transition(Action.TAU,
                Process.parallel(leftMove.getTarget(), rightMove.getTarget())));
          }
        }
      }
      return transitions;
    }

    @Override
    public Set<Transition> visitRestriction(final Process.Restriction restriction)
        throws CcsException {
      final Set<Transition> transitions = new LinkedHashSet<>();
      for (final Transition move : restriction.getInner().accept(this)) {
        if (!restriction.blocks(move.getLabel())) {
          transitions.add(new Transition(move.getLabel(),
              Process.restrict(move.getTarget(), restriction.getRestricted())));
        }
      }
      return transitions;
    }

    @Override
    public Set<Transition> visitRelabel(final Process.Relabel relabel) throws CcsException {
      final Set<Transition> transitions = new LinkedHashSet<>();
      for (final Transition move : relabel.getInner().accept(this)) {
        transitions.add(new Transition(relabel.apply(move.getLabel()),
            Process.relabel(move.getTarget(), relabel.getRenaming())));
      }
      return transitions;
    }

    @Override
    public Set<Transition> visitReference(final Process.Reference reference) throws CcsException {
      return environment.resolve(reference).accept(this);
    }
  }

  private Semantics() {}
}

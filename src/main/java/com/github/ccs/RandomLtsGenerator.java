package com.github.ccs;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generates random finite-state specifications for benchmarking. State {@code Si} is defined as a
 * choice of prefixed references {@code aj.Sk}, or {@code 0} when no transition was drawn for it.
 * Equal seeds produce equal environments.
 */
public final class RandomLtsGenerator {

  public static String stateName(final int state) {
    return "S" + state;
  }

  public static String actionName(final int action) {
    return "a" + action;
  }

  /**
   * @param states number of definitions S0 .. S(states-1), S0 is the main process
   * @param actions size of the alphabet a0 .. a(actions-1)
   * @param transitions number of transitions drawn, each with a uniformly chosen source, target
   *        and label. The same transition may be drawn twice
   */
  public static Environment generate(final int states, final int actions, final int transitions,
      final long seed) throws CcsException {
    if (states < 1 || actions < 1 || transitions < 0) {
      throw new IllegalArgumentException(String.format(
          "Need at least one state and one action, got states=%d, actions=%d, transitions=%d",
          states, actions, transitions));
    }
    final Random random = new Random(seed);
    final List<List<Process>> moves = new ArrayList<>(states);
    for (int state = 0; state < states; state++) {
      moves.add(new ArrayList<Process>());
    }
    for (int iter = 0; iter < transitions; iter++) {
      final int target = random.nextInt(states);
      final int source = random.nextInt(states);
      final int action = random.nextInt(actions);
      moves.get(source).add(Process.prefix(Action.named(actionName(action), false),
          Process.reference(stateName(target))));
    }
    final Environment.EnvironmentBuilder builder = Environment.EnvironmentBuilder.newBuilder();
    for (int state = 0; state < states; state++) {
      final List<Process> choices = moves.get(state);
      builder.define(stateName(state), choices.isEmpty() ? Process.deadlock()
          : Process.choice(choices.toArray(new Process[choices.size()])));
    }
    return builder.build();
  }

  private RandomLtsGenerator() {}
}

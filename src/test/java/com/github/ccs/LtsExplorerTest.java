package com.github.ccs;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.junit.Test;

import com.github.ccs.Environment.EnvironmentBuilder;

/**
 * Tests to maintain the sanity and correctness of LtsExplorer.
 */
public class LtsExplorerTest {
  private static final Process nil = Process.deadlock();

  @Test
  public void testRecursiveProcessIsSingleStateWithSelfLoop() throws CcsException {
    final Environment environment = EnvironmentBuilder.newBuilder()
        .define("P", Process.prefix("a", Process.reference("P"))).build();
    final Lts lts = new LtsExplorer().explore(Process.reference("P"), environment);
    assertEquals(1, lts.stateCount());
    assertEquals(1, lts.edgeCount());
    final Lts.Edge loop = lts.getEdges().get(0);
    assertEquals(0, loop.getSource());
    assertEquals(0, loop.getTarget());
    assertEquals(Action.of("a"), loop.getLabel());
    assertEquals(Process.reference("P"), lts.getState(0));
  }

  @Test
  public void testDefiningTermIsSameStateAsName() throws CcsException {
    final Process body = Process.prefix("a", Process.reference("P"));
    final Environment environment = EnvironmentBuilder.newBuilder().define("P", body).build();
    final Lts lts = new LtsExplorer().explore(body, environment);
    assertEquals(1, lts.stateCount());
    assertEquals(0, lts.indexOf(Process.reference("P")));
    assertEquals(0, lts.indexOf(body));
  }

  @Test
  public void testTargetsInternedToOneStateGiveOneEdge() throws CcsException {
    // 1. P and a.0 are different terms but the same state once P is resolved
    final Environment environment = EnvironmentBuilder.newBuilder()
        .define("P", Process.prefix("a", nil)).build();
    final Process root = Process.choice(Process.prefix("a", Process.reference("P")),
        Process.prefix("a", Process.prefix("a", nil)));
    final Lts lts = new LtsExplorer().explore(root, environment);
    assertEquals(3, lts.stateCount());
    assertEquals(2, lts.edgeCount());
    assertEquals(lts.edgeCount(), new HashSet<>(lts.getEdges()).size());

    // 2. same with several workers
    assertEquals(lts.getEdges(), new LtsExplorer(3).explore(root, environment).getEdges());
  }

  @Test
  public void testGeneratedSpecificationHasDistinctEdges() throws CcsException {
    final Environment environment = RandomLtsGenerator.generate(60, 2, 240, 7L);
    final Lts lts =
        new LtsExplorer().explore(environment.getMainProcess().get(), environment);
    assertEquals(lts.edgeCount(), new HashSet<>(lts.getEdges()).size());
  }

  @Test
  public void testEveryEdgeConnectsKnownStates() throws CcsException {
    // 1. two one-place buffers B0 = in.B1, B1 = out'.B0 chained through mid
    final Environment environment = EnvironmentBuilder.newBuilder()
        .define("B0", Process.prefix("in", Process.reference("B1")))
        .define("B1", Process.prefix("out'", Process.reference("B0")))
        .define("Pipe", Process.restrict(Process.parallel(
            Process.relabel(Process.reference("B0"), "mid", "out"),
            Process.relabel(Process.reference("B0"), "mid", "in")), "mid"))
        .build();
    final Lts lts = new LtsExplorer().explore(Process.reference("Pipe"), environment);

    // 2. 2 x 2 buffer states, all reachable
    assertEquals(4, lts.stateCount());
    for (final Lts.Edge edge : lts.getEdges()) {
      assertTrue(edge.getSource() >= 0 && edge.getSource() < lts.stateCount());
      assertTrue(edge.getTarget() >= 0 && edge.getTarget() < lts.stateCount());
      assertTrue(lts.outgoing(edge.getSource()).contains(edge));
      assertTrue(lts.incoming(edge.getTarget()).contains(edge));
    }
    final Set<Action> alphabet = new HashSet<>(lts.getAlphabet());
    assertEquals(new HashSet<>(Arrays.asList(Action.of("in"), Action.of("out'"), Action.TAU)),
        alphabet);
  }

  @Test
  public void testMultipleRoots() throws CcsException {
    final Environment environment = EnvironmentBuilder.newBuilder()
        .define("P", Process.prefix("a", Process.reference("P")))
        .define("Q", Process.prefix("a", Process.prefix("a", Process.reference("Q")))).build();
    final Lts lts = new LtsExplorer().explore(
        Arrays.asList(Process.reference("P"), Process.reference("Q"), Process.reference("P")),
        environment);
    assertEquals(Arrays.asList(0, 1, 0), lts.getRoots());
    assertEquals(3, lts.stateCount());
  }

  @Test
  public void testParallelExplorationMatchesSequential() throws CcsException {
    final Environment environment = RandomLtsGenerator.generate(40, 3, 120, 7L);
    final Process root = environment.getMainProcess().get();
    final Lts sequential = new LtsExplorer(1).explore(root, environment);
    final Lts parallel = new LtsExplorer(4).explore(root, environment);
    assertEquals(sequential.getStates(), parallel.getStates());
    assertEquals(sequential.getEdges(), parallel.getEdges());
  }

  @Test
  public void testUndefinedRootReference() {
    try {
      new LtsExplorer().explore(Process.reference("Missing"), Environment.empty());
      fail("Expected an undefined process");
    } catch (CcsException exception) {
      assertEquals(CcsException.Code.UNDEFINED_PROCESS, exception.getCode());
    }
  }

  @Test
  public void testUnknownState() throws CcsException {
    final Lts lts = new LtsExplorer().explore(Process.prefix("a", nil), Environment.empty());
    assertEquals(2, lts.stateCount());
    try {
      lts.indexOf(Process.prefix("b", nil));
      fail("Expected an unknown state");
    } catch (CcsException exception) {
      assertEquals(CcsException.Code.UNKNOWN_STATE, exception.getCode());
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testWorkersMustBePositive() {
    new LtsExplorer(0);
  }

}

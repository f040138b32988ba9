package com.github.ccs;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.Test;

import com.github.ccs.CcsEngine.CcsEngineBuilder;
import com.github.ccs.CcsException.Code;
import com.github.ccs.EngineConfiguration.EngineConfigurationBuilder;

/**
 * Tests to maintain the sanity and correctness of the engine facade.
 */
public class CcsEngineTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j2.properties");
  }

  private static final String vendingMachines = "Fair = coin.(tea.Fair + coffee.Fair)\n"
      + "Unfair = coin.tea.Unfair + coin.coffee.Unfair\n"
      + "Twice = coin.(tea.coin.(tea.Twice + coffee.Twice) + coffee.Fair)\n";

  @Test
  public void testEngineFlow() throws CcsException {
    // 1. wire up the engine
    final EngineConfiguration config = EngineConfigurationBuilder.newBuilder()
        .algorithm(BisimulationAlgorithmType.WORKLIST_FIXPOINT).explorationWorkers(2).build();
    final CcsEngine engine = CcsEngineBuilder.newBuilder().config(config).build();
    assertNotNull(engine.getId());
    assertEquals(config, engine.getConfiguration());

    // 2. parse and explore
    final Environment environment = new CcsParser().parse(vendingMachines);
    final Lts lts = engine.explore(environment.getMainProcess().get(), environment);
    assertEquals(2, lts.stateCount());

    // 3. check equivalences
    final BisimulationResult fair = engine.checkBisimilarity(Process.reference("Fair"),
        Process.reference("Twice"), environment);
    assertTrue(fair.isBisimilar());
    final BisimulationResult unfair = engine.checkBisimilarity(Process.reference("Fair"),
        Process.reference("Unfair"), environment);
    assertFalse(unfair.isBisimilar());
    assertEquals(Action.of("coin"), unfair.getCounterexample().get().getLabel());

    // 4. check statistics
    final EngineStatistics stats = engine.getStatistics();
    assertEquals(engine.getId(), stats.getEngineId());
    assertEquals(3L, stats.getTotalExplorations());
    assertEquals(2L, stats.getTotalChecks());
    assertEquals(1L, stats.getTotalBisimilarChecks());
    assertEquals(0L, stats.getTotalFailures());
  }

  @Test
  public void testChecksAcrossSystems() throws CcsException {
    final CcsEngine engine = CcsEngineBuilder.newBuilder().build();
    final SpecificationParser parser = new CcsParser();
    final Environment left = parser.parse("A = a.b.A");
    final Environment right = parser.parse("B = a.B1\nB1 = b.a.b.B");
    final Lts leftLts = engine.explore(Process.reference("A"), left);
    final Lts rightLts = engine.explore(Process.reference("B"), right);
    assertTrue(engine.checkBisimilarity(leftLts, Process.reference("A"), rightLts,
        Process.reference("B")).isBisimilar());

    final StateRelation relation = engine.bisimulation(leftLts, rightLts);
    assertEquals(leftLts.stateCount(), relation.getLeftCount());
    assertEquals(rightLts.stateCount(), relation.getRightCount());
    // A ~ B and a.b.B, b.A ~ B1 and b.B
    assertEquals(4, relation.size());

    // merged environments compare directly
    assertTrue(engine.checkBisimilarity(Process.reference("A"), Process.reference("B"),
        left.merge(right)).isBisimilar());
  }

  @Test
  public void testStepAndTraces() throws CcsException {
    final CcsEngine engine = CcsEngineBuilder.newBuilder().build();
    final Environment environment = new CcsParser().parse(vendingMachines);
    final Set<Transition> transitions = engine.step(Process.reference("Unfair"), environment);
    assertEquals(2, transitions.size());

    final Set<List<Action>> traces =
        engine.traces(engine.explore(Process.reference("Unfair"), environment), 2);
    assertEquals(3, traces.size());
    assertTrue(traces.contains(Arrays.asList(Action.of("coin"))));
    assertTrue(traces.contains(Arrays.asList(Action.of("coin"), Action.of("tea"))));
    assertTrue(traces.contains(Arrays.asList(Action.of("coin"), Action.of("coffee"))));
    assertEquals(traces,
        engine.traces(engine.explore(Process.reference("Fair"), environment), 2));
  }

  @Test
  public void testExport() throws CcsException {
    final CcsEngine engine = CcsEngineBuilder.newBuilder().build();
    final Environment environment = new CcsParser().parse(vendingMachines);
    final Lts lts = engine.explore(Process.reference("Twice"), environment);
    final GraphDescription graph = engine.export(lts);
    assertEquals(lts.stateCount(), graph.nodeCount());
    assertEquals(lts.edgeCount(), graph.edgeCount());
  }

  @Test
  public void testFailuresAreCounted() throws CcsException {
    final CcsEngine engine = CcsEngineBuilder.newBuilder().build();
    try {
      engine.explore(Process.reference("Missing"), Environment.empty());
      fail("Expected an undefined process");
    } catch (CcsException exception) {
      assertEquals(Code.UNDEFINED_PROCESS, exception.getCode());
    }
    try {
      engine.step(Process.prefix("a", Process.reference("Missing")), Environment.empty());
      fail("Expected an undefined process");
    } catch (CcsException exception) {
      assertEquals(Code.UNDEFINED_PROCESS, exception.getCode());
    }
    assertEquals(2L, engine.getStatistics().getTotalFailures());
  }

  @Test
  public void testConfigurationValidation() {
    try {
      EngineConfigurationBuilder.newBuilder().explorationWorkers(0).refinementWorkers(-1).build();
      fail("Expected an invalid configuration");
    } catch (CcsException exception) {
      assertEquals(Code.INVALID_ENGINE_CONFIG, exception.getCode());
      assertTrue(exception.getMessage().contains("Algorithm"));
      assertTrue(exception.getMessage().contains("ExplorationWorkers"));
      assertTrue(exception.getMessage().contains("RefinementWorkers"));
    }
  }

  @Test
  public void testAllAlgorithmsThroughEngine() throws CcsException {
    final Environment environment = new CcsParser().parse(vendingMachines);
    for (final BisimulationAlgorithmType type : BisimulationAlgorithmType.values()) {
      final CcsEngine engine = CcsEngineBuilder.newBuilder()
          .config(EngineConfigurationBuilder.newBuilder().algorithm(type).refinementWorkers(2)
              .build())
          .build();
      assertTrue(engine.checkBisimilarity(Process.reference("Fair"), Process.reference("Twice"),
          environment).isBisimilar());
      final BisimulationResult result = engine.checkBisimilarity(Process.reference("Fair"),
          Process.reference("Unfair"), environment);
      assertFalse(result.isBisimilar());
      assertEquals(type, result.getAlgorithm());
    }
  }

  @Test
  public void testConcurrentCallers() throws Exception {
    final CcsEngine engine = CcsEngineBuilder.newBuilder().build();
    final Environment environment = RandomLtsGenerator.generate(25, 3, 60, 5L);
    final Process root = environment.getMainProcess().get();
    final Lts expected = engine.explore(root, environment);

    final ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      final List<Callable<Lts>> tasks = new ArrayList<>();
      for (int iter = 0; iter < 8; iter++) {
        tasks.add(new Callable<Lts>() {
          @Override
          public Lts call() throws CcsException {
            return engine.explore(root, environment);
          }
        });
      }
      for (final Future<Lts> future : pool.invokeAll(tasks)) {
        assertEquals(expected.getEdges(), future.get().getEdges());
      }
    } finally {
      pool.shutdownNow();
    }
    assertEquals(9L, engine.getStatistics().getTotalExplorations());
  }

}

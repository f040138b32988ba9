package com.github.ccs;

import java.util.List;
import java.util.Set;

/**
 * Entry point to the CCS semantics engine. Accepts already parsed process terms together with the
 * environment that defines the names they refer to, see {@link SpecificationParser} to get those
 * from text.
 *
 * Notes for users:<br>
 * 1. this engine instance is thread-safe. Every call owns its state set, edge set and relation,
 * only the {@link EngineStatistics} counters are shared<br>
 *
 * 2. it is designed to not be singleton within a process, so, if different configurations are
 * needed, just create as many engines as needed<br>
 *
 * 3. all operations are blocking and run to completion or failure. Exploration of an infinite-state
 * (but guarded) system does not terminate on its own<br>
 */
public interface CcsEngine {

  /**
   * One-step transitions of a term.
   */
  Set<Transition> step(final Process term, final Environment environment) throws CcsException;

  /**
   * Reachable transition system of a term.
   */
  Lts explore(final Process root, final Environment environment) throws CcsException;

  /**
   * One combined transition system reachable from all roots.
   */
  Lts explore(final List<Process> roots, final Environment environment) throws CcsException;

  /**
   * Explore both terms into one transition system and check their states against each other.
   */
  BisimulationResult checkBisimilarity(final Process left, final Process right,
      final Environment environment) throws CcsException;

  /**
   * Check a state of one explored system against a state of another, or of the same, system.
   */
  BisimulationResult checkBisimilarity(final Lts leftLts, final Process left, final Lts rightLts,
      final Process right) throws CcsException;

  /**
   * Largest bisimulation between all states of both systems.
   */
  StateRelation bisimulation(final Lts left, final Lts right) throws CcsException;

  /**
   * Node/edge description of a transition system for external renderers.
   */
  GraphDescription export(final Lts lts);

  /**
   * Distinct non-empty action sequences of at most maxLength steps from the root of the system.
   */
  Set<List<Action>> traces(final Lts lts, final int maxLength);

  /**
   * Reports the id of this engine instance.
   */
  String getId();

  /**
   * Returns the config that this engine is wired with.
   */
  EngineConfiguration getConfiguration();

  /**
   * Report statistics for this engine.
   */
  EngineStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build engines.
   */
  public final static class CcsEngineBuilder {
    private EngineConfiguration config;

    public static CcsEngineBuilder newBuilder() {
      return new CcsEngineBuilder();
    }

    public CcsEngineBuilder config(final EngineConfiguration config) {
      this.config = config;
      return this;
    }

    public CcsEngine build() throws CcsException {
      if (config == null) {
        config = EngineConfiguration.EngineConfigurationBuilder.newBuilder()
            .algorithm(BisimulationAlgorithmType.WORKLIST_FIXPOINT).build();
      }
      return new CcsEngineImpl(config);
    }

    private CcsEngineBuilder() {}
  }

}

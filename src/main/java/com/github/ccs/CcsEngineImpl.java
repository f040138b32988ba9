package com.github.ccs;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Default {@link CcsEngine}. Wires an {@link LtsExplorer} and a {@link BisimulationChecker} per the
 * configuration and keeps running totals in {@link EngineStatistics}.
 */
public final class CcsEngineImpl implements CcsEngine {
  private static final Logger logger = LogManager.getLogger(CcsEngineImpl.class.getSimpleName());

  private final String engineId = UUID.randomUUID().toString();
  private final EngineConfiguration config;
  private final LtsExplorer explorer;
  private final BisimulationChecker checker;
  private final EngineStatistics engineStats;

  CcsEngineImpl(final EngineConfiguration config) throws CcsException {
    if (config == null) {
      throw new CcsException(CcsException.Code.INVALID_ENGINE_CONFIG,
          "Engine configuration cannot be null");
    }
    this.config = config;
    this.explorer = new LtsExplorer(config.getExplorationWorkers());
    this.checker =
        BisimulationChecker.forType(config.getAlgorithm(), config.getRefinementWorkers());
    this.engineStats = new EngineStatistics(engineId);
    logInfo(engineId, "Fired up engine with " + config);
  }

  @Override
  public Set<Transition> step(final Process term, final Environment environment)
      throws CcsException {
    try {
      environment.validate(term);
      return Semantics.step(term, environment);
    } catch (CcsException exception) {
      throw failed("Failed to derive transitions of " + term, exception);
    }
  }

  @Override
  public Lts explore(final Process root, final Environment environment) throws CcsException {
    return explore(Arrays.asList(root), environment);
  }

  @Override
  public Lts explore(final List<Process> roots, final Environment environment)
      throws CcsException {
    final long startNanos = System.nanoTime();
    final Lts lts;
    try {
      lts = explorer.explore(roots, environment);
    } catch (CcsException exception) {
      throw failed("Failed to explore " + roots, exception);
    }
    engineStats.recordExploration(lts, System.nanoTime() - startNanos);
    logDebug(engineId, "Explored " + lts + " from " + roots);
    return lts;
  }

  @Override
  public BisimulationResult checkBisimilarity(final Process left, final Process right,
      final Environment environment) throws CcsException {
    final Lts lts = explore(Arrays.asList(left, right), environment);
    final List<Integer> roots = lts.getRoots();
    final BisimulationResult result;
    try {
      result = checker.check(lts, roots.get(0), roots.get(1));
    } catch (CcsException exception) {
      throw failed("Failed to check " + left + " against " + right, exception);
    }
    engineStats.recordCheck(result);
    logCheck(left, right, result);
    return result;
  }

  @Override
  public BisimulationResult checkBisimilarity(final Lts leftLts, final Process left,
      final Lts rightLts, final Process right) throws CcsException {
    final BisimulationResult result;
    try {
      result = checker.check(leftLts, left, rightLts, right);
    } catch (CcsException exception) {
      throw failed("Failed to check " + left + " against " + right, exception);
    }
    engineStats.recordCheck(result);
    logCheck(left, right, result);
    return result;
  }

  @Override
  public StateRelation bisimulation(final Lts left, final Lts right) throws CcsException {
    try {
      return checker.relation(left, right);
    } catch (CcsException exception) {
      throw failed("Failed to compute the bisimulation of " + left + " and " + right, exception);
    }
  }

  @Override
  public GraphDescription export(final Lts lts) {
    return GraphExporter.export(lts);
  }

  @Override
  public Set<List<Action>> traces(final Lts lts, final int maxLength) {
    return TraceEnumerator.traces(lts, maxLength);
  }

  @Override
  public String getId() {
    return engineId;
  }

  @Override
  public EngineConfiguration getConfiguration() {
    return config;
  }

  @Override
  public EngineStatistics getStatistics() {
    return engineStats;
  }

  private CcsException failed(final String message, final CcsException exception) {
    engineStats.recordFailure();
    logError(engineId, message + ": " + exception.getCode() + ", " + exception.getMessage());
    return exception;
  }

  private void logCheck(final Process left, final Process right,
      final BisimulationResult result) {
    if (result.isBisimilar()) {
      logInfo(engineId, left + " and " + right + " are bisimilar");
    } else {
      logInfo(engineId, left + " and " + right + " are not bisimilar: "
          + result.getCounterexample().get().getMessage());
    }
  }

  private static void logError(final String engineId, final String message) {
    logger.error(
        new StringBuilder().append("[e:").append(engineId).append("] ").append(message).toString());
  }

  private static void logInfo(final String engineId, final String message) {
    logger.info(
        new StringBuilder().append("[e:").append(engineId).append("] ").append(message).toString());
  }

  private static void logDebug(final String engineId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[e:").append(engineId).append("] ")
          .append(message).toString());
    }
  }

}

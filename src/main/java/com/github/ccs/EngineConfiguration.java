package com.github.ccs;

/**
 * This class encapsulates all the configuration parameters for the CcsEngine. Use the
 * {@code EngineConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. the bisimulation algorithm is mandatory. All algorithms compute the same relation, pick
 * {@link BisimulationAlgorithmType#WORKLIST_FIXPOINT} unless measuring the others<br>
 * 2. explorationWorkers and refinementWorkers default to 1, ie. single-threaded. Exploration
 * results do not depend on the number of workers<br>
 * 3. refinementWorkers is only used by {@link BisimulationAlgorithmType#NAIVE_FIXPOINT}<br>
 */
public final class EngineConfiguration {
  private final BisimulationAlgorithmType algorithm;
  private final int explorationWorkers;
  private final int refinementWorkers;

  public BisimulationAlgorithmType getAlgorithm() {
    return algorithm;
  }

  public int getExplorationWorkers() {
    return explorationWorkers;
  }

  public int getRefinementWorkers() {
    return refinementWorkers;
  }

  public final static class EngineConfigurationBuilder {
    private BisimulationAlgorithmType algorithm;
    private int explorationWorkers = 1;
    private int refinementWorkers = 1;

    public static EngineConfigurationBuilder newBuilder() {
      return new EngineConfigurationBuilder();
    }

    public EngineConfigurationBuilder algorithm(final BisimulationAlgorithmType algorithm) {
      this.algorithm = algorithm;
      return this;
    }

    public EngineConfigurationBuilder explorationWorkers(final int explorationWorkers) {
      this.explorationWorkers = explorationWorkers;
      return this;
    }

    public EngineConfigurationBuilder refinementWorkers(final int refinementWorkers) {
      this.refinementWorkers = refinementWorkers;
      return this;
    }

    public EngineConfiguration build() throws CcsException {
      final EngineConfiguration config =
          new EngineConfiguration(algorithm, explorationWorkers, refinementWorkers);
      config.validate();
      return config;
    }

    private EngineConfigurationBuilder() {}
  }

  private void validate() throws CcsException {
    StringBuilder messages = new StringBuilder();
    if (algorithm == null) {
      messages.append("Algorithm cannot be null. ");
    }
    if (explorationWorkers < 1) {
      messages.append("ExplorationWorkers must be at least 1. ");
    }
    if (refinementWorkers < 1) {
      messages.append("RefinementWorkers must be at least 1. ");
    }
    if (messages.length() > 0) {
      throw new CcsException(CcsException.Code.INVALID_ENGINE_CONFIG, messages.toString());
    }
  }

  @Override
  public String toString() {
    return "EngineConfiguration [algorithm=" + algorithm + ", explorationWorkers="
        + explorationWorkers + ", refinementWorkers=" + refinementWorkers + "]";
  }

  private EngineConfiguration(final BisimulationAlgorithmType algorithm,
      final int explorationWorkers, final int refinementWorkers) {
    this.algorithm = algorithm;
    this.explorationWorkers = explorationWorkers;
    this.refinementWorkers = refinementWorkers;
  }

}

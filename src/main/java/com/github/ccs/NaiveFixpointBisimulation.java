package com.github.ccs;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.ccs.CcsException.Code;

/**
 * Textbook greatest-fixpoint iteration: R0 is the full cross product and R(n+1) keeps the pairs of
 * R(n) that pass the bisimulation game against R(n). Stops at the first pass that removes nothing.
 *
 * Every pass reads only the previous pass's relation, so the pairs of one pass are independent of
 * each other. With more than one worker the left states are split into slices, each slice is
 * checked concurrently and the removals are applied once all slices are done.
 *
 * Kept as the reference implementation the faster strategies are compared against.
 */
public final class NaiveFixpointBisimulation implements BisimulationAlgorithm {
  private static final Logger logger =
      LogManager.getLogger(NaiveFixpointBisimulation.class.getSimpleName());

  private final int workers;

  public NaiveFixpointBisimulation() {
    this(1);
  }

  public NaiveFixpointBisimulation(final int workers) {
    if (workers < 1) {
      throw new IllegalArgumentException("Refinement needs at least one worker, got " + workers);
    }
    this.workers = workers;
  }

  @Override
  public StateRelation computeBisimulation(final Lts left, final Lts right) throws CcsException {
    final Map<Action, Integer> labelIds = TransitionTable.labelIds(left, right);
    final TransitionTable leftTable = new TransitionTable(left, labelIds);
    final TransitionTable rightTable =
        left == right ? leftTable : new TransitionTable(right, labelIds);
    StateRelation relation = StateRelation.full(leftTable.stateCount(), rightTable.stateCount());

    final ExecutorService pool = workers > 1 ? newPool(workers) : null;
    try {
      int passes = 0;
      while (true) {
        passes++;
        final List<int[]> removals = pass(leftTable, rightTable, relation, pool);
        int removed = 0;
        final StateRelation next = relation.copy();
        for (final int[] slice : removals) {
          for (final int pair : slice) {
            next.removeIndex(pair);
          }
          removed += slice.length;
        }
        if (logger.isDebugEnabled()) {
          logger.debug(String.format("Naive refinement pass %d removed %d pairs", passes, removed));
        }
        if (removed == 0) {
          break;
        }
        relation = next;
      }
    } finally {
      if (pool != null) {
        pool.shutdownNow();
      }
    }
    return relation;
  }

  @Override
  public BisimulationAlgorithmType getType() {
    return BisimulationAlgorithmType.NAIVE_FIXPOINT;
  }

  private List<int[]> pass(final TransitionTable leftTable, final TransitionTable rightTable,
      final StateRelation previous, final ExecutorService pool) throws CcsException {
    final int leftCount = leftTable.stateCount();
    final List<int[]> removals = new ArrayList<>();
    if (pool == null) {
      removals.add(unstablePairs(leftTable, rightTable, previous, 0, leftCount));
      return removals;
    }
    final int sliceSize = Math.max(1, (leftCount + workers - 1) / workers);
    final List<Callable<int[]>> slices = new ArrayList<>();
    for (int from = 0; from < leftCount; from += sliceSize) {
      final int sliceFrom = from;
      final int sliceTo = Math.min(leftCount, from + sliceSize);
      slices.add(new Callable<int[]>() {
        @Override
        public int[] call() {
          return unstablePairs(leftTable, rightTable, previous, sliceFrom, sliceTo);
        }
      });
    }
    try {
      for (final Future<int[]> slice : pool.invokeAll(slices)) {
        removals.add(slice.get());
      }
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new CcsException(Code.INTERRUPTED, exception);
    } catch (ExecutionException exception) {
      throw new CcsException(Code.UNKNOWN_FAILURE, exception.getCause());
    }
    return removals;
  }

  private static int[] unstablePairs(final TransitionTable leftTable,
      final TransitionTable rightTable, final StateRelation previous, final int fromLeft,
      final int toLeft) {
    int[] unstable = new int[16];
    int count = 0;
    for (int p = fromLeft; p < toLeft; p++) {
      for (int q = 0; q < rightTable.stateCount(); q++) {
        if (previous.contains(p, q)
            && !TransitionTable.stable(leftTable, p, rightTable, q, previous)) {
          if (count == unstable.length) {
            unstable = Arrays.copyOf(unstable, count * 2);
          }
          unstable[count++] = previous.pairIndex(p, q);
        }
      }
    }
    return Arrays.copyOf(unstable, count);
  }

  private static ExecutorService newPool(final int workers) {
    return Executors.newFixedThreadPool(workers, new ThreadFactory() {
      private final AtomicInteger counter = new AtomicInteger();

      @Override
      public Thread newThread(final Runnable runnable) {
        final Thread thread = new Thread(runnable, "bisim-refiner-" + counter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      }
    });
  }

}

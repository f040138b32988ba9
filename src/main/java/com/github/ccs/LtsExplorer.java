package com.github.ccs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
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
 * Breadth-first reachable-state explorer. Repeatedly applies {@link Semantics} starting from one or
 * more root terms, interning every distinct term as a state, until no new state shows up.
 *
 * Notes for users:<br>
 * 1. terms are interned by structural equality after resolving their top-level references. This is
 * what makes self-referential but finite-state definitions such as {@code P = a.P} terminate: the
 * continuation {@code P} is recognized as an already seen state instead of being unfolded again<br>
 *
 * 2. interning does not help against genuinely infinite-state systems, eg. {@code P = a.(P | b.0)}
 * whose parallel width grows with every step. Those are not detected and exploration runs until
 * memory is exhausted<br>
 *
 * 3. with more than one worker, each breadth-first layer is derived concurrently and the results
 * are merged in frontier order by the calling thread. State numbering and edge order are therefore
 * identical to a single-threaded run<br>
 *
 * 4. every call owns its state set, edge list and worker pool. The pool is shut down before the
 * call returns<br>
 */
public final class LtsExplorer {
  private static final Logger logger = LogManager.getLogger(LtsExplorer.class.getSimpleName());

  private final int workers;

  public LtsExplorer() {
    this(1);
  }

  public LtsExplorer(final int workers) {
    if (workers < 1) {
      throw new IllegalArgumentException("Explorer needs at least one worker, got " + workers);
    }
    this.workers = workers;
  }

  public Lts explore(final Process root, final Environment environment) throws CcsException {
    return explore(Collections.singletonList(root), environment);
  }

  /**
   * Explore all roots into one combined transition system. Root states are reported in the order
   * of the given roots; roots that turn out to be the same state share a number.
   */
  public Lts explore(final List<Process> roots, final Environment environment)
      throws CcsException {
    if (roots == null || roots.isEmpty()) {
      throw new IllegalArgumentException("Exploration needs at least one root");
    }
    for (final Process root : roots) {
      environment.validate(root);
    }
    final long startNanos = System.nanoTime();
    final Interner interner = new Interner(environment);
    final List<Lts.Edge> edges = new ArrayList<>();
    final List<Integer> rootStates = new ArrayList<>(roots.size());

    List<Integer> frontier = new ArrayList<>();
    for (final Process root : roots) {
      rootStates.add(interner.intern(root, frontier));
    }

    final ExecutorService pool = workers > 1 ? newPool(workers) : null;
    try {
      int layer = 0;
      while (!frontier.isEmpty()) {
        if (logger.isDebugEnabled()) {
          logger.debug(String.format("Layer %d: expanding %d states, %d known", layer,
              frontier.size(), interner.states.size()));
        }
        final List<Set<Transition>> derived = derive(frontier, interner.states, environment, pool);
        final List<Integer> next = new ArrayList<>();
        for (int iter = 0; iter < frontier.size(); iter++) {
          final int source = frontier.get(iter);
          // distinct terms may intern to one state, their edges collapse
          final Set<Lts.Edge> outgoing = new LinkedHashSet<>();
          for (final Transition transition : derived.get(iter)) {
            final int target = interner.intern(transition.getTarget(), next);
            outgoing.add(new Lts.Edge(source, transition.getLabel(), target));
          }
          edges.addAll(outgoing);
        }
        frontier = next;
        layer++;
      }
    } finally {
      if (pool != null) {
        pool.shutdownNow();
      }
    }

    final Lts lts = new Lts(interner.states, interner.index, environment, edges, rootStates);
    logger.info(String.format("Explored %d states and %d edges from %d root(s) in %d ms",
        lts.stateCount(), lts.edgeCount(), roots.size(),
        (System.nanoTime() - startNanos) / 1_000_000L));
    return lts;
  }

  private static List<Set<Transition>> derive(final List<Integer> frontier,
      final List<Process> states, final Environment environment, final ExecutorService pool)
      throws CcsException {
    final List<Set<Transition>> derived = new ArrayList<>(frontier.size());
    if (pool == null || frontier.size() == 1) {
      for (final int state : frontier) {
        derived.add(Semantics.step(states.get(state), environment));
      }
      return derived;
    }
    final List<Callable<Set<Transition>>> tasks = new ArrayList<>(frontier.size());
    for (final int state : frontier) {
      final Process term = states.get(state);
      tasks.add(new Callable<Set<Transition>>() {
        @Override
        public Set<Transition> call() throws CcsException {
          return Semantics.step(term, environment);
        }
      });
    }
    try {
      for (final Future<Set<Transition>> future : pool.invokeAll(tasks)) {
        derived.add(future.get());
      }
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new CcsException(Code.INTERRUPTED, exception);
    } catch (ExecutionException exception) {
      final Throwable cause = exception.getCause();
      if (cause instanceof CcsException) {
        throw (CcsException) cause;
      }
      throw new CcsException(Code.UNKNOWN_FAILURE, cause);
    }
    return derived;
  }

  private static ExecutorService newPool(final int workers) {
    return Executors.newFixedThreadPool(workers, new ThreadFactory() {
      private final AtomicInteger counter = new AtomicInteger();

      @Override
      public Thread newThread(final Runnable runnable) {
        final Thread thread = new Thread(runnable, "lts-explorer-" + counter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      }
    });
  }

  /**
   * First insertion of a term wins its state number, later duplicates map to that number.
   */
  private static final class Interner {
    private final Environment environment;
    private final List<Process> states = new ArrayList<>();
    private final Map<Process, Integer> index = new HashMap<>();

    private Interner(final Environment environment) {
      this.environment = environment;
    }

    private int intern(final Process term, final List<Integer> discovered) throws CcsException {
      final Process key = environment.resolveHead(term);
      final Integer known = index.get(key);
      if (known != null) {
        return known;
      }
      final int state = states.size();
      states.add(term);
      index.put(key, state);
      discovered.add(state);
      return state;
    }
  }

}

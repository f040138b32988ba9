package com.github.ccs;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Partition refinement on the disjoint union of both systems. All states start in one block. Each
 * round gives every state a signature made of its current block and the set of (label, target
 * block) pairs it can reach in one step, and states with equal signatures form the next blocks.
 * Refinement only ever splits blocks, so the rounds stop as soon as the block count stays the same.
 * Two states are bisimilar iff they end up in the same block.
 */
public final class PartitionRefinementBisimulation implements BisimulationAlgorithm {
  private static final Logger logger =
      LogManager.getLogger(PartitionRefinementBisimulation.class.getSimpleName());

  @Override
  public StateRelation computeBisimulation(final Lts left, final Lts right) throws CcsException {
    final Map<Action, Integer> labelIds = TransitionTable.labelIds(left, right);
    final TransitionTable leftTable = new TransitionTable(left, labelIds);
    final TransitionTable rightTable =
        left == right ? leftTable : new TransitionTable(right, labelIds);
    final int leftCount = leftTable.stateCount();
    final int rightCount = rightTable.stateCount();
    // fail before doing any work if the result cannot be represented
    final StateRelation relation = StateRelation.empty(leftCount, rightCount);

    // union state u < leftCount is left state u, otherwise right state u - leftCount
    int[] blocks = new int[leftCount + rightCount];
    int blockCount = 1;
    int rounds = 0;
    while (true) {
      rounds++;
      final Map<Signature, Integer> signatures = new HashMap<>();
      final int[] next = new int[blocks.length];
      for (int u = 0; u < blocks.length; u++) {
        final Signature signature = u < leftCount ? signature(leftTable, u, 0, blocks)
            : signature(rightTable, u - leftCount, leftCount, blocks);
        Integer block = signatures.get(signature);
        if (block == null) {
          block = signatures.size();
          signatures.put(signature, block);
        }
        next[u] = block;
      }
      final int refined = signatures.size();
      blocks = next;
      if (refined == blockCount) {
        break;
      }
      blockCount = refined;
    }
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Partition refinement: %d blocks after %d rounds", blockCount,
          rounds));
    }

    final List<List<Integer>> leftMembers = members(blocks, 0, leftCount, blockCount);
    final List<List<Integer>> rightMembers = members(blocks, leftCount, rightCount, blockCount);
    for (int block = 0; block < blockCount; block++) {
      for (final int p : leftMembers.get(block)) {
        for (final int q : rightMembers.get(block)) {
          relation.add(p, q);
        }
      }
    }
    return relation;
  }

  @Override
  public BisimulationAlgorithmType getType() {
    return BisimulationAlgorithmType.PARTITION_REFINEMENT;
  }

  private static Signature signature(final TransitionTable table, final int state,
      final int offset, final int[] blocks) {
    final int[] labels = table.labels[state];
    final int[] targets = table.targets[state];
    final long[] moves = new long[labels.length];
    for (int iter = 0; iter < labels.length; iter++) {
      moves[iter] = ((long) labels[iter] << 32) | (blocks[targets[iter] + offset] & 0xffffffffL);
    }
    Arrays.sort(moves);
    int distinct = 0;
    for (int iter = 0; iter < moves.length; iter++) {
      if (iter == 0 || moves[iter] != moves[distinct - 1]) {
        moves[distinct++] = moves[iter];
      }
    }
    return new Signature(blocks[state + offset], Arrays.copyOf(moves, distinct));
  }

  private static List<List<Integer>> members(final int[] blocks, final int offset,
      final int count, final int blockCount) {
    final List<List<Integer>> members = new ArrayList<>(blockCount);
    for (int block = 0; block < blockCount; block++) {
      members.add(new ArrayList<Integer>());
    }
    for (int state = 0; state < count; state++) {
      members.get(blocks[state + offset]).add(state);
    }
    return members;
  }

  private static final class Signature {
    private final int block;
    private final long[] moves;
    private final int hash;

    private Signature(final int block, final long[] moves) {
      this.block = block;
      this.moves = moves;
      this.hash = 31 * block + Arrays.hashCode(moves);
    }

    @Override
    public int hashCode() {
      return hash;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Signature)) {
        return false;
      }
      final Signature other = (Signature) obj;
      return block == other.block && Arrays.equals(moves, other.moves);
    }
  }

}

package org.carma.coalition.formation;

import org.carma.coalition.model.CoalitionId;

import java.util.*;

/**
 * Lazily yields every partition of a set of players into non-empty blocks.
 *
 * Partitions are generated as restricted growth strings a_0..a_{n-1}
 * (a_0 = 0, a_i ≤ 1 + max(a_0..a_{i-1})) in lexicographic order, where
 * player i goes to block a_i. The first partition is the grand coalition,
 * the last one is all singletons. Blocks are returned in block-index order.
 * An empty player set has no partitions.
 */
public final class PartitionGenerator implements Iterable<List<CoalitionId>> {

    private final int[] players;

    public PartitionGenerator(CoalitionId players) {
        this(players.members());
    }

    public PartitionGenerator(List<Integer> players) {
        this.players = players.stream().mapToInt(Integer::intValue).toArray();
    }

    public static PartitionGenerator ofPlayers(int numPlayers) {
        return new PartitionGenerator(CoalitionId.grand(numPlayers));
    }

    @Override
    public Iterator<List<CoalitionId>> iterator() {
        return new Iterator<>() {
            private final int n = players.length;
            private final int[] rgs = new int[n];
            private final int[] prefixMax = new int[n];
            private boolean hasNext = n > 0;

            @Override
            public boolean hasNext() {
                return hasNext;
            }

            @Override
            public List<CoalitionId> next() {
                if (!hasNext) {
                    throw new NoSuchElementException();
                }
                List<CoalitionId> blocks = toBlocks();
                advance();
                return blocks;
            }

            private List<CoalitionId> toBlocks() {
                int numBlocks = n == 0 ? 0 : prefixMax[n - 1] + 1;
                long[] bits = new long[numBlocks];
                for (int i = 0; i < n; i++) {
                    bits[rgs[i]] |= 1L << players[i];
                }
                List<CoalitionId> blocks = new ArrayList<>(numBlocks);
                for (long b : bits) {
                    blocks.add(new CoalitionId(b));
                }
                return blocks;
            }

            // prefixMax[i] = max(rgs[0..i])
            private void advance() {
                for (int i = n - 1; i > 0; i--) {
                    if (rgs[i] <= prefixMax[i - 1]) {
                        rgs[i]++;
                        prefixMax[i] = Math.max(prefixMax[i - 1], rgs[i]);
                        for (int j = i + 1; j < n; j++) {
                            rgs[j] = 0;
                            prefixMax[j] = prefixMax[i];
                        }
                        return;
                    }
                }
                hasNext = false;
            }
        };
    }
}

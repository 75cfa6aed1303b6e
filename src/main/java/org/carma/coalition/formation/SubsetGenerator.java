package org.carma.coalition.formation;

import org.carma.coalition.model.CoalitionId;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazily yields every non-empty subset of a set of players, in ascending
 * coalition id order. Each call to {@link #iterator()} starts over.
 */
public final class SubsetGenerator implements Iterable<CoalitionId> {

    private final long mask;

    public SubsetGenerator(CoalitionId players) {
        this.mask = players.bits();
    }

    /**
     * Subsets of the players 0..numPlayers-1.
     */
    public static SubsetGenerator ofPlayers(int numPlayers) {
        return new SubsetGenerator(CoalitionId.grand(numPlayers));
    }

    /**
     * Number of subsets yielded: 2^n - 1.
     */
    public long count() {
        return (1L << Long.bitCount(mask)) - 1;
    }

    @Override
    public Iterator<CoalitionId> iterator() {
        return new Iterator<>() {
            // Next submask of mask, in increasing order
            private long next = (-mask) & mask;

            @Override
            public boolean hasNext() {
                return next != 0L;
            }

            @Override
            public CoalitionId next() {
                if (next == 0L) {
                    throw new NoSuchElementException();
                }
                CoalitionId current = new CoalitionId(next);
                next = (next - mask) & mask;
                return current;
            }
        };
    }
}

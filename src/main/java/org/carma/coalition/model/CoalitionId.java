package org.carma.coalition.model;

import java.util.*;

/**
 * Canonical identifier of a coalition of providers.
 *
 * The identifier is the bit-set of member provider indices: provider i is a
 * member iff bit i is set. Two coalitions with the same members always have
 * the same identifier, independent of the order the members were given in.
 * The numeric value of the bit-set is also the identifier exported in CSV
 * reports.
 */
public record CoalitionId(long bits) implements Comparable<CoalitionId> {

    /** Largest number of providers a bit-set identifier can represent. */
    public static final int MAX_PROVIDERS = 63;

    public static final CoalitionId EMPTY = new CoalitionId(0L);

    public CoalitionId {
        if (bits < 0) {
            throw new IllegalArgumentException("Coalition bit-set must be non-negative: " + bits);
        }
    }

    // ========================================================================
    // Factories
    // ========================================================================

    public static CoalitionId of(int... providers) {
        long bits = 0L;
        for (int p : providers) {
            bits |= bit(p);
        }
        return new CoalitionId(bits);
    }

    public static CoalitionId of(Collection<Integer> providers) {
        long bits = 0L;
        for (int p : providers) {
            bits |= bit(p);
        }
        return new CoalitionId(bits);
    }

    public static CoalitionId singleton(int provider) {
        return new CoalitionId(bit(provider));
    }

    /**
     * The coalition of all providers 0..numProviders-1.
     */
    public static CoalitionId grand(int numProviders) {
        if (numProviders < 0 || numProviders > MAX_PROVIDERS) {
            throw new IllegalArgumentException("Unsupported number of providers: " + numProviders);
        }
        return new CoalitionId(numProviders == 0 ? 0L : (-1L >>> (64 - numProviders)));
    }

    private static long bit(int provider) {
        if (provider < 0 || provider >= MAX_PROVIDERS) {
            throw new IllegalArgumentException("Provider index out of range: " + provider);
        }
        return 1L << provider;
    }

    // ========================================================================
    // Queries
    // ========================================================================

    public boolean isEmpty() {
        return bits == 0L;
    }

    public int size() {
        return Long.bitCount(bits);
    }

    public boolean contains(int provider) {
        return provider >= 0 && provider < MAX_PROVIDERS && (bits & (1L << provider)) != 0;
    }

    public boolean isSubsetOf(CoalitionId other) {
        return (bits & ~other.bits) == 0L;
    }

    public boolean intersects(CoalitionId other) {
        return (bits & other.bits) != 0L;
    }

    /**
     * Member provider indices in ascending order.
     */
    public List<Integer> members() {
        List<Integer> members = new ArrayList<>(size());
        long rest = bits;
        while (rest != 0L) {
            int p = Long.numberOfTrailingZeros(rest);
            members.add(p);
            rest &= rest - 1;
        }
        return members;
    }

    // ========================================================================
    // Derivations
    // ========================================================================

    public CoalitionId with(int provider) {
        return new CoalitionId(bits | bit(provider));
    }

    public CoalitionId without(int provider) {
        return new CoalitionId(bits & ~bit(provider));
    }

    public CoalitionId union(CoalitionId other) {
        return new CoalitionId(bits | other.bits);
    }

    @Override
    public int compareTo(CoalitionId other) {
        return Long.compare(bits, other.bits);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        List<Integer> members = members();
        for (int i = 0; i < members.size(); i++) {
            if (i > 0) sb.append(",");
            sb.append(members.get(i));
        }
        return sb.append("}").toString();
    }
}

package org.carma.coalition.model;

import java.util.*;

/**
 * Read-only table of all analysed coalitions, keyed by coalition id.
 * Built once by the enumerator and shared by every partition selector.
 */
public final class CoalitionTable {

    private final int numProviders;
    private final SortedMap<CoalitionId, CoalitionInfo> entries;

    private CoalitionTable(int numProviders, Map<CoalitionId, CoalitionInfo> entries) {
        this.numProviders = numProviders;
        this.entries = Collections.unmodifiableSortedMap(new TreeMap<>(entries));
    }

    public static Builder builder(int numProviders) {
        return new Builder(numProviders);
    }

    public int numProviders() {
        return numProviders;
    }

    public int size() {
        return entries.size();
    }

    public boolean contains(CoalitionId id) {
        return entries.containsKey(id);
    }

    /**
     * @throws NoSuchElementException if the coalition was never analysed
     */
    public CoalitionInfo get(CoalitionId id) {
        CoalitionInfo info = entries.get(id);
        if (info == null) {
            throw new NoSuchElementException("Unknown coalition: " + id);
        }
        return info;
    }

    public Optional<CoalitionInfo> find(CoalitionId id) {
        return Optional.ofNullable(entries.get(id));
    }

    /**
     * All entries in ascending id order.
     */
    public Collection<CoalitionInfo> coalitions() {
        return entries.values();
    }

    public CoalitionId grandCoalition() {
        return CoalitionId.grand(numProviders);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CoalitionTable)) return false;
        CoalitionTable that = (CoalitionTable) o;
        return numProviders == that.numProviders && entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numProviders, entries);
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private final int numProviders;
        private final Map<CoalitionId, CoalitionInfo> entries = new TreeMap<>();

        private Builder(int numProviders) {
            if (numProviders < 0 || numProviders > CoalitionId.MAX_PROVIDERS) {
                throw new IllegalArgumentException("Unsupported number of providers: " + numProviders);
            }
            this.numProviders = numProviders;
        }

        /**
         * @throws IllegalStateException if the coalition was already added
         */
        public Builder put(CoalitionInfo info) {
            CoalitionId id = info.getId();
            if (!id.isSubsetOf(CoalitionId.grand(numProviders))) {
                throw new IllegalArgumentException("Coalition " + id + " has unknown providers");
            }
            if (entries.putIfAbsent(id, info) != null) {
                throw new IllegalStateException("Coalition " + id + " already in table");
            }
            return this;
        }

        public CoalitionTable build() {
            return new CoalitionTable(numProviders, entries);
        }
    }
}

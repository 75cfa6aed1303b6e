package org.carma.coalition.model;

import java.util.*;

/**
 * Everything computed for one coalition: its optimal allocation, its value
 * in the cooperative game, core status and the division of the value among
 * the members.
 */
public final class CoalitionInfo {

    /**
     * Value given to coalitions whose allocation problem could not be solved.
     * Finite, so that sums over partitions remain ordered.
     */
    public static final double INFEASIBLE_VALUE = -1.0e20;

    private final CoalitionId id;
    private final OptimalAllocationInfo allocation;
    private final double value;
    private final boolean coreEmpty;
    private final SortedMap<Integer, Double> payoffs;
    private final boolean payoffsInCore;
    private final SortedMap<Integer, ProviderAllocationInfo> providerAllocations;

    private CoalitionInfo(Builder b) {
        this.id = Objects.requireNonNull(b.id, "Coalition id cannot be null");
        this.allocation = b.allocation != null ? b.allocation : OptimalAllocationInfo.unsolved();
        this.value = b.value;
        this.coreEmpty = b.coreEmpty;
        this.payoffs = Collections.unmodifiableSortedMap(new TreeMap<>(b.payoffs));
        this.payoffsInCore = b.payoffsInCore;
        this.providerAllocations = Collections.unmodifiableSortedMap(new TreeMap<>(b.providerAllocations));
    }

    public static Builder builder(CoalitionId id) {
        return new Builder(id);
    }

    public Builder toBuilder() {
        Builder b = new Builder(id)
            .allocation(allocation)
            .value(value)
            .coreEmpty(coreEmpty)
            .payoffsInCore(payoffsInCore);
        b.payoffs.putAll(payoffs);
        b.providerAllocations.putAll(providerAllocations);
        return b;
    }

    public CoalitionId getId() { return id; }
    public OptimalAllocationInfo getAllocation() { return allocation; }
    public double getValue() { return value; }
    public boolean isCoreEmpty() { return coreEmpty; }
    public boolean isPayoffsInCore() { return payoffsInCore; }
    public SortedMap<Integer, Double> getPayoffs() { return payoffs; }
    public SortedMap<Integer, ProviderAllocationInfo> getProviderAllocations() { return providerAllocations; }

    public boolean isFeasible() {
        return allocation.isSolved();
    }

    /**
     * Payoff of a member, or empty when no payoff was computed for it.
     */
    public OptionalDouble getPayoff(int provider) {
        Double p = payoffs.get(provider);
        return p != null ? OptionalDouble.of(p) : OptionalDouble.empty();
    }

    public double getKilowatts() {
        return allocation.isSolved() ? allocation.getKilowatts() : Double.NaN;
    }

    /**
     * Equality over the game-level record: id, value, core status and
     * payoffs. Allocation diagnostics are not compared.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CoalitionInfo)) return false;
        CoalitionInfo that = (CoalitionInfo) o;
        return Double.compare(value, that.value) == 0
            && coreEmpty == that.coreEmpty
            && payoffsInCore == that.payoffsInCore
            && id.equals(that.id)
            && payoffs.equals(that.payoffs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, value, coreEmpty, payoffs, payoffsInCore);
    }

    @Override
    public String toString() {
        return String.format("Coalition%s[value=%.6f, coreEmpty=%s, payoffs=%s, inCore=%s]",
            id, value, coreEmpty, payoffs, payoffsInCore);
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private final CoalitionId id;
        private OptimalAllocationInfo allocation;
        private double value = INFEASIBLE_VALUE;
        private boolean coreEmpty = true;
        private final Map<Integer, Double> payoffs = new TreeMap<>();
        private boolean payoffsInCore;
        private final Map<Integer, ProviderAllocationInfo> providerAllocations = new TreeMap<>();

        private Builder(CoalitionId id) {
            this.id = id;
        }

        public Builder allocation(OptimalAllocationInfo allocation) { this.allocation = allocation; return this; }
        public Builder value(double value) { this.value = value; return this; }
        public Builder coreEmpty(boolean coreEmpty) { this.coreEmpty = coreEmpty; return this; }
        public Builder payoffsInCore(boolean inCore) { this.payoffsInCore = inCore; return this; }

        public Builder payoff(int provider, double payoff) {
            if (!id.contains(provider)) {
                throw new IllegalArgumentException("Provider " + provider + " is not a member of " + id);
            }
            payoffs.put(provider, payoff);
            return this;
        }

        public Builder payoffs(Map<Integer, Double> values) {
            values.forEach(this::payoff);
            return this;
        }

        public Builder providerAllocation(int provider, ProviderAllocationInfo info) {
            providerAllocations.put(provider, info);
            return this;
        }

        public CoalitionInfo build() {
            return new CoalitionInfo(this);
        }
    }
}

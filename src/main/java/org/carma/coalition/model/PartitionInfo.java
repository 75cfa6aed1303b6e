package org.carma.coalition.model;

import java.util.*;

/**
 * A candidate coalition structure: a partition of all providers into
 * coalitions, together with what each provider would receive in it.
 */
public final class PartitionInfo {

    private final List<CoalitionId> coalitions;
    private final SortedMap<Integer, Double> payoffs;
    private final double value;

    /**
     * @param coalitions member coalitions, in any order
     * @param payoffs    provider to payoff; NaN where unknown
     * @param value      sum of the member coalitions' values
     */
    public PartitionInfo(Collection<CoalitionId> coalitions, Map<Integer, Double> payoffs, double value) {
        List<CoalitionId> sorted = new ArrayList<>(coalitions);
        Collections.sort(sorted);
        this.coalitions = Collections.unmodifiableList(sorted);
        this.payoffs = Collections.unmodifiableSortedMap(new TreeMap<>(payoffs));
        this.value = value;
    }

    public List<CoalitionId> getCoalitions() { return coalitions; }
    public SortedMap<Integer, Double> getPayoffs() { return payoffs; }
    public double getValue() { return value; }

    public double getPayoff(int provider) {
        return payoffs.getOrDefault(provider, Double.NaN);
    }

    /** Sum of all payoffs; NaN if any provider's payoff is unknown. */
    public double getPayoffSum() {
        double sum = 0;
        for (double p : payoffs.values()) {
            sum += p;
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PartitionInfo)) return false;
        PartitionInfo that = (PartitionInfo) o;
        return coalitions.equals(that.coalitions);
    }

    @Override
    public int hashCode() {
        return coalitions.hashCode();
    }

    @Override
    public String toString() {
        return String.format("Partition%s[value=%.6f, payoffs=%s]", coalitions, value, payoffs);
    }
}

package org.carma.coalition.model;

import java.util.*;

/**
 * Result of one coalition formation analysis.
 */
public final class CoalitionFormationInfo {

    private final CoalitionTable coalitions;
    private final List<PartitionInfo> bestPartitions;

    public CoalitionFormationInfo(CoalitionTable coalitions, List<PartitionInfo> bestPartitions) {
        this.coalitions = Objects.requireNonNull(coalitions, "Coalition table cannot be null");
        this.bestPartitions = List.copyOf(bestPartitions);
    }

    public CoalitionTable getCoalitions() { return coalitions; }
    public List<PartitionInfo> getBestPartitions() { return bestPartitions; }

    public int getNumProviders() {
        return coalitions.numProviders();
    }

    public boolean hasStablePartition() {
        return !bestPartitions.isEmpty();
    }
}

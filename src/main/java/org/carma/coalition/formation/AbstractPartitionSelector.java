package org.carma.coalition.formation;

import org.carma.coalition.model.*;

import java.util.*;

/**
 * Base class for partition selectors: candidate construction shared by all
 * stability concepts.
 */
public abstract class AbstractPartitionSelector implements PartitionSelector {

    protected boolean verbose = false;

    public AbstractPartitionSelector setVerbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }

    /**
     * Every partition of the table's providers, in canonical order.
     */
    protected static PartitionGenerator partitions(CoalitionTable table) {
        return PartitionGenerator.ofPlayers(table.numProviders());
    }

    /**
     * Build the candidate for a partition. Blocks missing from the table are
     * left out of the candidate and their members get a NaN payoff; the
     * candidate value is the sum of the values of the blocks present.
     */
    protected static PartitionInfo candidate(CoalitionTable table, List<CoalitionId> blocks) {
        List<CoalitionId> present = new ArrayList<>();
        Map<Integer, Double> payoffs = new TreeMap<>();
        double value = 0;

        for (CoalitionId block : blocks) {
            Optional<CoalitionInfo> info = table.find(block);
            for (int p : block.members()) {
                payoffs.put(p, info.isPresent() ? info.get().getPayoff(p).orElse(Double.NaN) : Double.NaN);
            }
            if (info.isPresent()) {
                present.add(block);
                value += info.get().getValue();
            }
        }
        return new PartitionInfo(present, payoffs, value);
    }

    protected void trace(String format, Object... args) {
        if (verbose) {
            System.out.printf("[" + getName() + "] " + format + "%n", args);
        }
    }
}

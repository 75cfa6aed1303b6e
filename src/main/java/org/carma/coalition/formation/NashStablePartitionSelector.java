package org.carma.coalition.formation;

import org.carma.coalition.game.Tolerance;
import org.carma.coalition.model.*;

import java.util.*;

/**
 * Nash stability: no provider strictly prefers to leave its coalition,
 * either to join another coalition of the partition or to stand alone.
 *
 * A move to S ∪ {p} is considered profitable when p would get a payoff
 * definitely greater than its current one, and also when p has no payoff
 * at all in S ∪ {p}. Ties keep the provider in place.
 */
public class NashStablePartitionSelector extends AbstractPartitionSelector {

    @Override
    public List<PartitionInfo> select(CoalitionTable table) {
        List<PartitionInfo> best = new ArrayList<>();
        for (List<CoalitionId> blocks : partitions(table)) {
            PartitionInfo candidate = candidate(table, blocks);
            if (isNashStable(table, blocks, candidate)) {
                trace("%s is Nash-stable", blocks);
                best.add(candidate);
            }
        }
        return best;
    }

    private boolean isNashStable(CoalitionTable table, List<CoalitionId> blocks, PartitionInfo candidate) {
        for (int p = 0; p < table.numProviders(); p++) {
            double current = candidate.getPayoff(p);
            boolean alone = false;

            for (CoalitionId block : blocks) {
                if (block.contains(p)) {
                    alone = block.size() == 1;
                    continue;
                }
                if (prefersToMove(table, block.with(p), p, current)) {
                    trace("%s: provider %d prefers %s", blocks, p, block.with(p));
                    return false;
                }
            }

            if (!alone && prefersToMove(table, CoalitionId.singleton(p), p, current)) {
                trace("%s: provider %d prefers to stand alone", blocks, p);
                return false;
            }
        }
        return true;
    }

    private static boolean prefersToMove(CoalitionTable table, CoalitionId target, int p, double current) {
        OptionalDouble payoff = table.find(target)
            .map(info -> info.getPayoff(p))
            .orElse(OptionalDouble.empty());
        return payoff.isEmpty() || Tolerance.definitelyGreater(payoff.getAsDouble(), current);
    }

    @Override
    public String getName() {
        return "Nash-stable";
    }
}

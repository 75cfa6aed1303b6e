package org.carma.coalition.formation;

import org.carma.coalition.game.Tolerance;
import org.carma.coalition.model.*;

import java.util.*;

/**
 * Social optimum: the partitions maximizing the sum of coalition values.
 * Values within tolerance of the best are kept together.
 */
public class SocialOptimumPartitionSelector extends AbstractPartitionSelector {

    @Override
    public List<PartitionInfo> select(CoalitionTable table) {
        List<PartitionInfo> best = new ArrayList<>();
        double bestValue = 0;

        for (List<CoalitionId> blocks : partitions(table)) {
            PartitionInfo candidate = candidate(table, blocks);
            double value = candidate.getValue();

            if (best.isEmpty() || Tolerance.definitelyGreater(value, bestValue)) {
                best.clear();
                best.add(candidate);
                bestValue = value;
                trace("%s new best with welfare %.6f", blocks, value);
            } else if (Tolerance.essentiallyEqual(value, bestValue)) {
                best.add(candidate);
                trace("%s ties best welfare %.6f", blocks, value);
            }
        }
        return best;
    }

    @Override
    public String getName() {
        return "Social-optimum";
    }
}

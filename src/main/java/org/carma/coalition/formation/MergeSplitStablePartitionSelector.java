package org.carma.coalition.formation;

import org.carma.coalition.game.Tolerance;
import org.carma.coalition.model.*;

import java.util.*;

/**
 * D_hp stability with respect to merge and split operations.
 *
 * A partition is kept when
 * <ul>
 *   <li>no coalition C of the partition is worth definitely less than the
 *       total value of some split of C into two or more blocks, and</li>
 *   <li>no group of its coalitions is worth definitely less, in total, than
 *       their union.</li>
 * </ul>
 * Coalitions missing from the table are ignored in both checks.
 */
public class MergeSplitStablePartitionSelector extends AbstractPartitionSelector {

    @Override
    public List<PartitionInfo> select(CoalitionTable table) {
        List<PartitionInfo> best = new ArrayList<>();
        for (List<CoalitionId> blocks : partitions(table)) {
            if (noProfitableSplit(table, blocks) && noProfitableMerge(table, blocks)) {
                trace("%s is merge/split-stable", blocks);
                best.add(candidate(table, blocks));
            }
        }
        return best;
    }

    private boolean noProfitableSplit(CoalitionTable table, List<CoalitionId> blocks) {
        for (CoalitionId c : blocks) {
            Optional<CoalitionInfo> info = table.find(c);
            if (info.isEmpty()) continue;
            double value = info.get().getValue();

            for (List<CoalitionId> split : new PartitionGenerator(c)) {
                if (split.size() < 2) continue;
                double splitValue = 0;
                for (CoalitionId part : split) {
                    splitValue += table.find(part).map(CoalitionInfo::getValue).orElse(0.0);
                }
                if (Tolerance.definitelyLess(value, splitValue)) {
                    trace("%s: splitting %s into %s pays off", blocks, c, split);
                    return false;
                }
            }
        }
        return true;
    }

    private boolean noProfitableMerge(CoalitionTable table, List<CoalitionId> blocks) {
        // Sub-collections of the partition, encoded as sets of block indices
        for (CoalitionId group : SubsetGenerator.ofPlayers(blocks.size())) {
            double sum = 0;
            CoalitionId union = CoalitionId.EMPTY;
            for (int i : group.members()) {
                Optional<CoalitionInfo> info = table.find(blocks.get(i));
                if (info.isEmpty()) continue;
                sum += info.get().getValue();
                union = union.union(blocks.get(i));
            }

            Optional<CoalitionInfo> merged = table.find(union);
            if (merged.isEmpty()) continue;
            if (Tolerance.definitelyLess(sum, merged.get().getValue())) {
                trace("%s: merging into %s pays off", blocks, union);
                return false;
            }
        }
        return true;
    }

    @Override
    public String getName() {
        return "Merge/split-stable";
    }
}

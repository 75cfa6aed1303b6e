package org.carma.coalition.formation;

import org.carma.coalition.model.*;

import java.util.*;

/**
 * Pareto optimality as a single pass over the partitions in canonical
 * order.
 *
 * A running best payoff is kept per provider, initially NaN. For each
 * candidate the providers are scanned in index order: a provider whose
 * best is NaN or strictly below its candidate payoff raises its best to
 * that payoff; the first provider that does not stops the scan and
 * rejects the candidate. Raises made before the rejection are kept.
 * Candidates accepted early are never revisited, so the result depends on
 * the generation order.
 */
public class ParetoOptimalPartitionSelector extends AbstractPartitionSelector {

    @Override
    public List<PartitionInfo> select(CoalitionTable table) {
        int n = table.numProviders();
        double[] bestPayoffs = new double[n];
        Arrays.fill(bestPayoffs, Double.NaN);

        List<PartitionInfo> best = new ArrayList<>();
        for (List<CoalitionId> blocks : partitions(table)) {
            PartitionInfo candidate = candidate(table, blocks);

            boolean optimal = true;
            for (int p = 0; p < n; p++) {
                double payoff = candidate.getPayoff(p);
                if (Double.isNaN(bestPayoffs[p]) || payoff > bestPayoffs[p]) {
                    bestPayoffs[p] = payoff;
                } else {
                    optimal = false;
                    break;
                }
            }

            if (optimal) {
                trace("%s accepted, best payoffs now %s", blocks, Arrays.toString(bestPayoffs));
                best.add(candidate);
            }
        }
        return best;
    }

    @Override
    public String getName() {
        return "Pareto-optimal";
    }
}

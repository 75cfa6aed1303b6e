package org.carma.coalition.formation;

import org.carma.coalition.model.CoalitionId;
import org.carma.coalition.model.CoalitionInfo;
import org.carma.coalition.model.CoalitionTable;

import java.util.List;

/**
 * Hand-built coalition tables for selector tests.
 */
final class Tables {

    private Tables() {}

    /**
     * Coalition whose value is the sum of its members' payoffs, given in
     * member order.
     */
    static CoalitionInfo coalition(CoalitionId id, double... payoffs) {
        List<Integer> members = id.members();
        if (members.size() != payoffs.length) {
            throw new IllegalArgumentException("One payoff per member expected for " + id);
        }
        CoalitionInfo.Builder b = CoalitionInfo.builder(id);
        double value = 0;
        for (int i = 0; i < payoffs.length; i++) {
            b.payoff(members.get(i), payoffs[i]);
            value += payoffs[i];
        }
        return b.value(value).build();
    }

    /** Cooperation pays: v{0}=v{1}=1, v{0,1}=3. */
    static CoalitionTable superadditivePair() {
        return CoalitionTable.builder(2)
            .put(coalition(CoalitionId.singleton(0), 1.0))
            .put(coalition(CoalitionId.singleton(1), 1.0))
            .put(coalition(CoalitionId.of(0, 1), 1.5, 1.5))
            .build();
    }

    /** Cooperation hurts: v{0}=v{1}=2, v{0,1}=3. */
    static CoalitionTable subadditivePair() {
        return CoalitionTable.builder(2)
            .put(coalition(CoalitionId.singleton(0), 2.0))
            .put(coalition(CoalitionId.singleton(1), 2.0))
            .put(coalition(CoalitionId.of(0, 1), 1.5, 1.5))
            .build();
    }

    /**
     * Three providers where {0,1} together with {2} is the best
     * arrangement, worth 4.
     */
    static CoalitionTable threeProviders(double grandValue) {
        double share = grandValue / 3;
        return CoalitionTable.builder(3)
            .put(coalition(CoalitionId.singleton(0), 1.0))
            .put(coalition(CoalitionId.singleton(1), 1.0))
            .put(coalition(CoalitionId.singleton(2), 1.0))
            .put(coalition(CoalitionId.of(0, 1), 1.5, 1.5))
            .put(coalition(CoalitionId.of(0, 2), 1.0, 1.0))
            .put(coalition(CoalitionId.of(1, 2), 1.0, 1.0))
            .put(coalition(CoalitionId.grand(3), share, share, share))
            .build();
    }
}

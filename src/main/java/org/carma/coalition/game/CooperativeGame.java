package org.carma.coalition.game;

import org.carma.coalition.model.CoalitionId;

import java.util.*;

/**
 * A transferable-utility cooperative game in characteristic-function form.
 *
 * The characteristic function is explicit: v(∅) = 0 and coalitions without
 * an entry are worth 0.
 */
public final class CooperativeGame {

    private final CoalitionId grand;
    private final Map<CoalitionId, Double> values;

    public CooperativeGame(CoalitionId players, Map<CoalitionId, Double> values) {
        this.grand = Objects.requireNonNull(players, "Players cannot be null");
        Map<CoalitionId, Double> copy = new HashMap<>();
        for (Map.Entry<CoalitionId, Double> e : values.entrySet()) {
            if (!e.getKey().isEmpty() && e.getKey().isSubsetOf(players)) {
                copy.put(e.getKey(), e.getValue());
            }
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    /**
     * Game among all given players, with values over their coalitions.
     */
    public static CooperativeGame of(Collection<Integer> players, Map<CoalitionId, Double> values) {
        return new CooperativeGame(CoalitionId.of(players), values);
    }

    public CoalitionId grandCoalition() {
        return grand;
    }

    public List<Integer> players() {
        return grand.members();
    }

    public int numPlayers() {
        return grand.size();
    }

    public double value(CoalitionId coalition) {
        if (coalition.isEmpty()) return 0.0;
        return values.getOrDefault(coalition, 0.0);
    }

    public boolean hasValue(CoalitionId coalition) {
        return values.containsKey(coalition);
    }

    /**
     * The game restricted to the members of a coalition.
     */
    public CooperativeGame subgame(CoalitionId coalition) {
        if (!coalition.isSubsetOf(grand)) {
            throw new IllegalArgumentException("Coalition " + coalition + " is not part of game " + grand);
        }
        return new CooperativeGame(coalition, values);
    }

    /**
     * Every non-empty sub-coalition of {@code coalition}, including itself,
     * in ascending id order.
     */
    static List<CoalitionId> subCoalitions(CoalitionId coalition) {
        List<CoalitionId> result = new ArrayList<>();
        long mask = coalition.bits();
        // Enumerate submasks from small to large
        long sub = 0L;
        do {
            sub = (sub - mask) & mask;
            if (sub != 0L) {
                result.add(new CoalitionId(sub));
            }
        } while (sub != 0L);
        return result;
    }

    @Override
    public String toString() {
        return "CooperativeGame[players=" + grand + ", coalitions=" + values.size() + "]";
    }
}

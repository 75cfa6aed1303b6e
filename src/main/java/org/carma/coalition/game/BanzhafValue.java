package org.carma.coalition.game;

import org.carma.coalition.model.CoalitionId;

import java.util.*;

/**
 * Banzhaf value: each player's marginal contribution averaged over all
 * coalitions of the other players. Not efficient in general.
 *
 * β_i = 1/2^(n−1) · Σ_{S ⊆ N\{i}} (v(S∪{i}) − v(S))
 */
public class BanzhafValue implements PayoffDivisionRule {

    @Override
    public SortedMap<Integer, Double> divide(CooperativeGame game) {
        SortedMap<Integer, Double> payoffs = new TreeMap<>();
        int n = game.numPlayers();
        CoalitionId grand = game.grandCoalition();
        double scale = Math.pow(2.0, -(n - 1));

        for (int i : game.players()) {
            CoalitionId others = grand.without(i);
            double sum = game.value(CoalitionId.singleton(i));
            for (CoalitionId s : CooperativeGame.subCoalitions(others)) {
                sum += game.value(s.with(i)) - game.value(s);
            }
            payoffs.put(i, scale * sum);
        }
        return payoffs;
    }

    @Override
    public String getName() {
        return "Banzhaf";
    }
}

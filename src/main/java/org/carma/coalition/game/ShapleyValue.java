package org.carma.coalition.game;

import org.apache.commons.math3.util.CombinatoricsUtils;
import org.carma.coalition.model.CoalitionId;

import java.util.*;

/**
 * Shapley value: each player receives its marginal contribution averaged
 * over all orders in which the grand coalition can form.
 *
 * φ_i = Σ_{S ⊆ N\{i}} |S|!(n−|S|−1)!/n! · (v(S∪{i}) − v(S))
 */
public class ShapleyValue implements PayoffDivisionRule {

    @Override
    public SortedMap<Integer, Double> divide(CooperativeGame game) {
        SortedMap<Integer, Double> payoffs = new TreeMap<>();
        int n = game.numPlayers();
        CoalitionId grand = game.grandCoalition();

        for (int i : game.players()) {
            CoalitionId others = grand.without(i);
            double phi = marginal(game, CoalitionId.EMPTY, i) / n;
            for (CoalitionId s : CooperativeGame.subCoalitions(others)) {
                // |S|!(n-|S|-1)!/n! = 1 / (n * C(n-1, |S|))
                double weight = 1.0 / (n * CombinatoricsUtils.binomialCoefficientDouble(n - 1, s.size()));
                phi += weight * marginal(game, s, i);
            }
            payoffs.put(i, phi);
        }
        return payoffs;
    }

    private static double marginal(CooperativeGame game, CoalitionId s, int player) {
        return game.value(s.with(player)) - game.value(s);
    }

    @Override
    public String getName() {
        return "Shapley";
    }
}

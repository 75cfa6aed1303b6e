package org.carma.coalition.game;

import java.util.*;

/**
 * Banzhaf value rescaled so that payoffs add up to the grand coalition's
 * value: β_i · v(N) / Σ_j β_j. Falls back to the raw Banzhaf value when the
 * raw values sum to zero.
 */
public class NormalizedBanzhafValue implements PayoffDivisionRule {

    private final BanzhafValue banzhaf = new BanzhafValue();

    @Override
    public SortedMap<Integer, Double> divide(CooperativeGame game) {
        SortedMap<Integer, Double> raw = banzhaf.divide(game);
        double total = 0;
        for (double b : raw.values()) {
            total += b;
        }
        if (Tolerance.essentiallyEqual(total, 0.0)) {
            return raw;
        }

        double grandValue = game.value(game.grandCoalition());
        SortedMap<Integer, Double> payoffs = new TreeMap<>();
        for (Map.Entry<Integer, Double> e : raw.entrySet()) {
            payoffs.put(e.getKey(), e.getValue() * grandValue / total);
        }
        return payoffs;
    }

    @Override
    public String getName() {
        return "Normalized Banzhaf";
    }
}

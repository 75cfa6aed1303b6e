package org.carma.coalition.game;

import java.util.SortedMap;

/**
 * Divides the value of a game's grand coalition among its players.
 */
public interface PayoffDivisionRule {

    /**
     * @return player index to payoff, for every player of the game
     */
    SortedMap<Integer, Double> divide(CooperativeGame game);

    String getName();
}

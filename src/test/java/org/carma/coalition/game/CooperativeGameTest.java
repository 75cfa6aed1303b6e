package org.carma.coalition.game;

import org.carma.coalition.model.CoalitionId;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CooperativeGameTest {

    @Test
    void testMissingCoalitionsAreWorthZero() {
        CooperativeGame game = Games.glove();
        assertEquals(0.0, game.value(CoalitionId.singleton(0)));
        assertEquals(0.0, game.value(CoalitionId.EMPTY));
        assertFalse(game.hasValue(CoalitionId.of(1, 2)));
        assertEquals(1.0, game.value(CoalitionId.of(0, 2)));
    }

    @Test
    void testSubgameKeepsOnlyInnerCoalitions() {
        CooperativeGame sub = Games.majority().subgame(CoalitionId.of(0, 2));
        assertEquals(List.of(0, 2), sub.players());
        assertEquals(1.0, sub.value(CoalitionId.of(0, 2)));
        assertFalse(sub.hasValue(CoalitionId.of(0, 1)));
    }

    @Test
    void testSubCoalitionsInAscendingOrder() {
        assertEquals(
            List.of(CoalitionId.singleton(0), CoalitionId.singleton(2), CoalitionId.of(0, 2)),
            CooperativeGame.subCoalitions(CoalitionId.of(0, 2)));
    }

    @Test
    void testPlayersNeedNotBeContiguous() {
        CooperativeGame game = CooperativeGame.of(List.of(1, 3), Map.of(CoalitionId.of(1, 3), 2.0));
        assertEquals(2, game.numPlayers());
        assertEquals(CoalitionId.of(1, 3), game.grandCoalition());
    }
}

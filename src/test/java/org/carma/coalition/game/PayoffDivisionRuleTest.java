package org.carma.coalition.game;

import org.carma.coalition.model.CoalitionId;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.*;

public class PayoffDivisionRuleTest {

    private static final double DELTA = 1e-9;

    private static double total(Map<Integer, Double> payoffs) {
        return payoffs.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    @Test
    void testShapleyOfGloveGame() {
        SortedMap<Integer, Double> phi = new ShapleyValue().divide(Games.glove());
        assertEquals(2.0 / 3.0, phi.get(0), DELTA);
        assertEquals(1.0 / 6.0, phi.get(1), DELTA);
        assertEquals(1.0 / 6.0, phi.get(2), DELTA);
    }

    @Test
    void testShapleyIsEfficient() {
        for (CooperativeGame game : new CooperativeGame[] {Games.glove(), Games.majority(), Games.squares()}) {
            assertEquals(game.value(game.grandCoalition()), total(new ShapleyValue().divide(game)), DELTA);
        }
    }

    @Test
    void testShapleyOfSubgameUsesActualProviderIndices() {
        CooperativeGame sub = Games.squares().subgame(CoalitionId.of(1, 2));
        SortedMap<Integer, Double> phi = new ShapleyValue().divide(sub);
        assertEquals(2, phi.size());
        assertEquals(2.0, phi.get(1), DELTA);
        assertEquals(2.0, phi.get(2), DELTA);
    }

    @Test
    void testBanzhafOfGloveGame() {
        SortedMap<Integer, Double> beta = new BanzhafValue().divide(Games.glove());
        assertEquals(0.75, beta.get(0), DELTA);
        assertEquals(0.25, beta.get(1), DELTA);
        assertEquals(0.25, beta.get(2), DELTA);
    }

    @Test
    void testNormalizedBanzhafSumsToGrandValue() {
        SortedMap<Integer, Double> beta = new NormalizedBanzhafValue().divide(Games.glove());
        assertEquals(0.6, beta.get(0), DELTA);
        assertEquals(0.2, beta.get(1), DELTA);
        assertEquals(1.0, total(beta), DELTA);
    }

    @Test
    void testNormalizedBanzhafFallsBackWhenAllIndicesVanish() {
        CooperativeGame zero = new CooperativeGame(CoalitionId.grand(2), Map.of());
        SortedMap<Integer, Double> beta = new NormalizedBanzhafValue().divide(zero);
        assertEquals(0.0, beta.get(0), DELTA);
        assertEquals(0.0, beta.get(1), DELTA);
    }

    @Test
    void testSinglePlayerGetsItsValue() {
        CooperativeGame solo = new CooperativeGame(CoalitionId.singleton(4), Map.of(CoalitionId.singleton(4), 3.5));
        assertEquals(3.5, new ShapleyValue().divide(solo).get(4), DELTA);
        assertEquals(3.5, new BanzhafValue().divide(solo).get(4), DELTA);
    }

    @Test
    void testMethodOptionNames() {
        assertEquals(PayoffDivisionMethod.NORMALIZED_BANZHAF, PayoffDivisionMethod.fromOptionName("norm-banzhaf"));
        assertTrue(PayoffDivisionMethod.SHAPLEY.createRule() instanceof ShapleyValue);
        assertThrows(IllegalArgumentException.class, () -> PayoffDivisionMethod.fromOptionName("nucleolus"));
    }
}

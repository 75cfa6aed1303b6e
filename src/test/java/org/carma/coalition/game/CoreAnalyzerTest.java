package org.carma.coalition.game;

import org.carma.coalition.model.CoalitionId;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CoreAnalyzerTest {

    private final CoreAnalyzer analyzer = new CoreAnalyzer();

    @Test
    void testMajorityGameHasEmptyCore() {
        assertTrue(analyzer.isCoreEmpty(Games.majority()));
    }

    @Test
    void testGloveGameHasNonEmptyCore() {
        CooperativeGame game = Games.glove();
        assertFalse(analyzer.isCoreEmpty(game));
        assertTrue(analyzer.belongsToCore(game, Map.of(0, 1.0, 1, 0.0, 2, 0.0)));
        // Shapley value of the glove game is outside its core
        assertFalse(analyzer.belongsToCore(game, new ShapleyValue().divide(game)));
    }

    @Test
    void testShapleyInCoreOfSquaresGame() {
        CooperativeGame game = Games.squares();
        assertFalse(analyzer.isCoreEmpty(game));
        assertTrue(analyzer.belongsToCore(game, new ShapleyValue().divide(game)));
    }

    @Test
    void testSingletonCoreIsNeverEmpty() {
        CooperativeGame solo = new CooperativeGame(CoalitionId.singleton(0), Map.of(CoalitionId.singleton(0), -5.0));
        assertFalse(analyzer.isCoreEmpty(solo));
    }

    @Test
    void testInefficientPayoffsAreOutsideCore() {
        assertFalse(analyzer.belongsToCore(Games.squares(), Map.of(0, 3.0, 1, 3.0, 2, 2.0)));
        assertFalse(analyzer.belongsToCore(Games.squares(), Map.of(0, 3.0, 1, 3.0)));
    }
}

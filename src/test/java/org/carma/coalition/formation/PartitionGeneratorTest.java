package org.carma.coalition.formation;

import org.carma.coalition.model.CoalitionId;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class PartitionGeneratorTest {

    private static List<List<CoalitionId>> collect(PartitionGenerator gen) {
        List<List<CoalitionId>> out = new ArrayList<>();
        gen.forEach(out::add);
        return out;
    }

    @Test
    void testCountsAreBellNumbers() {
        long[] bell = {1, 2, 5, 15, 52, 203};
        for (int n = 1; n <= bell.length; n++) {
            assertEquals(bell[n - 1], collect(PartitionGenerator.ofPlayers(n)).size(), "n=" + n);
        }
    }

    @Test
    void testGrandCoalitionFirstAndSingletonsLast() {
        List<List<CoalitionId>> partitions = collect(PartitionGenerator.ofPlayers(3));
        assertEquals(List.of(CoalitionId.grand(3)), partitions.get(0));
        assertEquals(
            List.of(CoalitionId.singleton(0), CoalitionId.singleton(1), CoalitionId.singleton(2)),
            partitions.get(partitions.size() - 1));
    }

    @Test
    void testCanonicalOrderForThreePlayers() {
        List<List<CoalitionId>> partitions = collect(PartitionGenerator.ofPlayers(3));
        assertEquals(List.of(CoalitionId.of(0, 1), CoalitionId.singleton(2)), partitions.get(1));
        assertEquals(List.of(CoalitionId.of(0, 2), CoalitionId.singleton(1)), partitions.get(2));
        assertEquals(List.of(CoalitionId.singleton(0), CoalitionId.of(1, 2)), partitions.get(3));
    }

    @Test
    void testEveryPartitionCoversThePlayersOnce() {
        CoalitionId players = CoalitionId.of(0, 2, 5, 6);
        Set<List<CoalitionId>> seen = new HashSet<>();
        for (List<CoalitionId> blocks : new PartitionGenerator(players)) {
            CoalitionId union = CoalitionId.EMPTY;
            for (CoalitionId block : blocks) {
                assertFalse(block.isEmpty());
                assertFalse(union.intersects(block));
                union = union.union(block);
            }
            assertEquals(players, union);
            assertTrue(seen.add(blocks), "duplicate " + blocks);
        }
        assertEquals(15, seen.size());
    }

    @Test
    void testNoPlayersYieldsNothing() {
        assertTrue(collect(new PartitionGenerator(CoalitionId.EMPTY)).isEmpty());
    }
}

package org.carma.coalition.formation;

import org.carma.coalition.model.CoalitionTable;
import org.carma.coalition.model.PartitionInfo;

import java.util.List;

/**
 * Picks the "best" partitions of all providers according to a stability or
 * optimality concept. Selectors only read the coalition table.
 */
public interface PartitionSelector {

    /**
     * @return the selected partitions in generation order; possibly empty
     */
    List<PartitionInfo> select(CoalitionTable table);

    String getName();
}

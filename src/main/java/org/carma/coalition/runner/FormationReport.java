package org.carma.coalition.runner;

import org.carma.coalition.model.*;

import java.io.PrintStream;
import java.util.*;

/**
 * Console report of a coalition formation analysis: the selected partitions
 * compared with the grand coalition and with every provider standing alone.
 */
public class FormationReport {

    private static final String RULE = "#".repeat(80);

    private final PrintStream out;

    public FormationReport() {
        this(System.out);
    }

    public FormationReport(PrintStream out) {
        this.out = out;
    }

    public void print(CoalitionFormationInfo formation) {
        CoalitionTable table = formation.getCoalitions();
        int n = table.numProviders();
        CoalitionId grand = table.grandCoalition();

        out.println(RULE);
        out.println("### Report on Formed Coalitions:");
        out.println(RULE);

        out.println("- Best Partitions:");
        if (formation.hasStablePartition()) {
            for (PartitionInfo partition : formation.getBestPartitions()) {
                printPartition(table, grand, partition);
            }
        } else {
            out.println(" * NOT AVAILABLE");
        }

        out.println("- Grand Coalition:");
        Optional<CoalitionInfo> grandInfo = table.find(grand);
        if (grandInfo.isPresent()) {
            CoalitionInfo info = grandInfo.get();
            out.println(" * Payoffs: " + formatPayoffs(info));
            out.println(" * Value: " + fmt(sum(info.getPayoffs().values())));
            out.println(" * Core exists?: {" + !info.isCoreEmpty() + "}");
            out.println(" * Value inside the Core?: {" + info.isPayoffsInCore() + "}");
        } else {
            out.println(" * NOT AVAILABLE");
        }

        out.println("- Singleton Coalitions:");
        StringJoiner payoffs = new StringJoiner(", ", "{", "}");
        StringJoiner cores = new StringJoiner(", ", "{", "}");
        StringJoiner inCore = new StringJoiner(", ", "{", "}");
        double value = 0;
        double kw = 0;
        for (int p = 0; p < n; p++) {
            Optional<CoalitionInfo> single = table.find(CoalitionId.singleton(p));
            double payoff = singletonPayoff(table, p);
            payoffs.add("{" + p + " => " + fmt(payoff) + "}");
            value += payoff;
            kw += single.map(CoalitionInfo::getKilowatts).orElse(Double.NaN);
            cores.add("{" + single.map(c -> !c.isCoreEmpty()).orElse(false) + "}");
            inCore.add("{" + single.map(CoalitionInfo::isPayoffsInCore).orElse(false) + "}");
        }
        out.println(" * Payoffs: " + payoffs);
        out.println(" * Value: " + fmt(value));
        out.println(" * Energy Consumption: " + fmt(kw));
        out.println(" * Core exists?: " + cores);
        out.println(" * Value inside the Core?: " + inCore);
    }

    private void printPartition(CoalitionTable table, CoalitionId grand, PartitionInfo partition) {
        List<CoalitionInfo> members = new ArrayList<>();
        for (CoalitionId id : partition.getCoalitions()) {
            members.add(table.get(id));
        }

        double value = partition.getPayoffSum();
        double kw = 0;
        StringJoiner payoffs = new StringJoiner(", ", "{", "}");
        StringJoiner cores = new StringJoiner(", ", "{", "}");
        StringJoiner inCore = new StringJoiner(", ", "{", "}");
        for (CoalitionInfo info : members) {
            payoffs.add(formatPayoffs(info));
            kw += info.getKilowatts();
            cores.add(String.valueOf(!info.isCoreEmpty()));
            inCore.add(String.valueOf(info.isPayoffsInCore()));
        }
        out.println(" * Payoffs: " + payoffs);
        out.println(" * Value: " + fmt(value));
        out.println(" * Energy Consumption: " + fmt(kw));
        out.println(" * Core exists?: " + cores);
        out.println(" * Value inside the Core?: " + inCore);

        double grandValue = 0;
        double singleValue = 0;
        double singleKw = 0;
        StringJoiner vsGrand = new StringJoiner(", ", "{", "}");
        StringJoiner vsSingle = new StringJoiner(", ", "{", "}");
        for (CoalitionInfo info : members) {
            StringJoiner g = new StringJoiner(", ", "{", "}");
            StringJoiner s = new StringJoiner(", ", "{", "}");
            for (Map.Entry<Integer, Double> e : info.getPayoffs().entrySet()) {
                int p = e.getKey();
                double grandPayoff = table.find(grand)
                    .map(c -> c.getPayoff(p).orElse(Double.NaN)).orElse(Double.NaN);
                double singlePayoff = singletonPayoff(table, p);
                g.add(p + " => " + fmt(increment(e.getValue(), grandPayoff)) + "%");
                s.add(p + " => " + fmt(increment(e.getValue(), singlePayoff)) + "%");
                grandValue += grandPayoff;
                singleValue += singlePayoff;
                singleKw += table.find(CoalitionId.singleton(p)).map(CoalitionInfo::getKilowatts).orElse(Double.NaN);
            }
            vsGrand.add(g.toString());
            vsSingle.add(s.toString());
        }
        out.println(" * Payoff increments wrt Grand-Coalition: " + vsGrand);
        out.println(" * Value increments wrt Grand-Coalition: " + fmt(increment(value, grandValue)) + "%");
        out.println(" * Payoff increments wrt Singleton Coalitions: " + vsSingle);
        out.println(" * Value increments wrt Singleton Coalitions: " + fmt(increment(value, singleValue)) + "%");
        out.println(" * Energy savings wrt Singleton Coalitions: " + fmt((1 - kw / singleKw) * 100.0) + "%");
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static double singletonPayoff(CoalitionTable table, int p) {
        return table.find(CoalitionId.singleton(p))
            .map(c -> c.getPayoff(p).orElse(Double.NaN))
            .orElse(Double.NaN);
    }

    private static String formatPayoffs(CoalitionInfo info) {
        StringJoiner sj = new StringJoiner(", ", "{", "}");
        for (int p : info.getId().members()) {
            sj.add(p + " => " + fmt(info.getPayoff(p).orElse(Double.NaN)));
        }
        return sj.toString();
    }

    /** Percent change of value with respect to reference. */
    static double increment(double value, double reference) {
        return (value / reference - 1) * 100.0;
    }

    private static double sum(Collection<Double> values) {
        double total = 0;
        for (double v : values) {
            total += v;
        }
        return total;
    }

    static String fmt(double v) {
        return String.format(Locale.ROOT, "%.6f", v);
    }
}

package org.carma.coalition;

import org.carma.coalition.config.RunOptions;
import org.carma.coalition.config.ScenarioConfigLoader;
import org.carma.coalition.formation.FormationCriterion;
import org.carma.coalition.game.PayoffDivisionMethod;
import org.carma.coalition.model.Scenario;
import org.carma.coalition.runner.ExperimentRunner;
import org.carma.coalition.safety.InvalidScenarioException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

/**
 * Command line entry point.
 *
 * <pre>
 * java -jar cloud-coalitions.jar --scenario scenarios/three-providers.yaml --formation nash --payoff shapley
 * </pre>
 */
public class CoalitionAnalyzer {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * @return process exit code
     */
    static int run(String[] args) {
        if (Arrays.asList(args).contains("--help") || Arrays.asList(args).contains("-h")) {
            usage(System.out);
            return 0;
        }

        String scenarioFile = null;
        RunOptions options;
        try {
            RunOptions.Builder b = RunOptions.builder();
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--scenario" -> scenarioFile = value(args, ++i);
                    case "--csv" -> b.csvFile(Paths.get(value(args, ++i)));
                    case "--formation" -> b.formationCriterion(FormationCriterion.fromOptionName(value(args, ++i)));
                    case "--payoff" -> b.payoffDivision(PayoffDivisionMethod.fromOptionName(value(args, ++i)));
                    case "--opt-relgap" -> b.optimizerRelativeGap(Double.parseDouble(value(args, ++i)));
                    case "--opt-tilim" -> b.optimizerTimeLimit(Double.parseDouble(value(args, ++i)));
                    case "--rnd-genvms" -> b.randomVms(true);
                    case "--rnd-genpmsonoff" -> b.randomPmPowerStates(true);
                    case "--rnd-genpmsonoffcosts" -> b.randomPmSwitchCosts(true);
                    case "--rnd-genvmsmigrcosts" -> b.randomMigrationCosts(true);
                    case "--rnd-numit" -> b.iterations(Integer.parseInt(value(args, ++i)));
                    case "--rnd-seed" -> b.seed(Long.parseLong(value(args, ++i)));
                    case "--parallelism" -> b.parallelism(Integer.parseInt(value(args, ++i)));
                    case "--verbose", "-v" -> b.verbose(true);
                    default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
                }
            }
            options = b.build();
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            System.err.println("(E) " + e.getMessage());
            usage(System.err);
            return 1;
        }

        if (scenarioFile == null) {
            System.err.println("(E) Scenario file not specified");
            usage(System.err);
            return 1;
        }

        try {
            Scenario scenario = new ScenarioConfigLoader().load(Path.of(scenarioFile));
            new ExperimentRunner().run(scenario, options);
            return 0;
        } catch (InvalidScenarioException e) {
            System.err.println("(E) " + e.getMessage());
            return 1;
        } catch (IOException e) {
            System.err.println("(E) " + e.getMessage());
            return 1;
        }
    }

    private static String value(String[] args, int i) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Missing value for option " + args[i - 1]);
        }
        return args[i];
    }

    static void usage(PrintStream out) {
        out.println("Usage: cloud-coalitions --scenario <file> {options}");
        out.println("Options:");
        out.println(" --csv <file>");
        out.println("   Export all the analyzed coalitions onto a CSV file.");
        out.println(" --formation {'merge-split'|'nash'|'pareto'|'social'}");
        out.println("   The coalition formation strategy [default: 'nash']:");
        out.println("   - 'merge-split': to form merge/split-stable partitions");
        out.println("   - 'nash': to form Nash-stable partitions");
        out.println("   - 'pareto': to form Pareto-optimal partitions");
        out.println("   - 'social': to form social-optimum partitions");
        out.println(" --help");
        out.println("   Show this message.");
        out.println(" --opt-relgap <number in [0,1]>");
        out.println("   Relative gap of the optimizer [default: 0].");
        out.println(" --opt-tilim <number>");
        out.println("   Time limit of the optimizer in seconds, -1 for none [default: -1].");
        out.println(" --parallelism <number>");
        out.println("   Number of allocation problems solved in parallel [default: 1].");
        out.println(" --payoff {'banzhaf'|'norm-banzhaf'|'shapley'}");
        out.println("   The coalition value division rule [default: 'shapley'].");
        out.println(" --rnd-genvms");
        out.println("   Enable the random generation of VMs for each CIP.");
        out.println(" --rnd-genpmsonoff");
        out.println("   Enable the random generation of PM power states for each CIP.");
        out.println(" --rnd-genpmsonoffcosts");
        out.println("   Enable the random generation of switch-on/off costs of PMs for each CIP and PM type.");
        out.println(" --rnd-genvmsmigrcosts");
        out.println("   Enable the random generation of CIP-to-CIP migration costs of VMs for each CIP and VM type.");
        out.println(" --rnd-numit <number>");
        out.println("   Number of iterations, used only with --rnd-genvms [default: 1].");
        out.println(" --rnd-seed <number>");
        out.println("   Seed for random number generation [default: 5489].");
        out.println(" --scenario <file>");
        out.println("   YAML scenario file to analyze.");
        out.println(" --verbose");
        out.println("   Trace the analysis.");
    }
}

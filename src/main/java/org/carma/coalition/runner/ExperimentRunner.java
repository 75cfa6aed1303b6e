package org.carma.coalition.runner;

import org.carma.coalition.config.RunOptions;
import org.carma.coalition.mechanism.CoalitionValueEnumerator;
import org.carma.coalition.model.CoalitionFormationInfo;
import org.carma.coalition.model.Scenario;
import org.carma.coalition.simulation.ScenarioPerturbator;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.*;

/**
 * Runs a coalition formation experiment: one analysis per (possibly
 * perturbed) scenario, each followed by a report and an optional CSV export.
 *
 * Usage:
 * <pre>
 * ExperimentRunner runner = new ExperimentRunner();
 * List&lt;CoalitionFormationInfo&gt; results = runner.run(scenario, RunOptions.defaults());
 * </pre>
 */
public class ExperimentRunner {

    private final CoalitionValueEnumerator enumerator;
    private final PrintStream out;
    private final CsvExporter csvExporter = new CsvExporter();

    /**
     * Runner on the OR-Tools backend, configured from each run's options.
     */
    public ExperimentRunner() {
        this(null, System.out);
    }

    /**
     * @param enumerator enumerator to use for every run, or null to build
     *                   one from the run options
     */
    public ExperimentRunner(CoalitionValueEnumerator enumerator, PrintStream out) {
        this.enumerator = enumerator;
        this.out = Objects.requireNonNull(out, "Output stream cannot be null");
    }

    // ========================================================================
    // MAIN EXECUTION
    // ========================================================================

    /**
     * @return the analysis of every iteration, in order
     * @throws IOException if the CSV file cannot be written
     */
    public List<CoalitionFormationInfo> run(Scenario scenario, RunOptions options) throws IOException {
        CoalitionValueEnumerator analyzer = enumerator != null ? enumerator : CoalitionValueEnumerator.create(options);
        ScenarioPerturbator perturbator = new ScenarioPerturbator(scenario, options);
        FormationReport report = new FormationReport(out);
        Optional<Path> csv = options.getCsvFile();

        List<CoalitionFormationInfo> results = new ArrayList<>();
        int n = perturbator.getIterations();
        for (int i = 1; i <= n; i++) {
            out.println("Iteration #" + i);

            Scenario current = perturbator.next();
            out.println("Scenario: " + current);
            out.println(options);

            out.println("Analyzing coalitions...");
            CoalitionFormationInfo formation = analyzer.enumerate(current, options);
            report.print(formation);

            if (csv.isPresent()) {
                csvExporter.export(csv.get(), formation, i > 1);
            }
            results.add(formation);
        }

        out.println("DONE!");
        return results;
    }
}

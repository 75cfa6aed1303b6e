package org.carma.coalition.runner;

import org.carma.coalition.model.*;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.Locale;

/**
 * Exports the coalition table of an analysis as CSV: one row per coalition
 * in ascending id order, with each provider's payoff (empty when the
 * provider has none) and their sum. Numbers are written in fixed notation
 * with six decimals.
 *
 * When appending, a line of separators stands in for the header so that
 * successive iterations remain distinguishable in one file.
 */
public class CsvExporter {

    private static final char FIELD_SEP = ',';
    private static final char QUOTE = '"';

    public void export(Path file, CoalitionFormationInfo formation, boolean append) throws IOException {
        OpenOption[] options = append
            ? new OpenOption[] { StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND }
            : new OpenOption[] { StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING };

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8, options)) {
            write(w, formation, append);
        }
    }

    public void write(Writer w, CoalitionFormationInfo formation, boolean append) throws IOException {
        CoalitionTable table = formation.getCoalitions();
        int n = table.numProviders();

        StringBuilder sb = new StringBuilder();
        if (append) {
            sb.append(String.valueOf(FIELD_SEP).repeat(n));
        } else {
            sb.append(quoted("Coalition ID"));
            for (int p = 0; p < n; p++) {
                sb.append(FIELD_SEP).append(quoted("Payoff(CIP " + p + ")"));
            }
            sb.append(FIELD_SEP).append(quoted("Value(Coalition)"));
        }
        sb.append('\n');

        for (CoalitionInfo info : table.coalitions()) {
            sb.append(info.getId().bits());
            double value = 0;
            for (int p = 0; p < n; p++) {
                sb.append(FIELD_SEP);
                Double payoff = info.getPayoffs().get(p);
                if (payoff != null) {
                    sb.append(number(payoff));
                    value += payoff;
                }
            }
            sb.append(FIELD_SEP).append(number(value)).append('\n');
        }
        w.write(sb.toString());
    }

    private static String number(double x) {
        return String.format(Locale.ROOT, "%.6f", x);
    }

    private static String quoted(String s) {
        return QUOTE + s + QUOTE;
    }
}

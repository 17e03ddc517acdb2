package org.lsst.fits.stacker.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A SExtractor catalog in ASCII_HEAD format. Column names come from the
 * {@code #   n NAME  description} lines at the top of the file; vector
 * columns occupy the following unnamed columns.
 */
public class SourceCatalog {

    private static final Pattern COLUMN_PATTERN = Pattern.compile("#\\s*(\\d+)\\s+(\\S+).*");

    private final Path file;
    private final Map<String, Integer> columns;
    private final List<double[]> rows;

    private SourceCatalog(Path file, Map<String, Integer> columns, List<double[]> rows) {
        this.file = file;
        this.columns = columns;
        this.rows = rows;
    }

    public static SourceCatalog read(Path file) throws IOException {
        Map<String, Integer> columns = new LinkedHashMap<>();
        List<double[]> rows = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.US_ASCII)) {
            for (;;) {
                String line = reader.readLine();
                if (line == null) {
                    break;
                }
                line = line.trim();
                if (line.isEmpty()) {
                    continue;
                }
                if (line.startsWith("#")) {
                    Matcher matcher = COLUMN_PATTERN.matcher(line);
                    if (matcher.matches()) {
                        columns.put(matcher.group(2), Integer.parseInt(matcher.group(1)) - 1);
                    }
                    continue;
                }
                String[] tokens = line.split("\\s+");
                double[] row = new double[tokens.length];
                for (int i = 0; i < tokens.length; i++) {
                    try {
                        row[i] = Double.parseDouble(tokens[i]);
                    } catch (NumberFormatException x) {
                        throw new IOException("Invalid value '" + tokens[i] + "' in " + file, x);
                    }
                }
                rows.add(row);
            }
        }
        if (columns.isEmpty()) {
            throw new IOException("No column definitions in catalog " + file);
        }
        return new SourceCatalog(file, columns, rows);
    }

    public Path getFile() {
        return file;
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public int size() {
        return rows.size();
    }

    public double get(int row, String column) {
        Integer index = columns.get(column);
        if (index == null) {
            throw new IllegalArgumentException("No column " + column + " in " + file);
        }
        double[] values = rows.get(row);
        return index < values.length ? values[index] : Double.NaN;
    }
}

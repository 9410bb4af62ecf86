package com.libragraph.batchsim.core.input.catalog;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Whitespace-separated text catalog. Blank lines and lines starting with the comment
 * marker are skipped.
 */
public final class AsciiCatalog implements Catalog {

    private final Path path;
    private final int nobjects;
    private final int ncols;
    private final List<String[]> rows;

    private AsciiCatalog(Path path, int nobjects, int ncols, List<String[]> rows) {
        this.path = path;
        this.nobjects = nobjects;
        this.ncols = ncols;
        this.rows = rows;
    }

    /**
     * @param countOnly count rows without keeping them; {@code get} methods then fail
     */
    public static AsciiCatalog read(Path path, String comments, boolean countOnly) throws IOException {
        List<String[]> rows = new ArrayList<>();
        int count = 0;
        int ncols = 0;
        try (BufferedReader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = in.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || (!comments.isEmpty() && trimmed.startsWith(comments))) {
                    continue;
                }
                count++;
                if (countOnly) continue;
                String[] cols = trimmed.split("\\s+");
                if (ncols == 0) {
                    ncols = cols.length;
                } else if (cols.length != ncols) {
                    throw new IOException(path + ": row " + count + " has " + cols.length
                            + " columns, expected " + ncols);
                }
                rows.add(cols);
            }
        }
        return new AsciiCatalog(path, count, ncols, countOnly ? null : rows);
    }

    public Path path() {
        return path;
    }

    @Override
    public int getNObjects() {
        return nobjects;
    }

    @Override
    public int getNCols() {
        return ncols;
    }

    @Override
    public String get(int index, int col) {
        if (rows == null) {
            throw new IllegalStateException("Catalog " + path + " was read for counting only");
        }
        if (index < 0 || index >= nobjects) {
            throw new IndexOutOfBoundsException("index " + index + " is out of range for catalog "
                    + path + " with " + nobjects + " rows");
        }
        if (col < 0 || col >= ncols) {
            throw new IndexOutOfBoundsException("col " + col + " is out of range for catalog "
                    + path + " with " + ncols + " columns");
        }
        return rows.get(index)[col];
    }

    @Override
    public double getFloat(int index, int col) {
        return Double.parseDouble(get(index, col));
    }

    @Override
    public int getInt(int index, int col) {
        return Integer.parseInt(get(index, col));
    }
}

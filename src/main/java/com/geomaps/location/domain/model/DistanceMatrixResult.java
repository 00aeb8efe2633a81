package com.geomaps.location.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Source-by-target travel distances (meters) and durations (seconds).
 * Row i belongs to {@code sources.get(i)}, column j to {@code targets.get(j)}.
 * Pairs the vendor could not route hold {@link Double#NaN}, never zero.
 */
@EqualsAndHashCode
public final class DistanceMatrixResult {

    private final double[][] distances;
    private final double[][] durations;
    @Getter
    private final List<Coordinate> sources;
    @Getter
    private final List<Coordinate> targets;
    @Getter
    private final DistanceUnit unit;

    public DistanceMatrixResult(double[][] distances, double[][] durations,
                                List<Coordinate> sources, List<Coordinate> targets, DistanceUnit unit) {
        this.sources = List.copyOf(Objects.requireNonNull(sources, "sources"));
        this.targets = List.copyOf(Objects.requireNonNull(targets, "targets"));
        this.unit = unit != null ? unit : DistanceUnit.METERS;
        this.distances = copyChecked("distances", distances, this.sources.size(), this.targets.size());
        this.durations = copyChecked("durations", durations, this.sources.size(), this.targets.size());
    }

    /**
     * Builds a table of the given shape with every cell unreachable.
     */
    public static double[][] unreachable(int rows, int columns) {
        double[][] table = new double[rows][columns];
        for (double[] row : table) {
            Arrays.fill(row, Double.NaN);
        }
        return table;
    }

    public double[][] getDistances() {
        return copy(distances);
    }

    public double[][] getDurations() {
        return copy(durations);
    }

    public double getDistance(int source, int target) {
        return distances[source][target];
    }

    public double getDuration(int source, int target) {
        return durations[source][target];
    }

    public boolean isReachable(int source, int target) {
        return !Double.isNaN(distances[source][target]) && !Double.isNaN(durations[source][target]);
    }

    public int getRowCount() {
        return sources.size();
    }

    public int getColumnCount() {
        return targets.size();
    }

    /**
     * Distances converted for display. Unreachable cells stay NaN.
     */
    public double[][] distancesIn(DistanceUnit displayUnit) {
        double[][] converted = copy(distances);
        for (double[] row : converted) {
            for (int j = 0; j < row.length; j++) {
                row[j] = displayUnit.fromMeters(row[j]);
            }
        }
        return converted;
    }

    /**
     * Distances in the unit the caller asked for when requesting the matrix.
     */
    public double[][] getDisplayDistances() {
        return distancesIn(unit);
    }

    @Override
    public String toString() {
        return "DistanceMatrixResult(" + sources.size() + "x" + targets.size() + ", unit=" + unit + ")";
    }

    private static double[][] copyChecked(String name, double[][] table, int rows, int columns) {
        Objects.requireNonNull(table, name);
        if (table.length != rows) {
            throw new IllegalArgumentException(name + " must have " + rows + " rows, got " + table.length);
        }
        for (int i = 0; i < table.length; i++) {
            if (table[i] == null || table[i].length != columns) {
                throw new IllegalArgumentException(name + " row " + i + " must have " + columns + " columns");
            }
        }
        return copy(table);
    }

    private static double[][] copy(double[][] table) {
        double[][] copy = new double[table.length][];
        for (int i = 0; i < table.length; i++) {
            copy[i] = table[i].clone();
        }
        return copy;
    }
}

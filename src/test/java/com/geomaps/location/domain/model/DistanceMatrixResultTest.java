package com.geomaps.location.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DistanceMatrixResultTest {

    private static final List<Coordinate> SOURCES = List.of(new Coordinate(40.7128, -74.0060), new Coordinate(34.0522, -118.2437));
    private static final List<Coordinate> TARGETS = List.of(new Coordinate(39.7392, -104.9903));

    @Test
    void testConstruct_ShapeMismatch_Rejected() {
        assertThatThrownBy(() -> new DistanceMatrixResult(
                new double[][] {{1.0}}, new double[][] {{1.0}, {2.0}}, SOURCES, TARGETS, DistanceUnit.METERS))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("distances");
        assertThatThrownBy(() -> new DistanceMatrixResult(
                new double[][] {{1.0}, {2.0}}, new double[][] {{1.0, 2.0}, {2.0}}, SOURCES, TARGETS, DistanceUnit.METERS))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("durations");
    }

    @Test
    void testUnreachable_RepresentedAsNaN() {
        double[][] distances = {{2_600_000.0}, {Double.NaN}};
        double[][] durations = {{90_000.0}, {Double.NaN}};

        DistanceMatrixResult result = new DistanceMatrixResult(distances, durations, SOURCES, TARGETS, DistanceUnit.KILOMETERS);

        assertThat(result.isReachable(0, 0)).isTrue();
        assertThat(result.isReachable(1, 0)).isFalse();
        assertThat(result.getDistance(1, 0)).isNaN();
        assertThat(result.getRowCount()).isEqualTo(2);
        assertThat(result.getColumnCount()).isEqualTo(1);
    }

    @Test
    void testAccessors_ReturnDefensiveCopies() {
        double[][] distances = {{1.0}, {2.0}};
        DistanceMatrixResult result = new DistanceMatrixResult(distances, new double[][] {{3.0}, {4.0}},
                SOURCES, TARGETS, DistanceUnit.METERS);

        distances[0][0] = 99.0;
        result.getDistances()[1][0] = 99.0;

        assertThat(result.getDistance(0, 0)).isEqualTo(1.0);
        assertThat(result.getDistance(1, 0)).isEqualTo(2.0);
    }

    @Test
    void testDistancesIn_ConvertsAtBoundaryOnly() {
        DistanceMatrixResult result = new DistanceMatrixResult(new double[][] {{1500.0}, {Double.NaN}},
                new double[][] {{60.0}, {Double.NaN}}, SOURCES, TARGETS, DistanceUnit.KILOMETERS);

        double[][] kilometers = result.getDisplayDistances();

        assertThat(kilometers[0][0]).isEqualTo(1.5);
        assertThat(kilometers[1][0]).isNaN();
        assertThat(result.getDistance(0, 0)).isEqualTo(1500.0);
        assertThat(result.distancesIn(DistanceUnit.METERS)[0][0]).isEqualTo(1500.0);
    }

    @Test
    void testUnreachableFactory_AllNaN() {
        double[][] table = DistanceMatrixResult.unreachable(2, 3);

        assertThat(table).hasDimensions(2, 3);
        for (double[] row : table) {
            for (double cell : row) {
                assertThat(cell).isNaN();
            }
        }
    }
}

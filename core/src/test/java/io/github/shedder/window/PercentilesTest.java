package io.github.shedder.window;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Percentiles Tests")
class PercentilesTest {

    @Test
    @DisplayName("Endpoints map to min and max")
    void endpoints() {
        double[] data = {2, 4, 8, 16};
        assertEquals(2, Percentiles.inclusive(data, 0));
        assertEquals(16, Percentiles.inclusive(data, 100));
    }

    @Test
    @DisplayName("Median of even-sized data interpolates the middle pair")
    void median() {
        double[] data = {1, 2, 3, 4};
        assertEquals(2.5, Percentiles.inclusive(data, 50), 1e-12);
    }

    @Test
    @DisplayName("Single value is every percentile")
    void singleValue() {
        double[] data = {7};
        assertEquals(7, Percentiles.inclusive(data, 1));
        assertEquals(7, Percentiles.inclusive(data, 99));
    }

    @Test
    @DisplayName("Only the first length elements are considered")
    void prefix() {
        double[] data = {10, 20, 30, 999, 999};
        assertEquals(30, Percentiles.inclusive(data, 3, 100));
    }

    @Test
    @DisplayName("No values is an error")
    void empty() {
        assertThrows(IllegalArgumentException.class, () -> Percentiles.inclusive(new double[0], 50));
    }
}

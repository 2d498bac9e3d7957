package io.github.shedder.window;

import java.util.Arrays;

/**
 * One time slice of a {@link RollingWindow}. Not thread-safe; guarded by the window's lock.
 */
final class Bucket {

    private final boolean retainValues;
    private final int initialCapacity;

    private long count;
    private double sum;
    private double[] values;
    private int size;

    Bucket(boolean retainValues, int preallocationHint) {
        this.retainValues = retainValues;
        this.initialCapacity = preallocationHint;
        this.values = retainValues ? new double[preallocationHint] : null;
    }

    void add(double value) {
        count++;
        sum += value;
        if (retainValues) {
            if (size == values.length) {
                values = Arrays.copyOf(values, Math.max(8, size * 2));
            }
            values[size++] = value;
        }
    }

    void reset() {
        count = 0;
        sum = 0;
        size = 0;
        // Shrink buffers inflated by a burst back to the hinted size
        if (retainValues && values.length > Math.max(64, initialCapacity * 4)) {
            values = new double[initialCapacity];
        }
    }

    long count() {
        return count;
    }

    double sum() {
        return sum;
    }

    int copyValuesTo(double[] target, int offset) {
        System.arraycopy(values, 0, target, offset, size);
        return offset + size;
    }

    int size() {
        return size;
    }
}

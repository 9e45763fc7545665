package it.unitn.ranges;

import org.eclipse.collections.api.block.procedure.primitive.IntProcedure;

/**
 * Inclusive run of consecutive integers, {@code low <= high}.
 */
public record Bounds(int low, int high) {

    public Bounds {
        if (low > high)
            throw new IllegalArgumentException("low %d > high %d".formatted(low, high));
    }

    public static Bounds of(int a, int b) {
        return new Bounds(Math.min(a, b), Math.max(a, b));
    }

    public static Bounds of(int value) {
        return new Bounds(value, value);
    }

    public long size() {
        return (long) high - low + 1L;
    }

    /**
     * Feeds every integer of the run, ascending, to {@code procedure}.
     * Iterates on {@code long} so that a run ending at {@link Integer#MAX_VALUE} terminates.
     */
    public void forEach(IntProcedure procedure) {
        for (long i = low; i <= high; i++)
            procedure.value((int) i);
    }

    @Override
    public String toString() {
        return "[%d, %d]".formatted(low, high);
    }

}

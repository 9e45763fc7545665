package it.unitn.ranges;

import org.eclipse.collections.api.IntIterable;
import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.factory.primitive.IntLists;
import org.eclipse.collections.api.factory.primitive.IntSets;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.Objects;

import static it.unitn.utils.Comparing.cmp;

/**
 * Integers to canonical range string.
 * <br>
 * Output tokens are ascending, never overlapping nor adjacent:
 * {@code [15, 1, 3, 5, 6, 7, 8, 10, 11, 3]} becomes {@code 1,3,5-8,10-11,15}.
 * Negative runs keep the plain rendering, {@code [-3, -2, -1]} becomes {@code -3--1}.
 */
public interface Formatting {

    static String format(int... values) {
        return format(IntLists.immutable.with(values));
    }

    static String format(IntIterable values) {
        return format(values, Notation.DEFAULT);
    }

    static String format(IntIterable values, Notation notation) {
        Objects.requireNonNull(notation, "notation");

        return runs(values)
            .collect(run -> render(run, notation))
            .makeString(notation.separator());
    }

    /**
     * @return the maximal runs of {@code values}, ascending
     */
    static ImmutableList<Bounds> runs(IntIterable values) {
        Objects.requireNonNull(values, "values");

        final var sorted = IntSets.mutable.withAll(values).toSortedArray();
        final var runs = Lists.mutable.<Bounds>empty();

        if (sorted.length == 0)
            return runs.toImmutable();

        var open = Bounds.of(sorted[0]);

        for (int i = 1; i < sorted.length; i++) {
            final var x = sorted[i];

            switch (cmp(x, open.high() + 1L)) {
                case EQ -> open = new Bounds(open.low(), x);
                case GT -> {
                    runs.add(open);
                    open = Bounds.of(x);
                }
                // duplicate
                case LT -> {}
            }
        }

        runs.add(open);
        return runs.toImmutable();
    }

    private static String render(Bounds run, Notation notation) {
        return run.low() == run.high()
            ? Integer.toString(run.low())
            : run.low() + notation.rangeDelim() + run.high();
    }

}

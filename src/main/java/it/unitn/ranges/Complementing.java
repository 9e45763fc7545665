package it.unitn.ranges;

import org.eclipse.collections.api.IntIterable;
import org.eclipse.collections.api.factory.primitive.IntSets;
import org.eclipse.collections.api.set.primitive.ImmutableIntSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalInt;

import static it.unitn.utils.Logging.logging;

/**
 * Gaps of a range string within {@code [rangeStart, rangeEnd)}.
 * <br>
 * Without {@code rangeEnd} the interval stops right after the greatest parsed value,
 * or is empty when nothing was parsed.
 * An interval with {@code rangeStart >= rangeEnd} is empty, never an error,
 * and a negative {@code rangeStart} counts as 0.
 */
public interface Complementing {

    static String complement(String range) {
        return complement(range, 0);
    }

    static String complement(String range, int rangeStart) {
        return complement(range, rangeStart, OptionalInt.empty(), Notation.DEFAULT);
    }

    static String complement(String range, int rangeStart, int rangeEnd) {
        return complement(range, rangeStart, OptionalInt.of(rangeEnd), Notation.DEFAULT);
    }

    static String complement(String range, int rangeStart, OptionalInt rangeEnd, Notation notation) {
        Objects.requireNonNull(rangeEnd, "rangeEnd");

        record Interval(long start, long end) {}

        final var set = Parsing.parse(range, notation);

        final var interval = new Interval(
            rangeStart,
            rangeEnd.isPresent()
                ? rangeEnd.getAsInt()
                : set.isEmpty() ? rangeStart : set.max() + 1L
        );

        return logging(
            log(),
            range,
            interval,
            Formatting.format(complementOf(set, interval.start(), interval.end()), notation)
        );
    }

    /**
     * Counts from zero: nothing below 0 is ever a gap, so an interval entirely below zero is empty.
     *
     * @return {@code { i : max(rangeStart, 0) <= i < rangeEnd } - values}
     */
    static ImmutableIntSet complementOf(IntIterable values, long rangeStart, long rangeEnd) {
        Objects.requireNonNull(values, "values");

        final var present = IntSets.immutable.withAll(values);
        final var gaps = IntSets.mutable.empty();

        final var from = Math.max(rangeStart, 0L);
        final var to = Math.min(rangeEnd, Integer.MAX_VALUE + 1L);

        for (long i = from; i < to; i++)
            if (!present.contains((int) i))
                gaps.add((int) i);

        return gaps.toImmutable();
    }

    private static Logger log() {
        return LoggerFactory.getLogger(Complementing.class);
    }

}

package it.unitn.ranges;

import org.eclipse.collections.api.list.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static it.unitn.utils.Logging.logging;

/**
 * Range string to the inclusive bounds of its maximal runs.
 * <br>
 * The input goes through {@link Parsing} and {@link Formatting} first,
 * so {@code 5,3,1-2} yields {@code [1, 3], [5, 5]}.
 */
public interface Tupling {

    static ImmutableList<Bounds> tuples(String range) {
        return tuples(range, Notation.DEFAULT);
    }

    static ImmutableList<Bounds> tuples(String range, Notation notation) {
        final var normalized = Formatting.format(Parsing.parse(range, notation), notation);

        return logging(
            log(),
            range,
            normalized,
            Parsing.spans(normalized, notation).collect(Token::bounds)
        );
    }

    private static Logger log() {
        return LoggerFactory.getLogger(Tupling.class);
    }

}

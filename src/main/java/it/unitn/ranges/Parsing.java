package it.unitn.ranges;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.factory.primitive.IntSets;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.set.primitive.ImmutableIntSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import static it.unitn.utils.Logging.logging;
import static org.eclipse.collections.impl.collector.Collectors2.toImmutableList;

/**
 * Range string to integers.
 * <br>
 * The whole string is trimmed once, split on {@link Notation#delim()},
 * and every token is trimmed again before {@link Token#classify}.
 * A blank string is the empty set; an empty token anywhere else is malformed.
 * <br>
 * Spans are expanded in full: {@code 0-2000000000} really allocates two billion entries.
 */
public interface Parsing {

    static ImmutableIntSet parse(String range) {
        return parse(range, Notation.DEFAULT);
    }

    static ImmutableIntSet parse(String range, Notation notation) {
        final var set = IntSets.mutable.empty();
        spans(range, notation).forEach(token -> token.bounds().forEach(set::add));
        return logging(log(), range, set.toImmutable());
    }

    static ImmutableList<Token> spans(String range) {
        return spans(range, Notation.DEFAULT);
    }

    /**
     * @return the tokens of {@code range} in textual order, not expanded nor merged
     * @throws MalformedTokenException on the first token that is not one or two integers
     */
    static ImmutableList<Token> spans(String range, Notation notation) {
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(notation, "notation");

        final var trimmed = range.strip();

        if (trimmed.isEmpty())
            return Lists.immutable.empty();

        return Stream.of(trimmed.split(Pattern.quote(notation.delim()), -1))
            .map(String::strip)
            .map(token -> Token.classify(token, notation))
            .collect(toImmutableList());
    }

    private static Logger log() {
        return LoggerFactory.getLogger(Parsing.class);
    }

}

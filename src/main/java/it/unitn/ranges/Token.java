package it.unitn.ranges;

/**
 * One classified token of a range string.
 */
public sealed interface Token {

    Bounds bounds();

    record Singleton(int value) implements Token {

        @Override
        public Bounds bounds() {
            return Bounds.of(value);
        }

    }

    /**
     * Both ends as written, so {@code 8-5} keeps {@code from = 8}.
     */
    record Span(int from, int to) implements Token {

        @Override
        public Bounds bounds() {
            return Bounds.of(from, to);
        }

    }

    /**
     * The separator is the first {@code rangeDelim} past index 0,
     * so a leading minus always belongs to the first literal:
     * <ul>
     *     <li>{@code -5} is {@code Singleton(-5)}</li>
     *     <li>{@code -5--1} is {@code Span(-5, -1)}</li>
     *     <li>{@code 5--1} is {@code Span(5, -1)}</li>
     * </ul>
     *
     * @throws MalformedTokenException if either side is not a base-10 integer
     */
    static Token classify(String token, Notation notation) {
        final var rangeDelim = notation.rangeDelim();
        final var at = token.indexOf(rangeDelim, 1);

        try {
            return at < 0
                ? new Singleton(Integer.parseInt(token))
                : new Span(
                    Integer.parseInt(token.substring(0, at)),
                    Integer.parseInt(token.substring(at + rangeDelim.length()))
                );
        } catch (NumberFormatException e) {
            throw new MalformedTokenException(token, e);
        }
    }

}

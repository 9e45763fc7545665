package it.unitn.ranges;

import java.util.Objects;

/**
 * Delimiters of a range string.
 *
 * @param delim      separates tokens, {@code ","} by default
 * @param rangeDelim separates the two ends of a span, {@code "-"} by default
 * @param delimSpace whether formatting puts a space after each {@code delim}
 */
public record Notation(String delim, String rangeDelim, boolean delimSpace) {

    public static final Notation DEFAULT = new Notation(",", "-", false);

    public Notation {
        Objects.requireNonNull(delim, "delim");
        Objects.requireNonNull(rangeDelim, "rangeDelim");

        if (delim.isEmpty() || rangeDelim.isEmpty())
            throw new IllegalArgumentException("delimiters must not be empty");

        if (delim.equals(rangeDelim))
            throw new IllegalArgumentException("delim and rangeDelim must differ, both are '%s'".formatted(delim));
    }

    public Notation(String delim, String rangeDelim) {
        this(delim, rangeDelim, false);
    }

    public Notation withDelim(String delim) {
        return new Notation(delim, rangeDelim, delimSpace);
    }

    public Notation withRangeDelim(String rangeDelim) {
        return new Notation(delim, rangeDelim, delimSpace);
    }

    public Notation withDelimSpace(boolean delimSpace) {
        return new Notation(delim, rangeDelim, delimSpace);
    }

    /**
     * @return what goes between two formatted tokens
     */
    public String separator() {
        return delimSpace ? delim + " " : delim;
    }

}

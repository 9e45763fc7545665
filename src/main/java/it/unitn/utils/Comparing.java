package it.unitn.utils;

public interface Comparing {

    static Ordering cmp(long a, long b) {
        final var cmp = Long.compare(a, b);

        if (cmp < 0)
            return Ordering.LT;

        if (cmp > 0)
            return Ordering.GT;

        return Ordering.EQ;
    }

}

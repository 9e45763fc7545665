package it.unitn.ranges;

import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.DynamicTest.dynamicTest;
import static org.junit.jupiter.api.DynamicTest.stream;
import static org.junit.jupiter.api.Named.named;

class TokenTest {

    @TestFactory
    Stream<DynamicTest> classify() {

        record Test(String token, Token expected) {}

        final var examples =
            Stream.of(
                    new Test("5", new Token.Singleton(5)),
                    new Test("-5", new Token.Singleton(-5)),
                    new Test("5-8", new Token.Span(5, 8)),
                    new Test("8-5", new Token.Span(8, 5)),
                    new Test("-5--1", new Token.Span(-5, -1)),
                    new Test("5--1", new Token.Span(5, -1)),
                    new Test("-5-1", new Token.Span(-5, 1))
                )
                .map(x -> named("'%s' → %s".formatted(x.token(), x.expected()), x));

        return Stream.concat(
            stream(examples, t -> assertEquals(t.expected(), Token.classify(t.token(), Notation.DEFAULT))),
            Stream.of(
                dynamicTest(
                    "span bounds are ascending",
                    () -> assertEquals(new Bounds(5, 8), new Token.Span(8, 5).bounds())
                ),
                dynamicTest(
                    "singleton bounds",
                    () -> assertEquals(new Bounds(3, 3), new Token.Singleton(3).bounds())
                ),
                dynamicTest(
                    "w/ multi-character rangeDelim",
                    () -> assertEquals(new Token.Span(-2, 7), Token.classify("-2..7", Notation.DEFAULT.withRangeDelim("..")))
                ),
                dynamicTest(
                    "malformed keeps the token and the cause",
                    () -> {
                        final var e = assertThrows(MalformedTokenException.class, () -> Token.classify("4-z", Notation.DEFAULT));
                        assertEquals("4-z", e.token());
                        assertEquals("malformed token '4-z'", e.getMessage());
                        assertInstanceOf(NumberFormatException.class, e.getCause());
                    }
                )
            )
        );
    }

}

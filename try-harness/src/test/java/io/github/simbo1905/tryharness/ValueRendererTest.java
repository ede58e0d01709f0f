package io.github.simbo1905.tryharness;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ValueRendererTest extends TryLoggingConfig {

    private final ValueRenderer qualified = new ValueRenderer(ValueRenderer.TypeNames.QUALIFIED);
    private final ValueRenderer simple = new ValueRenderer(ValueRenderer.TypeNames.SIMPLE);

    record Point(int x, int y) {}

    enum Colour { RED }

    static final class Opaque {}

    static final class Exploding {
        @Override
        public String toString() {
            throw new IllegalStateException("boom");
        }
    }

    static final class FailingAssertion {
        @Override
        public String toString() {
            throw new AssertionError("toString broke");
        }
    }

    static final class Recursive {
        @Override
        public String toString() {
            return "r" + this;
        }
    }

    static Stream<Arguments> printableValues() {
        return Stream.of(
            Arguments.of(4, "\"4\" (java.lang.Integer)"),
            Arguments.of("abc", "\"abc\" (java.lang.String)"),
            Arguments.of(2.5d, "\"2.5\" (java.lang.Double)"),
            Arguments.of('c', "\"c\" (java.lang.Character)"),
            Arguments.of(true, "\"true\" (java.lang.Boolean)"),
            Arguments.of(new ArrayList<>(List.of(1, 2)), "\"[1, 2]\" (java.util.ArrayList)"),
            Arguments.of(new Point(1, 2),
                "\"Point[x=1, y=2]\" (io.github.simbo1905.tryharness.ValueRendererTest$Point)"),
            Arguments.of(Colour.RED, "\"RED\" (io.github.simbo1905.tryharness.ValueRendererTest$Colour)"),
            Arguments.of(new int[]{1, 2, 3}, "\"[1, 2, 3]\" ([I)"),
            Arguments.of(new String[][]{{"a"}, {"b", null}}, "\"[[a], [b, null]]\" ([[Ljava.lang.String;)")
        );
    }

    @ParameterizedTest
    @MethodSource("printableValues")
    void printableValueRendersItsOwnText(Object value, String expected) {
        assertThat(qualified.render(value)).isEqualTo(expected);
    }

    @Test
    void objectWithoutToStringCannotBePrinted() {
        assertThat(qualified.render(new Opaque()))
            .isEqualTo("[Can't print] (io.github.simbo1905.tryharness.ValueRendererTest$Opaque)");
        assertThat(qualified.render(new Object())).isEqualTo("[Can't print] (java.lang.Object)");
    }

    @Test
    void lambdaCannotBePrinted() {
        final Supplier<String> supplier = () -> "x";
        assertThat(qualified.render(supplier))
            .startsWith("[Can't print] (")
            .contains("ValueRendererTest");
    }

    @Test
    @DisplayName("null renders as nullptr whatever the declared type")
    void nullRendersAsNullptr() {
        final String nothing = null;
        assertThat(qualified.render(nothing)).isEqualTo("\"nullptr\" (nullptr_t)");
        assertThat(simple.render(null)).isEqualTo("\"nullptr\" (nullptr_t)");
    }

    @Test
    void throwingToStringFallsBackToCantPrint() {
        assertThatCode(() -> qualified.render(new Exploding())).doesNotThrowAnyException();
        assertThat(qualified.render(new Exploding()))
            .isEqualTo("[Can't print] (io.github.simbo1905.tryharness.ValueRendererTest$Exploding)");
        assertThat(qualified.render(new Recursive()))
            .isEqualTo("[Can't print] (io.github.simbo1905.tryharness.ValueRendererTest$Recursive)");
    }

    @Test
    void errorFromToStringFallsBackToCantPrint() {
        final var value = new FailingAssertion();
        assertThatCode(() -> qualified.render(value)).doesNotThrowAnyException();
        assertThat(qualified.render(value))
            .isEqualTo("[Can't print] (io.github.simbo1905.tryharness.ValueRendererTest$FailingAssertion)");
    }

    @Test
    void simpleTypeNames() {
        assertThat(simple.render(4)).isEqualTo("\"4\" (Integer)");
        assertThat(simple.render(new Point(0, 0))).isEqualTo("\"Point[x=0, y=0]\" (Point)");
        assertThat(simple.render(new Opaque())).isEqualTo("[Can't print] (Opaque)");
        assertThat(simple.render(new long[]{7L})).isEqualTo("\"[7]\" (long[])");
    }

    @Test
    void printabilityProbe() {
        assertThat(ValueRenderer.isPrintable(String.class)).isTrue();
        assertThat(ValueRenderer.isPrintable(Point.class)).isTrue();
        assertThat(ValueRenderer.isPrintable(byte[].class)).isTrue();
        assertThat(ValueRenderer.isPrintable(Object.class)).isFalse();
        assertThat(ValueRenderer.isPrintable(Opaque.class)).isFalse();
    }

    @ParameterizedTest
    @MethodSource("typeNameProperties")
    void typeNamesPropertyParsing(String propertyValue, ValueRenderer.TypeNames expected) {
        assertThat(ValueRenderer.parseTypeNames(propertyValue)).isEqualTo(expected);
    }

    static Stream<Arguments> typeNameProperties() {
        return Stream.of(
            Arguments.of("simple", ValueRenderer.TypeNames.SIMPLE),
            Arguments.of(" Simple ", ValueRenderer.TypeNames.SIMPLE),
            Arguments.of("QUALIFIED", ValueRenderer.TypeNames.QUALIFIED),
            Arguments.of(null, ValueRenderer.TypeNames.QUALIFIED),
            Arguments.of("bogus", ValueRenderer.TypeNames.QUALIFIED),
            Arguments.of("", ValueRenderer.TypeNames.QUALIFIED)
        );
    }

    @Test
    void unrecognisedTypeNamesLogAWarning() {
        final Logger logger = Logger.getLogger(ValueRenderer.class.getName());
        final List<LogRecord> records = new ArrayList<>();
        final Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        logger.addHandler(handler);
        try {
            ValueRenderer.parseTypeNames("bogus");
        } finally {
            logger.removeHandler(handler);
        }
        assertThat(records)
            .anySatisfy(r -> {
                assertThat(r.getLevel()).isEqualTo(Level.WARNING);
                assertThat(r.getMessage()).contains("bogus").contains("QUALIFIED");
            });
    }
}

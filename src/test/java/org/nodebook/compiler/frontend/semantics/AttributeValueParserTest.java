package org.nodebook.compiler.frontend.semantics;

import org.nodebook.compiler.frontend.semantics.AttributeValueParser.Parsed;
import org.nodebook.compiler.frontend.semantics.AttributeValueParser.Rejected;
import org.nodebook.schema.AttributeType;
import org.nodebook.schema.ValueType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class AttributeValueParserTest {

    @Test
    void integerLiteralIsParsed() {
        assertThat(AttributeValueParser.parse(ValueType.INTEGER, "5"))
                .isInstanceOfSatisfying(Parsed.class, p -> {
                    assertThat(p.value()).isEqualTo(new TypedValue.IntegerValue("5", BigInteger.valueOf(5)));
                    assertThat(p.value().asNumber()).hasValue(5.0);
                });
    }

    @Test
    void wordIsNotAnInteger() {
        assertThat(AttributeValueParser.parse(ValueType.INTEGER, "five"))
                .isInstanceOfSatisfying(Rejected.class,
                        r -> assertThat(r.reason()).isEqualTo("'five' is not an integer"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"NaN", "Infinity", "0x1p3", "1e999", "abc", "1.2.3"})
    void floatRejectsNonDecimalNotation(String literal) {
        assertThat(AttributeValueParser.parse(ValueType.FLOAT, literal)).isInstanceOf(Rejected.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"3.5", "-2", ".5", "1e3", "+7.25"})
    void floatAcceptsDecimalNotation(String literal) {
        assertThat(AttributeValueParser.parse(ValueType.FLOAT, literal)).isInstanceOf(Parsed.class);
    }

    @Test
    void dateMustBeIsoCalendarDate() {
        assertThat(AttributeValueParser.parse(ValueType.DATE, "2024-02-29"))
                .isInstanceOfSatisfying(Parsed.class,
                        p -> assertThat(p.value()).isEqualTo(new TypedValue.DateValue("2024-02-29",
                                LocalDate.of(2024, 2, 29))));
        assertThat(AttributeValueParser.parse(ValueType.DATE, "2023-02-29")).isInstanceOf(Rejected.class);
        assertThat(AttributeValueParser.parse(ValueType.DATE, "29.02.2024")).isInstanceOf(Rejected.class);
    }

    @Test
    void booleanIsStrict() {
        assertThat(AttributeValueParser.parse(ValueType.BOOLEAN, "true")).isInstanceOf(Parsed.class);
        assertThat(AttributeValueParser.parse(ValueType.BOOLEAN, "yes")).isInstanceOf(Rejected.class);
    }

    @Test
    void stringAcceptsAnything() {
        assertThat(AttributeValueParser.parse(ValueType.STRING, "golden brown"))
                .isInstanceOfSatisfying(Parsed.class, p -> assertThat(p.value().asNumber()).isEmpty());
    }

    @Test
    void allowedValuesRestrictParsedLiterals() {
        AttributeType color = new AttributeType("color", ValueType.STRING, List.of(), "", null,
                List.of("red", "green"));

        assertThat(AttributeValueParser.parse(color, "red")).isInstanceOf(Parsed.class);
        assertThat(AttributeValueParser.parse(color, "blue"))
                .isInstanceOfSatisfying(Rejected.class, r -> assertThat(r.reason()).contains("[red, green]"));
    }
}

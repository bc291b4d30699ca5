package org.nodebook.compiler.frontend.semantics;

import org.nodebook.schema.ValueType;

import java.math.BigInteger;
import java.time.LocalDate;
import java.util.OptionalDouble;

/**
 * A successfully parsed attribute value. Every variant keeps the literal it was
 * parsed from, which is what the graph stores.
 */
public sealed interface TypedValue {

    String literal();

    ValueType type();

    /**
     * @return The numeric value for use in derived attribute expressions; empty for
     * non-numeric types.
     */
    default OptionalDouble asNumber() {
        return OptionalDouble.empty();
    }

    record StringValue(String literal) implements TypedValue {
        @Override
        public ValueType type() {
            return ValueType.STRING;
        }
    }

    record IntegerValue(String literal, BigInteger value) implements TypedValue {
        @Override
        public ValueType type() {
            return ValueType.INTEGER;
        }

        @Override
        public OptionalDouble asNumber() {
            return OptionalDouble.of(value.doubleValue());
        }
    }

    record FloatValue(String literal, double value) implements TypedValue {
        @Override
        public ValueType type() {
            return ValueType.FLOAT;
        }

        @Override
        public OptionalDouble asNumber() {
            return OptionalDouble.of(value);
        }
    }

    record DateValue(String literal, LocalDate value) implements TypedValue {
        @Override
        public ValueType type() {
            return ValueType.DATE;
        }
    }

    record BooleanValue(String literal, boolean value) implements TypedValue {
        @Override
        public ValueType type() {
            return ValueType.BOOLEAN;
        }
    }
}

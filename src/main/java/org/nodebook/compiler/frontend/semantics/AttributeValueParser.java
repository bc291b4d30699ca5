package org.nodebook.compiler.frontend.semantics;

import org.nodebook.schema.AttributeType;
import org.nodebook.schema.ValueType;

import java.math.BigInteger;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Parses attribute literals according to their declared value type. There is one
 * parsing function per value type and no fallback between them: a literal either
 * parses as its declared type or is rejected with a reason.
 */
public final class AttributeValueParser {

    private static final Pattern INTEGER = Pattern.compile("^-?\\d+$");
    private static final Pattern FLOAT = Pattern.compile("^[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?$");

    /**
     * Outcome of parsing a literal.
     */
    public sealed interface Result permits Parsed, Rejected {
    }

    public record Parsed(TypedValue value) implements Result {
    }

    public record Rejected(String reason) implements Result {
    }

    private AttributeValueParser() {
    }

    /**
     * Parses a literal for the given attribute type, including the allowed-values check.
     *
     * @param type    The attribute type.
     * @param literal The literal as declared, modifiers already removed.
     * @return {@link Parsed} or {@link Rejected}.
     */
    public static Result parse(AttributeType type, String literal) {
        Result result = parse(type.valueType(), literal);
        if (result instanceof Parsed && !type.allowedValues().isEmpty()
                && !type.allowedValues().contains(literal)) {
            return new Rejected("'" + literal + "' is not one of " + type.allowedValues());
        }
        return result;
    }

    public static Result parse(ValueType valueType, String literal) {
        return switch (valueType) {
            case INTEGER -> parseInteger(literal);
            case FLOAT -> parseFloat(literal);
            case DATE -> parseDate(literal);
            case BOOLEAN -> parseBoolean(literal);
            case STRING -> new Parsed(new TypedValue.StringValue(literal));
        };
    }

    static Result parseInteger(String literal) {
        if (!INTEGER.matcher(literal).matches()) {
            return new Rejected("'" + literal + "' is not an integer");
        }
        return new Parsed(new TypedValue.IntegerValue(literal, new BigInteger(literal)));
    }

    static Result parseFloat(String literal) {
        // Double.parseDouble alone would accept "NaN", "Infinity" and hex floats
        if (!FLOAT.matcher(literal).matches()) {
            return new Rejected("'" + literal + "' is not a number");
        }
        double value = Double.parseDouble(literal);
        if (!Double.isFinite(value)) {
            return new Rejected("'" + literal + "' is out of range");
        }
        return new Parsed(new TypedValue.FloatValue(literal, value));
    }

    static Result parseDate(String literal) {
        try {
            return new Parsed(new TypedValue.DateValue(literal, LocalDate.parse(literal)));
        } catch (DateTimeParseException e) {
            return new Rejected("'" + literal + "' is not a calendar date (expected yyyy-MM-dd)");
        }
    }

    static Result parseBoolean(String literal) {
        if ("true".equals(literal)) return new Parsed(new TypedValue.BooleanValue(literal, true));
        if ("false".equals(literal)) return new Parsed(new TypedValue.BooleanValue(literal, false));
        return new Rejected("'" + literal + "' is not a boolean (expected true or false)");
    }
}

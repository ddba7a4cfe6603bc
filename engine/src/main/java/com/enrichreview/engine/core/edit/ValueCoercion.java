package com.enrichreview.engine.core.edit;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Turns the text a reviewer typed back into a JSON value, keeping the type the
 * field had before the edit where the text allows it. Text that does not parse
 * is stored as a string.
 */
public final class ValueCoercion {
    private ValueCoercion() {}

    private static final Pattern INTEGRAL = Pattern.compile("[-+]?\\d+");
    private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
    private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);

    public static JsonNode coerce(JsonNode preEdit, String text) {
        String raw = (text == null) ? "" : text;
        if (preEdit == null) return TextNode.valueOf(raw);

        return switch (preEdit.getNodeType()) {
            case NUMBER -> parseNumber(raw).orElseGet(() -> TextNode.valueOf(raw));
            case BOOLEAN -> {
                if ("true".equalsIgnoreCase(raw)) yield BooleanNode.TRUE;
                if ("false".equalsIgnoreCase(raw)) yield BooleanNode.FALSE;
                yield TextNode.valueOf(raw);
            }
            case NULL -> "null".equalsIgnoreCase(raw) ? NullNode.getInstance() : TextNode.valueOf(raw);
            case ARRAY, BINARY, MISSING, OBJECT, POJO, STRING -> TextNode.valueOf(raw);
        };
    }

    /** What the edit box starts with: strings unquoted, everything else as JSON text. */
    public static String displayText(JsonNode value) {
        if (value == null || value.isMissingNode()) return "";
        if (value.isValueNode()) return value.asText();
        return value.toString();
    }

    static Optional<JsonNode> parseNumber(String text) {
        String t = text.trim();
        if (t.isEmpty()) return Optional.empty();

        if (INTEGRAL.matcher(t).matches()) {
            BigInteger big = new BigInteger(t);
            if (big.compareTo(INT_MIN) >= 0 && big.compareTo(INT_MAX) <= 0) {
                return Optional.of(JsonNodeFactory.instance.numberNode(big.intValue()));
            }
            if (big.bitLength() < 64) {
                return Optional.of(JsonNodeFactory.instance.numberNode(big.longValue()));
            }
            return Optional.of(JsonNodeFactory.instance.numberNode(big));
        }

        try {
            double d = new BigDecimal(t).doubleValue();
            if (Double.isInfinite(d)) return Optional.empty();
            return Optional.of(JsonNodeFactory.instance.numberNode(d));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}

package io.streamqueue.util;

import io.streamqueue.CorruptMessageException;
import io.streamqueue.EventMessage;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lightweight UTF-8 JSON codec for {@link EventMessage}s. Has no external dependencies.
 *
 * <p>A message is written as {@code {"event":"...","payload":...}}. Payloads may nest maps
 * with string keys, collections, strings, numbers, booleans and {@code null}. Decoding
 * produces canonical Java types so that round-trips compare equal:
 * <ul>
 *   <li>objects become insertion-ordered {@code Map<String, Object>}</li>
 *   <li>arrays become {@code List<Object>}</li>
 *   <li>integral numbers become {@link Integer} when they fit, else {@link Long},
 *       else {@link BigInteger}</li>
 *   <li>numbers with a fraction or exponent become {@link Double}</li>
 * </ul>
 *
 * <p>This is the default {@link MessageCodec}, accessible via {@link MessageCodec#getDefault()}.
 */
public final class JsonMessageCodec implements MessageCodec {
    static final JsonMessageCodec INSTANCE = new JsonMessageCodec();

    private static final int MAX_DEPTH = 512;

    JsonMessageCodec() {
    }

    @Override
    public byte[] encode(EventMessage message) {
        StringBuilder sb = new StringBuilder(64);
        sb.append("{\"event\":");
        writeString(sb, message.event());
        sb.append(",\"payload\":");
        writeValue(sb, message.payload(), 0);
        sb.append('}');
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public EventMessage decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new CorruptMessageException("Empty message");
        }
        String json;
        try {
            json = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new CorruptMessageException("Message is not valid UTF-8", e);
        }
        Parser parser = new Parser(json);
        Object root = parser.parseDocument();
        if (!(root instanceof Map<?, ?> map)) {
            throw new CorruptMessageException("Expected JSON object at top level");
        }
        if (!(map.get("event") instanceof String event)) {
            throw new CorruptMessageException("Missing string field 'event'");
        }
        return new EventMessage(event, map.get("payload"));
    }

    private static void writeValue(StringBuilder sb, Object value, int depth) {
        if (depth > MAX_DEPTH) {
            throw new IllegalArgumentException("Payload nesting exceeds " + MAX_DEPTH + " levels");
        }
        if (value == null) {
            sb.append("null");
        } else if (value instanceof String s) {
            writeString(sb, s);
        } else if (value instanceof Boolean b) {
            sb.append(b.booleanValue());
        } else if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("JSON cannot represent " + d);
            }
            sb.append(Double.toString(d));
        } else if (value instanceof Number n) {
            sb.append(n);
        } else if (value instanceof Map<?, ?> map) {
            sb.append('{');
            boolean first = true;
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException("Payload map keys must be strings: " + entry.getKey());
                }
                if (!first) {
                    sb.append(',');
                }
                first = false;
                writeString(sb, key);
                sb.append(':');
                writeValue(sb, entry.getValue(), depth + 1);
            }
            sb.append('}');
        } else if (value instanceof Collection<?> items) {
            sb.append('[');
            boolean first = true;
            for (Object item : items) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                writeValue(sb, item, depth + 1);
            }
            sb.append(']');
        } else {
            throw new IllegalArgumentException("Unsupported payload type: " + value.getClass().getName());
        }
    }

    private static void writeString(StringBuilder sb, String value) {
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\b':
                    sb.append("\\b");
                    break;
                case '\f':
                    sb.append("\\f");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    // surrogates are escaped so a lone half survives the UTF-8 round-trip
                    if (c < 0x20 || Character.isSurrogate(c)) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        sb.append('"');
    }

    private static final class Parser {
        private final String input;
        private int idx;

        private Parser(String input) {
            this.input = input;
        }

        Object parseDocument() {
            Object value = parseValue(0);
            skipWhitespace();
            if (idx != input.length()) {
                throw corrupt("Trailing characters after JSON value");
            }
            return value;
        }

        private Object parseValue(int depth) {
            if (depth > MAX_DEPTH) {
                throw corrupt("JSON nesting exceeds " + MAX_DEPTH + " levels");
            }
            skipWhitespace();
            if (idx >= input.length()) {
                throw corrupt("Unexpected end of input");
            }
            char ch = input.charAt(idx);
            switch (ch) {
                case '{':
                    return parseObject(depth);
                case '[':
                    return parseArray(depth);
                case '"':
                    idx++;
                    return parseString();
                case 't':
                    expectLiteral("true");
                    return Boolean.TRUE;
                case 'f':
                    expectLiteral("false");
                    return Boolean.FALSE;
                case 'n':
                    expectLiteral("null");
                    return null;
                default:
                    if (ch == '-' || (ch >= '0' && ch <= '9')) {
                        return parseNumber();
                    }
                    throw corrupt("Unexpected character '" + ch + "'");
            }
        }

        private Map<String, Object> parseObject(int depth) {
            idx++;
            Map<String, Object> result = new LinkedHashMap<>();
            skipWhitespace();
            if (peek() == '}') {
                idx++;
                return result;
            }
            while (true) {
                skipWhitespace();
                if (peek() != '"') {
                    throw corrupt("Expected string key");
                }
                idx++;
                String key = parseString();
                skipWhitespace();
                if (peek() != ':') {
                    throw corrupt("Expected ':' after key");
                }
                idx++;
                result.put(key, parseValue(depth + 1));
                skipWhitespace();
                char next = peek();
                idx++;
                if (next == ',') {
                    continue;
                }
                if (next == '}') {
                    return result;
                }
                throw corrupt("Expected ',' or '}'");
            }
        }

        private List<Object> parseArray(int depth) {
            idx++;
            List<Object> result = new ArrayList<>();
            skipWhitespace();
            if (peek() == ']') {
                idx++;
                return result;
            }
            while (true) {
                result.add(parseValue(depth + 1));
                skipWhitespace();
                char next = peek();
                idx++;
                if (next == ',') {
                    continue;
                }
                if (next == ']') {
                    return result;
                }
                throw corrupt("Expected ',' or ']'");
            }
        }

        private String parseString() {
            StringBuilder sb = new StringBuilder();
            while (idx < input.length()) {
                char c = input.charAt(idx);
                if (c == '"') {
                    idx++;
                    return sb.toString();
                }
                if (c < 0x20) {
                    throw corrupt("Unescaped control character in string");
                }
                if (c != '\\') {
                    sb.append(c);
                    idx++;
                    continue;
                }
                if (idx + 1 >= input.length()) {
                    throw corrupt("Invalid escape sequence");
                }
                char next = input.charAt(idx + 1);
                switch (next) {
                    case '"':
                    case '\\':
                    case '/':
                        sb.append(next);
                        break;
                    case 'b':
                        sb.append('\b');
                        break;
                    case 'f':
                        sb.append('\f');
                        break;
                    case 'n':
                        sb.append('\n');
                        break;
                    case 'r':
                        sb.append('\r');
                        break;
                    case 't':
                        sb.append('\t');
                        break;
                    case 'u':
                        if (idx + 5 >= input.length()) {
                            throw corrupt("Invalid unicode escape");
                        }
                        try {
                            sb.append((char) Integer.parseInt(input.substring(idx + 2, idx + 6), 16));
                        } catch (NumberFormatException ex) {
                            throw new CorruptMessageException("Invalid unicode escape", ex);
                        }
                        idx += 4;
                        break;
                    default:
                        throw corrupt("Unsupported escape sequence: \\" + next);
                }
                idx += 2;
            }
            throw corrupt("Unterminated string");
        }

        private Number parseNumber() {
            int start = idx;
            boolean integral = true;
            if (peek() == '-') {
                idx++;
            }
            if (peek() == '0') {
                idx++;
            } else if (isDigit(peek())) {
                skipDigits();
            } else {
                throw corrupt("Invalid number");
            }
            if (peek() == '.') {
                integral = false;
                idx++;
                if (!isDigit(peek())) {
                    throw corrupt("Expected digit after decimal point");
                }
                skipDigits();
            }
            if (peek() == 'e' || peek() == 'E') {
                integral = false;
                idx++;
                if (peek() == '+' || peek() == '-') {
                    idx++;
                }
                if (!isDigit(peek())) {
                    throw corrupt("Expected digit in exponent");
                }
                skipDigits();
            }
            String text = input.substring(start, idx);
            if (!integral) {
                return Double.parseDouble(text);
            }
            BigInteger big = new BigInteger(text);
            if (big.bitLength() < Integer.SIZE) {
                return big.intValue();
            }
            if (big.bitLength() < Long.SIZE) {
                return big.longValue();
            }
            return big;
        }

        private void expectLiteral(String literal) {
            if (!input.startsWith(literal, idx)) {
                throw corrupt("Expected '" + literal + "'");
            }
            idx += literal.length();
        }

        private void skipDigits() {
            while (isDigit(peek())) {
                idx++;
            }
        }

        private void skipWhitespace() {
            while (idx < input.length()) {
                char c = input.charAt(idx);
                if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
                    break;
                }
                idx++;
            }
        }

        private char peek() {
            return idx < input.length() ? input.charAt(idx) : '\0';
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        private CorruptMessageException corrupt(String message) {
            return new CorruptMessageException(message + " at offset " + idx);
        }
    }
}

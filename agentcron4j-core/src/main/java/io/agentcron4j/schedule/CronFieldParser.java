package io.agentcron4j.schedule;

import io.agentcron4j.core.InvalidScheduleException;

import java.util.BitSet;

/**
 * Recursive-descent parser for a single cron field.
 *
 * <pre>
 * field := item (',' item)*
 * item  := range ('/' step)?
 * range := '*' | value ('-' value)?
 * value := number | name
 * </pre>
 *
 * A stepped single value ({@code 5/15}) runs from the value to the end of the range.
 */
final class CronFieldParser {

    private static final int MAX_DIGITS = 4;

    private final CronFieldType type;
    private final String text;
    private int pos;

    private CronFieldParser(CronFieldType type, String text) {
        this.type = type;
        this.text = text;
    }

    static CronField parse(CronFieldType type, String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidScheduleException("Empty " + type.label() + " field");
        }
        return new CronFieldParser(type, text.trim()).field();
    }

    private CronField field() {
        BitSet values = new BitSet(type.max() + 1);
        item(values);
        while (accept(',')) {
            item(values);
        }
        if (pos < text.length()) {
            throw error("unexpected character '" + text.charAt(pos) + "'");
        }
        return new CronField(type, values, text);
    }

    private void item(BitSet values) {
        int start;
        int end;
        boolean ranged;
        if (accept('*')) {
            start = type.min();
            end = type.max();
            ranged = true;
        } else {
            start = value();
            if (accept('-')) {
                end = value();
                if (end < start) {
                    throw error("range " + start + "-" + end + " is reversed");
                }
                ranged = true;
            } else {
                end = start;
                ranged = false;
            }
        }

        int step = 1;
        if (accept('/')) {
            step = number();
            if (step <= 0) {
                throw error("step must be positive");
            }
            if (!ranged) {
                end = type.max();
            }
        }

        for (int v = start; v <= end; v += step) {
            values.set(v);
        }
    }

    private int value() {
        if (pos >= text.length()) {
            throw error("expected a value");
        }
        char c = text.charAt(pos);
        int v;
        if (Character.isDigit(c)) {
            v = number();
        } else if (Character.isLetter(c) && type.hasNames()) {
            int begin = pos;
            while (pos < text.length() && Character.isLetter(text.charAt(pos))) {
                pos++;
            }
            String token = text.substring(begin, pos);
            v = type.valueOfName(token);
            if (v < 0) {
                throw error("unknown name '" + token + "'");
            }
        } else {
            throw error("expected a value but found '" + c + "'");
        }
        if (v < type.min() || v > type.max()) {
            throw error("value " + v + " out of range " + type.min() + "-" + type.max());
        }
        return v;
    }

    private int number() {
        int begin = pos;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
        if (begin == pos) {
            throw error("expected a number");
        }
        if (pos - begin > MAX_DIGITS) {
            throw error("number too large");
        }
        return Integer.parseInt(text.substring(begin, pos));
    }

    private boolean accept(char c) {
        if (pos < text.length() && text.charAt(pos) == c) {
            pos++;
            return true;
        }
        return false;
    }

    private InvalidScheduleException error(String detail) {
        return new InvalidScheduleException(
                "Invalid " + type.label() + " field '" + text + "': " + detail);
    }
}

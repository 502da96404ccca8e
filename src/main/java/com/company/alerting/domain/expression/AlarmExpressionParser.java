package com.company.alerting.domain.expression;

import com.company.alerting.domain.enums.AlarmState;
import com.company.alerting.exception.MalformedExpressionException;

/**
 * Parses composite alarm rules such as
 * {@code ALARM("cpu-high") AND (ALARM(disk-full) OR NOT OK("status-check"))}.
 *
 * <p>Precedence: NOT binds tighter than AND, AND tighter than OR. Keywords are case-insensitive.
 * Alarm ids may be quoted; unquoted ids may contain letters, digits and {@code _ - . : /}.
 */
public final class AlarmExpressionParser {

    private final String text;
    private int pos;

    private AlarmExpressionParser(String text) {
        this.text = text;
    }

    public static AlarmExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new MalformedExpressionException(String.valueOf(expression), 0, "empty expression");
        }
        AlarmExpressionParser parser = new AlarmExpressionParser(expression);
        AlarmExpression result = parser.parseOr();
        parser.skipWhitespace();
        if (parser.pos < expression.length()) {
            throw parser.error("unexpected trailing input");
        }
        return result;
    }

    private AlarmExpression parseOr() {
        AlarmExpression left = parseAnd();
        while (acceptKeyword("OR")) {
            left = new Or(left, parseAnd());
        }
        return left;
    }

    private AlarmExpression parseAnd() {
        AlarmExpression left = parseNot();
        while (acceptKeyword("AND")) {
            left = new And(left, parseNot());
        }
        return left;
    }

    private AlarmExpression parseNot() {
        if (acceptKeyword("NOT")) {
            return new Not(parseNot());
        }
        return parsePrimary();
    }

    private AlarmExpression parsePrimary() {
        skipWhitespace();
        if (accept('(')) {
            AlarmExpression inner = parseOr();
            expect(')');
            return inner;
        }

        AlarmState state;
        if (acceptKeyword("INSUFFICIENT_DATA")) {
            state = AlarmState.INSUFFICIENT_DATA;
        } else if (acceptKeyword("ALARM")) {
            state = AlarmState.ALARM;
        } else if (acceptKeyword("OK")) {
            state = AlarmState.OK;
        } else {
            throw error("expected ALARM, OK, INSUFFICIENT_DATA, NOT or '('");
        }

        expect('(');
        String alarmId = parseAlarmId();
        expect(')');
        return new AlarmRef(alarmId, state);
    }

    private String parseAlarmId() {
        skipWhitespace();
        if (accept('"')) {
            int start = pos;
            while (pos < text.length() && text.charAt(pos) != '"') {
                pos++;
            }
            if (pos >= text.length()) {
                throw error("unterminated quoted alarm id");
            }
            String id = text.substring(start, pos);
            pos++;
            if (id.isBlank()) {
                throw error("empty alarm id");
            }
            return id;
        }

        int start = pos;
        while (pos < text.length() && isIdChar(text.charAt(pos))) {
            pos++;
        }
        if (start == pos) {
            throw error("expected alarm id");
        }
        return text.substring(start, pos);
    }

    private boolean acceptKeyword(String keyword) {
        skipWhitespace();
        int end = pos + keyword.length();
        if (end > text.length() || !text.regionMatches(true, pos, keyword, 0, keyword.length())) {
            return false;
        }
        // Keyword must not be the prefix of a longer identifier (e.g. ORDERS)
        if (end < text.length() && (Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '_')) {
            return false;
        }
        pos = end;
        return true;
    }

    private boolean accept(char c) {
        skipWhitespace();
        if (pos < text.length() && text.charAt(pos) == c) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(char c) {
        if (!accept(c)) {
            throw error("expected '" + c + "'");
        }
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isIdChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' || c == ':' || c == '/';
    }

    private MalformedExpressionException error(String reason) {
        return new MalformedExpressionException(text, pos, reason);
    }
}

package scheme;

import java.util.*;
import java.util.function.IntPredicate;

import static java.lang.String.format;
import static java.util.Collections.unmodifiableList;
import static scheme.Scheme.*;

// Backtracking recursive descent reader, every alternative restores pos when it fails.
public class SchemeReader {
    static final String symbolChars = "!#$%&|*+-/:<=>?@^_~";
    static final Map<String, Character> characterNames = new LinkedHashMap<>();
    static {
        characterNames.put("altmode", '\u001B');
        characterNames.put("backnext", '\u001F');
        characterNames.put("backspace", '\b');
        characterNames.put("call", '\u001A');
        characterNames.put("linefeed", '\n');
        characterNames.put("newline", '\n');
        characterNames.put("page", '\f');
        characterNames.put("return", '\r');
        characterNames.put("rubout", '\u007F');
        characterNames.put("tab", '\t');
        characterNames.put("space", ' ');
    }

    final String input;
    int pos;
    int furthest = -1;
    String unexpected;
    final Set<String> expected = new LinkedHashSet<>();

    SchemeReader(String input) {
        this.input = input;
    }

    public static Object parse(String text) throws ParseError {
        SchemeReader reader = new SchemeReader(text);
        reader.whitespace();
        Object x = reader.expr();
        if (x == null) throw reader.error();
        reader.whitespace();
        reader.end();
        return x;
    }

    public static List<Object> parseAll(String text) throws ParseError {
        SchemeReader reader = new SchemeReader(text);
        List<Object> forms = new ArrayList<>();
        reader.whitespace();
        while (!reader.atEnd()) {
            Object x = reader.expr();
            if (x == null) throw reader.error();
            forms.add(x);
            if (!reader.atEnd() && !reader.whitespace()) throw reader.error();
        }
        return forms;
    }

    public static Optional<Object> parseOptional(String text) throws ParseError {
        SchemeReader reader = new SchemeReader(text);
        reader.whitespace();
        if (reader.atEnd()) return Optional.empty();
        Object x = reader.expr();
        if (x == null) throw reader.error();
        reader.whitespace();
        reader.end();
        return Optional.of(x);
    }

    Object expr() throws ParseError {
        Object x;
        if ((x = string()) != null) return x;
        if ((x = character()) != null) return x;
        if ((x = number()) != null) return x;
        if ((x = atom()) != null) return x;
        if ((x = quoted()) != null) return x;
        return parenthesized();
    }

    Object string() throws ParseError {
        if (!ch('"', "string")) return null;
        int start = pos - 1;
        StringBuilder sb = new StringBuilder();
        while (!atEnd() && peek() != '"') {
            int c = next();
            if (c == '\\') {
                if (atEnd()) break;
                sb.append(escape(next()));
            } else sb.appendCodePoint(c);
        }
        if (!ch('"', "\"\\\"\"")) {
            pos = start;
            return null;
        }
        return sb.toString();
    }

    char escape(int c) throws ParseError {
        switch (c) {
            case '"': return '"';
            case '\\': return '\\';
            case 't': return '\t';
            case 'n': return '\n';
            case 'r': return '\r';
        }
        throw error(pos - 1 - Character.charCount(c), format("unknown escape sequence \"\\%s\"", new String(Character.toChars(c))));
    }

    Object character() throws ParseError {
        int start = pos;
        if (!ch('#', "character") || !ch('\\', "\"\\\\\"")) {
            pos = start;
            return null;
        }
        Character named = characterName();
        if (named != null) return named;
        if (atEnd()) {
            fail("any character");
            pos = start;
            return null;
        }
        if (!Character.isBmpCodePoint(peek()))
            throw error(pos, format("character U+%X is outside the Basic Multilingual Plane", peek()));
        return (char) next();
    }

    Character characterName() {
        int start = pos;
        while (!atEnd() && Character.isLetter(peek())) next();
        if (input.codePointCount(start, pos) < 2) {
            pos = start;
            return null;
        }
        String name = input.substring(start, pos).toLowerCase(Locale.ROOT);
        Character c = characterNames.get(name);
        if (c == null) {
            unexpected(format("character name '%s'", name));
            pos = start;
        }
        return c;
    }

    Object number() throws ParseError {
        int start = pos;
        if (ch('#', "number")) {
            int radix = radix();
            if (radix > 0) {
                Long n = digits(radix);
                if (n != null) return n;
            }
            pos = start;
            return null;
        }
        return digits(10);
    }

    int radix() {
        if (atEnd()) return fail("radix marker");
        switch (Character.toLowerCase(peek())) {
            case 'x': pos++; return 16;
            case 'o': pos++; return 8;
            case 'd': pos++; return 10;
            case 'b': pos++; return 2;
        }
        return fail("radix marker");
    }

    Long digits(int radix) throws ParseError {
        int start = pos;
        while (!atEnd() && Character.digit(peek(), radix) >= 0 && peek() < 0x80) pos++;
        if (pos == start) {
            fail(radix == 10 ? "digit" : format("base %d digit", radix));
            return null;
        }
        String digits = input.substring(start, pos);
        try {
            return Long.parseLong(digits, radix);
        } catch (NumberFormatException e) {
            throw error(start, format("integer literal %s out of range", digits));
        }
    }

    Object atom() {
        int start = pos;
        if (!satisfy(c -> Character.isLetter(c) || isSymbol(c), "letter or symbol")) return null;
        while (!atEnd() && (Character.isLetter(peek()) || isDigit(peek()) || isSymbol(peek()))) next();
        String atom = input.substring(start, pos);
        switch (atom) {
            case "#t": return true;
            case "#f": return false;
        }
        return intern(atom);
    }

    Object quoted() throws ParseError {
        int start = pos;
        if (!ch('\'', "quote")) return null;
        Object x = expr();
        if (x == null) {
            pos = start;
            return null;
        }
        return list(intern("quote"), x);
    }

    // Elements are read once; a " . " where the next element would start turns the list into a dotted list.
    Object parenthesized() throws ParseError {
        int start = pos;
        if (!ch('(', "\"(\"")) return null;
        whitespace();
        List<Object> xs = new ArrayList<>();
        Object x = expr();
        Object tail = null;
        if (x != null) {
            xs.add(x);
            while (true) {
                int separator = pos;
                if (!whitespace()) break;
                if ((x = expr()) != null) {
                    xs.add(x);
                    continue;
                }
                if (ch('.', "\".\"") && whitespace() && (tail = expr()) != null) break;
                pos = separator;
                break;
            }
        }
        if (!close()) {
            pos = start;
            return null;
        }
        return tail == null ? unmodifiableList(xs) : new DottedList(xs, tail);
    }

    boolean close() {
        whitespace();
        return ch(')', "\")\"");
    }

    // One or more whitespace characters or ; comments.
    boolean whitespace() {
        int start = pos;
        while (!atEnd()) {
            if (Character.isWhitespace(peek())) pos++;
            else if (peek() == ';')
                while (!atEnd() && peek() != '\n') pos++;
            else break;
        }
        if (pos == start) fail("whitespace");
        return pos > start;
    }

    void end() throws ParseError {
        if (!atEnd()) {
            fail("end of input");
            throw error();
        }
    }

    static boolean isSymbol(int c) {
        return symbolChars.indexOf(c) >= 0;
    }

    static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    boolean atEnd() {
        return pos >= input.length();
    }

    int peek() {
        return input.codePointAt(pos);
    }

    int next() {
        int c = peek();
        pos += Character.charCount(c);
        return c;
    }

    boolean ch(char c, String expected) {
        return satisfy(x -> x == c, expected);
    }

    boolean satisfy(IntPredicate p, String expected) {
        if (!atEnd() && p.test(peek())) {
            next();
            return true;
        }
        fail(expected);
        return false;
    }

    int fail(String what) {
        if (pos > furthest) {
            furthest = pos;
            unexpected = null;
            expected.clear();
        }
        if (pos == furthest) expected.add(what);
        return 0;
    }

    void unexpected(String what) {
        int at = pos;
        if (at > furthest) {
            furthest = at;
            expected.clear();
        }
        if (at == furthest) unexpected = what;
    }

    ParseError error() {
        int at = Math.max(furthest, 0);
        String message = unexpected != null ? "unexpected " + unexpected
                : at < input.length() ? "unexpected '" + describe(input.codePointAt(at)) + "'"
                : "unexpected end of input";
        if (!expected.isEmpty()) message += "; expecting " + String.join(", ", expected);
        return error(at, message);
    }

    static String describe(int c) {
        return Character.isBmpCodePoint(c) ? show((char) c).substring(2) : new String(Character.toChars(c));
    }

    ParseError error(int at, String message) {
        int line = 1, column = 1;
        for (int i = 0; i < at && i < input.length(); i++)
            if (input.charAt(i) == '\n') {
                line++;
                column = 1;
            } else if (!Character.isLowSurrogate(input.charAt(i))) column++;
        return new ParseError(message, line, column);
    }
}

package json.java17.toon;

import json.java17.JsonArray;
import json.java17.JsonBoolean;
import json.java17.JsonNull;
import json.java17.JsonNumber;
import json.java17.JsonObject;
import json.java17.JsonString;
import json.java17.JsonValue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Recursive descent parser from document text to a tree.
///
/// Grammar, where `D` is the document delimiter:
/// ```
/// document := scalar | object | array
/// object   := (key (':' scalar | ':' NEWLINE INDENT object | header body))+
/// header   := key? '[' length D? ']' ('{' key (D key)* '}')? ':'
/// body     := row | NEWLINE INDENT row+ | NEWLINE INDENT ('-' item NEWLINE)+
/// row      := scalar (D scalar)*
/// length   := DIGIT+ | MARKER DIGIT+
/// ```
/// Nesting follows indentation: an object's entries share one indentation,
/// and array bodies sit deeper than the line that owns the header.
///
/// The first header fixes the delimiter for the rest of the document unless
/// {@link DecodeOptions#delimiter()} pins it.
final class ToonParser {

    private static final Logger LOG = Logger.getLogger(ToonParser.class.getName());

    private final ToonScanner scanner;
    private final DecodeOptions options;
    private final int indentUnit;
    private Delimiter delimiter;

    private Token cur;
    private int curLine;
    private int curColumn;
    private int curIndent;
    private int curGap;

    private record Mark(ToonScanner.State state, Token token, int line, int column, int indent, int gap) {
    }

    private record Header(int length, List<String> fields) {
    }

    private record Length(int value, Delimiter declared) {
    }

    private ToonParser(String input, DecodeOptions options) {
        this.options = options;
        this.delimiter = options.delimiter();
        this.scanner = new ToonScanner(input, delimiter);
        this.indentUnit = indentUnit(input);
    }

    /// Parses `input` into a tree.
    /// @throws ToonException on the first violation; nothing is returned partially
    static JsonValue parse(String input, DecodeOptions options) {
        final ToonParser parser = new ToonParser(input, options);
        LOG.finer(() -> "Indent unit " + parser.indentUnit + ", delimiter "
                + (parser.delimiter == null ? "auto" : parser.delimiter));
        parser.advance();
        return parser.parseDocument();
    }

    // ========== Document structure ==========

    private JsonValue parseDocument() {
        skipNewlines();
        if (cur.is(TokenKind.EOF)) {
            return JsonObject.of(Map.of());
        }
        final JsonValue result;
        if (cur.is(TokenKind.LEFT_BRACKET)) {
            result = parseArray(curIndent, 1);
        } else if (startsKeyedEntry()) {
            result = parseObject(curIndent, 1);
        } else {
            result = scalarValue(readRequired(true, "value"));
            expectLineEnd();
        }
        skipNewlines();
        if (!cur.is(TokenKind.EOF)) {
            throw error("Unexpected " + cur.describe() + " after the root value");
        }
        return result;
    }

    /// Entries at exactly `indent`; any other indentation ends the object.
    private JsonObject parseObject(int indent, int depth) {
        Validation.validateDepth(depth);
        final Map<String, JsonValue> members = new LinkedHashMap<>();
        while (true) {
            skipNewlines();
            if (cur.is(TokenKind.EOF) || curIndent != indent) {
                break;
            }
            parseEntry(members, indent, depth);
        }
        return JsonObject.of(members);
    }

    /// Parses one `key: ...` or `key[...]` entry of an object at `depth` whose
    /// entries sit at `ownerIndent`.
    private void parseEntry(Map<String, JsonValue> members, int ownerIndent, int depth) {
        if (!cur.kind().isScalar()) {
            throw error("Expected key but found " + cur.describe());
        }
        final String key = join(readRun(false));
        final JsonValue value;
        if (cur.is(TokenKind.LEFT_BRACKET)) {
            value = parseArray(ownerIndent, depth + 1);
        } else {
            expect(TokenKind.COLON, "':' after key \"" + key + "\"");
            if (atLineEnd()) {
                skipNewlines();
                if (!cur.is(TokenKind.EOF) && curIndent > ownerIndent) {
                    value = parseObject(curIndent, depth + 1);
                } else {
                    Validation.validateDepth(depth + 1);
                    value = JsonObject.of(Map.of());
                }
            } else {
                value = scalarValue(readRequired(true, "value"));
                expectLineEnd();
            }
        }
        // a repeated key keeps its first position and takes the last value
        members.put(key, value);
    }

    /// Parses a header and its body. Bodies on following lines must be deeper than `ownerIndent`.
    private JsonArray parseArray(int ownerIndent, int depth) {
        Validation.validateDepth(depth);
        final int line = curLine;
        final int column = curColumn;
        final Header header = parseHeader();
        LOG.finest(() -> "Header length " + header.length() + " fields " + header.fields());
        final List<JsonValue> elements = new ArrayList<>(Math.min(header.length(), 1024));
        if (header.fields() != null) {
            expectLineEnd();
            parseRows(header.fields(), ownerIndent, depth, elements);
        } else if (!atLineEnd()) {
            parseInline(elements);
        } else {
            parseListItems(ownerIndent, depth, elements);
        }
        if (options.strict()) {
            Validation.validateLength(header.length(), elements.size(), line, column);
        }
        return JsonArray.of(elements);
    }

    private void parseInline(List<JsonValue> elements) {
        while (true) {
            elements.add(scalarValue(readRequired(false, "array value")));
            if (!cur.is(TokenKind.DELIMITER)) {
                break;
            }
            advance();
        }
        expectLineEnd();
    }

    private void parseRows(List<String> fields, int ownerIndent, int depth, List<JsonValue> elements) {
        int rowIndent = -1;
        while (true) {
            skipNewlines();
            if (cur.is(TokenKind.EOF) || curIndent <= ownerIndent) {
                break;
            }
            if (rowIndent < 0) {
                rowIndent = curIndent;
            } else if (curIndent != rowIndent) {
                break;
            }
            Validation.validateDepth(depth + 1);
            final int line = curLine;
            final int column = curColumn;
            final List<JsonValue> cells = new ArrayList<>(fields.size());
            parseInline(cells);
            if (cells.size() != fields.size()) {
                throw new ToonParseException("Row has %d values but the header declares %d fields"
                        .formatted(cells.size(), fields.size()), line, column);
            }
            final Map<String, JsonValue> row = new LinkedHashMap<>();
            for (int i = 0; i < fields.size(); i++) {
                row.put(fields.get(i), cells.get(i));
            }
            elements.add(JsonObject.of(row));
        }
    }

    private void parseListItems(int ownerIndent, int depth, List<JsonValue> elements) {
        skipNewlines();
        if (cur.is(TokenKind.EOF) || curIndent <= ownerIndent) {
            return;
        }
        final int itemIndent = curIndent;
        while (true) {
            if (!cur.is(TokenKind.DASH)) {
                throw error("Expected '-' list item but found " + cur.describe());
            }
            elements.add(parseListItem(itemIndent, depth));
            skipNewlines();
            if (cur.is(TokenKind.EOF) || curIndent != itemIndent) {
                break;
            }
        }
    }

    /// Parses what follows a dash: a scalar, an array header, an object whose first
    /// key shares the dash line, or nothing (an empty object).
    private JsonValue parseListItem(int itemIndent, int depth) {
        advance(); // dash
        if (atLineEnd()) {
            Validation.validateDepth(depth + 1);
            return JsonObject.of(Map.of());
        }
        if (cur.is(TokenKind.LEFT_BRACKET)) {
            return parseArray(itemIndent, depth + 1);
        }
        if (startsKeyedEntry()) {
            Validation.validateDepth(depth + 1);
            final int siblingIndent = itemIndent + indentUnit;
            final Map<String, JsonValue> members = new LinkedHashMap<>();
            parseEntry(members, siblingIndent, depth + 1);
            while (true) {
                skipNewlines();
                if (cur.is(TokenKind.EOF) || curIndent != siblingIndent) {
                    break;
                }
                parseEntry(members, siblingIndent, depth + 1);
            }
            return JsonObject.of(members);
        }
        final JsonValue value = scalarValue(readRequired(true, "list item"));
        expectLineEnd();
        return value;
    }

    // ========== Array headers ==========

    private Header parseHeader() {
        expect(TokenKind.LEFT_BRACKET, "'['");
        final Length length = parseLength();
        Delimiter declared = length.declared();
        if (declared == null) {
            if (cur.is(TokenKind.DELIMITER)) {
                declared = cur.delimiter();
                advance();
            } else if (cur.is(TokenKind.STRING) && !cur.quoted() && cur.raw().length() == 1) {
                declared = Delimiter.fromSymbol(cur.raw().charAt(0)).orElse(null);
                if (declared != null) {
                    advance();
                }
            }
        }
        if (!cur.is(TokenKind.RIGHT_BRACKET)) {
            expect(TokenKind.RIGHT_BRACKET, "']' after array length");
        }
        // switch before scanning past ']' so everything after the bracket sees the delimiter
        resolveDelimiter(declared);
        advance();
        List<String> fields = null;
        if (cur.is(TokenKind.LEFT_BRACE)) {
            advance();
            fields = parseFields();
        }
        expect(TokenKind.COLON, "':' after array header");
        return new Header(length.value(), fields);
    }

    private Length parseLength() {
        final Length length;
        if (cur.is(TokenKind.INTEGER) && cur.number().longValue() >= 0
                && cur.number().longValue() <= Integer.MAX_VALUE) {
            length = new Length(cur.number().intValue(), null);
        } else if (cur.is(TokenKind.STRING) && !cur.quoted()) {
            length = parseMarkedLength(cur.raw());
        } else if (cur.is(TokenKind.EOF)) {
            throw unexpectedEof("array length");
        } else {
            throw error("Invalid array length " + cur.describe());
        }
        advance();
        return length;
    }

    // A length marker such as `#3`; before the delimiter is known the declared
    // symbol is scanned together with the digits, as in `#3|` or `3|`.
    private Length parseMarkedLength(String raw) {
        int i = raw.isEmpty() || Character.isDigit(raw.charAt(0)) ? 0 : 1;
        final int start = i;
        while (i < raw.length() && raw.charAt(i) >= '0' && raw.charAt(i) <= '9') {
            i++;
        }
        final String rest = raw.substring(i);
        Delimiter declared = null;
        if (rest.length() == 1) {
            declared = Delimiter.fromSymbol(rest.charAt(0)).orElse(null);
        }
        if (i == start || (!rest.isEmpty() && declared == null)) {
            throw error("Invalid array length '" + raw + "'");
        }
        try {
            return new Length(Integer.parseInt(raw.substring(start, i)), declared);
        } catch (NumberFormatException ex) {
            throw error("Invalid array length '" + raw + "'");
        }
    }

    private List<String> parseFields() {
        final List<String> fields = new ArrayList<>();
        while (true) {
            final String name = join(readRequired(false, "field name"));
            if (options.strict()) {
                Validation.validateFieldName(name);
            }
            fields.add(name);
            if (cur.is(TokenKind.DELIMITER)) {
                advance();
            } else if (cur.is(TokenKind.RIGHT_BRACE)) {
                advance();
                return fields;
            } else {
                expect(TokenKind.RIGHT_BRACE, "delimiter or '}' in field list");
            }
        }
    }

    private void resolveDelimiter(Delimiter declared) {
        // a header without a symbol declares a comma
        final Delimiter stated = declared != null ? declared : Delimiter.COMMA;
        if (delimiter == null) {
            delimiter = stated;
            scanner.setActiveDelimiter(delimiter);
            LOG.finer(() -> "Document delimiter detected as " + delimiter + " at line " + curLine);
        } else if (stated != delimiter) {
            throw new ToonParseException(ToonException.Kind.INVALID_DELIMITER,
                    "Invalid delimiter: header declares '%s' but the document uses '%s'"
                            .formatted(Delimiter.printable(stated.symbol()), Delimiter.printable(delimiter.symbol())),
                    curLine, curColumn);
        }
    }

    // ========== Scalars ==========

    /// Reads consecutive scalar tokens on the current line. A dash continues a run
    /// but never starts one. With `absorbDelimiters` delimiter tokens are text too.
    /// The spaces between tokens are kept as filler tokens so the run joins back
    /// to its source text.
    private List<Token> readRun(boolean absorbDelimiters) {
        final List<Token> run = new ArrayList<>(2);
        while (true) {
            final boolean take = switch (cur.kind()) {
                case STRING, INTEGER, NUMBER, BOOL, NULL -> true;
                case DASH -> !run.isEmpty();
                case DELIMITER -> absorbDelimiters;
                case LEFT_BRACKET, RIGHT_BRACKET, LEFT_BRACE, RIGHT_BRACE, COLON, NEWLINE, EOF -> false;
            };
            if (!take) {
                break;
            }
            if (!run.isEmpty() && curGap > 0) {
                run.add(Token.unquoted(" ".repeat(curGap)));
            }
            run.add(cur);
            advance();
        }
        return run;
    }

    private List<Token> readRequired(boolean absorbDelimiters, String what) {
        final List<Token> run = readRun(absorbDelimiters);
        if (run.isEmpty()) {
            throw cur.is(TokenKind.EOF) ? unexpectedEof(what) : error("Expected " + what + " but found " + cur.describe());
        }
        return run;
    }

    /// Joins a run with its original spacing. Quoted tokens contribute their content.
    private static String join(List<Token> run) {
        if (run.size() == 1) {
            return run.get(0).text();
        }
        final var sb = new StringBuilder();
        for (Token t : run) {
            sb.append(t.text());
        }
        return sb.toString();
    }

    private JsonValue scalarValue(List<Token> run) {
        if (run.size() > 1) {
            return JsonString.of(join(run));
        }
        final Token t = run.get(0);
        return switch (t.kind()) {
            case STRING, DELIMITER, DASH -> JsonString.of(t.text());
            case NULL -> JsonNull.of();
            case BOOL -> JsonBoolean.of(t.boolValue());
            case INTEGER, NUMBER -> numberValue(t);
            case LEFT_BRACKET, RIGHT_BRACKET, LEFT_BRACE, RIGHT_BRACE, COLON, NEWLINE, EOF ->
                    throw new IllegalStateException("not a scalar token: " + t.kind());
        };
    }

    private JsonValue numberValue(Token t) {
        final String raw = t.raw();
        if (Quoting.isNumericLike(raw)) {
            return JsonNumber.of(raw);
        }
        if (!options.coerceTypes()) {
            return JsonString.of(raw);
        }
        // non-canonical numerals such as 007 or 1. take their plain decimal form
        return t.is(TokenKind.INTEGER) ? JsonNumber.of(t.number().longValue()) : JsonNumber.of(new BigDecimal(raw));
    }

    // ========== Token plumbing ==========

    private void advance() {
        cur = scanner.next();
        curLine = scanner.line();
        curColumn = scanner.column();
        curIndent = scanner.indent();
        curGap = scanner.gap();
        if (options.strict() && scanner.startsLine() && !atLineEnd() && curIndent % indentUnit != 0) {
            throw error("Indentation of %d spaces is not a multiple of %d".formatted(curIndent, indentUnit));
        }
    }

    /// {@return true if the current line starts with a key followed by ':' or '['}
    /// Leaves the cursor where it was.
    private boolean startsKeyedEntry() {
        final Mark mark = new Mark(scanner.save(), cur, curLine, curColumn, curIndent, curGap);
        try {
            final List<Token> run = readRun(false);
            return !run.isEmpty() && (cur.is(TokenKind.COLON) || cur.is(TokenKind.LEFT_BRACKET));
        } finally {
            scanner.restore(mark.state());
            cur = mark.token();
            curLine = mark.line();
            curColumn = mark.column();
            curIndent = mark.indent();
            curGap = mark.gap();
        }
    }

    private boolean atLineEnd() {
        return cur.is(TokenKind.NEWLINE) || cur.is(TokenKind.EOF);
    }

    private void skipNewlines() {
        while (cur.is(TokenKind.NEWLINE)) {
            advance();
        }
    }

    private void expect(TokenKind kind, String what) {
        if (cur.is(kind)) {
            advance();
            return;
        }
        if (cur.is(TokenKind.EOF)) {
            throw unexpectedEof(what);
        }
        throw error("Expected " + what + " but found " + cur.describe());
    }

    private void expectLineEnd() {
        if (!atLineEnd()) {
            throw error("Expected end of line but found " + cur.describe());
        }
    }

    private ToonParseException error(String message) {
        return new ToonParseException(message, curLine, curColumn);
    }

    private ToonParseException unexpectedEof(String what) {
        return new ToonParseException(ToonException.Kind.UNEXPECTED_EOF,
                "Unexpected end of input, expected " + what, curLine, curColumn);
    }

    /// {@return the leading space count of the first indented non-blank line, or 2}
    /// That line is always one level deep, so it fixes the width of a level.
    static int indentUnit(String input) {
        int i = 0;
        final int n = input.length();
        while (i < n) {
            int spaces = 0;
            while (i < n && input.charAt(i) == ' ') {
                spaces++;
                i++;
            }
            final boolean blank = i >= n || input.charAt(i) == '\n' || input.charAt(i) == '\r';
            if (spaces > 0 && !blank) {
                return spaces;
            }
            while (i < n && input.charAt(i) != '\n') {
                i++;
            }
            i++;
        }
        return EncodeOptions.DEFAULT_INDENT.length();
    }
}

package work.typedcss.extract;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.typedcss.error.ExtractionException;
import work.typedcss.model.ComposesReference;
import work.typedcss.model.FileIdentity;
import work.typedcss.model.ImportReference;
import work.typedcss.model.Position;
import work.typedcss.model.SourceLocation;
import work.typedcss.model.Token;

/**
 * Reads class tokens, {@code composes} declarations and {@code @import}s out of normalized CSS.
 * Only generic class-selector, nesting and composition syntax is understood; dialect features are
 * expected to have been compiled away by a transformer.
 */
public final class TokenExtractor {
    private static final Set<String> CONTAINER_AT_RULES = Set.of(
        "media", "supports", "layer", "container", "document", "scope", "starting-style"
    );
    private static final Set<String> COMPOSES_PROPERTIES = Set.of("composes", "compose-with");
    private static final Pattern FROM_CLAUSE = Pattern.compile("^(.*?)\\s+from\\s+(.+)$", Pattern.DOTALL);
    private static final Pattern NAME_SEPARATOR = Pattern.compile("[\\s,]+");
    private static final Pattern TRAILING_CLASS =
        Pattern.compile("\\.((?:[-\\w\\u0080-\\uFFFF]|\\\\[0-9a-fA-F]{1,6}\\s?|\\\\.)+)$");
    private static final int REPLACEMENT_CHARACTER = 0xFFFD;

    public ExtractionResult extract(FileIdentity file, String css) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(css, "css");
        var parser = new Parser(file, css);
        try {
            return parser.parse();
        } catch (ExtractionException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw parser.failure(ex);
        }
    }

    private record RuleContext(List<String> selectors, List<String> owners) {}

    private enum Kind { CLASS, SUFFIX }

    private record Occurrence(Kind kind, String name, int start, int end) {}

    private static final class Parser {
        private final FileIdentity file;
        private final String css;
        private final int[] lineStarts;
        private final Map<String, List<SourceLocation>> tokens = new LinkedHashMap<>();
        private final List<ComposesReference> composes = new ArrayList<>();
        private final List<ImportReference> imports = new ArrayList<>();
        private int pos;

        Parser(FileIdentity file, String css) {
            this.file = file;
            this.css = css;
            this.lineStarts = computeLineStarts(css);
        }

        ExtractionResult parse() {
            parseBlock(null, 0, -1);
            var localTokens = new ArrayList<Token>(tokens.size());
            tokens.forEach((name, locations) -> localTokens.add(new Token(name, locations)));
            return new ExtractionResult(localTokens, composes, imports);
        }

        private void parseBlock(RuleContext ctx, int depth, int openedAt) {
            while (true) {
                skipWhitespaceAndComments();
                if (pos >= css.length()) {
                    if (depth > 0) {
                        throw error("Unclosed block", openedAt);
                    }
                    return;
                }
                char c = css.charAt(pos);
                if (c == '}') {
                    if (depth == 0) {
                        throw error("Unexpected '}'", pos);
                    }
                    pos++;
                    return;
                }
                if (c == ';') {
                    pos++;
                    continue;
                }
                if (c == '@') {
                    parseAtRule(ctx, depth);
                    continue;
                }
                int start = pos;
                char terminator = scanPrelude();
                String text = blankComments(css.substring(start, pos));
                if (terminator == '{') {
                    int brace = pos++;
                    var ruleContext = defineRule(ctx, text, start);
                    parseBlock(ruleContext, depth + 1, brace);
                    continue;
                }
                if (ctx == null) {
                    throw error("Declaration outside of a rule", start);
                }
                if (terminator == ';') {
                    pos++;
                }
                parseDeclaration(ctx, text, start);
            }
        }

        private void parseAtRule(RuleContext ctx, int depth) {
            int start = pos++;
            while (pos < css.length() && (Character.isLetterOrDigit(css.charAt(pos)) || css.charAt(pos) == '-')) {
                pos++;
            }
            String name = css.substring(start + 1, pos).toLowerCase(Locale.ROOT);
            if (name.isEmpty()) {
                throw error("Missing at-rule name", start);
            }
            int preludeStart = pos;
            char terminator = scanPrelude();
            String prelude = blankComments(css.substring(preludeStart, pos));
            if (terminator == '{') {
                int brace = pos++;
                if (CONTAINER_AT_RULES.contains(name)) {
                    parseBlock(ctx, depth + 1, brace);
                } else {
                    skipBlock(brace);
                }
                return;
            }
            if (terminator == ';') {
                pos++;
            }
            if ("import".equals(name) && ctx == null && depth == 0) {
                imports.add(new ImportReference(parseImportSpecifier(prelude, start), position(start)));
            }
        }

        private String parseImportSpecifier(String prelude, int offset) {
            String trimmed = prelude.strip();
            String specifier = null;
            if (!trimmed.isEmpty() && (trimmed.charAt(0) == '\'' || trimmed.charAt(0) == '"')) {
                int close = trimmed.indexOf(trimmed.charAt(0), 1);
                if (close > 0) {
                    specifier = trimmed.substring(1, close);
                }
            } else if (trimmed.regionMatches(true, 0, "url(", 0, 4)) {
                int close = trimmed.indexOf(')');
                if (close > 0) {
                    specifier = unquote(trimmed.substring(4, close).strip());
                }
            }
            if (specifier == null || specifier.isBlank()) {
                throw error("Invalid @import", offset);
            }
            return specifier;
        }

        private RuleContext defineRule(RuleContext parent, String selectorText, int offset) {
            var defined = new LinkedHashSet<String>();
            for (var occurrence : scanSelector(selectorText, parent != null)) {
                var location = new SourceLocation(file, position(offset + occurrence.start()), position(offset + occurrence.end()));
                if (occurrence.kind() == Kind.CLASS) {
                    declare(occurrence.name(), location);
                    defined.add(occurrence.name());
                    continue;
                }
                for (String parentSelector : parent.selectors()) {
                    Matcher matcher = TRAILING_CLASS.matcher(parentSelector);
                    if (matcher.find()) {
                        String name = unescape(matcher.group(1)) + occurrence.name();
                        declare(name, location);
                        defined.add(name);
                    }
                }
            }
            var selectors = resolveSelectors(parent, selectorText);
            List<String> owners = defined.isEmpty() && parent != null ? parent.owners() : List.copyOf(defined);
            return new RuleContext(selectors, owners);
        }

        private void declare(String name, SourceLocation location) {
            tokens.computeIfAbsent(name, key -> new ArrayList<>()).add(location);
        }

        private List<String> resolveSelectors(RuleContext parent, String selectorText) {
            var resolved = new ArrayList<String>();
            for (String part : splitSelectorList(selectorText)) {
                if (parent == null) {
                    resolved.add(part);
                } else if (part.indexOf('&') >= 0) {
                    for (String p : parent.selectors()) {
                        resolved.add(part.replace("&", p));
                    }
                } else {
                    for (String p : parent.selectors()) {
                        resolved.add(p + " " + part);
                    }
                }
            }
            return resolved;
        }

        private void parseDeclaration(RuleContext ctx, String text, int offset) {
            int colon = text.indexOf(':');
            if (colon < 0) {
                throw error("Expected ':' in declaration", offset);
            }
            String property = text.substring(0, colon).strip().toLowerCase(Locale.ROOT);
            if (!COMPOSES_PROPERTIES.contains(property)) {
                return;
            }
            int propertyStart = offset + (text.length() - text.stripLeading().length());
            String value = text.substring(colon + 1).strip();
            String names = value;
            String specifier = null;
            Matcher from = FROM_CLAUSE.matcher(value);
            if (from.matches()) {
                names = from.group(1);
                String source = from.group(2).strip();
                if ("global".equals(source)) {
                    return;
                }
                specifier = unquote(source);
                if (specifier.equals(source) || specifier.isBlank()) {
                    throw error("Expected a quoted file after 'from'", propertyStart);
                }
            }
            var tokenNames = Arrays.stream(NAME_SEPARATOR.split(names.strip()))
                .filter(name -> !name.isEmpty())
                .toList();
            if (tokenNames.isEmpty()) {
                throw error("'" + property + "' lists no class names", propertyStart);
            }
            var at = position(propertyStart);
            composes.add(specifier == null
                ? ComposesReference.local(ctx.owners(), tokenNames, at)
                : ComposesReference.from(ctx.owners(), tokenNames, specifier, at));
        }

        private List<Occurrence> scanSelector(String selector, boolean nested) {
            var found = new ArrayList<Occurrence>();
            boolean global = false;
            int i = 0;
            int n = selector.length();
            while (i < n) {
                char c = selector.charAt(i);
                if (c == '"' || c == '\'') {
                    i = skipQuoted(selector, i);
                } else if (c == '[') {
                    i = skipBracket(selector, i);
                } else if (c == '\\') {
                    i += 2;
                } else if (c == ',') {
                    global = false;
                    i++;
                } else if (c == ':') {
                    if (selector.startsWith(":global(", i)) {
                        i = skipParens(selector, i + ":global".length());
                    } else if (selector.startsWith(":global", i) && !isIdentChar(selector, i + 7)) {
                        global = true;
                        i += ":global".length();
                    } else if (selector.startsWith(":local", i) && !selector.startsWith(":local(", i)) {
                        global = false;
                        i += ":local".length();
                    } else {
                        i++;
                    }
                } else if (c == '.' && isIdentStart(selector, i + 1)) {
                    int end = identEnd(selector, i + 1);
                    if (!global) {
                        found.add(new Occurrence(Kind.CLASS, unescape(selector.substring(i + 1, end)), i, end));
                    }
                    i = end;
                } else if (c == '&' && nested) {
                    int end = identEnd(selector, i + 1);
                    if (end > i + 1) {
                        found.add(new Occurrence(Kind.SUFFIX, unescape(selector.substring(i + 1, end)), i, end));
                    }
                    i = Math.max(end, i + 1);
                } else {
                    i++;
                }
            }
            return found;
        }

        /**
         * Advances to the next top-level '{', ';' or '}' (not consumed) and returns it, or 0 at end of input.
         */
        private char scanPrelude() {
            int nesting = 0;
            while (pos < css.length()) {
                char c = css.charAt(pos);
                if (c == '/' && pos + 1 < css.length() && css.charAt(pos + 1) == '*') {
                    skipComment();
                    continue;
                }
                if (c == '"' || c == '\'') {
                    pos = skipQuotedOrFail(pos);
                    continue;
                }
                if (c == '\\') {
                    pos += 2;
                    continue;
                }
                if (c == '(' || c == '[') {
                    nesting++;
                } else if ((c == ')' || c == ']') && nesting > 0) {
                    nesting--;
                } else if (nesting == 0 && (c == '{' || c == ';' || c == '}')) {
                    return c;
                }
                pos++;
            }
            pos = css.length();
            return 0;
        }

        private void skipBlock(int openedAt) {
            int depth = 1;
            while (pos < css.length()) {
                char c = css.charAt(pos);
                if (c == '/' && pos + 1 < css.length() && css.charAt(pos + 1) == '*') {
                    skipComment();
                    continue;
                }
                if (c == '"' || c == '\'') {
                    pos = skipQuotedOrFail(pos);
                    continue;
                }
                pos++;
                if (c == '{') {
                    depth++;
                } else if (c == '}' && --depth == 0) {
                    return;
                }
            }
            throw error("Unclosed block", openedAt);
        }

        private void skipWhitespaceAndComments() {
            while (pos < css.length()) {
                char c = css.charAt(pos);
                if (Character.isWhitespace(c)) {
                    pos++;
                } else if (c == '/' && pos + 1 < css.length() && css.charAt(pos + 1) == '*') {
                    skipComment();
                } else {
                    return;
                }
            }
        }

        private void skipComment() {
            int close = css.indexOf("*/", pos + 2);
            if (close < 0) {
                throw error("Unterminated comment", pos);
            }
            pos = close + 2;
        }

        private int skipQuotedOrFail(int start) {
            int end = skipQuoted(css, start);
            if (end > css.length()) {
                throw error("Unterminated string", start);
            }
            return end;
        }

        private ExtractionException failure(RuntimeException cause) {
            var position = position(Math.max(0, Math.min(pos, css.length())));
            return new ExtractionException(file, "Cannot tokenize: " + cause.getMessage(), position, cause);
        }

        private ExtractionException error(String message, int offset) {
            return new ExtractionException(file, message, position(Math.max(0, Math.min(offset, css.length()))));
        }

        private Position position(int offset) {
            int index = Arrays.binarySearch(lineStarts, offset);
            int line = index >= 0 ? index : -index - 2;
            return new Position(line + 1, offset - lineStarts[line] + 1);
        }
    }

    private static int[] computeLineStarts(String css) {
        var starts = new ArrayList<Integer>();
        starts.add(0);
        for (int i = 0; i < css.length(); i++) {
            char c = css.charAt(i);
            if (c == '\n') {
                starts.add(i + 1);
            } else if (c == '\r') {
                if (i + 1 < css.length() && css.charAt(i + 1) == '\n') {
                    i++;
                }
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Returns the index just past the closing quote, or {@code length + 1} when the string never closes.
     */
    private static int skipQuoted(String text, int start) {
        char quote = text.charAt(start);
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            if (c == '\n') {
                break;
            }
            i++;
        }
        return text.length() + 1;
    }

    private static int skipBracket(String text, int start) {
        int i = start + 1;
        while (i < text.length() && text.charAt(i) != ']') {
            char c = text.charAt(i);
            i = (c == '"' || c == '\'') ? skipQuoted(text, i) : i + 1;
        }
        return Math.min(i + 1, text.length());
    }

    private static int skipParens(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return i + 1;
            }
        }
        return text.length();
    }

    private static boolean isIdentStart(String text, int i) {
        if (i >= text.length()) {
            return false;
        }
        char c = text.charAt(i);
        return Character.isLetter(c) || c == '_' || c == '-' || c == '\\' || c >= 0x80;
    }

    private static boolean isIdentChar(String text, int i) {
        if (i >= text.length()) {
            return false;
        }
        char c = text.charAt(i);
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '\\' || c >= 0x80;
    }

    private static int identEnd(String text, int start) {
        int i = start;
        while (isIdentChar(text, i)) {
            i = text.charAt(i) == '\\' ? escapeEnd(text, i) : i + 1;
        }
        return Math.min(i, text.length());
    }

    /**
     * End of the escape at {@code backslash}: up to six hex digits plus one whitespace, or a single character.
     */
    private static int escapeEnd(String text, int backslash) {
        int start = backslash + 1;
        int digits = hexDigits(text, start);
        if (digits == 0) {
            return start + 1;
        }
        int end = start + digits;
        if (text.startsWith("\r\n", end)) {
            return end + 2;
        }
        if (end < text.length() && " \t\n\r\f".indexOf(text.charAt(end)) >= 0) {
            return end + 1;
        }
        return end;
    }

    private static int hexDigits(String text, int start) {
        int i = start;
        while (i < text.length() && i - start < 6 && isHexDigit(text.charAt(i))) {
            i++;
        }
        return i - start;
    }

    private static boolean isHexDigit(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static List<String> splitSelectorList(String selector) {
        var parts = new ArrayList<String>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < selector.length(); i++) {
            char c = selector.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
            } else if ((c == ')' || c == ']') && depth > 0) {
                depth--;
            } else if (c == ',' && depth == 0) {
                addPart(parts, selector.substring(start, i));
                start = i + 1;
            }
        }
        addPart(parts, selector.substring(start));
        return parts;
    }

    private static void addPart(List<String> parts, String raw) {
        String trimmed = raw.strip();
        if (!trimmed.isEmpty()) {
            parts.add(trimmed);
        }
    }

    /**
     * Replaces comments by spaces so offsets into the original text stay valid.
     */
    private static String blankComments(String text) {
        int open = text.indexOf("/*");
        if (open < 0) {
            return text;
        }
        var out = new StringBuilder(text);
        while (open >= 0) {
            int close = text.indexOf("*/", open + 2);
            int end = close < 0 ? text.length() : close + 2;
            for (int i = open; i < end; i++) {
                if (out.charAt(i) != '\n') {
                    out.setCharAt(i, ' ');
                }
            }
            open = close < 0 ? -1 : text.indexOf("/*", end);
        }
        return out.toString();
    }

    private static String unquote(String raw) {
        if (raw.length() >= 2) {
            char first = raw.charAt(0);
            if ((first == '\'' || first == '"') && raw.charAt(raw.length() - 1) == first) {
                return raw.substring(1, raw.length() - 1);
            }
        }
        return raw;
    }

    private static String unescape(String ident) {
        if (ident.indexOf('\\') < 0) {
            return ident;
        }
        var out = new StringBuilder(ident.length());
        int i = 0;
        while (i < ident.length()) {
            char c = ident.charAt(i);
            if (c != '\\' || i + 1 >= ident.length()) {
                out.append(c);
                i++;
                continue;
            }
            int digits = hexDigits(ident, i + 1);
            if (digits > 0) {
                int codePoint = Integer.parseInt(ident.substring(i + 1, i + 1 + digits), 16);
                boolean valid = codePoint != 0
                    && codePoint <= Character.MAX_CODE_POINT
                    && (codePoint < Character.MIN_SURROGATE || codePoint > Character.MAX_SURROGATE);
                out.appendCodePoint(valid ? codePoint : REPLACEMENT_CHARACTER);
            } else {
                out.append(ident.charAt(i + 1));
            }
            i = escapeEnd(ident, i);
        }
        return out.toString();
    }
}

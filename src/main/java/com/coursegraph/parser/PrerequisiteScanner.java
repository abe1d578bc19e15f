package com.coursegraph.parser;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Contextual tokenizer: the parser asks for the token kinds legal at its current position and only
 * those are tried. This is what lets {@code (} after a course start help text while {@code (} in term
 * position opens a group, and an uppercase {@code AND} in term position read as a subject.
 * <p>
 * One instance per parse; not thread-safe.
 */
class PrerequisiteScanner {

    enum TokenKind {
        LPAREN("\\(", "'('"),
        RPAREN("\\)", "')'"),
        COMMA(",", "','"),
        AND("(?i)and", "'and'"),
        OR("(?i)or", "'or'"),
        LBRACKET("\\[", "'['"),
        RBRACKET("\\]", "']'"),
        MIN_GRADE_TEXT("(?i)min\\s+grade\\s*:\\s*", "'Min Grade:'"),
        GRADE_VALUE("CR|NC|[A-F][+-]?", "GRADE_VALUE"),
        SUBJECT_ID("[A-Z0-9]{2,5}", "SUBJECT_ID"),
        COURSE_NUMBER("[A-Z0-9]+", "COURSE_NUMBER"),
        HELP_TEXT_CONTENT("[^)]+", "HELP_TEXT_CONTENT");

        private final Pattern pattern;
        private final String display;

        TokenKind(String regex, String display) {
            this.pattern = Pattern.compile(regex);
            this.display = display;
        }
    }

    record Token(TokenKind kind, String text, int position) {}

    private final String text;
    private int pos;
    // kinds tried and rejected at the current position, reported if nothing ends up matching
    private final Set<String> tried = new LinkedHashSet<>();

    PrerequisiteScanner(String text) {
        this.text = text == null ? "" : text;
    }

    String text() {
        return text;
    }

    int position() {
        skipWhitespace();
        return pos;
    }

    Token accept(TokenKind... kinds) {
        skipWhitespace();
        for (TokenKind kind : kinds) {
            Token token = match(kind);
            if (token != null) return token;
            tried.add(kind.display);
        }
        return null;
    }

    Token expect(TokenKind... kinds) {
        Token token = accept(kinds);
        if (token == null) throw error();
        return token;
    }

    void expectEnd() {
        skipWhitespace();
        if (pos < text.length()) {
            tried.add("end of input");
            throw error();
        }
    }

    private Token match(TokenKind kind) {
        if (pos >= text.length()) return null;
        Matcher m = kind.pattern.matcher(text);
        m.region(pos, text.length());
        if (!m.lookingAt() || m.end() == pos) return null;
        Token token = new Token(kind, m.group(), pos);
        pos = m.end();
        tried.clear();
        return token;
    }

    private void skipWhitespace() {
        while (pos < text.length() && isSpace(text.charAt(pos))) pos++;
    }

    private static boolean isSpace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private PrerequisiteSyntaxException error() {
        String expected = String.join(", ", tried);
        String diagnostic = pos >= text.length()
                ? "Unexpected end of input at " + pos + ", expected one of: " + expected
                : "Unexpected character '" + text.charAt(pos) + "' at " + pos + ", expected one of: " + expected;
        return new PrerequisiteSyntaxException(text, pos, diagnostic);
    }
}

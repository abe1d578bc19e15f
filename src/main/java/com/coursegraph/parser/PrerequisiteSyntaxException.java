package com.coursegraph.parser;

public class PrerequisiteSyntaxException extends RuntimeException {
    private final String text;
    private final int position;
    private final String diagnostic;

    public PrerequisiteSyntaxException(String text, int position, String diagnostic) {
        super(diagnostic + " in: " + text);
        this.text = text;
        this.position = position;
        this.diagnostic = diagnostic;
    }

    public String text() {
        return text;
    }

    public int position() {
        return position;
    }

    public String diagnostic() {
        return diagnostic;
    }
}

package com.coursegraph.parser;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum GradeRequirement {
    A_PLUS("A+"), A("A"), A_MINUS("A-"),
    B_PLUS("B+"), B("B"), B_MINUS("B-"),
    C_PLUS("C+"), C("C"), C_MINUS("C-"),
    D_PLUS("D+"), D("D"), D_MINUS("D-"),
    F("F"),
    CR("CR"), NC("NC");

    public static final GradeRequirement DEFAULT = D;

    private final String label;

    GradeRequirement(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<GradeRequirement> fromLabel(String label) {
        if (label == null) return Optional.empty();
        String normalized = label.trim().toUpperCase();
        return Arrays.stream(values()).filter(g -> g.label.equals(normalized)).findFirst();
    }

    @Override
    public String toString() {
        return label;
    }
}

package com.coursegraph.parser;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raw grammar output: one node per production, terminals as leaves carrying their matched text.
 * Combinator productions are kept even when they have a single child; collapsing is left to
 * {@link PrerequisiteAstBuilder}.
 */
public record ParseTree(Rule rule, List<ParseTree> children, String value, int position) {

    public enum Rule {
        OR_EXPRESSION(false),
        AND_EXPRESSION(false),
        COMMA_EXPRESSION(false),
        GROUPED_EXPRESSION(false),
        COURSE_WITH_METADATA(false),
        COURSE_CODE(false),
        GRADE_REQUIREMENT(false),
        HELP_TEXT(false),
        SUBJECT_ID(true),
        COURSE_NUMBER(true),
        GRADE_VALUE(true),
        HELP_TEXT_CONTENT(true);

        private final boolean terminal;

        Rule(boolean terminal) {
            this.terminal = terminal;
        }

        public boolean terminal() {
            return terminal;
        }
    }

    public ParseTree {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static ParseTree node(Rule rule, List<ParseTree> children, int position) {
        if (rule.terminal()) throw new IllegalArgumentException(rule + " is a terminal");
        return new ParseTree(rule, children, null, position);
    }

    public static ParseTree leaf(Rule rule, String value, int position) {
        if (!rule.terminal()) throw new IllegalArgumentException(rule + " is not a terminal");
        return new ParseTree(rule, List.of(), value, position);
    }

    public ParseTree child(int index) {
        return children.get(index);
    }

    public String pretty() {
        if (rule.terminal()) return value;
        return "(" + rule.name().toLowerCase() + " "
                + children.stream().map(ParseTree::pretty).collect(Collectors.joining(" ")) + ")";
    }
}

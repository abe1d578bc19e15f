package com.coursegraph.parser;

import com.coursegraph.parser.ParseTree.Rule;
import com.coursegraph.parser.PrerequisiteScanner.Token;
import com.coursegraph.parser.PrerequisiteScanner.TokenKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for prerequisite text.
 * <pre>
 * or_expression        : and_expression ("or" and_expression)*
 * and_expression       : comma_expression ("and" comma_expression)*
 * comma_expression     : course_term ("," course_term)*
 * course_term          : course_with_metadata | "(" or_expression ")"
 * course_with_metadata : SUBJECT_ID COURSE_NUMBER grade_requirement? help_text?
 * grade_requirement    : "[" "Min Grade:" GRADE_VALUE "]"
 * help_text            : "(" HELP_TEXT_CONTENT ")"
 * </pre>
 * Keywords are case-insensitive, whitespace between tokens is ignored.
 * Stateless: every call gets its own scanner, so one instance serves any number of threads.
 */
@Component
public class PrerequisiteGrammarParser {

    public ParseTree parse(String text) {
        PrerequisiteScanner scanner = new PrerequisiteScanner(text);
        ParseTree tree = orExpression(scanner);
        scanner.expectEnd();
        return tree;
    }

    private ParseTree orExpression(PrerequisiteScanner s) {
        int start = s.position();
        List<ParseTree> children = new ArrayList<>();
        children.add(andExpression(s));
        while (s.accept(TokenKind.OR) != null) {
            children.add(andExpression(s));
        }
        return ParseTree.node(Rule.OR_EXPRESSION, children, start);
    }

    private ParseTree andExpression(PrerequisiteScanner s) {
        int start = s.position();
        List<ParseTree> children = new ArrayList<>();
        children.add(commaExpression(s));
        while (s.accept(TokenKind.AND) != null) {
            children.add(commaExpression(s));
        }
        return ParseTree.node(Rule.AND_EXPRESSION, children, start);
    }

    private ParseTree commaExpression(PrerequisiteScanner s) {
        int start = s.position();
        List<ParseTree> children = new ArrayList<>();
        children.add(courseTerm(s));
        while (s.accept(TokenKind.COMMA) != null) {
            children.add(courseTerm(s));
        }
        return ParseTree.node(Rule.COMMA_EXPRESSION, children, start);
    }

    private ParseTree courseTerm(PrerequisiteScanner s) {
        Token first = s.expect(TokenKind.SUBJECT_ID, TokenKind.LPAREN);
        if (first.kind() == TokenKind.LPAREN) {
            ParseTree inner = orExpression(s);
            s.expect(TokenKind.RPAREN);
            return ParseTree.node(Rule.GROUPED_EXPRESSION, List.of(inner), first.position());
        }
        return courseWithMetadata(s, first);
    }

    private ParseTree courseWithMetadata(PrerequisiteScanner s, Token subject) {
        Token number = s.expect(TokenKind.COURSE_NUMBER);
        List<ParseTree> children = new ArrayList<>();
        children.add(ParseTree.node(Rule.COURSE_CODE, List.of(
                ParseTree.leaf(Rule.SUBJECT_ID, subject.text(), subject.position()),
                ParseTree.leaf(Rule.COURSE_NUMBER, number.text(), number.position())), subject.position()));

        Token bracket = s.accept(TokenKind.LBRACKET);
        if (bracket != null) {
            s.expect(TokenKind.MIN_GRADE_TEXT);
            Token grade = s.expect(TokenKind.GRADE_VALUE);
            if (GradeRequirement.fromLabel(grade.text()).isEmpty()) {
                throw new PrerequisiteSyntaxException(s.text(), grade.position(), "Unknown grade '" + grade.text() + "' at " + grade.position());
            }
            s.expect(TokenKind.RBRACKET);
            children.add(ParseTree.node(Rule.GRADE_REQUIREMENT,
                    List.of(ParseTree.leaf(Rule.GRADE_VALUE, grade.text(), grade.position())), bracket.position()));
        }

        // after a course code "(" can only open help text, never a group
        Token paren = s.accept(TokenKind.LPAREN);
        if (paren != null) {
            Token content = s.expect(TokenKind.HELP_TEXT_CONTENT);
            s.expect(TokenKind.RPAREN);
            children.add(ParseTree.node(Rule.HELP_TEXT,
                    List.of(ParseTree.leaf(Rule.HELP_TEXT_CONTENT, content.text(), content.position())), paren.position()));
        }
        return ParseTree.node(Rule.COURSE_WITH_METADATA, children, subject.position());
    }
}

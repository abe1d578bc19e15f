package com.coursegraph.parser;

import com.coursegraph.parser.ParseTree.Rule;
import com.coursegraph.parser.PrerequisiteAst.*;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

@Component
public class PrerequisiteAstBuilder {

    public Expression build(ParseTree tree) {
        return switch (tree.rule()) {
            case OR_EXPRESSION -> combinator(tree, Or::new);
            case AND_EXPRESSION -> combinator(tree, And::new);
            case COMMA_EXPRESSION -> combinator(tree, Comma::new);
            case GROUPED_EXPRESSION -> new Grouped(build(tree.child(0)));
            case COURSE_WITH_METADATA -> new Course(courseTerm(tree));
            default -> throw new IllegalArgumentException("Not an expression node: " + tree.rule());
        };
    }

    private Expression combinator(ParseTree tree, Function<List<Expression>, Expression> factory) {
        if (tree.children().size() == 1) return build(tree.child(0));
        return factory.apply(tree.children().stream().map(this::build).toList());
    }

    private CourseTerm courseTerm(ParseTree tree) {
        ParseTree code = tree.child(0);
        CourseCode course = new CourseCode(code.child(0).value(), code.child(1).value());

        Optional<GradeRequirement> grade = Optional.empty();
        Optional<HelpText> help = Optional.empty();
        for (ParseTree clause : tree.children().subList(1, tree.children().size())) {
            if (clause.rule() == Rule.GRADE_REQUIREMENT && grade.isEmpty()) {
                String label = clause.child(0).value();
                grade = Optional.of(GradeRequirement.fromLabel(label)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown grade: " + label)));
            } else if (clause.rule() == Rule.HELP_TEXT && help.isEmpty()) {
                help = Optional.of(new HelpText(clause.child(0).value()));
            }
        }
        return new CourseTerm(course, grade, help);
    }
}

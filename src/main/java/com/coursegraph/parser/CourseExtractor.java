package com.coursegraph.parser;

import com.coursegraph.parser.PrerequisiteAst.*;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class CourseExtractor {

    public List<ExtractedCourse> extract(Expression expression) {
        List<ExtractedCourse> courses = new ArrayList<>();
        walk(expression, List.of(), 0, courses);
        return List.copyOf(courses);
    }

    private void walk(Expression node, List<PathStep> path, int groupLevel, List<ExtractedCourse> out) {
        node.accept(new ExpressionVisitor<Void>() {
            @Override
            public Void visitCourse(Course course) {
                CourseTerm term = course.term();
                out.add(new ExtractedCourse(
                        term.course().subject(),
                        term.course().number(),
                        term.effectiveGrade(),
                        term.help().map(HelpText::content).orElse(null),
                        path,
                        groupLevel));
                return null;
            }

            @Override
            public Void visitComma(Comma comma) {
                operands(Operator.COMMA, comma.operands());
                return null;
            }

            @Override
            public Void visitAnd(And and) {
                operands(Operator.AND, and.operands());
                return null;
            }

            @Override
            public Void visitOr(Or or) {
                operands(Operator.OR, or.operands());
                return null;
            }

            @Override
            public Void visitGrouped(Grouped grouped) {
                walk(grouped.inner(), path, groupLevel + 1, out);
                return null;
            }

            private void operands(Operator operator, List<Expression> operands) {
                for (int i = 0; i < operands.size(); i++) {
                    List<PathStep> next = new ArrayList<>(path);
                    next.add(new PathStep(operator, i));
                    walk(operands.get(i), List.copyOf(next), groupLevel, out);
                }
            }
        });
    }

    public enum Operator { COMMA, AND, OR }

    public record PathStep(Operator operator, int index) {}

    public record ExtractedCourse(String subject,
                                  String number,
                                  GradeRequirement minGrade,
                                  String helpText,
                                  List<PathStep> logicalPath,
                                  int groupLevel) {}
}

package com.coursegraph.parser;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class PrerequisiteAst {

    public sealed interface Expression permits Course, Comma, And, Or, Grouped {
        <R> R accept(ExpressionVisitor<R> visitor);
    }

    public interface ExpressionVisitor<R> {
        R visitCourse(Course course);

        R visitComma(Comma comma);

        R visitAnd(And and);

        R visitOr(Or or);

        R visitGrouped(Grouped grouped);
    }

    public record CourseCode(String subject, String number) {
        public CourseCode {
            if (subject == null || subject.isBlank()) throw new IllegalArgumentException("Course subject is required");
            if (number == null || number.isBlank()) throw new IllegalArgumentException("Course number is required");
        }

        public String displayName() {
            return subject + " " + number;
        }

        @Override
        public String toString() {
            return displayName();
        }
    }

    public record HelpText(String content) {
        public HelpText {
            content = content == null ? "" : content.trim();
        }

        public boolean isPresent() {
            return !content.isEmpty();
        }
    }

    public record CourseTerm(CourseCode course, Optional<GradeRequirement> grade, Optional<HelpText> help) {
        public CourseTerm {
            Objects.requireNonNull(course, "course");
            grade = grade == null ? Optional.empty() : grade;
            help = help == null ? Optional.empty() : help;
        }

        public GradeRequirement effectiveGrade() {
            return grade.orElse(GradeRequirement.DEFAULT);
        }

        public String note() {
            return help.map(HelpText::content).orElse("");
        }

        public boolean allowsConcurrentEnrollment() {
            return help.map(HelpText::isPresent).orElse(false);
        }
    }

    public record Course(CourseTerm term) implements Expression {
        public Course {
            Objects.requireNonNull(term, "term");
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitCourse(this);
        }
    }

    public record Comma(List<Expression> operands) implements Expression {
        public Comma {
            operands = requireCombinatorOperands(operands, "Comma");
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitComma(this);
        }
    }

    public record And(List<Expression> operands) implements Expression {
        public And {
            operands = requireCombinatorOperands(operands, "And");
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitAnd(this);
        }
    }

    public record Or(List<Expression> operands) implements Expression {
        public Or {
            operands = requireCombinatorOperands(operands, "Or");
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitOr(this);
        }
    }

    public record Grouped(Expression inner) implements Expression {
        public Grouped {
            Objects.requireNonNull(inner, "inner");
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitGrouped(this);
        }
    }

    private static List<Expression> requireCombinatorOperands(List<Expression> operands, String kind) {
        if (operands == null || operands.size() < 2) {
            throw new IllegalArgumentException(kind + " needs at least two operands");
        }
        return List.copyOf(operands);
    }
}

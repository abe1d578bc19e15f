package com.coursegraph.graph;

import com.coursegraph.graph.PrerequisiteGraphModels.AndGroup;
import com.coursegraph.graph.PrerequisiteGraphModels.CourseRef;
import com.coursegraph.parser.PrerequisiteAst.*;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles an expression tree into AND-of-OR normal form: a list of groups that are all required,
 * each group a list of alternatives.
 * <ul>
 *   <li>a lone course is a group of one;</li>
 *   <li>{@code and} concatenates the groups of its operands;</li>
 *   <li>{@code or} and {@code ,} build a single group from all their operands;</li>
 *   <li>parentheses change nothing.</li>
 * </ul>
 * Pure and stateless.
 */
@Component
public class PrerequisiteNormalizer {

    public List<AndGroup> normalize(Expression expression) {
        return List.copyOf(expression.accept(new GroupCompiler()));
    }

    private static CourseRef toRef(CourseTerm term) {
        return CourseRef.of(term.course().displayName(), term.effectiveGrade());
    }

    private static final class GroupCompiler implements ExpressionVisitor<List<AndGroup>> {

        @Override
        public List<AndGroup> visitCourse(Course course) {
            CourseTerm term = course.term();
            return List.of(new AndGroup(List.of(toRef(term)), term.allowsConcurrentEnrollment(), term.note()));
        }

        @Override
        public List<AndGroup> visitAnd(And and) {
            List<AndGroup> groups = new ArrayList<>();
            and.operands().forEach(operand -> groups.addAll(operand.accept(this)));
            return groups;
        }

        @Override
        public List<AndGroup> visitOr(Or or) {
            return alternatives(or.operands());
        }

        @Override
        public List<AndGroup> visitComma(Comma comma) {
            return alternatives(comma.operands());
        }

        @Override
        public List<AndGroup> visitGrouped(Grouped grouped) {
            return grouped.inner().accept(this);
        }

        /*
         * Open question: a nested operand is flattened into this group, so "A or (B and C)" becomes
         * the single choice {A, B, C} and the inner conjunction is lost. Consumers of the stored graph
         * already rely on this shape, so it stays until they can take a deeper structure.
         */
        private List<AndGroup> alternatives(List<Expression> operands) {
            List<CourseRef> courses = new ArrayList<>();
            boolean concurrent = false;
            String note = "";

            for (Expression operand : operands) {
                if (operand instanceof Course course) {
                    CourseTerm term = course.term();
                    courses.add(toRef(term));
                    if (term.allowsConcurrentEnrollment()) {
                        concurrent = true;
                        if (note.isEmpty()) note = term.note();
                    }
                } else {
                    for (AndGroup nested : operand.accept(this)) {
                        courses.addAll(nested.courses());
                        concurrent |= nested.canBeTakenConcurrently();
                        if (note.isEmpty()) note = nested.note();
                    }
                }
            }

            if (courses.isEmpty()) return List.of();
            return List.of(new AndGroup(courses, concurrent, note));
        }
    }
}

package com.coursegraph.graph;

import com.coursegraph.parser.GradeRequirement;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public class PrerequisiteGraphModels {

    public record CourseRef(@JsonProperty("coursename") String name,
                            @JsonProperty("id") String id,
                            @JsonProperty("minimum_grade") GradeRequirement minimumGrade,
                            @JsonProperty("resolved") boolean resolved) {
        public CourseRef {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("Course name is required");
            id = id == null ? name : id;
            minimumGrade = minimumGrade == null ? GradeRequirement.DEFAULT : minimumGrade;
        }

        public static CourseRef of(String name, GradeRequirement minimumGrade) {
            return new CourseRef(name, name, minimumGrade, false);
        }

        public CourseRef withId(String catalogueId) {
            return new CourseRef(name, catalogueId, minimumGrade, true);
        }
    }

    public record AndGroup(@JsonProperty("courses") List<CourseRef> courses,
                           @JsonProperty("canBeTakenConcurrently") boolean canBeTakenConcurrently,
                           @JsonProperty("helpertext") String note) {
        public AndGroup {
            if (courses == null || courses.isEmpty()) throw new IllegalArgumentException("AND group needs at least one course");
            courses = List.copyOf(courses);
            note = note == null ? "" : note;
        }

        public RelationshipType relationshipType() {
            return courses.size() > 1 ? RelationshipType.CHOICE : RelationshipType.REQUIRED;
        }
    }

    public record CoursePrerequisites(String courseId, List<AndGroup> andGroups) {
        public CoursePrerequisites {
            if (andGroups == null || andGroups.isEmpty()) throw new IllegalArgumentException("Prerequisites need at least one AND group");
            andGroups = List.copyOf(andGroups);
        }
    }

    public enum RelationshipType { REQUIRED, CHOICE }

    public record PrerequisiteEdge(String courseId,
                                   String groupId,
                                   int groupIndex,
                                   int position,
                                   String prerequisiteName,
                                   String prerequisiteId,
                                   RelationshipType relationshipType,
                                   GradeRequirement minimumGrade,
                                   boolean canTakeConcurrent,
                                   boolean resolved,
                                   String note) {}

    public record CorequisiteEdge(String courseId, String corequisiteName, String corequisiteId, boolean resolved) {}

    public record EdgeStats(long total, Map<RelationshipType, Long> byType, long unresolved) {}
}

package com.coursegraph.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public class DomainModels {
    public record CourseRecord(@JsonProperty("id") String id,
                               @JsonProperty("subject_id") String subjectId,
                               @JsonProperty("course_number") String courseNumber,
                               @JsonProperty("title") String title,
                               @JsonProperty("prerequisites") String prerequisites,
                               @JsonProperty("corequisites") String corequisites) {

        public String displayName() {
            return subjectId.trim() + " " + courseNumber.trim();
        }

        public boolean hasPrerequisites() {
            return prerequisites != null && !prerequisites.isBlank();
        }

        public boolean hasCorequisites() {
            return corequisites != null && !corequisites.isBlank();
        }
    }
}

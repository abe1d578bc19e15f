package com.coursegraph.service;

import com.coursegraph.graph.PrerequisiteGraphModels.AndGroup;
import com.coursegraph.graph.PrerequisiteGraphModels.CourseRef;
import com.coursegraph.repository.CourseJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class CourseIdResolver {
    private static final Logger log = LoggerFactory.getLogger(CourseIdResolver.class);

    private final CourseJdbcRepository courseRepository;

    public CourseIdResolver(CourseJdbcRepository courseRepository) {
        this.courseRepository = courseRepository;
    }

    public Lookup snapshot() {
        Map<String, String> ids = new HashMap<>();
        courseRepository.loadCourseKeys().forEach(row -> ids.putIfAbsent(key(row.subjectId(), row.courseNumber()), row.id()));
        return new Lookup(Map.copyOf(ids));
    }

    private static String key(String subject, String number) {
        return subject.trim() + " " + number.trim();
    }

    public static final class Lookup {
        private final Map<String, String> ids;

        private Lookup(Map<String, String> ids) {
            this.ids = ids;
        }

        public Optional<String> resolve(String courseName) {
            String[] parts = courseName == null ? new String[0] : courseName.trim().split("\\s+");
            if (parts.length < 2) {
                log.warn("Invalid course name format: '{}'", courseName);
                return Optional.empty();
            }
            return Optional.ofNullable(ids.get(key(parts[0], parts[1])));
        }

        public List<AndGroup> resolveIds(List<AndGroup> groups) {
            return groups.stream()
                    .map(g -> new AndGroup(g.courses().stream().map(this::resolveRef).toList(), g.canBeTakenConcurrently(), g.note()))
                    .toList();
        }

        private CourseRef resolveRef(CourseRef ref) {
            Optional<String> id = resolve(ref.name());
            if (id.isEmpty()) {
                log.warn("Course not found in catalogue: {}", ref.name());
                return ref;
            }
            return ref.withId(id.get());
        }

        public int size() {
            return ids.size();
        }
    }
}

package com.coursegraph.repository;

import com.coursegraph.domain.DomainModels.CourseRecord;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class CourseJdbcRepository {
    private static final RowMapper<CourseRecord> COURSE_MAPPER = (rs, rowNum) -> new CourseRecord(
            rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getString(5), rs.getString(6));

    private final JdbcTemplate jdbcTemplate;

    public CourseJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void upsertAll(List<CourseRecord> courses) {
        courses.forEach(c -> jdbcTemplate.update(
                "MERGE INTO courses(id, subject_id, course_number, title, prerequisites, corequisites) KEY(id) VALUES (?,?,?,?,?,?)",
                c.id(), c.subjectId().trim(), c.courseNumber().trim(), c.title(), c.prerequisites(), c.corequisites()));
    }

    public List<CourseRecord> findAll() {
        return jdbcTemplate.query(
                "SELECT id, subject_id, course_number, title, prerequisites, corequisites FROM courses ORDER BY subject_id, course_number, id",
                COURSE_MAPPER);
    }

    public List<CourseKeyRow> loadCourseKeys() {
        return jdbcTemplate.query(
                "SELECT subject_id, course_number, id FROM courses",
                (rs, rowNum) -> new CourseKeyRow(rs.getString(1), rs.getString(2), rs.getString(3)));
    }

    public record CourseKeyRow(String subjectId, String courseNumber, String id) {}
}

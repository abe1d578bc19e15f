package com.coursegraph.repository;

import com.coursegraph.graph.PrerequisiteGraphModels.CorequisiteEdge;
import com.coursegraph.graph.PrerequisiteGraphModels.PrerequisiteEdge;
import com.coursegraph.graph.PrerequisiteGraphModels.RelationshipType;
import com.coursegraph.parser.GradeRequirement;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Repository
public class PrerequisiteJdbcRepository {
    private static final String EDGE_COLUMNS = "course_id, group_id, group_index, course_position, prerequisite_name, prerequisite_id, "
            + "relationship_type, minimum_grade, can_take_concurrent, resolved, note";

    private static final RowMapper<PrerequisiteEdge> EDGE_MAPPER = (rs, rowNum) -> new PrerequisiteEdge(
            rs.getString(1), rs.getString(2), rs.getInt(3), rs.getInt(4), rs.getString(5), rs.getString(6),
            RelationshipType.valueOf(rs.getString(7)),
            GradeRequirement.fromLabel(rs.getString(8)).orElse(GradeRequirement.DEFAULT),
            rs.getBoolean(9), rs.getBoolean(10), rs.getString(11));

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public PrerequisiteJdbcRepository(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    // one transaction per course: a failed insert leaves the previous edges in place
    public void replaceCourseEdges(String courseId, List<PrerequisiteEdge> edges, List<CorequisiteEdge> corequisites) {
        transactionTemplate.executeWithoutResult(status -> {
            jdbcTemplate.update("DELETE FROM course_prerequisites WHERE course_id = ?", courseId);
            edges.forEach(e -> jdbcTemplate.update(
                    "INSERT INTO course_prerequisites(" + EDGE_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?)",
                    e.courseId(), e.groupId(), e.groupIndex(), e.position(), e.prerequisiteName(), e.prerequisiteId(),
                    e.relationshipType().name(), e.minimumGrade().label(), e.canTakeConcurrent(), e.resolved(), e.note()));
            writeCorequisites(courseId, corequisites);
        });
    }

    public void replaceCorequisites(String courseId, List<CorequisiteEdge> corequisites) {
        transactionTemplate.executeWithoutResult(status -> writeCorequisites(courseId, corequisites));
    }

    private void writeCorequisites(String courseId, List<CorequisiteEdge> corequisites) {
        jdbcTemplate.update("DELETE FROM course_corequisites WHERE course_id = ?", courseId);
        corequisites.forEach(c -> jdbcTemplate.update(
                "INSERT INTO course_corequisites(course_id, corequisite_name, corequisite_id, resolved) VALUES (?,?,?,?)",
                c.courseId(), c.corequisiteName(), c.corequisiteId(), c.resolved()));
    }

    public void deleteAll() {
        jdbcTemplate.update("DELETE FROM course_prerequisites");
        jdbcTemplate.update("DELETE FROM course_corequisites");
    }

    public boolean hasEdges(String courseId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM course_prerequisites WHERE course_id = ?", Integer.class, courseId);
        return count != null && count > 0;
    }

    public List<PrerequisiteEdge> loadEdges(String courseId) {
        return jdbcTemplate.query(
                "SELECT " + EDGE_COLUMNS + " FROM course_prerequisites WHERE course_id = ? ORDER BY group_index, course_position",
                EDGE_MAPPER, courseId);
    }

    public List<PrerequisiteEdge> loadAllEdges() {
        return jdbcTemplate.query(
                "SELECT " + EDGE_COLUMNS + " FROM course_prerequisites ORDER BY course_id, group_index, course_position",
                EDGE_MAPPER);
    }

    public List<CorequisiteEdge> loadCorequisites(String courseId) {
        return jdbcTemplate.query(
                "SELECT course_id, corequisite_name, corequisite_id, resolved FROM course_corequisites WHERE course_id = ? ORDER BY corequisite_name",
                (rs, rowNum) -> new CorequisiteEdge(rs.getString(1), rs.getString(2), rs.getString(3), rs.getBoolean(4)),
                courseId);
    }

    public Map<RelationshipType, Long> countByType() {
        Map<RelationshipType, Long> counts = new EnumMap<>(RelationshipType.class);
        jdbcTemplate.query(
                "SELECT relationship_type, COUNT(*) FROM course_prerequisites GROUP BY relationship_type",
                (RowCallbackHandler) rs -> counts.put(RelationshipType.valueOf(rs.getString(1)), rs.getLong(2)));
        return counts;
    }

    public long countUnresolved() {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM course_prerequisites WHERE resolved = FALSE", Long.class);
        return count == null ? 0 : count;
    }
}

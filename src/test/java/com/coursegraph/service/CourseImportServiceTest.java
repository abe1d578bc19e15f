package com.coursegraph.service;

import com.coursegraph.domain.DomainModels.CourseRecord;
import com.coursegraph.graph.PrerequisiteGraphModels.AndGroup;
import com.coursegraph.graph.PrerequisiteGraphModels.CorequisiteEdge;
import com.coursegraph.graph.PrerequisiteGraphModels.CourseRef;
import com.coursegraph.graph.PrerequisiteGraphModels.EdgeStats;
import com.coursegraph.graph.PrerequisiteGraphModels.RelationshipType;
import com.coursegraph.graph.PrerequisiteGraphService;
import com.coursegraph.parser.GradeRequirement;
import com.coursegraph.service.CourseImportService.ImportFailure;
import com.coursegraph.service.CourseImportService.ImportReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class CourseImportServiceTest {
    static final List<CourseRecord> CATALOGUE = List.of(
            new CourseRecord("c-chem101", "CHEM", "101", "General Chemistry I", "", "MATH 121"),
            new CourseRecord("c-chem102", "CHEM", "102", "General Chemistry II", "CHEM 101 [Min Grade: C]", null),
            new CourseRecord("c-chem201", "CHEM", "201", "Organic Chemistry I",
                    "CHEM 102 [Min Grade: D] and (MATH 121 or MATH 101)", null),
            new CourseRecord("c-chem202", "CHEM", "202", "Organic Chemistry II", "CHEM 201 (Can be taken Concurrently)", null),
            new CourseRecord("c-math121", "MATH", "121", "Calculus I", null, null),
            new CourseRecord("c-bio300", "BIO", "300", "Genetics", "BIO 200 & BIO 201", null));

    @Autowired
    private CourseImportService importService;
    @Autowired
    private PrerequisiteGraphService graphService;
    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanTables() {
        jdbcTemplate.update("DELETE FROM course_prerequisites");
        jdbcTemplate.update("DELETE FROM course_corequisites");
        jdbcTemplate.update("DELETE FROM courses");
        importService.registerCourses(CATALOGUE);
    }

    @Test
    void importsCatalogueAndReportsFailures() {
        ImportReport report = importService.importPrerequisites(false);

        assertFalse(report.dryRun());
        assertEquals(6, report.totalCourses());
        assertEquals(4, report.withPrerequisites());
        assertEquals(3, report.succeeded());
        assertEquals(1, report.failed());
        assertEquals(0, report.skipped());
        assertEquals(1, report.unresolvedReferences());
        assertEquals(75.0, report.successRate(), 0.001);

        ImportFailure failure = report.failures().get(0);
        assertEquals("c-bio300", failure.courseId());
        assertEquals("BIO 300", failure.courseName());
        assertEquals("SYNTAX_ERROR", failure.code());
    }

    @Test
    void storedGroupsUseCatalogueIds() {
        importService.importPrerequisites(false);

        List<AndGroup> groups = graphService.prerequisitesOf("c-chem201").orElseThrow().andGroups();
        assertEquals(2, groups.size());
        assertEquals(List.of(new CourseRef("CHEM 102", "c-chem102", GradeRequirement.D, true)), groups.get(0).courses());
        assertEquals(List.of(
                new CourseRef("MATH 121", "c-math121", GradeRequirement.D, true),
                new CourseRef("MATH 101", "MATH 101", GradeRequirement.D, false)), groups.get(1).courses());

        AndGroup concurrent = graphService.prerequisitesOf("c-chem202").orElseThrow().andGroups().get(0);
        assertTrue(concurrent.canBeTakenConcurrently());
        assertEquals("Can be taken Concurrently", concurrent.note());

        assertEquals(GradeRequirement.C, graphService.prerequisitesOf("c-chem102").orElseThrow()
                .andGroups().get(0).courses().get(0).minimumGrade());
        assertTrue(graphService.prerequisitesOf("c-bio300").isEmpty());
        assertTrue(graphService.prerequisitesOf("c-math121").isEmpty());
    }

    @Test
    void storesCorequisitesEvenWithoutPrerequisites() {
        importService.importPrerequisites(false);

        List<CorequisiteEdge> corequisites = graphService.corequisitesOf("c-chem101");
        assertEquals(List.of(new CorequisiteEdge("c-chem101", "MATH 121", "c-math121", true)), corequisites);
    }

    @Test
    void statsCountEdgesByRelationship() {
        importService.importPrerequisites(false);

        EdgeStats stats = graphService.stats();
        assertEquals(5, stats.total());
        assertEquals(3L, stats.byType().get(RelationshipType.REQUIRED));
        assertEquals(2L, stats.byType().get(RelationshipType.CHOICE));
        assertEquals(1, stats.unresolved());
        assertEquals(List.of("c-chem102", "c-chem201", "c-chem202"), List.copyOf(graphService.export().keySet()));
    }

    @Test
    void dryRunParsesWithoutStoring() {
        ImportReport report = importService.importPrerequisites(true);

        assertTrue(report.dryRun());
        assertEquals(3, report.succeeded());
        assertEquals(3, report.prerequisites().size());
        assertTrue(graphService.export().isEmpty());
        assertTrue(graphService.corequisitesOf("c-chem101").isEmpty());
    }

    @Test
    void reimportReplacesPreviousEdges() {
        importService.importPrerequisites(false);
        importService.registerCourses(List.of(
                new CourseRecord("c-chem102", "CHEM", "102", "General Chemistry II", "CHEM 101 or MATH 121", null)));
        importService.importPrerequisites(false);

        assertEquals(6, graphService.stats().total());
        List<AndGroup> groups = graphService.prerequisitesOf("c-chem102").orElseThrow().andGroups();
        assertEquals(1, groups.size());
        assertEquals(RelationshipType.CHOICE, groups.get(0).relationshipType());
    }

    @Test
    void textThatRepairsToNothingCountsAsEmpty() {
        importService.registerCourses(List.of(
                new CourseRecord("c-chem301", "CHEM", "301", "Physical Chemistry", ") )", "MATH 121")));

        ImportReport dryRun = importService.importPrerequisites(true);
        assertEquals(1, dryRun.empty());
        assertEquals(3, dryRun.succeeded());

        ImportReport report = importService.importPrerequisites(false);
        assertEquals(1, report.empty());
        assertEquals(3, report.succeeded());
        assertEquals(1, report.failed());
        assertEquals(80.0, report.successRate(), 0.001);
        assertTrue(graphService.prerequisitesOf("c-chem301").isEmpty());
        assertEquals(1, graphService.corequisitesOf("c-chem301").size());
        assertEquals(5, graphService.stats().total());
    }

    @Test
    void storesLongHelpText() {
        String note = "x".repeat(1100);
        importService.registerCourses(List.of(
                new CourseRecord("c-math221", "MATH", "221", "Calculus II", "MATH 121 (" + note + ")", null)));

        ImportReport report = importService.importPrerequisites(false);

        assertEquals(4, report.succeeded());
        AndGroup group = graphService.prerequisitesOf("c-math221").orElseThrow().andGroups().get(0);
        assertEquals(note, group.note());
        assertTrue(group.canBeTakenConcurrently());
    }

    @Test
    void storesCorequisitesOfCourseWhosePrerequisitesFailToParse() {
        importService.registerCourses(List.of(
                new CourseRecord("c-bio301", "BIO", "301", "Genomics", "BIO 200 & BIO 201", "MATH 121")));

        ImportReport report = importService.importPrerequisites(false);

        assertEquals(2, report.failed());
        assertTrue(graphService.prerequisitesOf("c-bio301").isEmpty());
        assertEquals(List.of(new CorequisiteEdge("c-bio301", "MATH 121", "c-math121", true)),
                graphService.corequisitesOf("c-bio301"));
    }

    @Test
    void catalogueIdEqualToCourseNameStillCountsAsResolved() {
        importService.registerCourses(List.of(
                new CourseRecord("PHYS 101", "PHYS", "101", "Physics I", null, null),
                new CourseRecord("c-phys102", "PHYS", "102", "Physics II", "PHYS 101", null)));

        ImportReport report = importService.importPrerequisites(false);

        assertEquals(1, report.unresolvedReferences());
        CourseRef ref = graphService.prerequisitesOf("c-phys102").orElseThrow().andGroups().get(0).courses().get(0);
        assertEquals("PHYS 101", ref.id());
        assertTrue(ref.resolved());
        assertEquals(1, graphService.stats().unresolved());
    }

    @Test
    void registerSkipsIncompleteRows() {
        int registered = importService.registerCourses(Arrays.asList(
                new CourseRecord("c-phys101", "PHYS", "101", "Physics I", null, null),
                new CourseRecord("c-broken", " ", "100", "No subject", null, null),
                new CourseRecord(null, "PHYS", "102", "No id", null, null),
                null));
        assertEquals(1, registered);
        assertEquals(7, importService.importPrerequisites(true).totalCourses());
    }
}

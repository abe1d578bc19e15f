package com.coursegraph.api;

import com.coursegraph.domain.DomainModels.CourseRecord;
import com.coursegraph.service.CourseImportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class PrerequisiteControllerTest {
    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private CourseImportService importService;
    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanTables() {
        jdbcTemplate.update("DELETE FROM course_prerequisites");
        jdbcTemplate.update("DELETE FROM course_corequisites");
        jdbcTemplate.update("DELETE FROM courses");
    }

    @Test
    void parseReturnsAndGroups() throws Exception {
        mockMvc.perform(post("/api/prerequisites/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text": "CHEM 102 [Min Grade: C] and (MATH 121 or MATH 101)"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.andGroups", hasSize(2)))
                .andExpect(jsonPath("$.andGroups[0].courses[0].coursename").value("CHEM 102"))
                .andExpect(jsonPath("$.andGroups[0].courses[0].minimum_grade").value("C"))
                .andExpect(jsonPath("$.andGroups[1].courses", hasSize(2)))
                .andExpect(jsonPath("$.andGroups[1].canBeTakenConcurrently").value(false))
                .andExpect(jsonPath("$.courses", hasSize(0)));
    }

    @Test
    void parseWithExplainListsCourses() throws Exception {
        mockMvc.perform(post("/api/prerequisites/parse").param("explain", "true")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"AB 100 or BC 200\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.courses", hasSize(2)))
                .andExpect(jsonPath("$.courses[1].logicalPath[0].operator").value("OR"));
    }

    @Test
    void parseRejectsInvalidText() throws Exception {
        mockMvc.perform(post("/api/prerequisites/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"CHEM 101 & CHEM 102\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.error.code").value("SYNTAX_ERROR"))
                .andExpect(jsonPath("$.error.position").value(9));
    }

    @Test
    void importedPrerequisitesAreServedPerCourse() throws Exception {
        mockMvc.perform(post("/api/courses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                [
                                  {"id": "c-chem101", "subject_id": "CHEM", "course_number": "101", "title": "General Chemistry I"},
                                  {"id": "c-chem102", "subject_id": "CHEM", "course_number": "102", "title": "General Chemistry II",
                                   "prerequisites": "CHEM 101 (Can be taken Concurrently)", "corequisites": "CHEM 101"}
                                ]
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.registered").value(2));

        mockMvc.perform(post("/api/courses/prerequisites/import"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.succeeded").value(1))
                .andExpect(jsonPath("$.failed").value(0));

        mockMvc.perform(get("/api/prerequisites/c-chem102"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.courseId").value("c-chem102"))
                .andExpect(jsonPath("$.andGroups[0].courses[0].id").value("c-chem101"))
                .andExpect(jsonPath("$.andGroups[0].canBeTakenConcurrently").value(true))
                .andExpect(jsonPath("$.andGroups[0].helpertext").value("Can be taken Concurrently"));

        mockMvc.perform(get("/api/courses/c-chem102/corequisites"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].corequisiteId").value("c-chem101"));

        mockMvc.perform(get("/api/prerequisites/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.unresolved").value(0));

        mockMvc.perform(get("/api/prerequisites/export"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['c-chem102']", hasSize(1)));
    }

    @Test
    void unknownCourseIsNotFound() throws Exception {
        importService.registerCourses(List.of(new CourseRecord("c-math121", "MATH", "121", "Calculus I", null, null)));
        mockMvc.perform(get("/api/prerequisites/c-math121"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/prerequisites/does-not-exist"))
                .andExpect(status().isNotFound());
    }
}

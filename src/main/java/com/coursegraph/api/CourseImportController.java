package com.coursegraph.api;

import com.coursegraph.domain.DomainModels.CourseRecord;
import com.coursegraph.graph.PrerequisiteGraphModels.CorequisiteEdge;
import com.coursegraph.graph.PrerequisiteGraphService;
import com.coursegraph.service.CourseImportService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/courses")
public class CourseImportController {
    private final CourseImportService importService;
    private final PrerequisiteGraphService graphService;

    public CourseImportController(CourseImportService importService, PrerequisiteGraphService graphService) {
        this.importService = importService;
        this.graphService = graphService;
    }

    @PostMapping
    public ResponseEntity<RegisterResponse> register(@RequestBody List<CourseRecord> rows) {
        return ResponseEntity.ok(new RegisterResponse(importService.registerCourses(rows)));
    }

    @PostMapping("/prerequisites/import")
    public ResponseEntity<CourseImportService.ImportReport> importPrerequisites(@RequestParam(defaultValue = "false") boolean dryRun) {
        return ResponseEntity.ok(importService.importPrerequisites(dryRun));
    }

    @GetMapping("/{courseId}/corequisites")
    public ResponseEntity<List<CorequisiteEdge>> corequisites(@PathVariable String courseId) {
        return ResponseEntity.ok(graphService.corequisitesOf(courseId));
    }

    public record RegisterResponse(int registered) {}
}

package com.coursegraph.api;

import com.coursegraph.graph.PrerequisiteGraphModels.AndGroup;
import com.coursegraph.graph.PrerequisiteGraphModels.CoursePrerequisites;
import com.coursegraph.graph.PrerequisiteGraphModels.EdgeStats;
import com.coursegraph.graph.PrerequisiteGraphService;
import com.coursegraph.service.PrerequisiteParsingService;
import com.coursegraph.service.PrerequisiteParsingService.ParseOutcome;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/prerequisites")
public class PrerequisiteController {
    private final PrerequisiteParsingService parsingService;
    private final PrerequisiteGraphService graphService;

    public PrerequisiteController(PrerequisiteParsingService parsingService, PrerequisiteGraphService graphService) {
        this.parsingService = parsingService;
        this.graphService = graphService;
    }

    @PostMapping("/parse")
    public ResponseEntity<ParseOutcome> parse(@RequestBody ParseRequest request,
                                              @RequestParam(defaultValue = "false") boolean explain) {
        String text = request == null ? null : request.text();
        ParseOutcome outcome = explain ? parsingService.explain(text) : parsingService.parsePrerequisites(text);
        return outcome.valid() ? ResponseEntity.ok(outcome) : ResponseEntity.unprocessableEntity().body(outcome);
    }

    @GetMapping("/export")
    public ResponseEntity<Map<String, List<AndGroup>>> export() {
        return ResponseEntity.ok(graphService.export());
    }

    @GetMapping("/stats")
    public ResponseEntity<EdgeStats> stats() {
        return ResponseEntity.ok(graphService.stats());
    }

    @GetMapping("/{courseId}")
    public ResponseEntity<CoursePrerequisites> prerequisites(@PathVariable String courseId) {
        return graphService.prerequisitesOf(courseId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    public record ParseRequest(@JsonProperty("text") String text) {}
}

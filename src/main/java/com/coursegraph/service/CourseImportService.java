package com.coursegraph.service;

import com.coursegraph.domain.DomainModels.CourseRecord;
import com.coursegraph.graph.PrerequisiteGraphModels.AndGroup;
import com.coursegraph.graph.PrerequisiteGraphModels.CorequisiteEdge;
import com.coursegraph.graph.PrerequisiteGraphModels.CoursePrerequisites;
import com.coursegraph.graph.PrerequisiteGraphService;
import com.coursegraph.parser.CorequisiteParser;
import com.coursegraph.repository.CourseJdbcRepository;
import com.coursegraph.service.PrerequisiteParsingService.ParseError;
import com.coursegraph.service.PrerequisiteParsingService.ParseOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

@Service
public class CourseImportService {
    private static final Logger log = LoggerFactory.getLogger(CourseImportService.class);

    private final CourseJdbcRepository courseRepository;
    private final PrerequisiteParsingService parsingService;
    private final CorequisiteParser corequisiteParser;
    private final CourseIdResolver idResolver;
    private final PrerequisiteGraphService graphService;
    private final int parallelism;
    private final boolean clearExisting;

    public CourseImportService(CourseJdbcRepository courseRepository,
                               PrerequisiteParsingService parsingService,
                               CorequisiteParser corequisiteParser,
                               CourseIdResolver idResolver,
                               PrerequisiteGraphService graphService,
                               @Value("${prerequisites.import.parallelism:4}") int parallelism,
                               @Value("${prerequisites.import.clear-existing:true}") boolean clearExisting) {
        this.courseRepository = courseRepository;
        this.parsingService = parsingService;
        this.corequisiteParser = corequisiteParser;
        this.idResolver = idResolver;
        this.graphService = graphService;
        this.parallelism = Math.max(1, parallelism);
        this.clearExisting = clearExisting;
    }

    public int registerCourses(List<CourseRecord> rows) {
        if (rows == null) return 0;
        List<CourseRecord> accepted = rows.stream()
                .filter(Objects::nonNull)
                .filter(r -> !isBlank(r.id()) && !isBlank(r.subjectId()) && !isBlank(r.courseNumber()))
                .toList();
        if (accepted.size() < rows.size()) {
            log.warn("Skipped {} course rows without id, subject or number", rows.size() - accepted.size());
        }
        courseRepository.upsertAll(accepted);
        return accepted.size();
    }

    public ImportReport importPrerequisites(boolean dryRun) {
        List<CourseRecord> courses = courseRepository.findAll();
        List<CourseRecord> withPrerequisites = courses.stream().filter(CourseRecord::hasPrerequisites).toList();
        log.info("Found {} of {} courses with prerequisites", withPrerequisites.size(), courses.size());

        List<ParseOutcome> outcomes = parseAll(withPrerequisites);
        CourseIdResolver.Lookup lookup = idResolver.snapshot();

        if (!dryRun && clearExisting) {
            graphService.clear();
        }

        List<CoursePrerequisites> imported = new ArrayList<>();
        List<ImportFailure> failures = new ArrayList<>();
        int skipped = 0;
        int empty = 0;
        int unresolved = 0;

        for (int i = 0; i < withPrerequisites.size(); i++) {
            CourseRecord course = withPrerequisites.get(i);
            ParseOutcome outcome = outcomes.get(i);

            if (!outcome.valid()) {
                ParseError error = outcome.error();
                failures.add(new ImportFailure(course.id(), course.displayName(), course.prerequisites(), error.code(), error.message()));
                log.warn("Parse failed for {} ({}): {}", course.displayName(), course.id(), error.message());
                if (!dryRun) storeCorequisites(course, lookup, failures);
                continue;
            }

            if (outcome.andGroups().isEmpty()) {
                log.warn("Prerequisites of {} ({}) are empty after repair: '{}'", course.displayName(), course.id(), course.prerequisites());
                empty++;
                if (!dryRun) storeCorequisites(course, lookup, failures);
                continue;
            }

            List<AndGroup> groups = lookup.resolveIds(outcome.andGroups());
            unresolved += (int) groups.stream().flatMap(g -> g.courses().stream()).filter(ref -> !ref.resolved()).count();

            if (!dryRun) {
                if (!clearExisting && graphService.hasPrerequisites(course.id())) {
                    log.info("Keeping existing prerequisites of {}", course.displayName());
                    skipped++;
                    continue;
                }
                try {
                    graphService.replace(course.id(), groups, corequisites(course, lookup));
                } catch (DataAccessException e) {
                    failures.add(storageFailure(course, e));
                    continue;
                }
            }
            imported.add(new CoursePrerequisites(course.id(), groups));
            log.debug("Parsed {}: {} AND group(s)", course.displayName(), groups.size());
        }

        if (!dryRun) {
            courses.stream()
                    .filter(c -> !c.hasPrerequisites() && c.hasCorequisites())
                    .forEach(c -> storeCorequisites(c, lookup, failures));
        }

        ImportReport report = new ImportReport(dryRun, courses.size(), withPrerequisites.size(),
                imported.size(), failures.size(), skipped, empty, unresolved,
                successRate(imported.size() + skipped + empty, withPrerequisites.size()), imported, failures);
        log.info("Prerequisite import finished: {} parsed, {} failed, {} skipped, {} empty, {} unresolved references, success rate {}%",
                report.succeeded(), report.failed(), report.skipped(), report.empty(), report.unresolvedReferences(),
                String.format("%.1f", report.successRate()));
        return report;
    }

    private List<ParseOutcome> parseAll(List<CourseRecord> courses) {
        if (courses.isEmpty()) return List.of();

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, courses.size()),
                new ParseWorkerThreadFactory("prereq-parse"));
        try {
            List<Future<ParseOutcome>> futures = courses.stream()
                    .map(c -> pool.submit(() -> parseOne(c)))
                    .toList();

            List<ParseOutcome> outcomes = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), courses.get(i)));
            }
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }

    private ParseOutcome parseOne(CourseRecord course) {
        MDC.put("courseId", course.id());
        try {
            return parsingService.parsePrerequisites(course.prerequisites());
        } finally {
            MDC.remove("courseId");
        }
    }

    private ParseOutcome await(Future<ParseOutcome> future, CourseRecord course) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Prerequisite import interrupted", e);
        } catch (ExecutionException e) {
            log.error("Unexpected failure parsing {} ({})", course.displayName(), course.id(), e.getCause());
            String message = e.getCause() == null ? e.getMessage() : e.getCause().getMessage();
            return new ParseOutcome(false, course.prerequisites(), course.prerequisites(), List.of(), List.of(), List.of(),
                    new ParseError("INTERNAL_ERROR", message, course.prerequisites(), -1));
        }
    }

    private void storeCorequisites(CourseRecord course, CourseIdResolver.Lookup lookup, List<ImportFailure> failures) {
        if (!course.hasCorequisites()) return;
        try {
            graphService.replaceCorequisites(course.id(), corequisites(course, lookup));
        } catch (DataAccessException e) {
            failures.add(storageFailure(course, e));
        }
    }

    private ImportFailure storageFailure(CourseRecord course, DataAccessException e) {
        String message = e.getMostSpecificCause().getMessage();
        log.warn("Could not store prerequisites of {} ({}): {}", course.displayName(), course.id(), message);
        return new ImportFailure(course.id(), course.displayName(), course.prerequisites(), "STORAGE_ERROR", message);
    }

    private List<CorequisiteEdge> corequisites(CourseRecord course, CourseIdResolver.Lookup lookup) {
        return corequisiteParser.parse(course.corequisites()).stream()
                .map(code -> {
                    Optional<String> id = lookup.resolve(code.displayName());
                    return new CorequisiteEdge(course.id(), code.displayName(), id.orElse(code.displayName()), id.isPresent());
                })
                .toList();
    }

    private static double successRate(int succeeded, int total) {
        return total == 0 ? 100.0 : succeeded * 100.0 / total;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record ImportFailure(String courseId, String courseName, String prerequisites, String code, String message) {}

    public record ImportReport(boolean dryRun,
                               int totalCourses,
                               int withPrerequisites,
                               int succeeded,
                               int failed,
                               int skipped,
                               int empty,
                               int unresolvedReferences,
                               double successRate,
                               List<CoursePrerequisites> prerequisites,
                               List<ImportFailure> failures) {}
}

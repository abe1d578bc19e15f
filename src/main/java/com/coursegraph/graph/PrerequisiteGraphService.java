package com.coursegraph.graph;

import com.coursegraph.graph.PrerequisiteGraphModels.*;
import com.coursegraph.repository.PrerequisiteJdbcRepository;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

@Service
public class PrerequisiteGraphService {
    private final PrerequisiteJdbcRepository repository;

    public PrerequisiteGraphService(PrerequisiteJdbcRepository repository) {
        this.repository = repository;
    }

    public List<PrerequisiteEdge> toEdges(String courseId, List<AndGroup> groups) {
        List<PrerequisiteEdge> edges = new ArrayList<>();
        for (int g = 0; g < groups.size(); g++) {
            AndGroup group = groups.get(g);
            String groupId = "g" + (g + 1);
            for (int i = 0; i < group.courses().size(); i++) {
                CourseRef ref = group.courses().get(i);
                edges.add(new PrerequisiteEdge(courseId, groupId, g, i, ref.name(), ref.id(),
                        group.relationshipType(), ref.minimumGrade(), group.canBeTakenConcurrently(),
                        ref.resolved(), group.note()));
            }
        }
        return edges;
    }

    public void replace(String courseId, List<AndGroup> groups, List<CorequisiteEdge> corequisites) {
        repository.replaceCourseEdges(courseId, toEdges(courseId, groups), corequisites);
    }

    public void replaceCorequisites(String courseId, List<CorequisiteEdge> corequisites) {
        repository.replaceCorequisites(courseId, corequisites);
    }

    public void clear() {
        repository.deleteAll();
    }

    public boolean hasPrerequisites(String courseId) {
        return repository.hasEdges(courseId);
    }

    public Optional<CoursePrerequisites> prerequisitesOf(String courseId) {
        List<PrerequisiteEdge> edges = repository.loadEdges(courseId);
        if (edges.isEmpty()) return Optional.empty();
        return Optional.of(new CoursePrerequisites(courseId, toGroups(edges)));
    }

    public List<CorequisiteEdge> corequisitesOf(String courseId) {
        return repository.loadCorequisites(courseId);
    }

    public Map<String, List<AndGroup>> export() {
        Map<String, List<PrerequisiteEdge>> byCourse = repository.loadAllEdges().stream()
                .collect(Collectors.groupingBy(PrerequisiteEdge::courseId, LinkedHashMap::new, Collectors.toList()));

        Map<String, List<AndGroup>> adjacency = new LinkedHashMap<>();
        byCourse.forEach((courseId, edges) -> adjacency.put(courseId, toGroups(edges)));
        return adjacency;
    }

    public EdgeStats stats() {
        Map<RelationshipType, Long> byType = repository.countByType();
        long total = byType.values().stream().mapToLong(Long::longValue).sum();
        return new EdgeStats(total, byType, repository.countUnresolved());
    }

    private List<AndGroup> toGroups(List<PrerequisiteEdge> edges) {
        Map<Integer, List<PrerequisiteEdge>> byGroup = edges.stream()
                .sorted(Comparator.comparingInt(PrerequisiteEdge::groupIndex).thenComparingInt(PrerequisiteEdge::position))
                .collect(Collectors.groupingBy(PrerequisiteEdge::groupIndex, TreeMap::new, Collectors.toList()));

        return byGroup.values().stream()
                .map(groupEdges -> new AndGroup(
                        groupEdges.stream().map(e -> new CourseRef(e.prerequisiteName(), e.prerequisiteId(), e.minimumGrade(), e.resolved())).toList(),
                        groupEdges.get(0).canTakeConcurrent(),
                        groupEdges.get(0).note()))
                .toList();
    }
}

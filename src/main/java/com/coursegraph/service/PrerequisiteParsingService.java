package com.coursegraph.service;

import com.coursegraph.graph.PrerequisiteGraphModels.AndGroup;
import com.coursegraph.graph.PrerequisiteNormalizer;
import com.coursegraph.parser.CourseExtractor;
import com.coursegraph.parser.CourseExtractor.ExtractedCourse;
import com.coursegraph.parser.PrerequisiteAst.Expression;
import com.coursegraph.parser.PrerequisiteAstBuilder;
import com.coursegraph.parser.PrerequisiteGrammarParser;
import com.coursegraph.parser.PrerequisitePreprocessor;
import com.coursegraph.parser.PrerequisitePreprocessor.Repair;
import com.coursegraph.parser.PrerequisitePreprocessor.RepairResult;
import com.coursegraph.parser.PrerequisiteSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class PrerequisiteParsingService {
    private static final Logger log = LoggerFactory.getLogger(PrerequisiteParsingService.class);

    private final PrerequisitePreprocessor preprocessor;
    private final PrerequisiteGrammarParser grammarParser;
    private final PrerequisiteAstBuilder astBuilder;
    private final PrerequisiteNormalizer normalizer;
    private final CourseExtractor courseExtractor;

    public PrerequisiteParsingService(PrerequisitePreprocessor preprocessor,
                                      PrerequisiteGrammarParser grammarParser,
                                      PrerequisiteAstBuilder astBuilder,
                                      PrerequisiteNormalizer normalizer,
                                      CourseExtractor courseExtractor) {
        this.preprocessor = preprocessor;
        this.grammarParser = grammarParser;
        this.astBuilder = astBuilder;
        this.normalizer = normalizer;
        this.courseExtractor = courseExtractor;
    }

    public ParseOutcome parsePrerequisites(String rawText) {
        return parse(rawText, false);
    }

    public ParseOutcome explain(String rawText) {
        return parse(rawText, true);
    }

    public Expression parseExpression(String rawText) {
        return astBuilder.build(grammarParser.parse(preprocessor.repair(rawText)));
    }

    private ParseOutcome parse(String rawText, boolean withCourses) {
        String source = rawText == null ? "" : rawText;
        RepairResult repaired = preprocessor.preprocess(source);
        if (repaired.text().isEmpty()) {
            return new ParseOutcome(true, source, "", List.of(), repaired.repairs(), List.of(), null);
        }

        try {
            Expression expression = astBuilder.build(grammarParser.parse(repaired.text()));
            List<AndGroup> groups = normalizer.normalize(expression);
            List<ExtractedCourse> courses = withCourses ? courseExtractor.extract(expression) : List.of();
            return new ParseOutcome(true, source, repaired.text(), groups, repaired.repairs(), courses, null);
        } catch (PrerequisiteSyntaxException e) {
            log.warn("Prerequisite text rejected: {}", e.getMessage());
            ParseError error = new ParseError("SYNTAX_ERROR", e.diagnostic(), e.text(), e.position());
            return new ParseOutcome(false, source, repaired.text(), List.of(), repaired.repairs(), List.of(), error);
        }
    }

    public record ParseError(String code, String message, String text, int position) {}

    public record ParseOutcome(boolean valid,
                               String source,
                               String cleaned,
                               List<AndGroup> andGroups,
                               List<Repair> repairs,
                               List<ExtractedCourse> courses,
                               ParseError error) {}
}

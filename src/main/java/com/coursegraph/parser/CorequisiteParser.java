package com.coursegraph.parser;

import com.coursegraph.parser.PrerequisiteAst.CourseCode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class CorequisiteParser {
    private static final Pattern COURSE = Pattern.compile("([A-Z]{2,5})\\s+([A-Z0-9]+)");

    public List<CourseCode> parse(String text) {
        if (text == null || text.isBlank()) return List.of();

        List<CourseCode> courses = new ArrayList<>();
        Arrays.stream(text.split(",")).map(String::trim).filter(s -> !s.isEmpty()).forEach(segment -> {
            Matcher m = COURSE.matcher(segment);
            if (m.lookingAt()) {
                courses.add(new CourseCode(m.group(1), m.group(2)));
            }
        });
        return List.copyOf(courses);
    }
}

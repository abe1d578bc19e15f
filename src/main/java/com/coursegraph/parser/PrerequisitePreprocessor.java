package com.coursegraph.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class PrerequisitePreprocessor {
    private static final Logger log = LoggerFactory.getLogger(PrerequisitePreprocessor.class);

    // Unicode-aware so scraped text with no-break spaces collapses to plain ones
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    // "APPH50 P": a course number whose trailing character got split off by whitespace
    private static final Pattern SPLIT_COURSE_CODE = Pattern.compile("\\b([A-Z]+)(\\d+)\\s+([A-Z0-9])\\b");
    private static final int MAX_PLAIN_SUBJECT_LENGTH = 4;

    public String repair(String text) {
        return preprocess(text).text();
    }

    public RepairResult preprocess(String text) {
        String source = text == null ? "" : text;
        List<Repair> repairs = new ArrayList<>();

        String cleaned = collapseWhitespace(source);
        cleaned = fixUnbalancedParentheses(cleaned, repairs);
        // a fix can bring a letter run next to a separated character, so repeat until nothing matches
        String previous;
        do {
            previous = cleaned;
            cleaned = fixCourseCodes(cleaned, repairs);
        } while (!cleaned.equals(previous));
        cleaned = collapseWhitespace(cleaned);

        repairs.forEach(r -> log.warn("Prerequisite text repaired ({}): '{}' -> '{}'", r.kind(), r.before(), r.after()));
        if (!cleaned.equals(source)) {
            log.debug("Prerequisite text cleaned: '{}' -> '{}'", source, cleaned);
        }
        return new RepairResult(source, cleaned, List.copyOf(repairs));
    }

    private static String collapseWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    private String fixCourseCodes(String text, List<Repair> repairs) {
        Matcher matcher = SPLIT_COURSE_CODE.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String letters = matcher.group(1);
            String digits = matcher.group(2);
            String suffix = matcher.group(3);

            String fixed;
            if (letters.length() <= MAX_PLAIN_SUBJECT_LENGTH) {
                fixed = letters + " " + digits + suffix;
            } else {
                // TODO: review this branch against real catalogue data; dropping as many trailing subject
                //  characters as the number has digits is a guess with no known-good catalogue entries behind it.
                String subject = letters.substring(0, Math.max(0, letters.length() - digits.length()));
                fixed = subject + " " + digits + suffix;
            }
            repairs.add(new Repair(RepairKind.COURSE_CODE, matcher.group(0), fixed));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(fixed));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private String fixUnbalancedParentheses(String text, List<Repair> repairs) {
        StringBuilder sb = new StringBuilder(text.length());
        int open = 0;
        int dropped = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                open++;
            } else if (c == ')') {
                if (open == 0) {
                    dropped++;
                    continue;
                }
                open--;
            }
            sb.append(c);
        }
        if (dropped > 0) {
            repairs.add(new Repair(RepairKind.EXCESS_CLOSING_PARENTHESIS, text, "removed " + dropped + " ')'"));
        }
        if (open > 0) {
            sb.append(")".repeat(open));
            repairs.add(new Repair(RepairKind.UNCLOSED_OPENING_PARENTHESIS, text, "appended " + open + " ')'"));
        }
        return sb.toString();
    }

    public enum RepairKind { COURSE_CODE, EXCESS_CLOSING_PARENTHESIS, UNCLOSED_OPENING_PARENTHESIS }

    public record Repair(RepairKind kind, String before, String after) {}

    public record RepairResult(String source, String text, List<Repair> repairs) {
        public boolean changed() {
            return !source.equals(text);
        }
    }
}

package com.taskforest.core.extract;

import com.taskforest.core.index.InstructionNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the sub-task instructions a parent declared out of its raw text.
 * <p>
 * Patterns from {@link ExtractionPattern} run one after another over the same text.
 * Whatever a pattern matches is blanked out before the next one runs, so a bullet
 * inside a {@code <new_task>} message or a numbered line inside a code fence is
 * never counted twice. Results come back grouped by pattern priority and, within
 * a pattern, in source order.
 */
public class SubInstructionExtractor {

    private static final Logger log = LoggerFactory.getLogger(SubInstructionExtractor.class);

    public static final int DEFAULT_MIN_INSTRUCTION_LENGTH = 5;

    private static final Pattern NEW_TASK_BLOCK = Pattern.compile(
            "<\\s*new_task\\b[^>]*>(.*?)<\\s*/\\s*new_task\\s*>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern MESSAGE_TAG = Pattern.compile(
            "<\\s*message\\s*>(.*?)<\\s*/\\s*message\\s*>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern NEW_TASK_BRACKET = Pattern.compile(
            "\\[new_task in ([^:\\]]+):\\s*['\"](.+?)['\"]\\]",
            Pattern.DOTALL);
    private static final Pattern FENCE = Pattern.compile(
            "^[ \\t]*```[ \\t]*([A-Za-z0-9_+#.\\-]*)[^\\n]*\\n(.*?)^[ \\t]*```[ \\t]*$",
            Pattern.MULTILINE | Pattern.DOTALL);
    private static final Pattern BULLET = Pattern.compile(
            "^[ \\t]*[-*+][ \\t]+(.+?)[ \\t]*$", Pattern.MULTILINE);
    private static final Pattern NUMBERED = Pattern.compile(
            "^[ \\t]*\\d{1,3}[.)][ \\t]+(.+?)[ \\t]*$", Pattern.MULTILINE);
    private static final Pattern HEADING = Pattern.compile(
            "^[ \\t]{0,3}#{1,6}[ \\t]+(.+?)[ \\t#]*$", Pattern.MULTILINE);
    private static final Pattern BLOCK_QUOTE = Pattern.compile(
            "^[ \\t]*>[ \\t]?(.+?)[ \\t]*$", Pattern.MULTILINE);
    private static final Pattern INNER_TAG = Pattern.compile("<[^>]+>");

    private final int minInstructionLength;

    public SubInstructionExtractor() {
        this(DEFAULT_MIN_INSTRUCTION_LENGTH);
    }

    public SubInstructionExtractor(int minInstructionLength) {
        this.minInstructionLength = Math.max(1, minInstructionLength);
    }

    /**
     * Extracts declared instructions from one task's text.
     *
     * @param text arbitrary text from a parent task (nullable)
     * @return trimmed instructions in priority-then-source order; empty when nothing is structured
     */
    public List<String> extract(String text) {
        return extractDetailed(text).stream().map(Extraction::instruction).toList();
    }

    /**
     * Same as {@link #extract(String)} but keeps the pattern and source offset of each hit.
     */
    public List<Extraction> extractDetailed(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        var working = new StringBuilder(InstructionNormalizer.decodeEntities(text));
        var results = new ArrayList<Extraction>();

        collectSpawnDelimiters(working, results);
        collectFencedCode(working, results);
        collectLines(working, BULLET, ExtractionPattern.BULLET, results);
        collectLines(working, NUMBERED, ExtractionPattern.NUMBERED, results);
        collectLines(working, HEADING, ExtractionPattern.HEADING, results);
        collectLines(working, BLOCK_QUOTE, ExtractionPattern.BLOCK_QUOTE, results);

        if (results.isEmpty()) {
            log.debug("No structured sub-instructions in {} chars of text", text.length());
        } else {
            log.debug("Extracted {} sub-instruction(s)", results.size());
        }
        return results;
    }

    /**
     * One extracted instruction.
     *
     * @param pattern     the pattern that produced it
     * @param offset      start of the match in the (entity-decoded) text
     * @param instruction trimmed instruction text
     */
    public record Extraction(ExtractionPattern pattern, int offset, String instruction) {}

    private void collectSpawnDelimiters(StringBuilder working, List<Extraction> out) {
        var hits = new ArrayList<Extraction>();
        var source = working.toString();

        Matcher block = NEW_TASK_BLOCK.matcher(source);
        var consumed = new ArrayList<int[]>();
        while (block.find()) {
            consumed.add(new int[]{block.start(), block.end()});
            Matcher message = MESSAGE_TAG.matcher(block.group(1));
            if (message.find()) {
                String body = INNER_TAG.matcher(message.group(1)).replaceAll(" ");
                accept(ExtractionPattern.SPAWN_DELIMITER, block.start(), body, hits);
            } else {
                log.debug("new_task block at offset {} has no message body", block.start());
            }
        }

        Matcher bracket = NEW_TASK_BRACKET.matcher(source);
        while (bracket.find()) {
            if (overlaps(consumed, bracket.start(), bracket.end())) {
                continue;
            }
            consumed.add(new int[]{bracket.start(), bracket.end()});
            accept(ExtractionPattern.SPAWN_DELIMITER, bracket.start(),
                    InstructionNormalizer.unescapeJson(bracket.group(2)), hits);
        }

        hits.sort((a, b) -> Integer.compare(a.offset(), b.offset()));
        out.addAll(hits);
        consumed.forEach(range -> mask(working, range[0], range[1]));
    }

    private void collectFencedCode(StringBuilder working, List<Extraction> out) {
        Matcher fence = FENCE.matcher(working.toString());
        var consumed = new ArrayList<int[]>();
        while (fence.find()) {
            consumed.add(new int[]{fence.start(), fence.end()});
            String language = fence.group(1);
            String code = fence.group(2).strip();
            // Untagged fences are still claimed so their lines are not read as bullets.
            if (!language.isEmpty() && !code.isEmpty()) {
                accept(ExtractionPattern.FENCED_CODE, fence.start(), language + ": " + code, out);
            }
        }
        consumed.forEach(range -> mask(working, range[0], range[1]));
    }

    private void collectLines(StringBuilder working, Pattern pattern, ExtractionPattern kind,
                              List<Extraction> out) {
        Matcher line = pattern.matcher(working.toString());
        var consumed = new ArrayList<int[]>();
        while (line.find()) {
            consumed.add(new int[]{line.start(), line.end()});
            accept(kind, line.start(), line.group(1), out);
        }
        consumed.forEach(range -> mask(working, range[0], range[1]));
    }

    private void accept(ExtractionPattern kind, int offset, String raw, List<Extraction> out) {
        String instruction = raw == null ? "" : raw.strip();
        if (instruction.length() < minInstructionLength) {
            return;
        }
        out.add(new Extraction(kind, offset, instruction));
    }

    private static boolean overlaps(List<int[]> ranges, int start, int end) {
        for (int[] r : ranges) {
            if (start < r[1] && end > r[0]) return true;
        }
        return false;
    }

    /** Blanks a region while keeping line breaks, so line-anchored patterns still line up. */
    private static void mask(StringBuilder working, int start, int end) {
        for (int i = start; i < end; i++) {
            if (working.charAt(i) != '\n') {
                working.setCharAt(i, ' ');
            }
        }
    }
}

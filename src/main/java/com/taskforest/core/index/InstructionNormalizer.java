package com.taskforest.core.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical form shared by indexing and querying. Both sides must go through the
 * same instance settings or prefix lookups silently miss.
 * <p>
 * Steps, in order: byte-order mark, JSON escapes, HTML entities, delegation tag
 * unwrapping, remaining tag removal, control characters, case folding,
 * whitespace collapse, word-boundary truncation.
 */
public class InstructionNormalizer {

    public static final int DEFAULT_MAX_LENGTH = 192;

    private static final Pattern ENTITY = Pattern.compile("&(#[0-9]{1,7}|#[xX][0-9a-fA-F]{1,6}|[a-zA-Z]{2,8});");
    private static final Pattern DELEGATION = Pattern.compile(
            "<\\s*new_task\\b[^>]*>.*?<\\s*message\\s*>(.*?)<\\s*/\\s*message\\s*>.*?<\\s*/\\s*new_task\\s*>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern TAG = Pattern.compile("</?[A-Za-z_][A-Za-z0-9_:\\-]*[^<>]*>");
    private static final Pattern UNSAFE = Pattern.compile("[\\p{Cc}\\p{Cf}\\p{Co}\\p{Cn}]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final Map<String, String> NAMED_ENTITIES = Map.ofEntries(
            Map.entry("amp", "&"),
            Map.entry("lt", "<"),
            Map.entry("gt", ">"),
            Map.entry("quot", "\""),
            Map.entry("apos", "'"),
            Map.entry("nbsp", " "),
            Map.entry("ndash", "-"),
            Map.entry("mdash", "-"),
            Map.entry("hellip", "..."),
            Map.entry("lsquo", "'"),
            Map.entry("rsquo", "'"),
            Map.entry("ldquo", "\""),
            Map.entry("rdquo", "\""));

    private final int maxLength;

    public InstructionNormalizer() {
        this(DEFAULT_MAX_LENGTH);
    }

    public InstructionNormalizer(int maxLength) {
        if (maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be positive, got " + maxLength);
        }
        this.maxLength = maxLength;
    }

    public int maxLength() {
        return maxLength;
    }

    public String normalize(String text) {
        return normalize(text, maxLength);
    }

    /**
     * @param text      raw instruction text (nullable)
     * @param maxLength upper bound on the result length
     * @return the normalized form, possibly empty, never null
     */
    public String normalize(String text, int maxLength) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String s = text.replace("\uFEFF", "");
        s = unescapeJson(s);
        s = decodeEntities(s);
        s = DELEGATION.matcher(s).replaceAll(m -> Matcher.quoteReplacement(" " + m.group(1) + " "));
        s = TAG.matcher(s).replaceAll(" ");
        s = UNSAFE.matcher(s).replaceAll(" ");
        s = s.toLowerCase(Locale.ROOT);
        s = WHITESPACE.matcher(s).replaceAll(" ").strip();
        return truncate(s, maxLength);
    }

    /**
     * Splits already-normalized text into word tokens (letters and digits only).
     */
    public static List<String> tokens(String normalized) {
        var out = new ArrayList<String>();
        if (normalized == null || normalized.isEmpty()) {
            return out;
        }
        for (String t : TOKEN_SPLIT.split(normalized)) {
            if (!t.isEmpty()) {
                out.add(t);
            }
        }
        return out;
    }

    static String truncate(String s, int maxLength) {
        if (s.length() <= maxLength) {
            return s;
        }
        if (s.charAt(maxLength) == ' ') {
            return s.substring(0, maxLength).strip();
        }
        String cut = s.substring(0, maxLength);
        int lastSpace = cut.lastIndexOf(' ');
        // a single word longer than the limit gets a hard cut
        return lastSpace > 0 ? cut.substring(0, lastSpace).strip() : cut;
    }

    /** Undoes JSON string escapes; control escapes become a space. */
    public static String unescapeJson(String s) {
        if (s.indexOf('\\') < 0) {
            return s;
        }
        var sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != '\\' || i + 1 >= s.length()) {
                sb.append(c);
                continue;
            }
            char next = s.charAt(i + 1);
            switch (next) {
                case 'n', 'r', 't', 'f', 'b' -> { sb.append(' '); i++; }
                case '"', '\'', '/', '\\' -> { sb.append(next); i++; }
                case 'u' -> {
                    if (isHex(s, i + 2, i + 6)) {
                        sb.append((char) Integer.parseInt(s.substring(i + 2, i + 6), 16));
                        i += 5;
                    } else {
                        sb.append(c);
                    }
                }
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /** Decodes named and numeric HTML entities, leaving unknown ones as written. */
    public static String decodeEntities(String s) {
        if (s.indexOf('&') < 0) {
            return s;
        }
        Matcher m = ENTITY.matcher(s);
        var sb = new StringBuilder(s.length());
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(decodeEntity(m.group(1), m.group())));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String decodeEntity(String body, String original) {
        try {
            if (body.startsWith("#x") || body.startsWith("#X")) {
                return new String(Character.toChars(Integer.parseInt(body.substring(2), 16)));
            }
            if (body.startsWith("#")) {
                return new String(Character.toChars(Integer.parseInt(body.substring(1))));
            }
        } catch (IllegalArgumentException e) {
            // out-of-range code point: leave the entity as written
            return original;
        }
        return NAMED_ENTITIES.getOrDefault(body.toLowerCase(Locale.ROOT), original);
    }

    private static boolean isHex(String s, int from, int to) {
        if (to > s.length()) {
            return false;
        }
        for (int i = from; i < to; i++) {
            if (Character.digit(s.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}

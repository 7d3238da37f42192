package com.citation.resolution.bibtex;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text-level helpers for single BibTeX entries and whole {@code .bib} documents.
 * No full BibTeX grammar is implemented; entries are located by their
 * {@code @type{key,} header and balanced braces.
 */
public final class BibtexEntries {

    private static final Pattern ENTRY_HEADER = Pattern.compile("(@\\w+\\s*\\{)\\s*([^,\\s]+)\\s*,");
    private static final Pattern BLOCK_START = Pattern.compile("(?m)^\\s*@(\\w+)\\s*[{(]");

    private BibtexEntries() {
        // utility class
    }

    /**
     * Extracts the citation key of the first entry in the text.
     */
    public static Optional<String> extractKey(String bibtex) {
        if (bibtex == null) {
            return Optional.empty();
        }
        Matcher matcher = ENTRY_HEADER.matcher(bibtex);
        return matcher.find() ? Optional.of(matcher.group(2)) : Optional.empty();
    }

    /**
     * Replaces the citation key of the first entry with {@code newKey}.
     */
    public static String replaceKey(String bibtex, String newKey) {
        Matcher matcher = ENTRY_HEADER.matcher(bibtex);
        if (!matcher.find()) {
            return bibtex;
        }
        return bibtex.substring(0, matcher.start())
                + matcher.group(1) + newKey + ","
                + bibtex.substring(matcher.end());
    }

    /**
     * Extracts field values from an entry. Handles both {@code "quoted"} and
     * {@code {braced}} values; field names match case-insensitively.
     *
     * @return field name to trimmed value, for each requested field that is present
     */
    public static Map<String, String> extractFields(String bibtex, String... fieldNames) {
        Map<String, String> result = new LinkedHashMap<>();
        if (bibtex == null) {
            return result;
        }
        for (String field : fieldNames) {
            Pattern pattern = Pattern.compile(
                    "^\\s*" + Pattern.quote(field) + "\\s*=\\s*(?:\"([^\"]+)\"|\\{([^}]+)\\})",
                    Pattern.MULTILINE | Pattern.CASE_INSENSITIVE);
            Matcher matcher = pattern.matcher(bibtex);
            if (matcher.find()) {
                String value = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
                result.put(field, value.trim());
            }
        }
        return result;
    }

    /**
     * Extracts a single field value.
     */
    public static Optional<String> extractField(String bibtex, String fieldName) {
        return Optional.ofNullable(extractFields(bibtex, fieldName).get(fieldName));
    }

    /**
     * Builds the {@code @misc} entry that lets an arXiv identifier resolve to the
     * full entry through {@code crossref}.
     */
    public static String crossrefStub(String arxivId, String targetKey) {
        return "@misc{" + arxivId + ",\n  crossref = {" + targetKey + "}\n}";
    }

    /**
     * Returns true if the text starts with an entry header carrying a key.
     */
    public static boolean isWellFormed(String bibtex) {
        return bibtex != null && bibtex.stripLeading().startsWith("@") && extractKey(bibtex).isPresent();
    }

    /**
     * A top-level block, or the non-blank free text between two blocks.
     */
    public record Segment(String text, boolean block) {
    }

    /**
     * Splits a {@code .bib} document into top-level blocks ({@code @article}, {@code @string},
     * {@code @comment}, ...). Text between blocks is dropped.
     */
    public static List<String> splitBlocks(String document) {
        List<String> blocks = new ArrayList<>();
        for (Segment segment : segments(document)) {
            if (segment.block()) {
                blocks.add(segment.text());
            }
        }
        return blocks;
    }

    /**
     * Splits a {@code .bib} document into blocks and the free text around them
     * ({@code %} comment lines, notes), both trimmed, in document order.
     */
    public static List<Segment> segments(String document) {
        List<Segment> segments = new ArrayList<>();
        if (document == null || document.isBlank()) {
            return segments;
        }
        Matcher matcher = BLOCK_START.matcher(document);
        int searchFrom = 0;
        while (searchFrom < document.length() && matcher.find(searchFrom)) {
            int start = document.indexOf('@', matcher.start());
            addText(segments, document.substring(searchFrom, start));
            int open = matcher.end() - 1;
            char openChar = document.charAt(open);
            char closeChar = openChar == '{' ? '}' : ')';
            int end = findClosing(document, open, openChar, closeChar);
            if (end < 0) {
                // Unterminated block: keep the remainder as is
                segments.add(new Segment(document.substring(start).trim(), true));
                return segments;
            }
            segments.add(new Segment(document.substring(start, end + 1).trim(), true));
            searchFrom = end + 1;
        }
        if (searchFrom < document.length()) {
            addText(segments, document.substring(searchFrom));
        }
        return segments;
    }

    private static void addText(List<Segment> segments, String text) {
        if (!text.isBlank()) {
            segments.add(new Segment(text.strip(), false));
        }
    }

    /**
     * Returns the lower-cased block type ({@code article}, {@code string}, ...).
     */
    public static Optional<String> blockType(String block) {
        Matcher matcher = BLOCK_START.matcher(block);
        return matcher.find() ? Optional.of(matcher.group(1).toLowerCase(Locale.ROOT)) : Optional.empty();
    }

    /**
     * Returns true for {@code @string}, {@code @preamble} and {@code @comment} blocks,
     * which carry no citation key.
     */
    public static boolean isDirective(String block) {
        return blockType(block)
                .map(type -> type.equals("string") || type.equals("preamble") || type.equals("comment"))
                .orElse(false);
    }

    private static int findClosing(String text, int openIndex, char openChar, char closeChar) {
        int depth = 0;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
                continue;
            }
            if (c == openChar) {
                depth++;
            } else if (c == closeChar) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}

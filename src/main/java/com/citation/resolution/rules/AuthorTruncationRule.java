package com.citation.resolution.rules;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shortens long author lists to the first {@code maxAuthors} names followed by {@code others}.
 */
public class AuthorTruncationRule implements EntryRule {

    private static final Pattern AUTHOR_FIELD =
            Pattern.compile("(\\s*author\\s*=\\s*\\{)(.+?)(\\},?\\s*\\n)", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern AUTHOR_SEPARATOR = Pattern.compile("\\s+and\\s+");

    private final int maxAuthors;
    private final int priority;

    public AuthorTruncationRule(int maxAuthors) {
        this(maxAuthors, 10);
    }

    public AuthorTruncationRule(int maxAuthors, int priority) {
        if (maxAuthors < 1) {
            throw new IllegalArgumentException("maxAuthors must be at least 1, got " + maxAuthors);
        }
        this.maxAuthors = maxAuthors;
        this.priority = priority;
    }

    @Override
    public String getName() {
        return "author-truncation";
    }

    @Override
    public int getPriority() {
        return priority;
    }

    public int getMaxAuthors() {
        return maxAuthors;
    }

    @Override
    public String apply(String entry) {
        if (entry == null) {
            return null;
        }
        Matcher matcher = AUTHOR_FIELD.matcher(entry);
        if (!matcher.find()) {
            return entry;
        }

        List<String> authors = Arrays.stream(AUTHOR_SEPARATOR.split(matcher.group(2)))
                .map(String::trim)
                .toList();
        if (authors.size() <= maxAuthors) {
            return entry;
        }

        List<String> kept = new ArrayList<>(authors.subList(0, maxAuthors));
        kept.add("others");
        String field = matcher.group(1) + String.join(" and ", kept) + matcher.group(3);
        return entry.substring(0, matcher.start()) + field + entry.substring(matcher.end());
    }
}

package com.citation.resolution.tex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts citation keys from LaTeX sources.
 *
 * <p>Recognizes every {@code \cite...} / {@code \Cite...} command ({@code \citep},
 * {@code \citet}, {@code \citealt}, ...), including optional arguments such as
 * {@code \citep[e.g.][p.~3]{key}} and comma-separated key lists. Text after an
 * unescaped {@code %} is a comment and ignored.</p>
 */
public class CiteKeyExtractor {
    private static final Logger log = LoggerFactory.getLogger(CiteKeyExtractor.class);

    private static final Pattern CITE_COMMAND = Pattern.compile("\\\\[Cc]ite[a-zA-Z]*(?:\\[[^\\]]*\\])*\\{([^}]+)\\}");
    private static final Pattern COMMENT = Pattern.compile("(?<!\\\\)%.*$", Pattern.MULTILINE);

    /**
     * Keys in first-appearance order, without repeats, plus warnings for malformed commands.
     */
    public record ExtractionResult(List<String> keys, List<String> warnings) {
        public ExtractionResult {
            keys = List.copyOf(keys);
            warnings = List.copyOf(warnings);
        }

        public boolean hasWarnings() {
            return !warnings.isEmpty();
        }
    }

    public ExtractionResult extract(String content, String sourceName) {
        Set<String> keys = new LinkedHashSet<>();
        List<String> warnings = new ArrayList<>();
        collect(content, sourceName, keys, warnings);
        return new ExtractionResult(new ArrayList<>(keys), warnings);
    }

    public ExtractionResult extract(Path texFile) {
        return extractAll(List.of(texFile));
    }

    /**
     * Extracts from several files; keys keep their first appearance across all files.
     *
     * @throws UncheckedIOException if a file cannot be read
     */
    public ExtractionResult extractAll(Collection<Path> texFiles) {
        Set<String> keys = new LinkedHashSet<>();
        List<String> warnings = new ArrayList<>();
        for (Path file : texFiles) {
            String content;
            try {
                content = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read " + file, e);
            }
            collect(content, file.toString(), keys, warnings);
        }
        log.info("extraction.completed files={} keys={} warnings={}", texFiles.size(), keys.size(), warnings.size());
        return new ExtractionResult(new ArrayList<>(keys), warnings);
    }

    private void collect(String content, String sourceName, Set<String> keys, List<String> warnings) {
        if (content == null || content.isEmpty()) {
            return;
        }
        String stripped = COMMENT.matcher(content).replaceAll("");
        Matcher matcher = CITE_COMMAND.matcher(stripped);
        while (matcher.find()) {
            for (String part : matcher.group(1).split(",", -1)) {
                String key = part.trim();
                if (key.isEmpty()) {
                    warnings.add(sourceName + ": Empty citation key found");
                    log.warn("extraction.empty_key source={}", sourceName);
                } else {
                    keys.add(key);
                }
            }
        }
    }
}

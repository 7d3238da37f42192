package com.citation.resolution.classify;

import com.citation.resolution.core.model.CitationKey;
import com.citation.resolution.core.model.KeyFormat;

import java.util.regex.Pattern;

/**
 * Maps raw citation keys to their {@link KeyFormat}.
 *
 * <p>Patterns are checked in a fixed precedence order and the first match wins:</p>
 * <ol>
 *   <li>old-style arXiv ({@code archive/YYMMNNN})</li>
 *   <li>new-style arXiv ({@code YYMM.NNNNN})</li>
 *   <li>ADS bibcode</li>
 *   <li>INSPIRE texkey ({@code Author:YYYYabc})</li>
 * </ol>
 * Anything else is {@link KeyFormat#UNRECOGNIZED}. Classification never fails.
 */
public final class KeyClassifier {

    private static final Pattern ARXIV_OLD = Pattern.compile(
            "^[A-Za-z]+(-[A-Za-z]+)?(\\.[A-Z]{2})?/\\d{7}(v\\d+)?$");

    private static final Pattern ARXIV_NEW = Pattern.compile(
            "^\\d{4}\\.\\d{4,5}(v\\d+)?$");

    // YYYY JJJJJ VVVV M PPPP A, 19 characters, dot padded
    private static final Pattern ADS_BIBCODE_STRICT = Pattern.compile(
            "^\\d{4}[A-Za-z&.]{5}[A-Za-z0-9.]{4}[A-Za-z0-9.]{5}[A-Z.]$");

    // Tolerates bibcodes whose padding was collapsed
    private static final Pattern ADS_BIBCODE_LOOSE = Pattern.compile(
            "^\\d{4}[A-Za-z&.]+\\..*[A-Z]$");
    private static final int ADS_BIBCODE_MIN_LENGTH = 15;

    private static final Pattern INSPIRE_TEXKEY = Pattern.compile(
            "^[A-Za-z][A-Za-z0-9.'\\-]*:\\d{4}[A-Za-z]{0,4}$");

    private KeyClassifier() {
        // utility class
    }

    /**
     * Classifies a raw key. Total: {@code null} and blank keys are {@link KeyFormat#UNRECOGNIZED}.
     */
    public static KeyFormat classify(String raw) {
        if (raw == null || raw.isBlank()) {
            return KeyFormat.UNRECOGNIZED;
        }
        String key = raw.trim();
        if (ARXIV_OLD.matcher(key).matches()) {
            return KeyFormat.ARXIV_OLD;
        }
        if (ARXIV_NEW.matcher(key).matches()) {
            return KeyFormat.ARXIV_NEW;
        }
        if (isAdsBibcode(key)) {
            return KeyFormat.ADS_BIBCODE;
        }
        if (INSPIRE_TEXKEY.matcher(key).matches()) {
            return KeyFormat.INSPIRE;
        }
        return KeyFormat.UNRECOGNIZED;
    }

    /**
     * Classifies a raw key and wraps it as a {@link CitationKey}.
     */
    public static CitationKey toCitationKey(String raw) {
        return new CitationKey(raw, classify(raw));
    }

    static boolean isAdsBibcode(String key) {
        if (ADS_BIBCODE_STRICT.matcher(key).matches()) {
            return true;
        }
        return key.length() >= ADS_BIBCODE_MIN_LENGTH && ADS_BIBCODE_LOOSE.matcher(key).matches();
    }
}

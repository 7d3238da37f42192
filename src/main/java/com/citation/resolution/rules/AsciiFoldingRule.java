package com.citation.resolution.rules;

import java.text.Normalizer;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites non-ASCII characters as BibTeX accent macros ({@code é} becomes {@code {\'e}})
 * or plain ASCII equivalents. Characters with no known mapping are left unchanged.
 * The entry header, and with it the citation key, is not touched.
 */
public class AsciiFoldingRule implements EntryRule {

    private static final Pattern HEADER = Pattern.compile("\\s*@\\w+\\s*[{(][^,]*,");

    private static final Map<Character, String> ACCENTS = Map.ofEntries(
            Map.entry('\u0300', "`"),
            Map.entry('\u0301', "'"),
            Map.entry('\u0302', "^"),
            Map.entry('\u0303', "~"),
            Map.entry('\u0304', "="),
            Map.entry('\u0306', "u"),
            Map.entry('\u0307', "."),
            Map.entry('\u0308', "\""),
            Map.entry('\u030a', "r"),
            Map.entry('\u030b', "H"),
            Map.entry('\u030c', "v"),
            Map.entry('\u0327', "c"),
            Map.entry('\u0328', "k")
    );

    private static final Map<Character, String> SPECIALS = Map.ofEntries(
            Map.entry('\u00df', "{\\ss}"),
            Map.entry('\u00f8', "{\\o}"),
            Map.entry('\u00d8', "{\\O}"),
            Map.entry('\u00e6', "{\\ae}"),
            Map.entry('\u00c6', "{\\AE}"),
            Map.entry('\u0153', "{\\oe}"),
            Map.entry('\u0152', "{\\OE}"),
            Map.entry('\u0142', "{\\l}"),
            Map.entry('\u0141', "{\\L}"),
            Map.entry('\u0131', "{\\i}"),
            Map.entry('\u2013', "--"),
            Map.entry('\u2014', "---"),
            Map.entry('\u2018', "`"),
            Map.entry('\u2019', "'"),
            Map.entry('\u201c', "``"),
            Map.entry('\u201d', "''"),
            Map.entry('\u00a0', "~")
    );

    @Override
    public String getName() {
        return "ascii-folding";
    }

    @Override
    public int getPriority() {
        return 20;
    }

    @Override
    public String apply(String entry) {
        if (entry == null || isAscii(entry)) {
            return entry;
        }
        // The citation key is kept as is
        Matcher header = HEADER.matcher(entry);
        if (header.lookingAt()) {
            return entry.substring(0, header.end()) + fold(entry.substring(header.end()));
        }
        return fold(entry);
    }

    private static String fold(String text) {
        if (isAscii(text)) {
            return text;
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        StringBuilder out = new StringBuilder(decomposed.length() + 16);
        int i = 0;
        while (i < decomposed.length()) {
            char c = decomposed.charAt(i);
            String special = SPECIALS.get(c);
            if (special != null) {
                out.append(special);
                i++;
                continue;
            }
            if (i + 1 < decomposed.length() && ACCENTS.containsKey(decomposed.charAt(i + 1))) {
                out.append(accent(ACCENTS.get(decomposed.charAt(i + 1)), c));
                i += 2;
                continue;
            }
            if (ACCENTS.containsKey(c)) {
                // Combining mark without a preceding base letter
                i++;
                continue;
            }
            out.append(c);
            i++;
        }
        return Normalizer.normalize(out, Normalizer.Form.NFC);
    }

    private static String accent(String macro, char base) {
        String letter = base == 'i' ? "\\i" : String.valueOf(base);
        if (Character.isLetter(macro.charAt(0))) {
            return "{\\" + macro + "{" + letter + "}}";
        }
        return "{\\" + macro + letter + "}";
    }

    private static boolean isAscii(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) > 0x7F) {
                return false;
            }
        }
        return true;
    }
}

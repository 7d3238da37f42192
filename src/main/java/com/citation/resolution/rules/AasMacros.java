package com.citation.resolution.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * AAS journal macro table ({@code \apj} to {@code ApJ}, ...) as used by ADS exports.
 */
public final class AasMacros {

    private static final Pattern JOURNAL_DEF = Pattern.compile("\\\\def\\\\(\\w+)\\{\\\\ref@jnl\\{([^}]+)\\}\\}");
    private static final Pattern ALIAS_DEF = Pattern.compile("\\\\(?:def|let)\\\\(\\w+)\\s*=?\\s*\\{?\\\\(\\w+)\\}?");

    private static final Map<String, String> BUILT_IN = builtInTable();

    private AasMacros() {
    }

    /**
     * Parses {@code aasjournals.sty} content: {@code \def\apj{\ref@jnl{ApJ}}} definitions,
     * then {@code \def}/{@code \let} aliases of already known macros.
     *
     * @return macro name (without backslash) to journal string, in definition order
     */
    public static Map<String, String> parse(String styContent) {
        Map<String, String> macros = new LinkedHashMap<>();
        if (styContent == null) {
            return macros;
        }
        Matcher journals = JOURNAL_DEF.matcher(styContent);
        while (journals.find()) {
            macros.put(journals.group(1), journals.group(2));
        }
        Matcher aliases = ALIAS_DEF.matcher(styContent);
        while (aliases.find()) {
            String alias = aliases.group(1);
            String original = aliases.group(2);
            if (!macros.containsKey(alias) && macros.containsKey(original)) {
                macros.put(alias, macros.get(original));
            }
        }
        return macros;
    }

    /**
     * Table covering the journals most often seen in ADS exports.
     */
    public static Map<String, String> builtIn() {
        return BUILT_IN;
    }

    /**
     * Returns the macros that occur in the text.
     */
    public static Map<String, String> findUsed(String text, Map<String, String> macros) {
        Map<String, String> used = new LinkedHashMap<>();
        if (text == null) {
            return used;
        }
        macros.forEach((name, value) -> {
            if (usage(name).matcher(text).find()) {
                used.put(name, value);
            }
        });
        return used;
    }

    /**
     * Replaces each {@code \macro} not followed by a word character with its expansion.
     */
    public static String expand(String text, Map<String, String> macros) {
        if (text == null) {
            return null;
        }
        String result = text;
        for (Map.Entry<String, String> macro : macros.entrySet()) {
            result = usage(macro.getKey()).matcher(result).replaceAll(Matcher.quoteReplacement(macro.getValue()));
        }
        return result;
    }

    /**
     * One rule per macro, all at the given priority.
     */
    public static List<NormalizationRule> toRules(Map<String, String> macros, int priority) {
        List<NormalizationRule> rules = new ArrayList<>(macros.size());
        macros.forEach((name, value) -> rules.add(NormalizationRule.builder()
                .name("aas-" + name)
                .pattern(usage(name).pattern())
                .replacement(value)
                .priority(priority)
                .build()));
        return rules;
    }

    private static Pattern usage(String name) {
        return Pattern.compile("\\\\" + Pattern.quote(name) + "(?!\\w)");
    }

    private static Map<String, String> builtInTable() {
        Map<String, String> table = new LinkedHashMap<>();
        table.put("aj", "AJ");
        table.put("araa", "ARA\\&A");
        table.put("apj", "ApJ");
        table.put("apjl", "ApJL");
        table.put("apjs", "ApJS");
        table.put("ao", "ApOpt");
        table.put("apss", "Ap\\&SS");
        table.put("aap", "A\\&A");
        table.put("aapr", "A\\&A~Rv");
        table.put("aaps", "A\\&AS");
        table.put("azh", "AZh");
        table.put("baas", "BAAS");
        table.put("icarus", "Icarus");
        table.put("jcap", "JCAP");
        table.put("jrasc", "JRASC");
        table.put("memras", "MmRAS");
        table.put("mnras", "MNRAS");
        table.put("na", "New A");
        table.put("nar", "New A Rev.");
        table.put("pra", "PhRvA");
        table.put("prb", "PhRvB");
        table.put("prc", "PhRvC");
        table.put("prd", "PhRvD");
        table.put("pre", "PhRvE");
        table.put("prl", "PhRvL");
        table.put("pasa", "PASA");
        table.put("pasp", "PASP");
        table.put("pasj", "PASJ");
        table.put("qjras", "QJRAS");
        table.put("skytel", "S\\&T");
        table.put("solphys", "SoPh");
        table.put("sovast", "Soviet~Ast.");
        table.put("ssr", "SSRv");
        table.put("zap", "ZA");
        table.put("nat", "Nature");
        table.put("iaucirc", "IAU~Circ.");
        table.put("aplett", "Astrophys.~Lett.");
        table.put("apspr", "Astrophys.~Space~Phys.~Res.");
        table.put("bain", "BAN");
        table.put("fcp", "FCPh");
        table.put("gca", "GeoCoA");
        table.put("grl", "Geophys.~Res.~Lett.");
        table.put("jcp", "JChPh");
        table.put("jgr", "J.~Geophys.~Res.");
        table.put("jqsrt", "JQSRT");
        table.put("memsai", "MmSAI");
        table.put("nphysa", "NuPhA");
        table.put("physrep", "PhR");
        table.put("physscr", "PhyS");
        table.put("planss", "Planet.~Space~Sci.");
        table.put("procspie", "Proc.~SPIE");
        table.put("actaa", "AcA");
        table.put("caa", "ChA\\&A");
        table.put("cjaa", "ChJA\\&A");
        table.put("psj", "PSJ");
        table.put("rnaas", "RNAAS");
        return Collections.unmodifiableMap(table);
    }
}

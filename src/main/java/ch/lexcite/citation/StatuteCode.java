package ch.lexcite.citation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Canonical codes for Swiss federal statutes.
 *
 * <p>Each constant holds the official abbreviation in every citation language
 * and the SR (Systematische Rechtssammlung) number. Abbreviations from any
 * language resolve to the same constant, e.g. {@code OR} and {@code CO} both
 * map to {@link #OR}.</p>
 */
public enum StatuteCode {

    ZGB("ZGB", "CC", "CC", "CC", "210"),
    OR("OR", "CO", "CO", "CO", "220"),
    STGB("StGB", "CP", "CP", "CP", "311.0"),
    STPO("StPO", "CPP", "CPP", "CPP", "312.0"),
    ZPO("ZPO", "CPC", "CPC", "CPC", "272"),
    BV("BV", "Cst", "Cost", "Cst", "101"),
    SCHKG("SchKG", "LP", "LEF", "DEBA", "281.1"),
    DSG("DSG", "LPD", "LPD", "DPA", "235.1"),
    URG("URG", "LDA", "LDA", "CopA", "231.1"),
    MSCHG("MSchG", "LPM", "LPM", "TmPA", "232.11"),
    PATG("PatG", "LBI", "LBI", "PatA", "232.14"),
    KG("KG", "LCart", "LCart", "CartA", "251"),
    VVG("VVG", "LCA", "LCA", "ICA", "221.229.1"),
    ATSG("ATSG", "LPGA", "LPGA", "ATSG", "830.1"),
    AHVG("AHVG", "LAVS", "LAVS", "OASIA", "831.10"),
    IVG("IVG", "LAI", "LAI", "IVA", "831.20"),
    UVG("UVG", "LAA", "LAINF", "AIA", "832.20"),
    BVG("BVG", "LPP", "LPP", "OPA", "831.40"),
    ELG("ELG", "LPC", "LPC", null, "831.30"),
    FZG("FZG", "LFLP", "LFLP", null, "831.42"),
    AVIG("AVIG", "LACI", "LADI", "UIA", "837.0"),
    BGG("BGG", "LTF", "LTF", "SCA", "173.110"),
    VWVG("VwVG", "PA", "PA", "APA", "172.021"),
    KVG("KVG", "LAMal", "LAMal", "HIA", "832.10"),
    IPRG("IPRG", "LDIP", "LDIP", "PILA", "291"),
    MWSTG("MWSTG", "LTVA", "LIVA", "VATA", "641.20"),
    DBG("DBG", "LIFD", "LIFD", "FITA", "642.11");

    private static final Map<StatuteCode, Map<Language, String>> FULL_NAMES;

    static {
        Map<StatuteCode, Map<Language, String>> names = new EnumMap<>(StatuteCode.class);
        names.put(ZGB, names(
            "Schweizerisches Zivilgesetzbuch",
            "Code civil suisse",
            "Codice civile svizzero",
            "Swiss Civil Code"));
        names.put(OR, names(
            "Obligationenrecht",
            "Code des obligations",
            "Codice delle obbligazioni",
            "Code of Obligations"));
        names.put(STGB, names(
            "Schweizerisches Strafgesetzbuch",
            "Code pénal suisse",
            "Codice penale svizzero",
            "Swiss Criminal Code"));
        names.put(STPO, names(
            "Schweizerische Strafprozessordnung",
            "Code de procédure pénale suisse",
            "Codice di diritto processuale penale svizzero",
            "Swiss Criminal Procedure Code"));
        names.put(ZPO, names(
            "Schweizerische Zivilprozessordnung",
            "Code de procédure civile",
            "Codice di diritto processuale civile svizzero",
            "Swiss Civil Procedure Code"));
        names.put(BV, names(
            "Bundesverfassung der Schweizerischen Eidgenossenschaft",
            "Constitution fédérale de la Confédération suisse",
            "Costituzione federale della Confederazione Svizzera",
            "Federal Constitution of the Swiss Confederation"));
        names.put(SCHKG, names(
            "Bundesgesetz über Schuldbetreibung und Konkurs",
            "Loi fédérale sur la poursuite pour dettes et la faillite",
            "Legge federale sulla esecuzione e sul fallimento",
            "Debt Enforcement and Bankruptcy Act"));
        names.put(DSG, names(
            "Bundesgesetz über den Datenschutz",
            "Loi fédérale sur la protection des données",
            "Legge federale sulla protezione dei dati",
            "Federal Act on Data Protection"));
        names.put(BGG, names(
            "Bundesgerichtsgesetz",
            "Loi sur le Tribunal fédéral",
            "Legge sul Tribunale federale",
            "Federal Supreme Court Act"));
        FULL_NAMES = Collections.unmodifiableMap(names);
    }

    private final Map<Language, String> abbreviations;
    private final String srNumber;

    StatuteCode(String de, String fr, String it, @Nullable String en, String srNumber) {
        Map<Language, String> map = new EnumMap<>(Language.class);
        map.put(Language.DE, de);
        map.put(Language.FR, fr);
        map.put(Language.IT, it);
        if (en != null) {
            map.put(Language.EN, en);
        }
        this.abbreviations = Collections.unmodifiableMap(map);
        this.srNumber = srNumber;
    }

    private static Map<Language, String> names(String de, String fr, String it, String en) {
        Map<Language, String> map = new EnumMap<>(Language.class);
        map.put(Language.DE, de);
        map.put(Language.FR, fr);
        map.put(Language.IT, it);
        map.put(Language.EN, en);
        return Collections.unmodifiableMap(map);
    }

    /**
     * Returns the abbreviation used in the given language.
     *
     * @param language citation language
     * @return the abbreviation, or empty if the statute has no established
     *         abbreviation in that language
     */
    public Optional<String> abbreviation(@NotNull Language language) {
        return Optional.ofNullable(abbreviations.get(language));
    }

    /**
     * Returns the official full title in the given language, where one is maintained.
     *
     * @param language target language
     * @return the title, or empty
     */
    public Optional<String> fullName(@NotNull Language language) {
        Map<Language, String> names = FULL_NAMES.get(this);
        return names == null ? Optional.empty() : Optional.ofNullable(names.get(language));
    }

    /**
     * @return SR number of the statute in the classified compilation
     */
    public String srNumber() {
        return srNumber;
    }

    /**
     * Languages in which the given token is an abbreviation of this statute.
     *
     * @param token abbreviation as written
     * @return matching languages in declaration order
     */
    public Set<Language> languagesFor(@NotNull String token) {
        Set<Language> languages = EnumSet.noneOf(Language.class);
        for (Map.Entry<Language, String> entry : abbreviations.entrySet()) {
            if (entry.getValue().equalsIgnoreCase(token)) {
                languages.add(entry.getKey());
            }
        }
        return languages;
    }

    /**
     * Resolves an abbreviation from any language to its canonical code.
     *
     * <p>Exact matches win over case-insensitive matches.</p>
     *
     * @param abbreviation abbreviation as written, e.g. "CO" or "Cst"
     * @return the canonical code, or empty for unknown abbreviations
     */
    public static Optional<StatuteCode> fromAbbreviation(@Nullable String abbreviation) {
        if (abbreviation == null || abbreviation.isBlank()) {
            return Optional.empty();
        }
        String token = abbreviation.trim();
        for (StatuteCode code : values()) {
            if (code.abbreviations.containsValue(token)) {
                return Optional.of(code);
            }
        }
        String upper = token.toUpperCase(Locale.ROOT);
        for (StatuteCode code : values()) {
            for (String candidate : code.abbreviations.values()) {
                if (candidate.toUpperCase(Locale.ROOT).equals(upper)) {
                    return Optional.of(code);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves an abbreviation within one language family only.
     *
     * @param abbreviation abbreviation as written
     * @param language language family the abbreviation must belong to
     * @return the canonical code, or empty if the abbreviation is not used in that language
     */
    public static Optional<StatuteCode> fromAbbreviation(@Nullable String abbreviation, @NotNull Language language) {
        if (abbreviation == null || abbreviation.isBlank()) {
            return Optional.empty();
        }
        String token = abbreviation.trim();
        for (StatuteCode code : values()) {
            String candidate = code.abbreviations.get(language);
            if (candidate != null && candidate.equalsIgnoreCase(token)) {
                return Optional.of(code);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the language family implied by a statute abbreviation alone.
     *
     * <p>Abbreviations shared between French and Italian (CC, CO, CP) resolve to French;
     * German wins over English for shared tokens such as ATSG.</p>
     *
     * @param abbreviation abbreviation as written
     * @return implied language, or empty for unknown abbreviations
     */
    public static Optional<Language> languageOf(@Nullable String abbreviation) {
        Optional<StatuteCode> code = fromAbbreviation(abbreviation);
        if (code.isEmpty()) {
            return Optional.empty();
        }
        Set<Language> languages = code.get().languagesFor(abbreviation.trim());
        for (Language language : Language.values()) {
            if (languages.contains(language)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }
}

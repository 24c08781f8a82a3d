package ch.lexcite.citation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Label vocabulary, grammars and detection rules shared by the validator,
 * parser and formatter.
 */
final class CitationGrammar {

    /**
     * Citation vocabulary of one language.
     */
    record Labels(
        String article,
        String paragraph,
        String letter,
        String number,
        String courtPrefix,
        String consideration
    ) {}

    static final Map<Language, Labels> LABELS;

    static {
        Map<Language, Labels> labels = new EnumMap<>(Language.class);
        labels.put(Language.DE, new Labels("Art.", "Abs.", "lit.", "Ziff.", "BGE", "E."));
        labels.put(Language.FR, new Labels("art.", "al.", "let.", "ch.", "ATF", "consid."));
        labels.put(Language.IT, new Labels("art.", "cpv.", "lett.", "n.", "DTF", "consid."));
        labels.put(Language.EN, new Labels("Art.", "para.", "let.", "no.", "BGE", "E."));
        LABELS = Collections.unmodifiableMap(labels);
    }

    static final Pattern COURT_DECISION = Pattern.compile(
        "^(BGE|ATF|DTF)\\s+(\\d{1,3})\\s+([A-Za-z]+)\\s+(\\d{1,5})"
            + "(?:\\s+(?:E\\.|consid\\.|cons\\.)\\s*(\\d+(?:\\.\\d+)*))?$",
        Pattern.CASE_INSENSITIVE);

    static final Pattern CANTONAL_DECISION = Pattern.compile(
        "^([A-Za-z]{2,4})[-_](\\d{4})[-_](\\d{1,9})$");

    static final Pattern DOCTRINE = Pattern.compile(
        "^(BSK|CR|CHK|OFK|ZK|BK|KUKO|SHK|CommTI|OK)\\s+([A-Za-z]+)(?:\\s+([IVX]+))?\\s*-\\s*([^,]+?),\\s*"
            + "(?i:art\\.)\\s*(\\d+[a-z]*)\\s+(?:N|n\\.|no\\.?)\\s*(\\d{1,4})$");

    private static final String ARTICLE_SUFFIX = "(bis|ter|quater|quinquies|sexies|septies|octies|[a-z])?";

    private static final Map<Language, Pattern> STATUTE_PATTERNS;

    static {
        Map<Language, Pattern> patterns = new EnumMap<>(Language.class);
        for (Map.Entry<Language, Labels> entry : LABELS.entrySet()) {
            Labels l = entry.getValue();
            patterns.put(entry.getKey(), Pattern.compile(
                "^(art\\.)(\\s*)(\\d{1,4})" + ARTICLE_SUFFIX
                    + "(?:\\s+" + Pattern.quote(l.paragraph()) + "\\s*(\\d{1,3}))?"
                    + "(?:\\s+" + Pattern.quote(l.letter()) + "\\s*([a-z]))?"
                    + "(?:\\s+" + Pattern.quote(l.number()) + "\\s*(\\d{1,3}))?"
                    + "\\s+([A-Za-z]+)"
                    + "(\\s*[(\\[]\\s*(?:BGE|ATF|DTF)\\s[^)\\]]*[)\\]])?$",
                Pattern.CASE_INSENSITIVE));
        }
        STATUTE_PATTERNS = Collections.unmodifiableMap(patterns);
    }

    // Group indexes of the statute patterns
    static final int ST_MARKER = 1;
    static final int ST_SPACE = 2;
    static final int ST_ARTICLE = 3;
    static final int ST_SUFFIX = 4;
    static final int ST_PARAGRAPH = 5;
    static final int ST_LETTER = 6;
    static final int ST_NUMBER = 7;
    static final int ST_CODE = 8;
    static final int ST_TRAILER = 9;

    private static final Pattern EN_MARKERS = markers("para", "no");
    private static final Pattern FR_MARKERS = markers("al", "let", "ch");
    private static final Pattern IT_MARKERS = markers("cpv", "lett");
    private static final Pattern DE_MARKERS = markers("abs", "lit", "ziff");

    private static final Pattern COURT_PREFIX = Pattern.compile("\\b(BGE|ATF|DTF)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern COURT_CITATION_START = Pattern.compile("\\b(?:BGE|ATF|DTF)\\s+\\d", Pattern.CASE_INSENSITIVE);
    private static final Pattern ARTICLE_MARKER = Pattern.compile("(?:^|[\\s(\\[])art\\.", Pattern.CASE_INSENSITIVE);
    private static final Pattern CAPITALISED_TOKEN = Pattern.compile("\\b[A-Z][A-Za-z]{1,5}\\b");

    private CitationGrammar() {
    }

    private static Pattern markers(String... words) {
        return Pattern.compile("(?:^|\\s)(?:" + String.join("|", words) + ")\\.(?=\\s|\\d|$)",
            Pattern.CASE_INSENSITIVE);
    }

    static Labels labels(Language language) {
        return LABELS.get(language);
    }

    static Pattern statutePattern(Language language) {
        return STATUTE_PATTERNS.get(language);
    }

    /**
     * Detects the citation language. Signals are evaluated in a fixed order:
     * paragraph/letter/number markers, then the court prefix, then the statute
     * abbreviation, then German as default.
     */
    static Language detectLanguage(String text) {
        if (text == null || text.isBlank()) {
            return Language.DE;
        }
        if (EN_MARKERS.matcher(text).find()) {
            return Language.EN;
        }
        if (FR_MARKERS.matcher(text).find()) {
            return Language.FR;
        }
        if (IT_MARKERS.matcher(text).find()) {
            return Language.IT;
        }
        if (DE_MARKERS.matcher(text).find()) {
            return Language.DE;
        }

        Matcher prefix = COURT_PREFIX.matcher(text);
        if (prefix.find()) {
            return languageOfPrefix(prefix.group(1));
        }

        Matcher token = CAPITALISED_TOKEN.matcher(text);
        while (token.find()) {
            Optional<Language> language = StatuteCode.languageOf(token.group());
            if (language.isPresent()) {
                return language.get();
            }
        }
        return Language.DE;
    }

    static Language languageOfPrefix(String prefix) {
        switch (prefix.toUpperCase(Locale.ROOT)) {
            case "ATF":
                return Language.FR;
            case "DTF":
                return Language.IT;
            default:
                return Language.DE;
        }
    }

    static Language languageOfSeries(String series) {
        if ("CR".equals(series)) {
            return Language.FR;
        }
        if ("CommTI".equals(series)) {
            return Language.IT;
        }
        return Language.DE;
    }

    /**
     * Classifies the input by its leading markers.
     *
     * <p>Commentary series prefixes are checked first. A court prefix wins over an
     * article marker unless the article marker appears earlier in the text.</p>
     */
    static CitationType detectType(String text) {
        if (text == null || text.isBlank()) {
            return CitationType.UNKNOWN;
        }
        String trimmed = text.trim();
        if (trimmed.matches("^(BSK|CR|CHK|OFK|ZK|BK|KUKO|SHK|CommTI|OK)\\s.*")) {
            return CitationType.DOCTRINE;
        }

        Matcher court = COURT_CITATION_START.matcher(trimmed);
        Matcher article = ARTICLE_MARKER.matcher(trimmed);
        boolean hasCourt = court.find();
        boolean hasArticle = article.find();
        if (hasCourt && hasArticle) {
            return article.start() < court.start() ? CitationType.STATUTE : CitationType.COURT_DECISION;
        }
        if (hasCourt || trimmed.toUpperCase(Locale.ROOT).matches("^(BGE|ATF|DTF)(?![A-Z]).*")) {
            return CitationType.COURT_DECISION;
        }
        if (hasArticle) {
            return CitationType.STATUTE;
        }
        if (CANTONAL_DECISION.matcher(trimmed).matches()) {
            return CitationType.CANTONAL_DECISION;
        }
        return CitationType.UNKNOWN;
    }
}

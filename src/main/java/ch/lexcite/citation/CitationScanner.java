package ch.lexcite.citation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Finds citation candidates in running text.
 *
 * <p>Every type pattern is applied to the whole text; overlapping candidates
 * are resolved so that each character belongs to at most one citation. The
 * earliest start wins, and the longest match wins among equal starts.</p>
 */
final class CitationScanner {

    record Span(int start, int end, String text, CitationType type) {}

    private static final String STATUTE_CODES = Arrays.stream(StatuteCode.values())
        .flatMap(code -> Arrays.stream(Language.values()).map(code::abbreviation))
        .flatMap(Optional::stream)
        .distinct()
        .sorted(Comparator.comparingInt(String::length).reversed())
        .map(Pattern::quote)
        .collect(Collectors.joining("|"));

    private static final Map<CitationType, Pattern> PATTERNS = Map.of(
        CitationType.COURT_DECISION, Pattern.compile(
            "\\b(?:BGE|ATF|DTF)\\s+\\d{1,3}\\s+[IVX]{1,4}\\s+\\d{1,5}"
                + "(?:\\s+(?:E\\.|consid\\.)\\s*\\d+(?:\\.\\d+)*)?"),
        CitationType.STATUTE, Pattern.compile(
            "\\b[Aa]rt\\.\\s*\\d{1,4}(?:bis|ter|quater|quinquies|sexies|septies|octies|[a-z])?"
                + "(?:\\s+(?:Abs\\.|al\\.|cpv\\.|para\\.)\\s*\\d{1,3})?"
                + "(?:\\s+(?:lit\\.|lett\\.|let\\.)\\s*[a-z])?"
                + "(?:\\s+(?:Ziff\\.|ch\\.|no\\.|n\\.)\\s*\\d{1,3})?"
                + "\\s+(?:" + STATUTE_CODES + ")\\b"),
        CitationType.CANTONAL_DECISION, Pattern.compile(
            "\\b[A-Z]{2,4}[-_]\\d{4}[-_]\\d{1,9}\\b"),
        CitationType.DOCTRINE, Pattern.compile(
            "\\b(?:BSK|CR|CHK|OFK|ZK|BK|KUKO|SHK|CommTI|OK)\\s+[A-Za-z]+(?:\\s+[IVX]+)?\\s*-\\s*[^,\\n]+?,\\s*"
                + "[Aa]rt\\.\\s*\\d+[a-z]*\\s+(?:N|n\\.)\\s*\\d{1,4}"));

    private CitationScanner() {
    }

    /**
     * Returns non-overlapping citation spans ordered by position.
     */
    static List<Span> scan(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<Span> candidates = new ArrayList<>();
        for (Map.Entry<CitationType, Pattern> entry : PATTERNS.entrySet()) {
            Matcher matcher = entry.getValue().matcher(text);
            while (matcher.find()) {
                candidates.add(new Span(matcher.start(), matcher.end(), matcher.group(), entry.getKey()));
            }
        }
        candidates.sort(Comparator.comparingInt(Span::start)
            .thenComparing(Comparator.comparingInt((Span s) -> s.end() - s.start()).reversed())
            .thenComparing(Span::type));

        List<Span> spans = new ArrayList<>();
        int coveredUntil = -1;
        for (Span candidate : candidates) {
            if (candidate.start() >= coveredUntil) {
                spans.add(candidate);
                coveredUntil = candidate.end();
            }
        }
        return spans;
    }

    /**
     * Returns the distinct citation texts in order of first occurrence.
     */
    static List<String> distinctTexts(String text) {
        Set<String> texts = new LinkedHashSet<>();
        for (Span span : scan(text)) {
            texts.add(span.text());
        }
        return new ArrayList<>(texts);
    }
}

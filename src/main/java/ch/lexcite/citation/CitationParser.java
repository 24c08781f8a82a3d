package ch.lexcite.citation;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;

/**
 * Entry point for turning citation text into structured components.
 *
 * <p>Parsing delegates grammar checks to {@link CitationValidator} and adds
 * correction suggestions for input that does not validate.</p>
 */
@ApplicationScoped
public class CitationParser {

    private static final int SUGGESTED_STATUTE_CODES = 6;

    private final CitationValidator validator;

    @Inject
    public CitationParser(CitationValidator validator) {
        this.validator = validator;
    }

    public CitationParser() {
        this(new CitationValidator());
    }

    /**
     * Parses a single citation.
     *
     * @param text citation text
     * @return the parse result; never throws for malformed input
     */
    @NotNull
    public ParsedCitation parse(String text) {
        String raw = text == null ? "" : text.trim();
        ValidationResult result = validator.validate(raw);
        List<String> suggestions = result.valid()
            ? List.of()
            : suggestions(result.type(), result.language());
        return new ParsedCitation(raw, result.type(), result.language(), result.valid(), result.citation(),
            result.normalized(), result.errors(), result.warnings(), suggestions);
    }

    /**
     * Finds and parses every citation in a text.
     *
     * <p>Identical citations are returned once, in order of first occurrence.</p>
     *
     * @param text running text
     * @return parsed citations
     */
    @NotNull
    public List<ParsedCitation> parseMultiple(String text) {
        return CitationScanner.distinctTexts(text).stream()
            .map(this::parse)
            .collect(Collectors.toList());
    }

    public Language detectLanguage(String text) {
        return CitationGrammar.detectLanguage(text);
    }

    public CitationType detectType(String text) {
        return CitationGrammar.detectType(text);
    }

    public boolean containsCitations(String text) {
        return !CitationScanner.scan(text).isEmpty();
    }

    /**
     * Counts citation occurrences, including repeated ones.
     */
    public int countCitations(String text) {
        return CitationScanner.scan(text).size();
    }

    /**
     * Builds a format template and a worked example for the given citation kind.
     */
    List<String> suggestions(CitationType type, Language language) {
        CitationGrammar.Labels labels = CitationGrammar.labels(language);
        List<String> suggestions = new ArrayList<>();
        switch (type) {
            case COURT_DECISION:
                suggestions.add("Format: " + labels.courtPrefix() + " [volume] [chamber] [page]");
                suggestions.add("Example: " + labels.courtPrefix() + " 147 IV 73");
                suggestions.add("Chamber must be a Roman numeral from I to V");
                break;
            case STATUTE:
                suggestions.add("Format: " + labels.article() + " [number] [" + labels.paragraph() + " X] ["
                    + labels.letter() + " a] [" + labels.number() + " X] [statute]");
                suggestions.add("Example: " + statuteExample(language));
                suggestions.add("Known statute codes: " + knownCodes(language));
                break;
            case CANTONAL_DECISION:
                suggestions.add("Format: [court]-[year]-[number]");
                suggestions.add("Example: ZH-2023-145");
                break;
            case DOCTRINE:
                suggestions.add("Format: [series] [statute] [volume]-[author], " + labels.article() + " [article] N [margin]");
                suggestions.add(language == Language.FR
                    ? "Example: CR CO I-Thévenoz, art. 97 N 12"
                    : "Example: BSK OR I-Wiegand, Art. 97 N 12");
                break;
            default:
                suggestions.add("Format: " + labels.courtPrefix() + " [volume] [chamber] [page]");
                suggestions.add("Format: " + labels.article() + " [number] [statute]");
                suggestions.add("Example: " + labels.courtPrefix() + " 147 IV 73");
                suggestions.add("Example: " + statuteExample(language));
                break;
        }
        return suggestions;
    }

    private static String statuteExample(Language language) {
        switch (language) {
            case FR:
                return "art. 97 al. 1 CO";
            case IT:
                return "art. 97 cpv. 1 CO";
            case EN:
                return "Art. 97 para. 1 CO";
            default:
                return "Art. 97 Abs. 1 OR";
        }
    }

    private static String knownCodes(Language language) {
        List<String> codes = new ArrayList<>();
        for (StatuteCode code : StatuteCode.values()) {
            code.abbreviation(language).ifPresent(codes::add);
            if (codes.size() == SUGGESTED_STATUTE_CODES) {
                break;
            }
        }
        return String.join(", ", codes);
    }
}

package ch.lexcite.citation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;

/**
 * Validates Swiss legal citations against the per-type, per-language grammars.
 *
 * <p>Court decisions: {@code BGE|ATF|DTF <volume> <chamber> <page>} with a one to
 * three digit volume and a chamber from I to V. Statutes: article marker, article
 * number with optional suffix, optional paragraph/letter/number markers of one
 * language, and a statute abbreviation known in that language.</p>
 *
 * <p>The normalized form is rendered by {@link CitationFormatter} in the detected
 * language, so validating a normalized citation yields the same normalized form.</p>
 */
@ApplicationScoped
public class CitationValidator {

    static final String UNKNOWN_TYPE_ERROR =
        "Unable to detect citation type. Supported: BGE/ATF/DTF, Art. [statute]";

    private static final int MAX_USUAL_VOLUME = 200;

    private final CitationFormatter formatter;

    @Inject
    public CitationValidator(CitationFormatter formatter) {
        this.formatter = formatter;
    }

    public CitationValidator() {
        this(new CitationFormatter());
    }

    /**
     * Detects the citation type and validates the input.
     *
     * @param text citation text
     * @return validation result, never null
     */
    @NotNull
    public ValidationResult validate(String text) {
        if (text == null || text.isBlank()) {
            return ValidationResult.failure(CitationType.UNKNOWN, Language.DE, "Citation must not be empty");
        }
        String input = text.trim();
        Language language = CitationGrammar.detectLanguage(input);

        switch (CitationGrammar.detectType(input)) {
            case COURT_DECISION:
                return validateCourtDecision(input, language);
            case STATUTE:
                return validateStatute(input, language);
            case CANTONAL_DECISION:
                return validateCantonalDecision(input, language);
            case DOCTRINE:
                return validateDoctrine(input);
            default:
                return ValidationResult.failure(CitationType.UNKNOWN, language, UNKNOWN_TYPE_ERROR);
        }
    }

    private ValidationResult validateCourtDecision(String input, Language language) {
        Matcher matcher = CitationGrammar.COURT_DECISION.matcher(input);
        if (!matcher.matches()) {
            String prefix = CitationGrammar.labels(language).courtPrefix();
            return ValidationResult.failure(CitationType.COURT_DECISION, language,
                "Invalid " + prefix + " citation format. Expected: " + prefix + " [volume] [chamber] [page]");
        }

        Language prefixLanguage = CitationGrammar.languageOfPrefix(matcher.group(1));
        int volume = Integer.parseInt(matcher.group(2));
        String numeral = matcher.group(3);
        int page = Integer.parseInt(matcher.group(4));
        String consideration = matcher.group(5);

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        Optional<Chamber> chamber = Chamber.fromNumeral(numeral);
        if (chamber.isEmpty()) {
            errors.add("Invalid chamber: " + numeral + ". Must be one of I, II, III, IV, V");
        }
        if (volume < 1) {
            errors.add("Invalid volume: " + matcher.group(2));
        } else if (volume > MAX_USUAL_VOLUME) {
            warnings.add("Unusual volume number: " + volume);
        }
        if (page < 1) {
            errors.add("Invalid page number: " + matcher.group(4));
        }
        if (!errors.isEmpty()) {
            return new ValidationResult(false, CitationType.COURT_DECISION, prefixLanguage, null, null, errors, warnings);
        }

        CourtDecision decision = new CourtDecision(volume, chamber.get(), page, consideration, prefixLanguage, input);
        String normalized = formatter.format(decision, prefixLanguage).citation();
        return new ValidationResult(true, CitationType.COURT_DECISION, prefixLanguage, normalized, decision, errors, warnings);
    }

    private ValidationResult validateStatute(String input, Language language) {
        CitationGrammar.Labels labels = CitationGrammar.labels(language);
        Matcher matcher = CitationGrammar.statutePattern(language).matcher(input);
        if (!matcher.matches()) {
            // "n." is shared by several languages; a grammar that fits the abbreviation decides
            Optional<Language> fitting = languageMatchingStatute(input, language);
            if (fitting.isPresent()) {
                return validateStatute(input, fitting.get());
            }
            return ValidationResult.failure(CitationType.STATUTE, language,
                "Invalid statute citation format (" + language.code().toUpperCase(Locale.ROOT) + "). Expected: "
                    + labels.article() + " [number] [" + labels.paragraph() + " X] [" + labels.letter() + " a] ["
                    + labels.number() + " X] [statute]");
        }

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        String marker = matcher.group(CitationGrammar.ST_MARKER);
        if (matcher.group(CitationGrammar.ST_SPACE).isEmpty()) {
            errors.add("Missing space after article marker '" + marker + "'. Expected: " + labels.article() + " "
                + matcher.group(CitationGrammar.ST_ARTICLE) + " ...");
        }
        if (!marker.equals(labels.article())) {
            warnings.add("Article marker '" + marker + "' should be written '" + labels.article() + "' in "
                + language.code() + " citations");
        }

        String token = matcher.group(CitationGrammar.ST_CODE);
        Optional<StatuteCode> code = StatuteCode.fromAbbreviation(token, language);
        if (code.isEmpty()) {
            Optional<StatuteCode> elsewhere = StatuteCode.fromAbbreviation(token);
            // "let." is both French and English; the abbreviation decides
            if (elsewhere.isPresent()) {
                for (Language other : elsewhere.get().languagesFor(token)) {
                    if (other != language && CitationGrammar.statutePattern(other).matcher(input).matches()) {
                        return validateStatute(input, other);
                    }
                }
            }
            if (elsewhere.isPresent() && elsewhere.get().abbreviation(language).isPresent()) {
                errors.add("Statute code '" + token + "' is not used in " + language.code() + " citations. Use '"
                    + elsewhere.get().abbreviation(language).get() + "'");
            } else {
                errors.add("Unknown statute code: " + token);
            }
        }
        int article = Integer.parseInt(matcher.group(CitationGrammar.ST_ARTICLE));
        if (article < 1) {
            errors.add("Invalid article number: " + matcher.group(CitationGrammar.ST_ARTICLE));
        }
        if (matcher.group(CitationGrammar.ST_TRAILER) != null) {
            warnings.add("Embedded court decision reference ignored: " + matcher.group(CitationGrammar.ST_TRAILER).trim());
        }
        if (!errors.isEmpty()) {
            return new ValidationResult(false, CitationType.STATUTE, language, null, null, errors, warnings);
        }

        String suffix = matcher.group(CitationGrammar.ST_SUFFIX);
        String letter = matcher.group(CitationGrammar.ST_LETTER);
        Statute statute = Statute.builder(code.get(), article)
            .articleSuffix(suffix == null ? null : suffix.toLowerCase(Locale.ROOT))
            .paragraph(parseOptional(matcher.group(CitationGrammar.ST_PARAGRAPH)))
            .letter(letter == null ? null : letter.toLowerCase(Locale.ROOT))
            .number(parseOptional(matcher.group(CitationGrammar.ST_NUMBER)))
            .sourceLanguage(language)
            .rawText(input)
            .build();
        String normalized = formatter.format(statute, language).citation();
        return new ValidationResult(true, CitationType.STATUTE, language, normalized, statute, errors, warnings);
    }

    private static Optional<Language> languageMatchingStatute(String input, Language detected) {
        for (Language other : Language.values()) {
            if (other == detected) {
                continue;
            }
            Matcher matcher = CitationGrammar.statutePattern(other).matcher(input);
            if (matcher.matches()
                && StatuteCode.fromAbbreviation(matcher.group(CitationGrammar.ST_CODE), other).isPresent()) {
                return Optional.of(other);
            }
        }
        return Optional.empty();
    }

    private ValidationResult validateCantonalDecision(String input, Language language) {
        Matcher matcher = CitationGrammar.CANTONAL_DECISION.matcher(input);
        if (!matcher.matches()) {
            return ValidationResult.failure(CitationType.CANTONAL_DECISION, language,
                "Invalid cantonal citation format. Expected: [court]-[year]-[number]");
        }
        CantonalDecision decision = new CantonalDecision(
            matcher.group(1).toUpperCase(Locale.ROOT),
            Integer.parseInt(matcher.group(2)),
            matcher.group(3),
            language,
            input);
        String normalized = formatter.format(decision, language).citation();
        return new ValidationResult(true, CitationType.CANTONAL_DECISION, language, normalized, decision, List.of(), List.of());
    }

    private ValidationResult validateDoctrine(String input) {
        Matcher matcher = CitationGrammar.DOCTRINE.matcher(input);
        if (!matcher.matches()) {
            return ValidationResult.failure(CitationType.DOCTRINE, Language.DE,
                "Invalid commentary citation format. Expected: [series] [statute] [volume]-[author], Art. [number] N [margin]");
        }
        String series = matcher.group(1);
        Language language = CitationGrammar.languageOfSeries(series);
        List<String> warnings = new ArrayList<>();
        if (StatuteCode.fromAbbreviation(matcher.group(2)).isEmpty()) {
            warnings.add("Commented statute not recognised: " + matcher.group(2));
        }
        Doctrine doctrine = new Doctrine(
            series,
            matcher.group(2),
            matcher.group(3),
            matcher.group(4).trim(),
            matcher.group(5),
            Integer.parseInt(matcher.group(6)),
            language,
            input);
        String normalized = formatter.format(doctrine, language).citation();
        return new ValidationResult(true, CitationType.DOCTRINE, language, normalized, doctrine, List.of(), warnings);
    }

    private static Integer parseOptional(String value) {
        return value == null ? null : Integer.valueOf(value);
    }
}

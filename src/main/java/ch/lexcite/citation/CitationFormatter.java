package ch.lexcite.citation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Renders parsed citations in any supported language.
 *
 * <p>Output depends only on the citation components and the target language.
 * The source language and raw text are never consulted except to decide whether
 * a commentary reference can be rendered at all.</p>
 */
@ApplicationScoped
public class CitationFormatter {

    private static final Logger LOG = Logger.getLogger(CitationFormatter.class);

    /**
     * Formats a citation without a full reference.
     */
    @NotNull
    public FormattedCitation format(@NotNull Citation citation, @NotNull Language target) {
        return format(citation, target, FormatOptions.DEFAULT);
    }

    /**
     * Formats a citation in the target language.
     *
     * @param citation parsed citation
     * @param target   target language
     * @param options  rendering switches
     * @return rendered citation
     * @throws CitationFormatException if the citation has no rendering in the target language
     */
    @NotNull
    public FormattedCitation format(@NotNull Citation citation, @NotNull Language target, @NotNull FormatOptions options) {
        if (citation instanceof CourtDecision decision) {
            return new FormattedCitation(formatCourtDecision(decision, target), target, citation.type(), null);
        }
        if (citation instanceof Statute statute) {
            String rendered = formatStatute(statute, target);
            return new FormattedCitation(rendered, target, citation.type(), fullReference(rendered, statute.code(), target, options));
        }
        if (citation instanceof CantonalDecision decision) {
            return new FormattedCitation(decision.reference(), target, citation.type(), null);
        }
        if (citation instanceof Doctrine doctrine) {
            return new FormattedCitation(formatDoctrine(doctrine, target), target, citation.type(), null);
        }
        throw new CitationFormatException("Cannot format unrecognised citation: " + citation.rawText());
    }

    /**
     * Formats the citation in every supported language.
     *
     * <p>Languages without a rendering are left out of the result.</p>
     *
     * @param citation parsed citation
     * @return renderings keyed by language, possibly empty
     */
    @NotNull
    public Map<Language, FormattedCitation> getAllTranslations(@NotNull Citation citation) {
        Map<Language, FormattedCitation> translations = new EnumMap<>(Language.class);
        for (Language language : Language.values()) {
            try {
                translations.put(language, format(citation, language));
            } catch (CitationFormatException e) {
                LOG.debugf("No %s rendering for '%s': %s", language.code(), citation.rawText(), e.getMessage());
            }
        }
        return Collections.unmodifiableMap(translations);
    }

    /**
     * Translates a statute abbreviation from any language into the target language.
     *
     * @param abbreviation abbreviation as written, e.g. "CO"
     * @param target       target language
     * @return the abbreviation in the target language, or empty if unknown
     */
    public Optional<String> convertStatuteCode(String abbreviation, @NotNull Language target) {
        return StatuteCode.fromAbbreviation(abbreviation).flatMap(code -> code.abbreviation(target));
    }

    private String formatCourtDecision(CourtDecision decision, Language target) {
        CitationGrammar.Labels labels = CitationGrammar.labels(target);
        StringBuilder sb = new StringBuilder()
            .append(labels.courtPrefix()).append(' ')
            .append(decision.volume()).append(' ')
            .append(decision.chamber().name()).append(' ')
            .append(decision.page());
        decision.considerationRef().ifPresent(ref -> sb.append(' ').append(labels.consideration()).append(' ').append(ref));
        return sb.toString();
    }

    private String formatStatute(Statute statute, Language target) {
        CitationGrammar.Labels labels = CitationGrammar.labels(target);
        String abbreviation = statute.code().abbreviation(target)
            .orElseThrow(() -> new CitationFormatException(
                "Statute " + statute.code().name() + " has no " + target.code() + " abbreviation"));

        StringBuilder sb = new StringBuilder()
            .append(labels.article()).append(' ')
            .append(statute.articleLabel());
        if (statute.paragraph() != null) {
            sb.append(' ').append(labels.paragraph()).append(' ').append(statute.paragraph());
        }
        if (statute.letter() != null) {
            sb.append(' ').append(labels.letter()).append(' ').append(statute.letter());
        }
        if (statute.number() != null) {
            sb.append(' ').append(labels.number()).append(' ').append(statute.number());
        }
        return sb.append(' ').append(abbreviation).toString();
    }

    private String formatDoctrine(Doctrine doctrine, Language target) {
        if (doctrine.sourceLanguage() != target) {
            throw new CitationFormatException("Commentary " + doctrine.series() + " is only cited in "
                + doctrine.sourceLanguage().code());
        }
        StringBuilder sb = new StringBuilder()
            .append(doctrine.series()).append(' ')
            .append(doctrine.statute());
        if (doctrine.volume() != null) {
            sb.append(' ').append(doctrine.volume());
        }
        return sb.append('-').append(doctrine.author())
            .append(", ").append(CitationGrammar.labels(target).article())
            .append(' ').append(doctrine.article())
            .append(" N ").append(doctrine.marginNote())
            .toString();
    }

    private static String fullReference(String rendered, StatuteCode code, Language target, FormatOptions options) {
        if (!options.fullStatuteName() && !options.includeSrNumber()) {
            return null;
        }
        StringBuilder details = new StringBuilder();
        if (options.fullStatuteName()) {
            code.fullName(target).ifPresent(details::append);
        }
        if (options.includeSrNumber()) {
            if (details.length() > 0) {
                details.append(", ");
            }
            details.append("SR ").append(code.srNumber());
        }
        return details.length() == 0 ? null : rendered + " (" + details + ")";
    }
}

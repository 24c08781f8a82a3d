package ch.lexcite.citation;

import java.util.Objects;
import java.util.Optional;

import org.jetbrains.annotations.Nullable;

/**
 * Published Federal Supreme Court decision, e.g. {@code BGE 147 IV 73}.
 *
 * <p>Volume, chamber and page are the same in all languages; only the prefix
 * (BGE/ATF/DTF) and the consideration label change.</p>
 *
 * @param volume        volume of the official series, positive
 * @param chamber       section numeral
 * @param page          first page of the decision, positive
 * @param consideration consideration reference such as "3.2", or null
 * @param sourceLanguage language implied by the input
 * @param rawText       original input
 */
public record CourtDecision(
    int volume,
    Chamber chamber,
    int page,
    @Nullable String consideration,
    Language sourceLanguage,
    String rawText
) implements Citation {

    public CourtDecision {
        Objects.requireNonNull(chamber, "chamber must not be null");
        Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
        Objects.requireNonNull(rawText, "rawText must not be null");
        if (volume <= 0) {
            throw new IllegalArgumentException("volume must be positive, got: " + volume);
        }
        if (page <= 0) {
            throw new IllegalArgumentException("page must be positive, got: " + page);
        }
    }

    /**
     * Creates a decision reference without consideration and with a synthetic raw text.
     */
    public static CourtDecision of(int volume, Chamber chamber, int page) {
        return new CourtDecision(volume, chamber, page, null, Language.DE,
            "BGE " + volume + " " + chamber.name() + " " + page);
    }

    public Optional<String> considerationRef() {
        return Optional.ofNullable(consideration);
    }

    @Override
    public CitationType type() {
        return CitationType.COURT_DECISION;
    }
}

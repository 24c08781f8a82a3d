package ch.lexcite.citation;

import java.util.Objects;

import org.jetbrains.annotations.Nullable;

/**
 * Reference to a commentary, e.g. {@code BSK OR I-Wiegand, Art. 97 N 12}.
 *
 * <p>Commentaries are cited in the language they are published in, so a
 * doctrine reference is only rendered in its {@link #sourceLanguage()}.</p>
 *
 * @param series        commentary series (BSK, CR, ZK, ...)
 * @param statute       abbreviation of the commented statute, as written
 * @param volume        volume numeral, or null
 * @param author        author name(s)
 * @param article       commented article, including any suffix
 * @param marginNote    margin number (N/n.)
 * @param sourceLanguage language of the commentary
 * @param rawText       original input
 */
public record Doctrine(
    String series,
    String statute,
    @Nullable String volume,
    String author,
    String article,
    int marginNote,
    Language sourceLanguage,
    String rawText
) implements Citation {

    public Doctrine {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(statute, "statute must not be null");
        Objects.requireNonNull(author, "author must not be null");
        Objects.requireNonNull(article, "article must not be null");
        Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
        Objects.requireNonNull(rawText, "rawText must not be null");
    }

    @Override
    public CitationType type() {
        return CitationType.DOCTRINE;
    }
}

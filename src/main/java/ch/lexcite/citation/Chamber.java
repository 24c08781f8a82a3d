package ch.lexcite.citation;

import java.util.Locale;
import java.util.Optional;

/**
 * Sections of the official Federal Supreme Court decision series.
 *
 * <p>The chamber numeral is identical in BGE, ATF and DTF citations.</p>
 */
public enum Chamber {
    /** Constitutional law. */
    I,
    /** Administrative and international public law. */
    II,
    /** Civil law and debt enforcement. */
    III,
    /** Criminal law. */
    IV,
    /** Social insurance law. */
    V;

    /**
     * Parses a Roman numeral, ignoring case.
     *
     * @param numeral the numeral as written in the citation
     * @return the chamber, or empty if the numeral is not I to V
     */
    public static Optional<Chamber> fromNumeral(String numeral) {
        if (numeral == null) {
            return Optional.empty();
        }
        String upper = numeral.trim().toUpperCase(Locale.ROOT);
        for (Chamber chamber : values()) {
            if (chamber.name().equals(upper)) {
                return Optional.of(chamber);
            }
        }
        return Optional.empty();
    }
}

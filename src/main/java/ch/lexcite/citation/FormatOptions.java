package ch.lexcite.citation;

/**
 * Rendering switches for {@link CitationFormatter}.
 *
 * @param fullStatuteName append the official statute title as full reference
 * @param includeSrNumber append the SR number to the full reference
 */
public record FormatOptions(boolean fullStatuteName, boolean includeSrNumber) {

    public static final FormatOptions DEFAULT = new FormatOptions(false, false);

    public static FormatOptions withFullName() {
        return new FormatOptions(true, false);
    }
}

package ch.lexcite.citation;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Output style for document standardization.
 */
public enum StandardizeStyle {
    /** Citation only, e.g. {@code Art. 97 Abs. 1 OR}. */
    SHORT,
    /** Citation followed by the statute title. */
    LONG,
    /** Citation followed by the statute title and SR number. */
    ACADEMIC;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StandardizeStyle fromValue(String value) {
        if (value == null || value.isBlank()) {
            return SHORT;
        }
        for (StandardizeStyle style : values()) {
            if (style.value().equalsIgnoreCase(value.trim())) {
                return style;
            }
        }
        throw new IllegalArgumentException("Unsupported style: " + value + ". Supported: short, long, academic");
    }

    FormatOptions formatOptions() {
        switch (this) {
            case LONG:
                return FormatOptions.withFullName();
            case ACADEMIC:
                return new FormatOptions(true, true);
            default:
                return FormatOptions.DEFAULT;
        }
    }
}

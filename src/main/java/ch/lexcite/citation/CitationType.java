package ch.lexcite.citation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of legal references recognised by the parser.
 */
public enum CitationType {

    /**
     * Published Federal Supreme Court decision (BGE/ATF/DTF).
     */
    COURT_DECISION("court_decision"),

    /**
     * Article of a federal statute.
     */
    STATUTE("statute"),

    /**
     * Cantonal court case number.
     */
    CANTONAL_DECISION("cantonal_decision"),

    /**
     * Commentary (legal doctrine) reference.
     */
    DOCTRINE("doctrine"),

    /**
     * Input that matched no known grammar.
     */
    UNKNOWN("unknown");

    private final String value;

    CitationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Resolves a wire value such as "court_decision"; enum names are accepted too.
     *
     * @throws IllegalArgumentException for unknown values
     */
    @JsonCreator
    public static CitationType fromValue(String value) {
        for (CitationType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown citation type: " + value);
    }
}

package ch.lexcite.storage;

/**
 * Level of the court that issued a decision.
 */
public enum CourtLevel {
    FEDERAL,
    CANTONAL
}

package com.farearound.search.enums;

/**
 * Whether a traveller should book the best fare now or wait for a better one.
 */
public enum Recommendation {
    BOOK,
    WAIT
}

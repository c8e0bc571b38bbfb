package io.chunkvault.index;

/**
 * Storage class of a chunk. Affects retrieval cost, never correctness.
 */
public enum Tier {
    HOT,
    WARM,
    COLD
}

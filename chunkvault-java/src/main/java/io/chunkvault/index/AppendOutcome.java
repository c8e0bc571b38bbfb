package io.chunkvault.index;

public enum AppendOutcome {
    APPENDED,
    /** Same digest was already recorded at this index; the retry is a no-op. */
    ALREADY_PRESENT
}

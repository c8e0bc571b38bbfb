package io.chunkvault.index;

public enum InsertOutcome {
    INSERTED,
    ALREADY_EXISTS
}

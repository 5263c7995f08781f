package engine;

public enum ErrorKind {
    EMPTY_INPUT,
    UNKNOWN_ALGORITHM,
    INVALID_INPUT,
    INTERNAL_INCONSISTENCY
}

package blackcap.coordinator.error;

/**
 * Coarse classification of failures, shared by exceptions, batch item results and HTTP status mapping.
 */
public enum ErrorKind {
    /** Bad input shape, rejected before any side effect */
    VALIDATION,
    /** Referenced job, schedule or cluster is absent */
    NOT_FOUND,
    /** Uniqueness or lifecycle invariant violated */
    CONFLICT,
    /** Retryable backend failure (network, timeout) */
    TRANSIENT_BACKEND,
    /** Non-retryable backend rejection */
    PERMANENT_BACKEND,
    /** Identity provider denied the request */
    UNAUTHORIZED,
    /** Anything else (database failure, bug) */
    INTERNAL
}

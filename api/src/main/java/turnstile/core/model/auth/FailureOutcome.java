package turnstile.core.model.auth;

/**
 * Result of recording one failed attempt.
 *
 * @param failureCount failures in the current attempt sequence
 * @param remainingAttempts failures left before lockout; 0 once locked
 * @param lockStarted whether this failure put an unlocked key under lockout
 */
public record FailureOutcome(int failureCount, int remainingAttempts, boolean lockStarted) {}

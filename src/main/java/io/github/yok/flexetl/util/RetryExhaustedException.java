package io.github.yok.flexetl.util;

import lombok.Getter;

/**
 * Fatal error raised by {@link RetryPolicy} once every attempt of an operation has failed.
 *
 * <p>
 * The failures of the individual attempts are logged by {@link RetryPolicy}; they are not chained
 * into this exception.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class RetryExhaustedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    // Name of the wrapped operation
    private final String operation;
    // Number of attempts made before giving up
    private final int attempts;

    /**
     * Creates the exception for the given operation.
     *
     * @param operation name of the wrapped operation
     * @param attempts number of attempts made
     */
    public RetryExhaustedException(String operation, int attempts) {
        super("Operation " + operation + " failed after " + attempts + " attempts.");
        this.operation = operation;
        this.attempts = attempts;
    }
}

package io.github.yok.flexetl.util;

/**
 * Unchecked exception raised when a query against the source or sink store fails.
 *
 * <p>
 * Query failures are never retried: they abort the current run and propagate to the caller of
 * {@code runEtl()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class EtlException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public EtlException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and the underlying cause.
     *
     * @param message detail message
     * @param cause underlying cause
     */
    public EtlException(String message, Throwable cause) {
        super(message, cause);
    }
}

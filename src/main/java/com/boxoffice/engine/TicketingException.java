package com.boxoffice.engine;

/**
 * <p>
 * Base class of all errors reported by the {@link InventoryEngine}.
 * </p>
 *
 * <p>
 * Every subclass names one kind of failure so that callers (e.g., a transport
 * adapter) can relay the exact classification instead of a generic error.
 * </p>
 */
public abstract class TicketingException extends Exception {
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new exception with the given message.
     *
     * @param message Description of the failure.
     */
    protected TicketingException(final String message) {
        super(message);
    }

    /**
     * Constructs a new exception with the given message and cause.
     *
     * @param message Description of the failure.
     * @param cause   Underlying failure.
     */
    protected TicketingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

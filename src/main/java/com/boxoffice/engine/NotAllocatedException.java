package com.boxoffice.engine;

/**
 * A ticket identifier was never issued or lies outside the record table.
 */
public class NotAllocatedException extends TicketingException {
    private static final long serialVersionUID = 1L;

    /**
     * The requested identifier.
     */
    private final int ticketNumber;

    /**
     * Constructs a new {@link NotAllocatedException}.
     *
     * @param ticketNumber The requested identifier.
     * @param message      Description of the problem.
     */
    public NotAllocatedException(final int ticketNumber, final String message) {
        super(message);
        this.ticketNumber = ticketNumber;
    }

    /**
     * Wraps a lower-level {@link NotAllocatedException} with the failed
     * operation.
     *
     * @param operation Name of the failed operation.
     * @param cause     Underlying failure.
     */
    public NotAllocatedException(final String operation, final NotAllocatedException cause) {
        super(operation + " failed: " + cause.getMessage(), cause);
        this.ticketNumber = cause.getTicketNumber();
    }

    /**
     * Returns the requested identifier.
     *
     * @return The requested identifier.
     */
    public int getTicketNumber() {
        return this.ticketNumber;
    }
}

package com.boxoffice.engine;

/**
 * <p>
 * No further ticket identifier can be issued.
 * </p>
 *
 * <p>
 * ⚠️ When raised because the capacity has been used up, this is the one fatal
 * condition of the engine: the record table is too small for the actual
 * demand and unique identifiers can no longer be guaranteed. The hosting
 * process is informed through its {@link FatalErrorListener}.
 * </p>
 */
public class ExhaustedSourceException extends TicketingException {
    private static final long serialVersionUID = 1L;

    /**
     * Number of identifiers the source could issue.
     */
    private final int capacity;

    /**
     * Whether the source was closed explicitly rather than used up.
     */
    private final boolean closed;

    /**
     * Constructs a new {@link ExhaustedSourceException}.
     *
     * @param capacity Number of identifiers the source could issue.
     * @param closed   Whether the source was closed explicitly.
     */
    public ExhaustedSourceException(final int capacity, final boolean closed) {
        super(closed
                ? "Cannot get another ticket: the identifier source has been closed"
                : String.format("Cannot get another ticket: all %d ticket numbers have been issued", capacity));
        this.capacity = capacity;
        this.closed = closed;
    }

    /**
     * Returns the number of identifiers the source could issue.
     *
     * @return Capacity of the source.
     */
    public int getCapacity() {
        return this.capacity;
    }

    /**
     * Returns whether the source was closed explicitly (orderly shutdown) as
     * opposed to running out of identifiers.
     *
     * @return Whether the source was closed explicitly.
     */
    public boolean isClosed() {
        return this.closed;
    }

    /**
     * Returns whether this condition must bring the process down.
     *
     * @return {@code true} if the capacity has been used up.
     */
    public boolean isFatal() {
        return !this.closed;
    }
}

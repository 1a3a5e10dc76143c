package com.boxoffice.engine;

/**
 * <p>
 * A sale failed after identifiers had already been drawn.
 * </p>
 *
 * <p>
 * The tickets and receipt assembled before the failure are available through
 * {@link #getPartialResult()}. Seats consumed for those requests are not
 * given back.
 * </p>
 */
public class SaleAbortedException extends TicketingException {
    private static final long serialVersionUID = 1L;

    /**
     * 1-based number of the request being processed when the sale failed.
     */
    private final int requestNumber;

    /**
     * Whatever was assembled before the failure.
     */
    private final transient SaleResult partialResult;

    /**
     * Constructs a new {@link SaleAbortedException}.
     *
     * @param requestNumber 1-based number of the failing request.
     * @param partialResult Tickets and receipt assembled so far.
     * @param cause         Underlying failure.
     */
    public SaleAbortedException(final int requestNumber, final SaleResult partialResult, final Throwable cause) {
        super(String.format("Sell failed: ticket request %d: %s", requestNumber, cause.getMessage()), cause);
        this.requestNumber = requestNumber;
        this.partialResult = partialResult;
    }

    /**
     * Returns the 1-based number of the failing request.
     *
     * @return Number of the failing request.
     */
    public int getRequestNumber() {
        return this.requestNumber;
    }

    /**
     * Returns the tickets and receipt assembled before the failure.
     *
     * @return Partial result of the sale.
     */
    public SaleResult getPartialResult() {
        return this.partialResult;
    }

    /**
     * Returns whether the sale failed because identifiers ran out.
     *
     * @return Whether the cause is a fatal {@link ExhaustedSourceException}.
     */
    public boolean isFatal() {
        return this.getCause() instanceof ExhaustedSourceException
                && ((ExhaustedSourceException) this.getCause()).isFatal();
    }
}

package com.boxoffice.engine;

/**
 * <p>
 * A sell request is malformed.
 * </p>
 *
 * <p>
 * Validation happens before any identifier or seat is consumed, so a caller
 * receiving this exception can simply correct the request and retry.
 * </p>
 */
public class ValidationException extends TicketingException {
    private static final long serialVersionUID = 1L;

    /**
     * Index (1-based) of the offending ticket request, or 0 if the window is
     * out of range.
     */
    private final int requestNumber;

    /**
     * Name of the offending field.
     */
    private final String field;

    /**
     * Constructs a new {@link ValidationException}.
     *
     * @param requestNumber 1-based request number, 0 for the window.
     * @param field         Name of the offending field.
     * @param value         Rejected value.
     * @param low           Smallest accepted value.
     * @param high          Largest accepted value.
     */
    public ValidationException(final int requestNumber, final String field, final int value, final int low,
            final int high) {
        super(requestNumber == 0
                ? String.format("Sell failed: %s %d out of range, must be between %d and %d", field, value, low, high)
                : String.format("Sell failed: ticket request %d: %s %d out of range, must be between %d and %d",
                        requestNumber, field, value, low, high));
        this.requestNumber = requestNumber;
        this.field = field;
    }

    /**
     * Returns the 1-based number of the offending request (0 for the window).
     *
     * @return Number of the offending request.
     */
    public int getRequestNumber() {
        return this.requestNumber;
    }

    /**
     * Returns the name of the offending field.
     *
     * @return Name of the offending field.
     */
    public String getField() {
        return this.field;
    }
}

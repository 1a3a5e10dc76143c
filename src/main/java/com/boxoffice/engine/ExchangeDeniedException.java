package com.boxoffice.engine;

/**
 * <p>
 * A goodie exchange was refused by a business rule.
 * </p>
 *
 * <p>
 * Denials are expected and frequent; they are not failures of the system.
 * </p>
 */
public class ExchangeDeniedException extends TicketingException {
    private static final long serialVersionUID = 1L;

    /**
     * Why an exchange was denied.
     */
    public static enum Reason {
        /**
         * The ticket does not entitle the customer to goodies, either because
         * the showing was sold out or because it was not bought at the goodie
         * window.
         */
        NOT_ENTITLED("Exchange denied: customer is not entitled to goodies by this ticket"),
        /**
         * An exchange was already made with this ticket.
         */
        ALREADY_EXCHANGED("Exchange denied: a goodie exchange was already made with this ticket"),
        /**
         * The theatre has run out of goods to exchange.
         */
        OUT_OF_GOODS("Exchange denied: the theatre has run out of exchange goods");

        private final String message;

        Reason(final String message) {
            this.message = message;
        }

        /**
         * Returns the message reported to the customer.
         *
         * @return Message reported to the customer.
         */
        public String getMessage() {
            return this.message;
        }
    }

    private final Reason reason;

    /**
     * Constructs a new {@link ExchangeDeniedException}.
     *
     * @param reason Why the exchange was denied.
     */
    public ExchangeDeniedException(final Reason reason) {
        super(reason.getMessage());
        this.reason = reason;
    }

    /**
     * Returns why the exchange was denied.
     *
     * @return Why the exchange was denied.
     */
    public Reason getReason() {
        return this.reason;
    }
}

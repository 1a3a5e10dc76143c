package com.boxoffice.engine;

/**
 * Sales are not open, either because the engine has not been initialized yet
 * or because it has been shut down.
 */
public class ServiceNotOpenException extends TicketingException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new {@link ServiceNotOpenException}.
     *
     * @param operation Name of the refused operation.
     */
    public ServiceNotOpenException(final String operation) {
        super(operation + " failed: ticketing system is down");
    }
}

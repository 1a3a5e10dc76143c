package com.boxoffice.request;

/**
 * <p>
 * Interface for handling requests to the ticket service.
 * </p>
 */
public interface RequestHandler {
    /**
     * <p>
     * Handle a request and respond to it.
     * </p>
     *
     * <p>
     * ⚠️ This method may be called from different threads!
     * </p>
     *
     * @param request {@link Request} to be handled.
     */
    public void handle(Request request);

    /**
     * <p>
     * Shut the ticket service down.
     * </p>
     *
     * <p>
     * When this method returns, the engine has stopped issuing tickets.
     * </p>
     */
    public void shutdown();
}

package com.boxoffice.engine;

/**
 * <p>
 * Hook through which the {@link InventoryEngine} hands a fatal condition to
 * the hosting process.
 * </p>
 *
 * <p>
 * The engine has already logged the condition with its diagnostics when the
 * listener is invoked. A server is expected to shut down cleanly; tests may
 * simply record the call.
 * </p>
 */
public interface FatalErrorListener {
    /**
     * Listener which does nothing beyond the engine's own logging.
     */
    FatalErrorListener NONE = error -> {
    };

    /**
     * Called once for every fatal condition, on the thread which detected it.
     *
     * @param error The fatal condition.
     */
    void onFatalError(ExhaustedSourceException error);
}

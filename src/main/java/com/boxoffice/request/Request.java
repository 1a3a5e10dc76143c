package com.boxoffice.request;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * <p>
 * Represents a request to the ticket service.
 * </p>
 *
 * <p>
 * Every request has a {@link Method} and a {@link Kind}. Parameters are
 * carried by the path segments following the kind's prefix, e.g., the window
 * of {@code /tickets/sell/2}, and by an optional body.
 * </p>
 */
public abstract class Request {

    /**
     * The <em>method</em> of the request.
     */
    public enum Method {
        /**
         * Retrieves information; the exchange URL also accepts it.
         */
        GET,
        /**
         * Sends information to the service and may have side effects.
         */
        POST;

        /**
         * Returns a {@link Method} based on its name.
         *
         * @param method Name of the method.
         *
         * @return An optional {@link Method} which is empty in case the string
         *         is invalid.
         */
        public static Optional<Method> fromName(final String method) {
            return switch (method) {
                case "GET" ->
                    Optional.of(Method.GET);
                case "POST" ->
                    Optional.of(Method.POST);
                default ->
                    Optional.empty();
            };
        }
    }

    /**
     * There are four kinds of requests.
     */
    public enum Kind {
        /**
         * Opens the ticket sales system with the limits in the JSON body.
         */
        INIT("/tickets/init"),
        /**
         * Sells tickets at the window given by the first path parameter.
         */
        SELL("/tickets/sell"),
        /**
         * Exchanges a goodie; path parameters are ticket number, old good and
         * new good.
         */
        EXCHANGE("/tickets/exchange"),
        /**
         * Stops the service, optionally with a return code as path parameter.
         */
        STOP("/tickets/stop");

        private final String prefix;

        Kind(final String prefix) {
            this.prefix = prefix;
        }

        /**
         * Returns the path prefix of this kind.
         *
         * @return Path prefix.
         */
        public String getPrefix() {
            return this.prefix;
        }

        /**
         * Returns a {@link Kind} based on its path.
         *
         * @param path The path.
         *
         * @return An optional {@link Kind} which is empty in case the path is
         *         invalid.
         */
        public static Optional<Kind> fromPath(final String path) {
            for (final var kind : Kind.values()) {
                if (path.equals(kind.prefix) || path.startsWith(kind.prefix + "/")) {
                    return Optional.of(kind);
                }
            }
            return Optional.empty();
        }
    }

    /**
     * Method of the request.
     */
    protected final Method method;
    /**
     * Kind of the request.
     */
    protected final Kind kind;
    /**
     * Path of the request.
     */
    protected final String path;

    /**
     * Constructs a new request from the provided parameters.
     *
     * @param method Method of the request.
     * @param kind   Kind of the request.
     * @param path   Path of the request.
     */
    public Request(final Method method, final Kind kind, final String path) {
        this.method = method;
        this.kind = kind;
        this.path = path;
    }

    /**
     * Returns the {@link Method} of the request.
     *
     * @return {@link Method} of the request.
     */
    public Method getMethod() {
        return this.method;
    }

    /**
     * Returns the {@link Kind} of the request.
     *
     * @return {@link Kind} of the request.
     */
    public Kind getKind() {
        return this.kind;
    }

    /**
     * Returns the path of the request.
     *
     * @return Path of the request.
     */
    public String getPath() {
        return this.path;
    }

    /**
     * Returns the non-empty path segments following the kind's prefix.
     *
     * @return Path parameters in order.
     */
    public List<String> getParameters() {
        final var rest = this.path.substring(Math.min(this.path.length(), this.kind.getPrefix().length()));
        return Arrays.stream(rest.split("/")).filter(segment -> !segment.isEmpty()).toList();
    }

    /**
     * Returns a path parameter if present.
     *
     * @param index Index of the parameter, 0-based.
     * @return The parameter if there is any.
     */
    public Optional<String> getParameter(final int index) {
        final var parameters = this.getParameters();
        return index < parameters.size() ? Optional.of(parameters.get(index)) : Optional.empty();
    }

    /**
     * <p>
     * Reads the body of the request.
     * </p>
     *
     * <p>
     * 📌 This method has side effects and should be called only once on each
     * request.
     * </p>
     *
     * @return The body, empty if there is none or it cannot be read.
     */
    public abstract String readBody();

    /**
     * <p>
     * Responds with an error indicating an invalid request (400).
     * </p>
     *
     * <p>
     * This method blocks until the response has been sent.
     * </p>
     *
     * @param message An optional error message to be sent to the client.
     */
    public void respondWithError(final String message) {
        this.respondWithError(400, message);
    }

    /**
     * Responds with an error and the given status code.
     *
     * @param code    HTTP status code.
     * @param message An optional error message to be sent to the client.
     */
    public abstract void respondWithError(final int code, final String message);

    /**
     * Responds with a JSON document.
     *
     * @param code HTTP status code.
     * @param json The JSON document.
     */
    public abstract void respondWithJson(final int code, final String json);

    /**
     * Responds with 204 (No Content).
     */
    public abstract void respondWithNoContent();
}

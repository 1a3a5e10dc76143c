package com.boxoffice.request;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.HttpExchange;

/**
 * A {@link Request} received by the JDK HTTP server.
 */
public class HttpRequest extends Request {
    private static final Logger LOG = LoggerFactory.getLogger(HttpRequest.class);

    /**
     * Underlying {@link HttpExchange} used for communication.
     */
    private final HttpExchange exchange;

    /**
     * Constructs a new request from the provided parameters.
     *
     * @param method   Method of the request.
     * @param kind     Kind of the request.
     * @param exchange {@link HttpExchange} used for communication.
     */
    public HttpRequest(final Method method, final Kind kind, final HttpExchange exchange) {
        super(method, kind, exchange.getRequestURI().getPath());
        this.exchange = exchange;
    }

    @Override
    public String readBody() {
        try {
            return new String(this.exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException error) {
            LOG.warn("Cannot read body of request {}", this.path, error);
            return "";
        }
    }

    /**
     * <p>
     * Sends a response to the client.
     * </p>
     *
     * <p>
     * This method blocks until the response has been sent.
     * </p>
     *
     * @param code        HTTP status code of the response.
     * @param contentType Content type of the body.
     * @param body        Body to send to the client.
     */
    protected void respond(final int code, final String contentType, final String body) {
        final var bytes = body.getBytes(StandardCharsets.UTF_8);
        try {
            this.exchange.getResponseHeaders().set("Content-Type", contentType);
            this.exchange.sendResponseHeaders(code, bytes.length == 0 ? -1 : bytes.length);
            try (OutputStream stream = this.exchange.getResponseBody()) {
                stream.write(bytes);
            }
        } catch (IOException error) {
            LOG.warn("Error responding to client for {}", this.path, error);
        }
    }

    @Override
    public void respondWithError(final int code, final String message) {
        this.respond(code, "text/plain; charset=utf-8", message == null ? "" : message);
    }

    @Override
    public void respondWithJson(final int code, final String json) {
        this.respond(code, "application/json", json);
    }

    @Override
    public void respondWithNoContent() {
        try {
            this.exchange.sendResponseHeaders(204, -1);
        } catch (IOException error) {
            LOG.warn("Error responding to client for {}", this.path, error);
        } finally {
            this.exchange.close();
        }
    }
}

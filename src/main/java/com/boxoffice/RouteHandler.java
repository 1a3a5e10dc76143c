package com.boxoffice;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.boxoffice.request.HttpRequest;
import com.boxoffice.request.Request;
import com.boxoffice.request.RequestHandler;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

/**
 * Wraps each {@link HttpExchange} into a {@link Request} and hands it over to
 * a {@link RequestHandler}.
 */
class RouteHandler implements HttpHandler {
    private static final Logger LOG = LoggerFactory.getLogger(RouteHandler.class);

    /**
     * Request handler to hand requests over to.
     */
    private final RequestHandler requestHandler;

    /**
     * Constructs a new HTTP handler with the given request handler.
     *
     * @param requestHandler Request handler to hand requests over to.
     */
    public RouteHandler(final RequestHandler requestHandler) {
        this.requestHandler = requestHandler;
    }

    @Override
    public void handle(final HttpExchange exchange) throws IOException {
        // Set the CORS access control headers.
        final var headers = exchange.getResponseHeaders();
        headers.set("Access-Control-Request-Method", "*");
        headers.set("Access-Control-Allow-Origin", "*");
        headers.set("Access-Control-Allow-Headers", "*");
        // CORS pre-flight requests (OPTIONS) are handled directly with a 204 (No Content).
        if (exchange.getRequestMethod().equals("OPTIONS")) {
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return;
        }
        final var method = Request.Method.fromName(exchange.getRequestMethod());
        if (method.isEmpty()) {
            exchange.getResponseHeaders().set("Allow", "GET, POST");
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return;
        }
        final var kind = Request.Kind.fromPath(exchange.getRequestURI().getPath());
        if (kind.isEmpty()) {
            final var notFound = "404: Not Found!".getBytes();
            exchange.sendResponseHeaders(404, notFound.length);
            exchange.getResponseBody().write(notFound);
            exchange.close();
            return;
        }
        final var request = new HttpRequest(method.get(), kind.get(), exchange);
        try {
            this.requestHandler.handle(request);
        } catch (RuntimeException error) {
            // Otherwise the HTTP server drops the error silently.
            LOG.error("Runtime error while handling {}", request.getPath(), error);
            exchange.close();
        }
    }
}

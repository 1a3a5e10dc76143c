package com.boxoffice.service;

import java.util.function.IntConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.boxoffice.engine.ConfigurationException;
import com.boxoffice.engine.InventoryEngine;
import com.boxoffice.engine.SaleAbortedException;
import com.boxoffice.engine.SaleResult;
import com.boxoffice.engine.TicketingException;
import com.boxoffice.request.Request;
import com.boxoffice.request.RequestHandler;
import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * <p>
 * Exposes an {@link InventoryEngine} as a request/response service.
 * </p>
 *
 * <p>
 * The service only translates: it parses parameters, calls the engine and
 * maps each kind of engine error to a status code. Requests may arrive
 * concurrently; all synchronization is left to the engine.
 * </p>
 */
public class TicketService implements RequestHandler {
    private static final Logger LOG = LoggerFactory.getLogger(TicketService.class);

    private final InventoryEngine engine;
    private final JsonCodec codec;

    /**
     * Called with the requested return code after a stop request has been
     * answered.
     */
    private final IntConsumer stopHook;

    /**
     * Constructs a new {@link TicketService}.
     *
     * @param engine   Engine to expose.
     * @param codec    Codec for request and response bodies.
     * @param stopHook Called with the return code of a stop request.
     */
    public TicketService(final InventoryEngine engine, final JsonCodec codec, final IntConsumer stopHook) {
        this.engine = engine;
        this.codec = codec;
        this.stopHook = stopHook;
    }

    @Override
    public void handle(final Request request) {
        LOG.debug("{} {} called", request.getMethod(), request.getPath());
        switch (request.getKind()) {
            case INIT -> this.init(request);
            case SELL -> this.sell(request);
            case EXCHANGE -> this.exchange(request);
            case STOP -> this.stop(request);
        }
    }

    private void init(final Request request) {
        if (request.getMethod() != Request.Method.POST) {
            request.respondWithError(405, "init requires POST");
            return;
        }
        final InitPayload payload;
        try {
            payload = this.codec.readInit(request.readBody());
        } catch (JsonProcessingException error) {
            LOG.info("Request '{}' failed: data not in JSON format: {}", request.getPath(), error.getOriginalMessage());
            request.respondWithError("data not in JSON format");
            return;
        }
        try {
            this.engine.initialize(payload.toLimits());
            request.respondWithNoContent();
        } catch (ConfigurationException error) {
            LOG.info("Request '{}' failed: {}", request.getPath(), error.getMessage());
            request.respondWithError(error.getMessage());
        } catch (InterruptedException error) {
            Thread.currentThread().interrupt();
            request.respondWithError(503, "interrupted while waiting for initialization");
        }
    }

    private void sell(final Request request) {
        if (request.getMethod() != Request.Method.POST) {
            request.respondWithError(405, "sell requires POST");
            return;
        }
        final int window;
        try {
            window = Integer.parseInt(request.getParameter(0).orElse(""));
        } catch (NumberFormatException error) {
            LOG.info("Request '{}' failed: window number invalid", request.getPath());
            request.respondWithError("window number invalid");
            return;
        }
        final SellPayload payload;
        try {
            payload = this.codec.readSell(request.readBody());
        } catch (JsonProcessingException error) {
            LOG.info("Request '{}' failed: data not in JSON format: {}", request.getPath(), error.getOriginalMessage());
            request.respondWithError("data not in JSON format");
            return;
        }

        SaleResult result;
        int status = 200;
        try {
            result = this.engine.sell(window, payload.toTicketRequests(), payload.getPaymentInfo(),
                    payload.getLocalTime());
        } catch (SaleAbortedException error) {
            LOG.warn("Request '{}': {}", request.getPath(), error.getMessage());
            result = error.getPartialResult();
            // The engine has already informed the process of a fatal condition.
            status = error.isFatal() ? 503 : 400;
        } catch (TicketingException | IllegalArgumentException error) {
            LOG.info("Request '{}' failed: {}", request.getPath(), error.getMessage());
            request.respondWithError(error.getMessage());
            return;
        }

        try {
            request.respondWithJson(status, this.codec.writeSale(result));
        } catch (JsonProcessingException error) {
            LOG.error("Request '{}' failed: error rendering response", request.getPath(), error);
            request.respondWithError(500, "error rendering response");
        }
    }

    private void exchange(final Request request) {
        final var parameters = request.getParameters();
        if (parameters.size() < 3) {
            request.respondWithError("expected /tickets/exchange/<ticket number>/<old good>/<new good>");
            return;
        }
        final int ticketNumber;
        try {
            ticketNumber = Integer.parseInt(parameters.get(0));
        } catch (NumberFormatException error) {
            LOG.info("Request '{}' failed: ticket number invalid", request.getPath());
            request.respondWithError("ticket number invalid");
            return;
        }
        try {
            this.engine.exchange(ticketNumber, parameters.get(1), parameters.get(2));
            request.respondWithNoContent();
        } catch (TicketingException error) {
            LOG.info("Request '{}' failed: {}", request.getPath(), error.getMessage());
            request.respondWithError(error.getMessage());
        }
    }

    private void stop(final Request request) {
        if (request.getMethod() != Request.Method.POST) {
            request.respondWithError(405, "stop requires POST");
            return;
        }
        final int returnCode;
        try {
            returnCode = Integer.parseInt(request.getParameter(0).orElse("0"));
        } catch (NumberFormatException error) {
            request.respondWithError("server return code not an integer");
            return;
        }
        final var message = request.readBody();
        LOG.info("Stopping ticket service with return code {}{}", returnCode,
                message.isEmpty() ? "" : System.lineSeparator() + message);
        request.respondWithNoContent();
        this.shutdown();
        this.stopHook.accept(returnCode);
    }

    @Override
    public void shutdown() {
        this.engine.shutdown();
    }
}

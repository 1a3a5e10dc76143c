package com.boxoffice.service;

import java.io.Closeable;

import com.boxoffice.engine.LineItem;
import com.boxoffice.engine.Receipt;
import com.boxoffice.engine.SaleResult;
import com.boxoffice.engine.Ticket;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * <p>
 * Converts between the wire format of the ticket service and engine types.
 * </p>
 *
 * <p>
 * Field names follow the established wire format ({@code TicketNum},
 * {@code Ticks}, {@code Rcpt}, ...), which is why engine types are mapped by
 * hand rather than annotated.
 * </p>
 */
public class JsonCodec {
    private final ObjectMapper mapper;

    /**
     * Constructs a new codec using its own {@link ObjectMapper}.
     */
    public JsonCodec() {
        this(new ObjectMapper());
    }

    /**
     * Constructs a new codec.
     *
     * @param mapper Mapper to use.
     */
    public JsonCodec(final ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Parses an init request body.
     *
     * @param json The request body.
     * @return The parsed payload.
     * @throws JsonProcessingException If the body is not a valid JSON object.
     */
    public InitPayload readInit(final String json) throws JsonProcessingException {
        return requireObject(this.mapper.readValue(json, InitPayload.class));
    }

    /**
     * Parses a sell request body.
     *
     * @param json The request body.
     * @return The parsed payload.
     * @throws JsonProcessingException If the body is not a valid JSON object.
     */
    public SellPayload readSell(final String json) throws JsonProcessingException {
        return requireObject(this.mapper.readValue(json, SellPayload.class));
    }

    /**
     * Rejects a body consisting of the JSON literal {@code null}.
     */
    private static <T> T requireObject(final T payload) throws JsonMappingException {
        if (payload == null) {
            throw new JsonMappingException((Closeable) null, "expected a JSON object, got null");
        }
        return payload;
    }

    /**
     * Renders the response of a sale.
     *
     * @param result Tickets and receipt of the sale.
     * @return JSON object with the fields {@code Ticks} and {@code Rcpt}.
     * @throws JsonProcessingException If the response cannot be serialized.
     */
    public String writeSale(final SaleResult result) throws JsonProcessingException {
        final var root = this.mapper.createObjectNode();
        final var ticks = root.putArray("Ticks");
        for (final var ticket : result.getTickets()) {
            ticks.add(this.ticketNode(ticket));
        }
        root.set("Rcpt", this.receiptNode(result.getReceipt()));
        return this.mapper.writeValueAsString(root);
    }

    private ObjectNode ticketNode(final Ticket ticket) {
        final var node = this.mapper.createObjectNode();
        node.put("TicketNum", ticket.getTicketNumber());
        node.put("Movie", ticket.getMovie());
        node.put("Showing", ticket.getShowing());
        node.put("Price", ticket.getPrice());
        node.put("SoldOut", ticket.isSoldOut());
        node.put("Goodies", ticket.hasGoodies());
        node.put("Exchanged", ticket.isExchanged());
        node.put("XchOld", ticket.getOldGood());
        node.put("XchNew", ticket.getNewGood());
        node.put("Window", ticket.getWindow());
        return node;
    }

    private ObjectNode receiptNode(final Receipt receipt) {
        final var node = this.mapper.createObjectNode();
        if (receipt.getTime() == null) {
            node.putNull("Time");
        } else {
            node.set("Time", this.mapper.valueToTree(receipt.getTime()));
        }
        node.put("Window", receipt.getWindow());
        final var items = node.putArray("ItemsSold");
        for (final LineItem item : receipt.getItemsSold()) {
            items.addObject().put("Desc", item.getDescription()).put("Pennies", item.getPennies());
        }
        node.put("Total", receipt.getTotal());
        return node;
    }
}

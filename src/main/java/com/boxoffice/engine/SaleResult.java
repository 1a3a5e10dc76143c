package com.boxoffice.engine;

import java.util.Collections;
import java.util.List;

/**
 * Tickets and receipt produced by {@link InventoryEngine#sell}.
 */
public class SaleResult {
    /**
     * Issued tickets in request order, sold-out placeholders included.
     */
    private final List<Ticket> tickets;
    private final Receipt receipt;

    /**
     * Constructs a new {@link SaleResult}.
     *
     * @param tickets Issued tickets in request order.
     * @param receipt Receipt for the tickets actually sold.
     */
    public SaleResult(final List<Ticket> tickets, final Receipt receipt) {
        this.tickets = Collections.unmodifiableList(tickets);
        this.receipt = receipt;
    }

    public List<Ticket> getTickets() {
        return this.tickets;
    }

    public Receipt getReceipt() {
        return this.receipt;
    }

    @Override
    public String toString() {
        return String.format("SaleResult(tickets=%s, receipt=%s)", this.tickets, this.receipt);
    }
}

package com.boxoffice.engine;

import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * <p>
 * The table of ticket records, indexed by ticket identifier.
 * </p>
 *
 * <p>
 * The table holds one slot per issuable identifier plus slot 0, which is
 * never used so that an empty slot can stand for "not allocated". It tracks
 * sold tickets as well as sold-out placeholders.
 * </p>
 *
 * <p>
 * Reads and the two partial updates are serialized by a single lock covering
 * the whole table, so a sale update and an exchange update can never
 * interleave field by field. {@link #create(int)} does not take the lock:
 * every identifier reaches exactly one caller, and the slot is claimed with
 * an atomic compare-and-set.
 * </p>
 */
public class RecordStore {
    /**
     * Records by identifier; {@code null} means not allocated.
     */
    private final AtomicReferenceArray<Ticket> table;

    /**
     * Guards the contents of every record in {@link #table}.
     */
    private final Object lock = new Object();

    /**
     * Constructs a new, empty {@link RecordStore}.
     *
     * @param capacity Number of identifiers the table must hold.
     */
    public RecordStore(final int capacity) {
        this.table = new AtomicReferenceArray<>(capacity + 1);
    }

    /**
     * Returns the largest identifier the table can hold.
     *
     * @return Capacity of the table.
     */
    public int getCapacity() {
        return this.table.length() - 1;
    }

    /**
     * <p>
     * Marks a slot as allocated and returns a copy of the fresh record.
     * </p>
     *
     * <p>
     * An identifier beyond the table means the table is undersized for the
     * actual demand, which the caller has to treat as fatal.
     * </p>
     *
     * @param ticketNumber A freshly drawn identifier.
     * @return Copy of the new, zero-valued record.
     * @throws ExhaustedSourceException If the identifier does not fit into the table.
     */
    public Ticket create(final int ticketNumber) throws ExhaustedSourceException {
        if (ticketNumber < 1 || ticketNumber > this.getCapacity()) {
            throw new ExhaustedSourceException(this.getCapacity(), false);
        }
        final var ticket = new Ticket(ticketNumber);
        if (!this.table.compareAndSet(ticketNumber, null, ticket)) {
            throw new IllegalStateException(
                    String.format("Ticket %d has already been allocated, identifiers must be unique!", ticketNumber));
        }
        return new Ticket(ticket);
    }

    /**
     * Reads a copy of a record.
     *
     * @param ticketNumber Identifier of the record.
     * @return Copy of the record.
     * @throws NotAllocatedException If the identifier is out of range or has not been issued.
     */
    public Ticket read(final int ticketNumber) throws NotAllocatedException {
        synchronized (this.lock) {
            return new Ticket(this.slot("read", ticketNumber));
        }
    }

    /**
     * Overwrites the sale fields (movie, showing, price, sold-out, goodies,
     * window) of the record with the same identifier. Exchange fields are
     * ignored.
     *
     * @param ticket Ticket carrying the new sale fields.
     * @throws NotAllocatedException If the identifier is out of range or has not been issued.
     */
    public void updateSale(final Ticket ticket) throws NotAllocatedException {
        synchronized (this.lock) {
            this.slot("updateSale", ticket.getTicketNumber()).copySaleFrom(ticket);
        }
    }

    /**
     * Overwrites the exchange fields (exchanged, old good, new good) of the
     * record with the same identifier. Sale fields are ignored.
     *
     * @param ticket Ticket carrying the new exchange fields.
     * @throws NotAllocatedException If the identifier is out of range or has not been issued.
     */
    public void updateExchange(final Ticket ticket) throws NotAllocatedException {
        synchronized (this.lock) {
            this.slot("updateExchange", ticket.getTicketNumber()).copyExchangeFrom(ticket);
        }
    }

    /**
     * Looks up the stored record. Must be called with {@link #lock} held.
     */
    private Ticket slot(final String operation, final int ticketNumber) throws NotAllocatedException {
        // The table cannot shrink, the range check is safe in any case.
        if (ticketNumber < 1 || ticketNumber > this.getCapacity()) {
            throw new NotAllocatedException(ticketNumber,
                    String.format("%s failed: ticket number %d outside the table", operation, ticketNumber));
        }
        final var stored = this.table.get(ticketNumber);
        if (stored == null) {
            throw new NotAllocatedException(ticketNumber,
                    String.format("%s failed: ticket %d is not allocated", operation, ticketNumber));
        }
        if (stored.getTicketNumber() != ticketNumber) {
            throw new NotAllocatedException(ticketNumber, String.format(
                    "%s failed: ticket %d requested, but record is marked %d",
                    operation, ticketNumber, stored.getTicketNumber()));
        }
        return stored;
    }
}

package com.boxoffice.engine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class TestRecordStore {
    @Test
    public void testCreateAndRead() throws Exception {
        final var store = new RecordStore(10);
        final var created = store.create(3);
        assertEquals(3, created.getTicketNumber());
        assertFalse(created.isSoldOut());
        assertEquals("", created.getOldGood());

        final var read = store.read(3);
        assertEquals(3, read.getTicketNumber());
        assertEquals(0, read.getPrice());
    }

    @Test
    public void testReturnsCopies() throws Exception {
        final var store = new RecordStore(10);
        final var ticket = store.create(1);
        ticket.assign(2, 3, 1);
        // Not written back, so the stored record is unchanged.
        assertEquals(0, store.read(1).getMovie());
        store.read(1).assign(4, 4, 4);
        assertEquals(0, store.read(1).getMovie());
    }

    @Test
    public void testNotAllocated() throws Exception {
        final var store = new RecordStore(10);
        store.create(1);
        for (final var ticketNumber : new int[] { 0, 2, 11, -1 }) {
            try {
                store.read(ticketNumber);
                fail("Ticket " + ticketNumber + " must not be readable.");
            } catch (NotAllocatedException error) {
                assertEquals(ticketNumber, error.getTicketNumber());
            }
        }
        try {
            store.updateSale(new Ticket(2));
            fail("Updating an unallocated ticket must fail.");
        } catch (NotAllocatedException error) {
            assertEquals(2, error.getTicketNumber());
        }
    }

    @Test
    public void testCreateBeyondCapacity() throws Exception {
        final var store = new RecordStore(2);
        store.create(2);
        try {
            store.create(3);
            fail("The table holds only two tickets.");
        } catch (ExhaustedSourceException error) {
            assertTrue(error.isFatal());
            assertEquals(2, error.getCapacity());
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testCreateTwice() throws Exception {
        final var store = new RecordStore(2);
        store.create(1);
        store.create(1);
    }

    @Test
    public void testUpdatesAreDisjoint() throws Exception {
        final var store = new RecordStore(5);
        final var sale = store.create(4);
        final var exchange = new Ticket(sale);

        sale.assign(1, 2, 1);
        sale.price(1000, false);
        sale.grantGoodies();
        store.updateSale(sale);

        // The exchange copy was taken before the sale, its sale fields must be ignored.
        exchange.exchange("water", "soda");
        store.updateExchange(exchange);

        final var stored = store.read(4);
        assertEquals(1, stored.getMovie());
        assertEquals(2, stored.getShowing());
        assertEquals(1000, stored.getPrice());
        assertEquals(1, stored.getWindow());
        assertTrue(stored.hasGoodies());
        assertTrue(stored.isExchanged());
        assertEquals("water", stored.getOldGood());
        assertEquals("soda", stored.getNewGood());

        // And a later sale update leaves the exchange untouched.
        sale.price(1000, false);
        store.updateSale(sale);
        assertTrue(store.read(4).isExchanged());
    }
}

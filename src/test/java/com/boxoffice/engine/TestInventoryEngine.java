package com.boxoffice.engine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.After;
import org.junit.Test;

public class TestInventoryEngine {
    /**
     * Receives the fatal condition instead of terminating the test run.
     */
    private final AtomicReference<ExhaustedSourceException> fatal = new AtomicReference<>();

    private final InventoryEngine engine = new InventoryEngine(this.fatal::set);

    @After
    public void shutdownEngine() {
        this.engine.shutdown();
    }

    private static List<TicketRequest> requests(final int count, final int movie, final int showing) {
        return new ArrayList<>(Collections.nCopies(count, new TicketRequest(movie, showing)));
    }

    private SaleResult sell(final int window, final List<TicketRequest> requests) throws TicketingException {
        return this.engine.sell(window, requests, Map.of("Card", "1234"), "12:00");
    }

    @Test
    public void testClosedBeforeInitialize() throws Exception {
        assertFalse(this.engine.isOpen());
        assertNull(this.engine.getLimits());
        try {
            this.sell(1, requests(1, 0, 0));
            fail("Selling before initialization must fail.");
        } catch (ServiceNotOpenException error) {
            assertTrue(error.getMessage().contains("Sell"));
        }
        try {
            this.engine.exchange(1, "water", "soda");
            fail("Exchanging before initialization must fail.");
        } catch (ServiceNotOpenException error) {
            assertTrue(error.getMessage().contains("Exchange"));
        }
    }

    @Test
    public void testConfigurationErrorNamesField() throws Exception {
        ConfigurationException first = null;
        try {
            this.engine.initialize(10, 0, 3, 5, 2);
            fail("Zero movies must be rejected.");
        } catch (ConfigurationException error) {
            assertEquals("movies", error.getField());
            first = error;
        }
        // Initialization runs once, later callers get the same outcome.
        try {
            this.engine.initialize(10, 2, 3, 5, 2);
            fail("A failed initialization must not be repeated.");
        } catch (ConfigurationException error) {
            assertSame(first, error);
        }
        assertFalse(this.engine.isOpen());
    }

    @Test
    public void testEveryLimitIsChecked() throws Exception {
        final var cases = Map.of(
                "exchangeStock", new Limits(-1, 1, 1, 1, 1),
                "showingsPerMovie", new Limits(0, 1, 0, 1, 1),
                "seatsPerShowing", new Limits(0, 1, 1, 0, 1),
                "windows", new Limits(0, 1, 1, 1, 0),
                "capacity", new Limits(0, 65536, 65536, 1, 1));
        for (final var entry : cases.entrySet()) {
            try {
                new InventoryEngine().initialize(entry.getValue());
                fail(entry.getKey() + " must be rejected.");
            } catch (ConfigurationException error) {
                assertEquals(entry.getKey(), error.getField());
            }
        }
    }

    @Test
    public void testCapacityBeyondTableLimit() throws Exception {
        for (final var seats : new int[] { Integer.MAX_VALUE - 1, Limits.MAX_TICKET_CAPACITY + 1 }) {
            final var engine = new InventoryEngine();
            try {
                engine.initialize(0, 1, 1, seats, 1);
                fail(seats + " seats do not fit into the ticket table.");
            } catch (ConfigurationException error) {
                assertEquals("capacity", error.getField());
            }
            assertFalse(engine.isOpen());
        }
    }

    @Test
    public void testSetupFailureIsReturnedToLaterCallers() throws Exception {
        final var engine = new InventoryEngine() {
            @Override
            RecordStore newRecordStore(final int capacity) {
                throw new OutOfMemoryError("Requested array size exceeds VM limit");
            }
        };
        ConfigurationException first = null;
        try {
            engine.initialize(0, 1, 1, 10, 1);
            fail("The record table cannot be allocated.");
        } catch (ConfigurationException error) {
            assertEquals("limits", error.getField());
            assertTrue(error.getCause() instanceof OutOfMemoryError);
            first = error;
        }
        try {
            engine.initialize(0, 1, 1, 10, 1);
            fail("A failed initialization must not be reported as success.");
        } catch (ConfigurationException error) {
            assertSame(first, error);
        }
        assertFalse(engine.isOpen());
        assertNull(engine.getLimits());
        try {
            engine.sell(1, requests(1, 0, 0), Map.of(), "12:00");
            fail("Sales must stay closed.");
        } catch (ServiceNotOpenException error) {
            // expected
        }
    }

    @Test(timeout = 10000)
    public void testConcurrentInitializeRunsOnce() throws Exception {
        final var threads = 8;
        final var start = new CountDownLatch(1);
        final var executor = Executors.newFixedThreadPool(threads);
        try {
            final List<Callable<Limits>> callers = new ArrayList<>();
            for (var i = 0; i < threads; i++) {
                final var windows = i + 1;
                callers.add(() -> {
                    start.await();
                    this.engine.initialize(new Limits(10, 2, 3, 5, windows));
                    return this.engine.getLimits();
                });
            }
            final var results = new ArrayList<Future<Limits>>();
            for (final var caller : callers) {
                results.add(executor.submit(caller));
            }
            start.countDown();
            final var winner = results.get(0).get();
            for (final var result : results) {
                assertSame(winner, result.get());
            }
            assertTrue(this.engine.isOpen());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testSaleAtGoodieWindow() throws Exception {
        this.engine.initialize(10, 2, 3, 5, 2);
        assertEquals(3, this.sell(2, requests(3, 1, 2)).getTickets().size());

        final var result = this.sell(1, requests(2, 1, 2));
        assertEquals(2, result.getTickets().size());
        var expectedNumber = 4;
        for (final var ticket : result.getTickets()) {
            assertEquals(expectedNumber++, ticket.getTicketNumber());
            assertEquals(1, ticket.getMovie());
            assertEquals(2, ticket.getShowing());
            assertEquals(InventoryEngine.TICKET_PRICE, ticket.getPrice());
            assertEquals(1, ticket.getWindow());
            assertFalse(ticket.isSoldOut());
            assertTrue(ticket.hasGoodies());
            assertFalse(ticket.isExchanged());
        }
        final var receipt = result.getReceipt();
        assertEquals("12:00", receipt.getTime());
        assertEquals(1, receipt.getWindow());
        assertEquals(2, receipt.getItemsSold().size());
        assertEquals("Movie 1, Showing 2", receipt.getItemsSold().get(0).getDescription());
        assertEquals(1000, receipt.getItemsSold().get(0).getPennies());
        assertEquals(2000, receipt.getTotal());

        final var soldOut = this.sell(1, requests(1, 1, 2));
        final var placeholder = soldOut.getTickets().get(0);
        assertEquals(6, placeholder.getTicketNumber());
        assertTrue(placeholder.isSoldOut());
        assertFalse(placeholder.hasGoodies());
        assertTrue(soldOut.getReceipt().getItemsSold().isEmpty());
        assertEquals(0, soldOut.getReceipt().getTotal());
        assertTrue(this.engine.lookup(6).isSoldOut());
    }

    @Test
    public void testSaleRunningIntoSellout() throws Exception {
        this.engine.initialize(10, 2, 3, 5, 2);
        this.sell(2, requests(3, 1, 2));

        final var result = this.sell(1, requests(3, 1, 2));
        final var tickets = result.getTickets();
        assertEquals(3, tickets.size());
        for (var i = 0; i < 2; i++) {
            assertEquals(4 + i, tickets.get(i).getTicketNumber());
            assertFalse(tickets.get(i).isSoldOut());
            assertTrue(tickets.get(i).hasGoodies());
        }
        final var placeholder = tickets.get(2);
        assertEquals(6, placeholder.getTicketNumber());
        assertTrue(placeholder.isSoldOut());
        assertFalse(placeholder.hasGoodies());
        assertEquals(1, placeholder.getWindow());

        // Only the two seated tickets are charged.
        final var receipt = result.getReceipt();
        assertEquals(2, receipt.getItemsSold().size());
        assertEquals(2000, receipt.getTotal());
        assertTrue(this.engine.lookup(6).isSoldOut());
    }

    @Test
    public void testOnlyGoodieWindowGrantsGoodies() throws Exception {
        this.engine.initialize(10, 2, 3, 5, 3);
        for (final var ticket : this.sell(2, requests(2, 0, 0)).getTickets()) {
            assertFalse(ticket.hasGoodies());
        }
        for (final var ticket : this.sell(3, requests(2, 0, 1)).getTickets()) {
            assertFalse(ticket.hasGoodies());
        }
        assertTrue(this.engine.lookup(this.sell(1, requests(1, 0, 2)).getTickets().get(0).getTicketNumber())
                .hasGoodies());
    }

    @Test
    public void testValidationConsumesNothing() throws Exception {
        this.engine.initialize(10, 2, 3, 1, 2);
        final var invalid = new ArrayList<TicketRequest>();
        invalid.add(new TicketRequest(0, 0));
        invalid.add(new TicketRequest(2, 0));
        try {
            this.sell(1, invalid);
            fail("Movie 2 does not exist.");
        } catch (ValidationException error) {
            assertEquals(2, error.getRequestNumber());
            assertEquals("movie", error.getField());
        }
        try {
            this.sell(1, requests(1, 0, 3));
            fail("Showing 3 does not exist.");
        } catch (ValidationException error) {
            assertEquals(1, error.getRequestNumber());
            assertEquals("showing", error.getField());
        }
        try {
            this.sell(3, requests(1, 0, 0));
            fail("Window 3 does not exist.");
        } catch (ValidationException error) {
            assertEquals(0, error.getRequestNumber());
            assertEquals("window", error.getField());
        }
        // Neither a ticket number nor the only seat of (0, 0) has been used.
        final var ticket = this.sell(1, requests(1, 0, 0)).getTickets().get(0);
        assertEquals(1, ticket.getTicketNumber());
        assertFalse(ticket.isSoldOut());
    }

    @Test
    public void testEmptySale() throws Exception {
        this.engine.initialize(10, 1, 1, 1, 1);
        final var result = this.sell(1, List.of());
        assertTrue(result.getTickets().isEmpty());
        assertEquals(0, result.getReceipt().getTotal());
    }

    @Test(timeout = 20000)
    public void testConcurrentSalesUseUniqueNumbers() throws Exception {
        final var windows = 8;
        final var salesPerWindow = 100;
        final var seats = 60;
        this.engine.initialize(0, 4, 4, seats, windows);
        final var start = new CountDownLatch(1);
        final var executor = Executors.newFixedThreadPool(windows);
        try {
            final List<Callable<List<Ticket>>> sellers = new ArrayList<>();
            for (var i = 1; i <= windows; i++) {
                final var window = i;
                sellers.add(() -> {
                    start.await();
                    final var tickets = new ArrayList<Ticket>();
                    for (var j = 0; j < salesPerWindow; j++) {
                        tickets.addAll(this.sell(window, requests(1, j % 4, window % 4)).getTickets());
                    }
                    return tickets;
                });
            }
            final var results = new ArrayList<Future<List<Ticket>>>();
            for (final var seller : sellers) {
                results.add(executor.submit(seller));
            }
            start.countDown();

            final var numbers = new HashSet<Integer>();
            final var sold = new int[4][4];
            for (final var result : results) {
                for (final var ticket : result.get()) {
                    assertTrue(numbers.add(ticket.getTicketNumber()));
                    if (!ticket.isSoldOut()) {
                        sold[ticket.getMovie()][ticket.getShowing()]++;
                    }
                }
            }
            assertEquals(windows * salesPerWindow, numbers.size());
            for (var number = 1; number <= windows * salesPerWindow; number++) {
                assertTrue(numbers.contains(number));
            }
            for (final var row : sold) {
                for (final var count : row) {
                    assertTrue(count <= seats);
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testExchangeOnlyOnce() throws Exception {
        this.engine.initialize(10, 1, 1, 5, 2);
        final var number = this.sell(1, requests(1, 0, 0)).getTickets().get(0).getTicketNumber();
        this.engine.exchange(number, "water", "soda");
        assertEquals(1, this.engine.getExchangesMade());
        try {
            this.engine.exchange(number, "soda", "beer");
            fail("A ticket can be exchanged only once.");
        } catch (ExchangeDeniedException error) {
            assertEquals(ExchangeDeniedException.Reason.ALREADY_EXCHANGED, error.getReason());
        }
        final var ticket = this.engine.lookup(number);
        assertTrue(ticket.isExchanged());
        assertEquals("water", ticket.getOldGood());
        assertEquals("soda", ticket.getNewGood());
        assertEquals(1, this.engine.getExchangesMade());
    }

    @Test
    public void testExchangeNotEntitled() throws Exception {
        this.engine.initialize(10, 1, 1, 1, 2);
        final var plain = this.sell(2, requests(1, 0, 0)).getTickets().get(0);
        final var placeholder = this.sell(1, requests(1, 0, 0)).getTickets().get(0);
        assertTrue(placeholder.isSoldOut());
        for (final var ticket : List.of(plain, placeholder)) {
            try {
                this.engine.exchange(ticket.getTicketNumber(), "water", "soda");
                fail("Ticket " + ticket + " comes without goodies.");
            } catch (ExchangeDeniedException error) {
                assertEquals(ExchangeDeniedException.Reason.NOT_ENTITLED, error.getReason());
            }
            assertFalse(this.engine.lookup(ticket.getTicketNumber()).isExchanged());
        }
        assertEquals(0, this.engine.getExchangesMade());
    }

    @Test
    public void testExchangeOutOfGoods() throws Exception {
        this.engine.initialize(1, 1, 1, 5, 1);
        final var tickets = this.sell(1, requests(2, 0, 0)).getTickets();
        this.engine.exchange(tickets.get(0).getTicketNumber(), "water", "soda");
        try {
            this.engine.exchange(tickets.get(1).getTicketNumber(), "water", "soda");
            fail("The only exchange good has been handed out.");
        } catch (ExchangeDeniedException error) {
            assertEquals(ExchangeDeniedException.Reason.OUT_OF_GOODS, error.getReason());
        }
        assertFalse(this.engine.lookup(tickets.get(1).getTicketNumber()).isExchanged());
    }

    @Test
    public void testExchangeUnknownTicket() throws Exception {
        this.engine.initialize(1, 1, 1, 5, 1);
        this.sell(1, requests(1, 0, 0));
        for (final var number : new int[] { 0, 2, 6 }) {
            try {
                this.engine.exchange(number, "water", "soda");
                fail("Ticket " + number + " has not been issued.");
            } catch (NotAllocatedException error) {
                assertEquals(number, error.getTicketNumber());
            }
        }
    }

    @Test(timeout = 10000)
    public void testConcurrentExchangeOfSameTicket() throws Exception {
        this.engine.initialize(100, 1, 1, 5, 1);
        final var number = this.sell(1, requests(1, 0, 0)).getTickets().get(0).getTicketNumber();
        final var threads = 16;
        final var start = new CountDownLatch(1);
        final var executor = Executors.newFixedThreadPool(threads);
        try {
            final var results = new ArrayList<Future<Boolean>>();
            for (var i = 0; i < threads; i++) {
                final var newGood = "soda " + i;
                results.add(executor.submit(() -> {
                    start.await();
                    try {
                        this.engine.exchange(number, "water", newGood);
                        return true;
                    } catch (ExchangeDeniedException error) {
                        assertEquals(ExchangeDeniedException.Reason.ALREADY_EXCHANGED, error.getReason());
                        return false;
                    }
                }));
            }
            start.countDown();
            var successes = 0;
            for (final var result : results) {
                if (result.get()) {
                    successes++;
                }
            }
            assertEquals(1, successes);
            assertEquals(1, this.engine.getExchangesMade());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test(timeout = 10000)
    public void testExhaustedCapacityIsFatal() throws Exception {
        // Two seats overall; the sold-out placeholder needs a third ticket number.
        this.engine.initialize(0, 1, 1, 2, 1);
        try {
            this.sell(1, requests(3, 0, 0));
            fail("The third request exceeds the ticket capacity.");
        } catch (SaleAbortedException error) {
            assertTrue(error.isFatal());
            assertEquals(3, error.getRequestNumber());
            final var partial = error.getPartialResult();
            assertEquals(2, partial.getTickets().size());
            assertEquals(2000, partial.getReceipt().getTotal());
            assertTrue(error.getCause() instanceof ExhaustedSourceException);
            assertSame(error.getCause(), this.fatal.get());
        }
        // The tickets of the aborted sale stay sold.
        assertFalse(this.engine.lookup(1).isSoldOut());
        assertFalse(this.engine.lookup(2).isSoldOut());
    }

    @Test
    public void testShutdown() throws Exception {
        this.engine.initialize(1, 1, 1, 5, 1);
        final var number = this.sell(1, requests(1, 0, 0)).getTickets().get(0).getTicketNumber();
        this.engine.shutdown();
        this.engine.shutdown();
        assertFalse(this.engine.isOpen());
        assertNotNull(this.engine.getLimits());
        try {
            this.sell(1, requests(1, 0, 0));
            fail("Selling after shutdown must fail.");
        } catch (ServiceNotOpenException error) {
            // expected
        }
        try {
            this.engine.exchange(number, "water", "soda");
            fail("Exchanging after shutdown must fail.");
        } catch (ServiceNotOpenException error) {
            // expected
        }
        // Initialization is not repeated.
        this.engine.initialize(1, 1, 1, 5, 1);
        assertFalse(this.engine.isOpen());
        assertNull(this.fatal.get());
    }
}

package com.boxoffice.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Sells movie tickets and manages the exchange of promotional goodies.
 * </p>
 *
 * <p>
 * The engine orchestrates an {@link IdentifierSource}, a {@link SeatLedger}
 * and a {@link RecordStore}. After a single successful
 * {@link #initialize(Limits)}, {@link #sell} and {@link #exchange} may be
 * called concurrently from any number of threads.
 * </p>
 *
 * <p>
 * ⚠️ A seat consumed for a request of a sale that aborts later is not given
 * back.
 * </p>
 */
public class InventoryEngine {
    private static final Logger LOG = LoggerFactory.getLogger(InventoryEngine.class);

    /**
     * Flat price of every ticket, in pennies.
     */
    public static final int TICKET_PRICE = 1000;

    /**
     * The only window handing out goodies.
     */
    public static final int GOODIES_WINDOW = 1;

    /**
     * Progress of the one-time initialization.
     */
    private static enum State {
        UNINITIALIZED,
        INITIALIZING,
        DONE;
    }

    /**
     * Hook of the hosting process for fatal conditions.
     */
    private final FatalErrorListener fatalErrorListener;

    /**
     * Guards {@link #state} and {@link #initFailure}.
     */
    private final Object initGate = new Object();
    private State state = State.UNINITIALIZED;

    /**
     * Outcome of a failed first initialization, handed to every later caller.
     */
    private ConfigurationException initFailure;

    /**
     * Set once initialization succeeded, cleared by {@link #shutdown()}. The
     * components below are assigned before it is set and never change after.
     */
    private volatile boolean salesOpen = false;

    private Limits limits;
    private SeatLedger seats;
    private RecordStore records;
    private IdentifierSource identifiers;

    /**
     * Serializes whole exchanges, from reading the record to persisting it.
     */
    private final Object exchangeLock = new Object();

    /**
     * Number of exchanges made so far. Guarded by {@link #exchangeLock}.
     */
    private int exchangesMade = 0;

    /**
     * Constructs a new, uninitialized engine which only logs fatal conditions.
     */
    public InventoryEngine() {
        this(FatalErrorListener.NONE);
    }

    /**
     * Constructs a new, uninitialized engine.
     *
     * @param fatalErrorListener Hook informed about fatal conditions.
     */
    public InventoryEngine(final FatalErrorListener fatalErrorListener) {
        this.fatalErrorListener = fatalErrorListener;
    }

    /**
     * Convenience variant of {@link #initialize(Limits)}.
     *
     * @param exchangeStock    Number of goodie exchanges allowed, at least 0.
     * @param movies           Number of movies, at least 1.
     * @param showingsPerMovie Number of showings per movie, at least 1.
     * @param seatsPerShowing  Number of seats per showing, at least 1.
     * @param windows          Number of ticket windows, at least 1.
     * @throws ConfigurationException If a parameter is invalid.
     * @throws InterruptedException   Interrupted while waiting for a concurrent initialization.
     */
    public void initialize(final int exchangeStock, final int movies, final int showingsPerMovie,
            final int seatsPerShowing, final int windows) throws ConfigurationException, InterruptedException {
        this.initialize(new Limits(exchangeStock, movies, showingsPerMovie, seatsPerShowing, windows));
    }

    /**
     * <p>
     * Opens the ticket sales system.
     * </p>
     *
     * <p>
     * Only the first call does the actual work; every later call, including
     * calls arriving while the first one is still running, waits for it and
     * receives the same outcome.
     * </p>
     *
     * @param limits Capacity limits of the theatre.
     * @throws ConfigurationException If a limit is invalid or the system cannot be set up
     *                                for the limits. Nothing is set up in that case.
     * @throws InterruptedException   Interrupted while waiting for a concurrent initialization.
     */
    public void initialize(final Limits limits) throws ConfigurationException, InterruptedException {
        synchronized (this.initGate) {
            while (this.state == State.INITIALIZING) {
                this.initGate.wait();
            }
            if (this.state == State.DONE) {
                if (this.initFailure != null) {
                    throw this.initFailure;
                }
                return;
            }
            this.state = State.INITIALIZING;
        }
        ConfigurationException failure = null;
        try {
            this.setUp(limits);
        } catch (ConfigurationException error) {
            LOG.warn("Ticketing system initialization rejected: {}", error.getMessage());
            failure = error;
        } catch (RuntimeException | Error error) {
            LOG.error("Ticketing system initialization failed for {}", limits, error);
            failure = new ConfigurationException("limits",
                    String.format("cannot set up the ticketing system for %s: %s", limits, error), error);
        } finally {
            synchronized (this.initGate) {
                this.initFailure = failure;
                this.state = State.DONE;
                this.initGate.notifyAll();
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Creates all components first and publishes them only once nothing can
     * fail anymore.
     */
    private void setUp(final Limits limits) throws ConfigurationException {
        limits.validate();
        final var seats = new SeatLedger(limits.getMovies(), limits.getShowingsPerMovie(),
                limits.getSeatsPerShowing());
        final var records = this.newRecordStore(limits.getTicketCapacity());
        final var identifiers = new IdentifierSource(limits.getTicketCapacity());
        identifiers.start();
        synchronized (this.initGate) {
            this.limits = limits;
            this.seats = seats;
            this.records = records;
            this.identifiers = identifiers;
        }
        this.salesOpen = true;
        LOG.info("Ticketing system open for sales and exchanges with {}", limits);
    }

    /**
     * Allocates the record table.
     *
     * @param capacity Number of identifiers the table must hold.
     * @return The empty table.
     */
    RecordStore newRecordStore(final int capacity) {
        return new RecordStore(capacity);
    }

    /**
     * Returns whether sales are open.
     *
     * @return Whether {@link #sell} and {@link #exchange} are accepted.
     */
    public boolean isOpen() {
        return this.salesOpen;
    }

    /**
     * Returns the limits the engine has been initialized with.
     *
     * @return The limits, {@code null} before a successful initialization.
     */
    public Limits getLimits() {
        synchronized (this.initGate) {
            return this.limits;
        }
    }

    /**
     * Returns the number of exchanges made so far.
     *
     * @return Number of exchanges made.
     */
    public int getExchangesMade() {
        synchronized (this.exchangeLock) {
            return this.exchangesMade;
        }
    }

    private void requireOpen(final String operation) throws ServiceNotOpenException {
        if (!this.salesOpen) {
            throw new ServiceNotOpenException(operation);
        }
    }

    /**
     * <p>
     * Sells one ticket per request, in request order.
     * </p>
     *
     * <p>
     * All requests are validated before the first identifier is drawn. Each
     * request then receives a ticket; requests for a sold-out showing receive
     * a placeholder flagged as sold out, which does not appear on the receipt.
     * Tickets sold at {@link #GOODIES_WINDOW} entitle to a goodie exchange.
     * </p>
     *
     * @param window      Window conducting the sale, 1-based.
     * @param requests    Requested showings.
     * @param paymentInfo Payment data; opaque and not validated.
     * @param localTime   Copied as-is as the receipt's timestamp.
     * @return The tickets in request order and the receipt.
     * @throws ServiceNotOpenException If sales are not open.
     * @throws ValidationException     If the window or a request is out of range.
     * @throws SaleAbortedException    If a step failed after identifiers had been drawn.
     */
    public SaleResult sell(final int window, final List<TicketRequest> requests, final Map<String, Object> paymentInfo,
            final Object localTime) throws ServiceNotOpenException, ValidationException, SaleAbortedException {
        this.requireOpen("Sell");
        final var limits = this.limits;

        if (window < 1 || window > limits.getWindows()) {
            throw new ValidationException(0, "window", window, 1, limits.getWindows());
        }
        // Check as much as possible before consuming any ticket number.
        for (var i = 0; i < requests.size(); i++) {
            final var request = requests.get(i);
            if (request.getMovie() < 0 || request.getMovie() >= limits.getMovies()) {
                throw new ValidationException(i + 1, "movie", request.getMovie(), 0, limits.getMovies() - 1);
            }
            if (request.getShowing() < 0 || request.getShowing() >= limits.getShowingsPerMovie()) {
                throw new ValidationException(i + 1, "showing", request.getShowing(), 0,
                        limits.getShowingsPerMovie() - 1);
            }
        }

        final var tickets = new ArrayList<Ticket>(requests.size());
        final var items = new ArrayList<LineItem>();
        for (var i = 0; i < requests.size(); i++) {
            final var request = requests.get(i);
            final Ticket ticket;
            try {
                ticket = this.records.create(this.identifiers.take());
            } catch (ExhaustedSourceException error) {
                if (error.isFatal()) {
                    this.reportFatal(error);
                }
                throw new SaleAbortedException(i + 1, this.partial(tickets, window, items, localTime), error);
            } catch (InterruptedException error) {
                Thread.currentThread().interrupt();
                throw new SaleAbortedException(i + 1, this.partial(tickets, window, items, localTime), error);
            }

            ticket.assign(request.getMovie(), request.getShowing(), window);
            final var seat = this.seats.consumeSeat(request.getMovie(), request.getShowing());
            ticket.price(TICKET_PRICE, seat.isOverCapacity());
            if (!ticket.isSoldOut()) {
                if (window == GOODIES_WINDOW) {
                    ticket.grantGoodies();
                }
                items.add(new LineItem(String.format("Movie %d, Showing %d", ticket.getMovie(), ticket.getShowing()),
                        ticket.getPrice()));
            }
            tickets.add(ticket);

            try {
                this.records.updateSale(ticket);
            } catch (NotAllocatedException error) {
                throw new SaleAbortedException(i + 1, this.partial(tickets, window, items, localTime), error);
            }
        }

        final var result = new SaleResult(tickets, new Receipt(localTime, window, items));
        LOG.debug("Sell for window {} returning {}", window, result);
        return result;
    }

    private SaleResult partial(final List<Ticket> tickets, final int window, final List<LineItem> items,
            final Object localTime) {
        return new SaleResult(new ArrayList<>(tickets), new Receipt(localTime, window, items));
    }

    /**
     * <p>
     * Exchanges the goodie received with a ticket.
     * </p>
     *
     * <p>
     * Eligibility is checked in this order: sold-out placeholders and tickets
     * without goodies are not entitled, a ticket can be exchanged only once,
     * and the exchange stock must not be used up. A denied exchange changes
     * nothing.
     * </p>
     *
     * <p>
     * Exchanges are serialized from the read of the record to the write of
     * the outcome, so two concurrent exchanges of the same ticket cannot both
     * succeed and the stock is never overdrawn.
     * </p>
     *
     * @param ticketNumber Ticket under which the goodie was received.
     * @param oldGood      Item handed back.
     * @param newGood      Replacement item.
     * @throws ServiceNotOpenException If sales are not open.
     * @throws NotAllocatedException   If the ticket number has not been issued.
     * @throws ExchangeDeniedException If the exchange is not allowed.
     */
    public void exchange(final int ticketNumber, final String oldGood, final String newGood)
            throws ServiceNotOpenException, NotAllocatedException, ExchangeDeniedException {
        this.requireOpen("Exchange");
        synchronized (this.exchangeLock) {
            final Ticket ticket;
            try {
                ticket = this.records.read(ticketNumber);
            } catch (NotAllocatedException error) {
                throw new NotAllocatedException("Exchange", error);
            }

            if (ticket.isSoldOut() || !ticket.hasGoodies()) {
                throw this.deny(ticketNumber, ExchangeDeniedException.Reason.NOT_ENTITLED);
            }
            if (ticket.isExchanged()) {
                throw this.deny(ticketNumber, ExchangeDeniedException.Reason.ALREADY_EXCHANGED);
            }
            if (this.exchangesMade >= this.limits.getExchangeStock()) {
                throw this.deny(ticketNumber, ExchangeDeniedException.Reason.OUT_OF_GOODS);
            }

            ticket.exchange(oldGood, newGood);
            try {
                this.records.updateExchange(ticket);
            } catch (NotAllocatedException error) {
                throw new NotAllocatedException("Exchange", error);
            }
            this.exchangesMade++;
        }
        LOG.debug("Ticket {} exchanged {} for {}", ticketNumber, oldGood, newGood);
    }

    private ExchangeDeniedException deny(final int ticketNumber, final ExchangeDeniedException.Reason reason) {
        LOG.debug("Exchange for ticket {} denied: {}", ticketNumber, reason);
        return new ExchangeDeniedException(reason);
    }

    /**
     * Returns a copy of a stored ticket record.
     *
     * @param ticketNumber Identifier of the ticket.
     * @return Copy of the record.
     * @throws ServiceNotOpenException If sales are not open.
     * @throws NotAllocatedException   If the ticket number has not been issued.
     */
    public Ticket lookup(final int ticketNumber) throws ServiceNotOpenException, NotAllocatedException {
        this.requireOpen("Lookup");
        return this.records.read(ticketNumber);
    }

    /**
     * <p>
     * Closes the ticket sales system.
     * </p>
     *
     * <p>
     * Sales in progress fail once they need another ticket number; later
     * calls fail with {@link ServiceNotOpenException}. The engine cannot be
     * opened again.
     * </p>
     */
    public void shutdown() {
        synchronized (this.initGate) {
            if (!this.salesOpen) {
                return;
            }
            this.salesOpen = false;
        }
        this.identifiers.close();
        LOG.info("Ticketing system closed after {} exchanges", this.getExchangesMade());
    }

    private void reportFatal(final ExhaustedSourceException error) {
        final var diagnostics = new StringBuilder();
        for (final var entry : Thread.getAllStackTraces().entrySet()) {
            diagnostics.append('\n').append(entry.getKey()).append('\n');
            for (final var element : entry.getValue()) {
                diagnostics.append("\tat ").append(element).append('\n');
            }
        }
        LOG.error("Cannot continue: ticket table with {} slots is exhausted, {}. Live threads:{}",
                this.records.getCapacity(), this.limits, diagnostics, error);
        this.fatalErrorListener.onFatalError(error);
    }
}

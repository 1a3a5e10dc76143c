package com.boxoffice.theatre;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.boxoffice.engine.InventoryEngine;
import com.boxoffice.engine.SaleAbortedException;
import com.boxoffice.engine.SaleResult;
import com.boxoffice.engine.ServiceNotOpenException;
import com.boxoffice.engine.TicketRequest;
import com.boxoffice.engine.ValidationException;

/**
 * <p>
 * A ticket {@link Window} serving an endless line of customers.
 * </p>
 *
 * <p>
 * Every customer buys a random number of tickets for random showings. The
 * window reports each ticket to the {@link Tracker}; the goodie window
 * additionally sends about half of its goodie tickets to the
 * {@link Cafeteria}.
 * </p>
 */
public class Window implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(Window.class);

    /**
     * {@link Theatre} the window belongs to.
     */
    private final Theatre theatre;

    /**
     * Number of the window, 1-based.
     */
    private final int number;

    private volatile boolean open = true;

    /**
     * Constructs a new {@link Window}.
     *
     * @param theatre {@link Theatre} the window belongs to.
     * @param number  Number of the window, 1-based.
     */
    public Window(final Theatre theatre, final int number) {
        this.theatre = theatre;
        this.number = number;
    }

    public int getNumber() {
        return this.number;
    }

    /**
     * Closes the window after the sale in progress.
     */
    public void close() {
        this.open = false;
    }

    @Override
    public void run() {
        final var random = ThreadLocalRandom.current();
        try {
            while (this.open) {
                try {
                    this.report(this.sellToNextCustomer(random), random);
                } catch (SaleAbortedException error) {
                    LOG.warn("Window {} closing: {}", this.number, error.getMessage());
                    this.report(error.getPartialResult(), random);
                    return;
                } catch (ServiceNotOpenException error) {
                    LOG.info("Window {} closing: {}", this.number, error.getMessage());
                    return;
                }
                this.pause(random);
            }
        } catch (InterruptedException error) {
            LOG.debug("Window {} interrupted, closing", this.number);
            Thread.currentThread().interrupt();
        } finally {
            if (this.number == InventoryEngine.GOODIES_WINDOW) {
                this.theatre.getCafeteria().getMailbox().sendLowPriority(new Cafeteria.MsgClose());
            }
            this.theatre.getTracker().getMailbox().sendLowPriority(new Tracker.MsgDone("window " + this.number));
        }
    }

    private SaleResult sellToNextCustomer(final ThreadLocalRandom random)
            throws ServiceNotOpenException, SaleAbortedException {
        final var limits = this.theatre.getConfig().getLimits();
        final var count = random.nextInt(1, this.theatre.getConfig().getMaxPerSale() + 1);
        final List<TicketRequest> requests = new ArrayList<>(count);
        for (var i = 0; i < count; i++) {
            requests.add(new TicketRequest(random.nextInt(limits.getMovies()),
                    random.nextInt(limits.getShowingsPerMovie())));
        }
        try {
            return this.theatre.getEngine().sell(this.number, requests,
                    Map.of("Window", this.number, "Method", "cash"), LocalTime.now().toString());
        } catch (ValidationException error) {
            throw new IllegalStateException("Window " + this.number + " created an invalid sale!", error);
        }
    }

    private void report(final SaleResult result, final ThreadLocalRandom random) {
        final var tracker = this.theatre.getTracker().getMailbox();
        for (final var ticket : result.getTickets()) {
            tracker.sendLowPriority(new Tracker.MsgTicketSale(ticket.getMovie(), ticket.getShowing(),
                    ticket.isSoldOut()));
            if (ticket.hasGoodies() && random.nextBoolean()) {
                this.theatre.getCafeteria().getMailbox()
                        .sendLowPriority(new Cafeteria.MsgExchange(ticket.getTicketNumber()));
            }
        }
    }

    private void pause(final ThreadLocalRandom random) throws InterruptedException {
        final var average = this.theatre.getConfig().getAverageDelay().toMillis();
        if (average > 0) {
            Thread.sleep(random.nextLong(0, 2 * average + 1));
        }
    }
}

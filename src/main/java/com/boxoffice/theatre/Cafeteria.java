package com.boxoffice.theatre;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.boxoffice.engine.ExchangeDeniedException;
import com.boxoffice.engine.NotAllocatedException;
import com.boxoffice.engine.ServiceNotOpenException;

/**
 * <p>
 * {@link Cafeteria} that exchanges the free water of goodie tickets for soda.
 * </p>
 *
 * <p>
 * It does not know the rules for goodies; whether an exchange is allowed is
 * up to the engine. The cafeteria stops once it receives {@link MsgClose},
 * which the goodie window sends after its last sale.
 * </p>
 */
public class Cafeteria implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(Cafeteria.class);

    /**
     * The only exchange the cafeteria offers.
     */
    public static final String OLD_GOOD = "water";
    public static final String NEW_GOOD = "soda";

    /**
     * {@link Theatre} the cafeteria belongs to.
     */
    private final Theatre theatre;

    /**
     * Mailbox of the {@link Cafeteria}.
     */
    private final Mailbox<Command<Cafeteria>> mailbox = new Mailbox<>();

    /**
     * Only accessed by the cafeteria's own thread.
     */
    private boolean open = true;

    /**
     * Constructs a new {@link Cafeteria}.
     *
     * @param theatre {@link Theatre} the cafeteria belongs to.
     */
    public Cafeteria(final Theatre theatre) {
        this.theatre = theatre;
    }

    /**
     * Returns the {@link Mailbox} of the cafeteria.
     *
     * @return {@link Mailbox} of the cafeteria.
     */
    public Mailbox<Command<Cafeteria>> getMailbox() {
        return this.mailbox;
    }

    @Override
    public void run() {
        try {
            while (this.open) {
                this.mailbox.recv().execute(this);
            }
        } catch (InterruptedException error) {
            LOG.debug("Cafeteria interrupted, closing");
            Thread.currentThread().interrupt();
        } finally {
            this.mailbox.close();
            this.theatre.getTracker().getMailbox().sendLowPriority(new Tracker.MsgDone("cafeteria"));
        }
    }

    private void exchange(final int ticketNumber) {
        try {
            this.theatre.getEngine().exchange(ticketNumber, OLD_GOOD, NEW_GOOD);
            this.theatre.getTracker().getMailbox().sendLowPriority(new Tracker.MsgExchangeDone());
        } catch (ExchangeDeniedException | NotAllocatedException error) {
            LOG.info("Exchange for ticket {} denied: {}", ticketNumber, error.getMessage());
        } catch (ServiceNotOpenException error) {
            LOG.info("Cafeteria closing: {}", error.getMessage());
            this.open = false;
        }
    }

    /**
     * A message asking the {@link Cafeteria} to exchange the goodie of a ticket.
     */
    public static class MsgExchange implements Command<Cafeteria> {
        private final int ticketNumber;

        /**
         * Constructs a new {@link MsgExchange} message.
         *
         * @param ticketNumber Ticket which came with the goodie.
         */
        public MsgExchange(final int ticketNumber) {
            this.ticketNumber = ticketNumber;
        }

        @Override
        public void execute(final Cafeteria cafeteria) {
            cafeteria.exchange(this.ticketNumber);
        }
    }

    /**
     * A message telling the {@link Cafeteria} to close after the exchanges
     * requested so far.
     */
    public static class MsgClose implements Command<Cafeteria> {
        @Override
        public void execute(final Cafeteria cafeteria) {
            cafeteria.open = false;
        }
    }
}

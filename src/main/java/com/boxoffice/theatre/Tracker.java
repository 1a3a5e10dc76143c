package com.boxoffice.theatre;

import java.time.LocalDateTime;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * {@link Tracker} that keeps the books of the theatre.
 * </p>
 *
 * <p>
 * The tracker counts every ticket sold and every sale missed due to a sold
 * out showing, as well as the exchanges performed by the {@link Cafeteria}.
 * When the run time is over it closes the windows, waits until every window
 * and the cafeteria have reported that they are done and then produces the
 * {@link SummaryReport}.
 * </p>
 */
public class Tracker implements Callable<SummaryReport> {
    private static final Logger LOG = LoggerFactory.getLogger(Tracker.class);

    /**
     * {@link Theatre} the tracker belongs to.
     */
    private final Theatre theatre;

    /**
     * Mailbox of the {@link Tracker}.
     */
    private final Mailbox<Command<Tracker>> mailbox = new Mailbox<>();

    private final int movies;
    private final int showings;

    /**
     * Only accessed by the tracker's own thread, like all other counters.
     */
    private final int[][] ticketsSold;
    private final int[][] soldOuts;
    private int exchanges = 0;

    /**
     * Actors which have not reported that they are done.
     */
    private int pendingActors;

    /**
     * Constructs a new {@link Tracker}.
     *
     * @param theatre  {@link Theatre} the tracker belongs to.
     * @param movies   Number of movies.
     * @param showings Number of showings per movie.
     * @param actors   Number of actors which will report {@link MsgDone}.
     */
    public Tracker(final Theatre theatre, final int movies, final int showings, final int actors) {
        this.theatre = theatre;
        this.movies = movies;
        this.showings = showings;
        this.ticketsSold = new int[movies + 1][showings + 1];
        this.soldOuts = new int[movies + 1][showings + 1];
        this.pendingActors = actors;
    }

    /**
     * Returns the {@link Mailbox} of the tracker.
     *
     * @return {@link Mailbox} of the tracker.
     */
    public Mailbox<Command<Tracker>> getMailbox() {
        return this.mailbox;
    }

    @Override
    public SummaryReport call() throws InterruptedException {
        while (this.pendingActors > 0) {
            this.mailbox.recv().execute(this);
        }
        this.mailbox.close();
        LOG.info("All windows and the cafeteria are closed, preparing the summary report");
        return new SummaryReport(LocalDateTime.now(), this.exchanges, this.withTotals(this.ticketsSold),
                this.withTotals(this.soldOuts));
    }

    private int[][] withTotals(final int[][] counts) {
        final var table = new int[this.movies + 1][this.showings + 1];
        for (var movie = 0; movie < this.movies; movie++) {
            for (var showing = 0; showing < this.showings; showing++) {
                final var count = counts[movie][showing];
                table[movie][showing] = count;
                table[movie][this.showings] += count;
                table[this.movies][showing] += count;
                table[this.movies][this.showings] += count;
            }
        }
        return table;
    }

    /**
     * A message telling the {@link Tracker} that the run time is over.
     */
    public static class MsgCloseWindows implements Command<Tracker> {
        @Override
        public void execute(final Tracker tracker) {
            LOG.info("Run time is over, closing all windows");
            tracker.theatre.closeWindows();
        }
    }

    /**
     * A message informing the {@link Tracker} about one ticket of a sale.
     */
    public static class MsgTicketSale implements Command<Tracker> {
        private final int movie;
        private final int showing;
        private final boolean soldOut;

        /**
         * Constructs a new {@link MsgTicketSale} message.
         *
         * @param movie   Movie of the ticket.
         * @param showing Showing of the ticket.
         * @param soldOut Whether the showing was sold out.
         */
        public MsgTicketSale(final int movie, final int showing, final boolean soldOut) {
            this.movie = movie;
            this.showing = showing;
            this.soldOut = soldOut;
        }

        @Override
        public void execute(final Tracker tracker) {
            if (this.soldOut) {
                tracker.soldOuts[this.movie][this.showing]++;
            } else {
                tracker.ticketsSold[this.movie][this.showing]++;
            }
        }
    }

    /**
     * A message informing the {@link Tracker} about a successful exchange.
     */
    public static class MsgExchangeDone implements Command<Tracker> {
        @Override
        public void execute(final Tracker tracker) {
            tracker.exchanges++;
        }
    }

    /**
     * A message informing the {@link Tracker} that an actor has stopped.
     */
    public static class MsgDone implements Command<Tracker> {
        private final String actor;

        /**
         * Constructs a new {@link MsgDone} message.
         *
         * @param actor Name of the actor, for logging.
         */
        public MsgDone(final String actor) {
            this.actor = actor;
        }

        @Override
        public void execute(final Tracker tracker) {
            tracker.pendingActors--;
            LOG.debug("{} is done, waiting for {} more", this.actor, tracker.pendingActors);
        }
    }
}

package com.boxoffice.engine;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicIntegerArray;

/**
 * <p>
 * Counts the seats consumed per showing of every movie.
 * </p>
 *
 * <p>
 * Checking and consuming a seat are one atomic step: there is deliberately no
 * way to peek at a counter, so two callers can never both see the last seat
 * as free. Counters only grow; a count above the capacity means the showing
 * is sold out.
 * </p>
 */
public class SeatLedger {
    /**
     * Result of {@link SeatLedger#consumeSeat(int, int)}.
     */
    public static class Consumption {
        private final int consumed;
        private final boolean overCapacity;

        private Consumption(final int consumed, final boolean overCapacity) {
            this.consumed = consumed;
            this.overCapacity = overCapacity;
        }

        /**
         * Returns the number of seats consumed including this one.
         *
         * @return Seats consumed so far.
         */
        public int getConsumed() {
            return this.consumed;
        }

        /**
         * Returns whether this consumption exceeded the seat capacity, i.e.,
         * whether the showing is sold out.
         *
         * @return Whether the showing is sold out.
         */
        public boolean isOverCapacity() {
            return this.overCapacity;
        }
    }

    private final int movies;
    private final int showingsPerMovie;
    private final int seatsPerShowing;

    /**
     * One counter per (movie, showing), row by row.
     */
    private final AtomicIntegerArray consumed;

    /**
     * Constructs a new {@link SeatLedger} with all counters at zero.
     *
     * @param movies           Number of movies.
     * @param showingsPerMovie Number of showings per movie.
     * @param seatsPerShowing  Number of seats per showing.
     */
    public SeatLedger(final int movies, final int showingsPerMovie, final int seatsPerShowing) {
        this.movies = movies;
        this.showingsPerMovie = showingsPerMovie;
        this.seatsPerShowing = seatsPerShowing;
        this.consumed = new AtomicIntegerArray(movies * showingsPerMovie);
    }

    /**
     * Consumes one seat of a showing.
     *
     * @param movie   Movie number, 0-based.
     * @param showing Showing number, 0-based.
     * @return Post-increment count and whether it exceeds the capacity.
     */
    public Consumption consumeSeat(final int movie, final int showing) {
        Objects.checkIndex(movie, this.movies);
        Objects.checkIndex(showing, this.showingsPerMovie);
        final var count = this.consumed.incrementAndGet(movie * this.showingsPerMovie + showing);
        return new Consumption(count, count > this.seatsPerShowing);
    }

    /**
     * Returns the number of seats of every showing.
     *
     * @return Seats per showing.
     */
    int getSeatsPerShowing() {
        return this.seatsPerShowing;
    }
}

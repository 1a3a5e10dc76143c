package com.boxoffice.engine;

/**
 * A request for one ticket to a showing of a movie. Both indices are 0-based.
 */
public class TicketRequest {
    private final int movie;
    private final int showing;

    /**
     * Constructs a new {@link TicketRequest}.
     *
     * @param movie   Movie number.
     * @param showing Showing number.
     */
    public TicketRequest(final int movie, final int showing) {
        this.movie = movie;
        this.showing = showing;
    }

    public int getMovie() {
        return this.movie;
    }

    public int getShowing() {
        return this.showing;
    }

    @Override
    public String toString() {
        return String.format("[%d, %d]", this.movie, this.showing);
    }
}

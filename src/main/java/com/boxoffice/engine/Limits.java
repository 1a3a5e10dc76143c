package com.boxoffice.engine;

/**
 * Capacity limits of a theatre, fixed once the engine has been initialized.
 */
public class Limits {
    /**
     * Largest ticket capacity. The record table needs one slot more, and
     * arrays close to {@link Integer#MAX_VALUE} cannot be allocated by the VM.
     */
    public static final int MAX_TICKET_CAPACITY = Integer.MAX_VALUE - 9;

    /**
     * Number of goodie exchanges the stock on hand allows.
     */
    private final int exchangeStock;
    /**
     * Number of movies shown simultaneously.
     */
    private final int movies;
    /**
     * Number of showings per movie.
     */
    private final int showingsPerMovie;
    /**
     * Number of seats per showing.
     */
    private final int seatsPerShowing;
    /**
     * Number of ticket windows.
     */
    private final int windows;

    /**
     * Constructs a new {@link Limits} value. The values are checked by
     * {@link #validate()}, not here.
     *
     * @param exchangeStock    Number of goodie exchanges allowed.
     * @param movies           Number of movies.
     * @param showingsPerMovie Number of showings per movie.
     * @param seatsPerShowing  Number of seats per showing.
     * @param windows          Number of ticket windows.
     */
    public Limits(final int exchangeStock, final int movies, final int showingsPerMovie, final int seatsPerShowing,
            final int windows) {
        this.exchangeStock = exchangeStock;
        this.movies = movies;
        this.showingsPerMovie = showingsPerMovie;
        this.seatsPerShowing = seatsPerShowing;
        this.windows = windows;
    }

    /**
     * Checks all limits and the resulting ticket capacity.
     *
     * @throws ConfigurationException If a limit is out of range.
     */
    public void validate() throws ConfigurationException {
        if (this.exchangeStock < 0) {
            throw new ConfigurationException("exchangeStock", this.exchangeStock, 0);
        }
        if (this.movies < 1) {
            throw new ConfigurationException("movies", this.movies, 1);
        }
        if (this.showingsPerMovie < 1) {
            throw new ConfigurationException("showingsPerMovie", this.showingsPerMovie, 1);
        }
        if (this.seatsPerShowing < 1) {
            throw new ConfigurationException("seatsPerShowing", this.seatsPerShowing, 1);
        }
        if (this.windows < 1) {
            throw new ConfigurationException("windows", this.windows, 1);
        }
        final long capacity = (long) this.movies * this.showingsPerMovie * this.seatsPerShowing;
        if (capacity > MAX_TICKET_CAPACITY) {
            throw new ConfigurationException("capacity",
                    String.format("movies x showingsPerMovie x seatsPerShowing = %d exceeds the ticket table limit %d",
                            capacity, MAX_TICKET_CAPACITY));
        }
    }

    /**
     * Returns the number of tickets the theatre can issue, i.e., the number of
     * seats across all showings of all movies.
     *
     * @return Number of ticket identifiers available.
     */
    public int getTicketCapacity() {
        return this.movies * this.showingsPerMovie * this.seatsPerShowing;
    }

    public int getExchangeStock() {
        return this.exchangeStock;
    }

    public int getMovies() {
        return this.movies;
    }

    public int getShowingsPerMovie() {
        return this.showingsPerMovie;
    }

    public int getSeatsPerShowing() {
        return this.seatsPerShowing;
    }

    public int getWindows() {
        return this.windows;
    }

    @Override
    public String toString() {
        return String.format("Limits(exchangeStock=%d, movies=%d, showingsPerMovie=%d, seatsPerShowing=%d, windows=%d)",
                this.exchangeStock, this.movies, this.showingsPerMovie, this.seatsPerShowing, this.windows);
    }
}

package com.boxoffice.engine;

/**
 * <p>
 * A ticket record and its state transitions.
 * </p>
 *
 * <p>
 * A record is created the moment its identifier is drawn, populated by the
 * sale and, at most once, updated by a goodie exchange. Instances handed out
 * by the engine are copies; only the engine itself can change them.
 * </p>
 */
public class Ticket {
    /**
     * Identifier of the ticket, never 0.
     */
    private final int ticketNumber;

    private int movie;
    private int showing;

    /**
     * Price in pennies. May be meaningless if the showing was sold out.
     */
    private int price;

    /**
     * The request could not be fulfilled because the showing was sold out.
     */
    private boolean soldOut;

    /**
     * The ticket entitles its holder to one goodie exchange.
     */
    private boolean goodies;

    private boolean exchanged;
    private String oldGood = "";
    private String newGood = "";

    /**
     * Window which sold the ticket.
     */
    private int window;

    /**
     * Constructs a new, unsold ticket with the provided identifier.
     *
     * @param ticketNumber Identifier of the ticket.
     */
    public Ticket(final int ticketNumber) {
        this.ticketNumber = ticketNumber;
    }

    /**
     * Constructs a copy of another ticket.
     *
     * @param other Ticket to copy.
     */
    Ticket(final Ticket other) {
        this.ticketNumber = other.ticketNumber;
        this.copySaleFrom(other);
        this.copyExchangeFrom(other);
    }

    public int getTicketNumber() {
        return this.ticketNumber;
    }

    public int getMovie() {
        return this.movie;
    }

    public int getShowing() {
        return this.showing;
    }

    public int getPrice() {
        return this.price;
    }

    public boolean isSoldOut() {
        return this.soldOut;
    }

    public boolean hasGoodies() {
        return this.goodies;
    }

    public boolean isExchanged() {
        return this.exchanged;
    }

    public String getOldGood() {
        return this.oldGood;
    }

    public String getNewGood() {
        return this.newGood;
    }

    public int getWindow() {
        return this.window;
    }

    /**
     * Assigns the showing and the selling window.
     */
    void assign(final int movie, final int showing, final int window) {
        this.movie = movie;
        this.showing = showing;
        this.window = window;
    }

    /**
     * Records the outcome of the availability check.
     */
    void price(final int price, final boolean soldOut) {
        this.price = price;
        this.soldOut = soldOut;
    }

    /**
     * Entitles the holder to a goodie exchange.
     */
    void grantGoodies() {
        assert !this.soldOut : "Ticket is a sold-out placeholder!";
        this.goodies = true;
    }

    /**
     * <em>Exchanges</em> the goodie.
     */
    void exchange(final String oldGood, final String newGood) {
        assert !this.exchanged : "Ticket has already been exchanged!";
        this.exchanged = true;
        this.oldGood = oldGood;
        this.newGood = newGood;
    }

    /**
     * Overwrites the sale fields with those of {@code other}.
     */
    void copySaleFrom(final Ticket other) {
        this.movie = other.movie;
        this.showing = other.showing;
        this.price = other.price;
        this.soldOut = other.soldOut;
        this.goodies = other.goodies;
        this.window = other.window;
    }

    /**
     * Overwrites the exchange fields with those of {@code other}.
     */
    void copyExchangeFrom(final Ticket other) {
        this.exchanged = other.exchanged;
        this.oldGood = other.oldGood;
        this.newGood = other.newGood;
    }

    @Override
    public String toString() {
        return String.format(
                "Ticket(%d, movie=%d, showing=%d, price=%d, soldOut=%s, goodies=%s, exchanged=%s, old=%s, new=%s, window=%d)",
                this.ticketNumber, this.movie, this.showing, this.price, this.soldOut, this.goodies, this.exchanged,
                this.oldGood, this.newGood, this.window);
    }
}

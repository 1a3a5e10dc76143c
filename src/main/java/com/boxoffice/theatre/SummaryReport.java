package com.boxoffice.theatre;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * <p>
 * Final report of a theatre run: exchanges performed, tickets sold and sales
 * missed because a showing was sold out.
 * </p>
 *
 * <p>
 * Both tables are indexed {@code [movie][showing]} and carry the totals in
 * their last row and column, so they have {@code movies + 1} rows of
 * {@code showings + 1} cells.
 * </p>
 */
public class SummaryReport {
    private static final DateTimeFormatter HEAD_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final LocalDateTime createdAt;
    private final int exchanges;
    private final int[][] ticketsSold;
    private final int[][] soldOuts;
    private final int movies;
    private final int showings;

    /**
     * Constructs a new {@link SummaryReport}.
     *
     * @param createdAt   Time shown in the report head.
     * @param exchanges   Number of exchanges performed.
     * @param ticketsSold Tickets sold, including totals.
     * @param soldOuts    Sales missed due to sellouts, including totals.
     */
    public SummaryReport(final LocalDateTime createdAt, final int exchanges, final int[][] ticketsSold,
            final int[][] soldOuts) {
        this.createdAt = createdAt;
        this.exchanges = exchanges;
        this.ticketsSold = copy(ticketsSold);
        this.soldOuts = copy(soldOuts);
        this.movies = ticketsSold.length - 1;
        this.showings = ticketsSold[0].length - 1;
    }

    private static int[][] copy(final int[][] table) {
        final var result = new int[table.length][];
        for (var i = 0; i < table.length; i++) {
            result[i] = table[i].clone();
        }
        return result;
    }

    public int getExchanges() {
        return this.exchanges;
    }

    public int getMovies() {
        return this.movies;
    }

    public int getShowings() {
        return this.showings;
    }

    /**
     * Returns the tickets sold for a showing. Passing {@link #getMovies()} or
     * {@link #getShowings()} selects the respective total.
     *
     * @param movie   Movie index or {@link #getMovies()}.
     * @param showing Showing index or {@link #getShowings()}.
     * @return Tickets sold.
     */
    public int getTicketsSold(final int movie, final int showing) {
        return this.ticketsSold[movie][showing];
    }

    /**
     * Returns the sales missed because the showing was sold out, with the
     * same indexing as {@link #getTicketsSold(int, int)}.
     *
     * @param movie   Movie index or {@link #getMovies()}.
     * @param showing Showing index or {@link #getShowings()}.
     * @return Sales missed.
     */
    public int getSoldOuts(final int movie, final int showing) {
        return this.soldOuts[movie][showing];
    }

    public int getTotalSold() {
        return this.ticketsSold[this.movies][this.showings];
    }

    public int getTotalSoldOuts() {
        return this.soldOuts[this.movies][this.showings];
    }

    /**
     * Renders the report as text.
     *
     * @return The report.
     */
    public String render() {
        final var out = new StringBuilder();
        out.append(String.format("Ticket and Exchange Report                             %s\n\n%d Exchanges performed",
                HEAD_FORMAT.format(this.createdAt), this.exchanges));
        this.table(out, "\nTicket Sales per Movie and Showing", this.ticketsSold);
        this.table(out, "\n\nMissed Sales Due to Sellouts per Movie and Showing", this.soldOuts);
        return out.toString();
    }

    private void table(final StringBuilder out, final String head, final int[][] table) {
        // The indentation matches the width of "All showings ".
        out.append(head).append("\n             ");
        for (var movie = 0; movie < this.movies; movie++) {
            out.append(String.format("Movie %2d  ", movie));
        }
        out.append("All movies\n");
        for (var showing = 0; showing <= this.showings; showing++) {
            out.append(showing == this.showings ? "All showings " : String.format("Showing %2d   ", showing));
            for (var movie = 0; movie <= this.movies; movie++) {
                out.append(String.format("%8d  ", table[movie][showing]));
            }
            out.append('\n');
        }
    }

    @Override
    public String toString() {
        return this.render();
    }
}

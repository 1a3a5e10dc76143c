package com.boxoffice.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <p>
 * The itemized receipt for the tickets actually sold by one sale.
 * </p>
 *
 * <p>
 * Sold-out placeholders never appear on a receipt.
 * </p>
 */
public class Receipt {
    /**
     * Timestamp token provided by the caller; opaque to the engine.
     */
    private final Object time;
    /**
     * Window which conducted the sale.
     */
    private final int window;
    /**
     * Items sold, in request order.
     */
    private final List<LineItem> itemsSold;
    /**
     * Sum of all item prices in pennies.
     */
    private final int total;

    /**
     * Constructs a new {@link Receipt}; the total is computed from the items.
     *
     * @param time      Caller's timestamp token.
     * @param window    Window which conducted the sale.
     * @param itemsSold Items sold.
     */
    public Receipt(final Object time, final int window, final List<LineItem> itemsSold) {
        this.time = time;
        this.window = window;
        this.itemsSold = Collections.unmodifiableList(new ArrayList<>(itemsSold));
        var sum = 0;
        for (final var item : itemsSold) {
            sum += item.getPennies();
        }
        this.total = sum;
    }

    public Object getTime() {
        return this.time;
    }

    public int getWindow() {
        return this.window;
    }

    public List<LineItem> getItemsSold() {
        return this.itemsSold;
    }

    public int getTotal() {
        return this.total;
    }

    @Override
    public String toString() {
        return String.format("Receipt(time=%s, window=%d, items=%s, total=%d)", this.time, this.window,
                this.itemsSold, this.total);
    }
}

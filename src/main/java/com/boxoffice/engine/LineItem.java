package com.boxoffice.engine;

/**
 * One line of a {@link Receipt}.
 */
public class LineItem {
    /**
     * Human-readable description of the item.
     */
    private final String description;

    /**
     * Price in minor currency units (pennies).
     */
    private final int pennies;

    /**
     * Constructs a new {@link LineItem}.
     *
     * @param description Description of the item.
     * @param pennies     Price in pennies.
     */
    public LineItem(final String description, final int pennies) {
        this.description = description;
        this.pennies = pennies;
    }

    public String getDescription() {
        return this.description;
    }

    public int getPennies() {
        return this.pennies;
    }

    @Override
    public String toString() {
        return String.format("%s: %d", this.description, this.pennies);
    }
}

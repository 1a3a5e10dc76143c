package com.boxoffice.engine;

/**
 * An {@link InventoryEngine#initialize(Limits)} parameter is invalid.
 */
public class ConfigurationException extends TicketingException {
    private static final long serialVersionUID = 1L;

    /**
     * Name of the offending field.
     */
    private final String field;

    /**
     * Constructs a new {@link ConfigurationException}.
     *
     * @param field   Name of the offending field.
     * @param value   Rejected value.
     * @param minimum Smallest accepted value.
     */
    public ConfigurationException(final String field, final long value, final long minimum) {
        super(String.format("%s %d must be at least %d", field, value, minimum));
        this.field = field;
    }

    /**
     * Constructs a new {@link ConfigurationException} with a custom message.
     *
     * @param field   Name of the offending field.
     * @param message Description of the problem.
     */
    public ConfigurationException(final String field, final String message) {
        super(message);
        this.field = field;
    }

    /**
     * Constructs a new {@link ConfigurationException} for limits which passed
     * validation but could not be set up.
     *
     * @param field   Name of the offending field.
     * @param message Description of the problem.
     * @param cause   Failure raised during setup.
     */
    public ConfigurationException(final String field, final String message, final Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /**
     * Returns the name of the offending field.
     *
     * @return Name of the offending field.
     */
    public String getField() {
        return this.field;
    }
}

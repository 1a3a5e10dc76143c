package com.boxoffice;

import java.time.Duration;

import com.boxoffice.engine.Limits;

/**
 * Configuration of a theatre simulation run.
 */
public class Config {
    /**
     * Limits the engine is initialized with.
     */
    private final Limits limits;
    /**
     * How long the windows stay open.
     */
    private final Duration runTime;
    /**
     * Maximum number of tickets bought in one sale.
     */
    private final int maxPerSale;
    /**
     * Average delay between two sales at the same window.
     */
    private final Duration averageDelay;

    /**
     * Constructs a new instance from the provided parameters.
     *
     * @param limits       Limits of the theatre.
     * @param runTime      How long the windows stay open.
     * @param maxPerSale   Maximum number of tickets per sale, at least 1.
     * @param averageDelay Average delay between sales; zero for none.
     */
    public Config(final Limits limits, final Duration runTime, final int maxPerSale, final Duration averageDelay) {
        if (runTime.isNegative() || runTime.isZero()) {
            throw new IllegalArgumentException("run time must be positive");
        }
        if (maxPerSale < 1) {
            throw new IllegalArgumentException("max tickets per sale must be at least 1");
        }
        if (averageDelay.isNegative()) {
            throw new IllegalArgumentException("average delay must not be negative");
        }
        this.limits = limits;
        this.runTime = runTime;
        this.maxPerSale = maxPerSale;
        this.averageDelay = averageDelay;
    }

    /**
     * Returns the limits of the theatre.
     *
     * @return Limits of the theatre.
     */
    public Limits getLimits() {
        return this.limits;
    }

    /**
     * Returns how long the windows stay open.
     *
     * @return Run time of the simulation.
     */
    public Duration getRunTime() {
        return this.runTime;
    }

    /**
     * Returns the maximum number of tickets bought in one sale.
     *
     * @return Maximum number of tickets per sale.
     */
    public int getMaxPerSale() {
        return this.maxPerSale;
    }

    /**
     * Returns the average delay between two sales at the same window.
     *
     * @return Average delay, zero for none.
     */
    public Duration getAverageDelay() {
        return this.averageDelay;
    }
}

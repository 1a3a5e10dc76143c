package com.boxoffice.theatre;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.boxoffice.Config;
import com.boxoffice.engine.ConfigurationException;
import com.boxoffice.engine.InventoryEngine;

/**
 * <p>
 * {@link Theatre} that orchestrates the actors of a simulated theatre.
 * </p>
 *
 * <p>
 * Each {@link Window}, the {@link Cafeteria} and the {@link Tracker} run on a
 * thread of their own and talk to each other only through their mailboxes.
 * The windows and the cafeteria use the {@link InventoryEngine} directly.
 * </p>
 */
public class Theatre {
    private static final Logger LOG = LoggerFactory.getLogger(Theatre.class);

    /**
     * Configuration of the run.
     */
    private final Config config;

    /**
     * Engine the windows sell from.
     */
    private final InventoryEngine engine;

    private final Tracker tracker;
    private final Cafeteria cafeteria;
    private final List<Window> windows;

    /**
     * Constructs a new {@link Theatre}.
     *
     * @param config Configuration of the run.
     * @param engine Uninitialized engine to sell from.
     */
    public Theatre(final Config config, final InventoryEngine engine) {
        this.config = config;
        this.engine = engine;
        final var limits = config.getLimits();
        final var windows = new ArrayList<Window>(limits.getWindows());
        for (var number = 1; number <= limits.getWindows(); number++) {
            windows.add(new Window(this, number));
        }
        this.windows = Collections.unmodifiableList(windows);
        this.cafeteria = new Cafeteria(this);
        // Every window plus the cafeteria report when they are done.
        this.tracker = new Tracker(this, limits.getMovies(), limits.getShowingsPerMovie(), windows.size() + 1);
    }

    public Config getConfig() {
        return this.config;
    }

    public InventoryEngine getEngine() {
        return this.engine;
    }

    public Tracker getTracker() {
        return this.tracker;
    }

    public Cafeteria getCafeteria() {
        return this.cafeteria;
    }

    public List<Window> getWindows() {
        return this.windows;
    }

    /**
     * Closes all windows. Each window finishes its current sale first.
     */
    public void closeWindows() {
        for (final var window : this.windows) {
            window.close();
        }
    }

    /**
     * <p>
     * Opens the theatre for the configured run time and returns the report.
     * </p>
     *
     * <p>
     * The engine is initialized at the beginning and shut down at the end.
     * </p>
     *
     * @return The summary report of the run.
     * @throws ConfigurationException If the engine rejects the limits.
     * @throws InterruptedException   The thread has been interrupted.
     * @throws ExecutionException     If the tracker failed.
     */
    public SummaryReport run() throws ConfigurationException, InterruptedException, ExecutionException {
        this.engine.initialize(this.config.getLimits());
        LOG.info("Theatre opening {} windows for {}", this.windows.size(), this.config.getRunTime());

        final var executor = Executors.newFixedThreadPool(this.windows.size() + 2);
        final var timer = Executors.newSingleThreadScheduledExecutor();
        try {
            final var report = executor.submit(this.tracker);
            executor.execute(this.cafeteria);
            for (final var window : this.windows) {
                executor.execute(window);
            }
            timer.schedule(() -> this.tracker.getMailbox().sendHighPriority(new Tracker.MsgCloseWindows()),
                    this.config.getRunTime().toMillis(), TimeUnit.MILLISECONDS);
            return report.get();
        } finally {
            timer.shutdownNow();
            this.closeWindows();
            this.engine.shutdown();
            executor.shutdownNow();
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Theatre actors did not terminate in time");
            }
        }
    }
}

package com.boxoffice.theatre;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Test;

import com.boxoffice.Config;
import com.boxoffice.engine.ExhaustedSourceException;
import com.boxoffice.engine.InventoryEngine;
import com.boxoffice.engine.Limits;

public class TestTheatre {
    private final AtomicReference<ExhaustedSourceException> fatal = new AtomicReference<>();

    private static void assertConsistent(final SummaryReport report) {
        var sold = 0;
        var soldOuts = 0;
        for (var movie = 0; movie < report.getMovies(); movie++) {
            for (var showing = 0; showing < report.getShowings(); showing++) {
                sold += report.getTicketsSold(movie, showing);
                soldOuts += report.getSoldOuts(movie, showing);
            }
        }
        assertEquals(sold, report.getTotalSold());
        assertEquals(soldOuts, report.getTotalSoldOuts());
    }

    @Test(timeout = 20000)
    public void testRun() throws Exception {
        final var limits = new Limits(50, 3, 2, 1000, 3);
        final var config = new Config(limits, Duration.ofMillis(500), 3, Duration.ofMillis(2));
        final var engine = new InventoryEngine(this.fatal::set);
        final var theatre = new Theatre(config, engine);

        final var report = theatre.run();

        assertNotNull(report);
        assertFalse(engine.isOpen());
        assertNull(this.fatal.get());
        assertEquals(3, report.getMovies());
        assertEquals(2, report.getShowings());
        assertTrue(report.getTotalSold() > 0);
        assertEquals(0, report.getTotalSoldOuts());
        assertEquals(engine.getExchangesMade(), report.getExchanges());
        assertTrue(report.getExchanges() <= 50);
        assertConsistent(report);
    }

    @Test(timeout = 20000)
    public void testSelloutsAndExhaustion() throws Exception {
        // Only 8 ticket numbers, the windows run out of them long before the time is over.
        final var limits = new Limits(2, 2, 2, 2, 2);
        final var config = new Config(limits, Duration.ofSeconds(10), 2, Duration.ZERO);
        final var engine = new InventoryEngine(this.fatal::set);

        final var report = new Theatre(config, engine).run();

        assertNotNull(this.fatal.get());
        assertFalse(engine.isOpen());
        assertEquals(8, report.getTotalSold() + report.getTotalSoldOuts());
        for (var movie = 0; movie < 2; movie++) {
            for (var showing = 0; showing < 2; showing++) {
                assertTrue(report.getTicketsSold(movie, showing) <= 2);
            }
        }
        assertTrue(report.getExchanges() <= 2);
        assertConsistent(report);
    }
}

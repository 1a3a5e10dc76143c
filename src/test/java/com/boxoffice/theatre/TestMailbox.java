package com.boxoffice.theatre;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.concurrent.Executors;

import org.junit.Test;

public class TestMailbox {
    @Test(timeout = 10000)
    public void testPriorities() throws InterruptedException {
        final var mailbox = new Mailbox<String>();

        mailbox.sendHighPriority("1. High");
        mailbox.sendLowPriority("1. Low");
        mailbox.sendHighPriority("2. High");
        mailbox.sendLowPriority("2. Low");

        assertEquals("1. High", mailbox.recv());
        assertEquals("2. High", mailbox.recv());
        assertEquals("1. Low", mailbox.recv());
        assertEquals("2. Low", mailbox.recv());
        assertTrue(mailbox.isEmpty());
    }

    @Test(timeout = 10000)
    public void testTryRecv() {
        final var mailbox = new Mailbox<String>();

        assertNull(mailbox.tryRecv());

        mailbox.sendLowPriority("Low");
        mailbox.sendHighPriority("High");

        assertEquals("High", mailbox.tryRecv());
        assertEquals("Low", mailbox.tryRecv());

        assertNull(mailbox.tryRecv());
    }

    @Test(timeout = 10000)
    public void testRecvWaitsForSender() throws Exception {
        final var mailbox = new Mailbox<Integer>();
        final var executor = Executors.newSingleThreadExecutor();
        try {
            final var received = executor.submit(mailbox::recv);
            Thread.sleep(50);
            assertTrue(mailbox.sendLowPriority(42));
            assertEquals(Integer.valueOf(42), received.get());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test(timeout = 10000)
    public void testClose() throws InterruptedException {
        final var mailbox = new Mailbox<String>();
        assertTrue(mailbox.sendLowPriority("Before"));
        mailbox.close();
        assertTrue(mailbox.isClosed());

        assertFalse(mailbox.sendLowPriority("After"));
        assertFalse(mailbox.sendHighPriority("After"));
        // Messages sent before closing are still delivered.
        assertEquals("Before", mailbox.recv());
        assertTrue(mailbox.isEmpty());
    }
}

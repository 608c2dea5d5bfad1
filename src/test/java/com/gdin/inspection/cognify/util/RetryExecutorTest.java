package com.gdin.inspection.cognify.util;

import com.gdin.inspection.cognify.config.properties.CognifyProperties;
import com.gdin.inspection.cognify.exception.RetriesExhaustedException;
import com.gdin.inspection.cognify.exception.TransientStoreException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

public class RetryExecutorTest {

    private static RetryExecutor executor() {
        CognifyProperties.Retry retry = new CognifyProperties.Retry();
        retry.setMaxAttempts(3);
        retry.setBackoffMs(1L);
        retry.setMaxBackoffMs(4L);
        retry.setMultiplier(2.0);
        return new RetryExecutor(retry);
    }

    @Test
    public void testTransientErrorsAreRetried() {
        AtomicInteger calls = new AtomicInteger();
        String out = executor().call("op", () -> {
            if (calls.incrementAndGet() < 3) throw new TransientStoreException("busy");
            return "ok";
        });
        Assertions.assertEquals("ok", out);
        Assertions.assertEquals(3, calls.get());
    }

    @Test
    public void testRetriesAreBounded() {
        AtomicInteger calls = new AtomicInteger();
        RetriesExhaustedException e = Assertions.assertThrows(RetriesExhaustedException.class,
                () -> executor().call("op", () -> {
                    calls.incrementAndGet();
                    throw new TransientStoreException("down");
                }));
        Assertions.assertEquals(3, calls.get());
        Assertions.assertEquals(3, e.getAttempts());
        Assertions.assertEquals("op", e.getOperation());
    }

    @Test
    public void testNonTransientErrorIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        Assertions.assertThrows(IllegalStateException.class, () -> executor().call("op", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bad input");
        }));
        Assertions.assertEquals(1, calls.get());
    }

    @Test
    public void testTimeoutCountsAsTransient() {
        Assertions.assertThrows(RetriesExhaustedException.class, () -> executor().call("slow", () -> {
            Thread.sleep(500);
            return "late";
        }, Duration.ofMillis(20)));
    }

    @Test
    public void testBackoffIsCapped() {
        RetryExecutor executor = executor();
        Assertions.assertEquals(1, executor.backoffDelay(0));
        Assertions.assertEquals(2, executor.backoffDelay(1));
        Assertions.assertEquals(4, executor.backoffDelay(2));
        Assertions.assertEquals(4, executor.backoffDelay(5));
    }
}

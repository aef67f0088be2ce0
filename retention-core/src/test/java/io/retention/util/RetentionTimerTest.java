/**
 * Copyright 2016 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.retention.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.lang.ref.Reference;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import io.retention.RetentionTimerThreadPoolProperties;
import io.retention.strategy.RetentionPlugins;
import io.retention.strategy.properties.RetentionPropertiesStrategy;
import io.retention.util.RetentionTimer.TimerListener;

public class RetentionTimerTest {

    @Before
    public void setUp() {
        RetentionTimer.reset();
        RetentionPlugins.reset();
    }

    @After
    public void tearDown() {
        RetentionTimer.reset();
        RetentionPlugins.reset();
    }

    @Test
    public void testListenerTicksRepeatedly() throws Exception {
        CountingListener listener = new CountingListener(10, 5);
        Reference<TimerListener> ref = RetentionTimer.getInstance().addTimerListener(listener);

        assertTrue("listener did not tick 5 times", listener.ticks.await(2000, TimeUnit.MILLISECONDS));
        assertSame(listener, ref.get());
    }

    @Test
    public void testClearStopsListener() throws Exception {
        CountingListener kept = new CountingListener(10, 1);
        CountingListener removed = new CountingListener(10, 1);
        RetentionTimer timer = RetentionTimer.getInstance();
        timer.addTimerListener(kept);
        Reference<TimerListener> ref = timer.addTimerListener(removed);
        assertTrue(removed.ticks.await(2000, TimeUnit.MILLISECONDS));

        ref.clear();
        assertNull(ref.get());
        // let a tick that was already running finish
        Thread.sleep(20);
        int ticksAtClear = removed.count.get();
        int keptAtClear = kept.count.get();
        Thread.sleep(100);

        assertEquals(ticksAtClear, removed.count.get());
        assertTrue(kept.count.get() > keptAtClear);
    }

    @Test
    public void testFailingListenerKeepsTicking() throws Exception {
        final CountDownLatch attempts = new CountDownLatch(3);
        RetentionTimer.getInstance().addTimerListener(new TimerListener() {
            @Override
            public void tick() {
                attempts.countDown();
                throw new IllegalStateException("tick failure");
            }

            @Override
            public int getIntervalTimeInMilliseconds() {
                return 10;
            }
        });

        // an exception escaping the scheduled task would cancel it after the first run
        assertTrue(attempts.await(2000, TimeUnit.MILLISECONDS));
    }

    @Test
    public void testListenerThrowingErrorKeepsTicking() throws Exception {
        final CountDownLatch attempts = new CountDownLatch(3);
        RetentionTimer.getInstance().addTimerListener(new TimerListener() {
            @Override
            public void tick() {
                attempts.countDown();
                throw new AssertionError("tick error");
            }

            @Override
            public int getIntervalTimeInMilliseconds() {
                return 10;
            }
        });

        assertTrue(attempts.await(2000, TimeUnit.MILLISECONDS));
    }

    @Test
    public void testResetDeschedulesListeners() throws Exception {
        RetentionTimer timer = RetentionTimer.getInstance();
        CountingListener listener = new CountingListener(10, 1);
        Reference<TimerListener> ref = timer.addTimerListener(listener);
        assertTrue(listener.ticks.await(2000, TimeUnit.MILLISECONDS));
        ScheduledThreadPoolExecutor pool = timer.pool.get();

        RetentionTimer.reset();

        assertTrue(pool.isShutdown());
        assertNull(timer.pool.get());
        assertNull("a descheduled listener must not look scheduled", ref.get());
        Thread.sleep(20);
        int ticksAtReset = listener.count.get();
        Thread.sleep(100);
        assertEquals(ticksAtReset, listener.count.get());

        // idempotent
        RetentionTimer.reset();
    }

    @Test
    public void testPoolRestartsAfterReset() throws Exception {
        RetentionTimer timer = RetentionTimer.getInstance();
        timer.addTimerListener(new CountingListener(50, 1));
        ScheduledThreadPoolExecutor first = timer.pool.get();
        RetentionTimer.reset();

        CountingListener listener = new CountingListener(10, 1);
        Reference<TimerListener> ref = timer.addTimerListener(listener);
        ScheduledThreadPoolExecutor second = timer.pool.get();

        assertNotNull(second);
        assertNotSame(first, second);
        assertFalse(second.isShutdown());
        assertTrue(listener.ticks.await(2000, TimeUnit.MILLISECONDS));
        assertSame(listener, ref.get());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNonPositiveInterval() {
        RetentionTimer.getInstance().addTimerListener(new CountingListener(0, 1));
    }

    @Test
    public void testThreadsAreNamedDaemons() throws Exception {
        final CountDownLatch ticked = new CountDownLatch(1);
        final AtomicInteger foreignTicks = new AtomicInteger();
        RetentionTimer.getInstance().addTimerListener(new TimerListener() {
            @Override
            public void tick() {
                Thread current = Thread.currentThread();
                if (!current.isDaemon() || !current.getName().startsWith("RetentionTimer-")) {
                    foreignTicks.incrementAndGet();
                }
                ticked.countDown();
            }

            @Override
            public int getIntervalTimeInMilliseconds() {
                return 10;
            }
        });

        assertTrue(ticked.await(2000, TimeUnit.MILLISECONDS));
        assertEquals(0, foreignTicks.get());
    }

    @Test
    public void testDefaultCoreSizeIsProcessorCount() {
        assertEquals(Runtime.getRuntime().availableProcessors(), RetentionTimer.getInstance().getPool().getCorePoolSize());
    }

    @Test
    public void testCoreSizeFromPropertiesStrategy() {
        final RetentionTimerThreadPoolProperties props = new RetentionTimerThreadPoolProperties(RetentionTimerThreadPoolProperties.Setter().withCoreSize(2)) {
        };
        RetentionPlugins.getInstance().registerPropertiesStrategy(new RetentionPropertiesStrategy() {
            @Override
            public RetentionTimerThreadPoolProperties getTimerThreadPoolProperties() {
                return props;
            }
        });

        assertEquals(2, RetentionTimer.getInstance().getPool().getCorePoolSize());
    }

    private static class CountingListener implements TimerListener {

        private final int interval;
        final AtomicInteger count = new AtomicInteger();
        final CountDownLatch ticks;

        CountingListener(int interval, int expectedTicks) {
            this.interval = interval;
            this.ticks = new CountDownLatch(expectedTicks);
        }

        @Override
        public void tick() {
            count.incrementAndGet();
            ticks.countDown();
        }

        @Override
        public int getIntervalTimeInMilliseconds() {
            return interval;
        }

    }

}

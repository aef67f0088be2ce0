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

import java.lang.ref.Reference;
import java.lang.ref.SoftReference;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.retention.strategy.RetentionPlugins;

/**
 * Daemon scheduler shared by every collapser driver in the JVM.
 * <p>
 * The thread pool is created on the first {@link #addTimerListener} and sized by
 * {@link io.retention.RetentionTimerThreadPoolProperties}. {@link #reset()} discards it, descheduling every listener;
 * the next registration starts a new pool.
 */
public class RetentionTimer {

    private static final Logger logger = LoggerFactory.getLogger(RetentionTimer.class);

    private static final RetentionTimer INSTANCE = new RetentionTimer();

    /* package */ final AtomicReference<ScheduledThreadPoolExecutor> pool = new AtomicReference<ScheduledThreadPoolExecutor>();

    private RetentionTimer() {
    }

    public static RetentionTimer getInstance() {
        return INSTANCE;
    }

    /**
     * Shut the thread pool down. Listeners registered so far never tick again and their references report
     * <code>null</code> from {@link Reference#get()}.
     * <p>
     * NOTE: listeners added concurrently with a reset may land on the discarded pool.
     */
    public static void reset() {
        ScheduledThreadPoolExecutor current = INSTANCE.pool.getAndSet(null);
        if (current == null) {
            return;
        }
        List<Runnable> descheduled = current.shutdownNow();
        for (Runnable task : descheduled) {
            // queued tasks are the ScheduledFutures handed out by addTimerListener
            if (task instanceof Future) {
                ((Future<?>) task).cancel(false);
            }
        }
        logger.debug("RetentionTimer shut down, {} listeners descheduled", descheduled.size());
    }

    /**
     * Tick <code>listener</code> at its interval until the returned reference is cleared or the timer is reset.
     * <p>
     * A tick that throws, even an {@link Error}, is logged and the listener keeps its schedule.
     * 
     * @param listener
     *            listener to schedule
     * @return reference whose {@link Reference#clear()} deschedules the listener and whose {@link Reference#get()} is
     *         <code>null</code> once the listener is no longer scheduled
     * @throws IllegalArgumentException
     *             if the listener interval is not positive
     */
    public Reference<TimerListener> addTimerListener(final TimerListener listener) {
        int interval = listener.getIntervalTimeInMilliseconds();
        if (interval <= 0) {
            throw new IllegalArgumentException("TimerListener interval must be positive, was " + interval + " ms");
        }
        Runnable tick = new Runnable() {

            @Override
            public void run() {
                try {
                    listener.tick();
                } catch (Throwable e) {
                    // anything escaping run() would cancel the fixed-rate schedule for good
                    logger.error("TimerListener " + listener + " failed to tick", e);
                }
            }
        };
        ScheduledThreadPoolExecutor current = getPool();
        ScheduledFuture<?> schedule = current.scheduleAtFixedRate(tick, interval, interval, TimeUnit.MILLISECONDS);
        return new ListenerReference(listener, current, schedule);
    }

    /* package */ ScheduledThreadPoolExecutor getPool() {
        ScheduledThreadPoolExecutor current = pool.get();
        while (current == null) {
            ScheduledThreadPoolExecutor created = createPool();
            if (pool.compareAndSet(null, created)) {
                current = created;
            } else {
                // lost the race, no thread was started on this one yet
                created.shutdown();
                current = pool.get();
            }
        }
        return current;
    }

    private static ScheduledThreadPoolExecutor createPool() {
        int coreSize = RetentionPlugins.getInstance().getPropertiesStrategy().getTimerThreadPoolProperties().getCorePoolSize().get();
        ScheduledThreadPoolExecutor created = new ScheduledThreadPoolExecutor(coreSize, new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger();

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, "RetentionTimer-" + threadNumber.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        });
        created.setRemoveOnCancelPolicy(true);
        logger.debug("RetentionTimer pool created with core size {}", coreSize);
        return created;
    }

    private static class ListenerReference extends SoftReference<TimerListener> {

        private final ScheduledThreadPoolExecutor owner;
        private final ScheduledFuture<?> schedule;

        ListenerReference(TimerListener listener, ScheduledThreadPoolExecutor owner, ScheduledFuture<?> schedule) {
            super(listener);
            this.owner = owner;
            this.schedule = schedule;
        }

        @Override
        public TimerListener get() {
            // a tick running during reset() is only cancelled once it returns, the pool is shut down already
            if (schedule.isDone() || owner.isShutdown()) {
                return null;
            }
            return super.get();
        }

        @Override
        public void clear() {
            super.clear();
            schedule.cancel(false);
        }

    }

    /**
     * Work scheduled on the {@link RetentionTimer}.
     */
    public static interface TimerListener {

        /**
         * Called once per interval on a shared timer thread. A slow tick delays the other listeners on that thread.
         */
        public void tick();

        /**
         * @return milliseconds between ticks, must be positive
         */
        public int getIntervalTimeInMilliseconds();
    }

}

/**
 * Copyright 2026 The Retention Authors
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
package io.retention;

import java.lang.ref.Reference;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.retention.collapser.CollapserTimer;
import io.retention.collapser.PendingEntry;
import io.retention.collapser.PendingStore;
import io.retention.collapser.RealCollapserTimer;
import io.retention.metric.CollapserEvent;
import io.retention.metric.CollapserEventStream;
import io.retention.strategy.RetentionPlugins;
import io.retention.strategy.eventnotifier.RetentionEventNotifier;
import io.retention.strategy.properties.RetentionPropertiesStrategy;
import io.retention.util.RetentionTimer.TimerListener;
import io.retention.util.Time;
import rx.functions.Action1;

/**
 * Coalesces bursts of values per key into a single delayed invocation of an execute function.
 * <p>
 * The first value collapsed for a key is kept until it is flushed; later values for the same key are dropped but every
 * collapse re-arms the retention window. A pending value is flushed when the retention window elapses without a new
 * collapse, or when the time since the previous flush exceeds the max duration, whichever comes first. Both watermarks
 * are shared by all keys of one instance.
 * <p>
 * Flushing is driven by a {@link CollapserDriver} polling on the shared {@link io.retention.util.RetentionTimer}.
 * {@link #cancel()} stops the driver and drains everything still pending.
 * <p>
 * Example:
 * <pre> {@code
 * BatchCollapser<String, Change> collapser = BatchCollapser.create(
 *         BatchCollapser.Setter.withCollapserKey(BatchCollapserKey.Factory.asKey("config-changes"))
 *                 .andCollapserPropertiesDefaults(BatchCollapserProperties.Setter().withRetentionDurationInMilliseconds(500)),
 *         new Action1<Change>() {
 *             public void call(Change change) {
 *                 reload(change);
 *             }
 *         });
 * collapser.collapse(change.getPath(), change);
 * } </pre>
 * 
 * @param <K>
 *            type of the collapse key
 * @param <V>
 *            type of the collapsed values
 * 
 * @ThreadSafe
 */
public class BatchCollapser<K, V> implements Cancelable {

    private static final Logger logger = LoggerFactory.getLogger(BatchCollapser.class);

    /**
     * State of the background driver. Starts RUNNING and moves to STOPPED exactly once.
     */
    public enum DriverState {
        RUNNING, STOPPED
    }

    private final BatchCollapserKey collapserKey;
    private final BatchCollapserProperties properties;
    private final Action1<? super V> executeFunction;
    private final Time time;
    private final PendingStore<K, V> store;
    private final RetentionEventNotifier eventNotifier;
    private final CollapserEventStream eventStream;
    private final int timerDelay;

    private final AtomicBoolean cancellationSignal = new AtomicBoolean(false);
    private final AtomicBoolean canceled = new AtomicBoolean(false);
    private final AtomicReference<DriverState> driverState = new AtomicReference<DriverState>(DriverState.RUNNING);
    private final AtomicReference<Reference<TimerListener>> driverReference = new AtomicReference<Reference<TimerListener>>();
    // serializes calls into executeFunction, never taken by collapse
    private final ReentrantLock executionLock = new ReentrantLock();

    /**
     * Construct a {@link BatchCollapser} and start its driver on the shared timer.
     * 
     * @param setter
     *            collapser key and property overrides
     * @param executeFunction
     *            invoked once per flushed value. May be null, in which case nothing is ever flushed.
     */
    protected BatchCollapser(Setter setter, Action1<? super V> executeFunction) {
        this(setter.collapserKey, setter.propertiesSetter, executeFunction, new RealCollapserTimer(), Time.ACTUAL);
    }

    /* package for tests */ BatchCollapser(BatchCollapserKey collapserKey, BatchCollapserProperties.Setter propertiesDefaults, Action1<? super V> executeFunction, CollapserTimer timer, Time time) {
        if (collapserKey == null) {
            String defaultKeyName = getClass().getSimpleName();
            if (defaultKeyName.length() == 0) {
                defaultKeyName = "BatchCollapser";
            }
            collapserKey = BatchCollapserKey.Factory.asKey(defaultKeyName);
        }
        this.collapserKey = collapserKey;
        // resolved per instance, two collapsers sharing a key keep their own overrides
        this.properties = RetentionPlugins.getInstance().getPropertiesStrategy().getCollapserProperties(collapserKey, propertiesDefaults);
        this.executeFunction = executeFunction;
        this.time = time;
        this.eventNotifier = RetentionPlugins.getInstance().getEventNotifier();
        this.eventStream = CollapserEventStream.getInstance(collapserKey);

        // durations are read once, a running collapser does not follow later property changes
        long retentionDuration = properties.retentionDurationInMilliseconds().get();
        long maxDuration = properties.maxDurationInMilliseconds().get();
        if (maxDuration < retentionDuration) {
            logger.debug("BatchCollapser[{}] maxDuration {} ms is below retentionDuration {} ms and caps the retention window", collapserKey.name(), maxDuration, retentionDuration);
        }
        int configuredDelay = properties.timerDelayInMilliseconds().get();
        if (configuredDelay < 1) {
            logger.warn("BatchCollapser[{}] timerDelay {} ms is not positive, polling every 1 ms instead", collapserKey.name(), configuredDelay);
            configuredDelay = 1;
        }
        this.timerDelay = configuredDelay;
        this.store = new PendingStore<K, V>(time.getCurrentTimeInMillis(), retentionDuration, maxDuration, properties.maxPendingEntries().get());

        if (executeFunction == null) {
            logger.debug("BatchCollapser[{}] created without an execute function, pending values will never be flushed", collapserKey.name());
        }

        driverReference.set(timer.addListener(new CollapserDriver()));
        logger.debug("BatchCollapser[{}] started with retention {} ms, max {} ms, poll {} ms", collapserKey.name(), retentionDuration, maxDuration, timerDelay);
    }

    /**
     * Create a {@link BatchCollapser} on the shared timer.
     * 
     * @param setter
     *            collapser key and property overrides
     * @param executeFunction
     *            invoked once per flushed value, may be null
     */
    public static <K, V> BatchCollapser<K, V> create(Setter setter, Action1<? super V> executeFunction) {
        return new BatchCollapser<K, V>(setter, executeFunction);
    }

    /**
     * Offer a value for a key. The value is kept only if nothing is pending for the key yet. In every case the retention
     * window is re-armed.
     * <p>
     * Never fails from the caller's perspective. A null value keeps nothing but still re-arms the window.
     * 
     * @param key
     *            must not be null
     * @param value
     *            value to flush later
     * @throws NullPointerException
     *             if key is null
     */
    public void collapse(K key, V value) {
        if (key == null) {
            throw new NullPointerException("BatchCollapser[" + collapserKey.name() + "] does not accept a null key");
        }
        if (cancellationSignal.get()) {
            logger.warn("BatchCollapser[{}] is canceled, value for key '{}' will be kept but never flushed", collapserKey.name(), key);
        }
        PendingStore.Offer offer = store.offer(key, value, time.getCurrentTimeInMillis());
        switch (offer) {
        case ADDED:
            markEvent(RetentionEventType.COLLAPSED, 1);
            break;
        case DUPLICATE:
            markEvent(RetentionEventType.COLLAPSED_DUPLICATE, 1);
            break;
        case REJECTED:
            logger.warn("BatchCollapser[{}] is holding {} pending keys, dropping value for new key '{}'", collapserKey.name(), properties.maxPendingEntries().get(), key);
            markEvent(RetentionEventType.REJECTED, 1);
            break;
        default:
            // null value, window re-armed only
            break;
        }
    }

    /**
     * Flush the pending entries that are due now, or all of them when <code>force</code> is true.
     * <p>
     * Due entries are removed under the store lock and then handed to the execute function one at a time outside of it,
     * so a concurrent {@link #collapse} never waits on user code. A failing execute function is logged and does not stop
     * the remaining entries.
     * 
     * @param force
     *            flush regardless of the watermarks
     * @return number of entries handed to the execute function
     */
    /* package */ int evaluate(boolean force) {
        if (executeFunction == null) {
            return 0;
        }
        executionLock.lock();
        try {
            if (!force && cancellationSignal.get()) {
                // a tick that raced with cancel()
                return 0;
            }
            List<PendingEntry<K, V>> due = store.drain(time.getCurrentTimeInMillis(), force);
            if (due.isEmpty()) {
                return 0;
            }
            RetentionEventType flushType = force ? RetentionEventType.DRAINED : RetentionEventType.FLUSHED;
            markEvent(flushType, due.size());
            int executed = 0;
            for (PendingEntry<K, V> entry : due) {
                long start = System.currentTimeMillis();
                try {
                    executeFunction.call(entry.getValue());
                    executed++;
                } catch (Throwable e) {
                    // an Error from one value must not strand the rest of the drained batch
                    logger.error("BatchCollapser[" + collapserKey.name() + "] execute function failed for key '" + entry.getKey() + "'", e);
                    markEvent(RetentionEventType.EXECUTION_FAILURE, 1);
                } finally {
                    eventNotifier.markExecution(collapserKey, System.currentTimeMillis() - start);
                }
            }
            return executed;
        } finally {
            executionLock.unlock();
        }
    }

    /**
     * Stop the driver and synchronously flush every pending value, then mark this collapser canceled.
     * <p>
     * Only the first call has an effect. Values collapsed after that are stored but never flushed. The collapser
     * counts as canceled even if an event notifier throws during the drain.
     */
    @Override
    public void cancel() {
        if (!cancellationSignal.compareAndSet(false, true)) {
            logger.debug("BatchCollapser[{}] already canceled, ignoring cancel()", collapserKey.name());
            return;
        }
        try {
            stopDriver();
            int drained = evaluate(true);
            logger.debug("BatchCollapser[{}] canceled, drained {} pending values", collapserKey.name(), drained);
        } finally {
            canceled.set(true);
        }
    }

    @Override
    public boolean isCanceled() {
        return canceled.get();
    }

    private void stopDriver() {
        if (driverState.compareAndSet(DriverState.RUNNING, DriverState.STOPPED)) {
            logger.debug("BatchCollapser[{}] driver stopped", collapserKey.name());
        }
        Reference<TimerListener> ref = driverReference.getAndSet(null);
        if (ref != null) {
            ref.clear();
        }
    }

    private void markEvent(RetentionEventType eventType, int count) {
        eventNotifier.markEvent(eventType, collapserKey);
        eventStream.write(CollapserEvent.from(collapserKey, eventType, count));
    }

    /**
     * @return the value pending for <code>key</code> or null if nothing is pending
     */
    public V getPendingValue(K key) {
        return store.get(key);
    }

    /**
     * @return read-only copy of all pending values
     */
    public Map<K, V> getPendingValues() {
        return store.snapshot();
    }

    public int getPendingCount() {
        return store.size();
    }

    /**
     * @return STOPPED once the collapser is canceled or its timer no longer schedules the driver, for example after
     *         {@link Retention#reset()}
     */
    public DriverState getDriverState() {
        if (driverState.get() == DriverState.RUNNING) {
            Reference<TimerListener> ref = driverReference.get();
            if ((ref == null || ref.get() == null) && driverState.compareAndSet(DriverState.RUNNING, DriverState.STOPPED)) {
                logger.debug("BatchCollapser[{}] driver is no longer scheduled", collapserKey.name());
            }
        }
        return driverState.get();
    }

    public BatchCollapserKey getCollapserKey() {
        return collapserKey;
    }

    public BatchCollapserProperties getProperties() {
        return properties;
    }

    @Override
    public String toString() {
        return "BatchCollapser[" + collapserKey.name() + "]";
    }

    /**
     * Polls the owning collapser on the shared timer until the cancellation signal is seen.
     */
    private class CollapserDriver implements TimerListener {

        @Override
        public void tick() {
            if (cancellationSignal.get()) {
                stopDriver();
                return;
            }
            evaluate(false);
        }

        @Override
        public int getIntervalTimeInMilliseconds() {
            return timerDelay;
        }

    }

    /**
     * Fluent interface for arguments to the {@link BatchCollapser} constructor.
     * <p>
     * The required arguments are set via the 'with' factory method and optional arguments via the 'and' chained methods.
     * <p>
     * Example:
     * <pre> {@code
     *  Setter.withCollapserKey(BatchCollapserKey.Factory.asKey("CollapserName"))
     *          .andCollapserPropertiesDefaults(BatchCollapserProperties.Setter().withMaxDurationInMilliseconds(5000));
     * } </pre>
     * 
     * @NotThreadSafe
     */
    public static class Setter {
        private final BatchCollapserKey collapserKey;
        private BatchCollapserProperties.Setter propertiesSetter;

        private Setter(BatchCollapserKey collapserKey) {
            this.collapserKey = collapserKey;
        }

        /**
         * Setter factory method containing required values.
         * <p>
         * All optional arguments can be set via the chained methods.
         * 
         * @param collapserKey
         *            {@link BatchCollapserKey} that identifies this collapser and provides the key used for retrieving properties and publishing events
         * @return Setter for fluent interface via method chaining
         */
        public static Setter withCollapserKey(BatchCollapserKey collapserKey) {
            return new Setter(collapserKey);
        }

        /**
         * @param propertiesSetter
         *            {@link BatchCollapserProperties.Setter} that allows instance specific property overrides (which can then be overridden by dynamic properties, see
         *            {@link RetentionPropertiesStrategy} for information on order of precedence).
         *            <p>
         *            Will use defaults if left NULL.
         * @return Setter for fluent interface via method chaining
         */
        public Setter andCollapserPropertiesDefaults(BatchCollapserProperties.Setter propertiesSetter) {
            this.propertiesSetter = propertiesSetter;
            return this;
        }

    }

}

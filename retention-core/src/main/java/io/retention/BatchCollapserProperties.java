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
package io.retention;

import io.retention.strategy.properties.ChainedIntegerProperty;
import io.retention.strategy.properties.RetentionPropertiesStrategy;
import io.retention.strategy.properties.RetentionProperty;

/**
 * Properties for instances of {@link BatchCollapser}.
 * <p>
 * Each value is looked up as <code>retention.collapser.&lt;key&gt;.&lt;name&gt;</code> (falling back to the {@link Setter} override), then
 * <code>retention.collapser.default.&lt;name&gt;</code> (falling back to the built-in default).
 * <p>
 * Default implementation of methods uses Archaius (https://github.com/Netflix/archaius) when it is on the classpath.
 */
public abstract class BatchCollapserProperties {

    /* defaults */
    /* package */ static final Integer default_retentionDurationInMilliseconds = 1000;
    /* package */ static final Integer default_maxDurationInMilliseconds = 60000;
    /* package */ static final Integer default_timerDelayInMilliseconds = 10;
    private static final Integer default_maxPendingEntries = Integer.MAX_VALUE;

    private final RetentionProperty<Integer> retentionDurationInMilliseconds;
    private final RetentionProperty<Integer> maxDurationInMilliseconds;
    private final RetentionProperty<Integer> timerDelayInMilliseconds;
    private final RetentionProperty<Integer> maxPendingEntries;

    protected BatchCollapserProperties(BatchCollapserKey collapserKey) {
        this(collapserKey, new Setter(), "retention");
    }

    protected BatchCollapserProperties(BatchCollapserKey collapserKey, Setter builder) {
        this(collapserKey, builder, "retention");
    }

    protected BatchCollapserProperties(BatchCollapserKey key, Setter builder, String propertyPrefix) {
        if (builder == null) {
            builder = new Setter();
        }
        this.retentionDurationInMilliseconds = getProperty(propertyPrefix, key, "retentionDurationInMilliseconds", builder.getRetentionDurationInMilliseconds(), default_retentionDurationInMilliseconds);
        this.maxDurationInMilliseconds = getProperty(propertyPrefix, key, "maxDurationInMilliseconds", builder.getMaxDurationInMilliseconds(), default_maxDurationInMilliseconds);
        this.timerDelayInMilliseconds = getProperty(propertyPrefix, key, "timerDelayInMilliseconds", builder.getTimerDelayInMilliseconds(), default_timerDelayInMilliseconds);
        this.maxPendingEntries = getProperty(propertyPrefix, key, "maxPendingEntries", builder.getMaxPendingEntries(), default_maxPendingEntries);
    }

    private static RetentionProperty<Integer> getProperty(String propertyPrefix, BatchCollapserKey key, String instanceProperty, Integer builderOverrideValue, Integer defaultValue) {
        return ChainedIntegerProperty.builder()
                .add(propertyPrefix + ".collapser." + key.name() + "." + instanceProperty, builderOverrideValue)
                .add(propertyPrefix + ".collapser.default." + instanceProperty, defaultValue)
                .build();
    }

    /**
     * Quiet time after the most recent collapse before a pending value may be flushed. Re-armed on every collapse and every flush.
     * 
     * @return {@code RetentionProperty<Integer>}
     */
    public RetentionProperty<Integer> retentionDurationInMilliseconds() {
        return retentionDurationInMilliseconds;
    }

    /**
     * Upper bound on the time since the previous flush before a pending value is flushed regardless of new arrivals.
     * Expected to be at least {@link #retentionDurationInMilliseconds()}; if it is smaller it caps the retention window.
     * 
     * @return {@code RetentionProperty<Integer>}
     */
    public RetentionProperty<Integer> maxDurationInMilliseconds() {
        return maxDurationInMilliseconds;
    }

    /**
     * The number of milliseconds between polls of the driver loop.
     * 
     * @return {@code RetentionProperty<Integer>}
     */
    public RetentionProperty<Integer> timerDelayInMilliseconds() {
        return timerDelayInMilliseconds;
    }

    /**
     * The maximum number of distinct keys pending at once. Collapsing a new key into a full store drops the value.
     * 
     * @return {@code RetentionProperty<Integer>}
     */
    public RetentionProperty<Integer> maxPendingEntries() {
        return maxPendingEntries;
    }

    /**
     * Factory method to retrieve the default Setter.
     */
    public static Setter Setter() {
        return new Setter();
    }

    /**
     * Factory method to retrieve the default Setter.
     * Alias of {@link #Setter()} for languages that cannot call a method named like a nested class.
     */
    public static Setter defaultSetter() {
        return Setter();
    }

    /**
     * Fluent interface that allows chained setting of properties that can be passed into a {@link BatchCollapser} to inject instance specific property overrides.
     * <p>
     * See {@link RetentionPropertiesStrategy} for more information on order of precedence.
     * <p>
     * Example:
     * <p>
     * <pre> {@code
     * BatchCollapserProperties.Setter()
     *           .withRetentionDurationInMilliseconds(500)
     *           .withMaxDurationInMilliseconds(5000);
     * } </pre>
     * 
     * @NotThreadSafe
     */
    public static class Setter {
        private Integer retentionDurationInMilliseconds = null;
        private Integer maxDurationInMilliseconds = null;
        private Integer timerDelayInMilliseconds = null;
        private Integer maxPendingEntries = null;

        private Setter() {
        }

        public Integer getRetentionDurationInMilliseconds() {
            return retentionDurationInMilliseconds;
        }

        public Integer getMaxDurationInMilliseconds() {
            return maxDurationInMilliseconds;
        }

        public Integer getTimerDelayInMilliseconds() {
            return timerDelayInMilliseconds;
        }

        public Integer getMaxPendingEntries() {
            return maxPendingEntries;
        }

        public Setter withRetentionDurationInMilliseconds(int value) {
            this.retentionDurationInMilliseconds = value;
            return this;
        }

        public Setter withMaxDurationInMilliseconds(int value) {
            this.maxDurationInMilliseconds = value;
            return this;
        }

        public Setter withTimerDelayInMilliseconds(int value) {
            this.timerDelayInMilliseconds = value;
            return this;
        }

        public Setter withMaxPendingEntries(int value) {
            this.maxPendingEntries = value;
            return this;
        }
    }

}

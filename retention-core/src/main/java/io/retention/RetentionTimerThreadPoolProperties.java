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
import io.retention.strategy.properties.RetentionProperty;
import io.retention.util.RetentionTimer;

/**
 * Sizing of the {@link RetentionTimer} pool shared by all collapser drivers.
 * <p>
 * The core size resolves <code>retention.timer.threadpool.default.coreSize</code>, then the {@link Setter} value, then
 * the number of available processors. It is read when the pool is created, so a change applies after the next
 * {@link Retention#reset()}.
 */
public abstract class RetentionTimerThreadPoolProperties {

    /* package */ static final String CORE_SIZE = "retention.timer.threadpool.default.coreSize";

    private final RetentionProperty<Integer> corePoolSize;

    protected RetentionTimerThreadPoolProperties() {
        this(null);
    }

    protected RetentionTimerThreadPoolProperties(Setter setter) {
        Integer configured = setter == null ? null : setter.getCoreSize();
        this.corePoolSize = ChainedIntegerProperty.builder()
                .add(CORE_SIZE, configured == null ? Runtime.getRuntime().availableProcessors() : configured)
                .build();
    }

    /**
     * @return number of timer threads kept alive
     */
    public RetentionProperty<Integer> getCorePoolSize() {
        return corePoolSize;
    }

    public static Setter Setter() {
        return new Setter();
    }

    /**
     * Overrides for {@link RetentionTimerThreadPoolProperties}, still subject to the dynamic property.
     * 
     * @NotThreadSafe
     */
    public static class Setter {
        private Integer coreSize;

        private Setter() {
        }

        public Integer getCoreSize() {
            return coreSize;
        }

        public Setter withCoreSize(int value) {
            this.coreSize = value;
            return this;
        }
    }

}

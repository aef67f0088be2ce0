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
package io.retention.strategy.properties;

import io.retention.BatchCollapser;
import io.retention.BatchCollapserKey;
import io.retention.BatchCollapserProperties;
import io.retention.RetentionTimerThreadPoolProperties;
import io.retention.strategy.RetentionPlugins;

/**
 * Abstract class with default implementations of factory methods for properties used by collapsers and the shared timer.
 * <p>
 * See {@link RetentionPlugins} for information on configuring plugins.
 */
public abstract class RetentionPropertiesStrategy {

    /**
     * Construct an implementation of {@link BatchCollapserProperties} for {@link BatchCollapser} instances with {@link BatchCollapserKey}.
     * <p>
     * <b>Default Implementation</b>
     * <p>
     * Constructs instance of {@link RetentionPropertiesCollapserDefault}.
     * <p>
     * Called once per {@link BatchCollapser} instance. Collapsers sharing a key get their own properties, so the
     * builder overrides of one never leak into another.
     * 
     * @param collapserKey
     *            {@link BatchCollapserKey} representing the name of the {@link BatchCollapser}
     * @param builder
     *            {@link BatchCollapserProperties.Setter} with default overrides as injected to the {@link BatchCollapser} implementation.
     *            <p>
     *            The builder will return NULL for each value if no override was provided.
     * 
     * @return Implementation of {@link BatchCollapserProperties}
     */
    public BatchCollapserProperties getCollapserProperties(BatchCollapserKey collapserKey, BatchCollapserProperties.Setter builder) {
        return new RetentionPropertiesCollapserDefault(collapserKey, builder);
    }

    /**
     * Construct an implementation of {@link RetentionTimerThreadPoolProperties} for configuration of the timer thread pool
     * that drives collapser polling.
     * <p>
     * Constructs instance of {@link RetentionPropertiesTimerThreadPoolDefault}.
     *
     * @return Implementation of {@link RetentionTimerThreadPoolProperties}
     */
    public RetentionTimerThreadPoolProperties getTimerThreadPoolProperties() {
        return new RetentionPropertiesTimerThreadPoolDefault();
    }
}

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
package io.retention.strategy.eventnotifier;

import io.retention.BatchCollapserKey;
import io.retention.RetentionEventType;
import io.retention.strategy.RetentionPlugins;

/**
 * Abstract EventNotifier that allows receiving notifications for different events with default implementations.
 * <p>
 * See {@link RetentionPlugins} for information on configuring plugins.
 * <p>
 * <b>Note on thread-safety and performance</b>
 * <p>
 * A single implementation of this class will be used globally so methods on this class will be invoked concurrently from multiple threads so all functionality must be thread-safe.
 * <p>
 * Methods are invoked synchronously from <code>collapse</code> callers and from the polling thread, so all behavior should be fast.
 */
public abstract class RetentionEventNotifier {

    /**
     * Called for every event fired.
     * <p>
     * <b>Default Implementation: </b> Does nothing
     * 
     * @param eventType event type
     * @param key collapser key
     */
    public void markEvent(RetentionEventType eventType, BatchCollapserKey key) {
        // do nothing
    }

    /**
     * Called after the execute function ran for one flushed value, whether it succeeded or threw.
     * <p>
     * <b>Default Implementation: </b> Does nothing
     * 
     * @param key
     *            {@link BatchCollapserKey} of the collapser
     * @param duration
     *            time in milliseconds spent in the execute function
     */
    public void markExecution(BatchCollapserKey key, long duration) {
        // do nothing
    }

}

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

import io.retention.metric.CollapserEventStream;
import io.retention.strategy.RetentionPlugins;
import io.retention.util.RetentionTimer;

/**
 * Lifecycle management of the static state shared by all collapsers.
 */
public class Retention {

    /**
     * Reset state and release resources in use (such as the timer thread pool).
     * <p>
     * NOTE: This can result in race conditions if collapsers are concurrently being created or canceled.
     * Collapsers created before the reset keep their properties but their drivers stop with the timer and report
     * {@link BatchCollapser.DriverState#STOPPED}.
     */
    public static void reset() {
        // shutdown the timer thread pool
        RetentionTimer.reset();
        // clear plugins
        RetentionPlugins.reset();
        // drop event streams
        CollapserEventStream.reset();
    }

}

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
package io.retention.metric;

import io.retention.BatchCollapserKey;
import io.retention.RetentionEventType;

/**
 * Data class that comprises the event stream for collapsers: one {@link RetentionEventType} with a count for one {@link BatchCollapserKey}.
 */
public class CollapserEvent {
    private final BatchCollapserKey collapserKey;
    private final RetentionEventType eventType;
    private final int count;

    protected CollapserEvent(BatchCollapserKey collapserKey, RetentionEventType eventType, int count) {
        this.collapserKey = collapserKey;
        this.eventType = eventType;
        this.count = count;
    }

    public static CollapserEvent from(BatchCollapserKey collapserKey, RetentionEventType eventType, int count) {
        return new CollapserEvent(collapserKey, eventType, count);
    }

    public BatchCollapserKey getCollapserKey() {
        return collapserKey;
    }

    public RetentionEventType getEventType() {
        return eventType;
    }

    public int getCount() {
        return count;
    }

    @Override
    public String toString() {
        return "CollapserEvent[" + collapserKey.name() + "] : " + eventType.name() + " : " + count;
    }
}

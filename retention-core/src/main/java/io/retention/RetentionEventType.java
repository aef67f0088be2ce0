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

/**
 * Various states/events that a {@link BatchCollapser} can pass through.
 */
public enum RetentionEventType {
    /** a value became pending for a previously absent key */
    COLLAPSED,
    /** a value arrived for a key that already had one pending and was discarded */
    COLLAPSED_DUPLICATE,
    /** a value for a new key was dropped because the store was at capacity */
    REJECTED,
    /** a pending value was handed to the execute function by the polling loop */
    FLUSHED,
    /** a pending value was handed to the execute function by the drain on cancel */
    DRAINED,
    /** the execute function threw */
    EXECUTION_FAILURE
}

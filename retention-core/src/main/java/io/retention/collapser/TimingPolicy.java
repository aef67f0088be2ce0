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
package io.retention.collapser;

/**
 * Decides whether a pending value is due, from the shared watermarks of a collapser.
 */
public final class TimingPolicy {

    private TimingPolicy() {
        // static utility
    }

    /**
     * @param now
     *            current time in milliseconds
     * @param lastExec
     *            time of the most recent flush of any key
     * @param nextExec
     *            time before which no retention based flush occurs
     * @param maxDuration
     *            ceiling in milliseconds on the time since <code>lastExec</code>
     * @param force
     *            true during the drain performed on cancel
     * @return true if a pending value should be flushed now
     */
    public static boolean shouldFlush(long now, long lastExec, long nextExec, long maxDuration, boolean force) {
        return force
                || now > nextExec
                || now > lastExec + maxDuration;
    }

}

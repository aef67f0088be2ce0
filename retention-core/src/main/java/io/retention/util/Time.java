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

/**
 * Source of wall-clock milliseconds for the retention watermarks. Swapped out in unit tests.
 */
public interface Time {

    public long getCurrentTimeInMillis();

    public static final Time ACTUAL = new Time() {

        @Override
        public long getCurrentTimeInMillis() {
            return System.currentTimeMillis();
        }

        @Override
        public String toString() {
            return "Time.ACTUAL";
        }
    };

}

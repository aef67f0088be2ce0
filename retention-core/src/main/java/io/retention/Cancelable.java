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

/**
 * Something that can be told to stop and release what it still holds.
 */
public interface Cancelable {

    /**
     * Stop any background work and perform a final drain. Terminal: implementations never restart.
     */
    public void cancel();

    /**
     * @return true once {@link #cancel()} has completed
     */
    public boolean isCanceled();

}

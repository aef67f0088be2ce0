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
 * A value waiting in a {@link PendingStore} to be flushed. The first value collapsed for a key is the one kept.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class PendingEntry<K, V> {

    private final K key;
    private final V value;

    PendingEntry(K key, V value) {
        this.key = key;
        this.value = value;
    }

    public K getKey() {
        return key;
    }

    public V getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "PendingEntry[" + key + " => " + value + "]";
    }
}

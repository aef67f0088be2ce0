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

import io.retention.collapser.CollapserTimer;
import io.retention.util.Time;
import rx.functions.Action1;

/**
 * A {@link BatchCollapser} with a single implicit key: at most one value is pending at a time and a second
 * {@link #collapse(Object)} before it is flushed only re-arms the retention window.
 * 
 * @param <V>
 *            type of the collapsed value
 */
public class SingleValueCollapser<V> implements Cancelable {

    private static final Object SLOT = new Object() {
        @Override
        public String toString() {
            return "SLOT";
        }
    };

    private final BatchCollapser<Object, V> delegate;

    protected SingleValueCollapser(BatchCollapser.Setter setter, Action1<? super V> executeFunction) {
        this.delegate = new BatchCollapser<Object, V>(setter, executeFunction);
    }

    /* package for tests */ SingleValueCollapser(BatchCollapserKey collapserKey, BatchCollapserProperties.Setter propertiesDefaults, Action1<? super V> executeFunction, CollapserTimer timer, Time time) {
        this.delegate = new BatchCollapser<Object, V>(collapserKey, propertiesDefaults, executeFunction, timer, time);
    }

    public static <V> SingleValueCollapser<V> create(BatchCollapser.Setter setter, Action1<? super V> executeFunction) {
        return new SingleValueCollapser<V>(setter, executeFunction);
    }

    /**
     * Keep <code>value</code> unless a value is already pending, and re-arm the retention window.
     */
    public void collapse(V value) {
        delegate.collapse(SLOT, value);
    }

    /**
     * @return the pending value or null if the slot is empty
     */
    public V getValue() {
        return delegate.getPendingValue(SLOT);
    }

    @Override
    public void cancel() {
        delegate.cancel();
    }

    @Override
    public boolean isCanceled() {
        return delegate.isCanceled();
    }

    public BatchCollapser.DriverState getDriverState() {
        return delegate.getDriverState();
    }

    public BatchCollapserKey getCollapserKey() {
        return delegate.getCollapserKey();
    }

    public BatchCollapserProperties getProperties() {
        return delegate.getProperties();
    }

    @Override
    public String toString() {
        return "SingleValueCollapser[" + delegate.getCollapserKey().name() + "]";
    }

}

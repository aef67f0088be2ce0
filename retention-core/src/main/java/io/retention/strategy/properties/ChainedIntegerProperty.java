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
package io.retention.strategy.properties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.retention.strategy.RetentionPlugins;

/**
 * Integer property resolved from an ordered list of configuration names. The first name that yields a non-null value
 * wins.
 * <p>
 * Every link is read again on each {@link #get()}, so setting a more specific name later takes effect on the next read
 * and unsetting it falls back to the next link.
 * <p>
 * Example:
 * <pre> {@code
 * ChainedIntegerProperty.builder()
 *         .add("retention.collapser.orders.retentionDurationInMilliseconds", null)
 *         .add("retention.collapser.default.retentionDurationInMilliseconds", 1000)
 *         .build();
 * } </pre>
 */
public final class ChainedIntegerProperty implements RetentionDynamicProperty<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(ChainedIntegerProperty.class);

    private final List<RetentionDynamicProperty<Integer>> links;
    private final AtomicReference<String> resolvedFrom = new AtomicReference<String>();

    private ChainedIntegerProperty(List<RetentionDynamicProperty<Integer>> links) {
        this.links = links;
    }

    /**
     * @return builder reading from the {@link RetentionDynamicProperties} resolved by {@link RetentionPlugins}
     */
    public static Builder builder() {
        return builder(RetentionPlugins.getInstance().getDynamicProperties());
    }

    public static Builder builder(RetentionDynamicProperties source) {
        return new Builder(source);
    }

    @Override
    public Integer get() {
        for (RetentionDynamicProperty<Integer> link : links) {
            Integer value = link.get();
            if (value != null) {
                resolvedFrom(link.getName(), value);
                return value;
            }
        }
        resolvedFrom(null, null);
        return null;
    }

    private void resolvedFrom(String linkName, Integer value) {
        String previous = resolvedFrom.getAndSet(linkName);
        if (previous == null ? linkName != null : !previous.equals(linkName)) {
            logger.debug("Property {} resolved from {} = {}", getName(), linkName, value);
        }
    }

    /**
     * @return name of the most specific link
     */
    @Override
    public String getName() {
        return links.get(0).getName();
    }

    /**
     * @return read-only view of the links, most specific first
     */
    public List<RetentionDynamicProperty<Integer>> getLinks() {
        return links;
    }

    @Override
    public String toString() {
        return getName() + " = " + get();
    }

    /**
     * @NotThreadSafe
     */
    public static class Builder {
        private final RetentionDynamicProperties source;
        private final List<RetentionDynamicProperty<Integer>> links = new ArrayList<RetentionDynamicProperty<Integer>>();

        private Builder(RetentionDynamicProperties source) {
            if (source == null) {
                throw new NullPointerException("RetentionDynamicProperties source is required");
            }
            this.source = source;
        }

        /**
         * Append a link. Links added earlier take precedence.
         * 
         * @param name
         *            configuration name
         * @param fallback
         *            value this link reports while <code>name</code> is unset, null to defer to the next link
         */
        public Builder add(String name, Integer fallback) {
            links.add(source.getInteger(name, fallback));
            return this;
        }

        public ChainedIntegerProperty build() {
            if (links.isEmpty()) {
                throw new IllegalStateException("ChainedIntegerProperty needs at least one link");
            }
            return new ChainedIntegerProperty(Collections.unmodifiableList(new ArrayList<RetentionDynamicProperty<Integer>>(links)));
        }
    }

}

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
package io.retention.strategy.properties.archaius;

import com.netflix.config.DynamicProperty;

import io.retention.strategy.properties.RetentionDynamicProperties;
import io.retention.strategy.properties.RetentionDynamicProperty;

/**
 * {@link RetentionDynamicProperties} reading the Archaius 1 configuration.
 * <p>
 * Created by {@link io.retention.strategy.RetentionPlugins} only when Archaius is found on the classpath. Each
 * property holds the shared {@link DynamicProperty} for its name, so it follows configuration updates.
 */
public class RetentionDynamicPropertiesArchaius implements RetentionDynamicProperties {

    @Override
    public RetentionDynamicProperty<String> getString(String name, final String fallback) {
        return new ArchaiusProperty<String>(name) {
            @Override
            public String get() {
                return prop.getString(fallback);
            }
        };
    }

    @Override
    public RetentionDynamicProperty<Integer> getInteger(String name, final Integer fallback) {
        return new ArchaiusProperty<Integer>(name) {
            @Override
            public Integer get() {
                return prop.getInteger(fallback);
            }
        };
    }

    private abstract static class ArchaiusProperty<T> implements RetentionDynamicProperty<T> {

        protected final DynamicProperty prop;

        protected ArchaiusProperty(String name) {
            this.prop = DynamicProperty.getInstance(name);
        }

        @Override
        public String getName() {
            return prop.getName();
        }

        @Override
        public String toString() {
            return getName() + " = " + get();
        }
    }

}

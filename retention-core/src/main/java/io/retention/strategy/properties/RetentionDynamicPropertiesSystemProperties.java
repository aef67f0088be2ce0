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
package io.retention.strategy.properties;

/**
 * {@link RetentionDynamicProperties} backed by {@link System#getProperties()}. Every <code>get()</code> reads the
 * current system property.
 */
public final class RetentionDynamicPropertiesSystemProperties implements RetentionDynamicProperties {

    private static final RetentionDynamicPropertiesSystemProperties INSTANCE = new RetentionDynamicPropertiesSystemProperties();

    private RetentionDynamicPropertiesSystemProperties() {
    }

    public static RetentionDynamicProperties getInstance() {
        return INSTANCE;
    }

    @Override
    public RetentionDynamicProperty<String> getString(final String name, final String fallback) {
        return new SystemProperty<String>(name) {
            @Override
            public String get() {
                return System.getProperty(name, fallback);
            }
        };
    }

    @Override
    public RetentionDynamicProperty<Integer> getInteger(final String name, final Integer fallback) {
        return new SystemProperty<Integer>(name) {
            @Override
            public Integer get() {
                // Integer.getInteger falls back on unparseable values too
                return Integer.getInteger(name, fallback);
            }
        };
    }

    private static abstract class SystemProperty<T> implements RetentionDynamicProperty<T> {
        private final String name;

        SystemProperty(String name) {
            this.name = name;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public String toString() {
            return "-D" + name + "=" + get();
        }
    }

}

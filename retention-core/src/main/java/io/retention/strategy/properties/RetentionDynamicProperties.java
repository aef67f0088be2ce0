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

import io.retention.strategy.RetentionPlugins;

/**
 * Source of named configuration values used by collapser and timer properties.
 * <p>
 * Implementations must return a property object for any name, whether or not a value is currently configured. The
 * returned property reports the fallback while the name is unset.
 * <p>
 * See {@link RetentionPlugins#getDynamicProperties()} for how the implementation in use is chosen.
 */
public interface RetentionDynamicProperties {

    /**
     * @param name
     *            configuration name
     * @param fallback
     *            value reported while nothing is configured, may be null
     * @return property reading <code>name</code> as a string
     */
    RetentionDynamicProperty<String> getString(String name, String fallback);

    /**
     * @param name
     *            configuration name
     * @param fallback
     *            value reported while nothing is configured, may be null
     * @return property reading <code>name</code> as an integer
     */
    RetentionDynamicProperty<Integer> getInteger(String name, Integer fallback);

}

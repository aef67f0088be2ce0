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
package io.retention.strategy;

import java.lang.reflect.InvocationTargetException;
import java.util.Iterator;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.retention.strategy.eventnotifier.RetentionEventNotifier;
import io.retention.strategy.eventnotifier.RetentionEventNotifierDefault;
import io.retention.strategy.properties.RetentionDynamicProperties;
import io.retention.strategy.properties.RetentionDynamicPropertiesSystemProperties;
import io.retention.strategy.properties.RetentionPropertiesStrategy;
import io.retention.strategy.properties.RetentionPropertiesStrategyDefault;

/**
 * Registry of the pluggable parts used by every collapser. Each plugin is resolved once, in this order:
 * <ol>
 * <li>an implementation registered through the <code>register</code> methods</li>
 * <li>the class named by <code>retention.plugin.&lt;SimpleName&gt;.implementation</code> in the {@link #getDynamicProperties() dynamic properties}</li>
 * <li>the first provider found by {@link ServiceLoader}</li>
 * <li>the built-in default</li>
 * </ol>
 * Registration fails once a plugin has been resolved, so register before the first collapser is created.
 * <p>
 * {@link RetentionDynamicProperties} has its own order, see {@link #getDynamicProperties()}.
 */
public class RetentionPlugins {

    private static final Logger logger = LoggerFactory.getLogger(RetentionPlugins.class);

    private static final String PLUGIN_PROPERTY = "retention.plugin.%s.implementation";
    private static final String ARCHAIUS_CONFIGURATION_MANAGER = "com.netflix.config.ConfigurationManager";
    private static final String ARCHAIUS_DYNAMIC_PROPERTIES = "io.retention.strategy.properties.archaius.RetentionDynamicPropertiesArchaius";
    /* package */ static final String PLUGIN_RESOURCES = "retention-plugins";

    // created on first use so the configuration system is only touched by code that needs it
    private static class LazyHolder {
        private static final RetentionPlugins INSTANCE = new RetentionPlugins(RetentionPlugins.class.getClassLoader());
    }

    private final ClassLoader classLoader;
    private final RetentionDynamicProperties dynamicProperties;
    /* package */ final AtomicReference<RetentionEventNotifier> eventNotifier = new AtomicReference<RetentionEventNotifier>();
    /* package */ final AtomicReference<RetentionPropertiesStrategy> propertiesStrategy = new AtomicReference<RetentionPropertiesStrategy>();

    /* package for tests */ RetentionPlugins(ClassLoader classLoader) {
        this.classLoader = classLoader;
        this.dynamicProperties = resolveDynamicProperties();
    }

    public static RetentionPlugins getInstance() {
        return LazyHolder.INSTANCE;
    }

    /**
     * Forget the resolved and registered plugins. The dynamic properties stay as resolved. Also invoked by
     * <code>Retention.reset()</code>.
     */
    public static void reset() {
        getInstance().eventNotifier.set(null);
        getInstance().propertiesStrategy.set(null);
    }

    /**
     * Property override: <code>retention.plugin.RetentionEventNotifier.implementation</code>.
     * 
     * @return {@link RetentionEventNotifier} to use, {@link RetentionEventNotifierDefault} if nothing else is configured
     */
    public RetentionEventNotifier getEventNotifier() {
        return resolve(eventNotifier, RetentionEventNotifier.class, RetentionEventNotifierDefault.getInstance());
    }

    /**
     * @throws IllegalStateException
     *             if an event notifier was already registered or resolved
     */
    public void registerEventNotifier(RetentionEventNotifier impl) {
        register(eventNotifier, RetentionEventNotifier.class, impl);
    }

    /**
     * Property override: <code>retention.plugin.RetentionPropertiesStrategy.implementation</code>.
     * 
     * @return {@link RetentionPropertiesStrategy} to use, {@link RetentionPropertiesStrategyDefault} if nothing else is configured
     */
    public RetentionPropertiesStrategy getPropertiesStrategy() {
        return resolve(propertiesStrategy, RetentionPropertiesStrategy.class, RetentionPropertiesStrategyDefault.getInstance());
    }

    /**
     * @throws IllegalStateException
     *             if a properties strategy was already registered or resolved
     */
    public void registerPropertiesStrategy(RetentionPropertiesStrategy impl) {
        register(propertiesStrategy, RetentionPropertiesStrategy.class, impl);
    }

    /**
     * The source of every configuration value, chosen once when this registry is created:
     * <ol>
     * <li>the class named by the <b>system property</b> <code>retention.plugin.RetentionDynamicProperties.implementation</code></li>
     * <li>the first {@link ServiceLoader} provider</li>
     * <li>Archaius, when <code>com.netflix.config.ConfigurationManager</code> is on the classpath. The cascaded
     * <code>retention-plugins.properties</code> resources are loaded into it first.</li>
     * <li>{@link System#getProperties()}</li>
     * </ol>
     * 
     * @return never null
     */
    public RetentionDynamicProperties getDynamicProperties() {
        return dynamicProperties;
    }

    private <T> T resolve(AtomicReference<T> holder, Class<T> type, T defaultImpl) {
        T current = holder.get();
        if (current != null) {
            return current;
        }
        T impl = fromProperty(type, dynamicProperties);
        if (impl == null) {
            impl = fromServiceLoader(type);
        }
        if (impl == null) {
            impl = defaultImpl;
        } else {
            logger.debug("Using {} {}", type.getSimpleName(), impl.getClass().getName());
        }
        // a racing register() or resolve() wins, everyone gets the same instance
        holder.compareAndSet(null, impl);
        return holder.get();
    }

    private static <T> void register(AtomicReference<T> holder, Class<T> type, T impl) {
        if (!holder.compareAndSet(null, impl)) {
            throw new IllegalStateException(type.getSimpleName() + " " + holder.get().getClass().getName() + " is already in use");
        }
    }

    private RetentionDynamicProperties resolveDynamicProperties() {
        RetentionDynamicProperties resolved = fromProperty(RetentionDynamicProperties.class, RetentionDynamicPropertiesSystemProperties.getInstance());
        if (resolved != null) {
            logger.debug("Using RetentionDynamicProperties {} named by system property", resolved.getClass().getName());
            return resolved;
        }
        resolved = fromServiceLoader(RetentionDynamicProperties.class);
        if (resolved != null) {
            logger.debug("Using RetentionDynamicProperties {} from ServiceLoader", resolved.getClass().getName());
            return resolved;
        }
        resolved = createArchaiusProperties();
        if (resolved != null) {
            logger.debug("Using Archaius for RetentionDynamicProperties");
            return resolved;
        }
        logger.info("Archaius not found, using System properties for RetentionDynamicProperties");
        return RetentionDynamicPropertiesSystemProperties.getInstance();
    }

    private static <T> T fromProperty(Class<T> type, RetentionDynamicProperties properties) {
        String propertyName = String.format(PLUGIN_PROPERTY, type.getSimpleName());
        String className = properties.getString(propertyName, null).get();
        if (className == null) {
            return null;
        }
        return instantiate(type, className);
    }

    private static <T> T instantiate(Class<T> type, String className) {
        try {
            return Class.forName(className).asSubclass(type).newInstance();
        } catch (ClassCastException e) {
            throw new RuntimeException(className + " is not a " + type.getSimpleName(), e);
        } catch (ClassNotFoundException e) {
            throw new RuntimeException(type.getSimpleName() + " implementation class not found: " + className, e);
        } catch (InstantiationException e) {
            throw new RuntimeException(type.getSimpleName() + " implementation could not be instantiated: " + className, e);
        } catch (IllegalAccessException e) {
            throw new RuntimeException(type.getSimpleName() + " implementation has no accessible no-arg constructor: " + className, e);
        }
    }

    /**
     * @throws ServiceConfigurationError
     *             if a provider is declared but cannot be loaded
     */
    private <T> T fromServiceLoader(Class<T> type) {
        Iterator<T> providers = ServiceLoader.load(type, classLoader).iterator();
        return providers.hasNext() ? providers.next() : null;
    }

    private static RetentionDynamicProperties createArchaiusProperties() {
        Class<?> configurationManager;
        try {
            configurationManager = Class.forName(ARCHAIUS_CONFIGURATION_MANAGER);
        } catch (ClassNotFoundException e) {
            logger.debug("{} is not on the classpath", ARCHAIUS_CONFIGURATION_MANAGER);
            return null;
        }
        loadPluginResources(configurationManager);
        return instantiate(RetentionDynamicProperties.class, ARCHAIUS_DYNAMIC_PROPERTIES);
    }

    private static void loadPluginResources(Class<?> configurationManager) {
        try {
            configurationManager.getMethod("loadCascadedPropertiesFromResources", String.class).invoke(null, PLUGIN_RESOURCES);
            logger.debug("Loaded {}.properties into Archaius", PLUGIN_RESOURCES);
        } catch (InvocationTargetException e) {
            // thrown when no retention-plugins.properties is on the classpath
            logger.debug("No {}.properties loaded: {}", PLUGIN_RESOURCES, e.getCause().toString());
        } catch (NoSuchMethodException e) {
            logger.debug("This Archaius version cannot load {}.properties", PLUGIN_RESOURCES, e);
        } catch (IllegalAccessException e) {
            logger.debug("This Archaius version cannot load {}.properties", PLUGIN_RESOURCES, e);
        }
    }

}

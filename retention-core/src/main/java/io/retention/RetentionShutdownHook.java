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

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cancels a {@link Cancelable} when the JVM begins an orderly shutdown (SIGTERM, SIGINT or the last non-daemon thread exiting).
 * <p>
 * The wrapped target is canceled at most once no matter how often {@link #run()} is invoked.
 * <pre> {@code
 * RetentionShutdownHook hook = RetentionShutdownHook.install(collapser);
 * } </pre>
 */
public class RetentionShutdownHook implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(RetentionShutdownHook.class);

    private final Cancelable target;
    private final AtomicBoolean fired = new AtomicBoolean(false);
    private final AtomicReference<Thread> hookThread = new AtomicReference<Thread>();

    public RetentionShutdownHook(Cancelable target) {
        if (target == null) {
            throw new NullPointerException("target");
        }
        this.target = target;
    }

    /**
     * Create a hook for <code>target</code> and register it with the {@link Runtime}.
     */
    public static RetentionShutdownHook install(Cancelable target) {
        RetentionShutdownHook hook = new RetentionShutdownHook(target);
        hook.register();
        return hook;
    }

    /* package */ void register() {
        Thread thread = new Thread(this, "RetentionShutdownHook-" + target);
        if (hookThread.compareAndSet(null, thread)) {
            Runtime.getRuntime().addShutdownHook(thread);
            logger.debug("Installed shutdown hook for {}", target);
        }
    }

    /**
     * Remove the hook from the {@link Runtime} if it was installed and has not started.
     * 
     * @return true if the hook was removed
     */
    public boolean uninstall() {
        Thread thread = hookThread.getAndSet(null);
        if (thread == null) {
            return false;
        }
        try {
            return Runtime.getRuntime().removeShutdownHook(thread);
        } catch (IllegalStateException e) {
            // shutdown already in progress, the hook runs anyway
            logger.debug("Unable to remove shutdown hook for {}: {}", target, e.getMessage());
            return false;
        }
    }

    @Override
    public void run() {
        if (fired.compareAndSet(false, true)) {
            logger.debug("Shutdown requested, canceling {}", target);
            target.cancel();
        }
    }

    public boolean hasFired() {
        return fired.get();
    }

}

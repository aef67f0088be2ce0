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
package io.retention;

import io.retention.util.InternMap;

/**
 * A key to represent a {@link BatchCollapser} for configuration, event streams and logging.
 * <p>
 * This interface is intended to work natively with Enums so that implementing code can be an enum that implements this interface.
 */
public interface BatchCollapserKey extends RetentionKey {
    class Factory {
        private Factory() {
        }

        // used to intern instances so we don't keep re-creating them for the same key
        private static final InternMap<String, BatchCollapserKey> intern
                = new InternMap<String, BatchCollapserKey>(
                new InternMap.ValueConstructor<String, BatchCollapserKey>() {
                    @Override
                    public BatchCollapserKey create(String key) {
                        return new BatchCollapserKeyDefault(key);
                    }
                });

        /**
         * Retrieve (or create) an interned BatchCollapserKey instance for a given name.
         * 
         * @param name collapser name
         * @return BatchCollapserKey instance that is interned (cached) so a given name will always retrieve the same instance.
         */
        public static BatchCollapserKey asKey(String name) {
            return intern.interned(name);
        }

        private static class BatchCollapserKeyDefault extends RetentionKey.RetentionKeyDefault implements BatchCollapserKey {
            public BatchCollapserKeyDefault(String name) {
                super(name);
            }
        }

        /* package-private */ static int getCollapserCount() {
            return intern.size();
        }
    }
}

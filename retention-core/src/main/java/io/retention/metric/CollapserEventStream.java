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
package io.retention.metric;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.retention.BatchCollapserKey;
import rx.Observable;
import rx.subjects.PublishSubject;
import rx.subjects.SerializedSubject;
import rx.subjects.Subject;

/**
 * Per-collapser stream of {@link CollapserEvent}s.
 * Events are emitted synchronously on the thread that collapsed, flushed or drained the value.
 */
public class CollapserEventStream {
    private final BatchCollapserKey collapserKey;

    private final Subject<CollapserEvent, CollapserEvent> writeOnlyStream;
    private final Observable<CollapserEvent> readOnlyStream;

    private static final ConcurrentMap<String, CollapserEventStream> streams = new ConcurrentHashMap<String, CollapserEventStream>();

    public static CollapserEventStream getInstance(BatchCollapserKey collapserKey) {
        CollapserEventStream initialStream = streams.get(collapserKey.name());
        if (initialStream != null) {
            return initialStream;
        } else {
            synchronized (CollapserEventStream.class) {
                CollapserEventStream existingStream = streams.get(collapserKey.name());
                if (existingStream == null) {
                    CollapserEventStream newStream = new CollapserEventStream(collapserKey);
                    streams.putIfAbsent(collapserKey.name(), newStream);
                    return newStream;
                } else {
                    return existingStream;
                }
            }
        }
    }

    CollapserEventStream(final BatchCollapserKey collapserKey) {
        this.collapserKey = collapserKey;

        this.writeOnlyStream = new SerializedSubject<CollapserEvent, CollapserEvent>(PublishSubject.<CollapserEvent>create());
        this.readOnlyStream = writeOnlyStream.share();
    }

    public static void reset() {
        streams.clear();
    }

    public void write(CollapserEvent event) {
        writeOnlyStream.onNext(event);
    }

    public Observable<CollapserEvent> observe() {
        return readOnlyStream;
    }

    @Override
    public String toString() {
        return "CollapserEventStream(" + collapserKey.name() + ")";
    }
}

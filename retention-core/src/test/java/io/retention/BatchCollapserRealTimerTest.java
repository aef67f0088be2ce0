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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import rx.functions.Action1;

/**
 * Runs collapsers on the shared {@link io.retention.util.RetentionTimer}.
 */
public class BatchCollapserRealTimerTest {

    @Before
    public void init() {
        Retention.reset();
    }

    @After
    public void cleanup() {
        Retention.reset();
    }

    @Test
    public void testFlushAfterRetention() throws Exception {
        final CountDownLatch latch = new CountDownLatch(1);
        final List<Integer> executed = new CopyOnWriteArrayList<Integer>();
        BatchCollapser<String, Integer> collapser = BatchCollapser.create(
                BatchCollapser.Setter.withCollapserKey(BatchCollapserKey.Factory.asKey("testFlushAfterRetention"))
                        .andCollapserPropertiesDefaults(BatchCollapserProperties.Setter()
                                .withRetentionDurationInMilliseconds(5)
                                .withMaxDurationInMilliseconds(60000)),
                new Action1<Integer>() {
                    @Override
                    public void call(Integer value) {
                        executed.add(value);
                        latch.countDown();
                    }
                });

        collapser.collapse("value", 10);
        assertEquals(Integer.valueOf(10), collapser.getPendingValue("value"));

        Thread.sleep(10);
        assertTrue("value was not flushed", latch.await(2000, TimeUnit.MILLISECONDS));
        assertEquals(1, executed.size());
        assertEquals(Integer.valueOf(10), executed.get(0));
        assertNull(collapser.getPendingValue("value"));

        collapser.cancel();
    }

    @Test
    public void testRapidCollapsesFlushOnce() throws Exception {
        final CountDownLatch latch = new CountDownLatch(1);
        final List<Integer> executed = new CopyOnWriteArrayList<Integer>();
        BatchCollapser<String, Integer> collapser = BatchCollapser.create(
                BatchCollapser.Setter.withCollapserKey(BatchCollapserKey.Factory.asKey("testRapidCollapsesFlushOnce"))
                        .andCollapserPropertiesDefaults(BatchCollapserProperties.Setter()
                                .withRetentionDurationInMilliseconds(5)
                                .withMaxDurationInMilliseconds(60000)),
                new Action1<Integer>() {
                    @Override
                    public void call(Integer value) {
                        executed.add(value);
                        latch.countDown();
                    }
                });

        collapser.collapse("value", 10);
        collapser.collapse("value", 10);
        collapser.collapse("value", 10);

        assertTrue("value was not flushed", latch.await(2000, TimeUnit.MILLISECONDS));
        // give the driver several more polls to misbehave
        Thread.sleep(100);
        assertEquals(1, executed.size());

        collapser.cancel();
    }

    @Test
    public void testCancelStopsDriver() throws Exception {
        final List<Integer> executed = new CopyOnWriteArrayList<Integer>();
        BatchCollapser<String, Integer> collapser = BatchCollapser.create(
                BatchCollapser.Setter.withCollapserKey(BatchCollapserKey.Factory.asKey("testCancelStopsDriver"))
                        .andCollapserPropertiesDefaults(BatchCollapserProperties.Setter()
                                .withRetentionDurationInMilliseconds(5)
                                .withTimerDelayInMilliseconds(1)),
                new Action1<Integer>() {
                    @Override
                    public void call(Integer value) {
                        executed.add(value);
                    }
                });

        collapser.cancel();
        assertEquals(BatchCollapser.DriverState.STOPPED, collapser.getDriverState());

        collapser.collapse("late", 1);
        Thread.sleep(100);
        assertTrue(executed.isEmpty());
        assertEquals(Integer.valueOf(1), collapser.getPendingValue("late"));
    }

    @Test
    public void testZeroTimerDelayStillFlushes() throws Exception {
        final CountDownLatch latch = new CountDownLatch(1);
        BatchCollapser<String, Integer> collapser = BatchCollapser.create(
                BatchCollapser.Setter.withCollapserKey(BatchCollapserKey.Factory.asKey("testZeroTimerDelayStillFlushes"))
                        .andCollapserPropertiesDefaults(BatchCollapserProperties.Setter()
                                .withRetentionDurationInMilliseconds(5)
                                .withTimerDelayInMilliseconds(0)),
                new Action1<Integer>() {
                    @Override
                    public void call(Integer value) {
                        latch.countDown();
                    }
                });
        assertEquals(BatchCollapser.DriverState.RUNNING, collapser.getDriverState());

        collapser.collapse("value", 1);
        assertTrue("value was not flushed", latch.await(2000, TimeUnit.MILLISECONDS));
        collapser.cancel();
    }

    @Test
    public void testDriverStoppedByTimerReset() throws Exception {
        final List<Integer> executed = new CopyOnWriteArrayList<Integer>();
        BatchCollapser<String, Integer> collapser = BatchCollapser.create(
                BatchCollapser.Setter.withCollapserKey(BatchCollapserKey.Factory.asKey("testDriverStoppedByTimerReset"))
                        .andCollapserPropertiesDefaults(BatchCollapserProperties.Setter()
                                .withRetentionDurationInMilliseconds(5)
                                .withTimerDelayInMilliseconds(1)),
                new Action1<Integer>() {
                    @Override
                    public void call(Integer value) {
                        executed.add(value);
                    }
                });
        assertEquals(BatchCollapser.DriverState.RUNNING, collapser.getDriverState());

        Retention.reset();
        assertEquals(BatchCollapser.DriverState.STOPPED, collapser.getDriverState());
        assertFalse(collapser.isCanceled());

        collapser.collapse("orphan", 1);
        Thread.sleep(50);
        assertTrue(executed.isEmpty());

        // cancel still drains synchronously
        collapser.cancel();
        assertEquals(Collections.singletonList(1), executed);
    }

    @Test
    public void testSingleValueScenario() throws Exception {
        final CountDownLatch latch = new CountDownLatch(1);
        final List<String> executed = new CopyOnWriteArrayList<String>();
        SingleValueCollapser<String> collapser = SingleValueCollapser.create(
                BatchCollapser.Setter.withCollapserKey(BatchCollapserKey.Factory.asKey("testSingleValueScenario"))
                        .andCollapserPropertiesDefaults(BatchCollapserProperties.Setter()
                                .withRetentionDurationInMilliseconds(5)),
                new Action1<String>() {
                    @Override
                    public void call(String value) {
                        executed.add(value);
                        latch.countDown();
                    }
                });

        collapser.collapse("first");
        collapser.collapse("second");
        assertEquals("first", collapser.getValue());

        assertTrue("value was not flushed", latch.await(2000, TimeUnit.MILLISECONDS));
        assertNull(collapser.getValue());
        assertEquals(1, executed.size());
        assertEquals("first", executed.get(0));

        collapser.cancel();
        assertTrue(collapser.isCanceled());
    }

}

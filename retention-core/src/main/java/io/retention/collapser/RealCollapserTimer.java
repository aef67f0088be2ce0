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
package io.retention.collapser;

import java.lang.ref.Reference;

import io.retention.util.RetentionTimer;
import io.retention.util.RetentionTimer.TimerListener;

/**
 * {@link CollapserTimer} that schedules collapser drivers on the shared {@link RetentionTimer}.
 */
public class RealCollapserTimer implements CollapserTimer {

    @Override
    public Reference<TimerListener> addListener(TimerListener collapserDriver) {
        return RetentionTimer.getInstance().addTimerListener(collapserDriver);
    }

}

/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
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

package com.phonepe.leadmind.memory.consolidation;

import com.phonepe.leadmind.core.utils.EnvLoader;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Duration;

/**
 * Timing for the background consolidation task
 */
@Value
@Builder
@With
public class SchedulerSetup {
    public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(5);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    public static final SchedulerSetup DEFAULT = SchedulerSetup.builder().build();

    @Builder.Default
    Duration interval = DEFAULT_INTERVAL;

    /**
     * Delay before the first periodic run. Defaults to one interval.
     */
    Duration initialDelay;

    @Builder.Default
    Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;

    public Duration effectiveInitialDelay() {
        return initialDelay == null ? interval : initialDelay;
    }

    public static SchedulerSetup fromEnv() {
        return SchedulerSetup.builder()
                .interval(EnvLoader.readSeconds("LEADMIND_CONSOLIDATION_INTERVAL_SECONDS", DEFAULT_INTERVAL))
                .shutdownTimeout(EnvLoader.readSeconds("LEADMIND_CONSOLIDATION_SHUTDOWN_TIMEOUT_SECONDS",
                                                       DEFAULT_SHUTDOWN_TIMEOUT))
                .build();
    }
}

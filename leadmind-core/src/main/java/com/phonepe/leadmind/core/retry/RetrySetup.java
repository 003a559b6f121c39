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

package com.phonepe.leadmind.core.retry;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff configuration used for tier store calls and handoff delivery
 */
@Value
@With
public class RetrySetup {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final double DEFAULT_DELAY_FACTOR = 2.0;
    public static final RetrySetup DEFAULT = RetrySetup.builder().build();

    /**
     * Total attempts including the first one
     */
    int maxAttempts;

    /**
     * Delay after the first failed attempt
     */
    Duration baseDelay;

    /**
     * Each subsequent delay is the previous one multiplied by this
     */
    double delayFactor;

    @Builder
    public RetrySetup(int maxAttempts, Duration baseDelay, double delayFactor) {
        this.maxAttempts = maxAttempts <= 0 ? DEFAULT_MAX_ATTEMPTS : maxAttempts;
        this.baseDelay = Objects.requireNonNullElse(baseDelay, DEFAULT_BASE_DELAY);
        this.delayFactor = delayFactor < 1.0 ? DEFAULT_DELAY_FACTOR : delayFactor;
    }

    /**
     * @return Longest delay this setup will ever wait between two attempts
     */
    public Duration maxDelay() {
        final var retries = Math.max(1, maxAttempts - 1);
        return Duration.ofNanos((long) (baseDelay.toNanos() * Math.pow(delayFactor, retries - 1.0)));
    }
}

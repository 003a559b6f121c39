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

import com.phonepe.leadmind.core.errors.OperationCancelledError;
import com.phonepe.leadmind.core.errors.UnavailableError;
import dev.failsafe.Failsafe;
import dev.failsafe.FailsafeException;
import dev.failsafe.RetryPolicy;
import dev.failsafe.function.CheckedRunnable;
import dev.failsafe.function.CheckedSupplier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs calls that can fail transiently. Only {@link UnavailableError} is retried, using exponential backoff. Retries
 * stop as soon as the calling thread is interrupted, in which case {@link OperationCancelledError} is raised and no
 * further attempt is made.
 */
@Slf4j
public class RetryingExecutor {
    @Getter
    private final RetrySetup retrySetup;

    public RetryingExecutor(RetrySetup retrySetup) {
        this.retrySetup = retrySetup;
    }

    public <T> T call(final String operation, final CheckedSupplier<T> supplier) {
        try {
            return Failsafe.with(RetryingExecutor.<T>buildRetryPolicy(retrySetup, operation))
                    .get(executionContext -> {
                        if (Thread.currentThread().isInterrupted()) {
                            throw new OperationCancelledError(operation);
                        }
                        if (executionContext.getAttemptCount() > 0) {
                            log.debug("Retrying {}. Attempt: {}", operation, executionContext.getAttemptCount() + 1);
                        }
                        return supplier.get();
                    });
        }
        catch (FailsafeException e) {
            if (e.getCause() instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new OperationCancelledError(operation, e.getCause());
            }
            throw new UnavailableError(operation + " failed: " + e.getMessage(), e);
        }
    }

    public void run(final String operation, final CheckedRunnable runnable) {
        call(operation, () -> {
            runnable.run();
            return null;
        });
    }

    private static <T> RetryPolicy<T> buildRetryPolicy(RetrySetup retrySetup, String operation) {
        final var builder = RetryPolicy.<T>builder()
                .handle(UnavailableError.class)
                .withMaxAttempts(retrySetup.getMaxAttempts())
                .onRetriesExceeded(event -> log.warn("Retries exhausted for {} after {} attempts. Error: {}",
                                                     operation,
                                                     event.getAttemptCount(),
                                                     event.getException() == null
                                                     ? "none"
                                                     : event.getException().getMessage()));
        if (retrySetup.getDelayFactor() > 1.0 && retrySetup.getMaxAttempts() > 2) {
            builder.withBackoff(retrySetup.getBaseDelay(), retrySetup.maxDelay(), retrySetup.getDelayFactor());
        }
        else {
            builder.withDelay(retrySetup.getBaseDelay());
        }
        return builder.build();
    }
}

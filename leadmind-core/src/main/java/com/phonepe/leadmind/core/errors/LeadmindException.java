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

package com.phonepe.leadmind.core.errors;

import lombok.Getter;

/**
 * Base class for all errors raised by leadmind components
 */
@Getter
public abstract class LeadmindException extends RuntimeException {
    private final ErrorType errorType;

    protected LeadmindException(ErrorType errorType, String detail) {
        super(errorType.getMessage().formatted(detail));
        this.errorType = errorType;
    }

    protected LeadmindException(ErrorType errorType, String detail, Throwable cause) {
        super(errorType.getMessage().formatted(detail), cause);
        this.errorType = errorType;
    }

    public boolean isRetryable() {
        return errorType.isRetryable();
    }
}

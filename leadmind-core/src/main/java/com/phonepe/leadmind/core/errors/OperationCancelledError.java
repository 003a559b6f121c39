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

/**
 * The encompassing request was cancelled while waiting on a retry or a store call
 */
public class OperationCancelledError extends LeadmindException {
    public OperationCancelledError(final String message) {
        super(ErrorType.CANCELLED, message);
    }

    public OperationCancelledError(final String message, final Throwable cause) {
        super(ErrorType.CANCELLED, message, cause);
    }
}

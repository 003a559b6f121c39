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
 * Handoff delivery exhausted all retries. The conversation is parked and needs manual remediation.
 */
@Getter
public class HandoffFailedError extends LeadmindException {
    private final String handoffId;
    private final String leadId;

    public HandoffFailedError(String handoffId, String leadId, String message) {
        super(ErrorType.HANDOFF_FAILED, "[handoffId=%s leadId=%s] %s".formatted(handoffId, leadId, message));
        this.handoffId = handoffId;
        this.leadId = leadId;
    }

    public HandoffFailedError(String handoffId, String leadId, String message, Throwable cause) {
        super(ErrorType.HANDOFF_FAILED, "[handoffId=%s leadId=%s] %s".formatted(handoffId, leadId, message), cause);
        this.handoffId = handoffId;
        this.leadId = leadId;
    }
}

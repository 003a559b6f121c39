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

package com.phonepe.leadmind.handoff.delivery;

import com.phonepe.leadmind.handoff.model.EscalationTicket;
import com.phonepe.leadmind.handoff.model.HandoffRequest;

/**
 * Puts committed handoffs in front of whoever takes over. Transient failures must be reported as
 * {@link com.phonepe.leadmind.core.errors.UnavailableError} so the caller can retry.
 */
public interface HandoffDelivery {
    void toAgent(String agentId, HandoffRequest request);

    void toHuman(EscalationTicket ticket);
}

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

package com.phonepe.leadmind.core.model;

/**
 * Kinds of entries in a conversation's append-only history
 */
public enum ConversationEventType {
    /**
     * Something an agent did: sent an email, scored the lead, booked a call
     */
    AGENT_ACTION,
    /**
     * Inbound message or reaction from the lead
     */
    LEAD_MESSAGE,
    /**
     * Housekeeping entries written by the platform
     */
    SYSTEM,
    /**
     * Conversation state machine transition
     */
    STATE_CHANGE,
}

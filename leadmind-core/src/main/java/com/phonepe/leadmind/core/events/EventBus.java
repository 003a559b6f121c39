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

package com.phonepe.leadmind.core.events;

import com.google.common.annotations.VisibleForTesting;
import io.appform.signals.signals.ConsumingFireForgetSignal;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Consumer;

/**
 * The common bus which is used to fan out notifications to subscribed listeners
 */
@Slf4j
public class EventBus {
    private final ConsumingFireForgetSignal<LeadEvent> eventSignal;

    public EventBus() {
        this(new ConsumingFireForgetSignal<>());
    }

    @VisibleForTesting
    EventBus(ConsumingFireForgetSignal<LeadEvent> eventSignal) {
        this.eventSignal = eventSignal;
    }

    /**
     * @return The signal to listen to events. Use Signal.connect to connect event handlers.
     */
    public ConsumingFireForgetSignal<LeadEvent> onEvent() {
        return eventSignal;
    }

    public void subscribe(final Consumer<LeadEvent> listener) {
        eventSignal.connect(listener::accept);
    }

    public void notify(final LeadEvent event) {
        log.debug("Publishing {} event {}", event.getType().getType(), event.getEventId());
        eventSignal.dispatch(event);
    }
}

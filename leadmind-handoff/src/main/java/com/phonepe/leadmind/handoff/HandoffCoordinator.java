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

package com.phonepe.leadmind.handoff;

import com.google.common.base.Strings;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.phonepe.leadmind.core.errors.HandoffFailedError;
import com.phonepe.leadmind.core.errors.InvalidStateError;
import com.phonepe.leadmind.core.errors.OperationCancelledError;
import com.phonepe.leadmind.core.errors.OwnershipError;
import com.phonepe.leadmind.core.errors.ValidationError;
import com.phonepe.leadmind.core.events.EventBus;
import com.phonepe.leadmind.core.events.HandoffFailedEvent;
import com.phonepe.leadmind.core.model.Tier;
import com.phonepe.leadmind.core.model.payloads.ConversationContext;
import com.phonepe.leadmind.core.model.payloads.HandoffAudit;
import com.phonepe.leadmind.core.retry.RetrySetup;
import com.phonepe.leadmind.core.retry.RetryingExecutor;
import com.phonepe.leadmind.core.utils.KeyedLocks;
import com.phonepe.leadmind.handoff.agents.AgentDirectory;
import com.phonepe.leadmind.handoff.delivery.HandoffDelivery;
import com.phonepe.leadmind.handoff.escalation.DefaultEscalationPolicy;
import com.phonepe.leadmind.handoff.escalation.EscalationPolicy;
import com.phonepe.leadmind.handoff.escalation.EscalationThresholds;
import com.phonepe.leadmind.handoff.escalation.RoutingDecision;
import com.phonepe.leadmind.handoff.model.ConversationRecord;
import com.phonepe.leadmind.handoff.model.ConversationState;
import com.phonepe.leadmind.handoff.model.DeliveryStatus;
import com.phonepe.leadmind.handoff.model.EscalationTicket;
import com.phonepe.leadmind.handoff.model.HandoffRequest;
import com.phonepe.leadmind.handoff.model.HandoffResult;
import com.phonepe.leadmind.handoff.model.Route;
import com.phonepe.leadmind.handoff.model.TicketState;
import com.phonepe.leadmind.handoff.registry.ConversationRegistry;
import com.phonepe.leadmind.memory.MemoryManager;
import com.phonepe.leadmind.memory.PutOptions;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * Moves conversations between agents and humans.
 * <p>
 * A handoff is committed under the lead lock, which consolidation also takes, and then delivered outside the lock
 * with retries. Each handoff id is processed at most once; replays get the original outcome back. When delivery keeps
 * failing the conversation is parked: its delivery status becomes {@link DeliveryStatus#FAILED} and it refuses every
 * handoff and transition until {@link #resolveFailedHandoff(String, String)} is called. Outcomes are remembered for
 * {@code handoffRetention} (24 hours by default); an id replayed after that is processed as a new request.
 */
@Slf4j
public class HandoffCoordinator {
    public static final String HUMAN_DESTINATION = "human";
    public static final Duration DEFAULT_HANDOFF_RETENTION = Duration.ofHours(24);

    private final MemoryManager memoryManager;
    @Getter
    private final AgentDirectory agentDirectory;
    private final EscalationPolicy escalationPolicy;
    @Getter
    private final EscalationThresholds thresholds;
    private final HandoffDelivery delivery;
    private final RetryingExecutor deliveryExecutor;
    private final ConversationRegistry registry;
    private final KeyedLocks keyedLocks;
    private final EventBus eventBus;
    private final Clock clock;
    private final Cache<String, CompletableFuture<HandoffResult>> handoffs;

    private record Commit(EscalationTicket ticket, HandoffResult result) {
    }

    @Builder
    public HandoffCoordinator(
            @NonNull MemoryManager memoryManager,
            @NonNull AgentDirectory agentDirectory,
            @NonNull HandoffDelivery delivery,
            EscalationPolicy escalationPolicy,
            EscalationThresholds thresholds,
            RetrySetup deliveryRetry,
            ConversationRegistry registry,
            Duration handoffRetention,
            Clock clock) {
        this.memoryManager = memoryManager;
        this.agentDirectory = agentDirectory;
        this.delivery = delivery;
        this.escalationPolicy = Objects.requireNonNullElseGet(escalationPolicy, DefaultEscalationPolicy::new);
        this.thresholds = Objects.requireNonNullElse(thresholds, EscalationThresholds.DEFAULT);
        this.deliveryExecutor = new RetryingExecutor(Objects.requireNonNullElse(deliveryRetry, RetrySetup.DEFAULT));
        this.registry = Objects.requireNonNullElseGet(registry, ConversationRegistry::new);
        this.keyedLocks = memoryManager.getKeyedLocks();
        this.eventBus = memoryManager.getEventBus();
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        this.handoffs = CacheBuilder.newBuilder()
                .expireAfterWrite(Objects.requireNonNullElse(handoffRetention, DEFAULT_HANDOFF_RETENTION))
                .ticker(clockTicker(this.clock))
                .build();
    }

    /**
     * Start tracking a conversation held by {@code ownerAgent}
     *
     * @throws InvalidStateError if the conversation is already tracked
     */
    public ConversationRecord openConversation(String leadId, String conversationId, String ownerAgent) {
        required(leadId, "leadId");
        required(conversationId, "conversationId");
        ensureRegistered(ownerAgent);
        return keyedLocks.withLock(KeyedLocks.leadKey(leadId), () -> {
            if (registry.conversation(conversationId).isPresent()) {
                throw new InvalidStateError("Conversation " + conversationId + " already exists");
            }
            final var now = clock.instant();
            final var conversation = ConversationRecord.builder()
                    .conversationId(conversationId)
                    .leadId(leadId)
                    .owner(ownerAgent)
                    .state(ConversationState.CREATED)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            registry.save(conversation);
            agentDirectory.acquire(ownerAgent);
            log.info("Opened conversation {} for lead {} with owner {}", conversationId, leadId, ownerAgent);
            return conversation;
        });
    }

    /**
     * Move a conversation one step along the state machine on behalf of its owner. Moving to
     * {@link ConversationState#ESCALATED} opens a ticket, as {@link #escalate} does. Closing a conversation releases
     * the owner and marks its short term context completed so consolidation picks it up.
     *
     * @throws OwnershipError    if {@code actor} does not hold the conversation
     * @throws InvalidStateError if the move is not legal from the current state or the conversation is parked
     */
    public ConversationRecord transition(
            String conversationId,
            String actor,
            ConversationState target,
            String reason) {
        Objects.requireNonNull(target, "target");
        final var current = existing(conversationId);
        final var leadId = current.getLeadId();
        if (target == ConversationState.ESCALATED) {
            if (!current.getState().canTransitionTo(target)) {
                throw new InvalidStateError("%s -> %s is not allowed for conversation %s"
                                                    .formatted(current.getState(), target, conversationId));
            }
            final var ticket = escalate(leadId, conversationId, reason, actor);
            return existing(ticket.getConversationId());
        }
        return keyedLocks.withLock(KeyedLocks.leadKey(leadId), () -> {
            final var conversation = existing(conversationId);
            ensureNotParked(conversation);
            ensureOwner(conversation, actor);
            if (!conversation.getState().canTransitionTo(target)) {
                throw new InvalidStateError("%s -> %s is not allowed for conversation %s"
                                                    .formatted(conversation.getState(), target, conversationId));
            }
            final var closing = target == ConversationState.CLOSED;
            final var updated = conversation.moveTo(target,
                                                    closing ? null : conversation.getOwner(),
                                                    actor,
                                                    reason,
                                                    null,
                                                    clock.instant());
            if (closing) {
                updateContext(conversationId, context -> context.withCompleted(true));
            }
            registry.save(updated);
            if (closing) {
                agentDirectory.release(conversation.getOwner());
            }
            log.info("Conversation {} moved {} -> {} by {}", conversationId, conversation.getState(), target, actor);
            return updated;
        });
    }

    /**
     * Hand a conversation over to another agent or to a human, as the escalation policy decides.
     *
     * @return Outcome of the handoff. The same outcome is returned for every replay of the handoff id.
     * @throws ValidationError    if the request is incomplete or refers to an unknown conversation
     * @throws OwnershipError     if the source agent does not hold the conversation
     * @throws InvalidStateError  if the conversation cannot move or is parked
     * @throws HandoffFailedError if delivery did not succeed within the retry budget
     */
    public HandoffResult requestHandoff(HandoffRequest request) {
        validate(request);
        final var handoffId = request.getHandoffId();
        final var pending = new CompletableFuture<HandoffResult>();
        final var previous = handoffs.asMap().putIfAbsent(handoffId, pending);
        if (previous != null) {
            log.info("Handoff {} for lead {} was already processed. Replaying outcome", handoffId, request.getLeadId());
            return replay(previous);
        }
        final Commit commit;
        try {
            commit = commitHandoff(request);
        }
        catch (RuntimeException e) {
            // The conversation was not touched, so the same id can be retried
            handoffs.asMap().remove(handoffId, pending);
            pending.completeExceptionally(e);
            throw e;
        }
        final var result = commit.result();
        final var destination = result.getRoute() == Route.AGENT ? result.getAssignedAgent() : HUMAN_DESTINATION;
        try {
            deliver(handoffId, request.getLeadId(), request.getConversationId(), destination, () -> {
                if (result.getRoute() == Route.AGENT) {
                    delivery.toAgent(result.getAssignedAgent(), request);
                }
                else {
                    delivery.toHuman(commit.ticket());
                }
            });
        }
        catch (OperationCancelledError e) {
            pending.complete(result);
            throw e;
        }
        catch (HandoffFailedError e) {
            pending.completeExceptionally(e);
            throw e;
        }
        final var delivered = result.withDeliveryStatus(DeliveryStatus.DELIVERED);
        pending.complete(delivered);
        log.info("Handoff {} for lead {} delivered to {}. Conversation {} is now {}",
                 handoffId, request.getLeadId(), destination, request.getConversationId(), delivered.getNewState());
        return delivered;
    }

    /**
     * Raise a ticket for a human. With a conversation the conversation moves to
     * {@link ConversationState#ESCALATED} and stays with the human until {@link #resolveEscalation} is called.
     *
     * @param conversationId Optional. Without it the ticket concerns the lead as a whole.
     * @param requestedBy    Agent raising the ticket. Must hold the conversation when one is given.
     */
    public EscalationTicket escalate(String leadId, String conversationId, String reason, String requestedBy) {
        required(leadId, "leadId");
        final var now = clock.instant();
        final var ticket = EscalationTicket.builder()
                .ticketId("ticket-" + UUID.randomUUID())
                .leadId(leadId)
                .conversationId(conversationId)
                .raisedBy(requestedBy)
                .reason(Strings.isNullOrEmpty(reason) ? "Escalation requested" : reason)
                .state(TicketState.OPEN)
                .createdAt(now)
                .build();
        if (conversationId == null) {
            deliveryExecutor.run("deliver ticket " + ticket.getTicketId(), () -> delivery.toHuman(ticket));
            registry.save(ticket);
            log.info("Opened ticket {} for lead {}", ticket.getTicketId(), leadId);
            return ticket;
        }
        keyedLocks.withLock(KeyedLocks.leadKey(leadId), () -> {
            final var conversation = existing(conversationId);
            ensureBelongsTo(conversation, leadId);
            ensureNotParked(conversation);
            ensureOwner(conversation, requestedBy);
            final var path = pathTo(conversation, ConversationState.ESCALATED);
            writeAudit(ticket.getTicketId(), conversation, requestedBy, null, ticket.getTicketId(),
                       ConversationState.ESCALATED, ticket.getReason());
            final var updated = walk(conversation, path, null, requestedBy, ticket.getReason(), ticket.getTicketId())
                    .toBuilder()
                    .deliveryStatus(DeliveryStatus.PENDING)
                    .lastHandoffId(ticket.getTicketId())
                    .activeTicketId(ticket.getTicketId())
                    .build();
            registry.save(ticket);
            registry.save(updated);
            agentDirectory.release(conversation.getOwner());
        });
        deliver(ticket.getTicketId(), leadId, conversationId, HUMAN_DESTINATION, () -> delivery.toHuman(ticket));
        log.info("Conversation {} of lead {} escalated with ticket {}", conversationId, leadId, ticket.getTicketId());
        return ticket;
    }

    /**
     * Close a ticket. If it was raised for a conversation, the conversation goes back to {@code agentId}.
     *
     * @throws InvalidStateError if the ticket is not open
     */
    public EscalationTicket resolveEscalation(String ticketId, String agentId) {
        final var ticket = registry.ticket(ticketId)
                .orElseThrow(() -> new ValidationError("Unknown ticket " + ticketId));
        ensureRegistered(agentId);
        return keyedLocks.withLock(KeyedLocks.leadKey(ticket.getLeadId()), () -> {
            final var current = registry.ticket(ticketId).orElseThrow();
            if (current.getState() != TicketState.OPEN) {
                throw new InvalidStateError("Ticket " + ticketId + " is already " + current.getState());
            }
            final var now = clock.instant();
            if (current.getConversationId() != null) {
                final var conversation = existing(current.getConversationId());
                ensureNotParked(conversation);
                if (!ticketId.equals(conversation.getActiveTicketId())) {
                    throw new InvalidStateError("Ticket %s is not the active ticket of conversation %s"
                                                        .formatted(ticketId, conversation.getConversationId()));
                }
                final var path = pathTo(conversation, ConversationState.ENGAGED);
                final var updated = walk(conversation, path, agentId, agentId, "Escalation resolved", ticketId)
                        .withActiveTicketId(null);
                updateContext(conversation.getConversationId(), context -> context.withCurrentAgent(agentId));
                registry.save(updated);
                agentDirectory.acquire(agentId);
            }
            final var resolved = current.toBuilder()
                    .state(TicketState.RESOLVED)
                    .resolvedBy(agentId)
                    .resolvedAt(now)
                    .build();
            registry.save(resolved);
            log.info("Ticket {} for lead {} resolved by {}", ticketId, ticket.getLeadId(), agentId);
            return resolved;
        });
    }

    /**
     * Unpark a conversation whose last handoff could not be delivered. The operator is expected to have dealt with
     * the undelivered handoff.
     *
     * @throws InvalidStateError if the conversation is not parked
     */
    public ConversationRecord resolveFailedHandoff(String conversationId, String operator) {
        final var leadId = existing(conversationId).getLeadId();
        return keyedLocks.withLock(KeyedLocks.leadKey(leadId), () -> {
            final var conversation = existing(conversationId);
            if (!conversation.isHandoffFailed()) {
                throw new InvalidStateError("Conversation " + conversationId + " has no failed handoff");
            }
            final var updated = conversation
                    .moveTo(conversation.getState(),
                            conversation.getOwner(),
                            operator,
                            "Failed handoff resolved",
                            conversation.getLastHandoffId(),
                            clock.instant())
                    .withDeliveryStatus(DeliveryStatus.NONE);
            registry.save(updated);
            log.info("Failed handoff {} on conversation {} resolved by {}",
                     conversation.getLastHandoffId(), conversationId, operator);
            return updated;
        });
    }

    public Optional<ConversationRecord> conversation(String conversationId) {
        return registry.conversation(conversationId);
    }

    public Optional<EscalationTicket> ticket(String ticketId) {
        return registry.ticket(ticketId);
    }

    public List<EscalationTicket> tickets(String leadId) {
        return registry.tickets(leadId);
    }

    private Commit commitHandoff(HandoffRequest request) {
        return keyedLocks.withLock(KeyedLocks.leadKey(request.getLeadId()), () -> {
            final var conversation = existing(request.getConversationId());
            ensureBelongsTo(conversation, request.getLeadId());
            ensureNotParked(conversation);
            if (conversation.getState().isTerminal()) {
                throw new InvalidStateError("Conversation " + conversation.getConversationId() + " is closed");
            }
            ensureOwner(conversation, request.getSourceAgent());
            final var decision = escalationPolicy.decide(
                    request.getContext(),
                    agentDirectory.candidates(request.getSourceAgent(), request.getTargetAgent()),
                    thresholds);
            final var toHuman = decision.getRoute() == Route.HUMAN;
            final var destination = toHuman
                                    ? ConversationState.ESCALATED
                                    : agentDestination(conversation.getState());
            final var path = pathTo(conversation, destination);
            final var now = clock.instant();
            final var ticket = toHuman ? ticketFor(request, decision, now) : null;
            final var ticketId = ticket == null ? null : ticket.getTicketId();
            final var reason = toHuman ? decision.getReason() : "Handoff to " + decision.getAgentId();
            writeAudit(request.getHandoffId(), conversation, request.getSourceAgent(), decision.getAgentId(),
                       ticketId, destination, reason);

            final var updated = walk(conversation, path, decision.getAgentId(), request.getSourceAgent(), reason,
                                     request.getHandoffId())
                    .toBuilder()
                    .deliveryStatus(DeliveryStatus.PENDING)
                    .lastHandoffId(request.getHandoffId())
                    .activeTicketId(toHuman ? ticketId : conversation.getActiveTicketId())
                    .build();
            // Tier writes may still fail here. Registry and directory changes below cannot.
            if (!toHuman) {
                updateContext(request.getConversationId(),
                              context -> context.withCurrentAgent(decision.getAgentId()));
            }
            if (ticket != null) {
                registry.save(ticket);
            }
            registry.save(updated);
            agentDirectory.release(request.getSourceAgent());
            if (!toHuman) {
                agentDirectory.acquire(decision.getAgentId());
            }
            log.debug("Committed handoff {} for lead {}: {} -> {} via {}",
                      request.getHandoffId(), request.getLeadId(), conversation.getState(), destination, path);
            return new Commit(ticket,
                              HandoffResult.builder()
                                      .handoffId(request.getHandoffId())
                                      .accepted(true)
                                      .newState(destination)
                                      .route(decision.getRoute())
                                      .assignedAgent(decision.getAgentId())
                                      .ticketId(ticketId)
                                      .deliveryStatus(DeliveryStatus.PENDING)
                                      .build());
        });
    }

    /**
     * Deliver outside the lead lock. Success marks the conversation delivered. Anything but cancellation parks it.
     */
    private void deliver(String handoffId, String leadId, String conversationId, String destination, Runnable action) {
        try {
            deliveryExecutor.run("deliver " + handoffId + " to " + destination, action::run);
        }
        catch (OperationCancelledError e) {
            log.warn("Delivery of {} for lead {} cancelled. Conversation {} stays pending",
                     handoffId, leadId, conversationId);
            throw e;
        }
        catch (RuntimeException e) {
            throw park(handoffId, leadId, conversationId, destination, e);
        }
        updateDeliveryStatus(leadId, conversationId, handoffId, DeliveryStatus.DELIVERED);
    }

    private HandoffFailedError park(
            String handoffId,
            String leadId,
            String conversationId,
            String destination,
            RuntimeException cause) {
        updateDeliveryStatus(leadId, conversationId, handoffId, DeliveryStatus.FAILED);
        log.error("Handoff {} for lead {} could not be delivered to {}. Conversation {} parked. Error: {}",
                  handoffId, leadId, destination, conversationId, cause.getMessage());
        eventBus.notify(HandoffFailedEvent.builder()
                                .handoffId(handoffId)
                                .leadId(leadId)
                                .conversationId(conversationId)
                                .destination(destination)
                                .reason(cause.getMessage())
                                .build());
        return new HandoffFailedError(handoffId, leadId, "Delivery to " + destination + " failed", cause);
    }

    private void updateDeliveryStatus(String leadId, String conversationId, String handoffId, DeliveryStatus status) {
        keyedLocks.withLock(KeyedLocks.leadKey(leadId), () -> {
            final var conversation = existing(conversationId);
            // A later handoff has already taken over
            if (!handoffId.equals(conversation.getLastHandoffId())
                    || conversation.getDeliveryStatus() != DeliveryStatus.PENDING) {
                return;
            }
            registry.save(conversation.toBuilder()
                                  .deliveryStatus(status)
                                  .updatedAt(clock.instant())
                                  .build());
        });
    }

    private ConversationRecord walk(
            ConversationRecord conversation,
            List<ConversationState> path,
            String newOwner,
            String actor,
            String reason,
            String handoffId) {
        final var now = clock.instant();
        if (path.isEmpty()) {
            // Reassignment without a state change
            return conversation.moveTo(conversation.getState(), newOwner, actor, reason, handoffId, now);
        }
        var updated = conversation;
        for (int i = 0; i < path.size(); i++) {
            final var owner = i == path.size() - 1 ? newOwner : null;
            updated = updated.moveTo(path.get(i), owner, actor, reason, handoffId, now);
        }
        return updated;
    }

    private void writeAudit(
            String handoffId,
            ConversationRecord conversation,
            String sourceAgent,
            String targetAgent,
            String ticketId,
            ConversationState toState,
            String reason) {
        memoryManager.put(Tier.LONG_TERM,
                          handoffId,
                          HandoffAudit.builder()
                                  .handoffId(handoffId)
                                  .leadId(conversation.getLeadId())
                                  .conversationId(conversation.getConversationId())
                                  .sourceAgent(sourceAgent)
                                  .targetAgent(targetAgent)
                                  .ticketId(ticketId)
                                  .fromState(conversation.getState().name())
                                  .toState(toState.name())
                                  .reason(reason)
                                  .recordedAt(clock.instant())
                                  .build());
    }

    /**
     * Rewrite the live short term context of a conversation, keeping its remaining lifetime. Missing or expired
     * contexts are left alone.
     */
    private void updateContext(String conversationId, UnaryOperator<ConversationContext> change) {
        memoryManager.get(Tier.SHORT_TERM, conversationId).ifPresent(memoryRecord -> {
            if (!(memoryRecord.getPayload() instanceof ConversationContext context)) {
                return;
            }
            final var remaining = Duration.between(clock.instant(), memoryRecord.getExpiresAt());
            if (remaining.isNegative() || remaining.isZero()) {
                return;
            }
            memoryManager.put(Tier.SHORT_TERM,
                              conversationId,
                              change.apply(context),
                              PutOptions.builder().ttl(remaining).tags(memoryRecord.getTags()).build());
        });
    }

    private static EscalationTicket ticketFor(HandoffRequest request, RoutingDecision decision, Instant now) {
        return EscalationTicket.builder()
                .ticketId("ticket-" + UUID.randomUUID())
                .leadId(request.getLeadId())
                .conversationId(request.getConversationId())
                .raisedBy(request.getSourceAgent())
                .reason(decision.getReason())
                .recommendedActions(decision.getRecommendedActions())
                .state(TicketState.OPEN)
                .createdAt(now)
                .build();
    }

    private static ConversationState agentDestination(ConversationState current) {
        return switch (current) {
            case CREATED -> ConversationState.TRIAGED;
            case TRIAGED, ENGAGED, ESCALATED -> ConversationState.ENGAGED;
            case CLOSED -> throw new InvalidStateError("Closed conversations cannot be handed off");
        };
    }

    private static List<ConversationState> pathTo(ConversationRecord conversation, ConversationState destination) {
        return conversation.getState()
                .pathTo(destination)
                .orElseThrow(() -> new InvalidStateError("Conversation %s cannot move from %s to %s"
                                                                 .formatted(conversation.getConversationId(),
                                                                            conversation.getState(),
                                                                            destination)));
    }

    private static Ticker clockTicker(Clock clock) {
        return new Ticker() {
            @Override
            public long read() {
                return TimeUnit.MILLISECONDS.toNanos(clock.millis());
            }
        };
    }

    private static HandoffResult replay(CompletableFuture<HandoffResult> previous) {
        try {
            return previous.join();
        }
        catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private ConversationRecord existing(String conversationId) {
        return registry.conversation(conversationId)
                .orElseThrow(() -> new ValidationError("Unknown conversation " + conversationId));
    }

    private void ensureRegistered(String agentId) {
        if (!agentDirectory.isRegistered(agentId)) {
            throw new ValidationError("Unknown agent " + agentId);
        }
    }

    private static void ensureOwner(ConversationRecord conversation, String agentId) {
        if (!conversation.isOwnedBy(agentId)) {
            throw new OwnershipError("Agent %s does not hold conversation %s"
                                             .formatted(agentId, conversation.getConversationId()));
        }
    }

    private static void ensureBelongsTo(ConversationRecord conversation, String leadId) {
        if (!conversation.getLeadId().equals(leadId)) {
            throw new ValidationError("Conversation %s does not belong to lead %s"
                                              .formatted(conversation.getConversationId(), leadId));
        }
    }

    private static void ensureNotParked(ConversationRecord conversation) {
        if (conversation.isHandoffFailed()) {
            throw new InvalidStateError("Conversation %s is parked after failed handoff %s"
                                                .formatted(conversation.getConversationId(),
                                                           conversation.getLastHandoffId()));
        }
    }

    private static void validate(HandoffRequest request) {
        if (request == null) {
            throw new ValidationError("Handoff request is required");
        }
        required(request.getHandoffId(), "handoffId");
        required(request.getLeadId(), "leadId");
        required(request.getConversationId(), "conversationId");
        required(request.getSourceAgent(), "sourceAgent");
        if (request.getContext() == null) {
            throw new ValidationError("context is required");
        }
    }

    private static void required(String value, String field) {
        if (Strings.isNullOrEmpty(value)) {
            throw new ValidationError(field + " is required");
        }
    }
}

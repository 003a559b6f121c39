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

package com.phonepe.leadmind.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Stopwatch;
import com.google.common.base.Throwables;
import com.phonepe.leadmind.core.errors.ErrorType;
import com.phonepe.leadmind.core.errors.LeadmindException;
import com.phonepe.leadmind.core.errors.PermissionDeniedError;
import com.phonepe.leadmind.core.errors.ValidationError;
import com.phonepe.leadmind.core.model.Tier;
import com.phonepe.leadmind.core.utils.JsonUtils;
import com.phonepe.leadmind.handoff.HandoffCoordinator;
import com.phonepe.leadmind.handoff.model.HandoffRequest;
import com.phonepe.leadmind.memory.MemoryManager;
import com.phonepe.leadmind.memory.PutOptions;
import com.phonepe.leadmind.memory.QueryCriteria;
import com.phonepe.leadmind.rpc.auth.CallerIdentity;
import com.phonepe.leadmind.rpc.auth.PermissionChecker;
import com.phonepe.leadmind.rpc.model.EscalateParams;
import com.phonepe.leadmind.rpc.model.GetParams;
import com.phonepe.leadmind.rpc.model.PutParams;
import com.phonepe.leadmind.rpc.model.QueryParams;
import com.phonepe.leadmind.rpc.model.RpcError;
import com.phonepe.leadmind.rpc.model.RpcRequest;
import com.phonepe.leadmind.rpc.model.RpcResponse;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Routes method calls to the memory manager and the handoff coordinator. Method names:
 * <ul>
 *     <li>{@code memory.<tier>.put|get|query}, needing permission {@code memory.<tier>}</li>
 *     <li>{@code agent.handoff} and {@code agent.escalate}, needing the permission of the same name</li>
 * </ul>
 * Every failure is returned as an error response; nothing is thrown back to the transport.
 */
@Slf4j
public class RpcDispatcher {
    public static final String AGENT_HANDOFF = "agent.handoff";
    public static final String AGENT_ESCALATE = "agent.escalate";

    private record Binding(String permission, RpcMethod method) {
    }

    private final MemoryManager memoryManager;
    private final HandoffCoordinator handoffCoordinator;
    private final ObjectMapper mapper;
    private final Map<String, Binding> methods = new ConcurrentHashMap<>();

    @Builder
    public RpcDispatcher(
            @NonNull MemoryManager memoryManager,
            @NonNull HandoffCoordinator handoffCoordinator,
            ObjectMapper mapper) {
        this.memoryManager = memoryManager;
        this.handoffCoordinator = handoffCoordinator;
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        for (final var tier : Tier.values()) {
            final var scope = memoryScope(tier);
            register(scope + ".put", scope, (caller, params) -> put(tier, params));
            register(scope + ".get", scope, (caller, params) -> get(tier, params));
            register(scope + ".query", scope, (caller, params) -> query(tier, params));
        }
        register(AGENT_HANDOFF, AGENT_HANDOFF, this::handoff);
        register(AGENT_ESCALATE, AGENT_ESCALATE, this::escalate);
    }

    public static String memoryScope(Tier tier) {
        return "memory." + tier.wireName();
    }

    public void register(String name, String permission, RpcMethod method) {
        methods.put(name, new Binding(permission, method));
        log.info("Registered method: {}", name);
    }

    public Set<String> methods() {
        return new TreeSet<>(methods.keySet());
    }

    public RpcResponse dispatch(CallerIdentity caller, RpcRequest request) {
        final var requestId = request.getRequestId();
        final var binding = methods.get(request.getMethod());
        if (null == binding) {
            log.warn("Call {} to unknown method {}", requestId, request.getMethod());
            return RpcResponse.failure(requestId,
                                       RpcError.builder()
                                               .type(RpcError.METHOD_NOT_FOUND)
                                               .message("Method '%s' is not registered".formatted(request.getMethod()))
                                               .build());
        }
        final var callerId = caller == null ? "anonymous" : caller.getAgentId();
        final var stopwatch = Stopwatch.createStarted();
        try {
            PermissionChecker.check(caller, binding.permission());
            final var params = request.getParams() == null || request.getParams().isNull()
                               ? mapper.createObjectNode()
                               : request.getParams();
            log.debug("Calling {} [{}] for {}", request.getMethod(), requestId, callerId);
            final var result = binding.method().handle(caller, params);
            log.info("{} [{}] for {} completed in {} ms",
                     request.getMethod(), requestId, callerId, stopwatch.elapsed(TimeUnit.MILLISECONDS));
            return RpcResponse.success(requestId, result);
        }
        catch (LeadmindException e) {
            log.warn("{} [{}] for {} failed: {}", request.getMethod(), requestId, callerId, e.getMessage());
            return RpcResponse.failure(requestId,
                                       RpcError.builder()
                                               .type(e.getErrorType().name())
                                               .message(e.getMessage())
                                               .retryable(e.isRetryable())
                                               .build());
        }
        catch (JsonProcessingException | IllegalArgumentException e) {
            final var message = Throwables.getRootCause(e).getMessage();
            log.warn("Invalid params for {} [{}]: {}", request.getMethod(), requestId, message);
            return RpcResponse.failure(requestId,
                                       RpcError.builder()
                                               .type(ErrorType.VALIDATION.name())
                                               .message("Invalid params: " + message)
                                               .build());
        }
        catch (Exception e) {
            log.error("Error executing %s [%s]".formatted(request.getMethod(), requestId), e);
            return RpcResponse.failure(requestId,
                                       RpcError.builder()
                                               .type(RpcError.INTERNAL)
                                               .message(Throwables.getRootCause(e).getMessage())
                                               .build());
        }
    }

    private JsonNode put(Tier tier, JsonNode node) throws JsonProcessingException {
        final var params = mapper.treeToValue(node, PutParams.class);
        if (params.getPayload() == null) {
            throw new ValidationError("payload is required");
        }
        final var options = PutOptions.builder()
                .ttl(params.getTtlSeconds() == null ? null : Duration.ofSeconds(params.getTtlSeconds()))
                .tags(params.getTags())
                .build();
        memoryManager.put(tier, params.getKey(), params.getPayload(), options);
        return mapper.createObjectNode().put("ok", true);
    }

    private JsonNode get(Tier tier, JsonNode node) throws JsonProcessingException {
        final var params = mapper.treeToValue(node, GetParams.class);
        if (params.getKey() == null) {
            throw new ValidationError("key is required");
        }
        final var response = mapper.createObjectNode();
        final var memoryRecord = memoryManager.get(tier, params.getKey());
        if (memoryRecord.isPresent()) {
            final JsonNode payload = mapper.valueToTree(memoryRecord.get().getPayload());
            response.set("payload", payload);
        }
        else {
            response.put("notFound", true);
        }
        return response;
    }

    private JsonNode query(Tier tier, JsonNode node) throws JsonProcessingException {
        final var params = mapper.treeToValue(node, QueryParams.class);
        final var criteria = Objects.requireNonNullElseGet(params.getCriteria(), QueryCriteria::all);
        final var response = mapper.createObjectNode();
        final var records = response.putArray("records");
        for (final var memoryRecord : memoryManager.query(tier, criteria)) {
            final JsonNode tree = mapper.valueToTree(memoryRecord);
            records.add(tree);
        }
        return response;
    }

    private JsonNode handoff(CallerIdentity caller, JsonNode node) throws JsonProcessingException {
        final var request = mapper.treeToValue(node, HandoffRequest.class);
        if (!caller.isAdmin() && !caller.getAgentId().equals(request.getSourceAgent())) {
            throw new PermissionDeniedError("%s cannot hand off on behalf of %s"
                                                    .formatted(caller.getAgentId(), request.getSourceAgent()));
        }
        final var result = handoffCoordinator.requestHandoff(request);
        final var response = mapper.createObjectNode()
                .put("accepted", result.isAccepted())
                .put("newState", result.getNewState().name())
                .put("route", result.getRoute().name());
        if (result.getAssignedAgent() != null) {
            response.put("assignedAgent", result.getAssignedAgent());
        }
        if (result.getTicketId() != null) {
            response.put("ticketId", result.getTicketId());
        }
        return response;
    }

    private JsonNode escalate(CallerIdentity caller, JsonNode node) throws JsonProcessingException {
        final var params = mapper.treeToValue(node, EscalateParams.class);
        final var ticket = handoffCoordinator.escalate(params.getLeadId(),
                                                       params.getConversationId(),
                                                       params.getReason(),
                                                       caller.getAgentId());
        return mapper.createObjectNode().put("ticketId", ticket.getTicketId());
    }
}

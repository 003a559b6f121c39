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

package com.phonepe.leadmind.memory;

import com.phonepe.leadmind.core.errors.OperationCancelledError;
import com.phonepe.leadmind.core.errors.ValidationError;
import com.phonepe.leadmind.core.events.EventBus;
import com.phonepe.leadmind.core.model.MemoryRecord;
import com.phonepe.leadmind.core.model.Tier;
import com.phonepe.leadmind.core.model.payloads.MemoryPayload;
import com.phonepe.leadmind.core.retry.RetrySetup;
import com.phonepe.leadmind.core.retry.RetryingExecutor;
import com.phonepe.leadmind.core.store.EpisodicStore;
import com.phonepe.leadmind.core.store.LongTermStore;
import com.phonepe.leadmind.core.store.ScoredRecord;
import com.phonepe.leadmind.core.store.SemanticStore;
import com.phonepe.leadmind.core.store.ShortTermStore;
import com.phonepe.leadmind.core.store.TierStore;
import com.phonepe.leadmind.core.store.TraversalHit;
import com.phonepe.leadmind.core.utils.KeyedLocks;
import com.phonepe.leadmind.memory.consolidation.ConceptAssociationRule;
import com.phonepe.leadmind.memory.consolidation.ConsolidationContext;
import com.phonepe.leadmind.memory.consolidation.ConsolidationRule;
import com.phonepe.leadmind.memory.consolidation.ConsolidationSummary;
import com.phonepe.leadmind.memory.consolidation.EpisodeExtractionRule;
import com.phonepe.leadmind.memory.consolidation.RuleResult;
import com.phonepe.leadmind.memory.consolidation.ShortToLongTermRule;
import com.phonepe.leadmind.memory.fingerprint.FingerprintModel;
import com.phonepe.leadmind.memory.fingerprint.HashingFingerprintModel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Single entry point agents use to read and write memory. Owns the cross tier rules: which payloads go where, short
 * term expiry, and consolidation of short term state into the durable tiers.
 * <p>
 * Writes to the same record are serialized in arrival order. Store calls that fail with
 * {@link com.phonepe.leadmind.core.errors.UnavailableError} are retried with backoff before the error reaches the
 * caller.
 */
@Slf4j
public class MemoryManager {
    private final ShortTermStore shortTermStore;
    private final LongTermStore longTermStore;
    private final EpisodicStore episodicStore;
    private final SemanticStore semanticStore;
    @Getter
    private final MemorySetup setup;
    private final RetryingExecutor retryingExecutor;
    @Getter
    private final KeyedLocks keyedLocks;
    @Getter
    private final EventBus eventBus;
    private final FingerprintModel fingerprintModel;
    private final Clock clock;
    private final PayloadValidator payloadValidator;
    private final List<ConsolidationRule> consolidationRules;

    @Builder
    public MemoryManager(
            @NonNull ShortTermStore shortTermStore,
            @NonNull LongTermStore longTermStore,
            @NonNull EpisodicStore episodicStore,
            @NonNull SemanticStore semanticStore,
            MemorySetup setup,
            RetryingExecutor retryingExecutor,
            KeyedLocks keyedLocks,
            EventBus eventBus,
            FingerprintModel fingerprintModel,
            Clock clock) {
        this.shortTermStore = shortTermStore;
        this.longTermStore = longTermStore;
        this.episodicStore = episodicStore;
        this.semanticStore = semanticStore;
        this.setup = Objects.requireNonNullElse(setup, MemorySetup.DEFAULT);
        this.retryingExecutor = Objects.requireNonNullElseGet(retryingExecutor,
                                                              () -> new RetryingExecutor(RetrySetup.DEFAULT));
        this.keyedLocks = Objects.requireNonNullElseGet(keyedLocks, KeyedLocks::new);
        this.eventBus = Objects.requireNonNullElseGet(eventBus, EventBus::new);
        this.fingerprintModel = Objects.requireNonNullElseGet(fingerprintModel, HashingFingerprintModel::new);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        if (episodicStore.dimension() != this.setup.getFingerprintDimension()) {
            throw new IllegalArgumentException("Episodic store dimension %d does not match configured dimension %d"
                                                       .formatted(episodicStore.dimension(),
                                                                  this.setup.getFingerprintDimension()));
        }
        this.payloadValidator = new PayloadValidator(this.setup.getFingerprintDimension(),
                                                     this.setup.getEpisodicThreshold());
        this.consolidationRules = List.of(new ShortToLongTermRule(),
                                          new EpisodeExtractionRule(),
                                          new ConceptAssociationRule());
    }

    /**
     * Store or overwrite a record.
     *
     * @param tier    Tier to write to. The payload variant must belong to it.
     * @param key     Record key. Must match the natural key of the payload.
     * @param payload Value to store
     * @param options TTL (short term only, mandatory there) and tags
     * @return The record as stored
     * @throws ValidationError                                   if the write is not acceptable for the tier
     * @throws com.phonepe.leadmind.core.errors.UnavailableError if the store stays unreachable after retries
     */
    public MemoryRecord put(Tier tier, String key, MemoryPayload payload, PutOptions options) {
        final var putOptions = Objects.requireNonNullElse(options, PutOptions.NONE);
        payloadValidator.validate(tier, key, payload, putOptions);
        final var store = storeFor(tier);
        return keyedLocks.withLock(KeyedLocks.recordKey(tier.wireName(), key), () -> {
            final var now = clock.instant();
            final var existing = retryingExecutor.call("read " + tier.wireName(), () -> store.read(key));
            final var memoryRecord = MemoryRecord.builder()
                    .tier(tier)
                    .key(key)
                    .payload(payload)
                    .createdAt(existing.map(MemoryRecord::getCreatedAt).orElse(now))
                    .lastAccessedAt(now)
                    .expiresAt(tier == Tier.SHORT_TERM ? now.plus(putOptions.getTtl()) : null)
                    .tags(putOptions.getTags())
                    .build();
            retryingExecutor.run("write " + tier.wireName(), () -> store.write(memoryRecord));
            log.debug("Stored {} record {}", tier.wireName(), key);
            return memoryRecord;
        });
    }

    public MemoryRecord put(Tier tier, String key, MemoryPayload payload) {
        return put(tier, key, payload, PutOptions.NONE);
    }

    /**
     * Read a record. Expired short term records are reported as absent. A successful read refreshes the record's
     * last access time.
     */
    public Optional<MemoryRecord> get(Tier tier, String key) {
        if (tier == null || key == null) {
            throw new ValidationError("Tier and key are required");
        }
        final var store = storeFor(tier);
        final var now = clock.instant();
        return retryingExecutor.call("read " + tier.wireName(), () -> store.read(key))
                .filter(memoryRecord -> !memoryRecord.isExpired(now))
                .map(memoryRecord -> {
                    retryingExecutor.run("touch " + tier.wireName(), () -> store.touch(key, now));
                    return memoryRecord.withLastAccessedAt(now);
                });
    }

    /**
     * Query a tier. Criteria are validated immediately; the tier is read only when the returned sequence is
     * iterated, and again on every iteration.
     * <ul>
     *     <li>short and long term: most recently accessed first</li>
     *     <li>episodic: most similar first, above the similarity floor</li>
     *     <li>semantic: edges reachable from the start concept, nearest first</li>
     * </ul>
     */
    public RecordSequence query(Tier tier, QueryCriteria criteria) {
        if (tier == null) {
            throw new ValidationError("Tier is required");
        }
        final var queryCriteria = Objects.requireNonNullElseGet(criteria, QueryCriteria::all);
        final var limit = Objects.requireNonNullElse(queryCriteria.getLimit(), setup.getQueryLimit());
        if (limit <= 0) {
            throw new ValidationError("Query limit must be positive");
        }
        return switch (tier) {
            case SHORT_TERM -> {
                final var filter = queryCriteria.toFilter(limit);
                yield new RecordSequence(() -> retryingExecutor.call(
                        "scan short_term",
                        () -> shortTermStore.scanLive(clock.instant())
                                .stream()
                                .filter(filter::matches)
                                .limit(filter.getLimit())
                                .toList()));
            }
            case LONG_TERM -> {
                final var filter = queryCriteria.toFilter(limit);
                yield new RecordSequence(() -> retryingExecutor.call("find long_term",
                                                                     () -> longTermStore.find(filter)));
            }
            case EPISODIC -> episodicQuery(queryCriteria, limit);
            case SEMANTIC -> semanticQuery(queryCriteria, limit);
        };
    }

    /**
     * Run all consolidation rules once, in order. A rule that fails does not stop the ones after it.
     */
    public ConsolidationSummary consolidate() {
        final var startedAt = clock.instant();
        final var context = ConsolidationContext.builder()
                .setup(setup)
                .shortTermStore(shortTermStore)
                .longTermStore(longTermStore)
                .episodicStore(episodicStore)
                .semanticStore(semanticStore)
                .retryingExecutor(retryingExecutor)
                .keyedLocks(keyedLocks)
                .fingerprintModel(fingerprintModel)
                .eventBus(eventBus)
                .clock(clock)
                .startedAt(startedAt)
                .build();
        final var results = new ArrayList<RuleResult>();
        for (final var rule : consolidationRules) {
            try {
                final var result = rule.apply(context);
                log.debug("Rule {}: migrated {}, skipped {}, failed {}",
                          rule.name(), result.getMigrated(), result.getSkipped(), result.getFailed());
                results.add(result);
            }
            catch (OperationCancelledError e) {
                throw e;
            }
            catch (RuntimeException e) {
                log.error("Consolidation rule {} failed: {}", rule.name(), e.getMessage(), e);
                results.add(RuleResult.failure(rule.name(), e));
            }
        }
        return new ConsolidationSummary(startedAt, clock.instant(), List.copyOf(results));
    }

    /**
     * Physically remove expired short term records
     *
     * @return Number of records removed
     */
    public int purgeExpired() {
        return retryingExecutor.call("purge short_term", () -> shortTermStore.purgeExpired(clock.instant()));
    }

    private RecordSequence episodicQuery(QueryCriteria criteria, int limit) {
        final var fingerprint = criteria.getFingerprint();
        if (fingerprint == null || fingerprint.length != episodicStore.dimension()) {
            throw new ValidationError("Episodic query needs a fingerprint of dimension " + episodicStore.dimension());
        }
        final var minSimilarity = Objects.requireNonNullElse(criteria.getMinSimilarity(),
                                                             setup.getEpisodicMinSimilarity());
        return new RecordSequence(() -> retryingExecutor.call(
                "nearest episodic",
                () -> episodicStore.nearest(fingerprint, criteria.getScenarioTag(), minSimilarity, limit)
                        .stream()
                        .map(ScoredRecord::getMemoryRecord)
                        .toList()));
    }

    private RecordSequence semanticQuery(QueryCriteria criteria, int limit) {
        final var startConcept = criteria.getStartConcept();
        if (startConcept == null || startConcept.isBlank()) {
            throw new ValidationError("Semantic query needs a start concept");
        }
        final var maxDepth = Objects.requireNonNullElse(criteria.getMaxDepth(), setup.getTraversalDepth());
        if (maxDepth < 1) {
            throw new ValidationError("Traversal depth must be at least 1");
        }
        return new RecordSequence(() -> retryingExecutor.call(
                "traverse semantic",
                () -> semanticStore.traverse(startConcept, maxDepth, criteria.getRelationTypes(), limit)
                        .stream()
                        .map(TraversalHit::getEdge)
                        .toList()));
    }

    private TierStore storeFor(Tier tier) {
        return switch (tier) {
            case SHORT_TERM -> shortTermStore;
            case LONG_TERM -> longTermStore;
            case EPISODIC -> episodicStore;
            case SEMANTIC -> semanticStore;
        };
    }
}

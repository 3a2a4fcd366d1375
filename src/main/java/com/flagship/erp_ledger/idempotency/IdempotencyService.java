package com.flagship.erp_ledger.idempotency;

import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.exception.ValidationException;
import com.flagship.erp_ledger.observability.PostingMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Request deduplication for document-creating calls.
 *
 * Lookups try Redis first and fall back to the {@code idempotency_keys} table, which is the source of
 * truth. A new key is recorded in the same transaction as the operation it guards; Redis is only written
 * after that transaction commits. Redis failures are logged and ignored.
 */
@Service
@Slf4j
public class IdempotencyService {

    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private static final String REDIS_KEY_PREFIX = "idempotency:";
    private static final int MAX_KEY_LENGTH = 255;

    private final IdempotencyRecordRepository repository;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final PostingMetrics postingMetrics;
    private final Duration redisTtl;

    public IdempotencyService(IdempotencyRecordRepository repository,
                              Optional<StringRedisTemplate> redisTemplate,
                              PostingMetrics postingMetrics,
                              @Value("${idempotency.redis.enabled:true}") boolean redisEnabled,
                              @Value("${idempotency.redis-ttl:7d}") Duration redisTtl) {
        this.repository = repository;
        this.redisTemplate = redisEnabled ? redisTemplate : Optional.empty();
        this.postingMetrics = postingMetrics;
        this.redisTtl = redisTtl;
    }

    /**
     * Runs {@code action} unless the key was already used, in which case the earlier resource id is returned.
     *
     * @throws ValidationException if the key was used for a different operation
     */
    @Transactional
    public IdempotentResult execute(TenantScope scope, String idempotencyKey, IdempotentOperation operation,
                                    Supplier<UUID> action) {
        validateKey(idempotencyKey);

        Optional<UUID> existing = find(scope.getBusinessId(), idempotencyKey, operation);
        if (existing.isPresent()) {
            postingMetrics.recordIdempotencyHit(operation.name());
            log.info("Idempotency key already used, returning existing resource: operation={}, resourceId={}",
                    operation, existing.get());
            return new IdempotentResult(existing.get(), true);
        }
        postingMetrics.recordIdempotencyMiss(operation.name());

        UUID resourceId = action.get();
        repository.saveAndFlush(IdempotencyRecord.of(scope.getBusinessId(), idempotencyKey, operation, resourceId));
        cacheAfterCommit(scope.getBusinessId(), idempotencyKey, operation, resourceId);
        return new IdempotentResult(resourceId, false);
    }

    @Transactional(readOnly = true)
    public Optional<UUID> find(UUID businessId, String idempotencyKey, IdempotentOperation operation) {
        String redisKey = redisKey(businessId, idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(redisKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(decode(cached, operation, idempotencyKey));
                }
            } catch (ValidationException e) {
                throw e;
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<IdempotencyRecord> record = repository.findByBusinessIdAndIdempotencyKey(businessId, idempotencyKey);
        if (record.isEmpty()) {
            return Optional.empty();
        }
        IdempotencyRecord found = record.get();
        requireSameOperation(found.getOperation(), operation, idempotencyKey);
        cache(redisKey, found.getOperation(), found.getResourceId());
        return Optional.of(found.getResourceId());
    }

    private void cacheAfterCommit(UUID businessId, String idempotencyKey, IdempotentOperation operation, UUID resourceId) {
        String redisKey = redisKey(businessId, idempotencyKey);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    cache(redisKey, operation, resourceId);
                }
            });
        } else {
            cache(redisKey, operation, resourceId);
        }
    }

    private void cache(String redisKey, IdempotentOperation operation, UUID resourceId) {
        redisTemplate.ifPresent(template -> {
            try {
                template.opsForValue().set(redisKey, operation.name() + ":" + resourceId, redisTtl);
            } catch (Exception e) {
                log.debug("Failed to cache idempotency key in Redis: {}", e.getMessage());
            }
        });
    }

    private UUID decode(String cached, IdempotentOperation expected, String idempotencyKey) {
        int separator = cached.indexOf(':');
        IdempotentOperation stored = IdempotentOperation.valueOf(cached.substring(0, separator));
        requireSameOperation(stored, expected, idempotencyKey);
        return UUID.fromString(cached.substring(separator + 1));
    }

    private void requireSameOperation(IdempotentOperation stored, IdempotentOperation expected, String idempotencyKey) {
        if (stored != expected) {
            throw new ValidationException(String.format(
                "Idempotency key '%s' was already used for %s", idempotencyKey, stored));
        }
    }

    private void validateKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
        if (idempotencyKey.length() > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException("Idempotency key must be at most " + MAX_KEY_LENGTH + " characters");
        }
    }

    private String redisKey(UUID businessId, String idempotencyKey) {
        return REDIS_KEY_PREFIX + businessId + ":" + idempotencyKey;
    }
}

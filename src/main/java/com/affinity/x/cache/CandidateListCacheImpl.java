package com.affinity.x.cache;

import com.affinity.x.dto.CandidateFilters;
import com.affinity.x.exceptions.InternalServerErrorException;
import com.affinity.x.utils.basic.HashUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;


@Slf4j
@Component
public class CandidateListCacheImpl implements CandidateListCache {
    private static final String KEY_PREFIX = "matches:candidates:";

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Duration ttl;

    public CandidateListCacheImpl(
            @Qualifier("byteArrayRedisTemplate") RedisTemplate<String, byte[]> redisTemplate,
            @Qualifier("redisObjectMapper") ObjectMapper objectMapper,
            MeterRegistry meterRegistry,
            Clock clock,
            @Value("${matching.list-cache.ttl-seconds:300}") long ttlSeconds
    ) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.ttl = Duration.ofSeconds(ttlSeconds);
    }

    @CircuitBreaker(name = "candidateListCache", fallbackMethod = "getFallback")
    @Override
    public Optional<List<UUID>> get(UUID viewerId, CandidateFilters filters, int limit, int offset) {
        String key = cacheKey(viewerId, filters, limit, offset);
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            byte[] payload = redisTemplate.opsForValue().get(key);
            if (payload == null) {
                return miss(viewerId, key);
            }
            CandidateListCacheEntry entry = deserialize(key, payload);
            if (entry == null || entry.getCandidateIds() == null || entry.isExpiredAt(clock.instant())) {
                return miss(viewerId, key);
            }
            meterRegistry.counter("candidate_list_cache_hits").increment();
            log.debug("Candidate list cache hit for viewerId={} key={} size={}", viewerId, key, entry.getCandidateIds().size());
            return Optional.of(List.copyOf(entry.getCandidateIds()));
        } finally {
            sample.stop(meterRegistry.timer("candidate_list_cache_read_duration"));
        }
    }

    @CircuitBreaker(name = "candidateListCache", fallbackMethod = "putFallback")
    @Override
    public void put(UUID viewerId, CandidateFilters filters, int limit, int offset, List<UUID> candidateIds, Duration ttl) {
        if (candidateIds == null || candidateIds.isEmpty()) {
            log.debug("Skipping cache write of empty candidate list for viewerId={}", viewerId);
            return;
        }
        Duration effectiveTtl = ttl == null || ttl.isZero() || ttl.isNegative() ? this.ttl : ttl;
        String key = cacheKey(viewerId, filters, limit, offset);
        Instant now = clock.instant();
        CandidateListCacheEntry entry = CandidateListCacheEntry.builder()
                .candidateIds(List.copyOf(candidateIds))
                .cachedAt(now)
                .expiresAt(now.plus(effectiveTtl))
                .build();

        redisTemplate.opsForValue().set(key, serialize(entry), effectiveTtl);
        meterRegistry.counter("candidate_list_cache_writes").increment();
        log.debug("Cached {} candidate ids for viewerId={} key={} ttl={}s", candidateIds.size(), viewerId, key, effectiveTtl.toSeconds());
    }

    @Override
    public Duration defaultTtl() {
        return ttl;
    }

    public Optional<List<UUID>> getFallback(UUID viewerId, CandidateFilters filters, int limit, int offset, Throwable t) {
        log.warn("Candidate list cache unavailable for viewerId={}, treating as miss: {}", viewerId, t.getMessage());
        meterRegistry.counter("candidate_list_cache_errors", "operation", "get").increment();
        return Optional.empty();
    }

    public void putFallback(UUID viewerId, CandidateFilters filters, int limit, int offset,
                            List<UUID> candidateIds, Duration ttl, Throwable t) {
        log.warn("Candidate list cache unavailable for viewerId={}, skipping write of {} ids: {}",
                viewerId, candidateIds == null ? 0 : candidateIds.size(), t.getMessage());
        meterRegistry.counter("candidate_list_cache_errors", "operation", "put").increment();
    }

    String cacheKey(UUID viewerId, CandidateFilters filters, int limit, int offset) {
        CandidateFilters effective = filters == null ? CandidateFilters.none() : filters;
        return KEY_PREFIX + viewerId + ":" + HashUtils.sha256Hex(effective.signature(limit, offset));
    }

    private Optional<List<UUID>> miss(UUID viewerId, String key) {
        meterRegistry.counter("candidate_list_cache_misses").increment();
        log.debug("Candidate list cache miss for viewerId={} key={}", viewerId, key);
        return Optional.empty();
    }

    private CandidateListCacheEntry deserialize(String key, byte[] payload) {
        try {
            return objectMapper.readValue(payload, CandidateListCacheEntry.class);
        } catch (IOException e) {
            log.warn("Unreadable candidate list cache entry key={}, treating as miss: {}", key, e.getMessage());
            meterRegistry.counter("candidate_list_cache_errors", "operation", "deserialize").increment();
            return null;
        }
    }

    private byte[] serialize(CandidateListCacheEntry entry) {
        try {
            return objectMapper.writeValueAsBytes(entry);
        } catch (JsonProcessingException e) {
            throw new InternalServerErrorException("Failed to serialize candidate list cache entry", e);
        }
    }
}

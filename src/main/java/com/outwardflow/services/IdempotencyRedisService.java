/*
 * Copyright 2025 adityamehta.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.outwardflow.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.outwardflow.dto.PartRequestResponseDTO;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.stereotype.Service;

/**
 * Replay protection for request creation. A first caller takes the lock, later callers with
 * the same key either get the stored response or wait for the first caller to store it.
 *
 * @author adityamehta
 */
@Service
@Slf4j
public class IdempotencyRedisService {

    private final RedisTemplate<String, Object> redisTemplate;
    private final ObjectMapper objectMapper;

    private static final String IDEMPOTENCY_PREFIX = "outward:idempotency:";
    private static final String LOCK_PREFIX = "outward:idempotency:lock:";
    private static final String PROCESSING_PREFIX = "outward:idempotency:processing:";

    private static final Duration IDEMPOTENCY_TTL = Duration.ofHours(24);
    private static final Duration LOCK_TTL = Duration.ofMinutes(5);
    private static final Duration PROCESSING_TTL = Duration.ofMinutes(2);

    private static final int MAX_WAIT_ATTEMPTS = 30;
    private static final int WAIT_INTERVAL_MS = 1000;

    public IdempotencyRedisService(RedisTemplate<String, Object> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    public boolean tryLock(String idempotencyKey) {
        try {
            Boolean success = redisTemplate.opsForValue()
                    .setIfAbsent(LOCK_PREFIX + idempotencyKey, "processing", LOCK_TTL);

            if (Boolean.TRUE.equals(success)) {
                log.debug("Acquired lock for idempotency key: {}", idempotencyKey);
                return true;
            }

            log.debug("Lock already held for idempotency key: {}", idempotencyKey);
            return false;

        } catch (Exception e) {
            log.error("Error acquiring lock for idempotency key: {}", idempotencyKey, e);
            return false;
        }
    }

    public void releaseLock(String idempotencyKey) {
        try {
            redisTemplate.delete(LOCK_PREFIX + idempotencyKey);
            log.debug("Released lock for idempotency key: {}", idempotencyKey);
        } catch (Exception e) {
            log.error("Error releasing lock for idempotency key: {}", idempotencyKey, e);
        }
    }

    public void markAsProcessing(String idempotencyKey) {
        try {
            redisTemplate.opsForValue().set(PROCESSING_PREFIX + idempotencyKey, "processing", PROCESSING_TTL);
        } catch (Exception e) {
            log.error("Error marking as processing for idempotency key: {}", idempotencyKey, e);
        }
    }

    public boolean isProcessing(String idempotencyKey) {
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(PROCESSING_PREFIX + idempotencyKey));
        } catch (Exception e) {
            log.error("Error checking processing status for idempotency key: {}", idempotencyKey, e);
            return false;
        }
    }

    public void removeProcessingMarker(String idempotencyKey) {
        try {
            redisTemplate.delete(PROCESSING_PREFIX + idempotencyKey);
        } catch (Exception e) {
            log.error("Error removing processing marker for idempotency key: {}", idempotencyKey, e);
        }
    }

    /**
     * Stores the response, drops the lock and the processing marker in one MULTI block.
     */
    public void storeResponseAndReleaseLock(String idempotencyKey, PartRequestResponseDTO response) {
        try {
            redisTemplate.execute(new SessionCallback<Object>() {
                @Override
                public Object execute(RedisOperations operations) throws DataAccessException {
                    operations.multi();
                    operations.opsForValue().set(IDEMPOTENCY_PREFIX + idempotencyKey, response, IDEMPOTENCY_TTL);
                    operations.delete(LOCK_PREFIX + idempotencyKey);
                    operations.delete(PROCESSING_PREFIX + idempotencyKey);
                    return operations.exec();
                }
            });

            log.debug("Stored response for idempotency key: {}", idempotencyKey);

        } catch (Exception e) {
            log.error("Error storing response for idempotency key: {}", idempotencyKey, e);
            releaseLock(idempotencyKey);
            removeProcessingMarker(idempotencyKey);
            throw new IllegalStateException("Failed to store idempotency response", e);
        }
    }

    public Optional<PartRequestResponseDTO> getResponse(String idempotencyKey) {
        try {
            Object cached = redisTemplate.opsForValue().get(IDEMPOTENCY_PREFIX + idempotencyKey);

            if (cached == null) {
                return Optional.empty();
            }

            if (cached instanceof PartRequestResponseDTO) {
                log.debug("Found cached response for idempotency key: {}", idempotencyKey);
                return Optional.of((PartRequestResponseDTO) cached);
            }

            return Optional.of(objectMapper.convertValue(cached, PartRequestResponseDTO.class));

        } catch (Exception e) {
            log.error("Error retrieving cached response for idempotency key: {}", idempotencyKey, e);
            return Optional.empty();
        }
    }

    /**
     * Polls for the response stored by the caller holding the lock. Empty when that caller
     * stopped without storing one, or the wait timed out.
     */
    public Optional<PartRequestResponseDTO> waitForResult(String idempotencyKey) {
        for (int attempt = 0; attempt < MAX_WAIT_ATTEMPTS; attempt++) {
            Optional<PartRequestResponseDTO> result = getResponse(idempotencyKey);
            if (result.isPresent()) {
                return result;
            }

            if (!isProcessing(idempotencyKey)) {
                log.warn("Processing stopped without a result for idempotency key: {}", idempotencyKey);
                return Optional.empty();
            }

            try {
                Thread.sleep(WAIT_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for idempotency key: {}", idempotencyKey);
                return Optional.empty();
            }
        }

        log.warn("Timeout waiting for result for idempotency key: {}", idempotencyKey);
        return Optional.empty();
    }
}

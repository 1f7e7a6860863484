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
package com.outwardflow.services.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.outwardflow.dto.StockAvailabilityDTO;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Read-through cache for availability snapshots. Reserve and consume never read from here.
 *
 * @author adityamehta
 */
@Service
@Slf4j
public class StockAvailabilityCacheService {

    private final RedisTemplate<String, Object> redisTemplate;
    private final ObjectMapper objectMapper;

    private static final String AVAILABILITY_PREFIX = "outward:availability:";

    private static final Duration AVAILABILITY_TTL = Duration.ofMinutes(2);

    public StockAvailabilityCacheService(RedisTemplate<String, Object> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    public void cacheAvailability(StockAvailabilityDTO availability) {
        String key = key(availability.getSparePartId(), availability.getStoreId());
        try {
            redisTemplate.opsForValue().set(key, availability, AVAILABILITY_TTL);
            log.debug("Cached availability under {}", key);
        } catch (Exception e) {
            log.error("Error caching availability under {}", key, e);
        }
    }

    public Optional<StockAvailabilityDTO> getCachedAvailability(UUID sparePartId, String storeId) {
        String key = key(sparePartId, storeId);
        try {
            Object cached = redisTemplate.opsForValue().get(key);

            if (cached == null) {
                return Optional.empty();
            }

            if (cached instanceof StockAvailabilityDTO) {
                return Optional.of((StockAvailabilityDTO) cached);
            }

            return Optional.of(objectMapper.convertValue(cached, StockAvailabilityDTO.class));

        } catch (Exception e) {
            log.error("Error reading cached availability under {}", key, e);
            return Optional.empty();
        }
    }

    public void evictAvailability(UUID sparePartId, String storeId) {
        String key = key(sparePartId, storeId);
        try {
            redisTemplate.delete(key);
            log.debug("Evicted availability under {}", key);
        } catch (Exception e) {
            log.error("Error evicting availability under {}", key, e);
        }
    }

    private String key(UUID sparePartId, String storeId) {
        return AVAILABILITY_PREFIX + sparePartId + ":" + storeId;
    }
}

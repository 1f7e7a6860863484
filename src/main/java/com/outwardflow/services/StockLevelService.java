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

import com.outwardflow.dto.SparePartRequestDTO;
import com.outwardflow.dto.StockAvailabilityDTO;
import com.outwardflow.dto.StockReceiptRequestDTO;
import com.outwardflow.entity.MovementType;
import com.outwardflow.entity.ReservationStatus;
import com.outwardflow.entity.SparePart;
import com.outwardflow.entity.StockLevel;
import com.outwardflow.entity.StockMovement;
import com.outwardflow.exceptions.InvalidRequestException;
import com.outwardflow.exceptions.ResourceNotFoundException;
import com.outwardflow.repository.SparePartRepository;
import com.outwardflow.repository.StockLevelRepository;
import com.outwardflow.repository.StockMovementRepository;
import com.outwardflow.repository.StockReservationRepository;
import com.outwardflow.services.redis.StockAvailabilityCacheService;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Parts catalogue and per-store physical stock. Every change to a stock level goes through
 * the row lock on the (part, store) pair and leaves a {@link StockMovement} behind.
 *
 * @author adityamehta
 */
@Service
@Transactional
@Slf4j
public class StockLevelService {

    private final SparePartRepository sparePartRepository;
    private final StockLevelRepository stockLevelRepository;
    private final StockMovementRepository stockMovementRepository;
    private final StockReservationRepository stockReservationRepository;
    private final StockAvailabilityCacheService availabilityCache;
    private final Clock clock;

    public StockLevelService(
            SparePartRepository sparePartRepository,
            StockLevelRepository stockLevelRepository,
            StockMovementRepository stockMovementRepository,
            StockReservationRepository stockReservationRepository,
            StockAvailabilityCacheService availabilityCache,
            Clock clock) {
        this.sparePartRepository = sparePartRepository;
        this.stockLevelRepository = stockLevelRepository;
        this.stockMovementRepository = stockMovementRepository;
        this.stockReservationRepository = stockReservationRepository;
        this.availabilityCache = availabilityCache;
        this.clock = clock;
    }

    public SparePart registerPart(SparePartRequestDTO request) {
        log.info("Registering spare part {}", request.getPartNumber());

        if (sparePartRepository.findByPartNumber(request.getPartNumber()).isPresent()) {
            throw new InvalidRequestException("Spare part already exists with part number: " + request.getPartNumber());
        }

        SparePart part = SparePart.builder()
                .partNumber(request.getPartNumber())
                .name(request.getName())
                .categoryId(request.getCategoryId())
                .unitPrice(request.getUnitPrice())
                .warrantyMonths(request.getWarrantyMonths())
                .createdAt(OffsetDateTime.now(clock))
                .build();

        try {
            return sparePartRepository.saveAndFlush(part);
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent registration of part number {}", request.getPartNumber());
            throw new InvalidRequestException("Spare part already exists with part number: " + request.getPartNumber());
        }
    }

    @Cacheable(value = "spareParts", key = "#sparePartId")
    @Transactional(readOnly = true)
    public SparePart getPart(UUID sparePartId) {
        return sparePartRepository.findById(sparePartId)
                .orElseThrow(() -> new ResourceNotFoundException("Spare part not found with ID: " + sparePartId));
    }

    public boolean hasStockRecord(UUID sparePartId, String storeId) {
        return stockLevelRepository.findBySparePartIdAndStoreId(sparePartId, storeId).isPresent();
    }

    /**
     * Adds received units to a store, creating the stock record on first receipt.
     */
    public StockAvailabilityDTO receiveStock(UUID sparePartId, StockReceiptRequestDTO receipt) {
        sparePartRepository.findById(sparePartId)
                .orElseThrow(() -> new ResourceNotFoundException("Spare part not found with ID: " + sparePartId));

        OffsetDateTime now = OffsetDateTime.now(clock);
        StockLevel level = stockLevelRepository.findForUpdate(sparePartId, receipt.getStoreId())
                .orElseGet(() -> stockLevelRepository.saveAndFlush(StockLevel.builder()
                        .sparePartId(sparePartId)
                        .storeId(receipt.getStoreId())
                        .currentStock(0)
                        .damagedStock(0)
                        .updatedAt(now)
                        .build()));

        int previous = level.getCurrentStock();
        level.setCurrentStock(previous + receipt.getQuantity());
        level.setUpdatedAt(now);
        stockLevelRepository.save(level);

        recordMovement(level, MovementType.RECEIPT, receipt.getQuantity(), previous, null, null,
                receipt.getReason() != null ? receipt.getReason() : "Stock receipt", receipt.getReceivedBy(), now);
        availabilityCache.evictAvailability(sparePartId, receipt.getStoreId());

        log.info("Received {} units of part {} at store {}, stock {} -> {}",
                receipt.getQuantity(), sparePartId, receipt.getStoreId(), previous, level.getCurrentStock());
        return toAvailability(level);
    }

    /**
     * Puts issued units back. Damaged units raise both current and damaged stock so they are
     * counted but never issued again.
     */
    public StockLevel returnToStock(UUID sparePartId, String storeId, int quantity, boolean damaged,
                                    UUID requestId, String actor, String reason) {
        StockLevel level = stockLevelRepository.findForUpdate(sparePartId, storeId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "No stock record for part " + sparePartId + " at store " + storeId));

        OffsetDateTime now = OffsetDateTime.now(clock);
        int previous = level.getCurrentStock();
        level.setCurrentStock(previous + quantity);
        if (damaged) {
            level.setDamagedStock(level.getDamagedStock() + quantity);
        }
        level.setUpdatedAt(now);
        stockLevelRepository.save(level);

        recordMovement(level, damaged ? MovementType.DAMAGED : MovementType.RETURN, quantity, previous,
                requestId, null, reason, actor, now);
        availabilityCache.evictAvailability(sparePartId, storeId);
        return level;
    }

    @Transactional(readOnly = true)
    public StockAvailabilityDTO getAvailability(UUID sparePartId, String storeId) {
        Optional<StockAvailabilityDTO> cached = availabilityCache.getCachedAvailability(sparePartId, storeId);
        if (cached.isPresent()) {
            return cached.get();
        }

        StockLevel level = stockLevelRepository.findBySparePartIdAndStoreId(sparePartId, storeId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "No stock record for part " + sparePartId + " at store " + storeId));

        StockAvailabilityDTO availability = toAvailability(level);
        availabilityCache.cacheAvailability(availability);
        return availability;
    }

    public void recordMovement(StockLevel level, MovementType type, int quantity, int previousStock,
                               UUID requestId, UUID reservationId, String reason, String actor, OffsetDateTime at) {
        stockMovementRepository.save(StockMovement.builder()
                .stockLevelId(level.getId())
                .sparePartId(level.getSparePartId())
                .storeId(level.getStoreId())
                .movementType(type)
                .quantity(quantity)
                .previousStock(previousStock)
                .newStock(level.getCurrentStock())
                .requestId(requestId)
                .reservationId(reservationId)
                .reason(reason)
                .createdBy(actor)
                .createdAt(at)
                .build());
    }

    private StockAvailabilityDTO toAvailability(StockLevel level) {
        int reserved = stockReservationRepository.sumQuantityByStatus(
                level.getSparePartId(), level.getStoreId(), ReservationStatus.ACTIVE).intValue();

        return StockAvailabilityDTO.builder()
                .sparePartId(level.getSparePartId())
                .storeId(level.getStoreId())
                .currentStock(level.getCurrentStock())
                .reservedStock(reserved)
                .damagedStock(level.getDamagedStock())
                .availableStock(Math.max(0, level.usableStock() - reserved))
                .build();
    }
}

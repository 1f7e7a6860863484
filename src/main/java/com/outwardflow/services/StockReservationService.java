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

import com.outwardflow.config.OutwardFlowProperties;
import com.outwardflow.dto.ReserveStockRequestDTO;
import com.outwardflow.dto.StockReservationDTO;
import com.outwardflow.entity.MovementType;
import com.outwardflow.entity.RequestStatus;
import com.outwardflow.entity.ReservationStatus;
import com.outwardflow.entity.SparePartRequest;
import com.outwardflow.entity.StockLevel;
import com.outwardflow.entity.StockReservation;
import com.outwardflow.exceptions.InsufficientStockException;
import com.outwardflow.exceptions.InvalidTransitionException;
import com.outwardflow.exceptions.ReservationConflictException;
import com.outwardflow.exceptions.ReservationExpiredException;
import com.outwardflow.exceptions.ResourceNotFoundException;
import com.outwardflow.mapper.OutwardFlowMapper;
import com.outwardflow.repository.SparePartRequestRepository;
import com.outwardflow.repository.StockLevelRepository;
import com.outwardflow.repository.StockReservationRepository;
import com.outwardflow.services.redis.StockAvailabilityCacheService;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Holds stock for approved requests. Available stock for a (part, store) pair is its usable
 * stock minus every ACTIVE hold, computed under the pair's row lock, so concurrent holds can
 * never add up to more than the shelf has.
 */
@Service
@Transactional
@Slf4j
public class StockReservationService {

    static final String REASON_EXPIRED = "EXPIRED";
    static final String REASON_CONSUMED = "ISSUED";

    private final StockReservationRepository reservationRepository;
    private final StockLevelRepository stockLevelRepository;
    private final SparePartRequestRepository requestRepository;
    private final StockLevelService stockLevelService;
    private final StockAvailabilityCacheService availabilityCache;
    private final OutwardFlowMapper mapper;
    private final OutwardFlowProperties properties;
    private final Clock clock;

    public StockReservationService(
            StockReservationRepository reservationRepository,
            StockLevelRepository stockLevelRepository,
            SparePartRequestRepository requestRepository,
            StockLevelService stockLevelService,
            StockAvailabilityCacheService availabilityCache,
            OutwardFlowMapper mapper,
            OutwardFlowProperties properties,
            Clock clock) {
        this.reservationRepository = reservationRepository;
        this.stockLevelRepository = stockLevelRepository;
        this.requestRepository = requestRepository;
        this.stockLevelService = stockLevelService;
        this.availabilityCache = availabilityCache;
        this.mapper = mapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Places a hold if enough stock is available. An empty result means nothing was written.
     * Callers that must not roll back on a shortage use this instead of {@link #reserve}.
     */
    public Optional<StockReservation> tryReserve(UUID requestId, UUID sparePartId, String storeId,
                                                 int quantity, String reservedBy, Duration ttl) {
        Optional<StockLevel> lockedLevel = stockLevelRepository.findForUpdate(sparePartId, storeId);
        if (lockedLevel.isEmpty()) {
            log.warn("No stock record for part {} at store {}, cannot hold {} units for request {}",
                    sparePartId, storeId, quantity, requestId);
            return Optional.empty();
        }

        int available = available(lockedLevel.get());
        if (quantity > available) {
            log.warn("Insufficient stock for request {}: part {} at store {}, requested {}, available {}",
                    requestId, sparePartId, storeId, quantity, available);
            return Optional.empty();
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        StockReservation reservation = reservationRepository.save(StockReservation.builder()
                .requestId(requestId)
                .sparePartId(sparePartId)
                .storeId(storeId)
                .quantity(quantity)
                .reservedBy(reservedBy)
                .reservedAt(now)
                .expiresAt(ttl != null ? now.plus(ttl) : null)
                .status(ReservationStatus.ACTIVE)
                .build());

        availabilityCache.evictAvailability(sparePartId, storeId);
        log.info("Reserved {} units of part {} at store {} for request {} until {}",
                quantity, sparePartId, storeId, requestId, reservation.getExpiresAt());
        return Optional.of(reservation);
    }

    public StockReservation reserve(UUID requestId, UUID sparePartId, String storeId,
                                    int quantity, String reservedBy, Duration ttl) {
        return tryReserve(requestId, sparePartId, storeId, quantity, reservedBy, ttl)
                .orElseThrow(() -> new InsufficientStockException(sparePartId, storeId, quantity,
                        availableStock(sparePartId, storeId).orElse(0)));
    }

    /**
     * Explicit hold for an approved request. An existing ACTIVE hold at the same store is
     * returned as is.
     */
    public StockReservationDTO reserveForRequest(UUID requestId, ReserveStockRequestDTO request) {
        SparePartRequest partRequest = requestRepository.findByIdForUpdate(requestId)
                .orElseThrow(() -> new ResourceNotFoundException("Request not found with ID: " + requestId));

        if (partRequest.getStatus() != RequestStatus.APPROVED) {
            throw new InvalidTransitionException(requestId, partRequest.getStatus(), "reserve stock");
        }

        Optional<StockReservation> existing = findActiveReservation(requestId, request.getStoreId());
        if (existing.isPresent()) {
            log.info("Request {} already holds reservation {} at store {}",
                    requestId, existing.get().getId(), request.getStoreId());
            return mapper.toStockReservationDTO(existing.get());
        }

        Duration ttl = request.getTtlMinutes() != null
                ? Duration.ofMinutes(request.getTtlMinutes())
                : properties.getReservation().getTtl();

        StockReservation reservation = reserve(requestId, partRequest.getSparePartId(), request.getStoreId(),
                partRequest.getRequestedQuantity(), request.getReservedBy(), ttl);

        if (partRequest.getStoreId() == null) {
            partRequest.setStoreId(request.getStoreId());
        }
        partRequest.setAwaitingStock(false);
        requestRepository.save(partRequest);

        return mapper.toStockReservationDTO(reservation);
    }

    /**
     * Releasing an inactive reservation changes nothing.
     */
    public StockReservationDTO release(UUID reservationId, String reason) {
        StockReservation reservation = lockReservation(reservationId);

        if (!reservation.isActive()) {
            log.debug("Reservation {} is already {}, release ignored", reservationId, reservation.getStatus());
            return mapper.toStockReservationDTO(reservation);
        }

        reservation.close(ReservationStatus.RELEASED, OffsetDateTime.now(clock), reason);
        reservationRepository.save(reservation);
        availabilityCache.evictAvailability(reservation.getSparePartId(), reservation.getStoreId());

        log.info("Released reservation {} of request {}: {}", reservationId, reservation.getRequestId(), reason);
        return mapper.toStockReservationDTO(reservation);
    }

    public void releaseAllForRequest(UUID requestId, String reason) {
        for (StockReservation reservation : reservationRepository.findByRequestIdAndStatus(requestId, ReservationStatus.ACTIVE)) {
            release(reservation.getId(), reason);
        }
    }

    /**
     * Turns a hold into an issue: stock is deducted and an ISSUE movement recorded. An expired
     * hold is marked EXPIRED and that change is kept even though the call fails.
     */
    @Transactional(noRollbackFor = ReservationExpiredException.class)
    public StockReservation consume(UUID reservationId, String actor) {
        StockReservation reservation = lockReservation(reservationId);

        if (!reservation.isActive()) {
            throw new ReservationConflictException("Reservation " + reservationId + " is "
                    + reservation.getStatus() + " and cannot be consumed");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (reservation.isExpiredAt(now)) {
            reservation.close(ReservationStatus.EXPIRED, now, REASON_EXPIRED);
            reservationRepository.save(reservation);
            availabilityCache.evictAvailability(reservation.getSparePartId(), reservation.getStoreId());
            log.warn("Reservation {} expired at {}, consume refused", reservationId, reservation.getExpiresAt());
            throw new ReservationExpiredException(reservationId, reservation.getExpiresAt());
        }

        StockLevel level = stockLevelRepository.findForUpdate(reservation.getSparePartId(), reservation.getStoreId())
                .orElseThrow(() -> new IllegalStateException("Stock record missing for active reservation " + reservationId));

        int previous = level.getCurrentStock();
        level.deduct(reservation.getQuantity());
        level.setUpdatedAt(now);
        stockLevelRepository.save(level);

        reservation.close(ReservationStatus.CONSUMED, now, REASON_CONSUMED);
        reservationRepository.save(reservation);

        stockLevelService.recordMovement(level, MovementType.ISSUE, reservation.getQuantity(), previous,
                reservation.getRequestId(), reservation.getId(), "Issued against reservation", actor, now);
        availabilityCache.evictAvailability(reservation.getSparePartId(), reservation.getStoreId());

        log.info("Consumed reservation {}: {} units of part {} at store {}, stock {} -> {}",
                reservationId, reservation.getQuantity(), reservation.getSparePartId(),
                reservation.getStoreId(), previous, level.getCurrentStock());
        return reservation;
    }

    /**
     * Expires one hold if it is still ACTIVE and past its expiry. Runs under the same row
     * lock as release and consume.
     *
     * @return true when the hold was expired by this call
     */
    public boolean expire(UUID reservationId) {
        StockReservation reservation = lockReservation(reservationId);
        OffsetDateTime now = OffsetDateTime.now(clock);

        if (!reservation.isActive() || !reservation.isExpiredAt(now)) {
            return false;
        }

        reservation.close(ReservationStatus.EXPIRED, now, REASON_EXPIRED);
        reservationRepository.save(reservation);
        availabilityCache.evictAvailability(reservation.getSparePartId(), reservation.getStoreId());
        log.info("Expired reservation {} of request {}", reservationId, reservation.getRequestId());
        return true;
    }

    @Transactional(readOnly = true)
    public List<UUID> findExpiredReservationIds() {
        return reservationRepository.findIdsByStatusAndExpiresAtBefore(ReservationStatus.ACTIVE, OffsetDateTime.now(clock));
    }

    @Transactional(readOnly = true)
    public Optional<StockReservation> findActiveReservation(UUID requestId, String storeId) {
        return reservationRepository.findByRequestIdAndStatus(requestId, ReservationStatus.ACTIVE).stream()
                .filter(reservation -> reservation.getStoreId().equals(storeId))
                .findFirst();
    }

    @Transactional(readOnly = true)
    public Optional<UUID> findActiveReservationId(UUID requestId) {
        return reservationRepository.findByRequestIdAndStatus(requestId, ReservationStatus.ACTIVE).stream()
                .map(StockReservation::getId)
                .findFirst();
    }

    @Transactional(readOnly = true)
    public List<StockReservationDTO> getReservations(UUID requestId) {
        return reservationRepository.findByRequestIdOrderByReservedAtAsc(requestId).stream()
                .map(mapper::toStockReservationDTO)
                .collect(Collectors.toList());
    }

    /**
     * Unlocked snapshot, good for display only.
     */
    @Transactional(readOnly = true)
    public Optional<Integer> availableStock(UUID sparePartId, String storeId) {
        return stockLevelRepository.findBySparePartIdAndStoreId(sparePartId, storeId).map(this::available);
    }

    private int available(StockLevel level) {
        long reserved = reservationRepository.sumQuantityByStatus(
                level.getSparePartId(), level.getStoreId(), ReservationStatus.ACTIVE);
        return (int) (level.usableStock() - reserved);
    }

    private StockReservation lockReservation(UUID reservationId) {
        return reservationRepository.findByIdForUpdate(reservationId)
                .orElseThrow(() -> new ResourceNotFoundException("Reservation not found with ID: " + reservationId));
    }
}

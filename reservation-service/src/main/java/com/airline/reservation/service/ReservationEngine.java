package com.airline.reservation.service;

import com.airline.reservation.constants.ReservationConstants;
import com.airline.reservation.dto.FlightEntry;
import com.airline.reservation.dto.FlightSearchCriteria;
import com.airline.reservation.dto.HoldEntry;
import com.airline.reservation.dto.HoldRequest;
import com.airline.reservation.dto.LedgerEntry;
import com.airline.reservation.dto.PurchaseEntry;
import com.airline.reservation.dto.SeatMapEntry;
import com.airline.reservation.exception.HoldNotFoundException;
import com.airline.reservation.exception.PurchaseNotFoundException;
import com.airline.reservation.exception.ReservationException;
import com.airline.reservation.mapper.ReservationMapper;
import com.airline.reservation.model.Flight;
import com.airline.reservation.model.Hold;
import com.airline.reservation.model.Purchase;
import com.airline.reservation.model.SeatSelection;
import com.airline.reservation.repository.HoldRepository;
import com.airline.reservation.repository.PurchaseRepository;
import com.airline.reservation.service.lock.LockOperations;
import com.airline.reservation.util.SeatGridFormatter;
import com.airline.reservation.validator.ReservationValidator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Entry point for every seat transition.
 *
 * Each operation first expires overdue holds, then performs its own transition under the
 * flight lock, then writes a snapshot. Seat statuses are only changed through the ledgers
 * called from here. A failed snapshot never fails an operation that already committed.
 */
@Service
@Slf4j
public class ReservationEngine {

    private final FlightCatalogService catalogService;
    private final HoldRepository holdRepository;
    private final PurchaseRepository purchaseRepository;
    private final LeaseLedger leaseLedger;
    private final PurchaseLedger purchaseLedger;
    private final LockOperations lockOperations;
    private final StateSnapshotService snapshotService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int defaultHoldMinutes;

    public ReservationEngine(
            FlightCatalogService catalogService,
            HoldRepository holdRepository,
            PurchaseRepository purchaseRepository,
            LeaseLedger leaseLedger,
            PurchaseLedger purchaseLedger,
            LockOperations lockOperations,
            StateSnapshotService snapshotService,
            MeterRegistry meterRegistry,
            Clock clock,
            @Value("${reservation.hold.default-ttl-minutes:" + ReservationConstants.DEFAULT_HOLD_TTL_MINUTES + "}")
            int defaultHoldMinutes) {
        this.catalogService = catalogService;
        this.holdRepository = holdRepository;
        this.purchaseRepository = purchaseRepository;
        this.leaseLedger = leaseLedger;
        this.purchaseLedger = purchaseLedger;
        this.lockOperations = lockOperations;
        this.snapshotService = snapshotService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.defaultHoldMinutes = defaultHoldMinutes;
    }

    // ========== Expiry ==========

    /**
     * Expires overdue holds as of the current instant.
     */
    public int sweepExpired() {
        return sweep(clock.instant());
    }

    // ========== Read Operations ==========

    public List<FlightEntry> search(FlightSearchCriteria criteria) {
        sweepExpired();
        return ReservationMapper.toFlightEntryList(catalogService.search(criteria));
    }

    public SeatMapEntry viewSeats(String flightId) {
        sweepExpired();
        Flight flight = catalogService.getFlight(flightId);
        return lockOperations.executeWithLock(flightId, () -> ReservationMapper.toSeatMapEntry(flight));
    }

    public String viewSeatGrid(String flightId) {
        SeatMapEntry seats = viewSeats(flightId);
        return SeatGridFormatter.format(seats.getSeats(), seats.getRows());
    }

    public HoldEntry getHold(String holdId) {
        ReservationValidator.validateHoldId(holdId);
        sweepExpired();
        return ReservationMapper.toEntry(findHoldOrThrow(holdId));
    }

    public PurchaseEntry getPurchase(String purchaseId) {
        ReservationValidator.validatePurchaseId(purchaseId);
        sweepExpired();
        return ReservationMapper.toEntry(findPurchaseOrThrow(purchaseId));
    }

    public LedgerEntry listLedger() {
        sweepExpired();
        return LedgerEntry.builder()
                .holds(ReservationMapper.toHoldEntryList(holdRepository.findAll()))
                .purchases(ReservationMapper.toPurchaseEntryList(purchaseRepository.findAll()))
                .build();
    }

    // ========== Transitions ==========

    public HoldEntry reserve(HoldRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            Instant now = clock.instant();
            sweep(now);

            ReservationValidator.requireHoldRequest(request);
            Flight flight = catalogService.getFlight(request.getFlightId());

            ReservationValidator.validateHoldRequest(request);
            SeatSelection selection = SeatSelection.of(request.getSeats(), request.getCount());
            int holdMinutes = request.getHoldMinutes() != null ? request.getHoldMinutes() : defaultHoldMinutes;
            String customer = request.getCustomer().trim();

            Hold hold = lockOperations.executeWithLock(flight.getFlightId(),
                    () -> leaseLedger.createHold(flight, selection, customer, holdMinutes, now));

            meterRegistry.counter("reservation.hold.total", "result", "success").increment();
            snapshotService.snapshotAfterCommit();
            return ReservationMapper.toEntry(hold);
        } catch (ReservationException e) {
            recordFailure("reservation.hold.total", e);
            throw e;
        } finally {
            sample.stop(Timer.builder("reservation.hold.duration").register(meterRegistry));
        }
    }

    public PurchaseEntry purchase(String holdId) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            ReservationValidator.validateHoldId(holdId);
            Instant now = clock.instant();
            sweep(now);

            Hold hold = findHoldOrThrow(holdId);
            Flight flight = catalogService.getFlight(hold.getFlightId());
            Purchase purchase = lockOperations.executeWithLock(flight.getFlightId(),
                    () -> purchaseLedger.convert(hold, flight, now));

            meterRegistry.counter("reservation.purchase.total", "result", "success").increment();
            snapshotService.snapshotAfterCommit();
            return ReservationMapper.toEntry(purchase);
        } catch (ReservationException e) {
            recordFailure("reservation.purchase.total", e);
            throw e;
        } finally {
            sample.stop(Timer.builder("reservation.purchase.duration").register(meterRegistry));
        }
    }

    public PurchaseEntry cancel(String purchaseId) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            ReservationValidator.validatePurchaseId(purchaseId);
            sweepExpired();

            Purchase purchase = findPurchaseOrThrow(purchaseId);
            Flight flight = catalogService.getFlight(purchase.getFlightId());
            Purchase cancelled = lockOperations.executeWithLock(flight.getFlightId(),
                    () -> purchaseLedger.cancel(purchase, flight));

            meterRegistry.counter("reservation.cancel.total", "result", "success").increment();
            snapshotService.snapshotAfterCommit();
            return ReservationMapper.toEntry(cancelled);
        } catch (ReservationException e) {
            recordFailure("reservation.cancel.total", e);
            throw e;
        } finally {
            sample.stop(Timer.builder("reservation.cancel.duration").register(meterRegistry));
        }
    }

    // ========== Helpers ==========

    private int sweep(Instant now) {
        int expired = leaseLedger.sweepExpired(now);
        if (expired > 0) {
            meterRegistry.counter("reservation.sweep.expired").increment(expired);
            snapshotService.snapshotAfterCommit();
        } else {
            snapshotService.flushPending();
        }
        return expired;
    }

    private Hold findHoldOrThrow(String holdId) {
        return holdRepository.findById(holdId)
                .orElseThrow(() -> new HoldNotFoundException(holdId));
    }

    private Purchase findPurchaseOrThrow(String purchaseId) {
        return purchaseRepository.findById(purchaseId)
                .orElseThrow(() -> new PurchaseNotFoundException(purchaseId));
    }

    private void recordFailure(String counterName, ReservationException e) {
        meterRegistry.counter(counterName, "result", e.getErrorCode().toLowerCase(Locale.ROOT)).increment();
        log.warn("Request rejected: counter={}, code={}, message={}", counterName, e.getErrorCode(), e.getMessage());
    }
}

package com.airline.reservation.service;

import com.airline.reservation.enums.HoldStatus;
import com.airline.reservation.enums.SeatStatus;
import com.airline.reservation.exception.ReservationValidationException;
import com.airline.reservation.exception.SeatOperationException;
import com.airline.reservation.model.Flight;
import com.airline.reservation.model.Hold;
import com.airline.reservation.model.SeatSelection;
import com.airline.reservation.repository.InMemoryFlightRepository;
import com.airline.reservation.repository.InMemoryHoldRepository;
import com.airline.reservation.support.TestFlights;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LeaseLedger")
class LeaseLedgerTest {

    private static final Instant NOW = Instant.parse("2025-02-20T12:00:00Z");

    private InMemoryHoldRepository holdRepository;
    private Flight flight;
    private LeaseLedger leaseLedger;

    @BeforeEach
    void setUp() {
        holdRepository = new InMemoryHoldRepository();
        InMemoryFlightRepository flightRepository = new InMemoryFlightRepository();
        flight = flightRepository.save(TestFlights.sfoToPdx(2));
        leaseLedger = new LeaseLedger(holdRepository, flightRepository, new FlightLockService(1000));
    }

    @Nested
    @DisplayName("createHold")
    class CreateHold {

        @Test
        @DisplayName("holds explicit seats in request order")
        void holdsExplicitSeats() {
            Hold hold = leaseLedger.createHold(flight, SeatSelection.explicit(List.of("2C", "1a")), "alice", 10, NOW);

            assertThat(hold.getHoldId()).matches("H-[0-9a-f]{10}");
            assertThat(hold.getSeats()).containsExactly("2C", "1A");
            assertThat(hold.getStatus()).isEqualTo(HoldStatus.ACTIVE);
            assertThat(hold.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(10)));
            assertThat(flight.getSeatMap().seatsWithStatus(SeatStatus.HELD)).containsExactly("1A", "2C");
            assertThat(holdRepository.findById(hold.getHoldId())).contains(hold);
        }

        @Test
        @DisplayName("auto-assigns the first available seats by row then column")
        void autoAssigns() {
            flight.getSeatMap().set("1A", SeatStatus.PURCHASED);

            Hold hold = leaseLedger.createHold(flight, SeatSelection.autoAssign(3), "bob", 5, NOW);

            assertThat(hold.getSeats()).containsExactly("1B", "1C", "1D");
        }

        @Test
        @DisplayName("rejects a seat outside the layout without changing anything")
        void rejectsInvalidSeat() {
            assertThatThrownBy(() -> leaseLedger.createHold(flight,
                    SeatSelection.explicit(List.of("1A", "9A")), "alice", 10, NOW))
                    .isInstanceOf(ReservationValidationException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "INVALID_SEAT")
                    .hasMessageContaining("9A");

            assertThat(flight.getSeatMap().count(SeatStatus.AVAILABLE)).isEqualTo(12);
            assertThat(holdRepository.findAll()).isEmpty();
        }

        @Test
        @DisplayName("rejects an unavailable seat and reports its status")
        void rejectsUnavailableSeat() {
            flight.getSeatMap().set("1B", SeatStatus.HELD);

            assertThatThrownBy(() -> leaseLedger.createHold(flight,
                    SeatSelection.explicit(List.of("1A", "1B")), "alice", 10, NOW))
                    .isInstanceOf(SeatOperationException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "SEAT_UNAVAILABLE")
                    .hasMessageContaining("1B")
                    .hasMessageContaining("HOLD");

            assertThat(flight.getSeatMap().get("1A")).contains(SeatStatus.AVAILABLE);
        }

        @Test
        @DisplayName("auto-assigns every seat when the count equals availability")
        void holdsExactlyAvailableSeats() {
            Hold hold = leaseLedger.createHold(flight, SeatSelection.autoAssign(12), "bob", 10, NOW);

            assertThat(hold.getSeats()).containsExactly(
                    "1A", "1B", "1C", "1D", "1E", "1F",
                    "2A", "2B", "2C", "2D", "2E", "2F");
            assertThat(flight.getSeatMap().count(SeatStatus.AVAILABLE)).isZero();
            assertThat(flight.getSeatMap().count(SeatStatus.HELD)).isEqualTo(12);
        }

        @Test
        @DisplayName("rejects auto-assign beyond available inventory")
        void rejectsInsufficientInventory() {
            assertThatThrownBy(() -> leaseLedger.createHold(flight, SeatSelection.autoAssign(13), "bob", 10, NOW))
                    .isInstanceOf(SeatOperationException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "INSUFFICIENT_INVENTORY")
                    .hasMessageContaining("Requested=13, available=12");

            assertThat(flight.getSeatMap().count(SeatStatus.AVAILABLE)).isEqualTo(12);
        }
    }

    @Nested
    @DisplayName("sweepExpired")
    class SweepExpired {

        @Test
        @DisplayName("expires holds at or past expiry and frees their seats")
        void expiresDueHolds() {
            Hold due = leaseLedger.createHold(flight, SeatSelection.explicit(List.of("1A")), "a", 1, NOW);
            Hold later = leaseLedger.createHold(flight, SeatSelection.explicit(List.of("1B")), "b", 30, NOW);

            int expired = leaseLedger.sweepExpired(NOW.plus(Duration.ofMinutes(1)));

            assertThat(expired).isEqualTo(1);
            assertThat(due.getStatus()).isEqualTo(HoldStatus.EXPIRED);
            assertThat(later.getStatus()).isEqualTo(HoldStatus.ACTIVE);
            assertThat(flight.getSeatMap().get("1A")).contains(SeatStatus.AVAILABLE);
            assertThat(flight.getSeatMap().get("1B")).contains(SeatStatus.HELD);
        }

        @Test
        @DisplayName("is idempotent for the same instant")
        void idempotent() {
            leaseLedger.createHold(flight, SeatSelection.autoAssign(2), "a", 1, NOW);
            Instant later = NOW.plus(Duration.ofMinutes(5));

            assertThat(leaseLedger.sweepExpired(later)).isEqualTo(1);
            assertThat(leaseLedger.sweepExpired(later)).isZero();
            assertThat(flight.getSeatMap().count(SeatStatus.AVAILABLE)).isEqualTo(12);
        }

        @Test
        @DisplayName("only frees seats that are still held")
        void onlyFreesHeldSeats() {
            Hold hold = leaseLedger.createHold(flight, SeatSelection.explicit(List.of("1A", "1B")), "a", 1, NOW);
            flight.getSeatMap().set("1B", SeatStatus.PURCHASED);

            leaseLedger.sweepExpired(NOW.plus(Duration.ofMinutes(2)));

            assertThat(hold.getStatus()).isEqualTo(HoldStatus.EXPIRED);
            assertThat(flight.getSeatMap().get("1A")).contains(SeatStatus.AVAILABLE);
            assertThat(flight.getSeatMap().get("1B")).contains(SeatStatus.PURCHASED);
        }
    }
}

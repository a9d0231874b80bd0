package com.airline.reservation.mapper;

import com.airline.reservation.dto.FlightEntry;
import com.airline.reservation.dto.HoldEntry;
import com.airline.reservation.dto.PurchaseEntry;
import com.airline.reservation.dto.SeatMapEntry;
import com.airline.reservation.enums.SeatStatus;
import com.airline.reservation.model.Flight;
import com.airline.reservation.model.Hold;
import com.airline.reservation.model.Purchase;
import com.airline.reservation.model.SeatMap;

import java.util.ArrayList;
import java.util.List;

public final class ReservationMapper {

    private ReservationMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static FlightEntry toEntry(Flight flight) {
        if (flight == null) {
            return null;
        }

        return FlightEntry.builder()
                .flightId(flight.getFlightId())
                .departureCity(flight.getDepartureCity())
                .arrivalCity(flight.getArrivalCity())
                .departureAirport(flight.getDepartureAirport())
                .arrivalAirport(flight.getArrivalAirport())
                .departureTime(flight.getDepartureTime())
                .arrivalTime(flight.getArrivalTime())
                .departureDate(flight.getDepartureDate())
                .totalSeats(flight.getSeatMap().size())
                .build();
    }

    public static List<FlightEntry> toFlightEntryList(List<Flight> flights) {
        if (flights == null || flights.isEmpty()) {
            return new ArrayList<>();
        }

        List<FlightEntry> result = new ArrayList<>(flights.size());
        for (Flight flight : flights) {
            result.add(toEntry(flight));
        }
        return result;
    }

    /**
     * Callers must hold the flight lock so the counts and the seat snapshot agree.
     */
    public static SeatMapEntry toSeatMapEntry(Flight flight) {
        SeatMap seatMap = flight.getSeatMap();
        return SeatMapEntry.builder()
                .flightId(flight.getFlightId())
                .rows(seatMap.rows())
                .totalSeats(seatMap.size())
                .availableSeats(seatMap.count(SeatStatus.AVAILABLE))
                .heldSeats(seatMap.count(SeatStatus.HELD))
                .purchasedSeats(seatMap.count(SeatStatus.PURCHASED))
                .seats(seatMap.snapshot())
                .build();
    }

    public static HoldEntry toEntry(Hold hold) {
        if (hold == null) {
            return null;
        }

        return HoldEntry.builder()
                .holdId(hold.getHoldId())
                .flightId(hold.getFlightId())
                .seats(hold.getSeats())
                .customer(hold.getCustomer())
                .expiresAt(hold.getExpiresAt())
                .status(hold.getStatus())
                .build();
    }

    public static PurchaseEntry toEntry(Purchase purchase) {
        if (purchase == null) {
            return null;
        }

        return PurchaseEntry.builder()
                .purchaseId(purchase.getPurchaseId())
                .flightId(purchase.getFlightId())
                .seats(purchase.getSeats())
                .customer(purchase.getCustomer())
                .purchasedAt(purchase.getPurchasedAt())
                .status(purchase.getStatus())
                .build();
    }

    public static List<HoldEntry> toHoldEntryList(List<Hold> holds) {
        List<HoldEntry> result = new ArrayList<>(holds.size());
        for (Hold hold : holds) {
            result.add(toEntry(hold));
        }
        return result;
    }

    public static List<PurchaseEntry> toPurchaseEntryList(List<Purchase> purchases) {
        List<PurchaseEntry> result = new ArrayList<>(purchases.size());
        for (Purchase purchase : purchases) {
            result.add(toEntry(purchase));
        }
        return result;
    }
}

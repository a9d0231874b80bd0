package com.airline.reservation.mapper;

import com.airline.reservation.model.Flight;
import com.airline.reservation.model.Hold;
import com.airline.reservation.model.Purchase;
import com.airline.reservation.model.SeatMap;
import com.airline.reservation.persistence.FlightRecord;
import com.airline.reservation.persistence.HoldRecord;
import com.airline.reservation.persistence.PurchaseRecord;
import com.airline.reservation.persistence.ReservationState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class StateMapper {

    private StateMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ReservationState toState(Collection<Flight> flights,
                                           Collection<Hold> holds,
                                           Collection<Purchase> purchases) {
        Map<String, FlightRecord> flightRecords = new LinkedHashMap<>();
        for (Flight flight : flights) {
            flightRecords.put(flight.getFlightId(), toRecord(flight));
        }

        Map<String, HoldRecord> holdRecords = new LinkedHashMap<>();
        for (Hold hold : holds) {
            holdRecords.put(hold.getHoldId(), toRecord(hold));
        }

        Map<String, PurchaseRecord> purchaseRecords = new LinkedHashMap<>();
        for (Purchase purchase : purchases) {
            purchaseRecords.put(purchase.getPurchaseId(), toRecord(purchase));
        }

        return ReservationState.builder()
                .flights(flightRecords)
                .holds(holdRecords)
                .purchases(purchaseRecords)
                .build();
    }

    public static FlightRecord toRecord(Flight flight) {
        return FlightRecord.builder()
                .id(flight.getFlightId())
                .departureCity(flight.getDepartureCity())
                .arrivalCity(flight.getArrivalCity())
                .departureAirport(flight.getDepartureAirport())
                .arrivalAirport(flight.getArrivalAirport())
                .departureTime(flight.getDepartureTime())
                .arrivalTime(flight.getArrivalTime())
                .departureDate(flight.getDepartureDate())
                .seatMap(flight.getSeatMap().snapshot())
                .build();
    }

    public static HoldRecord toRecord(Hold hold) {
        return HoldRecord.builder()
                .id(hold.getHoldId())
                .flightId(hold.getFlightId())
                .seats(hold.getSeats())
                .customer(hold.getCustomer())
                .expiresAt(hold.getExpiresAt())
                .status(hold.getStatus())
                .build();
    }

    public static PurchaseRecord toRecord(Purchase purchase) {
        return PurchaseRecord.builder()
                .id(purchase.getPurchaseId())
                .flightId(purchase.getFlightId())
                .seats(purchase.getSeats())
                .customer(purchase.getCustomer())
                .purchasedAt(purchase.getPurchasedAt())
                .status(purchase.getStatus())
                .build();
    }

    public static List<Flight> toFlights(ReservationState state) {
        List<Flight> flights = new ArrayList<>();
        for (FlightRecord record : state.getFlights().values()) {
            flights.add(Flight.builder()
                    .flightId(record.getId())
                    .departureCity(record.getDepartureCity())
                    .arrivalCity(record.getArrivalCity())
                    .departureAirport(record.getDepartureAirport())
                    .arrivalAirport(record.getArrivalAirport())
                    .departureTime(record.getDepartureTime())
                    .arrivalTime(record.getArrivalTime())
                    .departureDate(record.getDepartureDate())
                    .seatMap(SeatMap.of(record.getSeatMap()))
                    .build());
        }
        return flights;
    }

    public static List<Hold> toHolds(ReservationState state) {
        List<Hold> holds = new ArrayList<>();
        for (HoldRecord record : state.getHolds().values()) {
            holds.add(Hold.builder()
                    .holdId(record.getId())
                    .flightId(record.getFlightId())
                    .seats(record.getSeats())
                    .customer(record.getCustomer())
                    .expiresAt(record.getExpiresAt())
                    .status(record.getStatus())
                    .build());
        }
        return holds;
    }

    public static List<Purchase> toPurchases(ReservationState state) {
        List<Purchase> purchases = new ArrayList<>();
        for (PurchaseRecord record : state.getPurchases().values()) {
            purchases.add(Purchase.builder()
                    .purchaseId(record.getId())
                    .flightId(record.getFlightId())
                    .seats(record.getSeats())
                    .customer(record.getCustomer())
                    .purchasedAt(record.getPurchasedAt())
                    .status(record.getStatus())
                    .build());
        }
        return purchases;
    }
}

package com.airline.reservation.repository;

import com.airline.reservation.model.Purchase;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage for purchases. Purchases are never deleted.
 */
public interface PurchaseRepository {

    Purchase save(Purchase purchase);

    Optional<Purchase> findById(String purchaseId);

    List<Purchase> findAll();

    void replaceAll(Collection<Purchase> purchases);
}

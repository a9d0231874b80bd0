package com.airline.reservation.repository;

import com.airline.reservation.model.Purchase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of PurchaseRepository.
 */
@Repository
@Slf4j
public class InMemoryPurchaseRepository implements PurchaseRepository {

    private final Map<String, Purchase> purchasesById = new ConcurrentHashMap<>();

    @Override
    public Purchase save(Purchase purchase) {
        log.debug("Saving purchase: id={}, flightId={}", purchase.getPurchaseId(), purchase.getFlightId());
        purchasesById.put(purchase.getPurchaseId(), purchase);
        return purchase;
    }

    @Override
    public Optional<Purchase> findById(String purchaseId) {
        if (purchaseId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(purchasesById.get(purchaseId));
    }

    @Override
    public List<Purchase> findAll() {
        List<Purchase> purchases = new ArrayList<>(purchasesById.values());
        purchases.sort(Comparator.comparing(Purchase::getPurchasedAt).thenComparing(Purchase::getPurchaseId));
        return purchases;
    }

    @Override
    public void replaceAll(Collection<Purchase> purchases) {
        purchasesById.clear();
        for (Purchase purchase : purchases) {
            purchasesById.put(purchase.getPurchaseId(), purchase);
        }
    }
}

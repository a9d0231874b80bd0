package com.airline.reservation.repository;

import com.airline.reservation.model.Hold;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@Slf4j
public class InMemoryHoldRepository implements HoldRepository {

    private final Map<String, Hold> holdsById = new ConcurrentHashMap<>();

    @Override
    public Hold save(Hold hold) {
        log.debug("Saving hold: id={}, flightId={}", hold.getHoldId(), hold.getFlightId());
        holdsById.put(hold.getHoldId(), hold);
        return hold;
    }

    @Override
    public Optional<Hold> findById(String holdId) {
        if (holdId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(holdsById.get(holdId));
    }

    @Override
    public List<Hold> findAll() {
        List<Hold> holds = new ArrayList<>(holdsById.values());
        holds.sort(Comparator.comparing(Hold::getExpiresAt).thenComparing(Hold::getHoldId));
        return holds;
    }

    @Override
    public List<Hold> findActiveExpiredAt(Instant now) {
        List<Hold> expired = new ArrayList<>();
        for (Hold hold : holdsById.values()) {
            if (hold.isActive() && hold.isExpiredAt(now)) {
                expired.add(hold);
            }
        }
        return expired;
    }

    @Override
    public void replaceAll(Collection<Hold> holds) {
        holdsById.clear();
        for (Hold hold : holds) {
            holdsById.put(hold.getHoldId(), hold);
        }
    }
}

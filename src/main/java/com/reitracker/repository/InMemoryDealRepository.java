package com.reitracker.repository;

import com.reitracker.domain.model.DealSpec;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * Process-local {@link DealRepository}. Deals are immutable, so the map holds them directly
 * and concurrent readers never see a partially updated deal.
 */
@Repository
public class InMemoryDealRepository implements DealRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDealRepository.class);

    private final Map<String, DealSpec> deals = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryDealRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public DealSpec save(DealSpec deal) {
        DealSpec toStore = deal.getId() == null ? deal.withId(UUID.randomUUID().toString()) : deal;
        DealSpec stored = toStore.touch(LocalDateTime.now(clock));
        deals.put(stored.getId(), stored);
        log.debug("Saved {} deal {}", stored.getAnalysisType(), stored.getId());
        return stored;
    }

    @Override
    public Optional<DealSpec> findById(String id) {
        return Optional.ofNullable(deals.get(id));
    }

    @Override
    public List<DealSpec> findByUserId(String userId) {
        return deals.values().stream()
                .filter(d -> userId.equals(d.getProfile().getUserId()))
                .sorted(Comparator.comparing(d -> d.getProfile().getCreatedAt()))
                .toList();
    }

    @Override
    public List<DealSpec> findAll() {
        return new ArrayList<>(deals.values());
    }

    @Override
    public void delete(String id) {
        deals.remove(id);
    }
}

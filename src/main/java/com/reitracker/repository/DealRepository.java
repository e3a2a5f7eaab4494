package com.reitracker.repository;

import com.reitracker.domain.model.DealSpec;
import java.util.List;
import java.util.Optional;

/**
 * Storage port for deals, keyed by deal id.
 *
 * <p>{@link #save(DealSpec)} returns the stored instance, which carries the assigned id
 * and refreshed timestamps; callers should continue with that instance.
 */
public interface DealRepository {

    DealSpec save(DealSpec deal);

    Optional<DealSpec> findById(String id);

    List<DealSpec> findByUserId(String userId);

    List<DealSpec> findAll();

    void delete(String id);
}

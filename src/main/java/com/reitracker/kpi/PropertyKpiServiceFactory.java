package com.reitracker.kpi;

import com.reitracker.domain.model.PropertyFacts;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Builds a {@link PropertyKpiService} over a fixed set of properties.
 *
 * <p>The property list is indexed by id once, at build time. The resulting service is
 * immutable and scoped to the caller's request; this factory is the long-lived bean.
 */
@Component
public class PropertyKpiServiceFactory {

    private final KpiCategoryConfig kpiCategoryConfig;
    private final Clock clock;

    public PropertyKpiServiceFactory(KpiCategoryConfig kpiCategoryConfig, Clock clock) {
        this.kpiCategoryConfig = kpiCategoryConfig;
        this.clock = clock;
    }

    /**
     * @param properties acquisition facts of the properties the caller may query; ids must be unique
     * @throws IllegalStateException if two entries share a property id
     */
    public PropertyKpiService forProperties(List<PropertyFacts> properties) {
        Map<String, PropertyFacts> propertiesById = properties.stream()
                .collect(Collectors.toUnmodifiableMap(PropertyFacts::getPropertyId, Function.identity()));
        return new PropertyKpiService(propertiesById, kpiCategoryConfig, clock);
    }
}

package org.geoingest.adapters;

import lombok.extern.slf4j.Slf4j;
import org.geoingest.exception.ConfigurationException;
import org.geoingest.models.domain.DataSource;
import org.geoingest.models.enums.DataSourceCategory;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps every source category to exactly one collector. Built once and read-only afterwards.
 */
@Slf4j
public class CollectorRegistry {

    private final Map<DataSourceCategory, Collector> collectors;

    public CollectorRegistry(List<? extends Collector> available) {
        Map<DataSourceCategory, Collector> byCategory = new EnumMap<>(DataSourceCategory.class);
        for (Collector collector : available) {
            for (DataSourceCategory category : collector.categories()) {
                Collector previous = byCategory.putIfAbsent(category, collector);
                if (previous != null) {
                    throw new ConfigurationException("Category " + category + " is claimed by both "
                            + previous.getClass().getSimpleName() + " and " + collector.getClass().getSimpleName());
                }
            }
        }
        this.collectors = Collections.unmodifiableMap(byCategory);
        log.info("Collector registry covers {} categories with {} collectors", byCategory.size(), available.size());
    }

    public Optional<Collector> find(DataSourceCategory category) {
        return Optional.ofNullable(collectors.get(category));
    }

    public Collector require(DataSourceCategory category) {
        return find(category)
                .orElseThrow(() -> new ConfigurationException("No collector registered for category " + category));
    }

    public Set<DataSourceCategory> registeredCategories() {
        return collectors.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(collectors.keySet()));
    }

    /**
     * Fails when any of the given sources has a category without a collector, naming every
     * uncovered category and the affected sources.
     */
    public void validateCoverage(Collection<DataSource> sources) {
        Set<DataSourceCategory> missing = EnumSet.noneOf(DataSourceCategory.class);
        Set<String> affected = new TreeSet<>();
        for (DataSource source : sources) {
            if (!collectors.containsKey(source.getCategory())) {
                missing.add(source.getCategory());
                affected.add(source.getName());
            }
        }
        if (!missing.isEmpty()) {
            throw new ConfigurationException("No collector registered for categories " + missing
                    + " used by sources " + affected);
        }
    }
}

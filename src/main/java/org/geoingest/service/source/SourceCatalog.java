package org.geoingest.service.source;

import org.geoingest.models.domain.DataSource;

import java.util.List;

/**
 * Bulk source definitions used to seed the registry.
 */
public interface SourceCatalog {

    List<DataSource> loadSources();
}

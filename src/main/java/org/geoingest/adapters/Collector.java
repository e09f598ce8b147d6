package org.geoingest.adapters;

import org.geoingest.exception.CollectorException;
import org.geoingest.models.domain.DataSource;
import org.geoingest.models.domain.RawDataRecord;
import org.geoingest.models.enums.DataSourceCategory;

import java.util.List;
import java.util.Set;

/**
 * Network access for one or more source categories. Implementations enforce their own call
 * timeouts and must tolerate being invoked repeatedly for the same source; duplicate records
 * across calls are accepted downstream.
 */
public interface Collector {

    Set<DataSourceCategory> categories();

    List<RawDataRecord> collectData(DataSource source) throws CollectorException;

    boolean validateConnection(DataSource source) throws CollectorException;

    List<String> getAvailableParameters(DataSource source) throws CollectorException;

    /** Rough size in bytes of one collection, for capacity planning only. */
    long estimateDataVolume(DataSource source) throws CollectorException;
}

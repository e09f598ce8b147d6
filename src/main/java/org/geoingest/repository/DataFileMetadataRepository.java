package org.geoingest.repository;

import org.geoingest.models.entity.DataFileMetadata;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface DataFileMetadataRepository extends JpaRepository<DataFileMetadata, UUID>,
        JpaSpecificationExecutor<DataFileMetadata> {

    @Query("select f.filePath from DataFileMetadata f")
    List<String> findAllFilePaths();

    @Query("""
            select coalesce(sum(f.recordCount), 0L) as totalRecords,
                   count(f) as fileCount,
                   coalesce(sum(f.fileSize), 0L) as totalSize,
                   coalesce(sum(f.compressedSize), 0L) as compressedSize,
                   min(f.timeRangeStart) as oldestRecord,
                   max(f.timeRangeEnd) as newestRecord,
                   count(distinct f.sourceId) as sourceCount
            from DataFileMetadata f
            """)
    StorageTotals aggregateTotals();

    interface StorageTotals {
        long getTotalRecords();

        long getFileCount();

        long getTotalSize();

        long getCompressedSize();

        Instant getOldestRecord();

        Instant getNewestRecord();

        long getSourceCount();
    }
}

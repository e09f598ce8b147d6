package org.geoingest.models.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "data_file_metadata", indexes = {
        @Index(name = "idx_data_file_metadata_source", columnList = "source_id"),
        @Index(name = "idx_data_file_metadata_time_range", columnList = "time_range_start, time_range_end")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@ToString
public class DataFileMetadata {
    @Id
    @Column(name = "file_id", nullable = false)
    @EqualsAndHashCode.Include
    private UUID fileId;

    @Column(name = "source_id", nullable = false)
    private UUID sourceId;

    @Column(name = "file_path", nullable = false, length = 1024)
    private String filePath;

    @Column(name = "file_size", nullable = false)
    private long fileSize;

    @Column(name = "compressed_size", nullable = false)
    private long compressedSize;

    @Column(name = "record_count", nullable = false)
    private long recordCount;

    @Column(name = "checksum", nullable = false, length = 64)
    private String checksum;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "time_range_start", nullable = false)
    private Instant timeRangeStart;

    @Column(name = "time_range_end", nullable = false)
    private Instant timeRangeEnd;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "data_file_parameter", joinColumns = @JoinColumn(name = "file_id"))
    @Column(name = "parameter", nullable = false)
    private Set<String> parameters = new LinkedHashSet<>();
}

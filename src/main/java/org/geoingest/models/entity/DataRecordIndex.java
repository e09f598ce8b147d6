package org.geoingest.models.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "data_record_index", indexes = {
        @Index(name = "idx_data_record_index_source_time", columnList = "source_id, record_timestamp"),
        @Index(name = "idx_data_record_index_file", columnList = "file_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@ToString
public class DataRecordIndex {
    @Id
    @Column(name = "record_id", nullable = false)
    @EqualsAndHashCode.Include
    private UUID recordId;

    @Column(name = "source_id", nullable = false)
    private UUID sourceId;

    @Column(name = "record_timestamp", nullable = false)
    private Instant timestamp;

    @Column(name = "file_id", nullable = false)
    private UUID fileId;

    @Column(name = "file_path", nullable = false, length = 1024)
    private String filePath;

    @Column(name = "parameters")
    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> parameters;
}

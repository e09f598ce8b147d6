package org.geoingest.controllers;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.geoingest.exception.CollectorException;
import org.geoingest.models.domain.RawDataRecord;
import org.geoingest.models.dto.CollectionResultDTO;
import org.geoingest.models.dto.DataSourceDTO;
import org.geoingest.models.dto.RawDataQuery;
import org.geoingest.models.dto.ScheduledTaskDTO;
import org.geoingest.models.dto.SchedulerStats;
import org.geoingest.models.dto.StatusUpdateRequest;
import org.geoingest.models.dto.StorageStats;
import org.geoingest.service.IngestionCoordinator;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/ingestion")
@RequiredArgsConstructor
public class IngestionController {

    private final IngestionCoordinator coordinator;

    @GetMapping("/sources")
    public ResponseEntity<List<DataSourceDTO>> listSources() {
        return ResponseEntity.ok(coordinator.listSources().stream().map(DataSourceDTO::from).toList());
    }

    @GetMapping("/sources/{id}")
    public ResponseEntity<DataSourceDTO> getSource(@PathVariable UUID id) {
        return ResponseEntity.ok(DataSourceDTO.from(coordinator.getSource(id)));
    }

    @PostMapping("/sources")
    public ResponseEntity<DataSourceDTO> registerSource(@Valid @RequestBody DataSourceDTO dto) {
        DataSourceDTO registered = DataSourceDTO.from(coordinator.registerSource(dto.toDomain()));
        return ResponseEntity.status(HttpStatus.CREATED).body(registered);
    }

    @PutMapping("/sources/{id}/status")
    public ResponseEntity<DataSourceDTO> updateStatus(@PathVariable UUID id,
                                                      @Valid @RequestBody StatusUpdateRequest request) {
        return ResponseEntity.ok(DataSourceDTO.from(coordinator.updateSourceStatus(id, request.status())));
    }

    @PostMapping("/sources/{id}/collect")
    public ResponseEntity<CollectionResultDTO> collect(@PathVariable UUID id) throws CollectorException {
        return ResponseEntity.ok(CollectionResultDTO.from(coordinator.collectFromSource(id)));
    }

    @PostMapping("/sources/{id}/force")
    public ResponseEntity<ScheduledTaskDTO> forceCollection(@PathVariable UUID id) {
        return ResponseEntity.ok(ScheduledTaskDTO.from(coordinator.forceCollection(id)));
    }

    @PostMapping("/sources/{id}/resume")
    public ResponseEntity<ScheduledTaskDTO> resume(@PathVariable UUID id) {
        return ResponseEntity.ok(ScheduledTaskDTO.from(coordinator.resumeSource(id)));
    }

    @GetMapping("/sources/{id}/parameters")
    public ResponseEntity<List<String>> availableParameters(@PathVariable UUID id) throws CollectorException {
        return ResponseEntity.ok(coordinator.getAvailableParameters(id));
    }

    @GetMapping("/sources/{id}/connection")
    public ResponseEntity<Map<String, Object>> validateConnection(@PathVariable UUID id) throws CollectorException {
        boolean reachable = coordinator.validateConnection(id);
        long estimate = coordinator.estimateDataVolume(id);
        return ResponseEntity.ok(Map.of("reachable", reachable, "estimatedBytes", estimate));
    }

    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start() {
        coordinator.startIngestion();
        return ResponseEntity.ok(Map.of("running", coordinator.isRunning()));
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        coordinator.stopIngestion();
        return ResponseEntity.ok(Map.of("running", coordinator.isRunning()));
    }

    @GetMapping("/tasks")
    public ResponseEntity<List<ScheduledTaskDTO>> listTasks() {
        return ResponseEntity.ok(coordinator.listTasks().stream().map(ScheduledTaskDTO::from).toList());
    }

    @GetMapping("/stats/scheduler")
    public ResponseEntity<SchedulerStats> schedulerStats() {
        return ResponseEntity.ok(coordinator.getSchedulerStats());
    }

    @GetMapping("/stats/storage")
    public ResponseEntity<StorageStats> storageStats() {
        return ResponseEntity.ok(coordinator.getStorageStats());
    }

    @GetMapping("/records")
    public ResponseEntity<List<RawDataRecord>> queryRecords(
            @RequestParam(value = "sourceId", required = false) UUID sourceId,
            @RequestParam(value = "start", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(value = "end", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @RequestParam(value = "parameter", required = false) List<String> parameters,
            @RequestParam(value = "limit", required = false) Integer limit) {
        RawDataQuery query = new RawDataQuery(sourceId, start, end, parameters, limit);
        return ResponseEntity.ok(coordinator.queryRawData(query));
    }

    @GetMapping("/records/{id}")
    public ResponseEntity<RawDataRecord> getRecord(@PathVariable UUID id) {
        return coordinator.findRecord(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/storage/reclaim")
    public ResponseEntity<Map<String, Object>> reclaimOrphans() {
        return ResponseEntity.ok(Map.of("reclaimed", coordinator.reclaimOrphans()));
    }
}

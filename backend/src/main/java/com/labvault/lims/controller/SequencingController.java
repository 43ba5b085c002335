package com.labvault.lims.controller;

import com.labvault.lims.dto.RunMetadata;
import com.labvault.lims.dto.SequencingImportRequest;
import com.labvault.lims.dto.SequencingImportResult;
import com.labvault.lims.dto.SequencingRowInput;
import com.labvault.lims.exception.AmbiguousSequencingRunException;
import com.labvault.lims.exception.SequencingRunNotFoundException;
import com.labvault.lims.service.SequencingImportService;
import com.labvault.lims.service.SequencingPreviewService;
import com.labvault.lims.service.SequencingRunLifecycleService;
import com.labvault.lims.service.SequencingRunQueryService;
import com.labvault.lims.service.SequencingSheetReader;
import com.labvault.lims.util.CompletionDateParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/sequencing")
public class SequencingController {
    private static final Logger log = LoggerFactory.getLogger(SequencingController.class);

    private final SequencingImportService importService;
    private final SequencingRunQueryService queryService;
    private final SequencingRunLifecycleService lifecycleService;
    private final SequencingPreviewService previewService;
    private final SequencingSheetReader sheetReader;

    public SequencingController(SequencingImportService importService,
                                SequencingRunQueryService queryService,
                                SequencingRunLifecycleService lifecycleService,
                                SequencingPreviewService previewService,
                                SequencingSheetReader sheetReader) {
        this.importService = importService;
        this.queryService = queryService;
        this.lifecycleService = lifecycleService;
        this.previewService = previewService;
        this.sheetReader = sheetReader;
    }

    @PostMapping(value = "/import", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> importRows(@RequestBody SequencingImportRequest request,
                                        @RequestHeader(value = "X-User-Id", required = false) String userId) {
        try {
            if (request == null || request.run() == null) {
                return ResponseEntity.badRequest().body(Map.of("error", "Run metadata is required"));
            }
            SequencingImportResult result = importService.importSequencingData(request.rows(), request.run(), userId);
            return ResponseEntity.ok(result);
        } catch (Exception ex) {
            return failure("Failed to import sequencing data", ex);
        }
    }

    @PostMapping(value = "/import/csv", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> importCsv(@RequestParam("file") MultipartFile file,
                                       @RequestParam(value = "service_request_number", required = false) String serviceRequestNumber,
                                       @RequestParam(value = "flowcell_id", required = false) String flowcellId,
                                       @RequestParam(value = "pool_name", required = false) String poolName,
                                       @RequestParam(value = "completion_date", required = false) String completionDate,
                                       @RequestParam(value = "sequencer_type", required = false) String sequencerType,
                                       @RequestParam(value = "base_directory", required = false) String baseDirectory,
                                       @RequestParam(value = "file_pattern_r1", required = false) String filePatternR1,
                                       @RequestParam(value = "file_pattern_r2", required = false) String filePatternR2,
                                       @RequestParam(value = "library_type", required = false) String libraryType,
                                       @RequestHeader(value = "X-User-Id", required = false) String userId) {
        try {
            List<SequencingRowInput> rows = readSheet(file);
            if (libraryType != null && !libraryType.isBlank()) {
                rows.forEach(r -> r.setLibraryType(libraryType.trim()));
            }

            RunMetadata metadata = new RunMetadata(serviceRequestNumber, flowcellId, baseDirectory);
            metadata.setPoolName(poolName);
            metadata.setSequencerType(sequencerType);
            metadata.setFilePatternR1(filePatternR1);
            metadata.setFilePatternR2(filePatternR2);
            // Explicit date wins; otherwise the sheet's first row
            String rawDate = (completionDate != null && !completionDate.isBlank()) ? completionDate : rows.get(0).getDateComplete();
            metadata.setCompletionDate(CompletionDateParser.parse(rawDate));

            SequencingImportResult result = importService.importSequencingData(rows, metadata, userId);
            return ResponseEntity.ok(result);
        } catch (Exception ex) {
            return failure("Failed to import sequencing data", ex);
        }
    }

    @PostMapping(value = "/preview", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> preview(@RequestParam("file") MultipartFile file) {
        try {
            return ResponseEntity.ok(previewService.preview(readSheet(file)));
        } catch (Exception ex) {
            return failure("Failed to preview sequencing data", ex);
        }
    }

    @GetMapping("/runs")
    public ResponseEntity<?> listRuns() {
        try {
            return ResponseEntity.ok(queryService.getSequencingRuns());
        } catch (Exception ex) {
            return failure("Failed to fetch sequencing runs", ex);
        }
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<?> getRun(@PathVariable("runId") Long runId) {
        try {
            return queryService.getSequencingRun(runId)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Sequencing run not found")));
        } catch (Exception ex) {
            return failure("Failed to fetch sequencing run", ex);
        }
    }

    @GetMapping("/runs/{runId}/samples")
    public ResponseEntity<?> getRunSamples(@PathVariable("runId") Long runId) {
        try {
            return ResponseEntity.ok(queryService.getRunSequencingSamples(runId));
        } catch (Exception ex) {
            return failure("Failed to fetch sequencing samples", ex);
        }
    }

    @DeleteMapping("/runs/{runId}")
    public ResponseEntity<?> deleteRun(@PathVariable("runId") Long runId,
                                       @RequestHeader(value = "X-User-Id", required = false) String userId) {
        try {
            lifecycleService.deleteSequencingRun(runId, userId);
            return ResponseEntity.ok(Map.of("message", "Sequencing run deleted successfully"));
        } catch (Exception ex) {
            return failure("Failed to delete sequencing run", ex);
        }
    }

    @GetMapping("/specimen/{specimenId}")
    public ResponseEntity<?> getSpecimenData(@PathVariable("specimenId") Long specimenId) {
        try {
            return ResponseEntity.ok(queryService.getSpecimenSequencingData(specimenId));
        } catch (Exception ex) {
            return failure("Failed to fetch specimen sequencing data", ex);
        }
    }

    private List<SequencingRowInput> readSheet(MultipartFile file) throws java.io.IOException {
        if (file == null || file.isEmpty()) throw new IllegalArgumentException("No file uploaded");
        List<SequencingRowInput> rows = sheetReader.read(file.getInputStream());
        if (rows.isEmpty()) throw new IllegalArgumentException("No data found in file");
        return rows;
    }

    private ResponseEntity<?> failure(String error, Exception ex) {
        if (ex instanceof IllegalArgumentException) {
            return ResponseEntity.badRequest().body(Map.of("error", messageOf(ex)));
        }
        if (ex instanceof SequencingRunNotFoundException) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Sequencing run not found"));
        }
        if (ex instanceof AmbiguousSequencingRunException) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", messageOf(ex)));
        }
        log.error("[Sequencing] {}", error, ex);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("details", ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private static String messageOf(Exception ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}

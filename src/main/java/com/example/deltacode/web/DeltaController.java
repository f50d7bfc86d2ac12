package com.example.deltacode.web;

import com.example.deltacode.application.DeltaComparisonUseCase;
import com.example.deltacode.application.InventoryReader;
import com.example.deltacode.domain.ComparisonRequest;
import com.example.deltacode.domain.InventoryException;
import com.example.deltacode.domain.Report;
import com.example.deltacode.domain.ScoringConfig;
import com.example.deltacode.domain.Snapshot;
import com.example.deltacode.infrastructure.ReportJsonWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;

@RestController
@RequestMapping("/api")
public class DeltaController {
    private static final Logger log = LogManager.getLogger(DeltaController.class);

    private final DeltaComparisonUseCase deltaComparisonUseCase;
    private final InventoryReader inventoryReader;
    private final MultipartSnapshotInputAdapter snapshotInputAdapter;
    private final ReportJsonWriter reportJsonWriter;
    private final ScoringConfig scoringConfig;

    public DeltaController(
            DeltaComparisonUseCase deltaComparisonUseCase,
            InventoryReader inventoryReader,
            MultipartSnapshotInputAdapter snapshotInputAdapter,
            ReportJsonWriter reportJsonWriter,
            ScoringConfig scoringConfig) {
        this.deltaComparisonUseCase = deltaComparisonUseCase;
        this.inventoryReader = inventoryReader;
        this.snapshotInputAdapter = snapshotInputAdapter;
        this.reportJsonWriter = reportJsonWriter;
        this.scoringConfig = scoringConfig;
    }

    @PostMapping(
            value = "/deltas",
            consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public String compare(
            @RequestParam("old") MultipartFile oldInventory,
            @RequestParam("new") MultipartFile newInventory,
            @RequestParam(name = "includeUnmodified", defaultValue = "true") boolean includeUnmodified,
            @RequestParam(name = "explain", defaultValue = "false") boolean explain,
            @RequestParam(name = "contextSize", defaultValue = "3") int contextSize)
            throws IOException {
        log.info(
                "Comparing {} with {}",
                snapshotInputAdapter.describeFilename(oldInventory),
                snapshotInputAdapter.describeFilename(newInventory));
        try {
            Snapshot oldSnapshot = inventoryReader.read(snapshotInputAdapter.adapt("old", oldInventory));
            Snapshot newSnapshot = inventoryReader.read(snapshotInputAdapter.adapt("new", newInventory));
            Report report =
                    deltaComparisonUseCase.compare(
                            new ComparisonRequest(
                                    oldSnapshot,
                                    newSnapshot,
                                    scoringConfig,
                                    includeUnmodified,
                                    explain,
                                    contextSize));
            return reportJsonWriter.write(report);
        } catch (InventoryException | IllegalArgumentException ex) {
            log.warn("Rejected comparison request: {}", ex.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }
}

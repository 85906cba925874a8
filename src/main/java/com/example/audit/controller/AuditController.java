package com.example.audit.controller;

import com.example.audit.error.AuditCancelledException;
import com.example.audit.model.AuditInput;
import com.example.audit.model.AuditReport;
import com.example.audit.model.StrategyOutcome;
import com.example.audit.service.ContractAuditService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST controller for contract audits.
 */
@RestController
@RequestMapping("/api")
public class AuditController {

    private static final Logger log = LoggerFactory.getLogger(AuditController.class);

    private final ContractAuditService auditService;

    public AuditController(ContractAuditService auditService) {
        this.auditService = auditService;
    }

    /**
     * Audits the supplied contracts and returns the full report.
     *
     * <p>Endpoint: POST /api/audit
     * <p>Content-Type: application/json
     */
    @PostMapping(value = "/audit", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> audit(@RequestBody AuditInput input) {
        if (input.contracts().isBlank()) {
            return badRequest("No contracts supplied. The 'contracts' field is required.");
        }

        log.info("Received audit request ({} characters)", input.contracts().length());
        try {
            AuditReport report = auditService.audit(input);
            return ResponseEntity.ok()
                    .headers(responseHeaders(report))
                    .body(report);
        } catch (AuditCancelledException e) {
            log.warn("Audit cancelled: {}", e.getMessage());
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Audit cancelled", "message", e.getMessage()));
        } catch (Exception e) {
            log.error("Error during audit", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of(
                            "error", "Error during audit",
                            "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
                    ));
        }
    }

    /**
     * Audits the supplied contracts and returns only the findings array.
     *
     * <p>Endpoint: POST /api/audit/findings
     */
    @PostMapping(value = "/audit/findings", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> auditFindings(@RequestBody AuditInput input) {
        if (input.contracts().isBlank()) {
            return badRequest("No contracts supplied. The 'contracts' field is required.");
        }

        try {
            AuditReport report = auditService.audit(input);
            return ResponseEntity.ok()
                    .headers(responseHeaders(report))
                    .body(report.findings());
        } catch (Exception e) {
            log.error("Error during audit", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of(
                            "error", "Error during audit",
                            "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
                    ));
        }
    }

    /**
     * Reports the configured strategies.
     *
     * <p>Endpoint: GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "service", "Contract-Audit-Agent",
                "strategies", auditService.strategyNames()
        ));
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }

    private HttpHeaders responseHeaders(AuditReport report) {
        HttpHeaders h = new HttpHeaders();
        h.set("X-Audit-Raw-Findings", String.valueOf(report.rawFindings()));
        h.set("X-Audit-Merged-Findings", String.valueOf(report.totalFindings()));
        String failed = report.strategies().stream()
                .filter(o -> !o.succeeded())
                .map(StrategyOutcome::strategy)
                .collect(Collectors.joining(","));
        h.set("X-Audit-Failed-Strategies", failed);
        return h;
    }
}

package com.example.reference_oracle.controller;

import com.example.reference_oracle.error.OracleException;
import com.example.reference_oracle.error.StateStorageException;
import com.example.reference_oracle.model.ExecutionContext;
import com.example.reference_oracle.model.RateRecord;
import com.example.reference_oracle.model.ReferenceData;
import com.example.reference_oracle.model.RelayBatch;
import com.example.reference_oracle.service.ReferenceDataService;
import io.swagger.v3.oas.annotations.Hidden;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Tag(name = "Reference Oracle API", description = "Relayers publish rate batches; consumers read stored refs and cross-rates")
public class ReferenceDataController {

    public static final String RELAYER_HEADER = "X-Relayer";

    private static final Logger log = LoggerFactory.getLogger(ReferenceDataController.class);

    private final ReferenceDataService referenceDataService;
    private final Clock clock;

    public ReferenceDataController(ReferenceDataService referenceDataService, Clock clock) {
        this.referenceDataService = referenceDataService;
        this.clock = clock;
    }

    // --- Relayer Endpoint ---

    @Operation(summary = "Relay Rates", description = "Applies a batch of rate updates atomically. The four arrays must have equal length; index i across them describes one symbol.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Batch applied"),
            @ApiResponse(responseCode = "400", description = "Arrays differ in length or a value is out of range"),
            @ApiResponse(responseCode = "403", description = "Sender is not an allowed relayer")
    })
    @PostMapping("/relay")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void relay(
            @Parameter(description = "Identity of the relaying sender")
            @RequestHeader(value = RELAYER_HEADER, required = false) String sender,
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "Parallel arrays of symbols, rates, resolve times and request ids",
                    required = true
            )
            @RequestBody(required = false) RelayBatch batch) {
        RelayBatch input = batch == null ? new RelayBatch(null, null, null, null) : batch;
        referenceDataService.relay(input, ExecutionContext.of(sender, clock));
    }

    // --- Consumer Endpoints ---

    @Operation(summary = "Get All Refs", description = "Returns every stored rate record keyed by symbol.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Snapshot of the store",
                    content = { @Content(mediaType = "application/json", schema = @Schema(implementation = RateRecord.class)) })
    })
    @GetMapping("/refs")
    public Map<String, RateRecord> getAllRefs() {
        return referenceDataService.getAllRefs();
    }

    @Operation(summary = "Get Ref", description = "Returns the stored rate record for a symbol. USD is not stored.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Record found",
                    content = { @Content(mediaType = "application/json", schema = @Schema(implementation = RateRecord.class)) }),
            @ApiResponse(responseCode = "404", description = "Symbol not registered", content = @Content)
    })
    @GetMapping("/refs/{symbol}")
    public ResponseEntity<RateRecord> getRef(
            @Parameter(description = "Symbol, case sensitive (e.g., ETH)", required = true)
            @PathVariable String symbol) {
        return referenceDataService.getRef(symbol)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Get Reference Data", description = "Price of base in quote scaled by 1e18, with the last update time of each side.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Cross-rate computed",
                    content = { @Content(mediaType = "application/json", schema = @Schema(implementation = ReferenceData.class)) }),
            @ApiResponse(responseCode = "404", description = "Base or quote symbol not registered", content = @Content),
            @ApiResponse(responseCode = "409", description = "Symbol registered but never resolved", content = @Content),
            @ApiResponse(responseCode = "422", description = "Quote rate is zero", content = @Content)
    })
    @GetMapping("/reference-data")
    public ReferenceData getReferenceData(
            @Parameter(description = "Base symbol (e.g., ETH)", required = true) @RequestParam String base,
            @Parameter(description = "Quote symbol (e.g., USD)", required = true) @RequestParam String quote) {
        return referenceDataService.getReferenceData(base, quote, ExecutionContext.of(null, clock));
    }

    @ExceptionHandler(OracleException.class)
    @Hidden
    public ResponseEntity<Map<String, String>> handleOracleException(OracleException ex) {
        HttpStatus status = switch (ex.getCode()) {
            case MISMATCHED_BATCH_LENGTH -> HttpStatus.BAD_REQUEST;
            case UNKNOWN_SYMBOL -> HttpStatus.NOT_FOUND;
            case REF_DATA_NOT_AVAILABLE -> HttpStatus.CONFLICT;
            case DIVISION_BY_ZERO -> HttpStatus.UNPROCESSABLE_ENTITY;
            case UNAUTHORIZED_RELAYER -> HttpStatus.FORBIDDEN;
        };
        return ResponseEntity.status(status)
                .body(Map.of("error", ex.getCode().name(), "message", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    @Hidden
    public Map<String, String> handleBadRequest(IllegalArgumentException ex) {
        return Map.of("error", "INVALID_ARGUMENT", "message", ex.getMessage() == null ? "invalid_request" : ex.getMessage());
    }

    @ExceptionHandler(StateStorageException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    @Hidden
    public Map<String, String> handleStorageFailure(StateStorageException ex) {
        log.error("Reference state unavailable", ex);
        return Map.of("error", "STATE_STORAGE", "message", ex.getMessage());
    }
}

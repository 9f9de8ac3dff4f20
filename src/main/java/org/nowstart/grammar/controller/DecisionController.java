package org.nowstart.grammar.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.nowstart.grammar.data.dto.BarRequest;
import org.nowstart.grammar.data.dto.FrictionRequest;
import org.nowstart.grammar.data.dto.SessionResetResult;
import org.nowstart.grammar.data.entity.LedgerEvent;
import org.nowstart.grammar.data.property.LockedDoctrine;
import org.nowstart.grammar.engine.core.BarDecision;
import org.nowstart.grammar.engine.core.ExecutionFriction;
import org.nowstart.grammar.engine.core.InstrumentSummary;
import org.nowstart.grammar.engine.core.PersistenceRecord;
import org.nowstart.grammar.engine.core.PositionExit;
import org.nowstart.grammar.engine.core.PositionSnapshot;
import org.nowstart.grammar.engine.core.ZoneOutcomeEvent;
import org.nowstart.grammar.service.BarDecisionService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/decision")
@Tag(name = "Decision", description = "Bar ingestion, certification state, positions and pipeline control")
public class DecisionController {

    private final BarDecisionService barDecisionService;

    public DecisionController(BarDecisionService barDecisionService) {
        this.barDecisionService = barDecisionService;
    }

    @PostMapping("/instruments/{instrument}/bars")
    @Operation(summary = "Process bar", description = "Feeds one closed bar to the instrument pipeline and returns the decision.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Bar processed"),
            @ApiResponse(responseCode = "400", description = "Request validation failed"),
            @ApiResponse(responseCode = "404", description = "Unknown instrument"),
            @ApiResponse(responseCode = "409", description = "Pipeline halted"),
            @ApiResponse(responseCode = "422", description = "Corrupt bar, pipeline halted")
    })
    public BarDecision processBar(@PathVariable String instrument, @RequestBody @Valid BarRequest request) {
        return barDecisionService.process(instrument, request.toBar());
    }

    @PutMapping("/instruments/{instrument}/friction")
    @Operation(summary = "Update friction", description = "Replaces the modelled slippage, spread and latency used by the policy.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Friction updated"),
            @ApiResponse(responseCode = "400", description = "Request validation failed"),
            @ApiResponse(responseCode = "404", description = "Unknown instrument")
    })
    public ExecutionFriction updateFriction(@PathVariable String instrument, @RequestBody @Valid FrictionRequest request) {
        return barDecisionService.updateFriction(instrument, request.toFriction());
    }

    @PostMapping("/instruments/{instrument}/flatten")
    @Operation(summary = "Flatten", description = "Cancels every tracked position at the last close without ledger write-back.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Positions cancelled"),
            @ApiResponse(responseCode = "404", description = "Unknown instrument")
    })
    public List<PositionExit> flatten(@PathVariable String instrument) {
        return barDecisionService.flatten(instrument);
    }

    @PostMapping("/instruments/{instrument}/acknowledge")
    @Operation(summary = "Acknowledge halt", description = "Resumes a pipeline halted by a corrupt bar.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Pipeline running"),
            @ApiResponse(responseCode = "404", description = "Unknown instrument")
    })
    public InstrumentSummary acknowledge(@PathVariable String instrument) {
        return barDecisionService.acknowledge(instrument);
    }

    @PostMapping("/instruments/{instrument}/session-reset")
    @Operation(summary = "Session reset", description = "Clears zone records, retry book and ignition history at a session boundary.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session reset"),
            @ApiResponse(responseCode = "404", description = "Unknown instrument")
    })
    public SessionResetResult resetSession(@PathVariable String instrument) {
        return barDecisionService.resetSession(instrument);
    }

    @GetMapping("/instruments/{instrument}/zones")
    @Operation(summary = "Zone records", description = "Current persistence record of every zone with outcomes.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Lookup succeeded"),
            @ApiResponse(responseCode = "404", description = "Unknown instrument")
    })
    public List<PersistenceRecord> getZones(@PathVariable String instrument) {
        return barDecisionService.zones(instrument);
    }

    @GetMapping("/instruments/{instrument}/ledger")
    @Operation(summary = "Ledger events", description = "Outcome events of the current session in append order.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Lookup succeeded"),
            @ApiResponse(responseCode = "404", description = "Unknown instrument")
    })
    public List<ZoneOutcomeEvent> getLedger(@PathVariable String instrument) {
        return barDecisionService.ledgerEvents(instrument);
    }

    @GetMapping("/instruments/{instrument}/journal")
    @Operation(summary = "Ledger journal", description = "Persisted outcome events across sessions.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Lookup succeeded"),
            @ApiResponse(responseCode = "404", description = "Unknown instrument")
    })
    public List<LedgerEvent> getJournal(@PathVariable String instrument) {
        return barDecisionService.journalHistory(instrument);
    }

    @GetMapping("/instruments/{instrument}/positions")
    @Operation(summary = "Positions", description = "Live and shadow positions currently tracked.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Lookup succeeded"),
            @ApiResponse(responseCode = "404", description = "Unknown instrument")
    })
    public List<PositionSnapshot> getPositions(@PathVariable String instrument) {
        return barDecisionService.positions(instrument);
    }

    @GetMapping("/summaries")
    @Operation(summary = "Summaries", description = "Immutable per-instrument status snapshots.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Lookup succeeded")
    })
    public List<InstrumentSummary> getSummaries() {
        return barDecisionService.summaries();
    }

    @GetMapping("/doctrine")
    @Operation(summary = "Locked doctrine", description = "Versioned constants the engine runs with.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Lookup succeeded")
    })
    public LockedDoctrine getDoctrine() {
        return barDecisionService.doctrine();
    }
}

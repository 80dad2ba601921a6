package org.nowstart.intraday.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.nowstart.intraday.data.dto.BarDecision;
import org.nowstart.intraday.data.dto.MarketBarRequest;
import org.nowstart.intraday.data.dto.PerformanceMetrics;
import org.nowstart.intraday.data.dto.PerformanceSummary;
import org.nowstart.intraday.data.dto.PortfolioValueRequest;
import org.nowstart.intraday.data.dto.TickRequest;
import org.nowstart.intraday.data.dto.TradeRecord;
import org.nowstart.intraday.service.IntradayStrategyService;
import org.nowstart.intraday.strategy.core.PositionSnapshot;
import org.nowstart.intraday.strategy.core.RiskSnapshot;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/strategy")
@Tag(name = "Strategy", description = "Bar/tick event intake, day and run boundaries, state queries")
public class StrategyController {

    private final IntradayStrategyService strategyService;

    public StrategyController(IntradayStrategyService strategyService) {
        this.strategyService = strategyService;
    }

    @PostMapping("/bars")
    @Operation(summary = "Consolidated bar", description = "Evaluates one consolidated bar and returns the entry/exit decision.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Evaluated (or skipped during warm-up)"),
            @ApiResponse(responseCode = "400", description = "Request validation failed"),
            @ApiResponse(responseCode = "422", description = "Out-of-order event or invalid portfolio/sizing data")
    })
    public BarDecision onBar(@RequestBody @Valid MarketBarRequest request) {
        return strategyService.onBar(request.toEvent());
    }

    @PostMapping("/ticks")
    @Operation(summary = "Tick", description = "Refreshes the OBV baseline from a finer-grained tick.")
    public ResponseEntity<Void> onTick(@RequestBody @Valid TickRequest request) {
        strategyService.onTick(request.toEvent());
        return ResponseEntity.status(HttpStatus.ACCEPTED).build();
    }

    @PostMapping("/day-end")
    @Operation(summary = "Day boundary", description = "Emits daily metrics and resets the daily P&L.")
    public PerformanceMetrics onEndOfDay(@RequestBody @Valid PortfolioValueRequest request) {
        return strategyService.onEndOfDay(request.portfolioValue(), request.timestamp());
    }

    @PostMapping("/run-end")
    @Operation(summary = "Run end", description = "Computes and emits the final performance summary.")
    public PerformanceSummary onRunEnd(@RequestBody @Valid PortfolioValueRequest request) {
        return strategyService.onRunEnd(request.portfolioValue());
    }

    @GetMapping("/position")
    @Operation(summary = "Position", description = "Current FLAT/OPEN state and trade counters.")
    public PositionSnapshot getPosition() {
        return strategyService.currentPosition();
    }

    @GetMapping("/risk")
    @Operation(summary = "Risk state", description = "Peak value, drawdown, daily P&L and consecutive losses.")
    public RiskSnapshot getRisk() {
        return strategyService.currentRisk();
    }

    @GetMapping("/metrics")
    @Operation(summary = "Metrics snapshot", description = "Running performance metrics at the given portfolio value.")
    public PerformanceMetrics getMetrics(@RequestParam("portfolioValue") double portfolioValue) {
        return strategyService.currentMetrics(portfolioValue);
    }

    @GetMapping("/trades")
    @Operation(summary = "Trade log", description = "Append-only ENTRY/EXIT audit trail.")
    public List<TradeRecord> getTrades() {
        return strategyService.tradeLog();
    }
}

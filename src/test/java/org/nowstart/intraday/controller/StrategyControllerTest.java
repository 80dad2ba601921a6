package org.nowstart.intraday.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.intraday.data.dto.BarDecision;
import org.nowstart.intraday.data.dto.EntryDecision;
import org.nowstart.intraday.data.dto.MarketBarEvent;
import org.nowstart.intraday.data.dto.MarketBarRequest;
import org.nowstart.intraday.data.dto.PerformanceMetrics;
import org.nowstart.intraday.data.dto.PerformanceSummary;
import org.nowstart.intraday.data.dto.PortfolioValueRequest;
import org.nowstart.intraday.data.dto.TickEvent;
import org.nowstart.intraday.data.dto.TickRequest;
import org.nowstart.intraday.data.dto.TradeRecord;
import org.nowstart.intraday.data.type.PositionStatus;
import org.nowstart.intraday.service.IntradayStrategyService;
import org.nowstart.intraday.strategy.core.PositionSnapshot;
import org.nowstart.intraday.strategy.core.RiskSnapshot;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class StrategyControllerTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private IntradayStrategyService strategyService;

    @InjectMocks
    private StrategyController controller;

    @Test
    void onBar_convertsRequestAndReturnsDecision() {
        MarketBarRequest request = new MarketBarRequest(T0, 100.0, 99.0, 25.0, 1000.0, null, null, 1000.0, false, false);
        BarDecision decision = BarDecision.entry(T0, new EntryDecision("BTCUSD", 0.99));
        when(strategyService.onBar(any(MarketBarEvent.class))).thenReturn(decision);

        BarDecision result = controller.onBar(request);

        assertThat(result).isEqualTo(decision);
        ArgumentCaptor<MarketBarEvent> captor = ArgumentCaptor.forClass(MarketBarEvent.class);
        verify(strategyService).onBar(captor.capture());
        assertThat(captor.getValue().snapshot().close()).isEqualTo(100.0);
        assertThat(captor.getValue().portfolioValue()).isEqualTo(1000.0);
    }

    @Test
    void onTick_returnsAccepted() {
        var response = controller.onTick(new TickRequest(T0, 1200.0, false));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        verify(strategyService).onTick(new TickEvent(T0, 1200.0, false));
    }

    @Test
    void onEndOfDay_delegatesToService() {
        PerformanceMetrics metrics = new PerformanceMetrics(T0, 1000.0, 1, 1, 1, 0, 0.0, 0, 9.9);
        when(strategyService.onEndOfDay(1000.0, T0)).thenReturn(metrics);

        assertThat(controller.onEndOfDay(new PortfolioValueRequest(T0, 1000.0))).isEqualTo(metrics);
    }

    @Test
    void onRunEnd_delegatesToService() {
        PerformanceSummary summary = new PerformanceSummary(
                0, 0, 0, 0, 0.0, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, 1000.0, 0.0, 0
        );
        when(strategyService.onRunEnd(1000.0)).thenReturn(summary);

        assertThat(controller.onRunEnd(new PortfolioValueRequest(null, 1000.0))).isEqualTo(summary);
    }

    @Test
    void stateQueries_delegateToService() {
        PositionSnapshot position = new PositionSnapshot(PositionStatus.FLAT, Double.NaN, null, Double.NaN, 0, 0, 0);
        RiskSnapshot risk = new RiskSnapshot(1000.0, 0.0, 0.0, 0.0, 0);
        PerformanceMetrics metrics = new PerformanceMetrics(T0, 1000.0, 0, 0, 0, 0, 0.0, 0, 0.0);
        List<TradeRecord> trades = List.of(TradeRecord.entry("BTCUSD", 0.99, 100.0, T0, 1, 1000.0));
        when(strategyService.currentPosition()).thenReturn(position);
        when(strategyService.currentRisk()).thenReturn(risk);
        when(strategyService.currentMetrics(1000.0)).thenReturn(metrics);
        when(strategyService.tradeLog()).thenReturn(trades);

        assertThat(controller.getPosition()).isEqualTo(position);
        assertThat(controller.getRisk()).isEqualTo(risk);
        assertThat(controller.getMetrics(1000.0)).isEqualTo(metrics);
        assertThat(controller.getTrades()).isEqualTo(trades);
    }
}

package com.tradestmt.application.service;

import com.tradestmt.domain.model.AmortizationResult;
import com.tradestmt.domain.model.MergedRecord;
import com.tradestmt.domain.model.MergedTable;
import com.tradestmt.domain.model.TradeRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AmortizationEngine
 */
class AmortizationEngineTest {

    private static final double EPSILON = 1e-9;
    private static final LocalDate TRADE_DATE = LocalDate.of(2024, 1, 1);

    private AmortizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new AmortizationEngine();
    }

    @Test
    void compute_halfYearExample() {
        // 182 days = 5.9836 months elapsed
        TradeRecord trade = trade(1200.0, TRADE_DATE, 30.0);

        AmortizationResult result = engine.compute(trade, -500.0, LocalDate.of(2024, 7, 1));

        assertTrue(result.isComputed());
        assertEquals(1200.0 * (12 - 182.0 / 365 * 12) / 12, result.adjustedPnl(), EPSILON);
        assertEquals(601.64, result.adjustedPnl(), 0.01);
        assertEquals(101.64, result.combinedValue(), 0.01);
        assertEquals(81.64, result.bid(), 0.01);
        assertEquals(111.64, result.offer(), 0.01);
    }

    @Test
    void compute_missingPnlLeavesEveryFieldEmpty() {
        AmortizationResult result = engine.compute(trade(null, TRADE_DATE, 30.0), -500.0, LocalDate.of(2024, 7, 1));

        assertFalse(result.isComputed());
        assertNull(result.adjustedPnl());
        assertNull(result.combinedValue());
        assertNull(result.bid());
        assertNull(result.offer());
    }

    @Test
    void compute_missingTradeDateLeavesEveryFieldEmpty() {
        AmortizationResult result = engine.compute(trade(1200.0, null, 30.0), 0.0, LocalDate.of(2024, 7, 1));

        assertNull(result.adjustedPnl());
        assertNull(result.combinedValue());
        assertNull(result.bid());
        assertNull(result.offer());
    }

    @Test
    void compute_fullyAmortizedAfterTwelveMonths() {
        TradeRecord trade = trade(1200.0, TRADE_DATE, 30.0);

        assertEquals(0.0, engine.compute(trade, 0.0, TRADE_DATE.plusDays(365)).adjustedPnl());
        assertEquals(0.0, engine.compute(trade, 0.0, TRADE_DATE.plusDays(400)).adjustedPnl());
        assertEquals(0.0, engine.compute(trade, 0.0, TRADE_DATE.plusYears(5)).adjustedPnl());
    }

    @Test
    void compute_adjustedPnlNeverIncreasesAsDateAdvances() {
        TradeRecord trade = trade(1200.0, TRADE_DATE, 30.0);

        double previous = Double.MAX_VALUE;
        for (int day = 0; day <= 400; day += 7) {
            double adjusted = engine.compute(trade, 0.0, TRADE_DATE.plusDays(day)).adjustedPnl();
            assertTrue(adjusted <= previous, "day " + day);
            previous = adjusted;
        }
    }

    @Test
    void compute_onTradeDateKeepsFullPnl() {
        AmortizationResult result = engine.compute(trade(1200.0, TRADE_DATE, 0.0), 0.0, TRADE_DATE);

        assertEquals(1200.0, result.adjustedPnl(), EPSILON);
    }

    @Test
    void compute_asOfBeforeTradeDateIsCappedAtFullPnl() {
        AmortizationResult result = engine.compute(trade(1200.0, TRADE_DATE, 0.0), 0.0, TRADE_DATE.minusDays(90));

        assertEquals(1200.0, result.adjustedPnl(), EPSILON);
    }

    @Test
    void compute_negativePnlIsFlooredAtZero() {
        AmortizationResult result = engine.compute(trade(-1200.0, TRADE_DATE, 30.0), 100.0, LocalDate.of(2024, 3, 1));

        assertEquals(0.0, result.adjustedPnl());
        assertEquals(100.0, result.combinedValue(), EPSILON);
    }

    @Test
    void compute_offerMinusBidEqualsSpread() {
        double[] spreads = {0.0, 1.0, 30.0, 12.5, 0.003};
        for (double spread : spreads) {
            AmortizationResult result = engine.compute(trade(950.0, TRADE_DATE, spread), -42.0, LocalDate.of(2024, 5, 17));
            assertEquals(spread, result.offer() - result.bid(), EPSILON);
            assertEquals(result.combinedValue() - 2.0 / 3.0 * spread, result.bid(), EPSILON);
            assertEquals(result.combinedValue() + 1.0 / 3.0 * spread, result.offer(), EPSILON);
        }
    }

    @Test
    void compute_combinedValueIsSignedPvPlusAdjustedPnl() {
        AmortizationResult result = engine.compute(trade(800.0, TRADE_DATE, 10.0), -250.5, LocalDate.of(2024, 9, 30));

        assertEquals(-250.5 + result.adjustedPnl(), result.combinedValue(), 0.0);
    }

    @Test
    void compute_missingSpreadCountsAsZero() {
        AmortizationResult result = engine.compute(trade(1200.0, TRADE_DATE, null), 0.0, TRADE_DATE);

        assertEquals(result.combinedValue(), result.bid());
        assertEquals(result.combinedValue(), result.offer());
    }

    @Test
    void computeAll_fillsEveryRowAndKeepsOrder() {
        MergedTable table = new MergedTable(List.of("TRADEIDENTIFIER"), List.of(
                merged(trade(1200.0, TRADE_DATE, 30.0), -500.0),
                merged(trade(null, TRADE_DATE, 30.0), 0.0)
        ));

        MergedTable computed = engine.computeAll(table, LocalDate.of(2024, 7, 1));

        assertEquals(2, computed.getRecords().size());
        assertEquals(101.64, computed.getRecords().get(0).getCombinedValue(), 0.01);
        assertNull(computed.getRecords().get(1).getCombinedValue());
        assertEquals(1, computed.computedCount());
        // The input table is not modified
        assertNull(table.getRecords().get(0).getCombinedValue());
    }

    private static MergedRecord merged(TradeRecord trade, double signedPv) {
        return MergedRecord.builder().trade(trade).signedPv(signedPv).matched(true).build();
    }

    private static TradeRecord trade(Double pnl, LocalDate tradeDate, Double spread) {
        return TradeRecord.builder()
                .tradeIdentifier("T000001")
                .tradeDate(tradeDate)
                .pnl(pnl)
                .spread(spread)
                .fundId("FUND-A")
                .build();
    }
}

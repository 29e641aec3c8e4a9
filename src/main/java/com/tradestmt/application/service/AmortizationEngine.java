package com.tradestmt.application.service;

import com.tradestmt.domain.model.AmortizationResult;
import com.tradestmt.domain.model.MergedRecord;
import com.tradestmt.domain.model.MergedTable;
import com.tradestmt.domain.model.TradeRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Straight-line amortization of P&L over twelve months from trade date, plus bid/offer.
 *
 * <pre>
 * months    = calendarDays(tradeDate, asOfDate) / 365 * 12
 * adjusted  = max(0, pnl * clamp((12 - months) / 12, 0, 1))
 * combined  = signedPv + adjusted
 * bid       = combined - 2/3 * spread
 * offer     = combined + 1/3 * spread
 * </pre>
 *
 * A trade dated after the as-of date keeps its full P&L. No rounding here; that is a rendering concern.
 */
@Slf4j
public class AmortizationEngine {

    static final double DAYS_PER_YEAR = 365.0;
    static final double HORIZON_MONTHS = 12.0;
    static final double BID_SHARE = 2.0 / 3.0;
    static final double OFFER_SHARE = 1.0 / 3.0;

    /**
     * @return all four fields, or {@link AmortizationResult#empty()} when P&L or trade date is missing
     */
    public AmortizationResult compute(TradeRecord record, double signedPv, LocalDate asOfDate) {
        if (!record.isAmortizable()) {
            return AmortizationResult.empty();
        }

        double adjustedPnl = Math.max(0.0, record.getPnl() * remainingFraction(record.getTradeDate(), asOfDate));
        double combinedValue = signedPv + adjustedPnl;
        double spread = record.getSpread() == null ? 0.0 : record.getSpread();

        return new AmortizationResult(
                adjustedPnl,
                combinedValue,
                combinedValue - BID_SHARE * spread,
                combinedValue + OFFER_SHARE * spread
        );
    }

    /**
     * Apply {@link #compute} to every row of a merged table
     */
    public MergedTable computeAll(MergedTable table, LocalDate asOfDate) {
        List<MergedRecord> computed = new ArrayList<>(table.getRecords().size());
        int skipped = 0;
        for (MergedRecord record : table.getRecords()) {
            AmortizationResult result = compute(record.getTrade(), record.getSignedPv(), asOfDate);
            if (!result.isComputed()) {
                skipped++;
                log.debug("Trade {} has no P&L or trade date; derived fields left empty",
                        record.getTrade().getTradeIdentifier());
            }
            computed.add(record.withAmortization(result));
        }

        log.info("Amortized {} trades as of {} ({} without P&L or trade date)",
                computed.size() - skipped, asOfDate, skipped);
        return table.withRecords(computed);
    }

    /**
     * Share of the P&L still unamortized, within [0, 1]
     */
    static double remainingFraction(LocalDate tradeDate, LocalDate asOfDate) {
        double monthsElapsed = ChronoUnit.DAYS.between(tradeDate, asOfDate) / DAYS_PER_YEAR * HORIZON_MONTHS;
        double fraction = (HORIZON_MONTHS - monthsElapsed) / HORIZON_MONTHS;
        return Math.min(1.0, Math.max(0.0, fraction));
    }
}

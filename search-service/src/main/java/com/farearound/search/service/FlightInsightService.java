package com.farearound.search.service;

import com.farearound.search.constants.SearchConstants;
import com.farearound.search.dto.FlightInsight;
import com.farearound.search.dto.FlightOffer;
import com.farearound.search.enums.Recommendation;
import com.farearound.search.exception.NoPricesException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Book-or-wait advice for a set of flight offers.
 *
 * Rules:
 * - within a week of departure: BOOK
 * - best fare at or below 88% of the median fare: BOOK
 * - otherwise: WAIT
 * Confidence grows closer to departure and with a deal, shrinks when fares are widely spread.
 */
@Service
@Slf4j
public class FlightInsightService {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal DEAL_THRESHOLD = new BigDecimal(SearchConstants.DEAL_THRESHOLD);

    static final String REASON_CLOSE_TO_DEPARTURE =
            "Close to departure: prices often rise in the final week. Booking now reduces risk.";
    static final String REASON_DEAL =
            "This fare is significantly cheaper than other options right now. Lock it in.";
    static final String REASON_EARLY =
            "Still early: prices often improve closer to departure. Set an alert and recheck in a few days.";

    public FlightInsight computeInsight(List<FlightOffer> offers, LocalDate departureDate, LocalDate today) {
        List<PricePoint> points = extractPricePoints(offers);
        if (points.isEmpty()) {
            throw new NoPricesException();
        }

        PricePoint best = points.stream()
                .min(Comparator.comparing(PricePoint::total))
                .orElseThrow();
        BigDecimal median = median(points);

        long daysToDeparture = Math.max(ChronoUnit.DAYS.between(today, departureDate), 0);

        BigDecimal spread = BigDecimal.ZERO;
        boolean deal = false;
        if (median.signum() > 0) {
            spread = median.subtract(best.total()).divide(median, MathContext.DECIMAL64);
            deal = best.total().compareTo(median.multiply(DEAL_THRESHOLD)) <= 0;
        }

        Recommendation recommendation;
        String reason;
        if (daysToDeparture <= SearchConstants.CLOSE_TO_DEPARTURE_DAYS) {
            recommendation = Recommendation.BOOK;
            reason = REASON_CLOSE_TO_DEPARTURE;
        } else if (deal) {
            recommendation = Recommendation.BOOK;
            reason = REASON_DEAL;
        } else {
            recommendation = Recommendation.WAIT;
            reason = REASON_EARLY;
        }

        double confidence = confidence(daysToDeparture, deal, spread.doubleValue());

        log.debug("Insight: best={} {}, median={}, days={}, deal={}, recommendation={}",
                best.total(), best.currency(), median, daysToDeparture, deal, recommendation);

        return FlightInsight.builder()
                .bestPrice(best.total())
                .currency(best.currency())
                .recommendation(recommendation)
                .reason(reason)
                .confidence(confidence)
                .build();
    }

    private double confidence(long daysToDeparture, boolean deal, double spread) {
        double confidence = SearchConstants.BASE_CONFIDENCE;
        if (daysToDeparture <= SearchConstants.CLOSE_TO_DEPARTURE_DAYS) {
            confidence += 0.20;
        } else if (daysToDeparture <= SearchConstants.MID_RANGE_DEPARTURE_DAYS) {
            confidence += 0.10;
        }
        if (deal) {
            confidence += 0.10;
        }
        if (spread >= 0.18) {
            confidence -= 0.08;
        }
        if (spread <= 0.06) {
            confidence += 0.05;
        }
        return Math.max(SearchConstants.MIN_CONFIDENCE, Math.min(SearchConstants.MAX_CONFIDENCE, confidence));
    }

    private List<PricePoint> extractPricePoints(List<FlightOffer> offers) {
        List<PricePoint> points = new ArrayList<>();
        if (offers == null) {
            return points;
        }
        for (FlightOffer offer : offers) {
            BigDecimal total = parseDecimal(offer.getTotal());
            if (total == null || total.signum() <= 0 || !StringUtils.hasText(offer.getCurrency())) {
                continue;
            }
            points.add(new PricePoint(total, offer.getCurrency().trim()));
        }
        return points;
    }

    private static BigDecimal median(List<PricePoint> points) {
        List<BigDecimal> totals = points.stream()
                .map(PricePoint::total)
                .sorted()
                .toList();
        int mid = totals.size() / 2;
        if (totals.size() % 2 == 1) {
            return totals.get(mid);
        }
        return totals.get(mid - 1).add(totals.get(mid)).divide(TWO);
    }

    private static BigDecimal parseDecimal(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private record PricePoint(BigDecimal total, String currency) {
    }
}

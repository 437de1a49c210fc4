package com.farearound.search.service;

import com.farearound.search.client.UpstreamClient;
import com.farearound.search.constants.SearchConstants;
import com.farearound.search.dto.FlightInsight;
import com.farearound.search.dto.FlightOffers;
import com.farearound.search.dto.FlightQuery;
import com.farearound.search.dto.FlightSearchParams;
import com.farearound.search.dto.FlightSearchRequest;
import com.farearound.search.dto.FlightSearchResponse;
import com.farearound.search.dto.HotelSearchParams;
import com.farearound.search.dto.HotelSearchRequest;
import com.farearound.search.util.StringUtils;
import com.farearound.search.validator.SearchValidator;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Travel search service.
 *
 * Validates and normalizes caller queries into typed upstream parameters, then delegates to
 * {@link UpstreamClient}. Upstream and authentication errors propagate unchanged.
 */
@Service
@Slf4j
public class SearchService {

    private final UpstreamClient upstreamClient;
    private final FlightInsightService insightService;
    private final Clock clock;
    private final String currencyCode;

    public SearchService(
            UpstreamClient upstreamClient,
            FlightInsightService insightService,
            Clock clock,
            @Value("${upstream.currency-code:" + SearchConstants.DEFAULT_CURRENCY_CODE + "}") String currencyCode) {
        this.upstreamClient = upstreamClient;
        this.insightService = insightService;
        this.clock = clock;
        this.currencyCode = currencyCode;
    }

    public FlightSearchResponse searchFlights(FlightSearchRequest request) {
        FlightSearchParams params = toFlightParams(request);

        log.info("Flight search: {} -> {} on {}, adults={}, nonStop={}",
                params.getOriginLocationCode(), params.getDestinationLocationCode(),
                params.getDepartureDate(), params.getAdults(), params.isNonStop());

        FlightOffers offers = upstreamClient.searchFlights(params);

        log.info("Flight search complete: {} offers", offers.getCount());

        return FlightSearchResponse.builder()
                .query(FlightQuery.builder()
                        .origin(params.getOriginLocationCode())
                        .destination(params.getDestinationLocationCode())
                        .departureDate(params.getDepartureDate())
                        .adults(params.getAdults())
                        .nonStop(params.isNonStop())
                        .build())
                .count(offers.getCount())
                .offers(offers.getOffers())
                .build();
    }

    public JsonNode searchHotels(HotelSearchRequest request) {
        SearchValidator.validateHotelSearch(request);

        HotelSearchParams params = HotelSearchParams.builder()
                .cityCode(StringUtils.normalizeLocationCode(request.getCityCode()))
                .checkInDate(request.getCheckIn())
                .checkOutDate(request.getCheckOut())
                .build();

        log.info("Hotel search: city={}, {} to {}",
                params.getCityCode(), params.getCheckInDate(), params.getCheckOutDate());

        return upstreamClient.searchHotels(params);
    }

    public FlightInsight getFlightInsight(FlightSearchRequest request) {
        FlightSearchParams params = toFlightParams(request);
        FlightOffers offers = upstreamClient.searchFlights(params);
        return insightService.computeInsight(offers.getOffers(), params.getDepartureDate(), LocalDate.now(clock));
    }

    private FlightSearchParams toFlightParams(FlightSearchRequest request) {
        SearchValidator.validateFlightSearch(request, LocalDate.now(clock));

        return FlightSearchParams.builder()
                .originLocationCode(StringUtils.normalizeLocationCode(request.getOrigin()))
                .destinationLocationCode(StringUtils.normalizeLocationCode(request.getDestination()))
                .departureDate(request.getDepartureDate())
                .adults(request.getAdults())
                .nonStop(Boolean.TRUE.equals(request.getNonStop()))
                .max(request.getMax())
                .currencyCode(currencyCode)
                .build();
    }
}

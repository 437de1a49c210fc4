package com.farearound.search.controller.v1;

import com.farearound.search.constants.SearchConstants;
import com.farearound.search.dto.FlightInsight;
import com.farearound.search.dto.FlightSearchRequest;
import com.farearound.search.dto.FlightSearchResponse;
import com.farearound.search.dto.HotelSearchRequest;
import com.farearound.search.service.SearchService;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/search")
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class SearchController {

    SearchService searchService;

    @GetMapping("/flights")
    public ResponseEntity<FlightSearchResponse> searchFlights(
            @RequestParam String origin,
            @RequestParam String destination,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate departureDate,
            @RequestParam(defaultValue = "" + SearchConstants.DEFAULT_ADULTS) Integer adults,
            @RequestParam(defaultValue = "false") Boolean nonStop,
            @RequestParam(defaultValue = "" + SearchConstants.DEFAULT_MAX_RESULTS) Integer max) {

        log.info("GET /api/search/flights: {} -> {} on {}, adults={}, nonStop={}, max={}",
                origin, destination, departureDate, adults, nonStop, max);

        FlightSearchRequest request = FlightSearchRequest.builder()
                .origin(origin)
                .destination(destination)
                .departureDate(departureDate)
                .adults(adults)
                .nonStop(nonStop)
                .max(max)
                .build();

        return ResponseEntity.ok(searchService.searchFlights(request));
    }

    @PostMapping("/flights")
    public ResponseEntity<FlightSearchResponse> searchFlightsPost(@Valid @RequestBody FlightSearchRequest request) {
        log.info("POST /api/search/flights: {} -> {} on {}, adults={}, nonStop={}, max={}",
                request.getOrigin(), request.getDestination(), request.getDepartureDate(),
                request.getAdults(), request.getNonStop(), request.getMax());

        return ResponseEntity.ok(searchService.searchFlights(request));
    }

    @GetMapping("/flights/insight")
    public ResponseEntity<FlightInsight> flightInsight(
            @RequestParam String origin,
            @RequestParam String destination,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate departureDate,
            @RequestParam(defaultValue = "" + SearchConstants.DEFAULT_ADULTS) Integer adults,
            @RequestParam(defaultValue = "false") Boolean nonStop,
            @RequestParam(defaultValue = "" + SearchConstants.DEFAULT_MAX_RESULTS) Integer max) {

        log.info("GET /api/search/flights/insight: {} -> {} on {}", origin, destination, departureDate);

        FlightSearchRequest request = FlightSearchRequest.builder()
                .origin(origin)
                .destination(destination)
                .departureDate(departureDate)
                .adults(adults)
                .nonStop(nonStop)
                .max(max)
                .build();

        return ResponseEntity.ok(searchService.getFlightInsight(request));
    }

    @GetMapping("/hotels")
    public ResponseEntity<JsonNode> searchHotels(
            @RequestParam String cityCode,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate checkIn,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate checkOut) {

        log.info("GET /api/search/hotels: city={}, {} to {}", cityCode, checkIn, checkOut);

        HotelSearchRequest request = HotelSearchRequest.builder()
                .cityCode(cityCode)
                .checkIn(checkIn)
                .checkOut(checkOut)
                .build();

        return ResponseEntity.ok(searchService.searchHotels(request));
    }
}

package com.farearound.search.mapper;

import com.farearound.search.dto.FlightOffer;
import com.farearound.search.dto.FlightOffers;
import com.farearound.search.dto.FlightSegment;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces the upstream flight-offers payload to the fields callers display.
 */
public final class FlightOfferMapper {

    private FlightOfferMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static FlightOffers toFlightOffers(JsonNode payload) {
        if (payload == null || !payload.path("data").isArray()) {
            return FlightOffers.of(List.of());
        }

        List<FlightOffer> offers = new ArrayList<>();
        for (JsonNode offer : payload.path("data")) {
            if (offer.isObject()) {
                offers.add(toFlightOffer(offer));
            }
        }
        return FlightOffers.of(offers);
    }

    public static FlightOffer toFlightOffer(JsonNode offer) {
        JsonNode price = offer.path("price");
        JsonNode firstItinerary = offer.path("itineraries").path(0);

        List<FlightSegment> segments = new ArrayList<>();
        for (JsonNode segment : firstItinerary.path("segments")) {
            segments.add(toFlightSegment(segment));
        }

        return FlightOffer.builder()
                .id(text(offer, "id"))
                .total(text(price, "total"))
                .currency(text(price, "currency"))
                .duration(text(firstItinerary, "duration"))
                .segments(segments)
                .build();
    }

    private static FlightSegment toFlightSegment(JsonNode segment) {
        JsonNode departure = segment.path("departure");
        JsonNode arrival = segment.path("arrival");
        return FlightSegment.builder()
                .from(text(departure, "iataCode"))
                .to(text(arrival, "iataCode"))
                .departAt(text(departure, "at"))
                .arriveAt(text(arrival, "at"))
                .carrier(text(segment, "carrierCode"))
                .flightNumber(text(segment, "number"))
                .segmentDuration(text(segment, "duration"))
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}

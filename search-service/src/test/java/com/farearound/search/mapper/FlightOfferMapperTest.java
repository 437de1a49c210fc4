package com.farearound.search.mapper;

import com.farearound.search.dto.FlightOffer;
import com.farearound.search.dto.FlightOffers;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FlightOfferMapper")
class FlightOfferMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("keeps price, duration and the segments of the first itinerary")
    void mapsFirstItinerary() throws Exception {
        JsonNode payload = objectMapper.readTree("""
                {
                  "data": [
                    {
                      "id": "7",
                      "price": {"total": "9876.50", "currency": "INR", "base": "8000.00"},
                      "itineraries": [
                        {
                          "duration": "PT6H",
                          "segments": [
                            {
                              "departure": {"iataCode": "DEL", "at": "2026-05-02T06:00:00"},
                              "arrival": {"iataCode": "BOM", "at": "2026-05-02T08:10:00"},
                              "carrierCode": "AI",
                              "number": "865",
                              "duration": "PT2H10M"
                            },
                            {
                              "departure": {"iataCode": "BOM", "at": "2026-05-02T10:00:00"},
                              "arrival": {"iataCode": "GOI", "at": "2026-05-02T12:00:00"},
                              "carrierCode": "AI",
                              "number": "661",
                              "duration": "PT1H15M"
                            }
                          ]
                        },
                        {
                          "duration": "PT9H",
                          "segments": [
                            {"departure": {"iataCode": "GOI"}, "arrival": {"iataCode": "DEL"}}
                          ]
                        }
                      ]
                    }
                  ]
                }
                """);

        FlightOffers offers = FlightOfferMapper.toFlightOffers(payload);

        assertThat(offers.getCount()).isEqualTo(1);
        FlightOffer offer = offers.getOffers().get(0);
        assertThat(offer.getId()).isEqualTo("7");
        assertThat(offer.getTotal()).isEqualTo("9876.50");
        assertThat(offer.getCurrency()).isEqualTo("INR");
        assertThat(offer.getDuration()).isEqualTo("PT6H");
        assertThat(offer.getSegments()).hasSize(2);
        assertThat(offer.getSegments().get(1).getFrom()).isEqualTo("BOM");
        assertThat(offer.getSegments().get(1).getTo()).isEqualTo("GOI");
        assertThat(offer.getSegments().get(1).getFlightNumber()).isEqualTo("661");
        assertThat(offer.getSegments().get(0).getDepartAt()).isEqualTo("2026-05-02T06:00:00");
        assertThat(offer.getSegments().get(0).getSegmentDuration()).isEqualTo("PT2H10M");
    }

    @Test
    @DisplayName("leaves missing fields null and an offer without itineraries segment-less")
    void toleratesMissingFields() throws Exception {
        JsonNode payload = objectMapper.readTree("{\"data\":[{\"id\":\"1\"}]}");

        FlightOffer offer = FlightOfferMapper.toFlightOffers(payload).getOffers().get(0);

        assertThat(offer.getTotal()).isNull();
        assertThat(offer.getCurrency()).isNull();
        assertThat(offer.getSegments()).isEmpty();
    }

    @Test
    @DisplayName("yields zero offers when data is missing or not an array")
    void noDataArray() throws Exception {
        assertThat(FlightOfferMapper.toFlightOffers(objectMapper.readTree("{}")).getCount()).isZero();
        assertThat(FlightOfferMapper.toFlightOffers(objectMapper.readTree("{\"data\":{}}")).getCount()).isZero();
        assertThat(FlightOfferMapper.toFlightOffers(null).getOffers()).isEmpty();
    }
}

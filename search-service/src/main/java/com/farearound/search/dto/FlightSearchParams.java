package com.farearound.search.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validated, normalized flight-offer search parameters, in upstream vocabulary.
 */
@Value
@Builder
public class FlightSearchParams {

    String originLocationCode;
    String destinationLocationCode;
    LocalDate departureDate;
    int adults;
    boolean nonStop;
    int max;
    String currencyCode;

    public Map<String, String> toQueryParams() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("originLocationCode", originLocationCode);
        params.put("destinationLocationCode", destinationLocationCode);
        params.put("departureDate", departureDate.toString());
        params.put("adults", String.valueOf(adults));
        params.put("nonStop", String.valueOf(nonStop));
        params.put("max", String.valueOf(max));
        if (currencyCode != null) {
            params.put("currencyCode", currencyCode);
        }
        return params;
    }
}

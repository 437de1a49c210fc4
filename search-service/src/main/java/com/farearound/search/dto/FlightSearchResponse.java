package com.farearound.search.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightSearchResponse {

    FlightQuery query;
    int count;
    List<FlightOffer> offers;
}

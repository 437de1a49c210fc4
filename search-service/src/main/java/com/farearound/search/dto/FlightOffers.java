package com.farearound.search.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightOffers {

    int count;

    @Builder.Default
    List<FlightOffer> offers = List.of();

    public static FlightOffers of(List<FlightOffer> offers) {
        return FlightOffers.builder()
                .count(offers.size())
                .offers(List.copyOf(offers))
                .build();
    }
}

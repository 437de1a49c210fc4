package com.farearound.search.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;

/**
 * A flight offer reduced to price, duration and the segments of its first itinerary.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightOffer {

    String id;
    String total;
    String currency;
    String duration;

    @Builder.Default
    List<FlightSegment> segments = List.of();
}

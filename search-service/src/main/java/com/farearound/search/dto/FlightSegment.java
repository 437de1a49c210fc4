package com.farearound.search.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightSegment {

    String from;
    String to;
    String departAt;
    String arriveAt;
    String carrier;
    String flightNumber;
    String segmentDuration;
}

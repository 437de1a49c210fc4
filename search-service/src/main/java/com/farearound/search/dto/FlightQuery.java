package com.farearound.search.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;

/**
 * Echo of the normalized query a flight search was answered for.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightQuery {

    String origin;
    String destination;
    LocalDate departureDate;
    Integer adults;
    Boolean nonStop;
}

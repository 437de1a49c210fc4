package com.farearound.search.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class HotelSearchRequest {

    String cityCode;
    LocalDate checkIn;
    LocalDate checkOut;
}

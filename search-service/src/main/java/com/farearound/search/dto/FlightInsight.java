package com.farearound.search.dto;

import com.farearound.search.enums.Recommendation;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightInsight {

    BigDecimal bestPrice;
    String currency;
    Recommendation recommendation;
    String reason;
    double confidence;
}

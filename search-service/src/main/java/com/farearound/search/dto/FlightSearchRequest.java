package com.farearound.search.dto;

import com.farearound.search.constants.SearchConstants;
import com.farearound.search.constants.ValidationMessages;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;

/**
 * Flight search query as received from callers, before validation and normalization.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightSearchRequest {

    @NotBlank(message = ValidationMessages.ORIGIN_REQUIRED)
    @Pattern(regexp = SearchConstants.IATA_CODE_PATTERN, message = ValidationMessages.ORIGIN_INVALID)
    String origin;

    @NotBlank(message = ValidationMessages.DESTINATION_REQUIRED)
    @Pattern(regexp = SearchConstants.IATA_CODE_PATTERN, message = ValidationMessages.DESTINATION_INVALID)
    String destination;

    @NotNull(message = ValidationMessages.DEPARTURE_DATE_REQUIRED)
    LocalDate departureDate;

    @Min(value = SearchConstants.MIN_ADULTS, message = ValidationMessages.ADULTS_OUT_OF_RANGE)
    @Max(value = SearchConstants.MAX_ADULTS, message = ValidationMessages.ADULTS_OUT_OF_RANGE)
    @Builder.Default
    Integer adults = SearchConstants.DEFAULT_ADULTS;

    @Builder.Default
    Boolean nonStop = false;

    @Min(value = SearchConstants.MIN_RESULTS, message = ValidationMessages.MAX_OUT_OF_RANGE)
    @Max(value = SearchConstants.MAX_RESULTS, message = ValidationMessages.MAX_OUT_OF_RANGE)
    @Builder.Default
    Integer max = SearchConstants.DEFAULT_MAX_RESULTS;
}

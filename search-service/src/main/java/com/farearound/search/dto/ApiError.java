package com.farearound.search.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by every endpoint of the search service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

    String error;
    String message;
    Map<String, String> details;
    boolean retryable;

    /**
     * Last HTTP status seen from the upstream API, when the error originated there.
     */
    Integer upstreamStatus;

    @Builder.Default
    String timestamp = Instant.now().toString();
}

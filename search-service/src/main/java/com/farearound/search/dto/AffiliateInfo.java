package com.farearound.search.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class AffiliateInfo {

    @JsonProperty("affiliate_id")
    String affiliateId;

    String domain;
}

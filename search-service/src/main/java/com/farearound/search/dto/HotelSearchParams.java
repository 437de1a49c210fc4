package com.farearound.search.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
public class HotelSearchParams {

    String cityCode;
    LocalDate checkInDate;
    LocalDate checkOutDate;

    public Map<String, String> toQueryParams() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("cityCode", cityCode);
        params.put("checkInDate", checkInDate.toString());
        params.put("checkOutDate", checkOutDate.toString());
        return params;
    }
}

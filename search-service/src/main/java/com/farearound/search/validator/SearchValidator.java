package com.farearound.search.validator;

import com.farearound.search.constants.SearchConstants;
import com.farearound.search.constants.ValidationMessages;
import com.farearound.search.dto.FlightSearchRequest;
import com.farearound.search.dto.HotelSearchRequest;
import com.farearound.search.exception.SearchValidationException;
import com.farearound.search.util.StringUtils;

import java.time.LocalDate;

public final class SearchValidator {

    private SearchValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void validateFlightSearch(FlightSearchRequest request, LocalDate today) {
        if (request == null) {
            throw new SearchValidationException(ValidationMessages.FLIGHT_SEARCH_REQUIRED);
        }

        validateLocationCode(request.getOrigin(),
                ValidationMessages.ORIGIN_REQUIRED, ValidationMessages.ORIGIN_INVALID);
        validateLocationCode(request.getDestination(),
                ValidationMessages.DESTINATION_REQUIRED, ValidationMessages.DESTINATION_INVALID);
        validateOriginDestinationNotSame(request.getOrigin(), request.getDestination());
        validateDepartureDate(request.getDepartureDate(), today);
        validateRange(request.getAdults(), SearchConstants.MIN_ADULTS, SearchConstants.MAX_ADULTS,
                ValidationMessages.ADULTS_OUT_OF_RANGE);
        validateRange(request.getMax(), SearchConstants.MIN_RESULTS, SearchConstants.MAX_RESULTS,
                ValidationMessages.MAX_OUT_OF_RANGE);
    }

    public static void validateHotelSearch(HotelSearchRequest request) {
        if (request == null) {
            throw new SearchValidationException(ValidationMessages.HOTEL_SEARCH_REQUIRED);
        }

        validateLocationCode(request.getCityCode(),
                ValidationMessages.CITY_CODE_REQUIRED, ValidationMessages.CITY_CODE_INVALID);
        if (request.getCheckIn() == null) {
            throw new SearchValidationException(ValidationMessages.CHECK_IN_REQUIRED);
        }
        if (request.getCheckOut() == null) {
            throw new SearchValidationException(ValidationMessages.CHECK_OUT_REQUIRED);
        }
        if (!request.getCheckOut().isAfter(request.getCheckIn())) {
            throw new SearchValidationException(ValidationMessages.CHECK_OUT_AFTER_CHECK_IN);
        }
    }

    private static void validateLocationCode(String code, String requiredMessage, String invalidMessage) {
        if (!org.springframework.util.StringUtils.hasText(code)) {
            throw new SearchValidationException(requiredMessage);
        }
        if (!StringUtils.isIataCode(code)) {
            throw new SearchValidationException(invalidMessage);
        }
    }

    private static void validateOriginDestinationNotSame(String origin, String destination) {
        String normalizedOrigin = StringUtils.normalizeLocationCode(origin);
        String normalizedDestination = StringUtils.normalizeLocationCode(destination);

        if (normalizedOrigin != null && normalizedOrigin.equals(normalizedDestination)) {
            throw new SearchValidationException(ValidationMessages.ORIGIN_DESTINATION_SAME);
        }
    }

    private static void validateDepartureDate(LocalDate date, LocalDate today) {
        if (date == null) {
            throw new SearchValidationException(ValidationMessages.DEPARTURE_DATE_REQUIRED);
        }
        if (date.isBefore(today)) {
            throw new SearchValidationException(ValidationMessages.DEPARTURE_DATE_NOT_PAST);
        }
    }

    private static void validateRange(Integer value, int min, int max, String message) {
        if (value == null || value < min || value > max) {
            throw new SearchValidationException(message);
        }
    }
}

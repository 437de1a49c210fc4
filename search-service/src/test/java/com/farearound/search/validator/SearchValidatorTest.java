package com.farearound.search.validator;

import com.farearound.search.constants.ValidationMessages;
import com.farearound.search.dto.FlightSearchRequest;
import com.farearound.search.dto.HotelSearchRequest;
import com.farearound.search.exception.SearchValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SearchValidator")
class SearchValidatorTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 4, 1);

    private static FlightSearchRequest.FlightSearchRequestBuilder flight() {
        return FlightSearchRequest.builder()
                .origin("blr")
                .destination("DXB")
                .departureDate(TODAY.plusDays(29));
    }

    private static HotelSearchRequest.HotelSearchRequestBuilder hotel() {
        return HotelSearchRequest.builder()
                .cityCode("DEL")
                .checkIn(TODAY.plusDays(10))
                .checkOut(TODAY.plusDays(12));
    }

    @Nested
    @DisplayName("Flight search")
    class FlightSearch {

        @Test
        void acceptsValidRequestWithDefaults() {
            assertThatCode(() -> SearchValidator.validateFlightSearch(flight().build(), TODAY))
                    .doesNotThrowAnyException();
        }

        @Test
        void acceptsDepartureToday() {
            assertThatCode(() -> SearchValidator.validateFlightSearch(flight().departureDate(TODAY).build(), TODAY))
                    .doesNotThrowAnyException();
        }

        @Test
        void rejectsMissingOrigin() {
            assertThatThrownBy(() -> SearchValidator.validateFlightSearch(flight().origin(" ").build(), TODAY))
                    .isInstanceOf(SearchValidationException.class)
                    .hasMessage(ValidationMessages.ORIGIN_REQUIRED);
        }

        @ParameterizedTest
        @ValueSource(strings = {"BL", "BLRX", "B1R", "12A"})
        void rejectsMalformedDestination(String code) {
            assertThatThrownBy(() -> SearchValidator.validateFlightSearch(flight().destination(code).build(), TODAY))
                    .isInstanceOf(SearchValidationException.class)
                    .hasMessage(ValidationMessages.DESTINATION_INVALID);
        }

        @Test
        void rejectsSameOriginAndDestinationIgnoringCase() {
            assertThatThrownBy(() -> SearchValidator.validateFlightSearch(
                    flight().origin("dxb").destination("DXB").build(), TODAY))
                    .isInstanceOf(SearchValidationException.class)
                    .hasMessage(ValidationMessages.ORIGIN_DESTINATION_SAME);
        }

        @Test
        void rejectsPastDeparture() {
            assertThatThrownBy(() -> SearchValidator.validateFlightSearch(
                    flight().departureDate(TODAY.minusDays(1)).build(), TODAY))
                    .isInstanceOf(SearchValidationException.class)
                    .hasMessage(ValidationMessages.DEPARTURE_DATE_NOT_PAST);
        }

        @Test
        void rejectsMissingDeparture() {
            assertThatThrownBy(() -> SearchValidator.validateFlightSearch(
                    flight().departureDate(null).build(), TODAY))
                    .hasMessage(ValidationMessages.DEPARTURE_DATE_REQUIRED);
        }

        @ParameterizedTest
        @ValueSource(ints = {0, 10})
        void rejectsAdultsOutOfRange(int adults) {
            assertThatThrownBy(() -> SearchValidator.validateFlightSearch(flight().adults(adults).build(), TODAY))
                    .hasMessage(ValidationMessages.ADULTS_OUT_OF_RANGE);
        }

        @ParameterizedTest
        @ValueSource(ints = {0, 51})
        void rejectsMaxOutOfRange(int max) {
            assertThatThrownBy(() -> SearchValidator.validateFlightSearch(flight().max(max).build(), TODAY))
                    .hasMessage(ValidationMessages.MAX_OUT_OF_RANGE);
        }

        @Test
        void rejectsNullRequest() {
            assertThatThrownBy(() -> SearchValidator.validateFlightSearch(null, TODAY))
                    .isInstanceOf(SearchValidationException.class);
        }
    }

    @Nested
    @DisplayName("Hotel search")
    class HotelSearch {

        @Test
        void acceptsValidRequest() {
            assertThatCode(() -> SearchValidator.validateHotelSearch(hotel().build())).doesNotThrowAnyException();
        }

        @Test
        void rejectsInvalidCityCode() {
            assertThatThrownBy(() -> SearchValidator.validateHotelSearch(hotel().cityCode("DELHI").build()))
                    .hasMessage(ValidationMessages.CITY_CODE_INVALID);
        }

        @Test
        void rejectsMissingCheckOut() {
            assertThatThrownBy(() -> SearchValidator.validateHotelSearch(hotel().checkOut(null).build()))
                    .hasMessage(ValidationMessages.CHECK_OUT_REQUIRED);
        }

        @Test
        void rejectsCheckOutOnCheckInDay() {
            HotelSearchRequest request = hotel().checkOut(TODAY.plusDays(10)).build();

            assertThatThrownBy(() -> SearchValidator.validateHotelSearch(request))
                    .isInstanceOf(SearchValidationException.class)
                    .hasMessage(ValidationMessages.CHECK_OUT_AFTER_CHECK_IN);
        }
    }
}

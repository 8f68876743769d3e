package kr.cinema.be.booking.domain.room;

import kr.cinema.be.booking.domain.common.Interval;
import kr.cinema.be.booking.domain.common.exception.TechnicalException;
import kr.cinema.be.booking.domain.common.result.FailureCode;
import kr.cinema.be.booking.domain.common.result.Outcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BookingTest {

    private final Instant now = Instant.parse("2026-05-01T00:00:00Z");

    private Interval from(Duration offset, Duration length) {
        Instant start = now.plus(offset);
        return new Interval(start, start.plus(length));
    }

    @Test
    @DisplayName("상영 일정을 생성하면 새 ID 가 부여된다")
    void create_Screening() {
        // when
        Outcome<Booking> outcome = Booking.create("screening-1", BookingType.SCREENING,
                from(Duration.ofHours(1), Duration.ofMinutes(120)), now);

        // then
        Booking booking = outcome.value();
        assertThat(booking.id()).isNotBlank();
        assertThat(booking.isFor("screening-1")).isTrue();
        assertThat(booking.type()).isEqualTo(BookingType.SCREENING);
    }

    @Test
    @DisplayName("상영 일정에 상영 ID 가 없으면 MISSING_REQUIRED_DATA")
    void create_ScreeningWithoutSubject() {
        Outcome<Booking> outcome = Booking.create(" ", BookingType.SCREENING,
                from(Duration.ofHours(1), Duration.ofMinutes(120)), now);

        assertThat(outcome.hasFailure(FailureCode.MISSING_REQUIRED_DATA)).isTrue();
    }

    @Test
    @DisplayName("점검 일정은 대상 없이도 만들 수 있다")
    void create_MaintenanceWithoutSubject() {
        Outcome<Booking> outcome = Booking.create(null, BookingType.MAINTENANCE,
                from(Duration.ofHours(1), Duration.ofHours(30)), now);

        assertThat(outcome.isSuccess()).isTrue();
    }

    @Test
    @DisplayName("과거에 시작하는 일정은 DATE_CANNOT_BE_PAST")
    void create_PastStart() {
        Outcome<Booking> outcome = Booking.create("screening-1", BookingType.SCREENING,
                from(Duration.ofMinutes(-1), Duration.ofMinutes(120)), now);

        assertThat(outcome.hasFailure(FailureCode.DATE_CANNOT_BE_PAST)).isTrue();
    }

    @Test
    @DisplayName("유형별 허용 길이를 벗어나면 INVALID_BOOKING_DURATION")
    void create_InvalidDuration() {
        assertThat(Booking.create("s", BookingType.SCREENING,
                from(Duration.ofHours(1), Duration.ofMinutes(29)), now)
                .hasFailure(FailureCode.INVALID_BOOKING_DURATION)).isTrue();
        assertThat(Booking.create(null, BookingType.CLEANING,
                from(Duration.ofHours(1), Duration.ofMinutes(121)), now)
                .hasFailure(FailureCode.INVALID_BOOKING_DURATION)).isTrue();
        assertThat(Booking.create("s", BookingType.SCREENING,
                from(Duration.ofHours(1), Duration.ofHours(6)), now).isSuccess()).isTrue();
    }

    @Test
    @DisplayName("상영 일정을 대상 없이 복원하면 기술 오류")
    void hydrate_ScreeningWithoutSubject() {
        assertThatThrownBy(() -> Booking.hydrate("b-1", null, BookingType.SCREENING,
                now, now.plus(Duration.ofHours(2))))
                .isInstanceOf(TechnicalException.class);
    }
}

package kr.cinema.be.booking.domain.screening;

import kr.cinema.be.booking.domain.common.exception.TechnicalException;
import kr.cinema.be.booking.domain.common.result.FailureCode;
import kr.cinema.be.booking.domain.common.result.Outcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeatReservationTest {

    private final Instant now = Instant.parse("2026-06-01T12:00:00Z");

    @Test
    @DisplayName("점유는 15분 뒤 만료되고 만료 시각 자체는 아직 유효하다")
    void hasExpired_Boundary() {
        // given
        SeatReservation reservation = SeatReservation.create("customer-1", now).value();

        // when & then
        assertThat(reservation.getExpiresAt()).isEqualTo(now.plus(Duration.ofMinutes(15)));
        assertThat(reservation.hasExpired(now.plus(Duration.ofMinutes(14)))).isFalse();
        assertThat(reservation.hasExpired(now.plus(Duration.ofMinutes(15)))).isFalse();
        assertThat(reservation.hasExpired(now.plus(Duration.ofMinutes(16)))).isTrue();
    }

    @Test
    @DisplayName("고객 ID 가 비어 있으면 RESERVATION_DATA_MISSING")
    void create_BlankCustomer() {
        Outcome<SeatReservation> outcome = SeatReservation.create("  ", now);

        assertThat(outcome.hasFailure(FailureCode.RESERVATION_DATA_MISSING)).isTrue();
        assertThat(SeatReservation.create(null, now).hasFailure(FailureCode.RESERVATION_DATA_MISSING)).isTrue();
    }

    @Test
    @DisplayName("남은 시간은 만료 후 0 이다")
    void remaining() {
        SeatReservation reservation = SeatReservation.create("customer-1", now).value();

        assertThat(reservation.remaining(now.plus(Duration.ofMinutes(10)))).isEqualTo(Duration.ofMinutes(5));
        assertThat(reservation.remaining(now.plus(Duration.ofMinutes(20)))).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("점유 고객 확인")
    void isHeldBy() {
        SeatReservation reservation = SeatReservation.create("customer-1", now).value();

        assertThat(reservation.isHeldBy("customer-1")).isTrue();
        assertThat(reservation.isHeldBy("customer-2")).isFalse();
    }

    @Test
    @DisplayName("고객 ID 없는 저장 데이터 복원은 기술 오류")
    void hydrate_NullCustomer() {
        assertThatThrownBy(() -> SeatReservation.hydrate(null, now, now.plusSeconds(900)))
                .isInstanceOf(TechnicalException.class)
                .hasMessageContaining("customerId");
    }

    @Test
    @DisplayName("만료 시각이 점유 시각보다 앞서면 기술 오류")
    void hydrate_ExpiryBeforeReservation() {
        assertThatThrownBy(() -> SeatReservation.hydrate("customer-1", now, now.minusSeconds(1)))
                .isInstanceOf(TechnicalException.class);
    }
}

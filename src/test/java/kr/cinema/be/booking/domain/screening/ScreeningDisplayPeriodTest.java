package kr.cinema.be.booking.domain.screening;

import kr.cinema.be.booking.domain.common.exception.TechnicalException;
import kr.cinema.be.booking.domain.common.result.FailureCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ScreeningDisplayPeriodTest {

    private final Instant now = Instant.parse("2026-06-01T12:00:00Z");

    @Test
    @DisplayName("상영 전/중/후 상태와 예매 가능 여부")
    void getStatus() {
        // given
        ScreeningDisplayPeriod period = ScreeningDisplayPeriod.create(
                now.plus(Duration.ofHours(1)), now.plus(Duration.ofHours(3)), now).value();

        // when & then
        assertThat(period.getStatus(now)).isEqualTo(ScreeningStatus.PRESALE);
        assertThat(period.getStatus(now.plus(Duration.ofHours(2)))).isEqualTo(ScreeningStatus.SHOWING);
        assertThat(period.getStatus(now.plus(Duration.ofHours(4)))).isEqualTo(ScreeningStatus.ENDED);

        assertThat(period.isAvailableForBooking(now)).isTrue();
        assertThat(period.isAvailableForBooking(now.plus(Duration.ofHours(2)))).isFalse();
        assertThat(period.isAvailableForBooking(now.plus(Duration.ofHours(4)))).isFalse();
        assertThat(period.durationInMinutes()).isEqualTo(120);
    }

    @Test
    @DisplayName("시작/종료 시각 경계는 상영중")
    void getStatus_BoundariesAreShowing() {
        ScreeningDisplayPeriod period = ScreeningDisplayPeriod.hydrate(now, now.plus(Duration.ofHours(2)));

        assertThat(period.getStatus(now)).isEqualTo(ScreeningStatus.SHOWING);
        assertThat(period.getStatus(now.plus(Duration.ofHours(2)))).isEqualTo(ScreeningStatus.SHOWING);
    }

    @Test
    @DisplayName("시작이 종료보다 늦으면 INVALID_SEQUENCE")
    void create_InvalidSequence() {
        assertThat(ScreeningDisplayPeriod.create(now.plus(Duration.ofHours(3)), now.plus(Duration.ofHours(1)), now)
                .hasFailure(FailureCode.INVALID_SEQUENCE)).isTrue();
    }

    @Test
    @DisplayName("시작 시각은 5분까지의 과거만 허용된다")
    void create_PastTolerance() {
        Instant end = now.plus(Duration.ofHours(2));

        assertThat(ScreeningDisplayPeriod.create(now.minus(Duration.ofMinutes(5)), end, now).isSuccess()).isTrue();
        assertThat(ScreeningDisplayPeriod.create(now.minus(Duration.ofMinutes(6)), end, now)
                .hasFailure(FailureCode.DATE_CANNOT_BE_PAST)).isTrue();
    }

    @Test
    @DisplayName("경계값이 없으면 모두 MISSING_REQUIRED_DATA 로 보고된다")
    void create_Missing() {
        assertThat(ScreeningDisplayPeriod.create(null, null, now).failures()).hasSize(2);
    }

    @Test
    @DisplayName("복원 데이터의 시작이 종료보다 늦거나 같으면 TechnicalException")
    void hydrate_InvertedPeriod() {
        // when
        TechnicalException inverted = catchThrowableOfType(
                () -> ScreeningDisplayPeriod.hydrate(now, now.minus(Duration.ofHours(1))),
                TechnicalException.class);
        TechnicalException empty = catchThrowableOfType(
                () -> ScreeningDisplayPeriod.hydrate(now, now),
                TechnicalException.class);

        // then
        assertThat(inverted.getCode()).isEqualTo(FailureCode.INVALID_HYDRATE_DATA);
        assertThat(empty.getCode()).isEqualTo(FailureCode.INVALID_HYDRATE_DATA);
    }
}

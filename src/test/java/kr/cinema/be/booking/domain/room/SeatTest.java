package kr.cinema.be.booking.domain.room;

import kr.cinema.be.booking.domain.common.exception.TechnicalException;
import kr.cinema.be.booking.domain.common.result.FailureCode;
import kr.cinema.be.booking.domain.common.result.FailureRecord;
import kr.cinema.be.booking.domain.common.result.Outcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeatTest {

    @Test
    @DisplayName("소문자 열은 대문자로 정규화된다")
    void create_NormalizesColumn() {
        // when
        Outcome<Seat> outcome = Seat.create("c", 5, false);

        // then
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.value().column()).isEqualTo('C');
        assertThat(outcome.value().identifier()).isEqualTo("C5");
    }

    @Test
    @DisplayName("두 글자 열은 INVALID_COLUMN_FORMAT")
    void create_TwoLetterColumn() {
        assertThat(Seat.create("AA", 5, false).hasFailure(FailureCode.INVALID_COLUMN_FORMAT)).isTrue();
    }

    @Test
    @DisplayName("줄 번호가 250 을 넘으면 VALUE_OUT_OF_RANGE")
    void create_RowOutOfRange() {
        assertThat(Seat.create("L", 251, false).hasFailure(FailureCode.VALUE_OUT_OF_RANGE)).isTrue();
        assertThat(Seat.create("L", 250, false).isSuccess()).isTrue();
    }

    @Test
    @DisplayName("줄 번호가 0 이면 VALUE_NOT_POSITIVE")
    void create_RowNotPositive() {
        assertThat(Seat.create("L", 0, false).hasFailure(FailureCode.VALUE_NOT_POSITIVE)).isTrue();
    }

    @Test
    @DisplayName("줄 번호가 정수가 아니면 VALUE_NOT_INTEGER")
    void create_RowNotInteger() {
        assertThat(Seat.create("L", 1.5, false).hasFailure(FailureCode.VALUE_NOT_INTEGER)).isTrue();
        assertThat(Seat.create("L", Double.NaN, false).hasFailure(FailureCode.VALUE_NOT_INTEGER)).isTrue();
    }

    @Test
    @DisplayName("열과 줄 오류는 함께 모아서 반환된다")
    void create_AccumulatesFailures() {
        // when
        Outcome<Seat> outcome = Seat.create("1", -3, true);

        // then
        assertThat(outcome.failures())
                .extracting(FailureRecord::code)
                .containsExactly(FailureCode.INVALID_COLUMN_FORMAT, FailureCode.VALUE_NOT_POSITIVE);
    }

    @Test
    @DisplayName("필수값이 없으면 필드별 MISSING_REQUIRED_DATA")
    void create_MissingFields() {
        // when
        Outcome<Seat> outcome = Seat.create(null, null, false);

        // then
        assertThat(outcome.failures())
                .extracting(failure -> failure.detail("field"))
                .containsExactly("column", "row");
    }

    @Test
    @DisplayName("열, 줄, 우선 여부가 모두 같아야 같은 좌석")
    void equality_IncludesPreferentialFlag() {
        Seat normal = new Seat('B', 3, false);

        assertThat(normal).isEqualTo(new Seat('B', 3, false));
        assertThat(normal).isNotEqualTo(normal.withPreferentialStatus(true));
        assertThat(normal.withPreferentialStatus(false)).isSameAs(normal);
    }

    @Test
    @DisplayName("저장 데이터에 열 정보가 없으면 기술 오류")
    void hydrate_MissingColumn() {
        assertThatThrownBy(() -> Seat.hydrate(null, 3, false))
                .isInstanceOf(TechnicalException.class);
        assertThat(Seat.hydrate("b", 3, true)).isEqualTo(new Seat('B', 3, true));
    }
}

package kr.cinema.be.booking.domain.room;

import kr.cinema.be.booking.domain.common.Interval;
import kr.cinema.be.booking.domain.common.exception.TechnicalException;
import kr.cinema.be.booking.domain.common.result.FailureCode;
import kr.cinema.be.booking.domain.common.result.Outcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoomScheduleTest {

    private static final ZoneId SEOUL = ZoneId.of("Asia/Seoul");
    private static final LocalDate DAY = LocalDate.of(2026, 5, 10);

    private static Instant at(int hour, int minute) {
        return LocalDateTime.of(DAY, LocalTime.of(hour, minute)).atZone(SEOUL).toInstant();
    }

    private static Booking screening(String id, int fromHour, int fromMinute, int toHour, int toMinute) {
        return Booking.hydrate(id, "screening-" + id, BookingType.SCREENING, at(fromHour, fromMinute), at(toHour, toMinute));
    }

    @Nested
    @DisplayName("일정 추가")
    class WithBooking {

        @Test
        @DisplayName("겹치지 않는 두 일정은 차례로 추가된다")
        void disjointBookings() {
            // given
            Booking first = screening("1", 10, 0, 12, 0);
            Booking second = screening("2", 12, 0, 14, 0);

            // when
            Outcome<RoomSchedule> outcome = RoomSchedule.empty()
                    .withBooking(first)
                    .flatMap(schedule -> schedule.withBooking(second));

            // then
            assertThat(outcome.value().bookings()).containsExactly(first, second);
        }

        @Test
        @DisplayName("겹치는 일정은 BOOKING_CONFLICT 이고 원본은 그대로다")
        void overlappingBookingKeepsSchedule() {
            // given
            Booking first = screening("1", 10, 0, 12, 0);
            RoomSchedule schedule = RoomSchedule.empty().withBooking(first).value();

            // when
            Outcome<RoomSchedule> outcome = schedule.withBooking(screening("2", 11, 0, 13, 0));

            // then
            assertThat(outcome.hasFailure(FailureCode.BOOKING_CONFLICT)).isTrue();
            assertThat(outcome.failures().get(0).detail("bookingId")).isEqualTo("1");
            assertThat(schedule.bookings()).containsExactly(first);
        }

        @Test
        @DisplayName("같은 ID 의 일정은 DUPLICATE_BOOKING")
        void duplicateId() {
            RoomSchedule schedule = RoomSchedule.hydrate(List.of(screening("1", 10, 0, 12, 0)));

            assertThat(schedule.withBooking(screening("1", 15, 0, 17, 0))
                    .hasFailure(FailureCode.DUPLICATE_BOOKING)).isTrue();
        }

        @Test
        @DisplayName("추가된 일정은 시작 시각 순으로 정렬된다")
        void sortedByStart() {
            RoomSchedule schedule = RoomSchedule.empty()
                    .withBooking(screening("late", 18, 0, 20, 0)).value()
                    .withBooking(screening("early", 10, 0, 12, 0)).value();

            assertThat(schedule.bookings()).extracting(Booking::id).containsExactly("early", "late");
        }
    }

    @Nested
    @DisplayName("일정 삭제")
    class RemoveBooking {

        @Test
        @DisplayName("ID 로 삭제하면 새 일정표를 돌려주고 원본은 그대로다")
        void removeById() {
            // given
            RoomSchedule schedule = RoomSchedule.hydrate(List.of(screening("1", 10, 0, 12, 0), screening("2", 13, 0, 15, 0)));

            // when
            RoomSchedule next = schedule.removeBooking("1").value();

            // then
            assertThat(next.bookings()).extracting(Booking::id).containsExactly("2");
            assertThat(schedule.size()).isEqualTo(2);
        }

        @Test
        @DisplayName("없는 ID 삭제는 변화 없이 성공한다")
        void removeUnknownIsNoOp() {
            RoomSchedule schedule = RoomSchedule.hydrate(List.of(screening("1", 10, 0, 12, 0)));

            Outcome<RoomSchedule> outcome = schedule.removeBooking("unknown");

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.value()).isSameAs(schedule);
        }

        @Test
        @DisplayName("대상 ID 로 삭제할 수 있다")
        void removeBySubject() {
            RoomSchedule schedule = RoomSchedule.hydrate(List.of(screening("1", 10, 0, 12, 0)));

            assertThat(schedule.removeBySubject("screening-1").value().isEmpty()).isTrue();
        }
    }

    @Test
    @DisplayName("가용성 검사는 경계만 맞닿은 구간을 허용한다")
    void findAvailability_TouchingBoundary() {
        RoomSchedule schedule = RoomSchedule.hydrate(List.of(screening("1", 10, 0, 12, 0)));

        assertThat(schedule.isAvailable(new Interval(at(12, 0), at(13, 0)))).isTrue();
        assertThat(schedule.isAvailable(new Interval(at(11, 59), at(13, 0)))).isFalse();
    }

    @Test
    @DisplayName("복원된 일정의 겹침을 validate 로 찾아낸다")
    void validate_FindsOverlaps() {
        // given
        RoomSchedule schedule = RoomSchedule.hydrate(List.of(
                screening("1", 10, 0, 12, 0),
                screening("2", 11, 0, 13, 0),
                screening("3", 14, 0, 16, 0)));

        // when
        Outcome<RoomSchedule> outcome = schedule.validate();

        // then
        assertThat(outcome.failures()).hasSize(1);
        assertThat(outcome.failures().get(0).detail("conflictingBookingId")).isEqualTo("2");
        assertThat(RoomSchedule.hydrate(List.of(screening("1", 10, 0, 12, 0))).validate().isSuccess()).isTrue();
    }

    @Test
    @DisplayName("null 이 섞인 일정 목록 복원은 기술 오류")
    void hydrate_NullElement() {
        assertThatThrownBy(() -> RoomSchedule.hydrate(Arrays.asList(screening("1", 10, 0, 12, 0), null)))
                .isInstanceOf(TechnicalException.class);
    }

    @Nested
    @DisplayName("운영 시간 검사")
    class OperatingWindow {

        @Test
        @DisplayName("10시 ~ 22시 사이 5분 단위 시작은 허용된다")
        void withinWindow() {
            assertThat(RoomSchedule.checkOperatingWindow(new Interval(at(10, 0), at(12, 0)), SEOUL).isSuccess()).isTrue();
            assertThat(RoomSchedule.checkOperatingWindow(new Interval(at(21, 55), at(23, 30)), SEOUL).isSuccess()).isTrue();
        }

        @Test
        @DisplayName("운영 시간 밖 시작은 ROOM_OPERATING_HOURS_VIOLATION")
        void outsideWindow() {
            assertThat(RoomSchedule.checkOperatingWindow(new Interval(at(9, 55), at(12, 0)), SEOUL)
                    .hasFailure(FailureCode.ROOM_OPERATING_HOURS_VIOLATION)).isTrue();
            assertThat(RoomSchedule.checkOperatingWindow(new Interval(at(22, 0), at(23, 0)), SEOUL)
                    .hasFailure(FailureCode.ROOM_OPERATING_HOURS_VIOLATION)).isTrue();
        }

        @Test
        @DisplayName("5분 단위가 아닌 시작은 INVALID_BOOKING_TIME_INTERVAL")
        void offGrid() {
            assertThat(RoomSchedule.checkOperatingWindow(new Interval(at(10, 7), at(12, 0)), SEOUL)
                    .hasFailure(FailureCode.INVALID_BOOKING_TIME_INTERVAL)).isTrue();
        }
    }

    @Test
    @DisplayName("빈 구간은 운영 시간 안에서 5분 단위로 계산된다")
    void freeSlotsOn_SplitsAroundBookings() {
        // given
        RoomSchedule schedule = RoomSchedule.hydrate(List.of(
                screening("1", 12, 0, 14, 7),
                screening("2", 14, 0, 15, 0),
                screening("3", 21, 40, 23, 30)));

        // when
        List<Interval> slots = schedule.freeSlotsOn(DAY, SEOUL, 30);

        // then
        assertThat(slots).containsExactly(
                new Interval(at(10, 0), at(12, 0)),
                new Interval(at(15, 0), at(21, 40)));
    }

    @Test
    @DisplayName("최소 길이보다 짧은 빈 구간은 제외된다")
    void freeSlotsOn_DropsShortSlots() {
        RoomSchedule schedule = RoomSchedule.hydrate(List.of(
                screening("1", 10, 20, 12, 0)));

        assertThat(schedule.freeSlotsOn(DAY, SEOUL, 30))
                .containsExactly(new Interval(at(12, 0), at(22, 0)));
        assertThat(RoomSchedule.empty().freeSlotsOn(DAY, SEOUL, 30))
                .containsExactly(new Interval(at(10, 0), at(22, 0)));
    }
}

package kr.cinema.be.booking.domain.room;

import kr.cinema.be.booking.domain.common.Interval;
import kr.cinema.be.booking.domain.common.exception.TechnicalException;
import kr.cinema.be.booking.domain.common.result.FailureCode;
import kr.cinema.be.booking.domain.common.result.FailureRecord;
import kr.cinema.be.booking.domain.common.result.Outcome;
import kr.cinema.be.booking.domain.room.service.RoomPolicy;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 한 상영관의 일정 모음
 * - 어떤 두 일정도 시간이 겹치지 않는다
 * - 불변 객체: 추가/삭제는 새 인스턴스를 반환하고 원본은 그대로 둔다
 *
 * <p>충돌 검사는 기존 일정 전체를 선형으로 훑는다. 한 상영관의 일정 수 규모에서만 유효하다.
 */
public final class RoomSchedule {

    private static final Comparator<Booking> BY_START =
            Comparator.comparing(Booking::start).thenComparing(Booking::id);

    private final List<Booking> bookings;

    private RoomSchedule(List<Booking> bookings) {
        List<Booking> sorted = new ArrayList<>(bookings);
        sorted.sort(BY_START);
        this.bookings = List.copyOf(sorted);
    }

    // === 팩토리 메서드들 ===

    public static RoomSchedule empty() {
        return new RoomSchedule(List.of());
    }

    /**
     * 저장된 일정으로 복원 (Repository 에서 사용)
     * - 신뢰된 데이터이므로 겹침 검사를 하지 않는다. 필요하면 validate() 로 재검사
     */
    public static RoomSchedule hydrate(List<Booking> bookings) {
        TechnicalException.when(bookings == null, FailureCode.INVALID_HYDRATE_DATA, "field", "bookings");
        TechnicalException.when(bookings.stream().anyMatch(Objects::isNull),
                FailureCode.INVALID_HYDRATE_DATA, "field", "bookings[]");
        return new RoomSchedule(bookings);
    }

    // === 비즈니스 메서드들 ===

    /**
     * 일정 추가
     * - 겹치는 일정이 있으면 BOOKING_CONFLICT (충돌한 일정 ID 포함), 원본은 변하지 않는다
     */
    public Outcome<RoomSchedule> withBooking(Booking candidate) {
        if (candidate == null) return Outcome.failure(FailureRecord.missing("booking"));

        if (findBooking(candidate.id()).isPresent()) {
            return Outcome.failure(FailureCode.DUPLICATE_BOOKING, "bookingId", candidate.id());
        }

        return findAvailability(candidate.interval())
                .map(free -> {
                    List<Booking> next = new ArrayList<>(bookings);
                    next.add(candidate);
                    return new RoomSchedule(next);
                });
    }

    /**
     * 일정 삭제. 없는 ID 는 아무것도 하지 않고 성공
     */
    public Outcome<RoomSchedule> removeBooking(String bookingId) {
        if (bookingId == null) return Outcome.failure(FailureRecord.missing("bookingId"));

        return Outcome.success(without(booking -> booking.id().equals(bookingId)));
    }

    /**
     * 대상(상영) 기준 삭제. 없는 대상은 아무것도 하지 않고 성공
     */
    public Outcome<RoomSchedule> removeBySubject(String subjectId) {
        if (subjectId == null) return Outcome.failure(FailureRecord.missing("subjectId"));

        return Outcome.success(without(booking -> booking.isFor(subjectId)));
    }

    /**
     * 읽기 전용 가용성 검사. withBooking 과 같은 충돌 규칙
     */
    public Outcome<Interval> findAvailability(Interval candidate) {
        if (candidate == null) return Outcome.failure(FailureRecord.missing("interval"));

        for (Booking booking : bookings) {
            if (booking.overlaps(candidate)) {
                return Outcome.failure(FailureCode.BOOKING_CONFLICT,
                        "bookingId", booking.id(),
                        "start", candidate.start(), "end", candidate.end());
            }
        }
        return Outcome.success(candidate);
    }

    public boolean isAvailable(Interval candidate) {
        return findAvailability(candidate).isSuccess();
    }

    /**
     * 보관 중인 일정끼리 겹치지 않는지 재검사 (hydrate 결과 점검용)
     */
    public Outcome<RoomSchedule> validate() {
        List<FailureRecord> failures = new ArrayList<>();
        for (int i = 0; i < bookings.size(); i++) {
            for (int j = i + 1; j < bookings.size(); j++) {
                Booking first = bookings.get(i);
                Booking second = bookings.get(j);
                // 시작 시각 순 정렬이므로 이후 일정은 더 볼 필요 없음
                if (!second.start().isBefore(first.end())) break;
                failures.add(FailureRecord.of(FailureCode.BOOKING_CONFLICT,
                        "bookingId", first.id(), "conflictingBookingId", second.id()));
            }
        }
        return failures.isEmpty() ? Outcome.success(this) : Outcome.failure(failures);
    }

    /**
     * 운영 시간(10시~22시 시작)과 5분 단위 시작 시각 검사
     */
    public static Outcome<Interval> checkOperatingWindow(Interval interval, ZoneId zone) {
        if (interval == null) return Outcome.failure(FailureRecord.missing("interval"));
        if (zone == null) return Outcome.failure(FailureRecord.missing("zone"));

        ZonedDateTime start = interval.start().atZone(zone);
        if (start.getHour() < RoomPolicy.OPERATING_START_HOUR || start.getHour() >= RoomPolicy.OPERATING_END_HOUR) {
            return Outcome.failure(FailureCode.ROOM_OPERATING_HOURS_VIOLATION,
                    "hour", start.getHour(),
                    "openHour", RoomPolicy.OPERATING_START_HOUR, "closeHour", RoomPolicy.OPERATING_END_HOUR);
        }
        if (!start.equals(floorToGrid(start))) {
            return Outcome.failure(FailureCode.INVALID_BOOKING_TIME_INTERVAL,
                    "start", start.toLocalTime(), "minuteStep", RoomPolicy.MINUTE_STEP);
        }
        return Outcome.success(interval);
    }

    /**
     * 해당 날짜 운영 시간 안의 빈 구간
     * - 겹치는 점유 구간은 합친다
     * - 빈 구간 경계는 5분 단위로 안쪽으로 맞춘다
     * - minMinutes 보다 짧은 구간은 제외
     */
    public List<Interval> freeSlotsOn(LocalDate date, ZoneId zone, int minMinutes) {
        if (date == null || zone == null || minMinutes <= 0) return List.of();

        Instant dayStart = date.atTime(LocalTime.of(RoomPolicy.OPERATING_START_HOUR, 0)).atZone(zone).toInstant();
        Instant dayEnd = date.atTime(LocalTime.of(RoomPolicy.OPERATING_END_HOUR, 0)).atZone(zone).toInstant();

        List<Instant[]> merged = new ArrayList<>();
        for (Booking booking : bookings) {
            Instant busyStart = booking.start().isAfter(dayStart) ? booking.start() : dayStart;
            Instant busyEnd = booking.end().isBefore(dayEnd) ? booking.end() : dayEnd;
            if (!busyStart.isBefore(busyEnd)) continue;

            Instant[] last = merged.isEmpty() ? null : merged.get(merged.size() - 1);
            if (last != null && !busyStart.isAfter(last[1])) {
                if (busyEnd.isAfter(last[1])) last[1] = busyEnd;
            } else {
                merged.add(new Instant[]{busyStart, busyEnd});
            }
        }

        List<Interval> freeSlots = new ArrayList<>();
        Instant previousEnd = dayStart;
        for (Instant[] busy : merged) {
            addFreeSlot(previousEnd, busy[0], zone, minMinutes, freeSlots);
            previousEnd = busy[1];
        }
        addFreeSlot(previousEnd, dayEnd, zone, minMinutes, freeSlots);
        return freeSlots;
    }

    private static void addFreeSlot(Instant gapStart, Instant gapEnd, ZoneId zone, int minMinutes,
                                    List<Interval> freeSlots) {
        if (!gapStart.isBefore(gapEnd)) return;

        Instant start = ceilToGrid(gapStart.atZone(zone));
        Instant end = floorToGrid(gapEnd.atZone(zone)).toInstant();
        if (start.isBefore(end) && ChronoUnit.MINUTES.between(start, end) >= minMinutes) {
            freeSlots.add(new Interval(start, end));
        }
    }

    private static ZonedDateTime floorToGrid(ZonedDateTime time) {
        ZonedDateTime minutes = time.truncatedTo(ChronoUnit.MINUTES);
        return minutes.minusMinutes(minutes.getMinute() % RoomPolicy.MINUTE_STEP);
    }

    private static Instant ceilToGrid(ZonedDateTime time) {
        ZonedDateTime floored = floorToGrid(time);
        return floored.equals(time)
                ? floored.toInstant()
                : floored.plusMinutes(RoomPolicy.MINUTE_STEP).toInstant();
    }

    private RoomSchedule without(Predicate<Booking> matcher) {
        List<Booking> remaining = bookings.stream().filter(matcher.negate()).toList();
        return remaining.size() == bookings.size() ? this : new RoomSchedule(remaining);
    }

    // === 조회 메서드들 ===

    public Optional<Booking> findBooking(String bookingId) {
        return bookings.stream().filter(booking -> booking.id().equals(bookingId)).findFirst();
    }

    public Optional<Booking> findBySubject(String subjectId) {
        return bookings.stream().filter(booking -> booking.isFor(subjectId)).findFirst();
    }

    /**
     * 시작 시각 순 일정 목록 (불변)
     */
    public List<Booking> bookings() {
        return bookings;
    }

    public int size() {
        return bookings.size();
    }

    public boolean isEmpty() {
        return bookings.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        RoomSchedule that = (RoomSchedule) obj;
        return bookings.equals(that.bookings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bookings);
    }

    @Override
    public String toString() {
        return String.format("RoomSchedule{bookings=%d}", bookings.size());
    }
}

package kr.cinema.be.booking.domain.room;

import kr.cinema.be.booking.domain.common.Interval;
import kr.cinema.be.booking.domain.common.exception.TechnicalException;
import kr.cinema.be.booking.domain.common.result.FailureCode;
import kr.cinema.be.booking.domain.common.result.FailureRecord;
import kr.cinema.be.booking.domain.common.result.Outcome;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * 상영관 시간 점유 (상영, 청소, 점검)
 *
 * @param id 일정 ID
 * @param subjectId 점유 대상 ID (상영이면 상영 ID, 점검/청소는 없을 수 있음)
 * @param type 일정 유형
 * @param interval 점유 구간
 */
public record Booking(String id, String subjectId, BookingType type, Interval interval) {

    public Booking {
        Objects.requireNonNull(id, "일정 ID는 필수입니다");
        Objects.requireNonNull(type, "일정 유형은 필수입니다");
        Objects.requireNonNull(interval, "일정 구간은 필수입니다");
    }

    /**
     * 새 일정 생성
     * - 상영 일정은 subjectId 필수
     * - 시작 시각은 now 이전일 수 없다
     * - 길이는 유형별 허용 범위 안이어야 한다
     */
    public static Outcome<Booking> create(String subjectId, BookingType type, Interval interval, Instant now) {
        if (type == null) return Outcome.failure(FailureRecord.missing("type"));
        if (interval == null) return Outcome.failure(FailureRecord.missing("interval"));
        if (now == null) return Outcome.failure(FailureRecord.missing("now"));

        if (type.requiresSubject() && (subjectId == null || subjectId.isBlank())) {
            return Outcome.failure(FailureRecord.missing("subjectId"));
        }
        if (interval.start().isBefore(now)) {
            return Outcome.failure(FailureCode.DATE_CANNOT_BE_PAST, "field", "start", "value", interval.start(), "now", now);
        }
        if (!type.allows(interval.duration())) {
            return Outcome.failure(FailureCode.INVALID_BOOKING_DURATION,
                    "type", type, "minutes", interval.durationInMinutes(),
                    "min", type.getMinDuration().toMinutes(), "max", type.getMaxDuration().toMinutes());
        }

        return Outcome.success(new Booking(UUID.randomUUID().toString(), subjectId, type, interval));
    }

    /**
     * 저장된 데이터로 복원 (Repository 에서 사용)
     */
    public static Booking hydrate(String id, String subjectId, BookingType type, Instant start, Instant end) {
        TechnicalException.requireFields(
                TechnicalException.fields("id", id, "type", type, "start", start, "end", end),
                FailureCode.INVALID_HYDRATE_DATA);
        TechnicalException.when(type.requiresSubject() && subjectId == null,
                FailureCode.INVALID_HYDRATE_DATA, "fields", "subjectId", "bookingId", id);

        return new Booking(id, subjectId, type, Interval.hydrate(start, end));
    }

    public boolean overlaps(Interval other) {
        return interval.overlaps(other);
    }

    public boolean isFor(String subject) {
        return subjectId != null && subjectId.equals(subject);
    }

    public Instant start() {
        return interval.start();
    }

    public Instant end() {
        return interval.end();
    }
}

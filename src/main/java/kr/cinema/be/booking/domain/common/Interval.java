package kr.cinema.be.booking.domain.common;

import kr.cinema.be.booking.domain.common.exception.TechnicalException;
import kr.cinema.be.booking.domain.common.result.FailureCode;
import kr.cinema.be.booking.domain.common.result.FailureRecord;
import kr.cinema.be.booking.domain.common.result.Outcome;

import java.time.Duration;
import java.time.Instant;

/**
 * 시작/종료 시각 쌍 Value Object
 * - start 는 항상 end 보다 앞선다 (생성 시 한 번 검증, 이후 불변)
 */
public record Interval(Instant start, Instant end) {

    public Interval {
        if (start == null || end == null) {
            throw new IllegalArgumentException("시작/종료 시각은 필수입니다");
        }
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("종료 시각은 시작 시각 이후여야 합니다");
        }
    }

    /**
     * 입력값 검증 후 생성
     */
    public static Outcome<Interval> create(Instant start, Instant end) {
        if (start == null) return Outcome.failure(FailureRecord.missing("start"));
        if (end == null) return Outcome.failure(FailureRecord.missing("end"));

        if (!end.isAfter(start)) {
            return Outcome.failure(FailureCode.INVALID_SEQUENCE, "start", start, "end", end);
        }
        return Outcome.success(new Interval(start, end));
    }

    /**
     * 저장된 데이터로 복원 (Repository 에서 사용)
     */
    public static Interval hydrate(Instant start, Instant end) {
        TechnicalException.when(start == null || end == null || !start.isBefore(end),
                FailureCode.INVALID_HYDRATE_DATA, "start", start, "end", end);
        return new Interval(start, end);
    }

    /**
     * 반열린 구간 비교: 경계만 맞닿은 경우는 겹치지 않는다
     */
    public boolean overlaps(Interval other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    /**
     * 양 끝 포함
     */
    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public long durationInMinutes() {
        return duration().toMinutes();
    }
}

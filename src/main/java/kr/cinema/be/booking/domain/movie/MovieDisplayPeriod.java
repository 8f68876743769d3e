package kr.cinema.be.booking.domain.movie;

import kr.cinema.be.booking.domain.common.exception.TechnicalException;
import kr.cinema.be.booking.domain.common.result.FailureCode;
import kr.cinema.be.booking.domain.common.result.FailureRecord;
import kr.cinema.be.booking.domain.common.result.Outcome;
import kr.cinema.be.booking.domain.movie.service.MovieDisplayPolicy;
import kr.cinema.be.booking.domain.screening.ScreeningStatus;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * 영화 상영 기간 (극장 전체 기준, 회차와 무관)
 * - 시작일: now 이후, now + 2개월 이내
 * - 종료일: 시작일 + 14일 이상, 시작일 + 30일 이내
 */
public final class MovieDisplayPeriod {

    private final Instant startDate;
    private final Instant endDate;

    private MovieDisplayPeriod(Instant startDate, Instant endDate) {
        this.startDate = startDate;
        this.endDate = endDate;
    }

    /**
     * 새 상영 기간 생성
     * - 종료일 검사는 시작일이 통과한 경우에만 수행한다
     */
    public static Outcome<MovieDisplayPeriod> create(Instant startDate, Instant endDate, Instant now) {
        if (startDate == null) return Outcome.failure(FailureRecord.missing("startDate"));

        if (startDate.isBefore(now)) {
            return Outcome.failure(FailureCode.DATE_CANNOT_BE_PAST, "field", "startDate", "value", startDate, "now", now);
        }
        Instant latestStart = now.atOffset(ZoneOffset.UTC).plusMonths(MovieDisplayPolicy.MAX_START_MONTHS_AHEAD).toInstant();
        if (startDate.isAfter(latestStart)) {
            return Outcome.failure(FailureCode.DATE_NOT_BEFORE_LIMIT, "field", "startDate", "value", startDate, "limit", latestStart);
        }

        if (endDate == null) return Outcome.failure(FailureRecord.missing("endDate"));

        Instant minEnd = startDate.plus(Duration.ofDays(MovieDisplayPolicy.MIN_DISPLAY_DAYS));
        Instant maxEnd = startDate.plus(Duration.ofDays(MovieDisplayPolicy.MAX_DISPLAY_DAYS));
        if (endDate.isBefore(minEnd)) {
            return Outcome.failure(FailureCode.INVALID_SEQUENCE, "start", startDate, "end", endDate,
                    "minDays", MovieDisplayPolicy.MIN_DISPLAY_DAYS);
        }
        if (endDate.isAfter(maxEnd)) {
            return Outcome.failure(FailureCode.DATE_NOT_BEFORE_LIMIT, "field", "endDate", "value", endDate, "limit", maxEnd);
        }

        return Outcome.success(new MovieDisplayPeriod(startDate, endDate));
    }

    /**
     * 저장된 데이터로 복원 (Repository 에서 사용)
     */
    public static MovieDisplayPeriod hydrate(Instant startDate, Instant endDate) {
        TechnicalException.requireFields(
                TechnicalException.fields("startDate", startDate, "endDate", endDate),
                FailureCode.MISSING_REQUIRED_DATA);
        TechnicalException.when(!startDate.isBefore(endDate), FailureCode.INVALID_HYDRATE_DATA,
                "startDate", startDate, "endDate", endDate);
        return new MovieDisplayPeriod(startDate, endDate);
    }

    // === 조회 메서드들 ===

    public ScreeningStatus getStatus(Instant now) {
        return ScreeningStatus.of(startDate, endDate, now);
    }

    public boolean isActive(Instant now) {
        return !now.isBefore(startDate) && !now.isAfter(endDate);
    }

    public boolean hasEnded(Instant now) {
        return now.isAfter(endDate);
    }

    public boolean hasNotStarted(Instant now) {
        return now.isBefore(startDate);
    }

    /**
     * 조회 기간과 상영 기간이 하루라도 겹치는지 (양 끝 포함)
     * - 조회 기간 경계가 없으면 false
     */
    public boolean isAvailableInRange(Instant rangeStart, Instant rangeEnd) {
        if (rangeStart == null || rangeEnd == null) return false;
        return !rangeStart.isAfter(endDate) && !rangeEnd.isBefore(startDate);
    }

    public Instant getStartDate() { return startDate; }
    public Instant getEndDate() { return endDate; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        MovieDisplayPeriod that = (MovieDisplayPeriod) obj;
        return startDate.equals(that.startDate) && endDate.equals(that.endDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startDate, endDate);
    }

    @Override
    public String toString() {
        return String.format("MovieDisplayPeriod{%s ~ %s}", startDate, endDate);
    }
}

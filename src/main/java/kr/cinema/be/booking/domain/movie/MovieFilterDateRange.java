package kr.cinema.be.booking.domain.movie;

import kr.cinema.be.booking.domain.common.Interval;
import kr.cinema.be.booking.domain.common.result.FailureCode;
import kr.cinema.be.booking.domain.common.result.FailureRecord;
import kr.cinema.be.booking.domain.common.result.Outcome;
import kr.cinema.be.booking.domain.movie.service.MovieDisplayPolicy;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * 영화 목록 조회 기간 (날짜 단위, 양 끝 포함)
 *
 * @param startDate 조회 시작일
 * @param endDate 조회 종료일
 */
public record MovieFilterDateRange(LocalDate startDate, LocalDate endDate) {

    public MovieFilterDateRange {
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("조회 시작일/종료일은 필수입니다");
        }
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("조회 종료일은 시작일보다 앞설 수 없습니다");
        }
    }

    /**
     * 조회 기간 검증 후 생성
     * - 시작일: 오늘 ~ 오늘 + 30일
     * - 종료일: 시작일 이후, 시작일 + 14일 이내
     */
    public static Outcome<MovieFilterDateRange> create(LocalDate startDate, LocalDate endDate, LocalDate today) {
        List<FailureRecord> missing = new ArrayList<>();
        if (startDate == null) missing.add(FailureRecord.missing("startDate"));
        if (endDate == null) missing.add(FailureRecord.missing("endDate"));
        if (!missing.isEmpty()) return Outcome.failure(missing);

        if (startDate.isBefore(today)) {
            return Outcome.failure(FailureCode.DATE_CANNOT_BE_PAST, "field", "startDate", "value", startDate, "now", today);
        }
        LocalDate latestStart = today.plusDays(MovieDisplayPolicy.FILTER_MAX_FUTURE_DAYS);
        if (startDate.isAfter(latestStart)) {
            return Outcome.failure(FailureCode.DATE_NOT_BEFORE_LIMIT, "field", "startDate", "value", startDate, "limit", latestStart);
        }
        if (endDate.isBefore(startDate)) {
            return Outcome.failure(FailureCode.INVALID_SEQUENCE, "start", startDate, "end", endDate);
        }
        if (ChronoUnit.DAYS.between(startDate, endDate) > MovieDisplayPolicy.FILTER_MAX_RANGE_DAYS) {
            return Outcome.failure(FailureCode.DATE_RANGE_TOO_LARGE,
                    "start", startDate, "end", endDate, "maxDays", MovieDisplayPolicy.FILTER_MAX_RANGE_DAYS);
        }

        return Outcome.success(new MovieFilterDateRange(startDate, endDate));
    }

    /**
     * 기본 조회 기간: 오늘 ~ 오늘 + 7일 (검증 없음)
     */
    public static MovieFilterDateRange createDefault(LocalDate today) {
        return new MovieFilterDateRange(today, today.plusDays(MovieDisplayPolicy.DEFAULT_FILTER_DAYS));
    }

    /**
     * 시작일 00:00 ~ 종료일 다음날 00:00 직전까지의 시각 구간
     */
    public Interval toInstantRange(ZoneId zone) {
        return new Interval(
                startDate.atStartOfDay(zone).toInstant(),
                endDate.plusDays(1).atStartOfDay(zone).toInstant().minusNanos(1));
    }
}

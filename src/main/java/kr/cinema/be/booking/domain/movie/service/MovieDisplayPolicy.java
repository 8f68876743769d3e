package kr.cinema.be.booking.domain.movie.service;

/**
 * 영화 상영 기간과 목록 조회 기간 정책
 */
public final class MovieDisplayPolicy {

    // 상영 시작일은 오늘부터 최대 2개월 이내
    public static final int MAX_START_MONTHS_AHEAD = 2;

    // 상영 기간 14일 ~ 30일
    public static final int MIN_DISPLAY_DAYS = 14;
    public static final int MAX_DISPLAY_DAYS = 30;

    // 목록 조회 기간
    public static final int FILTER_MAX_FUTURE_DAYS = 30;
    public static final int FILTER_MAX_RANGE_DAYS = 14;
    public static final int DEFAULT_FILTER_DAYS = 7;

    private MovieDisplayPolicy() {
    }
}

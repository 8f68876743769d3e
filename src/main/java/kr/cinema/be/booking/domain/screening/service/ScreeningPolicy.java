package kr.cinema.be.booking.domain.screening.service;

import java.time.Duration;

// 상영 / 좌석 점유 관련 정책
public final class ScreeningPolicy {
    private ScreeningPolicy() {}

    // 결제 진행 중 좌석 점유 유지 시간
    public static final Duration SEAT_HOLD_TTL = Duration.ofMinutes(15);

    // 상영 시작 시각 검증 시 허용하는 과거 오차 (요청~검증 사이 지연 흡수용)
    public static final Duration PAST_START_TOLERANCE = Duration.ofMinutes(5);
}

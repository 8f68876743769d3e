package kr.cinema.be.booking.application.port.out;

import kr.cinema.be.booking.domain.screening.ScreeningDisplayPeriod;

import java.util.Optional;

/**
 * 상영 회차 조회 포트
 */
public interface ScreeningPort {

    /**
     * 상영 회차 요약
     *
     * @param screeningId 상영 ID
     * @param roomId 상영관 ID
     * @param displayPeriod 상영 시작/종료 시각
     */
    record ScreeningInfo(
            String screeningId,
            String roomId,
            ScreeningDisplayPeriod displayPeriod
    ) {}

    Optional<ScreeningInfo> findById(String screeningId);
}

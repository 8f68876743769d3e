package kr.cinema.be.booking.domain.screening;

import java.time.Instant;

/**
 * 시간 기준 상영 상태
 * - 저장하지 않고 항상 (start, end, now) 로 계산한다
 * - PRESALE → SHOWING → ENDED 로만 진행 (역방향 없음)
 */
public enum ScreeningStatus {

    PRESALE("예매중", "아직 시작하지 않은 상태"),
    SHOWING("상영중", "시작했지만 끝나지 않은 상태"),
    ENDED("종료", "종료 시각이 지난 상태");

    private final String displayName;
    private final String description;

    ScreeningStatus(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 시작 시각과 종료 시각 모두 포함해서 SHOWING
     */
    public static ScreeningStatus of(Instant start, Instant end, Instant now) {
        if (now.isBefore(start)) return PRESALE;
        if (now.isAfter(end)) return ENDED;
        return SHOWING;
    }
}

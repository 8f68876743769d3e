package kr.cinema.be.booking.domain.room;

import java.time.Duration;

/**
 * 상영관 일정 유형
 * - 유형별로 허용되는 일정 길이가 다르다
 */
public enum BookingType {

    SCREENING("상영", Duration.ofMinutes(30), Duration.ofHours(6)),
    CLEANING("청소", Duration.ZERO, Duration.ofHours(2)),
    MAINTENANCE("점검", Duration.ZERO, Duration.ofDays(3));

    private final String displayName;
    private final Duration minDuration;
    private final Duration maxDuration;

    BookingType(String displayName, Duration minDuration, Duration maxDuration) {
        this.displayName = displayName;
        this.minDuration = minDuration;
        this.maxDuration = maxDuration;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Duration getMinDuration() {
        return minDuration;
    }

    public Duration getMaxDuration() {
        return maxDuration;
    }

    public boolean allows(Duration duration) {
        return duration.compareTo(minDuration) >= 0 && duration.compareTo(maxDuration) <= 0;
    }

    // 상영 일정은 대상(상영 ID)이 반드시 있어야 한다
    public boolean requiresSubject() {
        return this == SCREENING;
    }

    // 운영 시간(시작 시각) 제한은 상영 일정에만 적용. 청소/점검은 영업 종료 후에도 잡을 수 있다
    public boolean restrictedToOperatingHours() {
        return this == SCREENING;
    }
}

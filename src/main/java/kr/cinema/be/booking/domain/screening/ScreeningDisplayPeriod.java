package kr.cinema.be.booking.domain.screening;

import kr.cinema.be.booking.domain.common.exception.TechnicalException;
import kr.cinema.be.booking.domain.common.result.FailureCode;
import kr.cinema.be.booking.domain.common.result.FailureRecord;
import kr.cinema.be.booking.domain.common.result.Outcome;
import kr.cinema.be.booking.domain.screening.service.ScreeningPolicy;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 상영 한 회차의 시작/종료 시각
 * - 상태(PRESALE/SHOWING/ENDED)는 저장하지 않고 now 로 계산한다
 */
public final class ScreeningDisplayPeriod {

    private final Instant startsAt;
    private final Instant endsAt;

    private ScreeningDisplayPeriod(Instant startsAt, Instant endsAt) {
        this.startsAt = startsAt;
        this.endsAt = endsAt;
    }

    /**
     * 새 상영 기간 생성
     * - 시작 < 종료
     * - 시작 시각은 now 기준 5분 이상 과거일 수 없다
     */
    public static Outcome<ScreeningDisplayPeriod> create(Instant startsAt, Instant endsAt, Instant now) {
        List<FailureRecord> missing = new ArrayList<>();
        if (startsAt == null) missing.add(FailureRecord.missing("startsAt"));
        if (endsAt == null) missing.add(FailureRecord.missing("endsAt"));
        if (!missing.isEmpty()) return Outcome.failure(missing);

        if (!startsAt.isBefore(endsAt)) {
            return Outcome.failure(FailureCode.INVALID_SEQUENCE, "start", startsAt, "end", endsAt);
        }

        Instant earliestStart = now.minus(ScreeningPolicy.PAST_START_TOLERANCE);
        if (startsAt.isBefore(earliestStart)) {
            return Outcome.failure(FailureCode.DATE_CANNOT_BE_PAST, "field", "startsAt", "value", startsAt, "now", now);
        }

        return Outcome.success(new ScreeningDisplayPeriod(startsAt, endsAt));
    }

    /**
     * 저장된 데이터로 복원 (Repository 에서 사용)
     */
    public static ScreeningDisplayPeriod hydrate(Instant startsAt, Instant endsAt) {
        TechnicalException.requireFields(
                TechnicalException.fields("startsAt", startsAt, "endsAt", endsAt),
                FailureCode.MISSING_REQUIRED_DATA);
        TechnicalException.when(!startsAt.isBefore(endsAt), FailureCode.INVALID_HYDRATE_DATA,
                "startsAt", startsAt, "endsAt", endsAt);
        return new ScreeningDisplayPeriod(startsAt, endsAt);
    }

    // === 조회 메서드들 ===

    public ScreeningStatus getStatus(Instant now) {
        return ScreeningStatus.of(startsAt, endsAt, now);
    }

    /**
     * 예매는 상영 시작 전(PRESALE)에만 가능
     */
    public boolean isAvailableForBooking(Instant now) {
        return getStatus(now) == ScreeningStatus.PRESALE;
    }

    public long durationInMinutes() {
        return Duration.between(startsAt, endsAt).toMinutes();
    }

    public Instant getStartsAt() { return startsAt; }
    public Instant getEndsAt() { return endsAt; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        ScreeningDisplayPeriod that = (ScreeningDisplayPeriod) obj;
        return startsAt.equals(that.startsAt) && endsAt.equals(that.endsAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startsAt, endsAt);
    }

    @Override
    public String toString() {
        return String.format("ScreeningDisplayPeriod{%s ~ %s}", startsAt, endsAt);
    }
}

package kr.cinema.be.booking.domain.screening;

import kr.cinema.be.booking.domain.common.exception.TechnicalException;
import kr.cinema.be.booking.domain.common.result.FailureCode;
import kr.cinema.be.booking.domain.common.result.Outcome;
import kr.cinema.be.booking.domain.screening.service.ScreeningPolicy;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 결제 진행 중 좌석 임시 점유
 * - expiresAt = reservedAt + TTL(15분)
 * - 생성 후 변경하지 않는다. 만료되거나 결제가 끝나면 호출자가 버린다
 * - 만료 여부는 항상 호출자가 넘긴 now 로 판단한다
 */
public final class SeatReservation {

    private final String customerId;
    private final Instant reservedAt;
    private final Instant expiresAt;

    private SeatReservation(String customerId, Instant reservedAt, Instant expiresAt) {
        this.customerId = customerId;
        this.reservedAt = reservedAt;
        this.expiresAt = expiresAt;
    }

    // === 팩토리 메서드들 ===

    /**
     * 결제 시작 시점에 좌석 점유 생성
     */
    public static Outcome<SeatReservation> create(String customerId, Instant now) {
        if (customerId == null || customerId.isBlank()) {
            return Outcome.failure(FailureCode.RESERVATION_DATA_MISSING, "field", "customerId");
        }
        if (now == null) {
            return Outcome.failure(FailureCode.RESERVATION_DATA_MISSING, "field", "reservedAt");
        }
        return Outcome.success(new SeatReservation(customerId, now, now.plus(ScreeningPolicy.SEAT_HOLD_TTL)));
    }

    /**
     * 기존 점유 복원 (Repository 에서 사용)
     */
    public static SeatReservation hydrate(String customerId, Instant reservedAt, Instant expiresAt) {
        TechnicalException.requireFields(
                TechnicalException.fields("customerId", customerId, "reservedAt", reservedAt, "expiresAt", expiresAt),
                FailureCode.INVALID_HYDRATE_DATA);
        TechnicalException.when(expiresAt.isBefore(reservedAt), FailureCode.INVALID_HYDRATE_DATA,
                "reservedAt", reservedAt, "expiresAt", expiresAt);

        return new SeatReservation(customerId, reservedAt, expiresAt);
    }

    // === 조회 메서드들 ===

    /**
     * now 가 만료 시각을 지났는지. 만료 시각과 같으면 아직 유효
     */
    public boolean hasExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    public boolean isHeldBy(String otherCustomerId) {
        return customerId.equals(otherCustomerId);
    }

    /**
     * 남은 점유 시간. 만료됐으면 0
     */
    public Duration remaining(Instant now) {
        return hasExpired(now) ? Duration.ZERO : Duration.between(now, expiresAt);
    }

    // === Getters ===
    public String getCustomerId() { return customerId; }
    public Instant getReservedAt() { return reservedAt; }
    public Instant getExpiresAt() { return expiresAt; }

    // === Object methods ===

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        SeatReservation that = (SeatReservation) obj;
        return customerId.equals(that.customerId)
                && reservedAt.equals(that.reservedAt)
                && expiresAt.equals(that.expiresAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(customerId, reservedAt, expiresAt);
    }

    @Override
    public String toString() {
        return String.format("SeatReservation{customerId=%s, reservedAt=%s, expiresAt=%s}",
                customerId, reservedAt, expiresAt);
    }
}

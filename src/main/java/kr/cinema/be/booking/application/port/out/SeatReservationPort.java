package kr.cinema.be.booking.application.port.out;

import kr.cinema.be.booking.domain.room.Seat;
import kr.cinema.be.booking.domain.screening.SeatReservation;

import java.util.Optional;

/**
 * 좌석 임시 점유 저장소 포트
 * - 만료된 점유도 그대로 반환할 수 있다. 만료 판단은 도메인이 한다
 */
public interface SeatReservationPort {

    /**
     * 상영 회차의 좌석 점유 조회
     *
     * @param screeningId 상영 ID
     * @param seat 좌석
     * @return 점유 정보 (없으면 empty)
     */
    Optional<SeatReservation> findBySeat(String screeningId, Seat seat);

    /**
     * 좌석 점유 저장 (기존 점유는 덮어쓴다)
     */
    SeatReservation save(String screeningId, Seat seat, SeatReservation reservation);

    /**
     * 좌석 점유 해제
     */
    void release(String screeningId, Seat seat);
}

package kr.cinema.be.booking.application.port.out;

import kr.cinema.be.booking.domain.room.SeatLayout;

import java.util.Optional;

public interface SeatLayoutPort {

    // 상영관 좌석 배치 조회
    Optional<SeatLayout> findByRoomId(String roomId);
}

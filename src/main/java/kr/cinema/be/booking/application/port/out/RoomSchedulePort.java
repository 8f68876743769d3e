package kr.cinema.be.booking.application.port.out;

import kr.cinema.be.booking.domain.room.RoomSchedule;

import java.util.Optional;

/**
 * 상영관 일정 저장소 포트
 * - 일정이 하나도 없는 상영관은 빈 RoomSchedule 을 반환한다
 * - 존재하지 않는 상영관은 Optional.empty()
 */
public interface RoomSchedulePort {

    Optional<RoomSchedule> findByRoomId(String roomId);

    RoomSchedule save(String roomId, RoomSchedule schedule);
}

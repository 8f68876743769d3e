package kr.cinema.be.booking.application.port.in;

import kr.cinema.be.booking.domain.common.Interval;
import kr.cinema.be.booking.domain.common.result.Outcome;
import kr.cinema.be.booking.domain.room.Booking;
import kr.cinema.be.booking.domain.room.BookingType;
import kr.cinema.be.booking.domain.room.RoomSchedule;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * 상영관 일정 관리 Use Case
 */
public interface ScheduleRoomUseCase {

    // Command 객체들
    record BookCommand(
            String roomId,
            String subjectId,
            BookingType type,
            Instant start,
            Instant end
    ) {}

    record CancelCommand(
            String roomId,
            String bookingId
    ) {}

    record FreeSlotQuery(
            String roomId,
            LocalDate date,
            int minMinutes
    ) {}

    // Use Case 메서드들
    Outcome<Booking> book(BookCommand command);
    Outcome<RoomSchedule> cancel(CancelCommand command);
    List<Interval> freeSlots(FreeSlotQuery query);
}

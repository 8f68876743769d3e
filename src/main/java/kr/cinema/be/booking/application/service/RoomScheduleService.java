package kr.cinema.be.booking.application.service;

import kr.cinema.be.booking.application.port.in.ScheduleRoomUseCase;
import kr.cinema.be.booking.application.port.out.RoomSchedulePort;
import kr.cinema.be.booking.domain.common.Interval;
import kr.cinema.be.booking.domain.common.exception.ResourceNotFoundException;
import kr.cinema.be.booking.domain.common.result.Outcome;
import kr.cinema.be.booking.domain.room.Booking;
import kr.cinema.be.booking.domain.room.RoomSchedule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 상영관 일정 애플리케이션 서비스
 *
 * [일정 추가 순서]
 * 1. 구간 검증 (시작 < 종료)
 * 2. 상영 일정이면 운영 시간/5분 단위 검사
 * 3. 일정 생성 (과거 시작, 유형별 길이)
 * 4. 기존 일정과 충돌 검사 후 저장
 *
 * 검증 실패는 Outcome 으로 반환하고, 상영관이 없으면 예외를 던진다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoomScheduleService implements ScheduleRoomUseCase {

    private final RoomSchedulePort roomSchedulePort;
    private final Clock clock;

    @Override
    public Outcome<Booking> book(BookCommand command) {
        RoomSchedule schedule = loadSchedule(command.roomId());
        Instant now = Instant.now(clock);

        Outcome<Booking> result = Interval.create(command.start(), command.end())
                .flatMap(interval -> checkOperatingWindow(interval, command))
                .flatMap(interval -> Booking.create(command.subjectId(), command.type(), interval, now))
                .flatMap(booking -> schedule.withBooking(booking)
                        .tap(next -> roomSchedulePort.save(command.roomId(), next))
                        .map(next -> booking));

        if (result.isSuccess()) {
            Booking booking = result.value();
            log.info("일정 추가 완료: roomId={}, bookingId={}, type={}, {} ~ {}",
                    command.roomId(), booking.id(), booking.type(), booking.start(), booking.end());
        } else {
            log.warn("일정 추가 실패: roomId={}, type={}, failures={}", command.roomId(), command.type(), result.failures());
        }
        return result;
    }

    @Override
    public Outcome<RoomSchedule> cancel(CancelCommand command) {
        RoomSchedule schedule = loadSchedule(command.roomId());

        return schedule.removeBooking(command.bookingId())
                .tap(next -> {
                    if (next == schedule) {
                        log.debug("삭제할 일정 없음: roomId={}, bookingId={}", command.roomId(), command.bookingId());
                        return;
                    }
                    roomSchedulePort.save(command.roomId(), next);
                    log.info("일정 삭제 완료: roomId={}, bookingId={}", command.roomId(), command.bookingId());
                });
    }

    @Override
    public List<Interval> freeSlots(FreeSlotQuery query) {
        return loadSchedule(query.roomId()).freeSlotsOn(query.date(), clock.getZone(), query.minMinutes());
    }

    private Outcome<Interval> checkOperatingWindow(Interval interval, BookCommand command) {
        if (command.type() == null || !command.type().restrictedToOperatingHours()) {
            return Outcome.success(interval);
        }
        return RoomSchedule.checkOperatingWindow(interval, clock.getZone());
    }

    private RoomSchedule loadSchedule(String roomId) {
        return roomSchedulePort.findByRoomId(roomId)
                .orElseThrow(() -> ResourceNotFoundException.room(roomId));
    }
}

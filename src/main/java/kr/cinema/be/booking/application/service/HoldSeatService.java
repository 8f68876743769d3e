package kr.cinema.be.booking.application.service;

import kr.cinema.be.booking.application.port.in.HoldSeatUseCase;
import kr.cinema.be.booking.application.port.out.ScreeningPort;
import kr.cinema.be.booking.application.port.out.ScreeningPort.ScreeningInfo;
import kr.cinema.be.booking.application.port.out.SeatLayoutPort;
import kr.cinema.be.booking.application.port.out.SeatReservationPort;
import kr.cinema.be.booking.domain.common.exception.ResourceNotFoundException;
import kr.cinema.be.booking.domain.common.result.FailureCode;
import kr.cinema.be.booking.domain.common.result.Outcome;
import kr.cinema.be.booking.domain.room.Seat;
import kr.cinema.be.booking.domain.room.SeatLayout;
import kr.cinema.be.booking.domain.screening.ScreeningDisplayPeriod;
import kr.cinema.be.booking.domain.screening.SeatReservation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * 좌석 임시 점유 서비스
 * - 상영 시작 전 회차만 점유 가능
 * - 다른 고객이 점유 중이고 만료 전이면 실패
 * - 같은 고객이 다시 점유하면 만료 시각을 새로 잡는다
 * - 해제는 본인 점유 또는 만료된 점유만 가능, 점유가 없으면 그대로 성공
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HoldSeatService implements HoldSeatUseCase {

    private final ScreeningPort screeningPort;
    private final SeatLayoutPort seatLayoutPort;
    private final SeatReservationPort seatReservationPort;
    private final Clock clock;

    @Override
    public Outcome<Result> hold(Command command) {
        ScreeningInfo screening = screeningPort.findById(command.screeningId())
                .orElseThrow(() -> ResourceNotFoundException.screening(command.screeningId()));
        SeatLayout layout = seatLayoutPort.findByRoomId(screening.roomId())
                .orElseThrow(() -> ResourceNotFoundException.seatLayout(screening.roomId()));

        final Instant now = Instant.now(clock);
        ScreeningDisplayPeriod period = screening.displayPeriod();
        if (!period.isAvailableForBooking(now)) {
            log.warn("예매 불가 회차: screeningId={}, status={}", command.screeningId(), period.getStatus(now));
            return Outcome.failure(FailureCode.SCREENING_NOT_AVAILABLE,
                    "screeningId", command.screeningId(), "status", period.getStatus(now));
        }

        Outcome<Result> result = layout.locateSeat(command.column(), command.row())
                .flatMap(seat -> ensureNotHeldByOthers(command, seat, now))
                .flatMap(seat -> SeatReservation.create(command.customerId(), now)
                        .map(reservation -> seatReservationPort.save(command.screeningId(), seat, reservation))
                        .map(saved -> {
                            log.info("좌석 점유 완료: screeningId={}, seat={}, customerId={}, expiresAt={}",
                                    command.screeningId(), seat.identifier(), saved.getCustomerId(), saved.getExpiresAt());
                            return new Result(seat.identifier(), seat.preferential(), saved.getExpiresAt());
                        }));

        if (result.isFailure()) {
            log.warn("좌석 점유 실패: screeningId={}, customerId={}, failures={}",
                    command.screeningId(), command.customerId(), result.failures());
        }
        return result;
    }

    @Override
    public Outcome<String> release(ReleaseCommand command) {
        ScreeningInfo screening = screeningPort.findById(command.screeningId())
                .orElseThrow(() -> ResourceNotFoundException.screening(command.screeningId()));
        SeatLayout layout = seatLayoutPort.findByRoomId(screening.roomId())
                .orElseThrow(() -> ResourceNotFoundException.seatLayout(screening.roomId()));

        final Instant now = Instant.now(clock);
        Outcome<String> result = layout.locateSeat(command.column(), command.row())
                .<String>flatMap(seat -> {
                    Optional<SeatReservation> existing = seatReservationPort.findBySeat(command.screeningId(), seat);
                    if (existing.isEmpty()) {
                        return Outcome.success(seat.identifier());
                    }
                    SeatReservation reservation = existing.get();
                    if (!reservation.hasExpired(now) && !reservation.isHeldBy(command.customerId())) {
                        return Outcome.failure(FailureCode.SEAT_NOT_HELD_BY_CUSTOMER,
                                "seat", seat.identifier(), "customerId", command.customerId());
                    }
                    seatReservationPort.release(command.screeningId(), seat);
                    log.info("좌석 점유 해제: screeningId={}, seat={}, customerId={}",
                            command.screeningId(), seat.identifier(), command.customerId());
                    return Outcome.success(seat.identifier());
                });

        if (result.isFailure()) {
            log.warn("좌석 점유 해제 실패: screeningId={}, customerId={}, failures={}",
                    command.screeningId(), command.customerId(), result.failures());
        }
        return result;
    }

    private Outcome<Seat> ensureNotHeldByOthers(Command command, Seat seat, Instant now) {
        Optional<SeatReservation> existing = seatReservationPort.findBySeat(command.screeningId(), seat);
        if (existing.isEmpty()) {
            return Outcome.success(seat);
        }

        SeatReservation reservation = existing.get();
        if (reservation.hasExpired(now) || reservation.isHeldBy(command.customerId())) {
            return Outcome.success(seat);
        }

        log.debug("이미 점유된 좌석: screeningId={}, seat={}, expiresAt={}",
                command.screeningId(), seat.identifier(), reservation.getExpiresAt());
        return Outcome.failure(FailureCode.SEAT_ALREADY_HELD,
                "seat", seat.identifier(), "expiresAt", reservation.getExpiresAt());
    }
}

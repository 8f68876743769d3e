package kr.cinema.be.booking.application.port.in;

import kr.cinema.be.booking.domain.common.result.Outcome;

import java.time.Instant;

public interface HoldSeatUseCase {
    record Command(String screeningId, String customerId, String column, Integer row) {}
    record Result(String seat, boolean preferential, Instant holdExpiresAt) {}
    record ReleaseCommand(String screeningId, String customerId, String column, Integer row) {}
    Outcome<Result> hold(Command command);
    Outcome<String> release(ReleaseCommand command);
}

package kr.cinema.be.booking.application.port.in;

import kr.cinema.be.booking.domain.common.result.Outcome;

import java.time.LocalDate;
import java.util.List;

/**
 * 기간별 상영 영화 목록 Use Case
 */
public interface MovieListingUseCase {

    /**
     * 조회 기간. 둘 다 없으면 기본 기간(오늘 ~ 7일 후)
     */
    record Query(LocalDate startDate, LocalDate endDate) {}

    Outcome<List<String>> findAvailableMovies(Query query);
}

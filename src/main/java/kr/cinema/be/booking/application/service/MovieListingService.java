package kr.cinema.be.booking.application.service;

import kr.cinema.be.booking.application.port.in.MovieListingUseCase;
import kr.cinema.be.booking.application.port.out.MovieDisplayPeriodPort;
import kr.cinema.be.booking.domain.common.Interval;
import kr.cinema.be.booking.domain.common.result.Outcome;
import kr.cinema.be.booking.domain.movie.MovieFilterDateRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * 조회 기간에 상영하는 영화 목록
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MovieListingService implements MovieListingUseCase {

    private final MovieDisplayPeriodPort movieDisplayPeriodPort;
    private final Clock clock;

    @Override
    public Outcome<List<String>> findAvailableMovies(Query query) {
        LocalDate today = LocalDate.now(clock);

        Outcome<MovieFilterDateRange> range = query.startDate() == null && query.endDate() == null
                ? Outcome.success(MovieFilterDateRange.createDefault(today))
                : MovieFilterDateRange.create(query.startDate(), query.endDate(), today);

        if (range.isFailure()) {
            log.warn("잘못된 조회 기간: {} ~ {}, failures={}", query.startDate(), query.endDate(), range.failures());
        }

        return range.map(filter -> {
            Interval bounds = filter.toInstantRange(clock.getZone());
            List<String> movieIds = movieDisplayPeriodPort.findAll().entrySet().stream()
                    .filter(entry -> entry.getValue().isAvailableInRange(bounds.start(), bounds.end()))
                    .map(Map.Entry::getKey)
                    .sorted()
                    .toList();
            log.debug("상영 영화 조회: {} ~ {}, {}건", filter.startDate(), filter.endDate(), movieIds.size());
            return movieIds;
        });
    }
}

package kr.cinema.be.booking.application.port.out;

import kr.cinema.be.booking.domain.movie.MovieDisplayPeriod;

import java.util.Map;

public interface MovieDisplayPeriodPort {

    // 영화 ID → 상영 기간 (등록된 모든 영화)
    Map<String, MovieDisplayPeriod> findAll();
}

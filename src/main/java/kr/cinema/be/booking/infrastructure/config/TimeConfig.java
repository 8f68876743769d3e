package kr.cinema.be.booking.infrastructure.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 서비스에서 사용하는 현재 시각(Clock) 제공
 * - 도메인은 now 를 인자로만 받는다
 */
@Slf4j
@Configuration
public class TimeConfig {

    @Bean
    public Clock clock(CinemaTimeProperties properties) {
        log.info("극장 시간대 설정: {}", properties.getZone());
        return Clock.system(properties.zoneId());
    }
}

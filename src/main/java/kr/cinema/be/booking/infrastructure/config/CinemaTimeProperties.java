package kr.cinema.be.booking.infrastructure.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;

/**
 * 극장 시간 설정
 * - 운영 시간, 날짜 경계는 이 시간대 기준으로 계산한다
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "cinema.time")
public class CinemaTimeProperties {

    private String zone = "Asia/Seoul";

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }
}

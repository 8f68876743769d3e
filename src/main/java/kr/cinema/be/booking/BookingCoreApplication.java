package kr.cinema.be.booking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BookingCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(BookingCoreApplication.class, args);
    }
}

package kr.cinema.be.booking.domain.room;

import java.util.List;

/**
 * 좌석 줄 설정 입력값
 *
 * @param rowNumber 줄 번호 (1부터)
 * @param lastColumnLetter 마지막 열 문자. 'D' 이면 A~D 네 좌석
 * @param preferentialSeatLetters 우선 좌석 열 문자 목록
 */
public record SeatRowConfiguration(Integer rowNumber, String lastColumnLetter, List<String> preferentialSeatLetters) {

    public static SeatRowConfiguration of(int rowNumber, String lastColumnLetter, String... preferentialSeatLetters) {
        return new SeatRowConfiguration(rowNumber, lastColumnLetter, List.of(preferentialSeatLetters));
    }
}

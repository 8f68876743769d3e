package kr.cinema.be.booking.domain.room;

import kr.cinema.be.booking.domain.common.exception.TechnicalException;
import kr.cinema.be.booking.domain.common.result.FailureCode;
import kr.cinema.be.booking.domain.common.result.FailureRecord;
import kr.cinema.be.booking.domain.common.result.Outcome;
import kr.cinema.be.booking.domain.room.service.RoomPolicy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * 좌석 한 줄
 * - 'A' 부터 lastColumn 까지의 좌석을 가진다
 * - 우선 좌석(장애인석 등) 열 목록을 관리
 */
public final class SeatRow {

    private final char lastColumn;
    private final Set<Character> preferentialSeats;

    private SeatRow(char lastColumn, Set<Character> preferentialSeats) {
        this.lastColumn = lastColumn;
        this.preferentialSeats = Collections.unmodifiableSet(new TreeSet<>(preferentialSeats));
    }

    /**
     * 줄 설정 검증 후 생성
     *
     * @param rowNumber 줄 번호 (실패 상세 정보에만 사용)
     * @param lastColumnLetter 마지막 열 문자 ('D' 이면 A~D)
     * @param preferentialLetters 우선 좌석 열 문자 목록 (null 이면 없음)
     */
    public static Outcome<SeatRow> create(int rowNumber, String lastColumnLetter, List<String> preferentialLetters) {
        if (lastColumnLetter == null) {
            return Outcome.failure(FailureCode.MISSING_REQUIRED_DATA, "field", "lastColumnLetter", "rowNumber", rowNumber);
        }

        return validateLastColumn(rowNumber, lastColumnLetter)
                .flatMap(lastColumn -> validatePreferentialSeats(rowNumber, lastColumn,
                        preferentialLetters == null ? List.of() : preferentialLetters)
                        .map(preferential -> new SeatRow(lastColumn, preferential)));
    }

    /**
     * 저장된 데이터로 복원 (Repository 에서 사용)
     */
    public static SeatRow hydrate(String lastColumn, Collection<String> preferentialSeats) {
        char last = hydrateLetter("lastColumn", lastColumn);

        Set<Character> preferential = new TreeSet<>();
        if (preferentialSeats != null) {
            for (String seat : preferentialSeats) {
                char column = hydrateLetter("preferentialSeats", seat);
                TechnicalException.when(column > last, FailureCode.INVALID_HYDRATE_DATA,
                        "field", "preferentialSeats", "value", seat, "lastColumn", last);
                preferential.add(column);
            }
        }
        return new SeatRow(last, preferential);
    }

    private static char hydrateLetter(String field, String letter) {
        String normalized = letter == null ? "" : normalize(letter);
        TechnicalException.when(normalized.length() != 1 || !Seat.isColumnLetter(normalized.charAt(0)),
                FailureCode.INVALID_HYDRATE_DATA, "field", field, "value", letter);
        return normalized.charAt(0);
    }

    private static Outcome<Character> validateLastColumn(int rowNumber, String lastColumnLetter) {
        String normalized = normalize(lastColumnLetter);
        if (normalized.length() != 1 || !Seat.isColumnLetter(normalized.charAt(0))) {
            return Outcome.failure(FailureCode.INVALID_COLUMN_FORMAT,
                    "field", "lastColumnLetter", "rowNumber", rowNumber, "value", lastColumnLetter);
        }

        char lastColumn = normalized.charAt(0);
        int seatCount = lastColumn - 'A' + 1;
        if (seatCount < RoomPolicy.MIN_SEATS_PER_ROW || seatCount > RoomPolicy.MAX_SEATS_PER_ROW) {
            return Outcome.failure(FailureCode.SEAT_COLUMN_OUT_OF_RANGE,
                    "rowNumber", rowNumber, "value", lastColumnLetter,
                    "minSeatsPerRow", RoomPolicy.MIN_SEATS_PER_ROW,
                    "maxSeatsPerRow", RoomPolicy.MAX_SEATS_PER_ROW);
        }
        return Outcome.success(lastColumn);
    }

    private static Outcome<Set<Character>> validatePreferentialSeats(int rowNumber, char lastColumn,
                                                                     List<String> letters) {
        if (letters.size() > RoomPolicy.MAX_PREFERENTIAL_SEATS_PER_ROW) {
            return Outcome.failure(FailureCode.PREFERENTIAL_SEATS_LIMIT_EXCEEDED,
                    "rowNumber", rowNumber, "max", RoomPolicy.MAX_PREFERENTIAL_SEATS_PER_ROW);
        }

        List<FailureRecord> failures = new ArrayList<>();
        Set<Character> validated = new TreeSet<>();
        for (String letter : letters) {
            String normalized = letter == null ? "" : normalize(letter);
            if (normalized.length() != 1 || normalized.charAt(0) < 'A' || normalized.charAt(0) > lastColumn) {
                failures.add(FailureRecord.of(FailureCode.PREFERENTIAL_SEAT_NOT_IN_ROW,
                        "rowNumber", rowNumber, "value", letter, "lastColumn", lastColumn));
                continue;
            }
            if (!validated.add(normalized.charAt(0))) {
                failures.add(FailureRecord.of(FailureCode.DUPLICATE_PREFERENTIAL_SEAT,
                        "rowNumber", rowNumber, "value", normalized));
            }
        }
        return failures.isEmpty() ? Outcome.success(validated) : Outcome.failure(failures);
    }

    private static String normalize(String letter) {
        return letter.trim().toUpperCase(Locale.ROOT);
    }

    // === 조회 메서드들 ===

    public int capacity() {
        return lastColumn - 'A' + 1;
    }

    public List<Character> columns() {
        List<Character> columns = new ArrayList<>(capacity());
        for (char column = 'A'; column <= lastColumn; column++) {
            columns.add(column);
        }
        return columns;
    }

    public boolean hasSeat(char column) {
        char upper = Character.toUpperCase(column);
        return upper >= 'A' && upper <= lastColumn;
    }

    public boolean isPreferentialSeat(char column) {
        return preferentialSeats.contains(Character.toUpperCase(column));
    }

    public char getLastColumn() { return lastColumn; }
    public Set<Character> getPreferentialSeats() { return preferentialSeats; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        SeatRow that = (SeatRow) obj;
        return lastColumn == that.lastColumn && preferentialSeats.equals(that.preferentialSeats);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lastColumn, preferentialSeats);
    }

    @Override
    public String toString() {
        return String.format("SeatRow{A-%s, preferential=%s}", lastColumn, preferentialSeats);
    }
}

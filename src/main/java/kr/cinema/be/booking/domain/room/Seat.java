package kr.cinema.be.booking.domain.room;

import kr.cinema.be.booking.domain.common.exception.TechnicalException;
import kr.cinema.be.booking.domain.common.result.FailureCode;
import kr.cinema.be.booking.domain.common.result.FailureRecord;
import kr.cinema.be.booking.domain.common.result.Outcome;
import kr.cinema.be.booking.domain.room.service.RoomPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 상영관 좌석 Value Object
 * - column: 'A' ~ 'Z'
 * - row: 1 ~ 250
 * - 세 값이 모두 같아야 같은 좌석
 */
public record Seat(char column, int row, boolean preferential) {

    public Seat {
        if (!isColumnLetter(column)) {
            throw new IllegalArgumentException("좌석 열은 A~Z 여야 합니다");
        }
        if (row < 1 || row > RoomPolicy.MAX_SEAT_ROW_NUMBER) {
            throw new IllegalArgumentException("좌석 줄 번호는 1~250 사이여야 합니다");
        }
    }

    /**
     * 입력값 검증 후 좌석 생성
     * - 열은 공백 제거 + 대문자 변환 후 검증한다 (" b " → 'B')
     * - 열/줄 오류는 모두 모아서 반환한다
     */
    public static Outcome<Seat> create(String column, Number row, Boolean preferential) {
        List<FailureRecord> missing = new ArrayList<>();
        if (column == null) missing.add(FailureRecord.missing("column"));
        if (row == null) missing.add(FailureRecord.missing("row"));
        if (preferential == null) missing.add(FailureRecord.missing("preferential"));
        if (!missing.isEmpty()) return Outcome.failure(missing);

        return Outcome.combine(
                validateColumn(column),
                validateRow(row),
                (validColumn, validRow) -> new Seat(validColumn, validRow, preferential)
        );
    }

    /**
     * 저장된 데이터로 복원 (Repository 에서 사용)
     */
    public static Seat hydrate(String column, Integer row, Boolean preferential) {
        TechnicalException.requireFields(
                TechnicalException.fields("column", column, "row", row, "preferential", preferential),
                FailureCode.MISSING_REQUIRED_DATA);
        String normalized = column.trim().toUpperCase(Locale.ROOT);
        TechnicalException.when(normalized.length() != 1, FailureCode.INVALID_HYDRATE_DATA, "column", column);
        return new Seat(normalized.charAt(0), row, preferential);
    }

    public Seat withPreferentialStatus(boolean isPreferential) {
        if (preferential == isPreferential) return this;
        return new Seat(column, row, isPreferential);
    }

    /**
     * 외부 참조용 자연키 (ex: "C12")
     */
    public String identifier() {
        return String.valueOf(column) + row;
    }

    static boolean isColumnLetter(char value) {
        return value >= 'A' && value <= 'Z';
    }

    private static Outcome<Character> validateColumn(String column) {
        String normalized = column.trim().toUpperCase(Locale.ROOT);
        if (normalized.length() != 1 || !isColumnLetter(normalized.charAt(0))) {
            return Outcome.failure(FailureCode.INVALID_COLUMN_FORMAT, "field", "column", "value", column);
        }
        return Outcome.success(normalized.charAt(0));
    }

    private static Outcome<Integer> validateRow(Number row) {
        double value = row.doubleValue();

        if (Double.isNaN(value) || Double.isInfinite(value) || value != Math.rint(value)) {
            return Outcome.failure(FailureCode.VALUE_NOT_INTEGER, "field", "row", "value", row);
        }
        if (value <= 0) {
            return Outcome.failure(FailureCode.VALUE_NOT_POSITIVE, "field", "row", "value", row);
        }
        if (value > RoomPolicy.MAX_SEAT_ROW_NUMBER) {
            return Outcome.failure(FailureCode.VALUE_OUT_OF_RANGE,
                    "field", "row", "value", row, "min", 1, "max", RoomPolicy.MAX_SEAT_ROW_NUMBER);
        }
        return Outcome.success((int) value);
    }

    @Override
    public String toString() {
        return preferential ? identifier() + "(우선)" : identifier();
    }
}

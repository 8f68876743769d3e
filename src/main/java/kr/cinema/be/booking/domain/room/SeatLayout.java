package kr.cinema.be.booking.domain.room;

import kr.cinema.be.booking.domain.common.exception.TechnicalException;
import kr.cinema.be.booking.domain.common.result.FailureCode;
import kr.cinema.be.booking.domain.common.result.FailureRecord;
import kr.cinema.be.booking.domain.common.result.Outcome;
import kr.cinema.be.booking.domain.room.service.RoomPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 상영관 좌석 배치
 * - 줄 번호 → SeatRow
 * - 좌석 좌표(열, 줄)가 배치 안에 있는지 판단한다
 */
public final class SeatLayout {

    private final SortedMap<Integer, SeatRow> seatRows;
    private final int totalCapacity;

    private SeatLayout(Map<Integer, SeatRow> seatRows) {
        this.seatRows = Collections.unmodifiableSortedMap(new TreeMap<>(seatRows));
        this.totalCapacity = seatRows.values().stream().mapToInt(SeatRow::capacity).sum();
    }

    /**
     * 줄 설정 목록 검증 후 생성
     * - 줄 수 4~20, 줄 번호는 양수이며 중복 불가
     * - 전체 좌석 20~250, 우선 좌석 비율 5%~20%
     * - 줄 단위 오류와 상영관 단위 오류를 모두 모아서 반환한다
     */
    public static Outcome<SeatLayout> create(List<SeatRowConfiguration> rowConfigurations) {
        if (rowConfigurations == null) {
            return Outcome.failure(FailureRecord.missing("rowConfigurations"));
        }
        if (rowConfigurations.size() < RoomPolicy.MIN_ROW_COUNT || rowConfigurations.size() > RoomPolicy.MAX_ROW_COUNT) {
            return Outcome.failure(FailureCode.INVALID_ROW_COUNT, "value", rowConfigurations.size(),
                    "min", RoomPolicy.MIN_ROW_COUNT, "max", RoomPolicy.MAX_ROW_COUNT);
        }

        List<FailureRecord> failures = new ArrayList<>();
        Map<Integer, SeatRow> rows = new TreeMap<>();

        for (SeatRowConfiguration config : rowConfigurations) {
            if (config == null || config.rowNumber() == null) {
                failures.add(FailureRecord.missing("rowNumber"));
                continue;
            }
            int rowNumber = config.rowNumber();
            if (rowNumber <= 0) {
                failures.add(FailureRecord.of(FailureCode.VALUE_NOT_POSITIVE, "field", "rowNumber", "value", rowNumber));
                continue;
            }
            if (rows.containsKey(rowNumber)) {
                failures.add(FailureRecord.of(FailureCode.DUPLICATE_SEAT_ROW, "rowNumber", rowNumber));
                continue;
            }

            Outcome<SeatRow> seatRow = SeatRow.create(rowNumber, config.lastColumnLetter(), config.preferentialSeatLetters());
            if (seatRow.isFailure()) {
                failures.addAll(seatRow.failures());
                continue;
            }
            rows.put(rowNumber, seatRow.value());
        }

        int capacity = rows.values().stream().mapToInt(SeatRow::capacity).sum();
        if (capacity < RoomPolicy.MIN_ROOM_CAPACITY || capacity > RoomPolicy.MAX_ROOM_CAPACITY) {
            failures.add(FailureRecord.of(FailureCode.ROOM_WITH_INVALID_CAPACITY, "value", capacity,
                    "min", RoomPolicy.MIN_ROOM_CAPACITY, "max", RoomPolicy.MAX_ROOM_CAPACITY));
        }

        int preferentialCount = countPreferential(rows);
        if (preferentialCount < RoomPolicy.minPreferentialSeats(capacity)
                || preferentialCount > RoomPolicy.maxPreferentialSeats(capacity)) {
            failures.add(FailureRecord.of(FailureCode.INVALID_PREFERENTIAL_SEAT_COUNT, "value", preferentialCount,
                    "min", RoomPolicy.minPreferentialSeats(capacity), "max", RoomPolicy.maxPreferentialSeats(capacity)));
        }

        return failures.isEmpty() ? Outcome.success(new SeatLayout(rows)) : Outcome.failure(failures);
    }

    /**
     * 저장된 데이터로 복원 (Repository 에서 사용)
     */
    public static SeatLayout hydrate(Map<Integer, SeatRow> seatRows) {
        TechnicalException.when(seatRows == null || seatRows.isEmpty(),
                FailureCode.INVALID_HYDRATE_DATA, "field", "seatRows");
        return new SeatLayout(seatRows);
    }

    // === 조회 메서드들 ===

    /**
     * 줄이 존재하고, 열이 'A' ~ 해당 줄 마지막 열 사이인지
     */
    public boolean isValidSeat(Seat seat) {
        return seat != null && hasSeat(seat.row(), seat.column());
    }

    public boolean hasSeat(int rowNumber, char column) {
        SeatRow row = seatRows.get(rowNumber);
        return row != null && row.hasSeat(column);
    }

    public boolean isPreferentialSeat(int rowNumber, char column) {
        SeatRow row = seatRows.get(rowNumber);
        return row != null && row.isPreferentialSeat(column);
    }

    /**
     * 원시 입력(열 문자열, 줄 번호)을 검증해서 배치 안의 좌석으로 변환한다
     * - 우선 좌석 여부는 배치 기준으로 채운다
     */
    public Outcome<Seat> locateSeat(String column, Number row) {
        return Seat.create(column, row, false)
                .<Seat>flatMap(seat -> isValidSeat(seat)
                        ? Outcome.success(seat.withPreferentialStatus(isPreferentialSeat(seat.row(), seat.column())))
                        : Outcome.failure(FailureCode.SEAT_NOT_IN_LAYOUT, "seat", seat.identifier()));
    }

    public int totalCapacity() {
        return totalCapacity;
    }

    public int preferentialSeatCount() {
        return countPreferential(seatRows);
    }

    public Set<Integer> rowNumbers() {
        return seatRows.keySet();
    }

    public SortedMap<Integer, SeatRow> getSeatRows() {
        return seatRows;
    }

    private static int countPreferential(Map<Integer, SeatRow> rows) {
        return rows.values().stream().mapToInt(row -> row.getPreferentialSeats().size()).sum();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        SeatLayout that = (SeatLayout) obj;
        return seatRows.equals(that.seatRows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seatRows);
    }

    @Override
    public String toString() {
        return String.format("SeatLayout{rows=%d, capacity=%d}", seatRows.size(), totalCapacity);
    }
}

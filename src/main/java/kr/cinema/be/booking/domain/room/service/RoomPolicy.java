package kr.cinema.be.booking.domain.room.service;

// 상영관 좌석 배치 / 일정 관련 정책
public final class RoomPolicy {
    private RoomPolicy() {}

    // 좌석 줄 번호 상한
    public static final int MAX_SEAT_ROW_NUMBER = 250;

    // 한 줄 좌석 수 (A ~ 마지막 열)
    public static final int MIN_SEATS_PER_ROW = 4;
    public static final int MAX_SEATS_PER_ROW = 26;
    public static final int MAX_PREFERENTIAL_SEATS_PER_ROW = 4;

    // 상영관 단위
    public static final int MIN_ROW_COUNT = 4;
    public static final int MAX_ROW_COUNT = 20;
    public static final int MIN_ROOM_CAPACITY = 20;
    public static final int MAX_ROOM_CAPACITY = 250;
    public static final int MIN_PREFERENTIAL_PERCENTAGE = 5;
    public static final int MAX_PREFERENTIAL_PERCENTAGE = 20;

    // 운영 시간 (시작 시각 기준, 현지 시간)
    public static final int OPERATING_START_HOUR = 10;
    public static final int OPERATING_END_HOUR = 22;

    // 일정 시작 분 단위
    public static final int MINUTE_STEP = 5;

    public static int minPreferentialSeats(int capacity) {
        return (int) Math.ceil(capacity * MIN_PREFERENTIAL_PERCENTAGE / 100.0);
    }

    public static int maxPreferentialSeats(int capacity) {
        return (int) Math.floor(capacity * MAX_PREFERENTIAL_PERCENTAGE / 100.0);
    }
}

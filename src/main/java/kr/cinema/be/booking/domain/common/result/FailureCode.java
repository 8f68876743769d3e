package kr.cinema.be.booking.domain.common.result;

/**
 * 도메인 검증 실패 코드
 * - 호출자(상위 계층)가 코드별로 메시지/HTTP 상태를 결정한다
 */
public enum FailureCode {

    // ========== 공통 ==========
    MISSING_REQUIRED_DATA("필수값누락", "필수 데이터가 누락되었습니다"),
    INVALID_SEQUENCE("순서오류", "종료 시점이 시작 시점보다 앞서거나 같습니다"),
    VALUE_NOT_POSITIVE("양수아님", "값은 0보다 커야 합니다"),
    VALUE_OUT_OF_RANGE("범위초과", "허용 범위를 벗어난 값입니다"),
    VALUE_NOT_INTEGER("정수아님", "값은 정수여야 합니다"),
    DATE_CANNOT_BE_PAST("과거일자", "과거 시점은 허용되지 않습니다"),
    DATE_NOT_AFTER_LIMIT("하한미달", "기준 시점 이후여야 합니다"),
    DATE_NOT_BEFORE_LIMIT("상한초과", "기준 시점 이전이어야 합니다"),
    DATE_RANGE_TOO_LARGE("기간초과", "조회 기간이 너무 깁니다"),

    // ========== 좌석 ==========
    INVALID_COLUMN_FORMAT("열형식오류", "좌석 열은 알파벳 한 글자여야 합니다"),
    SEAT_COLUMN_OUT_OF_RANGE("열개수오류", "한 줄의 좌석 수가 허용 범위를 벗어났습니다"),
    PREFERENTIAL_SEATS_LIMIT_EXCEEDED("우선석초과", "한 줄의 우선 좌석 수를 초과했습니다"),
    PREFERENTIAL_SEAT_NOT_IN_ROW("우선석위치오류", "우선 좌석이 해당 줄에 존재하지 않습니다"),
    DUPLICATE_PREFERENTIAL_SEAT("우선석중복", "우선 좌석이 중복 지정되었습니다"),
    INVALID_ROW_COUNT("줄수오류", "좌석 줄 수가 허용 범위를 벗어났습니다"),
    DUPLICATE_SEAT_ROW("줄번호중복", "좌석 줄 번호가 중복되었습니다"),
    ROOM_WITH_INVALID_CAPACITY("수용인원오류", "상영관 좌석 수가 허용 범위를 벗어났습니다"),
    INVALID_PREFERENTIAL_SEAT_COUNT("우선석비율오류", "우선 좌석 비율이 허용 범위를 벗어났습니다"),
    SEAT_NOT_IN_LAYOUT("좌석없음", "상영관 배치에 없는 좌석입니다"),

    // ========== 상영관 일정 ==========
    BOOKING_CONFLICT("일정충돌", "다른 일정과 시간이 겹칩니다"),
    DUPLICATE_BOOKING("일정중복", "이미 등록된 일정입니다"),
    INVALID_BOOKING_DURATION("일정길이오류", "일정 유형의 허용 길이를 벗어났습니다"),
    ROOM_OPERATING_HOURS_VIOLATION("운영시간외", "상영관 운영 시간을 벗어났습니다"),
    INVALID_BOOKING_TIME_INTERVAL("시작분오류", "시작 시각은 5분 단위여야 합니다"),

    // ========== 좌석 예약 ==========
    RESERVATION_DATA_MISSING("예약정보누락", "좌석 예약에 필요한 정보가 누락되었습니다"),
    SEAT_ALREADY_HELD("점유중", "다른 고객이 점유 중인 좌석입니다"),
    SEAT_NOT_HELD_BY_CUSTOMER("점유자불일치", "본인이 점유한 좌석이 아닙니다"),
    SCREENING_NOT_AVAILABLE("예매불가", "예매 가능한 상영이 아닙니다"),

    // ========== 기술 오류 ==========
    INVALID_HYDRATE_DATA("복원데이터오류", "저장된 데이터로 객체를 복원할 수 없습니다"),
    INVALID_COMBINE_INPUT("결합입력오류", "결합할 결과 목록이 없습니다");

    private final String displayName;
    private final String description;

    FailureCode(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }
}

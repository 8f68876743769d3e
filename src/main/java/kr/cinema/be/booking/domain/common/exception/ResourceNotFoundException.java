package kr.cinema.be.booking.domain.common.exception;

/**
 * 조회 대상(상영관, 상영, 영화)을 찾을 수 없을 때 발생하는 예외
 * - 검증 실패가 아니라 조회 실패이므로 Outcome 이 아닌 예외로 전달한다
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    // 편의 팩토리 메서드들
    public static ResourceNotFoundException room(String roomId) {
        return new ResourceNotFoundException(
                String.format("상영관을 찾을 수 없습니다. ID: %s", roomId)
        );
    }

    public static ResourceNotFoundException screening(String screeningId) {
        return new ResourceNotFoundException(
                String.format("상영 정보를 찾을 수 없습니다. ID: %s", screeningId)
        );
    }

    public static ResourceNotFoundException seatLayout(String roomId) {
        return new ResourceNotFoundException(
                String.format("상영관 좌석 배치를 찾을 수 없습니다. 상영관 ID: %s", roomId)
        );
    }
}

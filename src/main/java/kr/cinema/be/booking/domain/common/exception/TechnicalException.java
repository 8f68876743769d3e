package kr.cinema.be.booking.domain.common.exception;

import kr.cinema.be.booking.domain.common.result.FailureCode;
import kr.cinema.be.booking.domain.common.result.FailureRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 복구 불가능한 기술 오류
 * - 신뢰된 저장소에서 복원(hydrate)하는 도중 내부 불변식이 깨진 경우 등
 * - 사용자 입력 오류가 아니라 상위 계층의 버그를 의미하므로 Outcome 이 아닌 예외로 던진다
 */
public class TechnicalException extends RuntimeException {

    private final FailureRecord failure;

    public TechnicalException(FailureRecord failure) {
        super(String.format("TechnicalError: %s - %s %s",
                failure.code(), failure.code().getDescription(), failure.details()));
        this.failure = failure;
    }

    public FailureRecord getFailure() {
        return failure;
    }

    public FailureCode getCode() {
        return failure.code();
    }

    // 편의 팩토리 메서드들

    /**
     * 조건이 참이면 TechnicalException 을 던진다
     */
    public static void when(boolean condition, FailureCode code, Object... keyValues) {
        if (condition) {
            throw new TechnicalException(FailureRecord.of(code, keyValues));
        }
    }

    /**
     * null 인 필드가 하나라도 있으면 필드 이름을 모아 TechnicalException 을 던진다
     * (LinkedHashMap 등 null 값을 허용하는 맵을 넘겨야 한다)
     */
    public static void requireFields(Map<String, Object> fields, FailureCode code) {
        List<String> nullFields = new ArrayList<>();
        fields.forEach((name, value) -> {
            if (value == null) {
                nullFields.add(name);
            }
        });
        when(!nullFields.isEmpty(), code, "fields", nullFields);
    }

    public static Map<String, Object> fields(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("fields 는 key, value 쌍이어야 합니다");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            fields.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return fields;
    }
}

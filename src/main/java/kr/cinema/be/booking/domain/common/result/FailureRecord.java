package kr.cinema.be.booking.domain.common.result;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 검증 실패 한 건을 나타내는 Value Object
 * - code: 위반한 규칙
 * - details: 메시지 렌더링에 필요한 값 (입력 순서 유지, null 값은 제외)
 */
public record FailureRecord(FailureCode code, Map<String, Object> details) {

    public FailureRecord {
        Objects.requireNonNull(code, "실패 코드는 필수입니다");
        details = details == null ? Map.of() : copyWithoutNulls(details);
    }

    public static FailureRecord of(FailureCode code) {
        return new FailureRecord(code, Map.of());
    }

    /**
     * key, value 쌍을 번갈아 받아 details 를 구성한다
     * ex) FailureRecord.of(VALUE_OUT_OF_RANGE, "field", "row", "max", 250)
     */
    public static FailureRecord of(FailureCode code, Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("details 는 key, value 쌍이어야 합니다");
        }
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            details.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return new FailureRecord(code, details);
    }

    public static FailureRecord missing(String field) {
        return of(FailureCode.MISSING_REQUIRED_DATA, "field", field);
    }

    public Object detail(String key) {
        return details.get(key);
    }

    private static Map<String, Object> copyWithoutNulls(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return details.isEmpty() ? code.name() : code.name() + details;
    }
}

package kr.cinema.be.booking.domain.common.result;

import kr.cinema.be.booking.domain.common.exception.TechnicalException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 검증 결과를 나타내는 타입
 * - Success: 검증된 값
 * - Failure: 하나 이상의 FailureRecord
 *
 * <p>비즈니스 규칙 위반은 예외가 아니라 Failure 로 반환한다.
 * 변환 함수에서 발생한 예외는 Failure 로 바꾸지 않고 그대로 호출자에게 전파한다.
 *
 * <pre>{@code
 * layout.locateSeat(column, row)
 *         .flatMap(seat -> reserve(seat))
 *         .fold(reservation -> accept(reservation), failures -> reject(failures));
 * }</pre>
 */
public sealed interface Outcome<T> permits Outcome.Success, Outcome.Failure {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * 성공 값. Failure 에서 호출하면 IllegalStateException
     */
    T value();

    /**
     * 실패 목록. Success 이면 빈 리스트
     */
    List<FailureRecord> failures();

    default boolean hasFailure(FailureCode code) {
        return failures().stream().anyMatch(failure -> failure.code() == code);
    }

    /**
     * 성공 값을 변환한다. Failure 는 그대로 통과
     */
    <U> Outcome<U> map(Function<? super T, ? extends U> fn);

    /**
     * 의존 관계가 있는 검증을 연결한다. 첫 실패에서 멈춘다 (combine 과 달리 누적하지 않음)
     */
    <U> Outcome<U> flatMap(Function<? super T, Outcome<U>> fn);

    <U> U fold(Function<? super T, ? extends U> onSuccess,
               Function<? super List<FailureRecord>, ? extends U> onFailure);

    /**
     * 성공일 때만 부수 효과를 실행하고 자기 자신을 반환한다
     */
    Outcome<T> tap(Consumer<? super T> action);

    <U> CompletableFuture<Outcome<U>> mapAsync(Function<? super T, ? extends CompletionStage<U>> fn);

    <U> CompletableFuture<Outcome<U>> flatMapAsync(
            Function<? super T, ? extends CompletionStage<Outcome<U>>> fn);

    // === 팩토리 메서드들 ===

    static <T> Outcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Outcome<T> failure(FailureRecord failure) {
        return new Failure<>(List.of(failure));
    }

    static <T> Outcome<T> failure(List<FailureRecord> failures) {
        return new Failure<>(failures);
    }

    static <T> Outcome<T> failure(FailureCode code, Object... keyValues) {
        return failure(FailureRecord.of(code, keyValues));
    }

    // === 결합 ===

    /**
     * 순서 있는 결과 목록을 하나로 합친다.
     * 모두 성공이면 값 목록, 하나라도 실패면 모든 실패를 입력 순서대로 모은 Failure
     */
    static Outcome<List<Object>> combine(List<? extends Outcome<?>> outcomes) {
        TechnicalException.when(outcomes == null, FailureCode.INVALID_COMBINE_INPUT);

        List<FailureRecord> failures = new ArrayList<>();
        List<Object> values = new ArrayList<>();
        for (Outcome<?> outcome : outcomes) {
            if (outcome.isFailure()) {
                failures.addAll(outcome.failures());
            } else {
                values.add(outcome.value());
            }
        }
        return failures.isEmpty()
                ? success(Collections.unmodifiableList(values))
                : failure(failures);
    }

    /**
     * 이름 붙은 결과들을 하나로 합친다. 값 맵은 입력 순서를 유지한다
     */
    static Outcome<Map<String, Object>> combine(Map<String, ? extends Outcome<?>> outcomes) {
        TechnicalException.when(outcomes == null, FailureCode.INVALID_COMBINE_INPUT);

        List<FailureRecord> failures = new ArrayList<>();
        Map<String, Object> values = new LinkedHashMap<>();
        outcomes.forEach((name, outcome) -> {
            if (outcome.isFailure()) {
                failures.addAll(outcome.failures());
            } else {
                values.put(name, outcome.value());
            }
        });
        return failures.isEmpty()
                ? success(Collections.unmodifiableMap(values))
                : failure(failures);
    }

    /**
     * 두 필드를 각각 검증한 뒤 하나의 값으로 조립한다. 실패는 누적된다
     */
    static <A, B, R> Outcome<R> combine(Outcome<A> first, Outcome<B> second,
                                        BiFunction<? super A, ? super B, ? extends R> combiner) {
        if (first.isSuccess() && second.isSuccess()) {
            return success(combiner.apply(first.value(), second.value()));
        }
        List<FailureRecord> failures = new ArrayList<>(first.failures());
        failures.addAll(second.failures());
        return failure(failures);
    }

    // === 구현 ===

    record Success<T>(T value) implements Outcome<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public List<FailureRecord> failures() {
            return List.of();
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> fn) {
            return new Success<>(fn.apply(value));
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, Outcome<U>> fn) {
            return Objects.requireNonNull(fn.apply(value), "flatMap 함수는 null 을 반환할 수 없습니다");
        }

        @Override
        public <U> U fold(Function<? super T, ? extends U> onSuccess,
                          Function<? super List<FailureRecord>, ? extends U> onFailure) {
            return onSuccess.apply(value);
        }

        @Override
        public Outcome<T> tap(Consumer<? super T> action) {
            action.accept(value);
            return this;
        }

        @Override
        public <U> CompletableFuture<Outcome<U>> mapAsync(Function<? super T, ? extends CompletionStage<U>> fn) {
            return fn.apply(value).<Outcome<U>>thenApply(Outcome::success).toCompletableFuture();
        }

        @Override
        public <U> CompletableFuture<Outcome<U>> flatMapAsync(
                Function<? super T, ? extends CompletionStage<Outcome<U>>> fn) {
            return fn.apply(value).toCompletableFuture();
        }
    }

    record Failure<T>(List<FailureRecord> failures) implements Outcome<T> {

        public Failure {
            if (failures == null || failures.isEmpty()) {
                throw new IllegalArgumentException("Failure 는 최소 한 건의 실패를 가져야 합니다");
            }
            failures = List.copyOf(failures);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException("실패 결과에는 값이 없습니다: " + failures);
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> fn) {
            return new Failure<>(failures);
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, Outcome<U>> fn) {
            return new Failure<>(failures);
        }

        @Override
        public <U> U fold(Function<? super T, ? extends U> onSuccess,
                          Function<? super List<FailureRecord>, ? extends U> onFailure) {
            return onFailure.apply(failures);
        }

        @Override
        public Outcome<T> tap(Consumer<? super T> action) {
            return this;
        }

        @Override
        public <U> CompletableFuture<Outcome<U>> mapAsync(Function<? super T, ? extends CompletionStage<U>> fn) {
            return CompletableFuture.completedFuture(new Failure<>(failures));
        }

        @Override
        public <U> CompletableFuture<Outcome<U>> flatMapAsync(
                Function<? super T, ? extends CompletionStage<Outcome<U>>> fn) {
            return CompletableFuture.completedFuture(new Failure<>(failures));
        }
    }
}

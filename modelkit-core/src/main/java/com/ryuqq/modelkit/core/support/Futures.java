package com.ryuqq.modelkit.core.support;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * CompletableFuture 조합 유틸리티.
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public final class Futures {

    // Utility class - prevent instantiation
    private Futures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 비동기 작업을 executor에서 시작.
     *
     * <p>task가 동기적으로 던진 예외도 반환된 future의 실패로 전달됩니다.</p>
     *
     * @param executor 실행자
     * @param task future를 반환하는 작업
     * @param <T> 결과 타입
     * @return 작업 결과 future
     */
    public static <T> CompletableFuture<T> fork(Executor executor, Supplier<CompletableFuture<T>> task) {
        return CompletableFuture.supplyAsync(task, executor).thenCompose(Function.identity());
    }

    /**
     * future 목록을 함께 기다려 순서를 유지한 결과 목록으로 변환.
     *
     * @param futures future 목록
     * @param <T> 결과 타입
     * @return 모든 결과 (입력 순서)
     */
    public static <T> CompletableFuture<List<T>> allAsList(List<CompletableFuture<T>> futures) {
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
            .thenApply(ignored -> {
                List<T> results = new ArrayList<>(futures.size());
                for (CompletableFuture<T> future : futures) {
                    results.add(future.join());
                }
                return results;
            });
    }

    /**
     * 키별 future를 함께 기다려 키 순서대로 결과를 target에 기록.
     *
     * @param pending 키 → future (순서 유지 Map)
     * @param target 결과를 기록할 Map
     * @return 모든 기록이 끝나면 완료되는 future
     */
    public static CompletableFuture<Void> allInto(
        Map<String, ? extends CompletableFuture<?>> pending,
        Map<String, Object> target
    ) {
        return CompletableFuture.allOf(pending.values().toArray(new CompletableFuture<?>[0]))
            .thenRun(() -> pending.forEach((key, future) -> target.put(key, future.join())));
    }
}

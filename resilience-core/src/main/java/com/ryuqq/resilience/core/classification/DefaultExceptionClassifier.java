package com.ryuqq.resilience.core.classification;

import com.ryuqq.resilience.core.exception.PermanentServiceException;
import com.ryuqq.resilience.core.exception.ServiceCallException;
import com.ryuqq.resilience.core.exception.TransientServiceException;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * 기본 예외 분류기.
 *
 * <p><strong>분류 규칙 (위에서부터 먼저 일치하는 규칙 적용):</strong></p>
 * <ol>
 *   <li>{@link CompletionException}, {@link ExecutionException}은 cause로 풀어서 분류</li>
 *   <li>{@link TransientServiceException} (RateLimitException 포함) → Transient</li>
 *   <li>{@link PermanentServiceException} → Permanent</li>
 *   <li>{@link ServiceCallException}: 429, 5xx → Transient / 그 외 → Permanent</li>
 *   <li>{@link IOException} 계열 (연결 거부/리셋, DNS, 소켓 타임아웃), {@link TimeoutException} → Transient</li>
 *   <li>{@link IllegalArgumentException}, {@link UnsupportedOperationException} → Permanent</li>
 *   <li>null 또는 알 수 없는 예외 → Permanent</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DefaultExceptionClassifier implements ExceptionClassifier {

    private static final int TOO_MANY_REQUESTS = 429;
    private static final int MAX_UNWRAP_DEPTH = 10;

    @Override
    public Classification classify(Throwable throwable) {
        Throwable target = unwrap(throwable);
        if (target == null) {
            return new Permanent("no exception");
        }

        String type = target.getClass().getSimpleName();

        if (target instanceof TransientServiceException) {
            return new Transient(type);
        }
        if (target instanceof PermanentServiceException) {
            return new Permanent(type);
        }
        if (target instanceof ServiceCallException callException) {
            int status = callException.getStatusCode();
            if (status == TOO_MANY_REQUESTS || callException.isServerError()) {
                return new Transient("HTTP " + status);
            }
            return new Permanent("HTTP " + status);
        }
        if (target instanceof IOException || target instanceof TimeoutException) {
            return new Transient(type);
        }
        if (target instanceof IllegalArgumentException || target instanceof UnsupportedOperationException) {
            return new Permanent(type);
        }
        return new Permanent("unclassified " + type);
    }

    /**
     * 비동기 래퍼 예외를 실제 원인으로 변환.
     *
     * @param throwable 예외
     * @return 래퍼가 아닌 예외 (null 가능)
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        int depth = 0;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null
            && depth++ < MAX_UNWRAP_DEPTH) {
            current = current.getCause();
        }
        return current;
    }
}

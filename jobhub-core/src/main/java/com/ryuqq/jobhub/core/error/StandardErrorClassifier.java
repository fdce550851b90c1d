package com.ryuqq.jobhub.core.error;

import java.util.Locale;
import java.util.OptionalInt;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 기본 실패 분류기.
 *
 * <p><strong>분류 규칙 (위에서부터 순서대로):</strong></p>
 * <ol>
 *   <li>CompletionException / ExecutionException은 원인으로 unwrap</li>
 *   <li>{@link ClassificationHint#category()}가 있으면 그대로 사용</li>
 *   <li>401 또는 메시지에 "authentication" 포함 → AUTHENTICATION</li>
 *   <li>403 + 메시지에 "rate limit" 포함 → RATE_LIMITED</li>
 *   <li>403 → AUTHORIZATION</li>
 *   <li>400 → VALIDATION</li>
 *   <li>429 → RATE_LIMITED</li>
 *   <li>그 외 → TRANSIENT</li>
 * </ol>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
final class StandardErrorClassifier implements ErrorClassifier {

    static final StandardErrorClassifier INSTANCE = new StandardErrorClassifier();

    private StandardErrorClassifier() {
    }

    @Override
    public ErrorCategory classify(Throwable error) {
        Throwable root = unwrap(error);
        if (root == null) {
            return ErrorCategory.TRANSIENT;
        }

        OptionalInt status = OptionalInt.empty();
        if (root instanceof ClassificationHint) {
            ClassificationHint hint = (ClassificationHint) root;
            if (hint.category().isPresent()) {
                return hint.category().get();
            }
            status = hint.statusCode();
        }

        String message = root.getMessage() == null ? "" : root.getMessage().toLowerCase(Locale.ROOT);
        int code = status.orElse(-1);

        if (code == 401 || message.contains("authentication")) {
            return ErrorCategory.AUTHENTICATION;
        }
        if (code == 403) {
            return message.contains("rate limit") ? ErrorCategory.RATE_LIMITED : ErrorCategory.AUTHORIZATION;
        }
        if (code == 400) {
            return ErrorCategory.VALIDATION;
        }
        if (code == 429) {
            return ErrorCategory.RATE_LIMITED;
        }
        return ErrorCategory.TRANSIENT;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

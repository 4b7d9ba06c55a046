package me.golemcore.memory.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.memory.domain.model.GenerationFailureKind;
import me.golemcore.memory.domain.model.LlmResponse;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Maps generation failures to a {@link GenerationFailureKind}.
 *
 * <p>
 * langchain4j exceptions are matched by class name so the domain layer does
 * not depend on the provider library. Status hints in messages (401, 403,
 * 429) are used as a fallback for transports that only report HTTP codes.
 */
public final class LlmErrorClassifier {

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_RATE_LIMIT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException";
    private static final String CLASS_TIMEOUT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException";
    private static final String CLASS_AUTHENTICATION_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "AuthenticationException";
    // Status codes as standalone tokens, so "4013 tokens" is not a 401
    private static final Pattern AUTH_STATUS_PATTERN = Pattern.compile("(?<!\\d)40[13](?!\\d)");
    private static final Pattern RATE_LIMIT_STATUS_PATTERN = Pattern.compile("(?<!\\d)429(?!\\d)");

    private LlmErrorClassifier() {
    }

    /**
     * Classify an empty completion.
     */
    public static GenerationFailureKind classifyResponse(LlmResponse response) {
        if (response == null || response.getContent() == null || response.getContent().isBlank()) {
            return GenerationFailureKind.EMPTY_RESPONSE;
        }
        return GenerationFailureKind.OTHER;
    }

    /**
     * Classify a failure by walking its cause chain.
     */
    public static GenerationFailureKind classify(Throwable throwable) {
        if (throwable == null) {
            return GenerationFailureKind.OTHER;
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            GenerationFailureKind byType = classifyKnownThrowable(current);
            if (byType != GenerationFailureKind.OTHER) {
                return byType;
            }

            GenerationFailureKind byMessage = classifyFromMessage(current.getMessage());
            if (byMessage != GenerationFailureKind.OTHER) {
                return byMessage;
            }

            current = current.getCause();
        }
        return GenerationFailureKind.OTHER;
    }

    private static GenerationFailureKind classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return GenerationFailureKind.TIMEOUT;
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return GenerationFailureKind.OTHER;
        }
        return switch (className) {
        case CLASS_RATE_LIMIT_EXCEPTION -> GenerationFailureKind.RATE_LIMIT;
        case CLASS_TIMEOUT_EXCEPTION -> GenerationFailureKind.TIMEOUT;
        case CLASS_AUTHENTICATION_EXCEPTION -> GenerationFailureKind.AUTHENTICATION;
        default -> GenerationFailureKind.OTHER;
        };
    }

    private static GenerationFailureKind classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return GenerationFailureKind.OTHER;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        if (AUTH_STATUS_PATTERN.matcher(normalized).find() || normalized.contains("unauthorized")
                || normalized.contains("invalid api key") || normalized.contains("incorrect api key")) {
            return GenerationFailureKind.AUTHENTICATION;
        }
        if (RATE_LIMIT_STATUS_PATTERN.matcher(normalized).find() || normalized.contains("rate_limit") || normalized.contains("rate limit")
                || normalized.contains("too many requests")) {
            return GenerationFailureKind.RATE_LIMIT;
        }
        if (normalized.contains("timed out") || normalized.contains("timeout")) {
            return GenerationFailureKind.TIMEOUT;
        }
        return GenerationFailureKind.OTHER;
    }
}

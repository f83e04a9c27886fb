package me.golemcore.flow.domain.system;

import me.golemcore.flow.domain.model.ModelErrorKind;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Maps chat-completion failures to {@link ModelErrorKind}.
 *
 * <p>
 * Adapters may tag a diagnostic with a machine-readable code
 * ({@code "[llm.not_configured] ..."}); an embedded code always wins. Otherwise
 * the cause chain is inspected by langchain4j exception class name, HTTP status
 * and well-known JDK network exceptions.
 */
public final class LlmErrorClassifier {

    public static final String NOT_CONFIGURED = "llm.not_configured";
    public static final String RATE_LIMIT = "llm.rate_limit";
    public static final String AUTHENTICATION = "llm.authentication";
    public static final String MODEL_UNAVAILABLE = "llm.model_unavailable";
    public static final String TIMEOUT = "llm.timeout";
    public static final String CONTEXT_LENGTH_EXCEEDED = "llm.context.length_exceeded";
    public static final String INVALID_REQUEST = "llm.invalid_request";

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_RATE_LIMIT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException";
    private static final String CLASS_TIMEOUT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException";
    private static final String CLASS_AUTHENTICATION_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "AuthenticationException";
    private static final String CLASS_INVALID_REQUEST_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InvalidRequestException";
    private static final String CLASS_MODEL_NOT_FOUND_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ModelNotFoundException";
    private static final String CLASS_INTERNAL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InternalServerException";
    private static final String CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "UnresolvedModelServerException";
    private static final String CLASS_HTTP_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "HttpException";

    private LlmErrorClassifier() {
    }

    /**
     * Classify an LLM failure based on structured throwable types/cause chain.
     */
    public static ModelErrorKind classify(Throwable throwable) {
        if (throwable == null) {
            return ModelErrorKind.UNKNOWN;
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            ModelErrorKind embedded = fromCode(extractCode(current.getMessage()));
            if (embedded != ModelErrorKind.UNKNOWN) {
                return embedded;
            }

            ModelErrorKind byType = classifyKnownThrowable(current);
            if (byType != ModelErrorKind.UNKNOWN) {
                return byType;
            }

            ModelErrorKind byMessage = classifyFromMessage(current.getMessage());
            if (byMessage != ModelErrorKind.UNKNOWN) {
                return byMessage;
            }

            current = current.getCause();
        }
        return ModelErrorKind.UNKNOWN;
    }

    /**
     * Prefix a human diagnostic with a machine-readable code.
     */
    public static String withCode(String code, String message) {
        if (message == null || message.isBlank()) {
            return "[" + code + "]";
        }
        if (message.startsWith("[" + code + "]")) {
            return message;
        }
        return "[" + code + "] " + message;
    }

    /**
     * Extract a code from diagnostics like: "[llm.some.code] details".
     */
    public static String extractCode(String message) {
        if (message == null || message.isBlank() || message.charAt(0) != '[') {
            return null;
        }
        int end = message.indexOf(']');
        if (end <= 1) {
            return null;
        }
        return message.substring(1, end);
    }

    public static boolean isTransient(ModelErrorKind kind) {
        return kind == ModelErrorKind.RATE_LIMIT
                || kind == ModelErrorKind.TIMEOUT
                || kind == ModelErrorKind.MODEL_UNAVAILABLE;
    }

    private static ModelErrorKind fromCode(String code) {
        if (code == null) {
            return ModelErrorKind.UNKNOWN;
        }
        return switch (code) {
        case NOT_CONFIGURED -> ModelErrorKind.NOT_CONFIGURED;
        case RATE_LIMIT -> ModelErrorKind.RATE_LIMIT;
        case AUTHENTICATION -> ModelErrorKind.AUTHENTICATION;
        case MODEL_UNAVAILABLE -> ModelErrorKind.MODEL_UNAVAILABLE;
        case TIMEOUT -> ModelErrorKind.TIMEOUT;
        case CONTEXT_LENGTH_EXCEEDED -> ModelErrorKind.CONTEXT_OVERFLOW;
        case INVALID_REQUEST -> ModelErrorKind.INVALID_REQUEST;
        default -> ModelErrorKind.UNKNOWN;
        };
    }

    private static ModelErrorKind classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return ModelErrorKind.TIMEOUT;
        }
        if (throwable instanceof ConnectException || throwable instanceof UnknownHostException) {
            return ModelErrorKind.MODEL_UNAVAILABLE;
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return ModelErrorKind.UNKNOWN;
        }

        if (CLASS_RATE_LIMIT_EXCEPTION.equals(className)) {
            return ModelErrorKind.RATE_LIMIT;
        }
        if (CLASS_TIMEOUT_EXCEPTION.equals(className)) {
            return ModelErrorKind.TIMEOUT;
        }
        if (CLASS_AUTHENTICATION_EXCEPTION.equals(className)) {
            return ModelErrorKind.AUTHENTICATION;
        }
        if (CLASS_INVALID_REQUEST_EXCEPTION.equals(className)) {
            return ModelErrorKind.INVALID_REQUEST;
        }
        if (CLASS_MODEL_NOT_FOUND_EXCEPTION.equals(className)
                || CLASS_INTERNAL_SERVER_EXCEPTION.equals(className)
                || CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION.equals(className)) {
            return ModelErrorKind.MODEL_UNAVAILABLE;
        }
        if (CLASS_HTTP_EXCEPTION.equals(className)) {
            return classifyHttpExceptionByStatus(throwable);
        }
        return ModelErrorKind.UNKNOWN;
    }

    private static ModelErrorKind classifyHttpExceptionByStatus(Throwable throwable) {
        Integer statusCode = readHttpStatusCode(throwable);
        if (statusCode == null) {
            return ModelErrorKind.UNKNOWN;
        }
        if (statusCode == 429) {
            return ModelErrorKind.RATE_LIMIT;
        }
        if (statusCode == 401 || statusCode == 403) {
            return ModelErrorKind.AUTHENTICATION;
        }
        if (statusCode == 408 || statusCode == 504) {
            return ModelErrorKind.TIMEOUT;
        }
        if (statusCode >= 500) {
            return ModelErrorKind.MODEL_UNAVAILABLE;
        }
        if (statusCode >= 400) {
            return ModelErrorKind.INVALID_REQUEST;
        }
        return ModelErrorKind.UNKNOWN;
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer) {
                return (Integer) result;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException ignored) {
            return null;
        }
        return null;
    }

    private static ModelErrorKind classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return ModelErrorKind.UNKNOWN;
        }

        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("context length")
                || normalized.contains("context window")
                || normalized.contains("maximum context")
                || normalized.contains("token limit exceeded")
                || normalized.contains("prompt is too long")) {
            return ModelErrorKind.CONTEXT_OVERFLOW;
        }

        return ModelErrorKind.UNKNOWN;
    }
}

package in.pollwall.service;

import in.pollwall.domain.error.DomainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Uniform error logging around service operations.
 *
 * Domain rejections are logged at WARN without a stack trace, anything else at ERROR
 * with one. Context values whose key looks like a credential are masked. The original
 * exception is always rethrown.
 */
public final class ServiceErrorLogger {
    private static final Logger log = LoggerFactory.getLogger(ServiceErrorLogger.class);

    private static final String MASK = "***";
    private static final String[] SENSITIVE_KEYS = {"password", "token", "secret", "authorization"};

    public static <T> T call(String operation, Map<String, ?> context, Supplier<T> body) {
        try {
            return body.get();
        } catch (DomainException e) {
            log.warn("[{}] {}: {} context={}", operation, e.getClass().getSimpleName(), e.getMessage(), scrub(context));
            throw e;
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected failure: {} context={}", operation, e.getMessage(), scrub(context), e);
            throw e;
        }
    }

    public static void run(String operation, Map<String, ?> context, Runnable body) {
        call(operation, context, () -> {
            body.run();
            return null;
        });
    }

    /**
     * Ordered context map from alternating keys and values. Values may be null.
     */
    public static Map<String, Object> context(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("context needs key/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }

    static Map<String, Object> scrub(Map<String, ?> context) {
        if (context == null || context.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> safe = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : context.entrySet()) {
            safe.put(entry.getKey(), isSensitive(entry.getKey()) ? MASK : entry.getValue());
        }
        return safe;
    }

    private static boolean isSensitive(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        for (String sensitive : SENSITIVE_KEYS) {
            if (lower.contains(sensitive)) {
                return true;
            }
        }
        return false;
    }

    private ServiceErrorLogger() {}
}

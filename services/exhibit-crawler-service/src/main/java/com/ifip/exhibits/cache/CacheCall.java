package com.ifip.exhibits.cache;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.util.DigestUtils;

/**
 * Fingerprint ignores argument order and the identity keywords.
 */
public record CacheCall(String operation, List<String> args, Map<String, String> kwargs) {

    public static final String USER_AGENT = "userAgent";
    public static final String SESSION = "session";

    private static final Set<String> EXCLUDED_KEYWORDS = Set.of(USER_AGENT, SESSION);

    public CacheCall {
        Objects.requireNonNull(operation, "operation");
        args = List.copyOf(args);
        kwargs = Map.copyOf(kwargs);
    }

    public static CacheCall of(String operation, Object... args) {
        List<String> values = Arrays.stream(args).map(String::valueOf).toList();
        return new CacheCall(operation, values, Map.of());
    }

    public CacheCall with(String key, Object value) {
        Map<String, String> merged = new LinkedHashMap<>(kwargs);
        merged.put(key, String.valueOf(value));
        return new CacheCall(operation, args, merged);
    }

    public String fingerprint() {
        List<String> sortedArgs = new ArrayList<>(args);
        sortedArgs.sort(null);
        String keywords = kwargs.entrySet().stream()
            .filter(entry -> !EXCLUDED_KEYWORDS.contains(entry.getKey()))
            .map(entry -> entry.getKey() + "=" + entry.getValue())
            .sorted()
            .collect(Collectors.joining(","));
        String signature = operation + "|" + String.join(",", sortedArgs) + "|" + keywords;
        return DigestUtils.md5DigestAsHex(signature.getBytes(StandardCharsets.UTF_8));
    }
}

package com.taskmanager.backend.global.cache;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Builds cache keys of the form {@code prefix:endpoint:owner:<id>:<param>=<value>:...}.
 * Every key is scoped to one owner so two users never share an entry.
 */
public final class CacheKeys {

    private static final String NULL_TOKEN = "~";

    private CacheKeys() {
    }

    public static String of(String prefix, String endpoint, Long ownerId, Object... params) {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        if (params.length % 2 != 0) {
            throw new IllegalArgumentException("params must be name/value pairs");
        }
        StringJoiner joiner = new StringJoiner(":");
        joiner.add(prefix).add(endpoint).add("owner").add(ownerId.toString());
        for (int i = 0; i < params.length; i += 2) {
            joiner.add(params[i] + "=" + encode(params[i + 1]));
        }
        return joiner.toString();
    }

    private static String encode(Object value) {
        if (value == null) {
            return NULL_TOKEN;
        }
        // separators inside user-supplied values are percent-escaped
        return value.toString()
                .replace("%", "%25")
                .replace(":", "%3A")
                .replace("=", "%3D")
                .replace("~", "%7E");
    }
}

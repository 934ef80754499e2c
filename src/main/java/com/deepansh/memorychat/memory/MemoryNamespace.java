package com.deepansh.memorychat.memory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Deterministic store namespace for a (user, profile) pair: {@code userId:profileId},
 * with "default" standing in for a missing profile.
 *
 * Each part is URL-encoded, so a ':' inside an id becomes {@code %3A} and two
 * different pairs can never share a namespace. Plain alphanumeric ids are left
 * as they are.
 */
public final class MemoryNamespace {

    public static final String DEFAULT_PROFILE = "default";

    private static final String SEPARATOR = ":";

    private MemoryNamespace() {
    }

    public static String of(String userId, String profileId) {
        String user = userId == null || userId.isBlank() ? "default" : userId;
        String profile = profileId == null || profileId.isBlank() ? DEFAULT_PROFILE : profileId;
        return encode(user) + SEPARATOR + encode(profile);
    }

    private static String encode(String part) {
        return URLEncoder.encode(part, StandardCharsets.UTF_8);
    }
}

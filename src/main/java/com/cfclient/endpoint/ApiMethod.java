package com.cfclient.endpoint;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The fixed set of remote methods. The wire name is the path segment after the API root.
 */
public enum ApiMethod {
    BLOG_ENTRY_COMMENTS("blogEntry.comments"),
    BLOG_ENTRY_VIEW("blogEntry.view"),
    CONTEST_HACKS("contest.hacks"),
    CONTEST_LIST("contest.list"),
    CONTEST_RATING_CHANGES("contest.ratingChanges"),
    CONTEST_STANDINGS("contest.standings"),
    CONTEST_STATUS("contest.status"),
    PROBLEMSET_PROBLEMS("problemset.problems"),
    PROBLEMSET_RECENT_STATUS("problemset.recentStatus"),
    RECENT_ACTIONS("recentActions"),
    USER_BLOG_ENTRIES("user.blogEntries"),
    USER_FRIENDS("user.friends"),
    USER_INFO("user.info"),
    USER_RATED_LIST("user.ratedList"),
    USER_RATING("user.rating"),
    USER_STATUS("user.status");

    private static final Map<String, ApiMethod> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ApiMethod::wireName, Function.identity()));

    private final String wireName;

    ApiMethod(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @throws IllegalArgumentException when the name is not one of the supported methods
     */
    public static ApiMethod fromWireName(String wireName) {
        ApiMethod method = BY_WIRE_NAME.get(wireName);
        if (method == null) {
            throw new IllegalArgumentException("Unsupported Codeforces method: " + wireName);
        }
        return method;
    }

    @Override
    public String toString() {
        return wireName;
    }
}

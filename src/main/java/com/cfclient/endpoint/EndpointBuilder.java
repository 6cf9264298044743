package com.cfclient.endpoint;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the endpoint for each remote method. Pure: no I/O, no clock.
 * <p>
 * Parameters are emitted in the order the API documents them. A null optional is left out of the
 * query entirely. Booleans are rendered as {@code True}/{@code False}, which the API expects verbatim.
 */
public final class EndpointBuilder {

    public static final String DEFAULT_API_ROOT = "https://codeforces.com/api";

    private final String apiRoot;

    public EndpointBuilder() {
        this(DEFAULT_API_ROOT);
    }

    public EndpointBuilder(String apiRoot) {
        if (apiRoot == null || apiRoot.isBlank()) {
            throw new IllegalArgumentException("apiRoot must not be blank");
        }
        this.apiRoot = apiRoot.endsWith("/") ? apiRoot.substring(0, apiRoot.length() - 1) : apiRoot;
    }

    public String apiRoot() {
        return apiRoot;
    }

    public String url(Endpoint endpoint) {
        return endpoint.toUrl(apiRoot);
    }

    public Endpoint blogEntryComments(long blogEntryId) {
        return new Params()
                .put("blogEntryId", blogEntryId)
                .build(ApiMethod.BLOG_ENTRY_COMMENTS);
    }

    public Endpoint blogEntryView(long blogEntryId) {
        return new Params()
                .put("blogEntryId", blogEntryId)
                .build(ApiMethod.BLOG_ENTRY_VIEW);
    }

    public Endpoint contestHacks(int contestId, Boolean asManager) {
        return new Params()
                .put("contestId", contestId)
                .put("asManager", asManager)
                .build(ApiMethod.CONTEST_HACKS);
    }

    public Endpoint contestList(Boolean gym) {
        return new Params()
                .put("gym", gym)
                .build(ApiMethod.CONTEST_LIST);
    }

    public Endpoint contestRatingChanges(int contestId) {
        return new Params()
                .put("contestId", contestId)
                .build(ApiMethod.CONTEST_RATING_CHANGES);
    }

    /**
     * @param from 1-based index of the first ranklist row
     */
    public Endpoint contestStandings(int contestId, Boolean asManager, Integer from, Integer count,
                                     Boolean showUnofficial) {
        return new Params()
                .put("contestId", contestId)
                .put("asManager", asManager)
                .put("from", from)
                .put("count", count)
                .put("showUnofficial", showUnofficial)
                .build(ApiMethod.CONTEST_STANDINGS);
    }

    public Endpoint contestStatus(int contestId, Boolean asManager, String handle, Integer from, Integer count) {
        return new Params()
                .put("contestId", contestId)
                .put("asManager", asManager)
                .put("handle", blankToNull(handle))
                .put("from", from)
                .put("count", count)
                .build(ApiMethod.CONTEST_STATUS);
    }

    /**
     * tags and problemsetName are exclusive filters; tags wins when both are given.
     */
    public Endpoint problemsetProblems(String tags, String problemsetName) {
        Params params = new Params();
        if (blankToNull(tags) != null) {
            params.put("tags", tags);
        } else if (blankToNull(problemsetName) != null) {
            params.put("problemsetName", problemsetName);
        }
        return params.build(ApiMethod.PROBLEMSET_PROBLEMS);
    }

    public Endpoint problemsetProblems(List<String> tags, String problemsetName) {
        String joined = tags == null || tags.isEmpty() ? null : String.join(";", tags);
        return problemsetProblems(joined, problemsetName);
    }

    public Endpoint problemsetRecentStatus(int count, String problemsetName) {
        return new Params()
                .put("count", count)
                .put("problemsetName", blankToNull(problemsetName))
                .build(ApiMethod.PROBLEMSET_RECENT_STATUS);
    }

    public Endpoint recentActions(int maxCount) {
        return new Params()
                .put("maxCount", maxCount)
                .build(ApiMethod.RECENT_ACTIONS);
    }

    public Endpoint userBlogEntries(String handle) {
        return new Params()
                .put("handle", requireHandle(handle))
                .build(ApiMethod.USER_BLOG_ENTRIES);
    }

    public Endpoint userFriends(Boolean onlyOnline) {
        return new Params()
                .put("onlyOnline", onlyOnline)
                .build(ApiMethod.USER_FRIENDS);
    }

    /**
     * @param handles semicolon-separated handles, e.g. "tourist;Petr"
     */
    public Endpoint userInfo(String handles, Boolean checkHistoricHandles) {
        if (handles == null || handles.isBlank()) {
            throw new IllegalArgumentException("handles must not be blank");
        }
        return new Params()
                .put("handles", handles)
                .put("checkHistoricHandles", checkHistoricHandles)
                .build(ApiMethod.USER_INFO);
    }

    public Endpoint userInfo(List<String> handles, Boolean checkHistoricHandles) {
        if (handles == null || handles.isEmpty()) {
            throw new IllegalArgumentException("handles must not be empty");
        }
        handles.forEach(EndpointBuilder::requireHandle);
        return userInfo(String.join(";", handles), checkHistoricHandles);
    }

    public Endpoint userRatedList(Boolean activeOnly, Boolean includeRetired, Integer contestId) {
        return new Params()
                .put("activeOnly", activeOnly)
                .put("includeRetired", includeRetired)
                .put("contestId", contestId)
                .build(ApiMethod.USER_RATED_LIST);
    }

    public Endpoint userRating(String handle) {
        return new Params()
                .put("handle", requireHandle(handle))
                .build(ApiMethod.USER_RATING);
    }

    public Endpoint userStatus(String handle, Integer from, Integer count) {
        return new Params()
                .put("handle", requireHandle(handle))
                .put("from", from)
                .put("count", count)
                .build(ApiMethod.USER_STATUS);
    }

    static String render(Object value) {
        if (value instanceof Boolean b) {
            return b ? "True" : "False";
        }
        return String.valueOf(value);
    }

    private static String requireHandle(String handle) {
        if (handle == null || handle.isBlank()) {
            throw new IllegalArgumentException("handle must not be blank");
        }
        return handle;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    /** Ordered parameter accumulator; null values are skipped. */
    private static final class Params {

        private final Map<String, String> values = new LinkedHashMap<>();

        Params put(String key, Object value) {
            if (value != null) {
                values.put(key, render(value));
            }
            return this;
        }

        Endpoint build(ApiMethod method) {
            return new Endpoint(method, values);
        }
    }
}

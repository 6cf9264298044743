package com.cfclient.client;

import com.cfclient.domain.BlogEntry;
import com.cfclient.domain.Comment;
import com.cfclient.domain.Contest;
import com.cfclient.domain.Hack;
import com.cfclient.domain.ProblemSetProblems;
import com.cfclient.domain.RatingChange;
import com.cfclient.domain.RecentAction;
import com.cfclient.domain.Standings;
import com.cfclient.domain.Submission;
import com.cfclient.domain.User;
import com.cfclient.endpoint.EndpointBuilder;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Non-blocking Codeforces client. Every method returns a cold {@link Mono}: nothing is sent until
 * subscription, and cancelling the subscription abandons the request.
 * <p>
 * Results are always lists, even for methods that return a single object. Failures surface as
 * {@link com.cfclient.common.CodeforcesApiException} (API said FAILED),
 * {@link com.cfclient.common.CodeforcesTransportException} or
 * {@link com.cfclient.common.CodeforcesDecodingException}. Invalid arguments throw immediately.
 * <p>
 * Optional parameters are nullable; null leaves the parameter out of the request.
 */
public class ReactiveCodeforcesClient implements AutoCloseable {

    private final CodeforcesRequestPipeline pipeline;
    private final EndpointBuilder endpoints;

    public ReactiveCodeforcesClient(CodeforcesRequestPipeline pipeline) {
        this.pipeline = pipeline;
        this.endpoints = pipeline.endpoints();
    }

    public static CodeforcesClientBuilder builder() {
        return new CodeforcesClientBuilder();
    }

    /**
     * Unsigned client for the public API with default transport settings.
     */
    public static ReactiveCodeforcesClient create() {
        return builder().buildReactive();
    }

    // blogEntry.*

    public Mono<List<Comment>> getBlogEntryComments(long blogEntryId) {
        return pipeline.execute(endpoints.blogEntryComments(blogEntryId), Comment.class);
    }

    public Mono<List<BlogEntry>> getBlogEntryView(long blogEntryId) {
        return pipeline.execute(endpoints.blogEntryView(blogEntryId), BlogEntry.class);
    }

    // contest.*

    public Mono<List<Hack>> getContestHacks(int contestId) {
        return getContestHacks(contestId, null);
    }

    public Mono<List<Hack>> getContestHacks(int contestId, Boolean asManager) {
        return pipeline.execute(endpoints.contestHacks(contestId, asManager), Hack.class);
    }

    public Mono<List<Contest>> getContestList() {
        return getContestList(null);
    }

    /**
     * @param gym true for gym contests only, false for regular contests only, null for the server default
     */
    public Mono<List<Contest>> getContestList(Boolean gym) {
        return pipeline.execute(endpoints.contestList(gym), Contest.class);
    }

    public Mono<List<RatingChange>> getContestRatingChanges(int contestId) {
        return pipeline.execute(endpoints.contestRatingChanges(contestId), RatingChange.class);
    }

    public Mono<List<Standings>> getContestStandings(int contestId) {
        return getContestStandings(contestId, null, null, null, null);
    }

    public Mono<List<Standings>> getContestStandings(int contestId, Integer from, Integer count) {
        return getContestStandings(contestId, null, from, count, null);
    }

    public Mono<List<Standings>> getContestStandings(int contestId, Boolean asManager, Integer from, Integer count,
                                                     Boolean showUnofficial) {
        return pipeline.execute(endpoints.contestStandings(contestId, asManager, from, count, showUnofficial),
                Standings.class);
    }

    public Mono<List<Submission>> getContestStatus(int contestId) {
        return getContestStatus(contestId, null, null, null, null);
    }

    public Mono<List<Submission>> getContestStatus(int contestId, String handle) {
        return getContestStatus(contestId, null, handle, null, null);
    }

    public Mono<List<Submission>> getContestStatus(int contestId, Boolean asManager, String handle, Integer from,
                                                   Integer count) {
        return pipeline.execute(endpoints.contestStatus(contestId, asManager, handle, from, count), Submission.class);
    }

    // problemset.*

    public Mono<List<ProblemSetProblems>> getProblemsetProblems() {
        return getProblemsetProblems((String) null, null);
    }

    public Mono<List<ProblemSetProblems>> getProblemsetProblems(List<String> tags) {
        return pipeline.execute(endpoints.problemsetProblems(tags, null), ProblemSetProblems.class);
    }

    /**
     * @param tags           semicolon-separated tags; takes precedence over problemsetName
     * @param problemsetName custom problemset short name, used only when tags is null
     */
    public Mono<List<ProblemSetProblems>> getProblemsetProblems(String tags, String problemsetName) {
        return pipeline.execute(endpoints.problemsetProblems(tags, problemsetName), ProblemSetProblems.class);
    }

    public Mono<List<Submission>> getProblemsetRecentStatus(int count) {
        return getProblemsetRecentStatus(count, null);
    }

    public Mono<List<Submission>> getProblemsetRecentStatus(int count, String problemsetName) {
        return pipeline.execute(endpoints.problemsetRecentStatus(count, problemsetName), Submission.class);
    }

    public Mono<List<RecentAction>> getRecentActions(int maxCount) {
        return pipeline.execute(endpoints.recentActions(maxCount), RecentAction.class);
    }

    // user.*

    public Mono<List<BlogEntry>> getUserBlogEntries(String handle) {
        return pipeline.execute(endpoints.userBlogEntries(handle), BlogEntry.class);
    }

    /**
     * Requires a signed client; friends of the key owner.
     */
    public Mono<List<String>> getUserFriends() {
        return getUserFriends(null);
    }

    public Mono<List<String>> getUserFriends(Boolean onlyOnline) {
        return pipeline.execute(endpoints.userFriends(onlyOnline), String.class);
    }

    /**
     * @param handles one handle or several separated by ';'
     */
    public Mono<List<User>> getUserInfo(String handles) {
        return getUserInfo(handles, null);
    }

    public Mono<List<User>> getUserInfo(String handles, Boolean checkHistoricHandles) {
        return pipeline.execute(endpoints.userInfo(handles, checkHistoricHandles), User.class);
    }

    public Mono<List<User>> getUserInfo(List<String> handles, Boolean checkHistoricHandles) {
        return pipeline.execute(endpoints.userInfo(handles, checkHistoricHandles), User.class);
    }

    public Mono<List<User>> getUserRatedList() {
        return getUserRatedList(null, null, null);
    }

    public Mono<List<User>> getUserRatedList(Boolean activeOnly, Boolean includeRetired, Integer contestId) {
        return pipeline.execute(endpoints.userRatedList(activeOnly, includeRetired, contestId), User.class);
    }

    public Mono<List<RatingChange>> getUserRating(String handle) {
        return pipeline.execute(endpoints.userRating(handle), RatingChange.class);
    }

    public Mono<List<Submission>> getUserStatus(String handle) {
        return getUserStatus(handle, null, null);
    }

    public Mono<List<Submission>> getUserStatus(String handle, Integer from, Integer count) {
        return pipeline.execute(endpoints.userStatus(handle, from, count), Submission.class);
    }

    public boolean isClosed() {
        return pipeline.isClosed();
    }

    /**
     * Releases the connection pool. Requests already in flight may fail; later calls fail with IllegalStateException.
     */
    @Override
    public void close() {
        pipeline.close();
    }
}

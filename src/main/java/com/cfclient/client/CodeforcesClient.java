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
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Blocking Codeforces client. Each call parks the calling thread until the response is decoded.
 * Backed by a {@link ReactiveCodeforcesClient}; must not be called from a reactor event-loop thread.
 */
public class CodeforcesClient implements AutoCloseable {

    private final ReactiveCodeforcesClient delegate;

    public CodeforcesClient(ReactiveCodeforcesClient delegate) {
        this.delegate = delegate;
    }

    public static CodeforcesClientBuilder builder() {
        return new CodeforcesClientBuilder();
    }

    public static CodeforcesClient create() {
        return builder().build();
    }

    public ReactiveCodeforcesClient reactive() {
        return delegate;
    }

    public List<Comment> getBlogEntryComments(long blogEntryId) {
        return await(delegate.getBlogEntryComments(blogEntryId));
    }

    public List<BlogEntry> getBlogEntryView(long blogEntryId) {
        return await(delegate.getBlogEntryView(blogEntryId));
    }

    public List<Hack> getContestHacks(int contestId) {
        return await(delegate.getContestHacks(contestId));
    }

    public List<Hack> getContestHacks(int contestId, Boolean asManager) {
        return await(delegate.getContestHacks(contestId, asManager));
    }

    public List<Contest> getContestList() {
        return await(delegate.getContestList());
    }

    public List<Contest> getContestList(Boolean gym) {
        return await(delegate.getContestList(gym));
    }

    public List<RatingChange> getContestRatingChanges(int contestId) {
        return await(delegate.getContestRatingChanges(contestId));
    }

    public List<Standings> getContestStandings(int contestId) {
        return await(delegate.getContestStandings(contestId));
    }

    public List<Standings> getContestStandings(int contestId, Integer from, Integer count) {
        return await(delegate.getContestStandings(contestId, from, count));
    }

    public List<Standings> getContestStandings(int contestId, Boolean asManager, Integer from, Integer count,
                                               Boolean showUnofficial) {
        return await(delegate.getContestStandings(contestId, asManager, from, count, showUnofficial));
    }

    public List<Submission> getContestStatus(int contestId) {
        return await(delegate.getContestStatus(contestId));
    }

    public List<Submission> getContestStatus(int contestId, String handle) {
        return await(delegate.getContestStatus(contestId, handle));
    }

    public List<Submission> getContestStatus(int contestId, Boolean asManager, String handle, Integer from,
                                             Integer count) {
        return await(delegate.getContestStatus(contestId, asManager, handle, from, count));
    }

    public List<ProblemSetProblems> getProblemsetProblems() {
        return await(delegate.getProblemsetProblems());
    }

    public List<ProblemSetProblems> getProblemsetProblems(List<String> tags) {
        return await(delegate.getProblemsetProblems(tags));
    }

    public List<ProblemSetProblems> getProblemsetProblems(String tags, String problemsetName) {
        return await(delegate.getProblemsetProblems(tags, problemsetName));
    }

    public List<Submission> getProblemsetRecentStatus(int count) {
        return await(delegate.getProblemsetRecentStatus(count));
    }

    public List<Submission> getProblemsetRecentStatus(int count, String problemsetName) {
        return await(delegate.getProblemsetRecentStatus(count, problemsetName));
    }

    public List<RecentAction> getRecentActions(int maxCount) {
        return await(delegate.getRecentActions(maxCount));
    }

    public List<BlogEntry> getUserBlogEntries(String handle) {
        return await(delegate.getUserBlogEntries(handle));
    }

    public List<String> getUserFriends() {
        return await(delegate.getUserFriends());
    }

    public List<String> getUserFriends(Boolean onlyOnline) {
        return await(delegate.getUserFriends(onlyOnline));
    }

    public List<User> getUserInfo(String handles) {
        return await(delegate.getUserInfo(handles));
    }

    public List<User> getUserInfo(String handles, Boolean checkHistoricHandles) {
        return await(delegate.getUserInfo(handles, checkHistoricHandles));
    }

    public List<User> getUserInfo(List<String> handles, Boolean checkHistoricHandles) {
        return await(delegate.getUserInfo(handles, checkHistoricHandles));
    }

    public List<User> getUserRatedList() {
        return await(delegate.getUserRatedList());
    }

    public List<User> getUserRatedList(Boolean activeOnly, Boolean includeRetired, Integer contestId) {
        return await(delegate.getUserRatedList(activeOnly, includeRetired, contestId));
    }

    public List<RatingChange> getUserRating(String handle) {
        return await(delegate.getUserRating(handle));
    }

    public List<Submission> getUserStatus(String handle) {
        return await(delegate.getUserStatus(handle));
    }

    public List<Submission> getUserStatus(String handle, Integer from, Integer count) {
        return await(delegate.getUserStatus(handle, from, count));
    }

    public boolean isClosed() {
        return delegate.isClosed();
    }

    @Override
    public void close() {
        delegate.close();
    }

    private static <T> List<T> await(Mono<List<T>> call) {
        List<T> result = call.block();
        return result != null ? result : List.of();
    }
}

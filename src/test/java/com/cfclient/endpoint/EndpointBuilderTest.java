package com.cfclient.endpoint;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class EndpointBuilderTest {

    private static final String API = "https://codeforces.com/api/";

    private final EndpointBuilder builder = new EndpointBuilder();

    static Stream<Arguments> everyOptionalSet() {
        return Stream.of(
                call(b -> b.blogEntryComments(79), "blogEntry.comments?blogEntryId=79"),
                call(b -> b.blogEntryView(79), "blogEntry.view?blogEntryId=79"),
                call(b -> b.contestHacks(566, true), "contest.hacks?contestId=566&asManager=True"),
                call(b -> b.contestList(true), "contest.list?gym=True"),
                call(b -> b.contestRatingChanges(566), "contest.ratingChanges?contestId=566"),
                call(b -> b.contestStandings(566, true, 1, 5, false),
                        "contest.standings?contestId=566&asManager=True&from=1&count=5&showUnofficial=False"),
                call(b -> b.contestStatus(566, false, "tourist", 1, 10),
                        "contest.status?contestId=566&asManager=False&handle=tourist&from=1&count=10"),
                call(b -> b.problemsetProblems("implementation", null), "problemset.problems?tags=implementation"),
                call(b -> b.problemsetRecentStatus(10, "acmsguru"),
                        "problemset.recentStatus?count=10&problemsetName=acmsguru"),
                call(b -> b.recentActions(30), "recentActions?maxCount=30"),
                call(b -> b.userBlogEntries("Fefer_Ivan"), "user.blogEntries?handle=Fefer_Ivan"),
                call(b -> b.userFriends(true), "user.friends?onlyOnline=True"),
                call(b -> b.userInfo("DmitriyH;Fefer_Ivan", true),
                        "user.info?handles=DmitriyH;Fefer_Ivan&checkHistoricHandles=True"),
                call(b -> b.userRatedList(true, false, 566),
                        "user.ratedList?activeOnly=True&includeRetired=False&contestId=566"),
                call(b -> b.userRating("Fefer_Ivan"), "user.rating?handle=Fefer_Ivan"),
                call(b -> b.userStatus("Fefer_Ivan", 1, 10), "user.status?handle=Fefer_Ivan&from=1&count=10"));
    }

    static Stream<Arguments> everyOptionalUnset() {
        return Stream.of(
                call(b -> b.blogEntryComments(79), "blogEntry.comments?blogEntryId=79"),
                call(b -> b.blogEntryView(79), "blogEntry.view?blogEntryId=79"),
                call(b -> b.contestHacks(566, null), "contest.hacks?contestId=566"),
                call(b -> b.contestList(null), "contest.list"),
                call(b -> b.contestRatingChanges(566), "contest.ratingChanges?contestId=566"),
                call(b -> b.contestStandings(566, null, null, null, null), "contest.standings?contestId=566"),
                call(b -> b.contestStatus(566, null, null, null, null), "contest.status?contestId=566"),
                call(b -> b.problemsetProblems((String) null, null), "problemset.problems"),
                call(b -> b.problemsetRecentStatus(10, null), "problemset.recentStatus?count=10"),
                call(b -> b.recentActions(30), "recentActions?maxCount=30"),
                call(b -> b.userBlogEntries("Fefer_Ivan"), "user.blogEntries?handle=Fefer_Ivan"),
                call(b -> b.userFriends(null), "user.friends"),
                call(b -> b.userInfo("DmitriyH;Fefer_Ivan", null), "user.info?handles=DmitriyH;Fefer_Ivan"),
                call(b -> b.userRatedList(null, null, null), "user.ratedList"),
                call(b -> b.userRating("Fefer_Ivan"), "user.rating?handle=Fefer_Ivan"),
                call(b -> b.userStatus("Fefer_Ivan", null, null), "user.status?handle=Fefer_Ivan"));
    }

    private static Arguments call(Function<EndpointBuilder, Endpoint> build, String expected) {
        return Arguments.of(expected.split("\\?")[0], build, API + expected);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("everyOptionalSet")
    @DisplayName("every optional set: exact URL with True/False booleans")
    void urlWithEveryOptionalSet(String method, Function<EndpointBuilder, Endpoint> build, String expected) {
        Endpoint endpoint = build.apply(builder);

        assertThat(endpoint.method().wireName()).isEqualTo(method);
        assertThat(builder.url(endpoint)).isEqualTo(expected);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("everyOptionalUnset")
    @DisplayName("every optional null: only required parameters remain")
    void urlWithEveryOptionalUnset(String method, Function<EndpointBuilder, Endpoint> build, String expected) {
        Endpoint endpoint = build.apply(builder);

        assertThat(endpoint.method().wireName()).isEqualTo(method);
        assertThat(builder.url(endpoint)).isEqualTo(expected);
    }

    @Test
    void urlTablesCoverEveryMethod() {
        Set<String> covered = everyOptionalSet()
                .map(args -> (String) args.get()[0])
                .collect(Collectors.toSet());

        assertThat(covered).containsExactlyInAnyOrderElementsOf(
                Arrays.stream(ApiMethod.values()).map(ApiMethod::wireName).toList());
        assertThat(everyOptionalUnset().count()).isEqualTo(ApiMethod.values().length);
    }

    @Test
    @DisplayName("booleans go on the wire as True/False")
    void booleansAreCapitalized() {
        assertThat(builder.url(builder.contestList(false)))
                .isEqualTo("https://codeforces.com/api/contest.list?gym=False");
        assertThat(builder.url(builder.contestList(true)))
                .isEqualTo("https://codeforces.com/api/contest.list?gym=True");
    }

    @Test
    @DisplayName("unset optionals are left out, including the '?'")
    void unsetOptionalsOmitted() {
        assertThat(builder.url(builder.contestList(null)))
                .isEqualTo("https://codeforces.com/api/contest.list");
        assertThat(builder.url(builder.userStatus("tourist", null, 10)))
                .isEqualTo("https://codeforces.com/api/user.status?handle=tourist&count=10");
    }

    @Test
    @DisplayName("contest.standings keeps documented parameter order")
    void standingsParameterOrder() {
        Endpoint endpoint = builder.contestStandings(566, null, 1, 5, true);

        assertThat(endpoint.method()).isEqualTo(ApiMethod.CONTEST_STANDINGS);
        assertThat(endpoint.params()).containsExactly(
                entry("contestId", "566"),
                entry("from", "1"),
                entry("count", "5"),
                entry("showUnofficial", "True"));
    }

    @Test
    @DisplayName("problemset.problems sends tags or problemsetName, never both")
    void problemsetFiltersAreExclusive() {
        assertThat(builder.problemsetProblems("implementation", "acmsguru").params())
                .containsOnlyKeys("tags");
        assertThat(builder.problemsetProblems((String) null, "acmsguru").params())
                .containsOnlyKeys("problemsetName");
        assertThat(builder.problemsetProblems((String) null, null).params()).isEmpty();
    }

    @Test
    @DisplayName("tag list is joined with ';' and the separator stays literal")
    void tagListJoined() {
        assertThat(builder.url(builder.problemsetProblems(List.of("dp", "greedy"), null)))
                .isEqualTo("https://codeforces.com/api/problemset.problems?tags=dp;greedy");
    }

    @Test
    @DisplayName("user.info URL parses back to the parameters it was built from")
    void userInfoRoundTrip() {
        String url = builder.url(builder.userInfo("A;B", true));

        assertThat(url).isEqualTo("https://codeforces.com/api/user.info?handles=A;B&checkHistoricHandles=True");
        String query = url.substring(url.indexOf('?') + 1);
        assertThat(QueryStrings.parse(query))
                .containsEntry("handles", "A;B")
                .containsEntry("checkHistoricHandles", "True")
                .hasSize(2);
    }

    @Test
    @DisplayName("handle list overload matches the joined string form")
    void handleListOverload() {
        assertThat(builder.userInfo(List.of("tourist", "Petr"), null))
                .isEqualTo(builder.userInfo("tourist;Petr", null));
    }

    @Test
    @DisplayName("blank required handle is rejected before any request is built")
    void blankHandleRejected() {
        assertThatThrownBy(() -> builder.userRating(" "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.userInfo(List.of(), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.userInfo(List.of("tourist", ""), null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("custom api root loses its trailing slash")
    void customRoot() {
        EndpointBuilder custom = new EndpointBuilder("http://localhost:8080/api/");

        assertThat(custom.apiRoot()).isEqualTo("http://localhost:8080/api");
        assertThat(custom.url(custom.recentActions(30)))
                .isEqualTo("http://localhost:8080/api/recentActions?maxCount=30");
    }

    @Test
    void wireNamesResolveBothWays() {
        for (ApiMethod method : ApiMethod.values()) {
            assertThat(ApiMethod.fromWireName(method.wireName())).isSameAs(method);
        }
        assertThatThrownBy(() -> ApiMethod.fromWireName("user.nope"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

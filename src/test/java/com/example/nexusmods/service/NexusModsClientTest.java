package com.example.nexusmods.service;

import com.example.nexusmods.config.NexusModsProperties;
import com.example.nexusmods.exception.*;
import com.example.nexusmods.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class NexusModsClientTest {

    private static final String API = "https://api.nexusmods.com/v1";
    private static final String API_KEY = "test-api-key";

    private static final String VALIDATE_BODY = """
            {"user_id": 1234, "key": "test-api-key", "name": "Dovahkiin",
             "is_premium?": true, "is_supporter?": true, "email": "dova@example.com",
             "profile_url": "https://example.com/avatar.png", "is_supporter": true, "is_premium": false}
            """;

    private static final String INVALID_KEY_BODY = "{\"message\": \"Please provide a valid API Key\"}";

    private MockRestServiceServer server;
    private NexusModsClient client;
    private final List<RateLimiting> rateLimitSnapshots = new ArrayList<>();

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();

        NexusModsProperties properties = NexusModsProperties.withApiKey(API_KEY);
        properties.setApplicationName("mod-manager");
        properties.setApplicationVersion("2.1.0");
        client = new NexusModsClient(builder, properties, rateLimitSnapshots::add);
    }

    // ==================== USER ====================

    @Test
    void validateSendsKeyAndDecodesUser() {
        server.expect(requestTo(API + "/users/validate.json"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("apikey", API_KEY))
                .andExpect(header(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE))
                .andExpect(header("Application-Name", "mod-manager"))
                .andExpect(header("Application-Version", "2.1.0"))
                .andRespond(withSuccess(VALIDATE_BODY, MediaType.APPLICATION_JSON));

        UserIdentity user = client.validate();

        assertThat(user.userId()).isEqualTo(1234L);
        assertThat(user.name()).isEqualTo("Dovahkiin");
        assertThat(user.email()).isEqualTo("dova@example.com");
        assertThat(user.isSupporter()).isTrue();
        assertThat(user.isPremium()).isFalse();
        server.verify();
    }

    @Test
    void validateWithRejectedKeyThrowsInvalidApiKey() {
        server.expect(requestTo(API + "/users/validate.json"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(INVALID_KEY_BODY));

        assertThatThrownBy(() -> client.validate())
                .isInstanceOfSatisfying(InvalidApiKeyException.class,
                        e -> assertThat(e.getServerMessage()).isEqualTo("Please provide a valid API Key"));
    }

    @Test
    void validateWithServerErrorIsAContractViolation() {
        server.expect(requestTo(API + "/users/validate.json"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> client.validate())
                .isInstanceOfSatisfying(ContractViolationException.class,
                        e -> assertThat(e.getStatus()).isEqualTo(500));
    }

    @Test
    void validateWith422IsReportedAsUnobserved() {
        server.expect(requestTo(API + "/users/validate.json"))
                .andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY).body("{}"));

        assertThatThrownBy(() -> client.validate()).isInstanceOf(UnobservedStatusException.class);
    }

    @Test
    void transportFailureIsPropagated() {
        server.expect(requestTo(API + "/users/validate.json"))
                .andRespond(withException(new IOException("connection reset")));

        assertThatThrownBy(() -> client.validate()).isInstanceOf(ResourceAccessException.class);
    }

    @Test
    void malformedBodyIsADecodingFailure() {
        server.expect(requestTo(API + "/users/validate.json"))
                .andRespond(withSuccess("{\"user_id\": \"many\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.validate()).isInstanceOf(ResponseDecodingException.class);
    }

    @Test
    void trackedModsAreGroupedByDomain() {
        server.expect(requestTo(API + "/user/tracked_mods.json"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        [{"mod_id": 5, "domain_name": "skyrim"},
                         {"mod_id": 9, "domain_name": "skyrim"},
                         {"mod_id": 1, "domain_name": "fallout4"}]
                        """, MediaType.APPLICATION_JSON));

        TrackedMods tracked = client.trackedMods();

        assertThat(tracked.modsFor("skyrim")).containsExactly(TestModIds.of(5), TestModIds.of(9));
        assertThat(tracked.modsFor("fallout4")).containsExactly(TestModIds.of(1));
    }

    @Test
    void trackModReportsNewlyTracked() {
        ModId modId = TestModIds.of(5);
        server.expect(requestTo(API + "/user/tracked_mods.json?domain_name=skyrim"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("apikey", API_KEY))
                .andExpect(content().formDataContains(Map.of("mod_id", "5")))
                .andRespond(withStatus(HttpStatus.CREATED)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"message\": \"User 1234 is now Tracking Mod: 5\"}"));

        TrackModOutcome outcome = client.trackMod("skyrim", modId);

        assertThat(outcome).isEqualTo(TrackModOutcome.newlyTracked(modId));
        server.verify();
    }

    @Test
    void trackModReportsAlreadyTracking() {
        ModId modId = TestModIds.of(5);
        server.expect(requestTo(API + "/user/tracked_mods.json?domain_name=skyrim"))
                .andRespond(withSuccess("{\"message\": \"User 1234 is already Tracking Mod: 5\"}",
                        MediaType.APPLICATION_JSON));

        TrackModOutcome outcome = client.trackMod("skyrim", modId);

        assertThat(outcome).isEqualTo(TrackModOutcome.alreadyTracking(modId));
        assertThat(outcome.wasAlreadyTracking()).isTrue();
    }

    @Test
    void trackUnknownModThrowsModNotFound() {
        server.expect(requestTo(API + "/user/tracked_mods.json?domain_name=skyrim"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"code\": 404, \"message\": \"No Mod Found\"}"));

        assertThatThrownBy(() -> client.trackMod("skyrim", TestModIds.of(5)))
                .isInstanceOfSatisfying(ModNotFoundException.class,
                        e -> assertThat(e.getServerMessage()).isEqualTo("No Mod Found"));
    }

    @Test
    void untrackModSendsDeleteWithForm() {
        server.expect(requestTo(API + "/user/tracked_mods.json?domain_name=skyrim"))
                .andExpect(method(HttpMethod.DELETE))
                .andExpect(content().formDataContains(Map.of("mod_id", "9")))
                .andRespond(withSuccess("{\"message\": \"User 1234 is no longer tracking 9\"}",
                        MediaType.APPLICATION_JSON));

        client.untrackMod("skyrim", TestModIds.of(9));

        server.verify();
    }

    @Test
    void untrackUnknownModThrowsUntrackedOrInvalid() {
        server.expect(requestTo(API + "/user/tracked_mods.json?domain_name=skyrim"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"message\": \"Users is not tracking mod. Unable to untrack.\"}"));

        assertThatThrownBy(() -> client.untrackMod("skyrim", TestModIds.of(9)))
                .isInstanceOf(UntrackedOrInvalidModException.class);
    }

    @Test
    void endorsementsDecodeStatusLeniently() {
        server.expect(requestTo(API + "/user/endorsements.json"))
                .andRespond(withSuccess("""
                        [{"mod_id": 3863, "domain_name": "skyrimspecialedition",
                          "date": "2019-02-05T14:02:03.000+00:00", "version": "3.0.4", "status": "Endorsed"},
                         {"mod_id": 266, "domain_name": "skyrimspecialedition",
                          "date": 1549375323, "version": null, "status": "Abstained"}]
                        """, MediaType.APPLICATION_JSON));

        List<Endorsement> endorsements = client.endorsements();

        assertThat(endorsements).extracting(Endorsement::status)
                .containsExactly(EndorsementStatus.ENDORSED, EndorsementStatus.NOT_ENDORSED);
        assertThat(endorsements).extracting(Endorsement::isEndorsed).containsExactly(true, false);
        assertThat(endorsements.get(1).versionIfKnown()).isEmpty();
        assertThat(endorsements.get(0).date()).isEqualTo(endorsements.get(1).date());
    }

    // ==================== GAMES ====================

    @Test
    void gamesSendsUnapprovedFlag() {
        server.expect(requestTo(API + "/games.json?include_unapproved=true"))
                .andRespond(withSuccess("""
                        [{"id": 100, "name": "Morrowind", "domain_name": "morrowind", "approved_date": 1,
                          "categories": [{"category_id": 1, "name": "Morrowind", "parent_category": false}]}]
                        """, MediaType.APPLICATION_JSON));

        List<Game> games = client.games(true);

        assertThat(games).singleElement().extracting(Game::domainName).isEqualTo("morrowind");
    }

    @Test
    void gameNotFoundUsesApiKeyErrorShape() {
        server.expect(requestTo(API + "/games/notagame.json"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(INVALID_KEY_BODY));

        assertThatThrownBy(() -> client.game("notagame")).isInstanceOf(InvalidApiKeyException.class);
    }

    @Test
    void blankDomainIsRejectedBeforeAnyRequest() {
        assertThatThrownBy(() -> client.game(" ")).isInstanceOf(IllegalArgumentException.class);

        server.verify();
    }

    // ==================== FILES ====================

    @Test
    void modFilesSendsCategoryFilterInDeclarationOrder() {
        server.expect(requestTo(startsWith(API + "/games/skyrim/mods/5/files.json")))
                .andExpect(queryParam("category", "main,update"))
                .andRespond(withSuccess("{\"files\": [], \"file_updates\": []}", MediaType.APPLICATION_JSON));

        ModFiles files = client.modFiles("skyrim", TestModIds.of(5), EnumSet.of(FileCategory.UPDATE, FileCategory.MAIN));

        assertThat(files.files()).isEmpty();
        server.verify();
    }

    @Test
    void modFilesWithoutFilterSendsNoQuery() {
        server.expect(requestTo(API + "/games/skyrim/mods/5/files.json"))
                .andRespond(withSuccess("{\"files\": [], \"file_updates\": []}", MediaType.APPLICATION_JSON));

        client.modFiles("skyrim", TestModIds.of(5));

        server.verify();
    }

    @Test
    void modFileDecodesSingleFile() {
        server.expect(requestTo(API + "/games/skyrim/mods/5/files/101.json"))
                .andRespond(withSuccess("""
                        {"id": [101, 110], "file_id": 101, "name": "Main", "category_id": 1,
                         "category_name": "ARCHIVED", "is_primary": false, "size": 3, "size_kb": 3,
                         "uploaded_timestamp": 1600000000, "uploaded_time": "2020-09-13T12:26:40.000+00:00"}
                        """, MediaType.APPLICATION_JSON));

        ModFile file = client.modFile("skyrim", TestModIds.of(5), 101);

        assertThat(file.category()).isEqualTo(FileCategory.ARCHIVED);
        assertThat(file.uploadedTime()).isEqualTo(file.uploadedTimestamp());
    }

    // ==================== MODS ====================

    @Test
    void modDecodesDetailsAndUserEndorsement() {
        server.expect(requestTo(API + "/games/skyrim/mods/5.json"))
                .andRespond(withSuccess("""
                        {"mod_id": 5, "game_id": 110, "domain_name": "skyrim", "name": "Better Bows",
                         "summary": "Bows, but better", "version": "2.0", "author": "Archer",
                         "category_id": 3, "mod_downloads": 1000, "mod_unique_downloads": 800,
                         "endorsement_count": 50, "allow_rating": true, "contains_adult_content": false,
                         "status": "published", "available": true,
                         "created_timestamp": 1500000000, "created_time": "2017-07-14T02:40:00.000+00:00",
                         "updated_timestamp": 1600000000, "updated_time": "2020-09-13T12:26:40.000+00:00",
                         "user": {"member_id": 77, "member_group_id": 27, "name": "Archer"},
                         "endorsement": {"endorse_status": "Undecided", "timestamp": null, "version": null}}
                        """, MediaType.APPLICATION_JSON));

        ModInfo mod = client.mod("skyrim", TestModIds.of(5));

        assertThat(mod.name()).isEqualTo("Better Bows");
        assertThat(mod.uploader()).map(ModInfo.ModUser::memberId).hasValue(77L);
        assertThat(mod.userEndorsement()).map(ModInfo.ModEndorsement::endorseStatus)
                .hasValue(EndorsementStatus.NOT_ENDORSED);
        assertThat(mod.createdTime()).isEqualTo(mod.createdTimestamp());
    }

    @Test
    void updatedModsSendsPeriod() {
        server.expect(requestTo(API + "/games/skyrim/mods/updated.json?period=1w"))
                .andRespond(withSuccess("""
                        [{"mod_id": 5, "latest_file_update": 1600000000, "latest_mod_activity": 1600000500}]
                        """, MediaType.APPLICATION_JSON));

        List<UpdatedMod> updated = client.updatedMods("skyrim", UpdatePeriod.WEEK);

        assertThat(updated).singleElement().extracting(UpdatedMod::modId).isEqualTo(TestModIds.of(5));
    }

    @Test
    void updatedModsForUnknownGameThrowsInvalidGame() {
        server.expect(requestTo(API + "/games/nope/mods/updated.json?period=1d"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"code\": 404, \"message\": \"Game nope not found\"}"));

        assertThatThrownBy(() -> client.updatedMods("nope", UpdatePeriod.DAY)).isInstanceOf(InvalidGameException.class);
    }

    @Test
    void trendingListsMods() {
        server.expect(requestTo(API + "/games/skyrim/mods/trending.json"))
                .andRespond(withSuccess("[{\"mod_id\": 5, \"available\": false}]", MediaType.APPLICATION_JSON));

        assertThat(client.trending("skyrim")).singleElement().satisfies(mod -> {
            assertThat(mod.modId()).isEqualTo(TestModIds.of(5));
            assertThat(mod.available()).isFalse();
            assertThat(mod.name()).isNull();
        });
    }

    @Test
    void changelogsKeepVersionOrder() {
        server.expect(requestTo(API + "/games/skyrim/mods/5/changelogs.json"))
                .andRespond(withSuccess("""
                        {"1.0": ["Initial release"], "1.1": ["Fixed bows", "Fixed arrows"], "0.9": ["Beta"]}
                        """, MediaType.APPLICATION_JSON));

        Map<String, List<String>> changelogs = client.changelogs("skyrim", TestModIds.of(5));

        assertThat(changelogs.keySet()).containsExactly("1.0", "1.1", "0.9");
        assertThat(changelogs.get("1.1")).containsExactly("Fixed bows", "Fixed arrows");
    }

    @Test
    void endorseSendsVersion() {
        server.expect(requestTo(API + "/games/skyrim/mods/5/endorse.json"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().formDataContains(Map.of("version", "2.0")))
                .andRespond(withSuccess("{\"message\": \"SUCCESS\", \"status\": \"Endorsed\"}",
                        MediaType.APPLICATION_JSON));

        EndorsementResult result = client.endorse("skyrim", TestModIds.of(5), "2.0");

        assertThat(result.status()).isEqualTo(EndorsementStatus.ENDORSED);
    }

    @Test
    void abstainWithoutDownloadIsRefused() {
        server.expect(requestTo(API + "/games/skyrim/mods/5/abstain.json"))
                .andRespond(withStatus(HttpStatus.FORBIDDEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"message\": \"NOT_DOWNLOADED_MOD\", \"status\": \"Undecided\"}"));

        assertThatThrownBy(() -> client.abstain("skyrim", TestModIds.of(5), "2.0"))
                .isInstanceOfSatisfying(EndorsementRefusedException.class,
                        e -> assertThat(e.getServerMessage()).isEqualTo("NOT_DOWNLOADED_MOD"));
    }

    // ==================== RATE LIMITS ====================

    @Test
    void rateLimitHeadersReachTheListener() {
        server.expect(requestTo(API + "/users/validate.json"))
                .andRespond(withSuccess(VALIDATE_BODY, MediaType.APPLICATION_JSON)
                        .headers(RateLimitHeadersTest.fullHeaders()));

        client.validate();

        assertThat(rateLimitSnapshots).singleElement().satisfies(rateLimits -> {
            assertThat(rateLimits.remaining(RateLimitWindow.HOURLY)).isEqualTo(99);
            assertThat(rateLimits.remaining(RateLimitWindow.DAILY)).isEqualTo(2450);
        });
    }

    @Test
    void rateLimitsArePassedOnEvenForErrorResponses() {
        server.expect(requestTo(API + "/users/validate.json"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED)
                        .contentType(MediaType.APPLICATION_JSON)
                        .headers(RateLimitHeadersTest.fullHeaders())
                        .body(INVALID_KEY_BODY));

        assertThatThrownBy(() -> client.validate()).isInstanceOf(InvalidApiKeyException.class);
        assertThat(rateLimitSnapshots).hasSize(1);
    }

    @Test
    void responsesWithoutRateLimitHeadersProduceNoSnapshot() {
        server.expect(requestTo(API + "/users/validate.json"))
                .andRespond(withSuccess(VALIDATE_BODY, MediaType.APPLICATION_JSON));

        client.validate();

        assertThat(rateLimitSnapshots).isEmpty();
    }

    // ==================== CONSTRUCTION ====================

    @Test
    void keyThatCannotBeAHeaderFailsFast() {
        assertThatThrownBy(() -> NexusModsClient.create("line\nbreak")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NexusModsClient.create("café")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NexusModsClient.create(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void ordinaryKeyIsAccepted() {
        assertThat(NexusModsClient.create("abc123+/=")).isNotNull();
    }
}

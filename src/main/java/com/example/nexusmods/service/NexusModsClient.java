package com.example.nexusmods.service;

import com.example.nexusmods.config.NexusModsProperties;
import com.example.nexusmods.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Client for the Nexus Mods public REST API.
 * <p>
 * Every call sends the API key as the {@code apikey} header and interprets the
 * response through the endpoint's {@link EndpointContract}. Failures surface as:
 * <ul>
 * <li>{@link org.springframework.web.client.RestClientException} for transport errors,</li>
 * <li>{@link com.example.nexusmods.exception.NexusApiException} subclasses for documented error bodies,</li>
 * <li>{@link com.example.nexusmods.exception.ResponseDecodingException} for bodies of the wrong shape,</li>
 * <li>{@link com.example.nexusmods.exception.UnobservedStatusException} for documented statuses never seen in practice,</li>
 * <li>{@link com.example.nexusmods.exception.ContractViolationException} for undocumented statuses.</li>
 * </ul>
 * Nothing is retried. The client holds no per-call state and may be shared between threads.
 */
public class NexusModsClient {

    private static final Logger log = LoggerFactory.getLogger(NexusModsClient.class);

    static final String API_KEY_HEADER = "apikey";
    static final String APPLICATION_NAME_HEADER = "Application-Name";
    static final String APPLICATION_VERSION_HEADER = "Application-Version";

    private final RestClient restClient;
    private final ResponseDecoder decoder;
    private final RateLimitListener rateLimitListener;

    public NexusModsClient(RestClient.Builder restClientBuilder, NexusModsProperties properties) {
        this(restClientBuilder, properties, RateLimitListener.NONE);
    }

    /**
     * @throws IllegalArgumentException if the API key is missing or cannot be sent as a header value
     */
    public NexusModsClient(RestClient.Builder restClientBuilder, NexusModsProperties properties,
            RateLimitListener rateLimitListener) {
        String apiKey = requireHeaderValue("API key", properties.getApiKey());
        this.restClient = restClientBuilder
                .baseUrl(properties.getVersionedBaseUrl())
                .defaultHeaders(headers -> addCommonHeaders(headers, apiKey, properties))
                .build();
        this.decoder = new ResponseDecoder();
        this.rateLimitListener = rateLimitListener;

        log.info("Nexus Mods client configured for {}", properties.getVersionedBaseUrl());
    }

    /**
     * Client with default settings and a plain {@link RestClient}.
     */
    public static NexusModsClient create(String apiKey) {
        return new NexusModsClient(RestClient.builder(), NexusModsProperties.withApiKey(apiKey));
    }

    // ==================== USER ====================

    /**
     * GET users/validate.json - details of the user owning the API key.
     */
    public UserIdentity validate() {
        return execute(restClient.get().uri("/users/validate.json"), EndpointContracts.VALIDATE);
    }

    /**
     * GET user/tracked_mods.json - tracked mods in the order the API lists them.
     */
    public List<ModEntry> trackedModEntries() {
        return execute(restClient.get().uri("/user/tracked_mods.json"), EndpointContracts.TRACKED_MODS);
    }

    /**
     * Tracked mods grouped by game domain.
     */
    public TrackedMods trackedMods() {
        return TrackedMods.from(trackedModEntries());
    }

    /**
     * POST user/tracked_mods.json - start tracking a mod.
     */
    public TrackModOutcome trackMod(String domainName, ModId modId) {
        requireDomain(domainName);
        TrackModOutcome.Kind kind = execute(restClient.post()
                .uri(uri -> uri.path("/user/tracked_mods.json")
                        .queryParam("domain_name", "{domain}")
                        .build(domainName))
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(modIdForm(modId)), EndpointContracts.TRACK_MOD);
        return kind == TrackModOutcome.Kind.NEWLY_TRACKED
                ? TrackModOutcome.newlyTracked(modId)
                : TrackModOutcome.alreadyTracking(modId);
    }

    /**
     * DELETE user/tracked_mods.json - stop tracking a mod.
     */
    public void untrackMod(String domainName, ModId modId) {
        requireDomain(domainName);
        execute(restClient.method(HttpMethod.DELETE)
                .uri(uri -> uri.path("/user/tracked_mods.json")
                        .queryParam("domain_name", "{domain}")
                        .build(domainName))
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(modIdForm(modId)), EndpointContracts.UNTRACK_MOD);
    }

    /**
     * GET user/endorsements.json - every endorsement decision of the user.
     */
    public List<Endorsement> endorsements() {
        return execute(restClient.get().uri("/user/endorsements.json"), EndpointContracts.ENDORSEMENTS);
    }

    // ==================== GAMES ====================

    public List<Game> games() {
        return games(false);
    }

    /**
     * GET games.json - all games, optionally including unapproved ones.
     */
    public List<Game> games(boolean includeUnapproved) {
        return execute(restClient.get()
                .uri(uri -> uri.path("/games.json")
                        .queryParam("include_unapproved", includeUnapproved)
                        .build()), EndpointContracts.GAMES);
    }

    /**
     * GET games/{domain}.json
     */
    public Game game(String domainName) {
        requireDomain(domainName);
        return execute(restClient.get().uri("/games/{domain}.json", domainName), EndpointContracts.GAME);
    }

    // ==================== MODS ====================

    /**
     * GET games/{domain}/mods/{id}.json
     */
    public ModInfo mod(String domainName, ModId modId) {
        requireDomain(domainName);
        return execute(restClient.get()
                .uri("/games/{domain}/mods/{modId}.json", domainName, modId.value()), EndpointContracts.MOD);
    }

    /**
     * GET games/{domain}/mods/updated.json - mods updated within the given period.
     */
    public List<UpdatedMod> updatedMods(String domainName, UpdatePeriod period) {
        requireDomain(domainName);
        Objects.requireNonNull(period, "period");
        return execute(restClient.get()
                .uri(uri -> uri.path("/games/{domain}/mods/updated.json")
                        .queryParam("period", period.queryValue())
                        .build(domainName)), EndpointContracts.UPDATED_MODS);
    }

    public List<ModInfo> latestAdded(String domainName) {
        requireDomain(domainName);
        return execute(restClient.get()
                .uri("/games/{domain}/mods/latest_added.json", domainName), EndpointContracts.LATEST_ADDED);
    }

    public List<ModInfo> latestUpdated(String domainName) {
        requireDomain(domainName);
        return execute(restClient.get()
                .uri("/games/{domain}/mods/latest_updated.json", domainName), EndpointContracts.LATEST_UPDATED);
    }

    public List<ModInfo> trending(String domainName) {
        requireDomain(domainName);
        return execute(restClient.get()
                .uri("/games/{domain}/mods/trending.json", domainName), EndpointContracts.TRENDING);
    }

    /**
     * GET games/{domain}/mods/{id}/changelogs.json - changelog lines keyed by version, in API order.
     */
    public Map<String, List<String>> changelogs(String domainName, ModId modId) {
        requireDomain(domainName);
        return execute(restClient.get()
                .uri("/games/{domain}/mods/{modId}/changelogs.json", domainName, modId.value()),
                EndpointContracts.CHANGELOGS);
    }

    /**
     * POST games/{domain}/mods/{id}/endorse.json
     */
    public EndorsementResult endorse(String domainName, ModId modId, String version) {
        return changeEndorsement("endorse", EndpointContracts.ENDORSE, domainName, modId, version);
    }

    /**
     * POST games/{domain}/mods/{id}/abstain.json
     */
    public EndorsementResult abstain(String domainName, ModId modId, String version) {
        return changeEndorsement("abstain", EndpointContracts.ABSTAIN, domainName, modId, version);
    }

    // ==================== FILES ====================

    public ModFiles modFiles(String domainName, ModId modId) {
        return modFiles(domainName, modId, Set.of());
    }

    /**
     * GET games/{domain}/mods/{id}/files.json, restricted to {@code categories} unless empty.
     */
    public ModFiles modFiles(String domainName, ModId modId, Set<FileCategory> categories) {
        requireDomain(domainName);
        String categoryFilter = categories.stream()
                .sorted()
                .map(FileCategory::queryValue)
                .collect(Collectors.joining(","));
        return execute(restClient.get()
                .uri(uri -> {
                    uri.path("/games/{domain}/mods/{modId}/files.json");
                    if (!categoryFilter.isEmpty()) {
                        uri.queryParam("category", categoryFilter);
                    }
                    return uri.build(domainName, modId.value());
                }), EndpointContracts.MOD_FILES);
    }

    /**
     * GET games/{domain}/mods/{id}/files/{file_id}.json
     */
    public ModFile modFile(String domainName, ModId modId, long fileId) {
        requireDomain(domainName);
        return execute(restClient.get()
                .uri("/games/{domain}/mods/{modId}/files/{fileId}.json", domainName, modId.value(), fileId),
                EndpointContracts.MOD_FILE);
    }

    // ==================== INTERNALS ====================

    private EndorsementResult changeEndorsement(String action, EndpointContract<EndorsementResult> contract,
            String domainName, ModId modId, String version) {
        requireDomain(domainName);
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        if (version != null && !version.isBlank()) {
            form.add("version", version);
        }
        return execute(restClient.post()
                .uri("/games/{domain}/mods/{modId}/{action}.json", domainName, modId.value(), action)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form), contract);
    }

    private <T> T execute(RestClient.RequestHeadersSpec<?> request, EndpointContract<T> contract) {
        RawResponse response = request.exchange((clientRequest, clientResponse) -> {
            RawResponse raw = RawResponse.read(clientResponse);
            log.debug("{} {} -> {}", clientRequest.getMethod(), clientRequest.getURI(), raw.status());
            return raw;
        });
        RateLimitHeaders.parse(response.headers()).ifPresent(rateLimitListener::onRateLimits);
        return decoder.decode(contract, response);
    }

    private static MultiValueMap<String, String> modIdForm(ModId modId) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("mod_id", Long.toString(modId.value()));
        return form;
    }

    private static void addCommonHeaders(HttpHeaders headers, String apiKey, NexusModsProperties properties) {
        headers.set(API_KEY_HEADER, apiKey);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (properties.getUserAgent() != null && !properties.getUserAgent().isBlank()) {
            headers.set(HttpHeaders.USER_AGENT, requireHeaderValue("User agent", properties.getUserAgent()));
        }
        if (properties.getApplicationName() != null && !properties.getApplicationName().isBlank()) {
            headers.set(APPLICATION_NAME_HEADER, requireHeaderValue("Application name", properties.getApplicationName()));
        }
        if (properties.getApplicationVersion() != null && !properties.getApplicationVersion().isBlank()) {
            headers.set(APPLICATION_VERSION_HEADER,
                    requireHeaderValue("Application version", properties.getApplicationVersion()));
        }
    }

    /**
     * Header values may only hold visible ASCII, spaces and tabs.
     */
    static String requireHeaderValue(String what, String value) {
        if (value == null) {
            throw new IllegalArgumentException(what + " must be set");
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != '\t' && (c < 0x20 || c > 0x7E)) {
                throw new IllegalArgumentException(what + " contains a character that is not allowed in an HTTP header");
            }
        }
        return value;
    }

    private static void requireDomain(String domainName) {
        if (domainName == null || domainName.isBlank()) {
            throw new IllegalArgumentException("Game domain name must not be blank");
        }
    }
}

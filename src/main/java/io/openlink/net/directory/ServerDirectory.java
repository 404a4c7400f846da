/*
 * The MIT License (MIT)
 *
 * Copyright (c) 2024-2030 The OpenLink Developers
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.openlink.net.directory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.openlink.config.spec.DirectorySpec;
import io.openlink.core.AbstractLifecycle;
import io.openlink.core.OperationResult;
import io.openlink.event.EventBus;
import io.openlink.event.RelayEvent;
import io.openlink.net.address.AddressKind;
import io.openlink.net.address.AddressParseResult;
import io.openlink.net.address.AddressParser;
import io.openlink.net.address.ResolutionException;
import io.openlink.net.address.Web3Resolver;
import io.openlink.net.http.HttpFetcher;
import io.openlink.net.http.HttpResult;
import io.openlink.store.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Directory of relay servers: built-in defaults, community servers fetched from a remote list and
 * user-saved servers. Keeps the latest health status of each and picks the best server to use.
 */
@Slf4j
public class ServerDirectory extends AbstractLifecycle {

    public static final String SAVED_SERVERS_KEY = "savedServers";

    private static final List<String> DEFAULT_FEATURES = ImmutableList.of("signaling", "relay", "turn");

    public static final List<ServerDescriptor> DEFAULT_SERVERS = ImmutableList.of(
            new ServerDescriptor("Local Server", "ws://localhost:8765", ServerKind.PRIMARY, "Local", DEFAULT_FEATURES),
            new ServerDescriptor("TappedIn (Legacy)", "ws://vps1.tappedin.fm:8765", ServerKind.FALLBACK, "US", DEFAULT_FEATURES),
            new ServerDescriptor("OpenLink", "wss://openlink.raywonderis.me", ServerKind.PRIMARY, "US", DEFAULT_FEATURES),
            new ServerDescriptor("TappedIn", "wss://openlink.tappedin.fm", ServerKind.PRIMARY, "US", DEFAULT_FEATURES),
            new ServerDescriptor("Devine (.net)", "wss://openlink.devinecreations.net", ServerKind.PRIMARY, "US", DEFAULT_FEATURES),
            new ServerDescriptor("Devine Creations", "wss://openlink.devine-creations.com", ServerKind.PRIMARY, "US", DEFAULT_FEATURES),
            new ServerDescriptor("Walter Harper", "wss://openlink.walterharper.com", ServerKind.PRIMARY, "US", DEFAULT_FEATURES),
            new ServerDescriptor("Tetoee Howard", "wss://openlink.tetoeehoward.com", ServerKind.PRIMARY, "US", DEFAULT_FEATURES));

    private static final TypeReference<List<ServerDescriptor>> SERVER_LIST = new TypeReference<>() {
    };

    private final DirectorySpec spec;
    private final List<ServerDescriptor> defaults;
    private final KeyValueStore store;
    private final HealthChecker checker;
    private final HttpFetcher http;
    private final ObjectMapper mapper;
    private final AddressParser parser;
    private final Web3Resolver resolver;
    private final EventBus events;
    private final Clock clock;

    private final Cache<String, HealthResult> statusCache = Caffeine.newBuilder().maximumSize(4096).build();
    private final List<ServerDescriptor> savedServers = new ArrayList<>();
    private volatile List<ServerDescriptor> communityServers = ImmutableList.of();

    private ScheduledExecutorService exec;
    private volatile ExecutorService probeExec;
    private ScheduledFuture<?> probeFuture;

    public ServerDirectory(DirectorySpec spec, List<ServerDescriptor> defaults, KeyValueStore store,
                           HealthChecker checker, HttpFetcher http, ObjectMapper mapper,
                           AddressParser parser, Web3Resolver resolver, EventBus events, Clock clock) {
        this.spec = spec;
        this.defaults = ImmutableList.copyOf(defaults);
        this.store = store;
        this.checker = checker;
        this.http = http;
        this.mapper = mapper;
        this.parser = parser;
        this.resolver = resolver;
        this.events = events;
        this.clock = clock;

        loadSavedServers();
    }

    @Override
    protected void doStart() {
        exec = new ScheduledThreadPoolExecutor(1, new BasicThreadFactory.Builder()
                .namingPattern("ServerDirectory-thread-%d")
                .daemon(true)
                .build());
        probeExec = Executors.newFixedThreadPool(Math.max(1, spec.getHealthCheckConcurrency()),
                new BasicThreadFactory.Builder()
                        .namingPattern("ServerDirectory-probe-%d")
                        .daemon(true)
                        .build());
        exec.execute(this::refreshCommunityServers);
        probeFuture = exec.scheduleAtFixedRate(this::probeQuietly, 0,
                spec.getHealthCheckIntervalSeconds(), TimeUnit.SECONDS);
        log.info("Server directory started, {} servers known", getAllServers().size());
    }

    @Override
    protected void doStop() {
        if (probeFuture != null) {
            probeFuture.cancel(true);
        }
        exec.shutdown();
        probeExec.shutdown();
        exec = null;
        probeExec = null;
        log.debug("Server directory stopped");
    }

    private void probeQuietly() {
        try {
            List<ProbeResult> results = checkAll();
            long online = results.stream().filter(r -> r.getHealth().isOnline()).count();
            log.debug("Health check complete, {}/{} servers online", online, results.size());
        } catch (Exception e) {
            log.error("Periodic health check failed", e);
        }
    }

    // --------------------------------------------------------------- listing

    /**
     * Defaults, then community servers, then saved servers, each annotated with its latest status.
     */
    public List<ServerDescriptor> getAllServers() {
        Map<String, ServerDescriptor> all = new LinkedHashMap<>();
        for (ServerDescriptor s : knownServers()) {
            all.putIfAbsent(s.getUrl(), s.withStatus(statusOf(s.getUrl())));
        }
        return new ArrayList<>(all.values());
    }

    public synchronized List<ServerDescriptor> getSavedServers() {
        return ImmutableList.copyOf(savedServers);
    }

    public List<ServerDescriptor> getCommunityServers() {
        return communityServers;
    }

    public List<ServerDescriptor> getDefaultServers() {
        return defaults;
    }

    /**
     * Latest cached status of {@code url}, {@link HealthStatus#UNKNOWN} if never probed.
     */
    public HealthStatus statusOf(String url) {
        HealthResult result = statusCache.getIfPresent(url);
        return result == null ? HealthStatus.UNKNOWN : result.getStatus();
    }

    public Optional<HealthResult> lastResult(String url) {
        return Optional.ofNullable(statusCache.getIfPresent(url));
    }

    private List<ServerDescriptor> knownServers() {
        List<ServerDescriptor> all = new ArrayList<>(defaults);
        all.addAll(communityServers);
        all.addAll(getSavedServers());
        return all;
    }

    // ---------------------------------------------------------------- health

    public HealthResult checkHealth(String url) {
        HealthResult result = checker.check(url);
        record(url, result);
        return result;
    }

    /**
     * Probe every known server and return the per-server results. Probes run concurrently while
     * the directory is started, one after another otherwise.
     */
    public List<ProbeResult> checkAll() {
        Map<String, ServerDescriptor> unique = new LinkedHashMap<>();
        for (ServerDescriptor s : knownServers()) {
            unique.putIfAbsent(s.getUrl(), s);
        }

        ExecutorService pool = probeExec;
        List<CompletableFuture<ProbeResult>> futures = new ArrayList<>();
        for (ServerDescriptor s : unique.values()) {
            futures.add(submitProbe(s, pool));
        }

        List<ProbeResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<ProbeResult> f : futures) {
            results.add(f.join());
        }
        return results;
    }

    private CompletableFuture<ProbeResult> submitProbe(ServerDescriptor server, ExecutorService pool) {
        if (pool != null) {
            try {
                return CompletableFuture.supplyAsync(() -> probe(server), pool);
            } catch (RejectedExecutionException e) {
                log.debug("Probe pool is shut down, checking {} inline", server.getUrl());
            }
        }
        return CompletableFuture.completedFuture(probe(server));
    }

    private ProbeResult probe(ServerDescriptor server) {
        HealthResult result;
        try {
            result = checker.check(server.getUrl());
        } catch (RuntimeException e) {
            result = HealthResult.error(e.getMessage());
        }
        record(server.getUrl(), result);
        return new ProbeResult(server.withStatus(result.getStatus()), result);
    }

    private void record(String url, HealthResult result) {
        HealthResult previous = statusCache.getIfPresent(url);
        statusCache.put(url, result);
        if (previous == null || previous.getStatus() != result.getStatus()) {
            events.publish(RelayEvent.Type.HEALTH_CHANGED, ImmutableMap.of(
                    "url", url,
                    "status", result.getStatus().name(),
                    "previous", previous == null ? HealthStatus.UNKNOWN.name() : previous.getStatus().name()));
        }
    }

    /**
     * Server to connect to: a saved server marked {@link ServerPreference#ALWAYS} if it is online,
     * otherwise the online server with the lowest latency, otherwise the first default.
     */
    public ServerDescriptor getBestServer() {
        Optional<ServerDescriptor> preferred = getSavedServers().stream()
                .filter(s -> s.getPreference() == ServerPreference.ALWAYS)
                .findFirst();
        if (preferred.isPresent()) {
            HealthResult health = checkHealth(preferred.get().getUrl());
            if (health.isOnline()) {
                return preferred.get().withStatus(health.getStatus());
            }
            log.info("Preferred server {} is {}, selecting by latency", preferred.get().getUrl(), health.getStatus());
        }

        long sentinel = spec.getLatencySentinel();
        return checkAll().stream()
                .filter(r -> r.getHealth().isOnline())
                .min(Comparator.comparingLong(r -> r.getHealth().getLatency() == null
                        ? sentinel : r.getHealth().getLatency()))
                .map(ProbeResult::getServer)
                .orElseGet(() -> defaults.get(0).withStatus(statusOf(defaults.get(0).getUrl())));
    }

    // ---------------------------------------------------------- saved servers

    public AddServerResult addServer(String url) {
        return addServer(url, null);
    }

    public AddServerResult addServer(String url, String name) {
        if (StringUtils.isBlank(url)) {
            return AddServerResult.invalid("Server URL is required");
        }
        String trimmed = url.trim();
        AddressParseResult parsed = parser.parse(trimmed);
        if (parsed.getKind() == AddressKind.UNKNOWN) {
            return AddServerResult.invalid("Invalid server address: " + trimmed);
        }
        String serverUrl = hasWebSocketScheme(trimmed) || parsed.isRequiresResolution()
                ? trimmed
                : parsed.toEndpoint();

        ServerDescriptor server;
        synchronized (this) {
            boolean exists = knownServers().stream().anyMatch(s -> s.getUrl().equalsIgnoreCase(trimmed)
                    || s.getUrl().equalsIgnoreCase(serverUrl));
            if (exists) {
                return AddServerResult.alreadyExists(serverUrl);
            }
            server = new ServerDescriptor(StringUtils.defaultIfBlank(name, parsed.getHost()), serverUrl,
                    ServerKind.CUSTOM, "Custom", ImmutableList.of());
            server.setAddressKind(parsed.getKind());
            server.setAddedAt(clock.millis());
            server.setPreference(ServerPreference.ONCE);
            savedServers.add(server);
            persist();
        }
        log.info("Added server {} ({})", serverUrl, parsed.getKind().getWireName());
        return AddServerResult.added(server.withStatus(HealthStatus.UNKNOWN));
    }

    public OperationResult removeServer(String url) {
        boolean removed;
        synchronized (this) {
            removed = savedServers.removeIf(s -> s.getUrl().equals(url));
            if (removed) {
                persist();
            }
        }
        if (!removed) {
            return OperationResult.fail("Server not found: " + url);
        }
        statusCache.invalidate(url);
        return OperationResult.ok();
    }

    public synchronized OperationResult setPreferredServer(String url, ServerPreference preference) {
        for (ServerDescriptor s : savedServers) {
            if (s.getUrl().equals(url)) {
                s.setPreference(preference);
                persist();
                return OperationResult.ok();
            }
        }
        return OperationResult.fail("Server not found: " + url);
    }

    private void persist() {
        store.set(SAVED_SERVERS_KEY, new ArrayList<>(savedServers));
    }

    private synchronized void loadSavedServers() {
        List<ServerDescriptor> loaded = store.get(SAVED_SERVERS_KEY, SERVER_LIST, ImmutableList.of());
        savedServers.clear();
        for (ServerDescriptor s : loaded) {
            if (StringUtils.isNotBlank(s.getUrl()) && !savedServers.contains(s)) {
                s.setKind(ServerKind.CUSTOM);
                savedServers.add(s);
            }
        }
        log.debug("Loaded {} saved servers", savedServers.size());
    }

    // ------------------------------------------------------------- community

    /**
     * Fetch the community server list. Failures leave the previous list in place.
     */
    public void refreshCommunityServers() {
        String url = spec.getCommunityServersUrl();
        if (StringUtils.isBlank(url)) {
            return;
        }
        try {
            HttpResult result = http.get(url, ImmutableMap.of(), Duration.ofMillis(spec.getHttpTimeoutMillis()));
            if (!result.isOk()) {
                log.warn("Community server list returned HTTP {}", result.getStatus());
                return;
            }
            JsonNode servers = mapper.readTree(StringUtils.defaultString(result.getBody())).path("servers");
            Map<String, ServerDescriptor> unique = new LinkedHashMap<>();
            for (JsonNode node : servers) {
                ServerDescriptor s = mapper.treeToValue(node, ServerDescriptor.class);
                if (StringUtils.isBlank(s.getUrl())) {
                    continue;
                }
                s.setKind(ServerKind.COMMUNITY);
                unique.putIfAbsent(s.getUrl(), s);
            }
            communityServers = ImmutableList.copyOf(unique.values());
            log.info("Loaded {} community servers", communityServers.size());
        } catch (IOException e) {
            log.warn("Failed to fetch community servers from {}: {}", url, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Failed to refresh community servers", e);
        }
    }

    // ------------------------------------------------------------ resolution

    /**
     * Connectable URL of {@code server}, resolving Web3 names.
     */
    public String buildServerUrl(ServerDescriptor server) throws ResolutionException {
        AddressParseResult parsed = parser.parse(server.getUrl());
        if (!parsed.isRequiresResolution()) {
            String url = server.getUrl().trim();
            return hasWebSocketScheme(url) ? url : parsed.toEndpoint();
        }
        return resolver.resolve(parsed);
    }

    private static boolean hasWebSocketScheme(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        return lower.startsWith("ws://") || lower.startsWith("wss://");
    }
}

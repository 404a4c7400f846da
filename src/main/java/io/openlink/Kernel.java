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
package io.openlink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.openlink.config.Config;
import io.openlink.core.AbstractLifecycle;
import io.openlink.event.EventBus;
import io.openlink.net.address.AddressParseResult;
import io.openlink.net.address.AddressParser;
import io.openlink.net.address.ResolutionException;
import io.openlink.net.address.Web3Resolver;
import io.openlink.net.directory.HealthChecker;
import io.openlink.net.directory.ServerDirectory;
import io.openlink.net.http.DefaultHttpFetcher;
import io.openlink.net.http.HttpFetcher;
import io.openlink.relay.RelayEngine;
import io.openlink.relay.RelayHost;
import io.openlink.relay.RelayStats;
import io.openlink.relay.SessionIdGenerator;
import io.openlink.relay.ShareableLinks;
import io.openlink.relay.auth.AccessController;
import io.openlink.store.KeyValueStore;
import io.openlink.trust.BanStatus;
import io.openlink.trust.HostTrustManager;
import io.openlink.trust.HttpTrustRegistry;
import io.openlink.trust.ReportResult;
import io.openlink.trust.VerificationService;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * Wires the relay, the server directory and the trust layer together and exposes the calls the
 * application shell uses: relay start/stop, host report/check and address resolution.
 */
@Slf4j
@Getter
public class Kernel extends AbstractLifecycle {

    private final Config config;
    private final KeyValueStore store;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final EventBus events;

    private final HttpFetcher http;
    private final AddressParser addressParser;
    private final Web3Resolver web3Resolver;
    private final ServerDirectory directory;

    private final ScheduledExecutorService relayExec;
    private final AccessController access;
    private final RelayEngine engine;
    private final RelayHost relayHost;

    private final VerificationService verification;
    private final HostTrustManager trust;

    public Kernel(Config config, KeyValueStore store, Clock clock) {
        this.config = config;
        this.store = store;
        this.clock = clock;
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.events = new EventBus(clock);
        SecureRandom random = new SecureRandom();

        this.http = DefaultHttpFetcher.strict();
        this.addressParser = new AddressParser(config.getDirectorySpec());
        this.web3Resolver = new Web3Resolver(config.getDirectorySpec(), http, mapper);
        HealthChecker checker = new HealthChecker(DefaultHttpFetcher.insecure(),
                Duration.ofMillis(config.getHealthCheckTimeoutMillis()), clock);
        this.directory = new ServerDirectory(config.getDirectorySpec(), ServerDirectory.DEFAULT_SERVERS, store,
                checker, http, mapper, addressParser, web3Resolver, events, clock);

        this.relayExec = new ScheduledThreadPoolExecutor(1, new BasicThreadFactory.Builder()
                .namingPattern("RelayEngine-thread-%d")
                .daemon(true)
                .build());
        this.access = new AccessController(store, clock, random);
        if (!store.contains(AccessController.ACCESS_CONFIG_KEY)) {
            access.setHostName(config.getHostName());
            access.setMaxConnections(config.getMaxConnections());
        }
        SessionIdGenerator ids = new SessionIdGenerator(random);
        this.engine = new RelayEngine(access, mapper, ids, relayExec, events, new RelayStats(), clock,
                config.getAuthTimeoutMillis());
        this.relayHost = new RelayHost(config.getRelaySpec(), access, engine,
                new ShareableLinks(config.getShareDomains(), ids, random), http, mapper, events, clock);

        this.verification = new VerificationService(store, clock, access::getHostName);
        this.trust = new HostTrustManager(config.getTrustSpec(),
                new HttpTrustRegistry(config.getTrustSpec(), http, mapper), clock);
    }

    @Override
    protected void doStart() {
        directory.start();
        relayHost.start(config.getRelayPort(), config.getRelayHost());
        log.info("OpenLink relay started");
    }

    @Override
    protected void doStop() {
        relayHost.stop();
        directory.stop();
        log.info("OpenLink relay stopped");
    }

    /**
     * Stop the services if running and release the relay scheduler. A kernel cannot be started
     * again afterwards.
     */
    @Override
    public void stop() {
        super.stop();
        relayExec.shutdownNow();
    }

    /**
     * Connectable endpoint for a raw address. Web3 names are resolved; when resolution fails the
     * literal address is returned.
     */
    public String resolveAddress(String address) {
        AddressParseResult parsed = addressParser.parse(address);
        try {
            return web3Resolver.resolve(parsed);
        } catch (ResolutionException e) {
            log.warn("Could not resolve {} ({}), using it as is", address, e.getReason());
            return parsed.toEndpoint();
        }
    }

    public ReportResult reportHost(String hostUrl, String reporterId, String reason) {
        return trust.reportHost(hostUrl, reporterId, reason);
    }

    public BanStatus checkHost(String hostUrl) {
        return trust.checkHostBanStatus(hostUrl);
    }
}

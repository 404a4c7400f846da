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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import io.openlink.config.Config;
import io.openlink.core.OperationResult;
import io.openlink.event.EventBus;
import io.openlink.event.RelayEvent;
import io.openlink.net.address.AddressKind;
import io.openlink.net.address.AddressParseResult;
import io.openlink.net.address.AddressParser;
import io.openlink.net.address.Web3Resolver;
import io.openlink.net.http.HttpFetcher;
import io.openlink.net.http.HttpResult;
import io.openlink.store.KeyValueStore;
import io.openlink.store.MemoryKeyValueStore;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class ServerDirectoryTest {

    private static final String A = "ws://a.example.com:8765";
    private static final String B = "wss://b.example.com";
    private static final String C = "wss://c.example.com";
    private static final String COMMUNITY = "https://list.example.com/servers.json";

    private final List<ServerDescriptor> defaults = ImmutableList.of(
            new ServerDescriptor("A", A, ServerKind.PRIMARY, "US", null),
            new ServerDescriptor("B", B, ServerKind.PRIMARY, "EU", null),
            new ServerDescriptor("C", C, ServerKind.FALLBACK, "US", null));

    private Config config;
    private KeyValueStore store;
    private HealthChecker checker;
    private HttpFetcher http;
    private Web3Resolver resolver;
    private EventBus events;
    private ServerDirectory directory;

    @Before
    public void setUp() {
        config = Config.defaults().set("directory.communityServersUrl", COMMUNITY);
        store = new MemoryKeyValueStore();
        checker = mock(HealthChecker.class);
        when(checker.check(anyString())).thenReturn(HealthResult.offline());
        http = mock(HttpFetcher.class);
        resolver = mock(Web3Resolver.class);
        events = new EventBus();
        directory = newDirectory();
    }

    @After
    public void tearDown() {
        directory.stop();
    }

    private ServerDirectory newDirectory() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);
        return new ServerDirectory(config, defaults, store, checker, http, new ObjectMapper(),
                new AddressParser(config), resolver, events, clock);
    }

    @Test
    public void testBestServerPicksLowestLatency() {
        when(checker.check(A)).thenReturn(HealthResult.online(120));
        when(checker.check(B)).thenReturn(HealthResult.online(40));

        ServerDescriptor best = directory.getBestServer();
        assertEquals(B, best.getUrl());
        assertEquals(HealthStatus.ONLINE, best.getStatus());
        assertEquals(HealthStatus.OFFLINE, directory.statusOf(C));
    }

    @Test
    public void testBestServerFallsBackToFirstDefault() {
        when(checker.check(B)).thenReturn(HealthResult.degraded(10));

        ServerDescriptor best = directory.getBestServer();
        assertEquals(A, best.getUrl());
        assertEquals(HealthStatus.OFFLINE, best.getStatus());
    }

    @Test
    public void testPreferredServerWinsWhenOnline() {
        String mine = "wss://mine.example.com";
        assertTrue(directory.addServer(mine, "Mine").isSuccess());
        assertTrue(directory.setPreferredServer(mine, ServerPreference.ALWAYS).isSuccess());
        when(checker.check(mine)).thenReturn(HealthResult.online(300));
        when(checker.check(A)).thenReturn(HealthResult.online(10));

        assertEquals(mine, directory.getBestServer().getUrl());
    }

    @Test
    public void testOfflinePreferredServerIsSkipped() {
        String mine = "wss://mine.example.com";
        directory.addServer(mine);
        directory.setPreferredServer(mine, ServerPreference.ALWAYS);
        when(checker.check(C)).thenReturn(HealthResult.online(90));

        assertEquals(C, directory.getBestServer().getUrl());
    }

    @Test
    public void testAddServer() {
        AddServerResult result = directory.addServer("  wss://relay.example.org:9443  ");
        assertTrue(result.isSuccess());

        ServerDescriptor server = result.getServer();
        assertEquals("wss://relay.example.org:9443", server.getUrl());
        assertEquals("relay.example.org", server.getName());
        assertEquals(ServerKind.CUSTOM, server.getKind());
        assertEquals("Custom", server.getRegion());
        assertEquals(ServerPreference.ONCE, server.getPreference());
        assertEquals(AddressKind.DOMAIN, server.getAddressKind());
        assertEquals(Long.valueOf(1_700_000_000_000L), server.getAddedAt());
        assertEquals(4, directory.getAllServers().size());
    }

    @Test
    public void testAddServerRejectsDuplicatesAndGarbage() {
        assertTrue(directory.addServer("mine.eth").isSuccess());

        AddServerResult again = directory.addServer("MINE.ETH");
        assertFalse(again.isSuccess());
        assertTrue(again.isAlreadyExists());

        AddServerResult builtIn = directory.addServer(B);
        assertTrue("defaults count as known servers", builtIn.isAlreadyExists());

        AddServerResult blank = directory.addServer(" ");
        assertFalse(blank.isSuccess());
        assertFalse(blank.isAlreadyExists());

        assertFalse(directory.addServer("no such host!").isSuccess());
        assertEquals(1, directory.getSavedServers().size());
    }

    @Test
    public void testSavedServersArePersisted() {
        directory.addServer("wss://one.example.com", "One");
        directory.addServer("192.168.1.20:8765");
        directory.setPreferredServer("wss://one.example.com", ServerPreference.NEVER);

        ServerDirectory reloaded = newDirectory();
        try {
            List<ServerDescriptor> saved = reloaded.getSavedServers();
            assertEquals(2, saved.size());
            assertEquals("One", saved.get(0).getName());
            assertEquals(ServerPreference.NEVER, saved.get(0).getPreference());
            assertEquals(AddressKind.IPV4, saved.get(1).getAddressKind());
        } finally {
            reloaded.stop();
        }
    }

    @Test
    public void testSchemeLessServerIsStoredAsEndpoint() throws Exception {
        String lan = "wss://192.168.1.5:8765";

        assertEquals(lan, directory.addServer("192.168.1.5:8765").getServer().getUrl());
        assertEquals("wss://relay.example.com:443", directory.addServer("relay.example.com").getServer().getUrl());
        assertTrue("same endpoint with a scheme", directory.addServer(lan).isAlreadyExists());
        assertEquals("https://192.168.1.5:8765/health", HealthChecker.toHealthUrl(lan));

        directory.setPreferredServer(lan, ServerPreference.ALWAYS);
        when(checker.check(lan)).thenReturn(HealthResult.online(5));
        assertEquals(lan, directory.getBestServer().getUrl());
    }

    @Test
    public void testBestServerAfterStop() {
        directory.start();
        directory.stop();
        when(checker.check(B)).thenReturn(HealthResult.online(10));

        assertEquals(B, directory.getBestServer().getUrl());
        assertEquals(3, directory.checkAll().size());
    }

    @Test
    public void testRestart() {
        directory.stop();
        directory.start();
        directory.stop();
        directory.start();

        assertTrue(directory.isRunning());
        assertEquals(3, directory.checkAll().size());
    }

    @Test
    public void testRemoveServer() {
        directory.addServer("wss://one.example.com");

        assertTrue(directory.removeServer("wss://one.example.com").isSuccess());
        OperationResult missing = directory.removeServer("wss://one.example.com");
        assertFalse(missing.isSuccess());
        assertTrue(directory.getSavedServers().isEmpty());
        assertFalse(directory.setPreferredServer("wss://one.example.com", ServerPreference.ALWAYS).isSuccess());
    }

    @Test
    public void testHealthChangesArePublished() {
        List<RelayEvent> seen = Collections.synchronizedList(new ArrayList<>());
        events.subscribe(seen::add, RelayEvent.Type.HEALTH_CHANGED);
        when(checker.check(A)).thenReturn(HealthResult.online(5));

        directory.checkAll();
        assertEquals("first probe of each server", 3, seen.size());

        seen.clear();
        directory.checkAll();
        assertTrue("unchanged status is not republished", seen.isEmpty());

        when(checker.check(A)).thenReturn(HealthResult.timeout());
        directory.checkHealth(A);
        assertEquals(1, seen.size());
        assertEquals(A, seen.get(0).get("url"));
        assertEquals("TIMEOUT", seen.get(0).get("status"));
        assertEquals("ONLINE", seen.get(0).get("previous"));
    }

    @Test
    public void testServersAreAnnotatedWithStatus() {
        assertEquals(HealthStatus.UNKNOWN, directory.getAllServers().get(0).getStatus());

        when(checker.check(A)).thenReturn(HealthResult.online(5));
        directory.checkHealth(A);

        assertEquals(HealthStatus.ONLINE, directory.getAllServers().get(0).getStatus());
        assertEquals(Long.valueOf(5), directory.lastResult(A).get().getLatency());
    }

    @Test
    public void testRefreshCommunityServers() throws Exception {
        when(http.get(eq(COMMUNITY), anyMap(), any(Duration.class))).thenReturn(new HttpResult(200,
                "{\"servers\":[{\"name\":\"C1\",\"url\":\"wss://c1.example.com\",\"region\":\"EU\",\"extra\":1},"
                        + "{\"name\":\"Dup\",\"url\":\"wss://c1.example.com\"},"
                        + "{\"name\":\"NoUrl\"},"
                        + "{\"name\":\"C2\",\"url\":\"wss://c2.example.com\",\"kind\":\"PRIMARY\"}]}"));

        directory.refreshCommunityServers();

        List<ServerDescriptor> community = directory.getCommunityServers();
        assertEquals(2, community.size());
        assertEquals("C1", community.get(0).getName());
        assertEquals(ServerKind.COMMUNITY, community.get(1).getKind());
        assertEquals(5, directory.getAllServers().size());
    }

    @Test
    public void testFailedRefreshKeepsPreviousList() throws Exception {
        when(http.get(eq(COMMUNITY), anyMap(), any(Duration.class)))
                .thenReturn(new HttpResult(200, "{\"servers\":[{\"url\":\"wss://c1.example.com\"}]}"))
                .thenReturn(new HttpResult(500, ""))
                .thenThrow(new IOException("unreachable"));

        directory.refreshCommunityServers();
        directory.refreshCommunityServers();
        directory.refreshCommunityServers();

        assertEquals(1, directory.getCommunityServers().size());
    }

    @Test
    public void testBuildServerUrl() throws Exception {
        when(resolver.resolve(any(AddressParseResult.class)))
                .thenReturn("wss://resolved.example.net");

        ServerDescriptor plain = new ServerDescriptor("p", "ws://plain.example.com:8765/x", ServerKind.CUSTOM, null, null);
        ServerDescriptor bare = new ServerDescriptor("b", "10.0.0.7:9000", ServerKind.CUSTOM, null, null);
        ServerDescriptor web3 = new ServerDescriptor("w", "relay.eth", ServerKind.CUSTOM, null, null);

        assertEquals("ws://plain.example.com:8765/x", directory.buildServerUrl(plain));
        assertEquals("wss://10.0.0.7:9000", directory.buildServerUrl(bare));
        assertEquals("wss://resolved.example.net", directory.buildServerUrl(web3));
    }
}

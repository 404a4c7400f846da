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
package io.openlink.config;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

public class ConfigTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @After
    public void tearDown() {
        System.clearProperty("openlink.relay.maxConnections");
    }

    @Test
    public void testDefaults() {
        Config config = Config.defaults();

        assertEquals(8765, config.getRelayPort());
        assertEquals("/", config.getRelayWebSocketPath());
        assertEquals(30_000L, config.getAuthTimeoutMillis());
        assertEquals(List.of("eth"), config.getEnsSuffixes());
        assertEquals(9, config.getUnstoppableSuffixes().size());
        assertEquals("_openlink", config.getTxtRecordPrefix());
        assertEquals(3, config.getReportThreshold());
        assertEquals(List.of("signaling", "relay", "turn"), config.getRelayFeatures());
        assertNull(config.getHostName());
        assertSame(config, config.getDirectorySpec());
    }

    @Test
    public void testSetOverrides() {
        Config config = Config.defaults()
                .set("relay.port", 9000)
                .set("directory.ensSuffixes", " eth , , box ");

        assertEquals(9000, config.getRelayPort());
        assertEquals(List.of("eth", "box"), config.getEnsSuffixes());
    }

    @Test
    public void testInvalidOrBlankValuesFallBack() {
        Config config = Config.defaults()
                .set("relay.port", "eighty")
                .set("relay.authTimeoutMillis", "")
                .set("trust.registryUrl", "   ");

        assertEquals(8765, config.getRelayPort());
        assertEquals(30_000L, config.getAuthTimeoutMillis());
        assertEquals("https://raywonderis.me/openlink/api", config.getRegistryUrl());
    }

    @Test
    public void testLoadExternalFileAndSystemProperties() throws Exception {
        File file = folder.newFile("openlink.conf");
        Files.write(file.toPath(), "relay.port=9443\nrelay.hostName=Studio\n".getBytes(StandardCharsets.UTF_8));
        System.setProperty("openlink.relay.maxConnections", "7");

        Config config = Config.load(file.getAbsolutePath());

        assertEquals(9443, config.getRelayPort());
        assertEquals("Studio", config.getHostName());
        assertEquals(7, config.getMaxConnections());
        assertEquals("untouched keys keep defaults", "https://cloudflare-dns.com/dns-query", config.getDohEndpoint());
    }

    @Test
    public void testLoadMissingFile() {
        Config config = Config.load(new File(folder.getRoot(), "absent.conf").getAbsolutePath());

        assertEquals(8765, config.getRelayPort());
    }
}

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

import com.google.common.collect.ImmutableList;
import io.openlink.config.spec.DirectorySpec;
import io.openlink.config.spec.RelaySpec;
import io.openlink.config.spec.TrustSpec;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Relay configuration backed by {@code openlink.properties}.
 * <p>
 * Values are layered: classpath defaults, then an optional external file, then system
 * properties starting with {@code openlink.}. Invalid numbers fall back to the built-in default.
 */
@Slf4j
public class Config implements RelaySpec, DirectorySpec, TrustSpec {

    public static final String DEFAULT_RESOURCE = "openlink.properties";
    private static final String SYSTEM_PREFIX = "openlink.";

    private final Properties props;

    public Config(Properties props) {
        this.props = props;
    }

    /**
     * Built-in defaults only.
     */
    public static Config defaults() {
        return new Config(loadClasspath());
    }

    /**
     * Defaults, overlaid by {@code externalFile} when it exists, then by system properties.
     */
    public static Config load(String externalFile) {
        Properties props = loadClasspath();
        if (externalFile != null) {
            Path path = Path.of(externalFile);
            if (Files.isRegularFile(path)) {
                try (InputStream in = Files.newInputStream(path)) {
                    props.load(in);
                    log.info("Loaded configuration from {}", path.toAbsolutePath());
                } catch (IOException e) {
                    log.warn("Failed to read configuration file {}, using defaults", path, e);
                }
            }
        }
        for (Map.Entry<Object, Object> e : System.getProperties().entrySet()) {
            String key = String.valueOf(e.getKey());
            if (key.startsWith(SYSTEM_PREFIX)) {
                props.setProperty(key.substring(SYSTEM_PREFIX.length()), String.valueOf(e.getValue()));
            }
        }
        return new Config(props);
    }

    private static Properties loadClasspath() {
        Properties props = new Properties();
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                log.warn("{} not found on classpath, using hard-coded defaults", DEFAULT_RESOURCE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}", DEFAULT_RESOURCE, e);
        }
        return props;
    }

    public RelaySpec getRelaySpec() {
        return this;
    }

    public DirectorySpec getDirectorySpec() {
        return this;
    }

    public TrustSpec getTrustSpec() {
        return this;
    }

    /**
     * Override a single value, mostly useful for tests and the launcher.
     */
    public Config set(String key, Object value) {
        props.setProperty(key, String.valueOf(value));
        return this;
    }

    // ------------------------------------------------------------------ relay

    @Override
    public String getRelayHost() {
        return getString("relay.host", "0.0.0.0");
    }

    @Override
    public int getRelayPort() {
        return getInt("relay.port", 8765);
    }

    @Override
    public int getRelayBossThreads() {
        return getInt("relay.bossThreads", 1);
    }

    @Override
    public int getRelayWorkerThreads() {
        return getInt("relay.workerThreads", 0);
    }

    @Override
    public int getRelayMaxFrameSize() {
        return getInt("relay.maxFrameSize", 1024 * 1024);
    }

    @Override
    public String getRelayWebSocketPath() {
        return getString("relay.webSocketPath", "/");
    }

    @Override
    public long getAuthTimeoutMillis() {
        return getLong("relay.authTimeoutMillis", 30_000L);
    }

    @Override
    public int getMaxConnections() {
        return getInt("relay.maxConnections", 100);
    }

    @Override
    public String getHostName() {
        return getString("relay.hostName", null);
    }

    @Override
    public List<String> getShareDomains() {
        return getList("relay.shareDomains",
                "openlink.tappedin.fm,openlink.devinecreations.net,openlink.devine-creations.com");
    }

    @Override
    public String getRelayVersion() {
        return getString("relay.version", "1.0.0");
    }

    @Override
    public List<String> getRelayFeatures() {
        return getList("relay.features", "signaling,relay,turn");
    }

    @Override
    public String getTlsCertFile() {
        return getString("relay.tls.certFile", null);
    }

    @Override
    public String getTlsKeyFile() {
        return getString("relay.tls.keyFile", null);
    }

    @Override
    public String getRegisterUrl() {
        return getString("relay.registerUrl", "https://raywonderis.me/openlink/register-host");
    }

    // -------------------------------------------------------------- directory

    @Override
    public long getHealthCheckIntervalSeconds() {
        return getLong("directory.healthCheckIntervalSeconds", 60L);
    }

    @Override
    public int getHealthCheckTimeoutMillis() {
        return getInt("directory.healthCheckTimeoutMillis", 5_000);
    }

    @Override
    public int getHealthCheckConcurrency() {
        return getInt("directory.healthCheckConcurrency", 16);
    }

    @Override
    public long getLatencySentinel() {
        return getLong("directory.latencySentinel", 9_999L);
    }

    @Override
    public String getCommunityServersUrl() {
        return getString("directory.communityServersUrl", null);
    }

    @Override
    public int getHttpTimeoutMillis() {
        return getInt("directory.httpTimeoutMillis", 10_000);
    }

    @Override
    public List<String> getEnsSuffixes() {
        return getList("directory.ensSuffixes", "eth");
    }

    @Override
    public List<String> getUnstoppableSuffixes() {
        return getList("directory.unstoppableSuffixes", "crypto,nft,wallet,blockchain,bitcoin,x,888,dao,zil");
    }

    @Override
    public String getDohEndpoint() {
        return getString("directory.dohEndpoint", "https://cloudflare-dns.com/dns-query");
    }

    @Override
    public String getTxtRecordPrefix() {
        return getString("directory.txtRecordPrefix", "_openlink");
    }

    @Override
    public String getUnstoppableApiUrl() {
        return getString("directory.unstoppableApiUrl", "https://resolve.unstoppabledomains.com");
    }

    // ------------------------------------------------------------------ trust

    @Override
    public String getRegistryUrl() {
        return getString("trust.registryUrl", "https://raywonderis.me/openlink/api");
    }

    @Override
    public int getReportThreshold() {
        return getInt("trust.reportThreshold", 3);
    }

    @Override
    public int getBanDurationHours() {
        return getInt("trust.banDurationHours", 24);
    }

    @Override
    public String getAdminContact() {
        return getString("trust.adminContact", null);
    }

    // ---------------------------------------------------------------- helpers

    private String getString(String key, String defaultValue) {
        String value = props.getProperty(key);
        return StringUtils.isBlank(value) ? defaultValue : value.trim();
    }

    private int getInt(String key, int defaultValue) {
        String value = props.getProperty(key);
        if (StringUtils.isBlank(value)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private long getLong(String key, long defaultValue) {
        String value = props.getProperty(key);
        if (StringUtils.isBlank(value)) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private List<String> getList(String key, String defaultValue) {
        String value = getString(key, defaultValue);
        return Arrays.stream(StringUtils.split(value, ','))
                .map(String::trim)
                .filter(StringUtils::isNotEmpty)
                .collect(ImmutableList.toImmutableList());
    }
}

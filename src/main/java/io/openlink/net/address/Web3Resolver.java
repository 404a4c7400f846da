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
package io.openlink.net.address;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.collect.ImmutableMap;
import io.openlink.config.spec.DirectorySpec;
import io.openlink.net.http.HttpFetcher;
import io.openlink.net.http.HttpResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Resolves Web3 domain names to relay endpoints.
 * <ul>
 * <li>ENS-style names: DNS-over-HTTPS TXT lookup of {@code <prefix>.<domain>}, expecting
 * {@code openlink=<endpoint>}; without such a record the domain itself is used as a wss host.</li>
 * <li>Unstoppable-style names: registry API lookup of the {@code openlink.server} record; other
 * records fall back to the domain as a wss host.</li>
 * </ul>
 * Successful resolutions are cached for a few minutes.
 */
@Slf4j
public class Web3Resolver {

    static final String TXT_MARKER = "openlink=";
    static final String SERVER_RECORD = "openlink.server";

    private static final int CACHE_SIZE = 256;
    private static final long CACHE_TTL_MINUTES = 10;

    private final DirectorySpec spec;
    private final HttpFetcher http;
    private final ObjectMapper mapper;
    private final Cache<String, String> resolved = Caffeine.newBuilder()
            .maximumSize(CACHE_SIZE)
            .expireAfterWrite(CACHE_TTL_MINUTES, TimeUnit.MINUTES)
            .build();

    public Web3Resolver(DirectorySpec spec, HttpFetcher http, ObjectMapper mapper) {
        this.spec = spec;
        this.http = http;
        this.mapper = mapper;
    }

    /**
     * Resolve {@code host} of the given kind to a relay endpoint.
     *
     * @throws ResolutionException when the lookup fails; callers may fall back to the literal address
     */
    public String resolve(String host, AddressKind kind) throws ResolutionException {
        if (StringUtils.isBlank(host)) {
            throw new ResolutionException(ResolutionException.Reason.DOMAIN_NOT_FOUND, host, "Empty domain");
        }
        String domain = host.trim().toLowerCase(Locale.ROOT);
        if (!kind.isWeb3()) {
            return "wss://" + domain;
        }

        String key = kind.getWireName() + ":" + domain;
        String cached = resolved.getIfPresent(key);
        if (cached != null) {
            return cached;
        }

        String endpoint = kind == AddressKind.ENS ? resolveEns(domain) : resolveUnstoppable(domain);
        resolved.put(key, endpoint);
        log.debug("Resolved {} domain {} to {}", kind.getWireName(), domain, endpoint);
        return endpoint;
    }

    /**
     * Resolve a parsed address, returning its literal endpoint when no resolution is needed.
     */
    public String resolve(AddressParseResult address) throws ResolutionException {
        if (!address.isRequiresResolution()) {
            return address.toEndpoint();
        }
        return resolve(address.getHost(), address.getKind());
    }

    protected String resolveEns(String domain) throws ResolutionException {
        String name = spec.getTxtRecordPrefix() + "." + domain;
        String url = spec.getDohEndpoint() + "?name=" + URLEncoder.encode(name, StandardCharsets.UTF_8) + "&type=TXT";
        JsonNode response = fetch(domain, url, ImmutableMap.of("Accept", "application/dns-json"));

        for (JsonNode answer : response.path("Answer")) {
            String data = StringUtils.remove(answer.path("data").asText(""), '"').trim();
            if (data.startsWith(TXT_MARKER) && data.length() > TXT_MARKER.length()) {
                return data.substring(TXT_MARKER.length());
            }
        }
        return "wss://" + domain;
    }

    protected String resolveUnstoppable(String domain) throws ResolutionException {
        String url = StringUtils.removeEnd(spec.getUnstoppableApiUrl(), "/") + "/domains/"
                + URLEncoder.encode(domain, StandardCharsets.UTF_8);
        JsonNode records = fetch(domain, url, ImmutableMap.of("Accept", "application/json")).path("records");

        String server = records.path(SERVER_RECORD).asText("");
        if (StringUtils.isNotBlank(server)) {
            return server.trim();
        }
        if (!records.isObject() || records.isEmpty()) {
            throw new ResolutionException(ResolutionException.Reason.DOMAIN_NOT_FOUND, domain,
                    "No records found for " + domain);
        }
        return "wss://" + domain;
    }

    private JsonNode fetch(String domain, String url, ImmutableMap<String, String> headers) throws ResolutionException {
        HttpResult result;
        try {
            result = http.get(url, headers, Duration.ofMillis(spec.getHttpTimeoutMillis()));
        } catch (IOException e) {
            throw new ResolutionException(ResolutionException.Reason.NETWORK_ERROR, domain,
                    "Lookup failed for " + domain + ": " + e.getMessage(), e);
        }

        if (result.getStatus() == 404) {
            throw new ResolutionException(ResolutionException.Reason.DOMAIN_NOT_FOUND, domain,
                    "Domain not found: " + domain);
        }
        if (!result.isOk()) {
            throw new ResolutionException(ResolutionException.Reason.NETWORK_ERROR, domain,
                    "Lookup for " + domain + " returned HTTP " + result.getStatus());
        }

        try {
            JsonNode node = mapper.readTree(StringUtils.defaultString(result.getBody()));
            if (node == null || !node.isObject()) {
                throw new ResolutionException(ResolutionException.Reason.INVALID_RESPONSE, domain,
                        "Unexpected lookup response for " + domain);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ResolutionException(ResolutionException.Reason.INVALID_RESPONSE, domain,
                    "Malformed lookup response for " + domain, e);
        }
    }
}

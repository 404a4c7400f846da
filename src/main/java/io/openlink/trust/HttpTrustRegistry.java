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
package io.openlink.trust;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;
import io.openlink.config.spec.TrustSpec;
import io.openlink.net.http.HttpFetcher;
import io.openlink.net.http.HttpResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * {@link TrustRegistry} over the registry's HTTP API:
 * {@code POST /report-host}, {@code GET /host-status?url=} and {@code GET /host-reports?url=}.
 */
@Slf4j
public class HttpTrustRegistry implements TrustRegistry {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final TrustSpec spec;
    private final HttpFetcher http;
    private final ObjectMapper mapper;

    public HttpTrustRegistry(TrustSpec spec, HttpFetcher http, ObjectMapper mapper) {
        this.spec = spec;
        this.http = http;
        this.mapper = mapper;
    }

    @Override
    public JsonNode submit(Map<String, Object> payload) throws RegistryException {
        HttpResult result;
        try {
            result = http.postJson(endpoint("report-host"), mapper.writeValueAsString(payload), TIMEOUT);
        } catch (IOException e) {
            throw new RegistryException("Trust registry unreachable: " + e.getMessage(), e);
        }

        // replies that are not JSON only tell success by status
        try {
            JsonNode node = mapper.readTree(StringUtils.defaultString(result.getBody()));
            if (node != null && node.isObject()) {
                return node;
            }
        } catch (JsonProcessingException e) {
            log.debug("Non-JSON reply from trust registry: HTTP {}", result.getStatus());
        }
        ObjectNode fallback = mapper.createObjectNode();
        fallback.put("success", result.isOk());
        return fallback;
    }

    @Override
    public JsonNode hostStatus(String hostUrl) throws RegistryException {
        return get(endpoint("host-status") + "?url=" + URLEncoder.encode(hostUrl, StandardCharsets.UTF_8));
    }

    @Override
    public int reportCount(String hostUrl) throws RegistryException {
        JsonNode node = get(endpoint("host-reports") + "?url=" + URLEncoder.encode(hostUrl, StandardCharsets.UTF_8));
        return node.path("count").asInt(0);
    }

    private JsonNode get(String url) throws RegistryException {
        HttpResult result;
        try {
            result = http.get(url, ImmutableMap.of(), TIMEOUT);
        } catch (IOException e) {
            throw new RegistryException("Trust registry unreachable: " + e.getMessage(), e);
        }
        if (!result.isOk()) {
            throw new RegistryException("Trust registry returned HTTP " + result.getStatus());
        }
        try {
            JsonNode node = mapper.readTree(StringUtils.defaultString(result.getBody()));
            if (node == null || !node.isObject()) {
                throw new RegistryException("Unexpected trust registry response");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new RegistryException("Malformed trust registry response", e);
        }
    }

    private String endpoint(String name) {
        return StringUtils.removeEnd(spec.getRegistryUrl(), "/") + "/" + name;
    }
}

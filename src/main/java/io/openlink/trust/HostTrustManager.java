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

import com.fasterxml.jackson.databind.JsonNode;
import io.openlink.config.spec.TrustSpec;
import io.openlink.core.OperationResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lets participants report public hosts and check whether a host is banned.
 * <p>
 * Counting, banning and alerting happen in the registry; a host is considered banned here once
 * the registry says so or its report count reaches the configured threshold. Registry failures
 * never propagate: reports fail softly, ban checks answer "not banned" and counts answer 0.
 */
@Slf4j
public class HostTrustManager {

    private final TrustSpec spec;
    private final TrustRegistry registry;
    private final Clock clock;

    public HostTrustManager(TrustSpec spec, TrustRegistry registry, Clock clock) {
        this.spec = spec;
        this.registry = registry;
        this.clock = clock;
    }

    public ReportResult reportHost(String hostUrl, String reporterId, String reason) {
        if (StringUtils.isBlank(hostUrl)) {
            return ReportResult.failed("Host URL is required");
        }
        Report report = new Report(hostUrl, reporterId, reason, clock.millis());
        try {
            JsonNode reply = registry.submit(report.toPayload());
            if (!reply.path("success").asBoolean(true)) {
                return ReportResult.failed(reply.path("error").asText("Report rejected"));
            }
            int total = reply.path("totalReports").asInt(0);
            String action = reply.path("actionTaken").asText(ReportResult.ACTION_LOGGED);
            boolean banned = ReportResult.ACTION_BANNED.equals(action) || total >= spec.getReportThreshold();
            log.info("Host reported: {}, reason: {}, total reports: {}", hostUrl, reason, total);
            return ReportResult.accepted(total, action, banned);
        } catch (RegistryException e) {
            log.warn("Failed to report host {}: {}", hostUrl, e.getMessage());
            return ReportResult.failed(e.getMessage());
        }
    }

    public BanStatus checkHostBanStatus(String hostUrl) {
        try {
            JsonNode status = registry.hostStatus(hostUrl);
            Long expiresAt = status.hasNonNull("expiresAt") ? status.get("expiresAt").asLong() : null;
            boolean banned = status.path("banned").asBoolean(false)
                    && (expiresAt == null || expiresAt > clock.millis());
            return BanStatus.of(banned, status.path("reason").asText(null), expiresAt);
        } catch (RegistryException e) {
            log.debug("Ban status of {} unknown: {}", hostUrl, e.getMessage());
            return BanStatus.unknown(e.getMessage());
        }
    }

    public int getHostReportCount(String hostUrl) {
        try {
            return registry.reportCount(hostUrl);
        } catch (RegistryException e) {
            log.debug("Report count of {} unknown: {}", hostUrl, e.getMessage());
            return 0;
        }
    }

    /**
     * Admin action lifting a ban.
     */
    public OperationResult unbanHost(String hostUrl, String adminToken) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", "unban");
        payload.put("hostUrl", hostUrl);
        payload.put("adminToken", adminToken);
        payload.put("timestamp", clock.millis());
        try {
            JsonNode reply = registry.submit(payload);
            if (!reply.path("success").asBoolean(false)) {
                return OperationResult.fail(reply.path("error").asText("Unban rejected"));
            }
            log.info("Host unbanned: {}", hostUrl);
            return OperationResult.ok();
        } catch (RegistryException e) {
            log.warn("Failed to unban host {}: {}", hostUrl, e.getMessage());
            return OperationResult.fail(e.getMessage());
        }
    }

    public int getReportThreshold() {
        return spec.getReportThreshold();
    }

    public String getAdminContact() {
        return spec.getAdminContact();
    }
}

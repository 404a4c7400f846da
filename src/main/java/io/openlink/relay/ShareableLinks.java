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
package io.openlink.relay;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;

import java.security.SecureRandom;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds and parses shareable connection links of the form {@code https://<domain>/<sessionId>}
 * over a fixed pool of link domains.
 */
public class ShareableLinks {

    private final List<String> domains;
    private final SessionIdGenerator ids;
    private final SecureRandom random;

    public ShareableLinks(List<String> domains, SessionIdGenerator ids, SecureRandom random) {
        if (domains.isEmpty()) {
            throw new IllegalArgumentException("At least one link domain is required");
        }
        this.domains = ImmutableList.copyOf(domains);
        this.ids = ids;
        this.random = random;
    }

    public List<String> getDomains() {
        return domains;
    }

    /**
     * @param sessionId       existing session id, or null to generate one
     * @param preferredDomain used when it belongs to the pool, otherwise a random pool domain is picked
     */
    public ShareableLink generate(String sessionId, String preferredDomain) {
        String id = StringUtils.isBlank(sessionId) ? ids.nextSessionId() : sessionId;
        String domain = preferredDomain != null && domains.contains(preferredDomain)
                ? preferredDomain
                : domains.get(random.nextInt(domains.size()));
        return new ShareableLink(id, domain);
    }

    public ShareableLink generate() {
        return generate(null, null);
    }

    /**
     * Parse {@code http(s)://<domain>/<id>} or {@code <domain>/<id>} for a pool domain.
     */
    public Optional<ShareableLink> parse(String link) {
        if (StringUtils.isBlank(link)) {
            return Optional.empty();
        }
        String s = link.trim();
        String lower = s.toLowerCase(Locale.ROOT);
        if (lower.startsWith("https://")) {
            s = s.substring("https://".length());
        } else if (lower.startsWith("http://")) {
            s = s.substring("http://".length());
        }

        for (String domain : domains) {
            String prefix = domain + "/";
            if (s.regionMatches(true, 0, prefix, 0, prefix.length()) && s.length() > prefix.length()) {
                return Optional.of(new ShareableLink(s.substring(prefix.length()), domain));
            }
        }
        return Optional.empty();
    }
}

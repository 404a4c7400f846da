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

import com.fasterxml.jackson.core.type.TypeReference;
import io.openlink.core.OperationResult;
import io.openlink.store.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maintains the host's verification profile, persisted under {@link #VERIFICATION_KEY}.
 */
@Slf4j
public class VerificationService {

    public static final String VERIFICATION_KEY = "verification";

    private static final Pattern MASTODON_HANDLE = Pattern.compile("^@(\\w+)@([\\w.-]+)$");

    private final KeyValueStore store;
    private final Clock clock;
    private final Supplier<String> hostName;

    private VerificationProfile profile;

    public VerificationService(KeyValueStore store, Clock clock, Supplier<String> hostName) {
        this.store = store;
        this.clock = clock;
        this.hostName = hostName;
        this.profile = store.get(VERIFICATION_KEY, new TypeReference<VerificationProfile>() {
        }, new VerificationProfile());
    }

    /**
     * Set the verification status and level. Marking a profile verified records the time.
     */
    public synchronized VerificationInfo setVerification(boolean verified, VerificationLevel level) {
        if (verified && !profile.isVerified()) {
            profile.setVerifiedAt(clock.millis());
        } else if (!verified) {
            profile.setVerifiedAt(null);
        }
        profile.setVerified(verified);
        profile.setVerificationLevel(level == null ? VerificationLevel.NONE : level);
        persist();
        return getVerificationInfo();
    }

    public synchronized OperationResult setMastodonVerification(String handle, String url) {
        Matcher m = handle == null ? null : MASTODON_HANDLE.matcher(handle.trim());
        if (m == null || !m.matches()) {
            return OperationResult.fail("Invalid Mastodon handle format. Use @user@instance.social");
        }
        profile.setMastodon(handle.trim());
        profile.setMastodonUrl(StringUtils.isNotBlank(url) ? url.trim() : "https://" + m.group(2) + "/@" + m.group(1));
        persist();
        return OperationResult.ok();
    }

    public synchronized List<VerificationLink> setSocialLinks(SocialLinks links) {
        if (StringUtils.isNotBlank(links.getTwitter())) {
            profile.setTwitter(StringUtils.removeStart(links.getTwitter().trim(), "@"));
        }
        if (StringUtils.isNotBlank(links.getGithub())) {
            profile.setGithub(links.getGithub().trim());
        }
        if (StringUtils.isNotBlank(links.getWebsite())) {
            profile.setWebsite(links.getWebsite().trim());
        }
        if (StringUtils.isNotBlank(links.getEmail())) {
            profile.setEmail(links.getEmail().trim());
        }
        if (StringUtils.isNotBlank(links.getPgpKeyId())) {
            profile.setPgpKeyId(links.getPgpKeyId().trim());
        }
        persist();
        return getVerificationLinks();
    }

    /**
     * Add an unverified custom link.
     */
    public synchronized OperationResult addCustomVerificationLink(String name, String url) {
        if (StringUtils.isAnyBlank(name, url)) {
            return OperationResult.fail("Link name and URL are required");
        }
        profile.getCustomLinks().add(new CustomLink(name.trim(), url.trim(), false, clock.millis()));
        persist();
        return OperationResult.ok();
    }

    /**
     * Mark the custom link pointing at {@code url} as verified.
     */
    public synchronized OperationResult verifyCustomLink(String url) {
        for (CustomLink link : profile.getCustomLinks()) {
            if (link.getUrl().equals(url)) {
                link.setVerified(true);
                persist();
                return OperationResult.ok();
            }
        }
        return OperationResult.fail("Link not found: " + url);
    }

    public synchronized OperationResult setOrganization(String organization, boolean verified) {
        profile.setOrganization(StringUtils.trimToNull(organization));
        profile.setOrgVerified(verified && profile.getOrganization() != null);
        persist();
        return OperationResult.ok();
    }

    public synchronized OperationResult addBadge(String badge) {
        if (StringUtils.isBlank(badge)) {
            return OperationResult.fail("Badge name is required");
        }
        if (!profile.getBadges().contains(badge.trim())) {
            profile.getBadges().add(badge.trim());
            persist();
        }
        return OperationResult.ok();
    }

    public synchronized List<VerificationLink> getVerificationLinks() {
        List<VerificationLink> links = new ArrayList<>();
        if (profile.getMastodon() != null) {
            links.add(VerificationLink.mastodon(profile.getMastodon(), profile.getMastodonUrl()));
        }
        if (profile.getTwitter() != null) {
            links.add(VerificationLink.twitter(profile.getTwitter()));
        }
        if (profile.getGithub() != null) {
            links.add(VerificationLink.github(profile.getGithub()));
        }
        if (profile.getWebsite() != null) {
            links.add(VerificationLink.website(profile.getWebsite()));
        }
        if (profile.getEmail() != null) {
            links.add(VerificationLink.email(profile.getEmail()));
        }
        if (profile.getPgpKeyId() != null) {
            links.add(VerificationLink.pgp(profile.getPgpKeyId()));
        }
        for (CustomLink link : profile.getCustomLinks()) {
            links.add(VerificationLink.custom(link));
        }
        return links;
    }

    public synchronized VerificationInfo getVerificationInfo() {
        return new VerificationInfo(profile, hostName.get(), getVerificationLinks());
    }

    public synchronized int getTrustScore() {
        return TrustScore.calculate(profile);
    }

    public synchronized TrustLevel getTrustLevel() {
        return TrustScore.level(profile);
    }

    private void persist() {
        store.set(VERIFICATION_KEY, profile);
    }
}

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

import org.apache.commons.lang3.StringUtils;

/**
 * Scores a {@link VerificationProfile} from 0 to 100.
 */
public final class TrustScore {

    public static final int MAX = 100;

    static final int VERIFIED = 30;
    static final int MASTODON = 10;
    static final int TWITTER = 5;
    static final int GITHUB = 10;
    static final int WEBSITE = 5;
    static final int EMAIL = 5;
    static final int PGP = 15;
    static final int ORGANIZATION = 5;
    static final int ORG_VERIFIED = 15;
    static final int BADGE = 5;
    static final int VERIFIED_LINK = 5;

    private TrustScore() {
    }

    public static int calculate(VerificationProfile v) {
        int score = 0;
        if (v.isVerified()) {
            score += VERIFIED;
        }
        if (v.getVerificationLevel() != null) {
            score += v.getVerificationLevel().getPoints();
        }

        score += points(v.getMastodon(), MASTODON);
        score += points(v.getTwitter(), TWITTER);
        score += points(v.getGithub(), GITHUB);
        score += points(v.getWebsite(), WEBSITE);
        score += points(v.getEmail(), EMAIL);
        score += points(v.getPgpKeyId(), PGP);

        score += points(v.getOrganization(), ORGANIZATION);
        if (v.isOrgVerified()) {
            score += ORG_VERIFIED;
        }

        if (v.getBadges() != null) {
            score += v.getBadges().size() * BADGE;
        }
        if (v.getCustomLinks() != null) {
            score += (int) v.getCustomLinks().stream().filter(CustomLink::isVerified).count() * VERIFIED_LINK;
        }
        return Math.min(MAX, score);
    }

    public static TrustLevel level(VerificationProfile v) {
        return TrustLevel.fromScore(calculate(v));
    }

    private static int points(String value, int points) {
        return StringUtils.isNotBlank(value) ? points : 0;
    }
}

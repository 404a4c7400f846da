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

import lombok.Getter;

import java.util.List;

/**
 * Public view of a host's verification, including its trust score.
 */
@Getter
public class VerificationInfo {

    private final boolean verified;
    private final VerificationLevel verificationLevel;
    private final Long verifiedAt;
    private final String hostName;
    private final List<VerificationLink> links;
    private final String organization;
    private final boolean orgVerified;
    private final List<String> badges;
    private final int trustScore;
    private final TrustLevel trustLevel;

    VerificationInfo(VerificationProfile p, String hostName, List<VerificationLink> links) {
        this.verified = p.isVerified();
        this.verificationLevel = p.getVerificationLevel();
        this.verifiedAt = p.getVerifiedAt();
        this.hostName = hostName;
        this.links = links;
        this.organization = p.getOrganization();
        this.orgVerified = p.isOrgVerified();
        this.badges = List.copyOf(p.getBadges());
        this.trustScore = TrustScore.calculate(p);
        this.trustLevel = TrustLevel.fromScore(trustScore);
    }
}

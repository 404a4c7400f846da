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

import io.openlink.store.KeyValueStore;
import io.openlink.store.MemoryKeyValueStore;
import org.junit.Before;
import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class VerificationServiceTest {

    private static final long NOW = 1_700_000_000_000L;

    private KeyValueStore store;
    private VerificationService service;

    @Before
    public void setUp() {
        store = new MemoryKeyValueStore();
        service = newService();
    }

    private VerificationService newService() {
        return new VerificationService(store, Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC), () -> "Studio");
    }

    @Test
    public void testSetVerification() {
        VerificationInfo info = service.setVerification(true, VerificationLevel.VERIFIED);

        assertTrue(info.isVerified());
        assertEquals(Long.valueOf(NOW), info.getVerifiedAt());
        assertEquals("Studio", info.getHostName());
        assertEquals(55, info.getTrustScore());
        assertEquals(TrustLevel.VERIFIED, info.getTrustLevel());

        info = service.setVerification(false, null);
        assertNull(info.getVerifiedAt());
        assertEquals(VerificationLevel.NONE, info.getVerificationLevel());
        assertEquals(0, service.getTrustScore());
    }

    @Test
    public void testMastodonHandle() {
        assertTrue(service.setMastodonVerification("@alice@mastodon.social", null).isSuccess());

        VerificationLink link = service.getVerificationLinks().get(0);
        assertEquals("mastodon", link.getType());
        assertEquals("@alice@mastodon.social", link.getHandle());
        assertEquals("https://mastodon.social/@alice", link.getUrl());

        service.setMastodonVerification("@bob@fosstodon.org", "https://fosstodon.org/@bob/verify");
        assertEquals("https://fosstodon.org/@bob/verify", service.getVerificationLinks().get(0).getUrl());
    }

    @Test
    public void testInvalidMastodonHandle() {
        assertFalse(service.setMastodonVerification("alice@mastodon.social", null).isSuccess());
        assertFalse(service.setMastodonVerification("@alice", null).isSuccess());
        assertFalse(service.setMastodonVerification(null, null).isSuccess());
        assertTrue(service.getVerificationLinks().isEmpty());
    }

    @Test
    public void testSocialLinks() {
        SocialLinks social = new SocialLinks();
        social.setTwitter("@alice");
        social.setGithub("alice");
        social.setEmail("alice@example.com");
        social.setPgpKeyId("ABCD1234");

        List<VerificationLink> links = service.setSocialLinks(social);

        assertEquals(4, links.size());
        assertEquals("twitter", links.get(0).getType());
        assertEquals("@alice", links.get(0).getHandle());
        assertEquals("https://twitter.com/alice", links.get(0).getUrl());
        assertEquals("https://github.com/alice", links.get(1).getUrl());
        assertEquals("alice@example.com", links.get(2).getValue());
        assertEquals("https://keys.openpgp.org/search?q=ABCD1234", links.get(3).getUrl());
    }

    @Test
    public void testCustomLinks() {
        assertFalse(service.addCustomVerificationLink("", "https://blog.example.com").isSuccess());
        assertTrue(service.addCustomVerificationLink("Blog", "https://blog.example.com").isSuccess());
        assertEquals(0, service.getTrustScore());

        assertFalse(service.verifyCustomLink("https://other.example.com").isSuccess());
        assertTrue(service.verifyCustomLink("https://blog.example.com").isSuccess());

        VerificationLink link = service.getVerificationLinks().get(0);
        assertEquals("custom", link.getType());
        assertEquals("Blog", link.getName());
        assertEquals(Boolean.TRUE, link.getVerified());
        assertEquals(TrustScore.VERIFIED_LINK, service.getTrustScore());
    }

    @Test
    public void testOrganizationAndBadges() {
        service.setOrganization("  ", true);
        assertFalse("no organization to verify", service.getVerificationInfo().isOrgVerified());

        service.setOrganization("Example Org", true);
        service.addBadge("early-adopter");
        service.addBadge("early-adopter");
        assertFalse(service.addBadge(" ").isSuccess());

        VerificationInfo info = service.getVerificationInfo();
        assertEquals("Example Org", info.getOrganization());
        assertTrue(info.isOrgVerified());
        assertEquals(1, info.getBadges().size());
        assertEquals(25, info.getTrustScore());
        assertEquals(TrustLevel.BASIC, service.getTrustLevel());
    }

    @Test
    public void testProfileIsPersisted() {
        service.setVerification(true, VerificationLevel.TRUSTED);
        service.setMastodonVerification("@alice@mastodon.social", null);
        service.addCustomVerificationLink("Blog", "https://blog.example.com");

        VerificationService reloaded = newService();
        VerificationInfo info = reloaded.getVerificationInfo();
        assertTrue(info.isVerified());
        assertEquals(VerificationLevel.TRUSTED, info.getVerificationLevel());
        assertEquals(2, info.getLinks().size());
        assertEquals(80, info.getTrustScore());
    }
}

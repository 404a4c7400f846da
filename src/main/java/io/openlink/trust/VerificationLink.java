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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

/**
 * One identity link shown to connecting users.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VerificationLink {

    private final String type;
    private final String icon;
    private String handle;
    private String url;
    private String value;
    private String keyId;
    private String name;
    private Boolean verified;

    private VerificationLink(String type, String icon) {
        this.type = type;
        this.icon = icon;
    }

    static VerificationLink mastodon(String handle, String url) {
        VerificationLink l = new VerificationLink("mastodon", "mastodon");
        l.handle = handle;
        l.url = url;
        return l;
    }

    static VerificationLink twitter(String user) {
        VerificationLink l = new VerificationLink("twitter", "twitter");
        l.handle = "@" + user;
        l.url = "https://twitter.com/" + user;
        return l;
    }

    static VerificationLink github(String user) {
        VerificationLink l = new VerificationLink("github", "github");
        l.handle = user;
        l.url = "https://github.com/" + user;
        return l;
    }

    static VerificationLink website(String url) {
        VerificationLink l = new VerificationLink("website", "globe");
        l.url = url;
        return l;
    }

    static VerificationLink email(String email) {
        VerificationLink l = new VerificationLink("email", "email");
        l.value = email;
        return l;
    }

    static VerificationLink pgp(String keyId) {
        VerificationLink l = new VerificationLink("pgp", "key");
        l.keyId = keyId;
        l.url = "https://keys.openpgp.org/search?q=" + keyId;
        return l;
    }

    static VerificationLink custom(CustomLink link) {
        VerificationLink l = new VerificationLink("custom", "link");
        l.name = link.getName();
        l.url = link.getUrl();
        l.verified = link.isVerified();
        return l;
    }
}

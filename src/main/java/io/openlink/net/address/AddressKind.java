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

import lombok.Getter;

/**
 * Kind of a server address as recognised by {@link AddressParser}.
 */
@Getter
public enum AddressKind {

    IPV4("ipv4", false),
    IPV6("ipv6", false),
    DOMAIN("domain", false),
    /**
     * Name resolved through a DNS TXT record published for an ENS-style domain.
     */
    ENS("ens", true),
    /**
     * Name resolved through the Unstoppable-style domain registry API.
     */
    UNSTOPPABLE("unstoppable", true),
    UNKNOWN("unknown", false);

    private final String wireName;
    private final boolean web3;

    AddressKind(String wireName, boolean web3) {
        this.wireName = wireName;
        this.web3 = web3;
    }

    public static AddressKind of(String wireName) {
        for (AddressKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(wireName)) {
                return kind;
            }
        }
        return UNKNOWN;
    }
}

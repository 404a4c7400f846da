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

import java.util.Objects;

/**
 * Typed description of a raw server address. A pure value; two results with equal fields are equal.
 */
@Getter
public class AddressParseResult {

    private final String original;
    private final AddressKind kind;
    private final String host;
    private final Integer port;
    private final String protocol;
    private final boolean requiresResolution;

    public AddressParseResult(String original, AddressKind kind, String host, Integer port, String protocol) {
        this.original = original;
        this.kind = kind;
        this.host = host;
        this.port = port;
        this.protocol = protocol;
        this.requiresResolution = kind.isWeb3();
    }

    /**
     * Build the WebSocket endpoint this address denotes, without any network lookup.
     */
    public String toEndpoint() {
        if (host == null) {
            return original;
        }
        String h = kind == AddressKind.IPV6 ? "[" + host + "]" : host;
        return port == null ? protocol + "://" + h : protocol + "://" + h + ":" + port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AddressParseResult)) return false;
        AddressParseResult other = (AddressParseResult) o;
        return requiresResolution == other.requiresResolution
                && Objects.equals(original, other.original)
                && kind == other.kind
                && Objects.equals(host, other.host)
                && Objects.equals(port, other.port)
                && Objects.equals(protocol, other.protocol);
    }

    @Override
    public int hashCode() {
        return Objects.hash(original, kind, host, port, protocol, requiresResolution);
    }

    @Override
    public String toString() {
        return "AddressParseResult [kind=" + kind + ", host=" + host + ", port=" + port
                + ", protocol=" + protocol + "]";
    }
}

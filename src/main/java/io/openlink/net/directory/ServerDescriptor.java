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
package io.openlink.net.directory;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.openlink.net.address.AddressKind;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A relay server known to the directory. Identity is the URL.
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServerDescriptor {

    private String name;
    private String url;
    private ServerKind kind;
    private String region;
    private List<String> features = new ArrayList<>();

    // saved servers only
    private AddressKind addressKind;
    private Long addedAt;
    private ServerPreference preference;

    @JsonIgnore
    private HealthStatus status = HealthStatus.UNKNOWN;

    public ServerDescriptor() {
    }

    public ServerDescriptor(String name, String url, ServerKind kind, String region, List<String> features) {
        this.name = name;
        this.url = url;
        this.kind = kind;
        this.region = region;
        this.features = features == null ? new ArrayList<>() : new ArrayList<>(features);
    }

    /**
     * Copy annotated with the given health status.
     */
    public ServerDescriptor withStatus(HealthStatus status) {
        ServerDescriptor copy = new ServerDescriptor(name, url, kind, region, features);
        copy.addressKind = addressKind;
        copy.addedAt = addedAt;
        copy.preference = preference;
        copy.status = status == null ? HealthStatus.UNKNOWN : status;
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ServerDescriptor other && Objects.equals(url, other.url);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(url);
    }

    @Override
    public String toString() {
        return "ServerDescriptor [name=" + name + ", url=" + url + ", kind=" + kind + ", status=" + status + "]";
    }
}

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

import lombok.Getter;

/**
 * Partial relay configuration applied by {@link RelayHost#configure(RelayOptions)}. Unset fields
 * leave the current value alone.
 */
@Getter
public class RelayOptions {

    private final String hostName;
    private final Integer maxConnections;
    private final Boolean publicServer;

    private RelayOptions(Builder builder) {
        this.hostName = builder.hostName;
        this.maxConnections = builder.maxConnections;
        this.publicServer = builder.publicServer;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private String hostName;
        private Integer maxConnections;
        private Boolean publicServer;

        public Builder hostName(String hostName) {
            this.hostName = hostName;
            return this;
        }

        public Builder maxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder publicServer(boolean publicServer) {
            this.publicServer = publicServer;
            return this;
        }

        public RelayOptions build() {
            return new RelayOptions(this);
        }
    }
}

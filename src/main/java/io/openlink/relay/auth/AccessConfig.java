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
package io.openlink.relay.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted access settings of the relay host.
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class AccessConfig {

    private AccessMode accessMode = AccessMode.PUBLIC;
    private boolean publicServer = true;
    private String hostName;
    private int maxConnections = 100;

    private String pinCode;
    private String passwordSalt;
    private String passwordHash;
    private String twoFactorSecret;
    private boolean twoFactorEnabled;

    private List<String> whitelistedIps = new ArrayList<>();
    private List<String> blacklistedIps = new ArrayList<>();

    private boolean requireConnectionPin;
    private String connectionPin;
    /**
     * Epoch millis after which the connection PIN is rejected, 0 for never.
     */
    private long connectionPinExpiry;
    private boolean oneTimePin;
}

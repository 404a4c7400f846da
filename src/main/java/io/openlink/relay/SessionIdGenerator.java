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

import java.security.SecureRandom;

/**
 * Generates shareable session ids: 20 to 24 characters of mixed-case letters and digits, with
 * {@code -} or {@code _} separators sprinkled in every five to seven positions, never first or last.
 */
public class SessionIdGenerator {

    static final String ALPHANUMERIC = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    static final String SEPARATORS = "-_";
    static final int MIN_LENGTH = 20;
    static final int MAX_LENGTH = 24;

    private static final String CLIENT_ID_CHARS = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int CLIENT_ID_LENGTH = 13;

    private final SecureRandom random;

    public SessionIdGenerator(SecureRandom random) {
        this.random = random;
    }

    public SessionIdGenerator() {
        this(new SecureRandom());
    }

    public String nextSessionId() {
        int length = MIN_LENGTH + random.nextInt(MAX_LENGTH - MIN_LENGTH + 1);
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            if (i > 0 && i < length - 1 && i % (5 + random.nextInt(3)) == 0) {
                sb.append(SEPARATORS.charAt(random.nextInt(SEPARATORS.length())));
            } else {
                sb.append(ALPHANUMERIC.charAt(random.nextInt(ALPHANUMERIC.length())));
            }
        }
        return sb.toString();
    }

    /**
     * Connection ids, {@code c_} followed by lowercase base-36 characters.
     */
    public String nextClientId() {
        StringBuilder sb = new StringBuilder("c_");
        for (int i = 0; i < CLIENT_ID_LENGTH; i++) {
            sb.append(CLIENT_ID_CHARS.charAt(random.nextInt(CLIENT_ID_CHARS.length())));
        }
        return sb.toString();
    }
}

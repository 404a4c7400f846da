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

import org.apache.commons.codec.binary.Base32;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.apache.commons.lang3.StringUtils;

import java.nio.ByteBuffer;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Locale;

/**
 * Time-based one-time passwords: HMAC-SHA1, 6 digits, 30 second steps.
 */
public class Totp {

    public static final int DIGITS = 6;
    public static final long STEP_MILLIS = 30_000L;
    public static final int SECRET_BYTES = 20;

    /**
     * Accepted drift, in steps, either side of the current one.
     */
    public static final int WINDOW = 1;

    private static final int MODULUS = 1_000_000;

    private final Clock clock;
    private final SecureRandom random;

    public Totp(Clock clock, SecureRandom random) {
        this.clock = clock;
        this.random = random;
    }

    public Totp(Clock clock) {
        this(clock, new SecureRandom());
    }

    /**
     * A fresh Base32 secret without padding.
     */
    public String generateSecret() {
        byte[] bytes = new byte[SECRET_BYTES];
        random.nextBytes(bytes);
        return StringUtils.remove(new Base32().encodeAsString(bytes), '=');
    }

    public boolean verify(String secret, String code) {
        if (StringUtils.isBlank(secret) || code == null || code.length() != DIGITS || !StringUtils.isNumeric(code)) {
            return false;
        }
        long counter = clock.millis() / STEP_MILLIS;
        for (int i = -WINDOW; i <= WINDOW; i++) {
            if (generate(secret, counter + i).equals(code)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Code valid at the current step.
     */
    public String now(String secret) {
        return generate(secret, clock.millis() / STEP_MILLIS);
    }

    public static String generate(String secret, long counter) {
        byte[] key = new Base32().decode(secret.toUpperCase(Locale.ROOT));
        byte[] hash = new HmacUtils(HmacAlgorithms.HMAC_SHA_1, key)
                .hmac(ByteBuffer.allocate(Long.BYTES).putLong(counter).array());

        int offset = hash[hash.length - 1] & 0xf;
        int binary = ((hash[offset] & 0x7f) << 24)
                | ((hash[offset + 1] & 0xff) << 16)
                | ((hash[offset + 2] & 0xff) << 8)
                | (hash[offset + 3] & 0xff);
        return StringUtils.leftPad(Integer.toString(binary % MODULUS), DIGITS, '0');
    }
}

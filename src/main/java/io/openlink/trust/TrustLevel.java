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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Display bucket of a trust score.
 */
public enum TrustLevel {

    HIGHLY_TRUSTED("highly-trusted", "Highly Trusted", "green", 80),
    TRUSTED("trusted", "Trusted", "blue", 60),
    VERIFIED("verified", "Verified", "teal", 40),
    BASIC("basic", "Basic Verification", "yellow", 20),
    UNVERIFIED("unverified", "Unverified", "gray", 0);

    private final String level;
    private final String label;
    private final String color;
    private final int minScore;

    TrustLevel(String level, String label, String color, int minScore) {
        this.level = level;
        this.label = label;
        this.color = color;
        this.minScore = minScore;
    }

    public static TrustLevel fromScore(int score) {
        for (TrustLevel l : values()) {
            if (score >= l.minScore) {
                return l;
            }
        }
        return UNVERIFIED;
    }

    @JsonValue
    public String getLevel() {
        return level;
    }

    public String getLabel() {
        return label;
    }

    public String getColor() {
        return color;
    }

    public int getMinScore() {
        return minScore;
    }
}

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum VerificationLevel {

    NONE("none", 0),
    BASIC("basic", 10),
    VERIFIED("verified", 25),
    TRUSTED("trusted", 40);

    private final String wireName;
    private final int points;

    VerificationLevel(String wireName, int points) {
        this.wireName = wireName;
        this.points = points;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Trust score contribution.
     */
    public int getPoints() {
        return points;
    }

    @JsonCreator
    public static VerificationLevel of(String wireName) {
        for (VerificationLevel l : values()) {
            if (l.wireName.equalsIgnoreCase(wireName) || l.name().equalsIgnoreCase(wireName)) {
                return l;
            }
        }
        return NONE;
    }
}

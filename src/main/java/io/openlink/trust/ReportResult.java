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

import io.openlink.core.OperationResult;
import lombok.Getter;

@Getter
public class ReportResult extends OperationResult {

    public static final String ACTION_LOGGED = "logged";
    public static final String ACTION_BANNED = "banned_and_alerted";

    private final int totalReports;
    private final String actionTaken;
    private final boolean banned;

    private ReportResult(boolean success, String error, int totalReports, String actionTaken, boolean banned) {
        super(success, error);
        this.totalReports = totalReports;
        this.actionTaken = actionTaken;
        this.banned = banned;
    }

    static ReportResult accepted(int totalReports, String actionTaken, boolean banned) {
        return new ReportResult(true, null, totalReports, actionTaken, banned);
    }

    static ReportResult failed(String error) {
        return new ReportResult(false, error, 0, null, false);
    }
}

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

import io.openlink.core.OperationResult;
import lombok.Getter;

@Getter
public class AddServerResult extends OperationResult {

    private final ServerDescriptor server;
    private final boolean alreadyExists;

    private AddServerResult(boolean success, String error, ServerDescriptor server, boolean alreadyExists) {
        super(success, error);
        this.server = server;
        this.alreadyExists = alreadyExists;
    }

    public static AddServerResult added(ServerDescriptor server) {
        return new AddServerResult(true, null, server, false);
    }

    public static AddServerResult alreadyExists(String url) {
        return new AddServerResult(false, "Server already exists: " + url, null, true);
    }

    public static AddServerResult invalid(String error) {
        return new AddServerResult(false, error, null, false);
    }
}

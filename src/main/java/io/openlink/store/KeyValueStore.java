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
package io.openlink.store;

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * Opaque persistent key-value store owned by the application shell.
 * <p>
 * The relay reads and writes its saved servers, access configuration and verification profile
 * through this interface only and makes no assumption about the backing format.
 */
public interface KeyValueStore {

    /**
     * Get the value stored under {@code key}, or {@code defaultValue} when absent or unreadable.
     */
    <T> T get(String key, TypeReference<T> type, T defaultValue);

    /**
     * Store {@code value} under {@code key}, replacing any previous value.
     */
    void set(String key, Object value);

    /**
     * Remove the value stored under {@code key}.
     */
    void remove(String key);

    boolean contains(String key);
}

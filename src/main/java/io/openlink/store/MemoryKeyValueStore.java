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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store. Values are kept as JSON trees, so callers never share mutable state with it.
 */
@Slf4j
public class MemoryKeyValueStore implements KeyValueStore {

    private final ObjectMapper mapper;
    private final Map<String, JsonNode> values = new ConcurrentHashMap<>();

    public MemoryKeyValueStore(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public MemoryKeyValueStore() {
        this(new ObjectMapper());
    }

    @Override
    public <T> T get(String key, TypeReference<T> type, T defaultValue) {
        JsonNode node = values.get(key);
        if (node == null) {
            return defaultValue;
        }
        try {
            return mapper.convertValue(node, type);
        } catch (IllegalArgumentException e) {
            log.warn("Stored value for {} is unreadable, using default", key, e);
            return defaultValue;
        }
    }

    @Override
    public void set(String key, Object value) {
        values.put(key, mapper.valueToTree(value));
    }

    @Override
    public void remove(String key) {
        values.remove(key);
    }

    @Override
    public boolean contains(String key) {
        return values.containsKey(key);
    }
}

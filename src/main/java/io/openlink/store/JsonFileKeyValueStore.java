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
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Store persisted as a single JSON document. Every write rewrites the file through a temp file.
 */
@Slf4j
public class JsonFileKeyValueStore implements KeyValueStore {

    private final Path file;
    private final ObjectMapper mapper;
    private final ObjectNode root;

    public JsonFileKeyValueStore(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.root = load();
    }

    public JsonFileKeyValueStore(Path file) {
        this(file, new ObjectMapper());
    }

    private ObjectNode load() {
        if (!Files.isRegularFile(file)) {
            return mapper.createObjectNode();
        }
        try {
            JsonNode node = mapper.readTree(file.toFile());
            if (node instanceof ObjectNode) {
                return (ObjectNode) node;
            }
            log.warn("Store file {} does not contain a JSON object, starting empty", file);
        } catch (IOException e) {
            log.warn("Failed to read store file {}, starting empty", file, e);
        }
        return mapper.createObjectNode();
    }

    @Override
    public synchronized <T> T get(String key, TypeReference<T> type, T defaultValue) {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
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
    public synchronized void set(String key, Object value) {
        root.set(key, mapper.valueToTree(value));
        flush();
    }

    @Override
    public synchronized void remove(String key) {
        if (root.remove(key) != null) {
            flush();
        }
    }

    @Override
    public synchronized boolean contains(String key) {
        return root.has(key);
    }

    private void flush() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            mapper.writeValue(tmp.toFile(), root);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write store file " + file, e);
        }
    }
}

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * In-memory transport that records everything sent to the client.
 */
public class FakeTransport implements Transport {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String ip;
    private final List<String> texts = new ArrayList<>();
    private final List<byte[]> binaries = new ArrayList<>();
    private boolean open = true;

    public FakeTransport(String ip) {
        this.ip = ip;
    }

    @Override
    public synchronized void sendText(String text) {
        texts.add(text);
    }

    @Override
    public synchronized void sendBinary(byte[] data) {
        binaries.add(data);
    }

    @Override
    public synchronized void close() {
        open = false;
    }

    @Override
    public synchronized boolean isOpen() {
        return open;
    }

    @Override
    public String getRemoteIp() {
        return ip;
    }

    public synchronized List<JsonNode> messages() {
        return texts.stream().map(FakeTransport::parse).collect(Collectors.toList());
    }

    public synchronized List<String> types() {
        return messages().stream().map(m -> m.path("type").asText()).collect(Collectors.toList());
    }

    public synchronized JsonNode last() {
        if (texts.isEmpty()) {
            throw new AssertionError("nothing was sent to " + ip);
        }
        return parse(texts.get(texts.size() - 1));
    }

    public synchronized List<byte[]> binaries() {
        return new ArrayList<>(binaries);
    }

    public synchronized void clear() {
        texts.clear();
        binaries.clear();
    }

    private static JsonNode parse(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}

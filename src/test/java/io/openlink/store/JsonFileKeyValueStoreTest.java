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
import com.google.common.collect.ImmutableMap;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class JsonFileKeyValueStoreTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path file;

    @Before
    public void setUp() {
        file = folder.getRoot().toPath().resolve("data").resolve("store.json");
    }

    @Test
    public void testValuesSurviveReload() {
        JsonFileKeyValueStore store = new JsonFileKeyValueStore(file);
        store.set("servers", List.of("wss://a.example.com", "wss://b.example.com"));
        store.set("preference", ImmutableMap.of("mode", "auto"));

        assertTrue("parent directories are created", Files.isRegularFile(file));

        JsonFileKeyValueStore reloaded = new JsonFileKeyValueStore(file);
        assertEquals(List.of("wss://a.example.com", "wss://b.example.com"),
                reloaded.get("servers", new TypeReference<List<String>>() {}, List.of()));
        Map<String, String> pref = reloaded.get("preference", new TypeReference<Map<String, String>>() {}, null);
        assertEquals("auto", pref.get("mode"));
    }

    @Test
    public void testMissingKeyReturnsDefault() {
        JsonFileKeyValueStore store = new JsonFileKeyValueStore(file);

        assertFalse(store.contains("nothing"));
        assertEquals("fallback", store.get("nothing", new TypeReference<String>() {}, "fallback"));
        assertFalse("reads never create the file", Files.exists(file));
    }

    @Test
    public void testRemove() {
        JsonFileKeyValueStore store = new JsonFileKeyValueStore(file);
        store.set("a", 1);
        store.set("b", 2);

        store.remove("a");

        assertFalse(store.contains("a"));
        JsonFileKeyValueStore reloaded = new JsonFileKeyValueStore(file);
        assertFalse(reloaded.contains("a"));
        assertEquals(Integer.valueOf(2), reloaded.get("b", new TypeReference<Integer>() {}, null));
    }

    @Test
    public void testNonObjectFileStartsEmpty() throws Exception {
        Files.createDirectories(file.getParent());
        Files.write(file, "[1, 2, 3]".getBytes(StandardCharsets.UTF_8));

        JsonFileKeyValueStore store = new JsonFileKeyValueStore(file);
        assertFalse(store.contains("0"));

        store.set("k", "v");
        assertEquals("v", new JsonFileKeyValueStore(file).get("k", new TypeReference<String>() {}, null));
    }

    @Test
    public void testCorruptFileStartsEmpty() throws Exception {
        Files.createDirectories(file.getParent());
        Files.write(file, "{not json".getBytes(StandardCharsets.UTF_8));

        JsonFileKeyValueStore store = new JsonFileKeyValueStore(file);
        assertNull(store.get("k", new TypeReference<String>() {}, null));
    }

    @Test
    public void testUnreadableValueFallsBack() {
        JsonFileKeyValueStore store = new JsonFileKeyValueStore(file);
        store.set("port", "not a number");

        assertEquals(Integer.valueOf(8765), store.get("port", new TypeReference<Integer>() {}, 8765));
    }
}

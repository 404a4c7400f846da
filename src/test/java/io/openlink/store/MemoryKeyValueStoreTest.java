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
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class MemoryKeyValueStoreTest {

    @Test
    public void testSetGetRemove() {
        MemoryKeyValueStore store = new MemoryKeyValueStore();
        store.set("pin", "1234");

        assertTrue(store.contains("pin"));
        assertEquals("1234", store.get("pin", new TypeReference<String>() {}, null));

        store.remove("pin");
        assertFalse(store.contains("pin"));
        assertEquals("none", store.get("pin", new TypeReference<String>() {}, "none"));
    }

    @Test
    public void testValuesAreCopied() {
        MemoryKeyValueStore store = new MemoryKeyValueStore();
        List<String> list = new ArrayList<>(List.of("a"));
        store.set("list", list);
        list.add("b");

        assertEquals("later mutation is not visible", List.of("a"),
                store.get("list", new TypeReference<List<String>>() {}, List.of()));
    }
}

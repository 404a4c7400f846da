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
package io.openlink;

import io.openlink.config.Config;
import io.openlink.store.JsonFileKeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Command line entry point: {@code [port] [bindHost]}.
 * <p>
 * The configuration file is taken from {@code -Dopenlink.config}, the store from
 * {@code -Dopenlink.store} (default {@code ~/.openlink/store.json}).
 */
@Slf4j
public class Launcher {

    public static void main(String[] args) {
        Config config = Config.load(System.getProperty("openlink.config", "openlink.properties"));
        if (args.length > 0) {
            if (!StringUtils.isNumeric(args[0])) {
                System.err.println("Usage: openlink-relay [port] [bindHost]");
                System.exit(2);
            }
            config.set("relay.port", args[0]);
        }
        if (args.length > 1) {
            config.set("relay.host", args[1]);
        }

        Path storeFile = Path.of(System.getProperty("openlink.store",
                Path.of(System.getProperty("user.home"), ".openlink", "store.json").toString()));
        Kernel kernel = new Kernel(config, new JsonFileKeyValueStore(storeFile), Clock.systemUTC());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down OpenLink relay...");
            kernel.stop();
        }, "shutdown-hook"));

        try {
            kernel.start();
        } catch (Exception e) {
            log.error("Fatal error starting OpenLink relay", e);
            System.exit(1);
        }
    }
}

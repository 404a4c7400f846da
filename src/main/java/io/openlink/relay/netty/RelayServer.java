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
package io.openlink.relay.netty;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.openlink.config.spec.RelaySpec;
import io.openlink.relay.RelayEngine;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.net.InetAddress;
import java.net.InetSocketAddress;

/**
 * Netty WebSocket server carrying the relay, with the health and status endpoints on the same port.
 */
@Slf4j
public class RelayServer {

    private final RelaySpec spec;
    private final RelayEngine engine;
    private final ObjectMapper mapper;

    private Channel channel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public RelayServer(RelaySpec spec, RelayEngine engine, ObjectMapper mapper) {
        this.spec = spec;
        this.engine = engine;
        this.mapper = mapper;
    }

    /**
     * Bind and start accepting connections.
     *
     * @return the bound address
     * @throws RuntimeException if the server fails to start
     */
    public InetSocketAddress start(String host, int port) {
        try {
            final SslContext sslCtx;
            if (StringUtils.isNoneBlank(spec.getTlsCertFile(), spec.getTlsKeyFile())) {
                File certFile = new File(spec.getTlsCertFile());
                File keyFile = new File(spec.getTlsKeyFile());
                if (!certFile.exists() || !keyFile.exists()) {
                    throw new IllegalStateException("TLS certificate or key file not found");
                }
                sslCtx = SslContextBuilder.forServer(certFile, keyFile).build();
            } else {
                sslCtx = null;
            }

            bossGroup = new NioEventLoopGroup(spec.getRelayBossThreads());
            workerGroup = new NioEventLoopGroup(spec.getRelayWorkerThreads());

            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .handler(new LoggingHandler(LogLevel.DEBUG))
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childHandler(new RelayChannelInitializer(spec, engine, mapper, sslCtx));

            channel = b.bind(InetAddress.getByName(host), port).sync().channel();
            InetSocketAddress bound = (InetSocketAddress) channel.localAddress();
            log.info("Relay server listening on {}:{}{}", host, bound.getPort(), sslCtx != null ? " (TLS)" : "");
            return bound;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new RuntimeException("Interrupted while starting relay server", e);
        } catch (Exception e) {
            stop();
            throw new RuntimeException("Failed to start relay server", e);
        }
    }

    public void stop() {
        if (channel != null) {
            channel.close();
            channel = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
    }

    public boolean isRunning() {
        return channel != null && channel.isActive();
    }
}

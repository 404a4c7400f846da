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
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.ssl.SslContext;
import io.openlink.config.spec.RelaySpec;
import io.openlink.relay.RelayEngine;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class RelayChannelInitializer extends ChannelInitializer<SocketChannel> {

    private static final int MAX_HTTP_CONTENT = 65536;

    private final RelaySpec spec;
    private final RelayEngine engine;
    private final ObjectMapper mapper;
    private final SslContext sslCtx;

    public RelayChannelInitializer(RelaySpec spec, RelayEngine engine, ObjectMapper mapper, SslContext sslCtx) {
        this.spec = spec;
        this.engine = engine;
        this.mapper = mapper;
        this.sslCtx = sslCtx;
    }

    @Override
    protected void initChannel(SocketChannel ch) {
        log.debug("New inbound channel: remoteAddress = {}", ch.remoteAddress());
        ch.config().setOption(ChannelOption.TCP_NODELAY, true);

        ChannelPipeline p = ch.pipeline();
        if (sslCtx != null) {
            p.addLast(sslCtx.newHandler(ch.alloc()));
        }
        p.addLast(new HttpServerCodec());
        p.addLast(new HttpObjectAggregator(MAX_HTTP_CONTENT));
        p.addLast(new RelayHttpHandler(spec, engine, mapper));
        p.addLast(new WebSocketServerProtocolHandler(spec.getRelayWebSocketPath(), null, true,
                spec.getRelayMaxFrameSize(), false, true));
        p.addLast(new WebSocketFrameAggregator(spec.getRelayMaxFrameSize()));
        p.addLast(new RelayFrameHandler(engine));
    }
}

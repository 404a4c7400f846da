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
package io.openlink.net.address;

import com.google.common.collect.ImmutableSet;
import com.google.common.net.InetAddresses;
import io.openlink.config.spec.DirectorySpec;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses raw server addresses: ws/wss URLs, IPv4, IPv6, Web3 names and conventional domains.
 * <p>
 * Parsing never throws. Input that cannot be classified yields {@link AddressKind#UNKNOWN} with as
 * much of host and port filled in as could be recovered.
 */
@Slf4j
public class AddressParser {

    public static final int DEFAULT_PORT = 443;
    private static final int DEFAULT_INSECURE_PORT = 80;
    private static final String DEFAULT_PROTOCOL = "wss";

    private static final Pattern IPV4 = Pattern.compile("^((?:\\d{1,3}\\.){3}\\d{1,3})(?::(\\d+))?$");
    private static final Pattern IPV6_BRACKETED = Pattern.compile("^\\[([0-9a-fA-F:.]+)](?::(\\d+))?$");
    private static final Pattern IPV6_BARE = Pattern.compile("^[0-9a-fA-F:.]*:[0-9a-fA-F:.]*:[0-9a-fA-F:.]*$");
    private static final Pattern HOST_PORT = Pattern.compile("^([^:/\\s]+)(?::(\\d+))?$");
    private static final Pattern HOSTNAME = Pattern.compile(
            "^(?=.{1,253}$)[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?(?:\\.[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?)*$");

    private final Set<String> ensSuffixes;
    private final Set<String> unstoppableSuffixes;

    public AddressParser(Collection<String> ensSuffixes, Collection<String> unstoppableSuffixes) {
        this.ensSuffixes = normalize(ensSuffixes);
        this.unstoppableSuffixes = normalize(unstoppableSuffixes);
    }

    public AddressParser(DirectorySpec spec) {
        this(spec.getEnsSuffixes(), spec.getUnstoppableSuffixes());
    }

    private static Set<String> normalize(Collection<String> suffixes) {
        ImmutableSet.Builder<String> builder = ImmutableSet.builder();
        for (String s : suffixes) {
            builder.add(StringUtils.removeStart(s.trim(), ".").toLowerCase(Locale.ROOT));
        }
        return builder.build();
    }

    public AddressParseResult parse(String address) {
        if (StringUtils.isBlank(address)) {
            return unknown(address, null, null);
        }
        String input = address.trim();
        String lower = input.toLowerCase(Locale.ROOT);

        if (lower.startsWith("ws://") || lower.startsWith("wss://")) {
            return parseUrl(address, input);
        }

        Matcher m = IPV4.matcher(input);
        if (m.matches()) {
            Integer port = parsePort(m.group(2));
            if (!InetAddresses.isInetAddress(m.group(1)) || port == null) {
                return unknown(address, m.group(1), port);
            }
            return new AddressParseResult(address, AddressKind.IPV4, m.group(1), port, DEFAULT_PROTOCOL);
        }

        m = IPV6_BRACKETED.matcher(input);
        if (m.matches()) {
            return ipv6(address, m.group(1), parsePort(m.group(2)));
        }
        if (IPV6_BARE.matcher(input).matches()) {
            return ipv6(address, input, DEFAULT_PORT);
        }

        m = HOST_PORT.matcher(input);
        if (!m.matches()) {
            return unknown(address, bestEffortHost(input), null);
        }
        String host = m.group(1);
        Integer port = parsePort(m.group(2));
        if (!HOSTNAME.matcher(host).matches() || port == null) {
            return unknown(address, host, port);
        }
        return new AddressParseResult(address, detectKind(host), host, port, DEFAULT_PROTOCOL);
    }

    /**
     * Classify a bare host name, as found inside a URL.
     */
    public AddressKind detectKind(String host) {
        if (StringUtils.isEmpty(host)) {
            return AddressKind.UNKNOWN;
        }
        if (InetAddresses.isInetAddress(host)) {
            return host.contains(":") ? AddressKind.IPV6 : AddressKind.IPV4;
        }
        String tld = StringUtils.substringAfterLast(host, ".").toLowerCase(Locale.ROOT);
        if (ensSuffixes.contains(tld)) {
            return AddressKind.ENS;
        }
        if (unstoppableSuffixes.contains(tld)) {
            return AddressKind.UNSTOPPABLE;
        }
        return HOSTNAME.matcher(host).matches() ? AddressKind.DOMAIN : AddressKind.UNKNOWN;
    }

    private AddressParseResult parseUrl(String original, String input) {
        try {
            URI uri = new URI(input);
            String protocol = uri.getScheme().toLowerCase(Locale.ROOT);
            String host = uri.getHost();
            if (host == null) {
                return unknown(original, bestEffortHost(input), null);
            }
            host = StringUtils.removeEnd(StringUtils.removeStart(host, "["), "]");
            int port = uri.getPort() > 0 ? uri.getPort()
                    : "wss".equals(protocol) ? DEFAULT_PORT : DEFAULT_INSECURE_PORT;
            return new AddressParseResult(original, detectKind(host), host, port, protocol);
        } catch (URISyntaxException e) {
            log.debug("Invalid URL: {}", input);
            return unknown(original, bestEffortHost(input), null);
        }
    }

    private AddressParseResult ipv6(String original, String host, Integer port) {
        if (!InetAddresses.isInetAddress(host) || port == null) {
            return unknown(original, host, port);
        }
        return new AddressParseResult(original, AddressKind.IPV6, host, port, DEFAULT_PROTOCOL);
    }

    private static AddressParseResult unknown(String original, String host, Integer port) {
        return new AddressParseResult(original, AddressKind.UNKNOWN, host, port, DEFAULT_PROTOCOL);
    }

    /**
     * @return the port, {@link #DEFAULT_PORT} when absent, or null when out of range
     */
    private static Integer parsePort(String digits) {
        if (digits == null) {
            return DEFAULT_PORT;
        }
        try {
            int port = Integer.parseInt(digits);
            return port > 0 && port <= 65535 ? port : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String bestEffortHost(String input) {
        String s = StringUtils.substringAfter(input, "://");
        if (s.isEmpty()) {
            s = input;
        }
        s = StringUtils.substringBefore(s, "/");
        s = StringUtils.substringBefore(s, ":");
        return s.isEmpty() ? null : s;
    }
}

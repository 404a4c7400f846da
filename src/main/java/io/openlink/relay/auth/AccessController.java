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
package io.openlink.relay.auth;

import com.fasterxml.jackson.core.type.TypeReference;
import io.openlink.core.OperationResult;
import io.openlink.relay.message.AuthData;
import io.openlink.store.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Decides whether a connecting client may use the relay and holds the operator's access settings.
 * <p>
 * Checks run in order: deny-list, access mode, then the connection PIN when one is required.
 * Every mutation is persisted under {@link #ACCESS_CONFIG_KEY}.
 */
@Slf4j
public class AccessController {

    public static final String ACCESS_CONFIG_KEY = "accessConfig";

    private static final Pattern PIN_FORMAT = Pattern.compile("^\\d{4,8}$");
    private static final int MIN_PASSWORD_LENGTH = 4;

    private final KeyValueStore store;
    private final Clock clock;
    private final SecureRandom random;
    private final Totp totp;
    private final PasswordHasher hasher;

    private AccessConfig config;
    private boolean publicWarningShown;

    public AccessController(KeyValueStore store, Clock clock, SecureRandom random) {
        this.store = store;
        this.clock = clock;
        this.random = random;
        this.totp = new Totp(clock, random);
        this.hasher = new PasswordHasher(random);
        this.config = store.get(ACCESS_CONFIG_KEY, new TypeReference<AccessConfig>() {
        }, new AccessConfig());
    }

    public AccessController(KeyValueStore store) {
        this(store, Clock.systemUTC(), new SecureRandom());
    }

    // ------------------------------------------------------------ verification

    /**
     * Whether a client from {@code ip} must send an {@code authenticate} message before relaying.
     */
    public synchronized boolean requiresAuthentication(String ip) {
        return config.getAccessMode() != AccessMode.PUBLIC
                || config.isRequireConnectionPin()
                || config.getBlacklistedIps().contains(ip);
    }

    /**
     * Full check of an {@code authenticate} message: access mode first, then the connection PIN.
     */
    public synchronized AuthResult verify(AuthData auth, String ip) {
        AuthData data = auth == null ? AuthData.EMPTY : auth;
        AuthResult result = verifyAccess(data, ip);
        if (!result.isSuccess()) {
            return result;
        }
        return verifyConnectionPin(data.getConnectionPin());
    }

    synchronized AuthResult verifyAccess(AuthData auth, String ip) {
        if (config.getBlacklistedIps().contains(ip)) {
            return AuthResult.deny(AuthResult.IP_BLOCKED);
        }

        return switch (config.getAccessMode()) {
            case WHITELIST -> config.getWhitelistedIps().contains(ip)
                    ? AuthResult.allow() : AuthResult.deny(AuthResult.IP_NOT_WHITELISTED);
            case PUBLIC -> AuthResult.allow();
            case PIN -> config.getPinCode() != null && config.getPinCode().equals(auth.getPin())
                    ? AuthResult.allow() : AuthResult.deny(AuthResult.INVALID_PIN);
            case PASSWORD -> passwordMatches(auth.getPassword())
                    ? AuthResult.allow() : AuthResult.deny(AuthResult.INVALID_PASSWORD);
            case TWO_FACTOR -> verifyTwoFactor(auth);
        };
    }

    private AuthResult verifyTwoFactor(AuthData auth) {
        if (config.getPasswordHash() != null && !passwordMatches(auth.getPassword())) {
            return AuthResult.deny(AuthResult.INVALID_PASSWORD);
        }
        if (config.isTwoFactorEnabled() && !totp.verify(config.getTwoFactorSecret(), auth.getTotpCode())) {
            return AuthResult.deny(AuthResult.INVALID_2FA_CODE);
        }
        return AuthResult.allow();
    }

    private boolean passwordMatches(String password) {
        return hasher.matches(config.getPasswordSalt(), config.getPasswordHash(), password);
    }

    /**
     * Check the host-side connection PIN. A one-time PIN is replaced by a new one of the same
     * length once it has been used.
     */
    public synchronized AuthResult verifyConnectionPin(String pin) {
        if (!config.isRequireConnectionPin()) {
            return AuthResult.allow();
        }
        long expiry = config.getConnectionPinExpiry();
        if (expiry > 0 && clock.millis() > expiry) {
            return AuthResult.deny(AuthResult.PIN_EXPIRED);
        }
        if (!Objects.equals(pin, config.getConnectionPin())) {
            return AuthResult.deny(AuthResult.INVALID_PIN);
        }
        if (config.isOneTimePin()) {
            config.setConnectionPin(randomDigits(config.getConnectionPin().length()));
            persist();
            log.info("One-time connection PIN used, a new PIN was generated");
        }
        return AuthResult.allow();
    }

    // ---------------------------------------------------------------- operator

    public synchronized OperationResult setPinCode(String pin) {
        if (pin == null || !PIN_FORMAT.matcher(pin).matches()) {
            return OperationResult.fail("PIN must be 4-8 digits");
        }
        config.setPinCode(pin);
        config.setAccessMode(AccessMode.PIN);
        persist();
        return OperationResult.ok();
    }

    public synchronized OperationResult setPassword(String password) {
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            return OperationResult.fail("Password must be at least 4 characters");
        }
        String salt = hasher.newSalt();
        config.setPasswordSalt(salt);
        config.setPasswordHash(hasher.hash(salt, password));
        config.setAccessMode(AccessMode.PASSWORD);
        persist();
        return OperationResult.ok();
    }

    public synchronized TwoFactorSetup enable2FA() {
        String secret = totp.generateSecret();
        config.setTwoFactorSecret(secret);
        config.setTwoFactorEnabled(true);
        config.setAccessMode(AccessMode.TWO_FACTOR);
        persist();

        String label = URLEncoder.encode(StringUtils.defaultIfBlank(config.getHostName(), "relay"), StandardCharsets.UTF_8)
                .replace("+", "%20");
        return new TwoFactorSetup(secret,
                "otpauth://totp/OpenLink:" + label + "?secret=" + secret + "&issuer=OpenLink");
    }

    public synchronized OperationResult disable2FA() {
        config.setTwoFactorEnabled(false);
        config.setTwoFactorSecret(null);
        if (config.getAccessMode() == AccessMode.TWO_FACTOR) {
            config.setAccessMode(config.getPasswordHash() != null ? AccessMode.PASSWORD : AccessMode.PUBLIC);
        }
        persist();
        return OperationResult.ok();
    }

    public synchronized OperationResult setPublic() {
        config.setPublicServer(true);
        config.setAccessMode(AccessMode.PUBLIC);
        publicWarningShown = false;
        persist();
        return OperationResult.ok();
    }

    public synchronized OperationResult setPrivate() {
        config.setPublicServer(false);
        persist();
        return OperationResult.ok();
    }

    public synchronized OperationResult setWhitelistMode() {
        config.setAccessMode(AccessMode.WHITELIST);
        persist();
        return OperationResult.ok();
    }

    public synchronized OperationResult allowIp(String ip) {
        if (StringUtils.isBlank(ip)) {
            return OperationResult.fail("IP address is required");
        }
        config.getBlacklistedIps().remove(ip.trim());
        if (!config.getWhitelistedIps().contains(ip.trim())) {
            config.getWhitelistedIps().add(ip.trim());
        }
        persist();
        return OperationResult.ok();
    }

    public synchronized OperationResult denyIp(String ip) {
        if (StringUtils.isBlank(ip)) {
            return OperationResult.fail("IP address is required");
        }
        config.getWhitelistedIps().remove(ip.trim());
        if (!config.getBlacklistedIps().contains(ip.trim())) {
            config.getBlacklistedIps().add(ip.trim());
        }
        persist();
        return OperationResult.ok();
    }

    /**
     * Require connecting users to enter {@code pin}.
     *
     * @param expiryMinutes minutes until the PIN expires, 0 for never
     */
    public synchronized ConnectionPinResult setConnectionPin(String pin, boolean oneTime, long expiryMinutes) {
        if (pin == null || !PIN_FORMAT.matcher(pin).matches()) {
            return ConnectionPinResult.rejected("PIN must be 4-8 digits");
        }
        long expiry = expiryMinutes > 0 ? clock.millis() + expiryMinutes * 60_000L : 0;
        config.setRequireConnectionPin(true);
        config.setConnectionPin(pin);
        config.setOneTimePin(oneTime);
        config.setConnectionPinExpiry(expiry);
        persist();
        return ConnectionPinResult.set(pin, expiry, oneTime);
    }

    public synchronized ConnectionPinResult generateConnectionPin(int digits, boolean oneTime, long expiryMinutes) {
        return setConnectionPin(randomDigits(digits), oneTime, expiryMinutes);
    }

    public synchronized OperationResult clearConnectionPin() {
        config.setRequireConnectionPin(false);
        config.setConnectionPin(null);
        config.setConnectionPinExpiry(0);
        config.setOneTimePin(false);
        persist();
        return OperationResult.ok();
    }

    public synchronized void setHostName(String hostName) {
        config.setHostName(StringUtils.trimToNull(hostName));
        persist();
    }

    public synchronized void setMaxConnections(int maxConnections) {
        if (maxConnections <= 0) {
            throw new IllegalArgumentException("maxConnections must be positive: " + maxConnections);
        }
        config.setMaxConnections(maxConnections);
        persist();
    }

    /**
     * True exactly once after the server became public, so the caller can warn the operator.
     */
    public synchronized boolean claimPublicWarning() {
        if (config.isPublicServer() && !publicWarningShown) {
            publicWarningShown = true;
            return true;
        }
        return false;
    }

    // ----------------------------------------------------------------- getters

    public synchronized AccessMode getAccessMode() {
        return config.getAccessMode();
    }

    public synchronized boolean isPublic() {
        return config.isPublicServer();
    }

    public synchronized String getHostName() {
        return config.getHostName();
    }

    public synchronized int getMaxConnections() {
        return config.getMaxConnections();
    }

    public synchronized boolean isTwoFactorEnabled() {
        return config.isTwoFactorEnabled();
    }

    public synchronized boolean hasPin() {
        return config.getPinCode() != null;
    }

    public synchronized boolean hasPassword() {
        return config.getPasswordHash() != null;
    }

    public synchronized boolean isConnectionPinRequired() {
        return config.isRequireConnectionPin();
    }

    public synchronized String getConnectionPin() {
        return config.getConnectionPin();
    }

    /**
     * Current TOTP code, used by the operator UI to confirm setup.
     */
    public synchronized String currentTotpCode() {
        return config.getTwoFactorSecret() == null ? null : totp.now(config.getTwoFactorSecret());
    }

    private String randomDigits(int digits) {
        if (digits < 4 || digits > 8) {
            throw new IllegalArgumentException("PIN length must be 4-8 digits: " + digits);
        }
        StringBuilder sb = new StringBuilder(digits);
        for (int i = 0; i < digits; i++) {
            sb.append(random.nextInt(10));
        }
        return sb.toString();
    }

    private void persist() {
        store.set(ACCESS_CONFIG_KEY, config);
    }
}

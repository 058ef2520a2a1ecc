package com.tgnote.backend.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Checks the signature Telegram puts on mini app init data and login widget payloads.
 * The data-check string is every field except {@code hash}, sorted by key, joined as
 * {@code key=value} lines; it is signed with HMAC-SHA256 under a key derived from the bot token.
 * Mini apps derive that key as {@code HMAC("WebAppData", token)}, the login widget as
 * {@code SHA-256(token)}. Both are accepted.
 */
@Slf4j
@Component
public class TelegramInitDataVerifier {

    private static final String HMAC_SHA256 = "HmacSHA256";

    private final String botToken;
    private final Duration maxAge;
    private final ObjectMapper objectMapper;

    public TelegramInitDataVerifier(
            @Value("${application.config.auth.bot-token:}") String botToken,
            @Value("${application.config.auth.max-age:24h}") Duration maxAge,
            ObjectMapper objectMapper
    ) {
        this.botToken = botToken;
        this.maxAge = maxAge;
        this.objectMapper = objectMapper;
    }

    /**
     * @return the Telegram user id carried by the payload when the signature is valid
     */
    public Optional<Long> verify(String initData) {
        if (!StringUtils.hasText(botToken)) {
            log.warn("Telegram bot token is not configured, rejecting init data");
            return Optional.empty();
        }
        if (!StringUtils.hasText(initData)) {
            return Optional.empty();
        }

        Map<String, String> data = parseQuery(initData);
        String hash = data.remove("hash");
        if (!StringUtils.hasText(hash)) {
            return Optional.empty();
        }

        String dataCheckString = data.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("\n"));

        try {
            byte[] expected = HexFormat.of().parseHex(hash.toLowerCase());
            boolean valid = MessageDigest.isEqual(expected, sign(dataCheckString, webAppKey()))
                    || MessageDigest.isEqual(expected, sign(dataCheckString, loginWidgetKey()));
            if (!valid) {
                log.warn("Telegram init data hash mismatch");
                return Optional.empty();
            }
        } catch (IllegalArgumentException e) {
            log.warn("Telegram init data hash is not hex: {}", e.getMessage());
            return Optional.empty();
        }

        if (isExpired(data.get("auth_date"))) {
            log.warn("Telegram init data is older than {}", maxAge);
            return Optional.empty();
        }
        return userId(data);
    }

    private boolean isExpired(String authDate) {
        if (maxAge.isZero() || maxAge.isNegative()) {
            return false;
        }
        if (authDate == null) {
            return true;
        }
        try {
            Instant issued = Instant.ofEpochSecond(Long.parseLong(authDate));
            return issued.plus(maxAge).isBefore(Instant.now());
        } catch (NumberFormatException e) {
            return true;
        }
    }

    private Optional<Long> userId(Map<String, String> data) {
        // login widget sends the id as a plain field, mini apps as a JSON user object
        String plainId = data.get("id");
        if (plainId != null) {
            try {
                return Optional.of(Long.parseLong(plainId));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        String userJson = data.get("user");
        if (!StringUtils.hasText(userJson)) {
            return Optional.empty();
        }
        try {
            JsonNode idNode = objectMapper.readTree(userJson).get("id");
            return idNode != null && idNode.canConvertToLong() ? Optional.of(idNode.asLong()) : Optional.empty();
        } catch (Exception e) {
            log.warn("Failed to parse Telegram user: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Map<String, String> parseQuery(String query) {
        Map<String, String> map = new TreeMap<>();
        for (String pair : query.split("&")) {
            int idx = pair.indexOf('=');
            if (idx <= 0) {
                continue;
            }
            String key = URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8);
            String value = URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8);
            map.put(key, value);
        }
        return map;
    }

    private byte[] webAppKey() {
        return hmac("WebAppData".getBytes(StandardCharsets.UTF_8), botToken.getBytes(StandardCharsets.UTF_8));
    }

    private byte[] loginWidgetKey() {
        try {
            return MessageDigest.getInstance("SHA-256").digest(botToken.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static byte[] sign(String data, byte[] key) {
        return hmac(key, data.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] hmac(byte[] key, byte[] data) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(key, HMAC_SHA256));
            return mac.doFinal(data);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }
}

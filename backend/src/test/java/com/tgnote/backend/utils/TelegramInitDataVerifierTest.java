package com.tgnote.backend.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class TelegramInitDataVerifierTest {

    private static final String TOKEN = "123456:TEST-TOKEN";

    private final TelegramInitDataVerifier verifier =
            new TelegramInitDataVerifier(TOKEN, Duration.ofHours(24), new ObjectMapper());

    @Test
    void acceptsSignedMiniAppInitData() throws Exception {
        Map<String, String> fields = new TreeMap<>();
        fields.put("auth_date", String.valueOf(Instant.now().getEpochSecond()));
        fields.put("query_id", "AAH-query");
        fields.put("user", "{\"id\":987654321,\"first_name\":\"Ann\"}");

        byte[] secret = hmac("WebAppData".getBytes(StandardCharsets.UTF_8), TOKEN.getBytes(StandardCharsets.UTF_8));
        String initData = encode(fields, sign(fields, secret));

        assertThat(verifier.verify(initData)).contains(987654321L);
    }

    @Test
    void acceptsSignedLoginWidgetPayload() throws Exception {
        Map<String, String> fields = new TreeMap<>();
        fields.put("auth_date", String.valueOf(Instant.now().getEpochSecond()));
        fields.put("id", "555");
        fields.put("username", "ann");

        byte[] secret = MessageDigest.getInstance("SHA-256").digest(TOKEN.getBytes(StandardCharsets.UTF_8));
        String initData = encode(fields, sign(fields, secret));

        assertThat(verifier.verify(initData)).contains(555L);
    }

    @Test
    void rejectsTamperedPayload() throws Exception {
        Map<String, String> fields = new TreeMap<>();
        fields.put("auth_date", String.valueOf(Instant.now().getEpochSecond()));
        fields.put("user", "{\"id\":1}");
        byte[] secret = hmac("WebAppData".getBytes(StandardCharsets.UTF_8), TOKEN.getBytes(StandardCharsets.UTF_8));
        String hash = sign(fields, secret);

        fields.put("user", "{\"id\":2}");

        assertThat(verifier.verify(encode(fields, hash))).isEmpty();
    }

    @Test
    void rejectsStalePayload() throws Exception {
        Map<String, String> fields = new TreeMap<>();
        fields.put("auth_date", String.valueOf(Instant.now().minus(Duration.ofDays(2)).getEpochSecond()));
        fields.put("user", "{\"id\":1}");
        byte[] secret = hmac("WebAppData".getBytes(StandardCharsets.UTF_8), TOKEN.getBytes(StandardCharsets.UTF_8));

        assertThat(verifier.verify(encode(fields, sign(fields, secret)))).isEmpty();
    }

    @Test
    void rejectsMissingOrGarbledHash() {
        assertThat(verifier.verify(null)).isEmpty();
        assertThat(verifier.verify("user=%7B%22id%22%3A1%7D")).isEmpty();
        assertThat(verifier.verify("user=%7B%22id%22%3A1%7D&hash=not-hex")).isEmpty();
    }

    @Test
    void rejectsEverythingWithoutBotToken() {
        TelegramInitDataVerifier unconfigured = new TelegramInitDataVerifier("", Duration.ZERO, new ObjectMapper());

        assertThat(unconfigured.verify("id=1&hash=00")).isEmpty();
    }

    private static String sign(Map<String, String> fields, byte[] secret) throws Exception {
        String dataCheckString = fields.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("\n"));
        return HexFormat.of().formatHex(hmac(secret, dataCheckString.getBytes(StandardCharsets.UTF_8)));
    }

    private static byte[] hmac(byte[] key, byte[] data) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(key, "HmacSHA256"));
        return mac.doFinal(data);
    }

    private static String encode(Map<String, String> fields, String hash) {
        return fields.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&")) + "&hash=" + hash;
    }
}

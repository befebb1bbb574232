package com.dispatchplatform.ingestion.poll;

import com.dispatchplatform.common.exception.DispatchException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Signs the per-request HS256 bearer token the Broadcastify Calls API expects.
 *
 * <p>Header {@code {alg, typ, kid}}; payload {@code {iss, iat, exp}} plus {@code sub} and
 * {@code utk} when a user session is attached. Segments are base64url without padding.
 */
public class CallTokenSigner {

    private static final Base64.Encoder B64 = Base64.getUrlEncoder().withoutPadding();

    private final String keyId;
    private final byte[] secret;
    private final String appId;
    private final Duration ttl;
    private final ObjectMapper objectMapper;

    public CallTokenSigner(String keyId, String keySecret, String appId, Duration ttl, ObjectMapper objectMapper) {
        this.keyId        = keyId;
        this.secret       = keySecret.getBytes(StandardCharsets.UTF_8);
        this.appId        = appId;
        this.ttl          = ttl;
        this.objectMapper = objectMapper;
    }

    /** @param session user session to embed, or {@code null} for app-only calls such as login */
    public String sign(BroadcastifySession session, Instant issuedAt) {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("alg", "HS256");
        header.put("typ", "JWT");
        header.put("kid", keyId);

        long iat = issuedAt.getEpochSecond();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("iss", appId);
        payload.put("iat", iat);
        payload.put("exp", iat + ttl.toSeconds());
        if (session != null) {
            payload.put("sub", session.userId());
            payload.put("utk", session.userToken());
        }

        String signingInput = encode(header) + "." + encode(payload);
        return signingInput + "." + B64.encodeToString(hmac(signingInput));
    }

    private String encode(Map<String, Object> segment) {
        try {
            return B64.encodeToString(objectMapper.writeValueAsBytes(segment));
        } catch (JsonProcessingException e) {
            throw new DispatchException("Failed to serialize token segment", e);
        }
    }

    private byte[] hmac(String input) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret, "HmacSHA256"));
            return mac.doFinal(input.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new DispatchException("Failed to sign call-log token", e);
        }
    }
}

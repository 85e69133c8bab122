package com.marketplace.compliance.infrastructure.storage;

import com.marketplace.compliance.domain.service.DocumentUrlSigner;
import org.springframework.web.util.UriUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;

/**
 * Signs document download URLs as {@code {baseUrl}/{key}?expires={epochSeconds}&signature={hmac}}.
 *
 * The signature is HMAC-SHA256 over {@code key + "\n" + expires}, base64url without padding.
 * The storage gateway recomputes it and rejects expired or altered URLs.
 */
public class HmacDocumentUrlSigner implements DocumentUrlSigner {

    private static final String ALGORITHM = "HmacSHA256";

    private final String baseUrl;
    private final SecretKeySpec signingKey;
    private final Clock clock;

    public HmacDocumentUrlSigner(String baseUrl, String signingSecret, Clock clock) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("storage base url is required");
        }
        if (signingSecret == null || signingSecret.isBlank()) {
            throw new IllegalArgumentException("storage signing secret is required");
        }
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.signingKey = new SecretKeySpec(signingSecret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
        this.clock = clock;
    }

    @Override
    public String sign(String storageKey, Duration ttl) {
        if (storageKey == null || storageKey.isBlank()) {
            throw new IllegalArgumentException("storage key is required");
        }
        long expires = clock.instant().plus(ttl).getEpochSecond();
        String signature = hmac(storageKey + "\n" + expires);
        return baseUrl + "/" + UriUtils.encodePath(storageKey, StandardCharsets.UTF_8)
                + "?expires=" + expires + "&signature=" + signature;
    }

    private String hmac(String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(signingKey);
            byte[] digest = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC signing unavailable", e);
        }
    }
}

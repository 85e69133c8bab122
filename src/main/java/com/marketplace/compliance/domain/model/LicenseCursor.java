package com.marketplace.compliance.domain.model;

import com.marketplace.compliance.domain.error.ComplianceException;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.UUID;

/**
 * Keyset position in a store's license list, ordered by (createdAt DESC, id DESC).
 *
 * Rendered to callers as an opaque URL-safe token.
 */
@Value
public class LicenseCursor {

    private static final char SEPARATOR = '|';

    Instant createdAt;
    UUID id;

    public String encode() {
        String raw = createdAt.toString() + SEPARATOR + id;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @return null for a blank token (first page)
     */
    public static LicenseCursor decode(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        try {
            String raw = new String(Base64.getUrlDecoder().decode(token.trim()), StandardCharsets.UTF_8);
            int separator = raw.indexOf(SEPARATOR);
            if (separator < 0) {
                throw ComplianceException.validation("invalid cursor");
            }
            return new LicenseCursor(Instant.parse(raw.substring(0, separator)),
                    UUID.fromString(raw.substring(separator + 1)));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw ComplianceException.validation("invalid cursor");
        }
    }
}

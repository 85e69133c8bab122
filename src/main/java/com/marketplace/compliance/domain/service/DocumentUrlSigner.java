package com.marketplace.compliance.domain.service;

import java.time.Duration;

/**
 * Issues time-bounded download URLs for stored documents.
 */
public interface DocumentUrlSigner {

    String sign(String storageKey, Duration ttl);
}

package com.marketplace.compliance.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketplace.compliance.domain.error.ComplianceException;
import com.marketplace.compliance.domain.error.ErrorKind;
import com.marketplace.compliance.domain.model.PaymentEvent;
import com.marketplace.compliance.domain.model.PaymentEventType;
import com.marketplace.compliance.domain.model.ProviderSubscription;
import com.marketplace.compliance.domain.model.SubscriptionStatus;
import com.marketplace.compliance.infrastructure.persistence.entity.StoreEntity;
import com.marketplace.compliance.infrastructure.persistence.entity.SubscriptionEntity;
import com.marketplace.compliance.infrastructure.persistence.repository.StoreRepository;
import com.marketplace.compliance.infrastructure.persistence.repository.SubscriptionRepository;
import com.marketplace.compliance.infrastructure.tx.TransactionRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Synchronizes the local subscription mirror and the store's subscription flag
 * from payment provider events.
 *
 * Subscription events embed the full subscription. Invoice events only reference
 * it, so the current state is fetched from the provider first. Lookup,
 * create-or-update and the store flag update run in one transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentEventReconciler {

    static final String METADATA_STORE_ID = "store_id";
    static final String METADATA_CUSTOMER_ID = "stripe_customer_id";
    static final String METADATA_PAYMENT_METHOD_ID = "stripe_payment_method_id";

    private final SubscriptionRepository subscriptionRepository;
    private final StoreRepository storeRepository;
    private final PaymentProviderClient providerClient;
    private final TransactionRunner transactionRunner;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @return false when the event type is not one this service reconciles
     */
    public boolean reconcile(PaymentEvent event) {
        Optional<PaymentEventType> type = PaymentEventType.fromWireName(event.getType());
        if (type.isEmpty()) {
            log.debug("Ignoring payment event {} of type {}", event.getEventId(), event.getType());
            return false;
        }

        ProviderSubscription subscription;
        if (type.get().carriesSubscription()) {
            subscription = event.getSubscription();
            if (subscription == null) {
                throw ComplianceException.validation("subscription payload missing");
            }
        } else {
            String subscriptionId = event.getSubscriptionId();
            if (subscriptionId == null || subscriptionId.isBlank()) {
                throw ComplianceException.validation("subscription id missing");
            }
            try {
                subscription = providerClient.fetchSubscription(subscriptionId);
            } catch (RuntimeException e) {
                throw ComplianceException.wrap("fetch subscription", e);
            }
        }

        SubscriptionEntity synced = syncSubscription(subscription);
        log.info("Payment event {} ({}) synced subscription {} for store {}: {}",
                event.getEventId(), event.getType(), synced.getExternalSubscriptionId(),
                synced.getStoreId(), synced.getStatus());
        return true;
    }

    public SubscriptionEntity syncSubscription(ProviderSubscription subscription) {
        if (subscription.getId() == null || subscription.getId().isBlank()) {
            throw ComplianceException.validation("subscription id missing");
        }
        SubscriptionStatus status = SubscriptionStatus.fromProviderValue(subscription.getStatus())
                .orElseThrow(() -> new ComplianceException(ErrorKind.DEPENDENCY,
                        "unknown subscription status: " + subscription.getStatus()));
        UUID metadataStoreId = metadataStoreId(subscription.getMetadata());
        String metadataJson = encodeMetadata(subscription.getMetadata());

        SubscriptionEntity saved;
        try {
            saved = transactionRunner.inTransaction(() -> {
                Optional<SubscriptionEntity> existing =
                        subscriptionRepository.findByExternalSubscriptionId(subscription.getId());
                UUID storeId = resolveStoreId(metadataStoreId, existing);

                StoreEntity store = storeRepository.findByIdForUpdate(storeId)
                        .orElseThrow(() -> ComplianceException.notFound("store not found"));

                SubscriptionEntity entity = existing.orElseGet(() -> SubscriptionEntity.builder()
                        .id(UUID.randomUUID())
                        .storeId(storeId)
                        .externalSubscriptionId(subscription.getId())
                        .createdAt(clock.instant())
                        .build());
                apply(entity, subscription, status, metadataJson);
                entity.setUpdatedAt(clock.instant());

                SubscriptionEntity persisted = subscriptionRepository.save(entity);
                if (persisted == null) {
                    throw ComplianceException.internal("subscription not persisted");
                }

                boolean active = status.isActive();
                if (store.isSubscriptionActive() != active) {
                    store.setSubscriptionActive(active);
                    store.setUpdatedAt(clock.instant());
                    storeRepository.save(store);
                    log.info("Store {} subscription active flag set to {}", storeId, active);
                }
                return persisted;
            });
        } catch (RuntimeException e) {
            throw ComplianceException.wrap("sync subscription", e);
        }
        return saved;
    }

    private UUID resolveStoreId(UUID metadataStoreId, Optional<SubscriptionEntity> existing) {
        if (metadataStoreId != null) {
            if (existing.isPresent() && !existing.get().getStoreId().equals(metadataStoreId)) {
                throw ComplianceException.conflict("subscription belongs to a different store");
            }
            return metadataStoreId;
        }
        // Degraded payload without metadata: the stored row still knows its store
        return existing.map(SubscriptionEntity::getStoreId)
                .orElseThrow(() -> ComplianceException.validation("store_id metadata missing"));
    }

    private void apply(SubscriptionEntity entity, ProviderSubscription subscription,
                       SubscriptionStatus status, String metadataJson) {
        Map<String, String> metadata = subscription.getMetadata();
        entity.setStatus(status);
        if (subscription.getPriceId() != null) {
            entity.setPriceId(subscription.getPriceId());
        }
        entity.setCurrentPeriodStart(subscription.getCurrentPeriodStart());
        entity.setCurrentPeriodEnd(subscription.getCurrentPeriodEnd());
        entity.setCancelAtPeriodEnd(subscription.isCancelAtPeriodEnd());
        entity.setCanceledAt(subscription.getCanceledAt());
        entity.setCustomerId(firstNonBlank(subscription.getCustomerId(), metadata.get(METADATA_CUSTOMER_ID),
                entity.getCustomerId()));
        entity.setPaymentMethodId(firstNonBlank(subscription.getPaymentMethodId(),
                metadata.get(METADATA_PAYMENT_METHOD_ID), entity.getPaymentMethodId()));
        entity.setMetadata(metadataJson);
    }

    private static UUID metadataStoreId(Map<String, String> metadata) {
        String raw = metadata.get(METADATA_STORE_ID);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            throw ComplianceException.validation("invalid store_id metadata");
        }
    }

    private String encodeMetadata(Map<String, String> metadata) {
        if (metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(new TreeMap<>(metadata));
        } catch (JsonProcessingException e) {
            throw new ComplianceException(ErrorKind.INTERNAL, "encode subscription metadata failed", e);
        }
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}

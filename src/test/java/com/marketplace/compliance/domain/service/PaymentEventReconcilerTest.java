package com.marketplace.compliance.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketplace.compliance.domain.error.ComplianceException;
import com.marketplace.compliance.domain.error.ErrorKind;
import com.marketplace.compliance.domain.model.PaymentEvent;
import com.marketplace.compliance.domain.model.ProviderSubscription;
import com.marketplace.compliance.domain.model.SubscriptionStatus;
import com.marketplace.compliance.infrastructure.persistence.entity.StoreEntity;
import com.marketplace.compliance.infrastructure.persistence.entity.SubscriptionEntity;
import com.marketplace.compliance.infrastructure.persistence.repository.StoreRepository;
import com.marketplace.compliance.infrastructure.persistence.repository.SubscriptionRepository;
import com.marketplace.compliance.support.InlineTransactionRunner;
import com.marketplace.compliance.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentEventReconcilerTest {

    @Mock private SubscriptionRepository subscriptionRepository;
    @Mock private StoreRepository storeRepository;
    @Mock private PaymentProviderClient providerClient;

    private InlineTransactionRunner transactionRunner;
    private PaymentEventReconciler reconciler;

    private static final Instant NOW = Instant.parse("2026-04-02T12:00:00Z");

    private final UUID storeId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        transactionRunner = new InlineTransactionRunner();
        reconciler = new PaymentEventReconciler(subscriptionRepository, storeRepository, providerClient,
                transactionRunner, new ObjectMapper(), new MutableClock(NOW));
    }

    @Test
    void reconcile_canceledSubscriptionDeactivatesStore() {
        SubscriptionEntity existing = existing("sub_123", SubscriptionStatus.ACTIVE);
        StoreEntity store = store(true);
        when(subscriptionRepository.findByExternalSubscriptionId("sub_123")).thenReturn(Optional.of(existing));
        when(storeRepository.findByIdForUpdate(storeId)).thenReturn(Optional.of(store));
        when(subscriptionRepository.save(existing)).thenReturn(existing);

        boolean handled = reconciler.reconcile(PaymentEvent.builder()
                .eventId("evt_1")
                .type("customer.subscription.updated")
                .subscription(ProviderSubscription.builder()
                        .id("sub_123")
                        .status("canceled")
                        .metadataEntry("store_id", storeId.toString())
                        .canceledAt(Instant.parse("2026-04-01T00:00:00Z"))
                        .build())
                .build());

        assertTrue(handled);
        assertEquals(SubscriptionStatus.CANCELED, existing.getStatus());
        assertEquals(Instant.parse("2026-04-01T00:00:00Z"), existing.getCanceledAt());
        assertFalse(store.isSubscriptionActive());
        assertEquals(NOW, store.getUpdatedAt());
        assertEquals(NOW, existing.getUpdatedAt());
        verify(storeRepository, times(1)).save(store);
        verify(subscriptionRepository, times(1)).save(existing);
        assertEquals(1, transactionRunner.getCommits());
    }

    @Test
    void reconcile_firstSeenSubscriptionIsCreated() {
        StoreEntity store = store(false);
        when(subscriptionRepository.findByExternalSubscriptionId("sub_new")).thenReturn(Optional.empty());
        when(storeRepository.findByIdForUpdate(storeId)).thenReturn(Optional.of(store));
        when(subscriptionRepository.save(any(SubscriptionEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        reconciler.reconcile(PaymentEvent.builder()
                .eventId("evt_2")
                .type("customer.subscription.created")
                .subscription(ProviderSubscription.builder()
                        .id("sub_new")
                        .status("trialing")
                        .priceId("price_basic")
                        .metadataEntry("store_id", storeId.toString())
                        .metadataEntry("stripe_customer_id", "cus_9")
                        .build())
                .build());

        ArgumentCaptor<SubscriptionEntity> saved = ArgumentCaptor.forClass(SubscriptionEntity.class);
        verify(subscriptionRepository).save(saved.capture());
        assertEquals(storeId, saved.getValue().getStoreId());
        assertEquals("sub_new", saved.getValue().getExternalSubscriptionId());
        assertEquals(SubscriptionStatus.TRIALING, saved.getValue().getStatus());
        assertEquals("price_basic", saved.getValue().getPriceId());
        assertEquals("cus_9", saved.getValue().getCustomerId());
        assertTrue(saved.getValue().getMetadata().contains("\"store_id\""));
        assertTrue(store.isSubscriptionActive());
    }

    @Test
    void reconcile_missingMetadataFallsBackToStoredStore() {
        SubscriptionEntity existing = existing("sub_123", SubscriptionStatus.PAST_DUE);
        StoreEntity store = store(true);
        when(subscriptionRepository.findByExternalSubscriptionId("sub_123")).thenReturn(Optional.of(existing));
        when(storeRepository.findByIdForUpdate(storeId)).thenReturn(Optional.of(store));
        when(subscriptionRepository.save(existing)).thenReturn(existing);

        reconciler.reconcile(PaymentEvent.builder()
                .eventId("evt_3")
                .type("customer.subscription.updated")
                .subscription(ProviderSubscription.builder().id("sub_123").status("active").build())
                .build());

        assertEquals(SubscriptionStatus.ACTIVE, existing.getStatus());
        // flag unchanged, no store write
        verify(storeRepository, never()).save(any());
    }

    @Test
    void reconcile_missingMetadataForUnknownSubscriptionIsValidationError() {
        when(subscriptionRepository.findByExternalSubscriptionId("sub_orphan")).thenReturn(Optional.empty());

        ComplianceException e = assertThrows(ComplianceException.class, () -> reconciler.reconcile(
                PaymentEvent.builder()
                        .eventId("evt_4")
                        .type("customer.subscription.updated")
                        .subscription(ProviderSubscription.builder().id("sub_orphan").status("active").build())
                        .build()));

        assertEquals(ErrorKind.VALIDATION, e.getKind());
        assertEquals(1, transactionRunner.getRollbacks());
        verify(subscriptionRepository, never()).save(any());
    }

    @Test
    void reconcile_metadataNamingAnotherStoreIsConflict() {
        when(subscriptionRepository.findByExternalSubscriptionId("sub_123"))
                .thenReturn(Optional.of(existing("sub_123", SubscriptionStatus.ACTIVE)));

        ComplianceException e = assertThrows(ComplianceException.class, () -> reconciler.reconcile(
                PaymentEvent.builder()
                        .eventId("evt_5")
                        .type("customer.subscription.updated")
                        .subscription(ProviderSubscription.builder()
                                .id("sub_123")
                                .status("active")
                                .metadataEntry("store_id", UUID.randomUUID().toString())
                                .build())
                        .build()));

        assertEquals(ErrorKind.CONFLICT, e.getKind());
        verifyNoInteractions(storeRepository);
    }

    @Test
    void reconcile_invoiceEventFetchesSubscriptionFromProvider() {
        SubscriptionEntity existing = existing("sub_123", SubscriptionStatus.ACTIVE);
        StoreEntity store = store(true);
        when(providerClient.fetchSubscription("sub_123")).thenReturn(ProviderSubscription.builder()
                .id("sub_123")
                .status("unpaid")
                .metadataEntry("store_id", storeId.toString())
                .build());
        when(subscriptionRepository.findByExternalSubscriptionId("sub_123")).thenReturn(Optional.of(existing));
        when(storeRepository.findByIdForUpdate(storeId)).thenReturn(Optional.of(store));
        when(subscriptionRepository.save(existing)).thenReturn(existing);

        reconciler.reconcile(PaymentEvent.builder()
                .eventId("evt_6")
                .type("invoice.payment_failed")
                .subscriptionId("sub_123")
                .build());

        assertEquals(SubscriptionStatus.UNPAID, existing.getStatus());
        // unpaid is still a live subscription; only cancellation clears the flag
        assertTrue(store.isSubscriptionActive());
        verify(storeRepository, never()).save(any());
    }

    @ParameterizedTest
    @ValueSource(strings = {"unpaid", "incomplete", "incomplete_expired", "past_due"})
    void reconcile_dunningStatusesKeepStoreSubscribed(String status) {
        SubscriptionEntity existing = existing("sub_123", SubscriptionStatus.ACTIVE);
        StoreEntity store = store(true);
        when(subscriptionRepository.findByExternalSubscriptionId("sub_123")).thenReturn(Optional.of(existing));
        when(storeRepository.findByIdForUpdate(storeId)).thenReturn(Optional.of(store));
        when(subscriptionRepository.save(existing)).thenReturn(existing);

        reconciler.reconcile(PaymentEvent.builder()
                .eventId("evt_" + status)
                .type("customer.subscription.updated")
                .subscription(ProviderSubscription.builder()
                        .id("sub_123")
                        .status(status)
                        .metadataEntry("store_id", storeId.toString())
                        .build())
                .build());

        assertTrue(store.isSubscriptionActive());
        verify(storeRepository, never()).save(any());
    }

    @Test
    void reconcile_pausedSubscriptionDeactivatesStore() {
        SubscriptionEntity existing = existing("sub_123", SubscriptionStatus.ACTIVE);
        StoreEntity store = store(true);
        when(subscriptionRepository.findByExternalSubscriptionId("sub_123")).thenReturn(Optional.of(existing));
        when(storeRepository.findByIdForUpdate(storeId)).thenReturn(Optional.of(store));
        when(subscriptionRepository.save(existing)).thenReturn(existing);

        reconciler.reconcile(PaymentEvent.builder()
                .eventId("evt_paused")
                .type("customer.subscription.updated")
                .subscription(ProviderSubscription.builder()
                        .id("sub_123")
                        .status("paused")
                        .metadataEntry("store_id", storeId.toString())
                        .build())
                .build());

        assertEquals(SubscriptionStatus.PAUSED, existing.getStatus());
        assertFalse(store.isSubscriptionActive());
        verify(storeRepository).save(store);
    }

    @Test
    void reconcile_invoiceWithoutSubscriptionIdIsValidationError() {
        ComplianceException e = assertThrows(ComplianceException.class, () -> reconciler.reconcile(
                PaymentEvent.builder().eventId("evt_7").type("invoice.paid").build()));

        assertEquals(ErrorKind.VALIDATION, e.getKind());
        assertEquals("subscription id missing", e.getMessage());
        verifyNoInteractions(providerClient);
    }

    @Test
    void reconcile_providerFailureIsDependency() {
        when(providerClient.fetchSubscription("sub_123")).thenThrow(new IllegalStateException("stripe 502"));

        ComplianceException e = assertThrows(ComplianceException.class, () -> reconciler.reconcile(
                PaymentEvent.builder().eventId("evt_8").type("invoice.paid").subscriptionId("sub_123").build()));

        assertEquals(ErrorKind.DEPENDENCY, e.getKind());
        verifyNoInteractions(subscriptionRepository);
    }

    @Test
    void reconcile_unknownStatusIsDependency() {
        ComplianceException e = assertThrows(ComplianceException.class, () -> reconciler.reconcile(
                PaymentEvent.builder()
                        .eventId("evt_9")
                        .type("customer.subscription.updated")
                        .subscription(ProviderSubscription.builder().id("sub_123").status("hibernating").build())
                        .build()));

        assertEquals(ErrorKind.DEPENDENCY, e.getKind());
        verifyNoInteractions(subscriptionRepository);
    }

    @Test
    void reconcile_unhandledTypeIsIgnored() {
        boolean handled = reconciler.reconcile(PaymentEvent.builder()
                .eventId("evt_10")
                .type("charge.refunded")
                .build());

        assertFalse(handled);
        verifyNoInteractions(subscriptionRepository, storeRepository, providerClient);
    }

    @Test
    void reconcile_unknownStoreIsNotFound() {
        when(subscriptionRepository.findByExternalSubscriptionId("sub_x")).thenReturn(Optional.empty());
        when(storeRepository.findByIdForUpdate(storeId)).thenReturn(Optional.empty());

        ComplianceException e = assertThrows(ComplianceException.class, () -> reconciler.reconcile(
                PaymentEvent.builder()
                        .eventId("evt_11")
                        .type("customer.subscription.created")
                        .subscription(ProviderSubscription.builder()
                                .id("sub_x")
                                .status("active")
                                .metadataEntry("store_id", storeId.toString())
                                .build())
                        .build()));

        assertEquals(ErrorKind.NOT_FOUND, e.getKind());
    }

    private SubscriptionEntity existing(String externalId, SubscriptionStatus status) {
        return SubscriptionEntity.builder()
                .id(UUID.randomUUID())
                .storeId(storeId)
                .externalSubscriptionId(externalId)
                .status(status)
                .priceId("price_pro")
                .build();
    }

    private StoreEntity store(boolean subscriptionActive) {
        return StoreEntity.builder()
                .id(storeId)
                .companyName("Harbor Dispensary")
                .subscriptionActive(subscriptionActive)
                .build();
    }
}

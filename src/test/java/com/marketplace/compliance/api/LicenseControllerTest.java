package com.marketplace.compliance.api;

import com.marketplace.compliance.domain.error.ComplianceException;
import com.marketplace.compliance.domain.model.CreateLicenseInput;
import com.marketplace.compliance.domain.model.LicensePage;
import com.marketplace.compliance.domain.model.LicenseStatus;
import com.marketplace.compliance.domain.model.LicenseType;
import com.marketplace.compliance.domain.service.LicenseService;
import com.marketplace.compliance.infrastructure.persistence.entity.LicenseEntity;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(LicenseController.class)
class LicenseControllerTest {

    @Autowired private MockMvc mockMvc;

    @MockBean private LicenseService licenseService;

    private final UUID storeId = UUID.randomUUID();
    private final UUID userId = UUID.randomUUID();

    @Test
    void createLicense_returnsCreated() throws Exception {
        LicenseEntity license = license(LicenseStatus.PENDING);
        when(licenseService.createLicense(eq(userId), eq(storeId), any(CreateLicenseInput.class))).thenReturn(license);

        mockMvc.perform(post("/api/v1/stores/{storeId}/licenses", storeId)
                        .header("X-User-Id", userId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"media_id\":\"" + license.getMediaId() + "\",\"issuing_state\":\"CA\","
                                + "\"expiration_date\":\"2027-06-30\",\"type\":\"dispensary\",\"number\":\"C10-1\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.number").value("C10-1"));

        ArgumentCaptor<CreateLicenseInput> input = ArgumentCaptor.forClass(CreateLicenseInput.class);
        verify(licenseService).createLicense(eq(userId), eq(storeId), input.capture());
        assertEquals("CA", input.getValue().getIssuingState());
        assertEquals(LocalDate.of(2027, 6, 30), input.getValue().getExpirationDate());
        assertEquals("dispensary", input.getValue().getType());
    }

    @Test
    void createLicense_missingUserHeaderIsValidationError() throws Exception {
        mockMvc.perform(post("/api/v1/stores/{storeId}/licenses", storeId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION"))
                .andExpect(jsonPath("$.retryable").value(false));

        verifyNoInteractions(licenseService);
    }

    @Test
    void createLicense_serviceErrorRendersKind() throws Exception {
        when(licenseService.createLicense(eq(userId), eq(storeId), any(CreateLicenseInput.class)))
                .thenThrow(ComplianceException.conflict("license number already registered"));

        mockMvc.perform(post("/api/v1/stores/{storeId}/licenses", storeId)
                        .header("X-User-Id", userId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"number\":\"C10-1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("license number already registered"));
    }

    @Test
    void listLicenses_passesCursorAndLimit() throws Exception {
        when(licenseService.listLicenses(storeId, "abc", 5)).thenReturn(LicensePage.builder()
                .items(Collections.emptyList())
                .build());

        mockMvc.perform(get("/api/v1/stores/{storeId}/licenses", storeId)
                        .param("cursor", "abc")
                        .param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items").isEmpty());
    }

    @Test
    void deleteLicense_returnsNoContent() throws Exception {
        UUID licenseId = UUID.randomUUID();

        mockMvc.perform(delete("/api/v1/stores/{storeId}/licenses/{licenseId}", storeId, licenseId)
                        .header("X-User-Id", userId.toString()))
                .andExpect(status().isNoContent());

        verify(licenseService).deleteLicense(userId, storeId, licenseId);
    }

    @Test
    void verifyLicense_parsesDecision() throws Exception {
        LicenseEntity license = license(LicenseStatus.VERIFIED);
        when(licenseService.verifyLicense(license.getId(), LicenseStatus.VERIFIED, "documents match"))
                .thenReturn(license);

        mockMvc.perform(post("/api/v1/admin/licenses/{licenseId}/verify", license.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"decision\":\"verified\",\"reason\":\"documents match\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("VERIFIED"));
    }

    @Test
    void verifyLicense_unknownDecisionIsValidationError() throws Exception {
        mockMvc.perform(post("/api/v1/admin/licenses/{licenseId}/verify", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"decision\":\"maybe\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("invalid decision"));

        verifyNoInteractions(licenseService);
    }

    private LicenseEntity license(LicenseStatus status) {
        Instant now = Instant.parse("2026-05-01T00:00:00Z");
        return LicenseEntity.builder()
                .id(UUID.randomUUID())
                .storeId(storeId)
                .userId(userId)
                .status(status)
                .mediaId(UUID.randomUUID())
                .issuingState("CA")
                .expirationDate(LocalDate.of(2027, 6, 30))
                .type(LicenseType.DISPENSARY)
                .number("C10-1")
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}

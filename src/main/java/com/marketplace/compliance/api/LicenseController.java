package com.marketplace.compliance.api;

import com.marketplace.compliance.domain.error.ComplianceException;
import com.marketplace.compliance.domain.model.CreateLicenseInput;
import com.marketplace.compliance.domain.model.LicenseListItem;
import com.marketplace.compliance.domain.model.LicensePage;
import com.marketplace.compliance.domain.model.LicenseStatus;
import com.marketplace.compliance.domain.service.LicenseService;
import com.marketplace.compliance.infrastructure.persistence.entity.LicenseEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;
import java.util.UUID;

/**
 * REST API for store licenses.
 *
 * The acting user comes from the {@code X-User-Id} header set by the gateway
 * after authentication.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class LicenseController {

    static final String USER_HEADER = "X-User-Id";

    private final LicenseService licenseService;

    /**
     * POST /api/v1/stores/{storeId}/licenses
     */
    @PostMapping("/stores/{storeId}/licenses")
    public ResponseEntity<LicenseListItem> createLicense(@RequestHeader(USER_HEADER) UUID userId,
                                                         @PathVariable UUID storeId,
                                                         @RequestBody CreateLicenseRequest request) {
        log.info("Create license request: store {}, user {}", storeId, userId);

        LicenseEntity license = licenseService.createLicense(userId, storeId, CreateLicenseInput.builder()
                .mediaId(request.getMediaId())
                .issuingState(request.getIssuingState())
                .issueDate(request.getIssueDate())
                .expirationDate(request.getExpirationDate())
                .type(request.getType())
                .number(request.getNumber())
                .build());

        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(license));
    }

    /**
     * GET /api/v1/stores/{storeId}/licenses?cursor=&limit=
     */
    @GetMapping("/stores/{storeId}/licenses")
    public ResponseEntity<LicensePage> listLicenses(@PathVariable UUID storeId,
                                                    @RequestParam(required = false) String cursor,
                                                    @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(licenseService.listLicenses(storeId, cursor, limit));
    }

    /**
     * DELETE /api/v1/stores/{storeId}/licenses/{licenseId}
     */
    @DeleteMapping("/stores/{storeId}/licenses/{licenseId}")
    public ResponseEntity<Void> deleteLicense(@RequestHeader(USER_HEADER) UUID userId,
                                              @PathVariable UUID storeId,
                                              @PathVariable UUID licenseId) {
        licenseService.deleteLicense(userId, storeId, licenseId);
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /api/v1/admin/licenses/{licenseId}/verify
     */
    @PostMapping("/admin/licenses/{licenseId}/verify")
    public ResponseEntity<LicenseListItem> verifyLicense(@PathVariable UUID licenseId,
                                                         @RequestBody VerifyLicenseRequest request) {
        LicenseEntity license = licenseService.verifyLicense(licenseId, parseDecision(request.getDecision()),
                request.getReason());
        return ResponseEntity.ok(toResponse(license));
    }

    private static LicenseStatus parseDecision(String decision) {
        if (decision == null || decision.isBlank()) {
            throw ComplianceException.validation("invalid decision");
        }
        try {
            return LicenseStatus.valueOf(decision.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw ComplianceException.validation("invalid decision");
        }
    }

    private static LicenseListItem toResponse(LicenseEntity license) {
        return LicenseListItem.builder()
                .id(license.getId())
                .storeId(license.getStoreId())
                .userId(license.getUserId())
                .status(license.getStatus())
                .mediaId(license.getMediaId())
                .issuingState(license.getIssuingState())
                .issueDate(license.getIssueDate())
                .expirationDate(license.getExpirationDate())
                .type(license.getType())
                .number(license.getNumber())
                .createdAt(license.getCreatedAt())
                .updatedAt(license.getUpdatedAt())
                .build();
    }
}

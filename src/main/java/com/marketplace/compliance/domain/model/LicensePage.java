package com.marketplace.compliance.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class LicensePage {

    List<LicenseListItem> items;

    /** Opaque cursor for the next page, empty on the last page. */
    String cursor;
}

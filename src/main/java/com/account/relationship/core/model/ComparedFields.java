package com.account.relationship.core.model;

import java.util.Objects;

/**
 * The pair of address field sets an address comparison actually used.
 */
public record ComparedFields(AddressFieldSet customerSide, AddressFieldSet parentSide) {

    public ComparedFields {
        Objects.requireNonNull(customerSide, "customerSide is required");
        Objects.requireNonNull(parentSide, "parentSide is required");
    }

    /**
     * e.g. "Customer Billing Address vs Parent Enrichment Address".
     */
    public String describe() {
        return customerSide.getLabel() + " vs " + parentSide.getLabel();
    }
}

package com.account.relationship.core.model;

/**
 * The four address field sets that can take part in an address comparison.
 */
public enum AddressFieldSet {
    CUSTOMER_BILLING("Customer Billing Address"),
    CUSTOMER_ENRICHMENT("Customer Enrichment Address"),
    PARENT_BILLING("Parent Billing Address"),
    PARENT_ENRICHMENT("Parent Enrichment Address");

    private final String label;

    AddressFieldSet(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}

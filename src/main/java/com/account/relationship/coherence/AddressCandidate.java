package com.account.relationship.coherence;

import com.account.relationship.core.model.AccountRecord;
import com.account.relationship.core.model.AddressFieldSet;
import com.account.relationship.core.model.ComparedFields;
import com.account.relationship.core.model.PostalAddress;

import java.util.List;
import java.util.function.Function;

/**
 * One step of the address fallback chain: which customer address is compared with which
 * parent address.
 */
record AddressCandidate(AddressFieldSet customerSide, AddressFieldSet parentSide) {

    /**
     * Precedence order. The first candidate with data on both sides is the one compared.
     */
    static final List<AddressCandidate> PRECEDENCE = List.of(
            new AddressCandidate(AddressFieldSet.CUSTOMER_BILLING, AddressFieldSet.PARENT_ENRICHMENT),
            new AddressCandidate(AddressFieldSet.CUSTOMER_BILLING, AddressFieldSet.PARENT_BILLING),
            new AddressCandidate(AddressFieldSet.CUSTOMER_ENRICHMENT, AddressFieldSet.PARENT_ENRICHMENT),
            new AddressCandidate(AddressFieldSet.CUSTOMER_ENRICHMENT, AddressFieldSet.PARENT_BILLING));

    PostalAddress customerAddress(AccountRecord customer) {
        return extractor(customerSide).apply(customer);
    }

    PostalAddress parentAddress(AccountRecord parent) {
        return extractor(parentSide).apply(parent);
    }

    ComparedFields comparedFields() {
        return new ComparedFields(customerSide, parentSide);
    }

    private static Function<AccountRecord, PostalAddress> extractor(AddressFieldSet fieldSet) {
        return switch (fieldSet) {
            case CUSTOMER_BILLING, PARENT_BILLING -> AccountRecord::getBillingAddress;
            case CUSTOMER_ENRICHMENT, PARENT_ENRICHMENT -> AccountRecord::getEnrichmentAddress;
        };
    }
}

package com.account.relationship.coherence;

import com.account.relationship.core.model.AccountRecord;
import com.account.relationship.core.model.AddressConsistencyFlag;
import com.account.relationship.core.model.ComparedFields;
import com.account.relationship.core.model.PostalAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Decides whether a customer's address agrees with its parent's.
 *
 * <p>Walks {@link AddressCandidate#PRECEDENCE} and compares the first pair where both
 * addresses carry data. State and country must agree; the postal code must agree when both
 * sides have one, otherwise the configured {@link PostalCodeTolerance} decides.</p>
 */
public class AddressConsistencyCalculator {
    private static final Logger log = LoggerFactory.getLogger(AddressConsistencyCalculator.class);

    private final PostalCodeTolerance tolerance;

    public AddressConsistencyCalculator() {
        this(PostalCodeTolerance.AT_LEAST_ONE_SIDE_MISSING);
    }

    public AddressConsistencyCalculator(PostalCodeTolerance tolerance) {
        this.tolerance = Objects.requireNonNull(tolerance, "tolerance is required");
    }

    public PostalCodeTolerance getTolerance() {
        return tolerance;
    }

    public AddressConsistencyFlag calculate(AccountRecord customer, AccountRecord parent) {
        Objects.requireNonNull(customer, "customer is required");
        Objects.requireNonNull(parent, "parent is required");

        for (AddressCandidate candidate : AddressCandidate.PRECEDENCE) {
            PostalAddress customerAddress = candidate.customerAddress(customer);
            PostalAddress parentAddress = candidate.parentAddress(parent);
            if (customerAddress.isUsable() && parentAddress.isUsable()) {
                return compare(candidate.comparedFields(), customerAddress, parentAddress);
            }
        }
        return AddressConsistencyFlag.noComparableData();
    }

    AddressConsistencyFlag compare(ComparedFields fields, PostalAddress customer, PostalAddress parent) {
        String prefix = fields.describe() + ": ";

        if (!((customer.hasState() && parent.hasState()) || (customer.hasCountry() && parent.hasCountry()))) {
            return new AddressConsistencyFlag(false,
                    prefix + "no state or country present on both sides ("
                            + render(customer) + " vs " + render(parent) + ")", fields);
        }

        List<String> differences = new ArrayList<>();
        if (!sameComponent(customer.state(), parent.state())) {
            differences.add("state '" + nullText(customer.state()) + "' vs '" + nullText(parent.state()) + "'");
        }
        if (!sameComponent(customer.country(), parent.country())) {
            differences.add("country '" + nullText(customer.country()) + "' vs '" + nullText(parent.country()) + "'");
        }

        String postalNote;
        if (customer.hasPostalCode() && parent.hasPostalCode()) {
            if (!sameComponent(customer.postalCode(), parent.postalCode())) {
                differences.add("postal code '" + customer.postalCode() + "' vs '" + parent.postalCode() + "'");
            }
            postalNote = "";
        } else if (tolerance.tolerates(customer.hasPostalCode(), parent.hasPostalCode())) {
            postalNote = " (postal code missing on " + missingSide(customer, parent) + ")";
        } else {
            differences.add("postal code missing on " + missingSide(customer, parent));
            postalNote = "";
        }

        if (differences.isEmpty()) {
            return new AddressConsistencyFlag(true,
                    prefix + "addresses match (" + render(customer) + ")" + postalNote, fields);
        }
        log.debug("address-consistency.mismatch fields='{}' differences={}", fields.describe(), differences);
        return new AddressConsistencyFlag(false,
                prefix + "addresses differ: " + String.join(", ", differences), fields);
    }

    private static boolean sameComponent(String a, String b) {
        if (a == null || b == null) {
            return a == null && b == null;
        }
        return a.trim().toLowerCase(Locale.ROOT).equals(b.trim().toLowerCase(Locale.ROOT));
    }

    private static String missingSide(PostalAddress customer, PostalAddress parent) {
        if (!customer.hasPostalCode() && !parent.hasPostalCode()) {
            return "both sides";
        }
        return customer.hasPostalCode() ? "parent side" : "customer side";
    }

    private static String render(PostalAddress address) {
        String formatted = address.format();
        return formatted != null ? formatted : "empty";
    }

    private static String nullText(String value) {
        return value != null ? value : "";
    }
}

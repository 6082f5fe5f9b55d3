package com.account.relationship.assessment;

import com.account.relationship.api.EvaluationResult;
import com.account.relationship.core.model.AccountRecord;
import com.account.relationship.core.model.AddressConsistencyFlag;
import com.account.relationship.core.model.RelationshipFlags;
import com.account.relationship.core.model.ScoredFlag;
import com.account.relationship.core.model.TrustLevel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns an evaluated record into an {@link AssessmentPayload}. Own fields are trusted,
 * enrichment fields semi-reliable and flags computed. The parent is only included when the
 * record has a shell and the parent was resolved.
 */
public final class AssessmentPayloadBuilder {

    static final String NAME = "Name";
    static final String PARENT_ID = "ParentId";
    static final String PARENT_NAME = "Parent";
    static final String WEBSITE = "Website";
    static final String BILLING_ADDRESS = "Billing_Address";
    static final String ENRICHMENT_COMPANY_NAME = "Enrichment_Company_Name";
    static final String ENRICHMENT_WEBSITE = "Enrichment_Website";
    static final String ENRICHMENT_BILLING_ADDRESS = "Enrichment_Billing_Address";

    static final String BAD_DOMAIN = "Bad_Domain";
    static final String HAS_SHELL = "Has_Shell";
    static final String CUSTOMER_CONSISTENCY = "Customer_Consistency";
    static final String CUSTOMER_SHELL_COHERENCE = "Customer_Shell_Coherence";
    static final String ADDRESS_CONSISTENCY = "Address_Consistency";

    private AssessmentPayloadBuilder() {
        // Utility class
    }

    public static AssessmentPayload from(EvaluationResult result) {
        return build(result.record(), result.parent(), result.flags());
    }

    public static AssessmentPayload build(AccountRecord record, AccountRecord parent, RelationshipFlags flags) {
        List<AnnotatedField> fields = new ArrayList<>();

        AnnotatedField.Section customer = AnnotatedField.Section.CUSTOMER;
        fields.add(new AnnotatedField(customer, NAME, record.getName(), TrustLevel.TRUSTED));
        fields.add(new AnnotatedField(customer, PARENT_ID, record.getParentId(), TrustLevel.TRUSTED));
        fields.add(new AnnotatedField(customer, PARENT_NAME, record.getParentName(), TrustLevel.TRUSTED));
        addRecordFields(fields, customer, record);

        if (parent != null && flags.hasShell().orElse(false)) {
            AnnotatedField.Section parentSection = AnnotatedField.Section.PARENT;
            fields.add(new AnnotatedField(parentSection, NAME, parent.getName(), TrustLevel.TRUSTED));
            addRecordFields(fields, parentSection, parent);
        }

        addFlags(fields, flags);
        return new AssessmentPayload(record.getId(), fields);
    }

    private static void addRecordFields(List<AnnotatedField> fields, AnnotatedField.Section section,
                                        AccountRecord record) {
        fields.add(new AnnotatedField(section, WEBSITE, record.getWebsite(), TrustLevel.TRUSTED));
        fields.add(new AnnotatedField(section, BILLING_ADDRESS, record.getBillingAddress().format(),
                TrustLevel.TRUSTED));
        fields.add(new AnnotatedField(section, ENRICHMENT_COMPANY_NAME, record.getEnrichmentCompanyName(),
                TrustLevel.SEMI_RELIABLE));
        fields.add(new AnnotatedField(section, ENRICHMENT_WEBSITE, record.getEnrichmentWebsite(),
                TrustLevel.SEMI_RELIABLE));
        fields.add(new AnnotatedField(section, ENRICHMENT_BILLING_ADDRESS, record.getEnrichmentAddress().format(),
                TrustLevel.SEMI_RELIABLE));
    }

    private static void addFlags(List<AnnotatedField> fields, RelationshipFlags flags) {
        AnnotatedField.Section section = AnnotatedField.Section.FLAGS;

        Map<String, Object> badDomain = new LinkedHashMap<>();
        badDomain.put("is_bad", flags.getBadDomain().bad());
        badDomain.put("explanation", flags.getBadDomain().explanation());
        fields.add(new AnnotatedField(section, BAD_DOMAIN, badDomain, TrustLevel.COMPUTED));

        flags.hasShell().ifPresent(shell ->
                fields.add(new AnnotatedField(section, HAS_SHELL, shell, TrustLevel.COMPUTED)));
        flags.getCustomerConsistency().ifPresent(flag ->
                fields.add(new AnnotatedField(section, CUSTOMER_CONSISTENCY, scored(flag), TrustLevel.COMPUTED)));
        flags.getCustomerShellCoherence().ifPresent(flag ->
                fields.add(new AnnotatedField(section, CUSTOMER_SHELL_COHERENCE, scored(flag), TrustLevel.COMPUTED)));
        flags.getAddressConsistency().ifPresent(flag ->
                fields.add(new AnnotatedField(section, ADDRESS_CONSISTENCY, address(flag), TrustLevel.COMPUTED)));
    }

    private static Map<String, Object> scored(ScoredFlag flag) {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("score", flag.score());
        value.put("explanation", flag.explanation());
        return value;
    }

    private static Map<String, Object> address(AddressConsistencyFlag flag) {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("is_consistent", flag.consistent());
        value.put("explanation", flag.explanation());
        flag.fieldsCompared().ifPresent(compared -> value.put("fields_compared", compared.describe()));
        return value;
    }
}

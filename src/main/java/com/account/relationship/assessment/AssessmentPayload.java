package com.account.relationship.assessment;

import com.account.relationship.core.model.TrustLevel;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything the external reasoning step receives for one record: the customer's raw fields,
 * the parent's raw fields when a parent was resolved, and the computed flags.
 *
 * <p>Serialized, customer and parent fields are grouped by trust tier
 * ({@code trusted}, {@code semi_reliable}); flags sit under {@code flags}.</p>
 */
@JsonPropertyOrder({"record_id", "customer", "parent", "flags"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AssessmentPayload {

    private final String recordId;
    private final List<AnnotatedField> fields;

    AssessmentPayload(String recordId, List<AnnotatedField> fields) {
        this.recordId = Objects.requireNonNull(recordId, "recordId is required");
        this.fields = List.copyOf(fields);
    }

    @JsonProperty("record_id")
    public String getRecordId() {
        return recordId;
    }

    @JsonProperty("customer")
    public Map<String, Map<String, Object>> getCustomer() {
        return byTrust(AnnotatedField.Section.CUSTOMER);
    }

    /**
     * Parent fields grouped by trust tier, or {@code null} when no parent was included.
     */
    @JsonProperty("parent")
    public Map<String, Map<String, Object>> getParent() {
        return hasParent() ? byTrust(AnnotatedField.Section.PARENT) : null;
    }

    @JsonProperty("flags")
    public Map<String, Object> getFlags() {
        Map<String, Object> flags = new LinkedHashMap<>();
        for (AnnotatedField field : fields) {
            if (field.section() == AnnotatedField.Section.FLAGS) {
                flags.put(field.name(), field.value());
            }
        }
        return flags;
    }

    @JsonIgnore
    public List<AnnotatedField> getFields() {
        return fields;
    }

    @JsonIgnore
    public boolean hasParent() {
        return fields.stream().anyMatch(f -> f.section() == AnnotatedField.Section.PARENT);
    }

    public Optional<AnnotatedField> find(AnnotatedField.Section section, String name) {
        return fields.stream()
                .filter(f -> f.section() == section && f.name().equals(name))
                .findFirst();
    }

    private Map<String, Map<String, Object>> byTrust(AnnotatedField.Section section) {
        Map<String, Map<String, Object>> tiers = new LinkedHashMap<>();
        for (AnnotatedField field : fields) {
            if (field.section() == section) {
                tiers.computeIfAbsent(tierKey(field.trust()), k -> new LinkedHashMap<>())
                        .put(field.name(), field.value());
            }
        }
        return tiers;
    }

    static String tierKey(TrustLevel trust) {
        return trust.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AssessmentPayload that = (AssessmentPayload) o;
        return recordId.equals(that.recordId) && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recordId, fields);
    }

    @Override
    public String toString() {
        return "AssessmentPayload{recordId='" + recordId + "', fields=" + fields.size() + '}';
    }
}

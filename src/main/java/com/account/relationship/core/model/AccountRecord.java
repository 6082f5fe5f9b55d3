package com.account.relationship.core.model;

import java.util.Objects;

/**
 * A business record (customer or shell) as supplied by the record source.
 *
 * <p>Own fields (name, website, email, billing address) are trusted; the enrichment
 * fields are third-party copies and only semi-reliable. Parent fields are the raw
 * link as stored on the record and may be null or point back at the record itself.</p>
 */
public final class AccountRecord {
    private final String id;
    private final String name;
    private final String website;
    private final String email;
    private final PostalAddress billingAddress;
    private final String enrichmentCompanyName;
    private final String enrichmentWebsite;
    private final PostalAddress enrichmentAddress;
    private final String parentId;
    private final String parentName;

    private AccountRecord(Builder builder) {
        this.id = builder.id;
        this.name = blankToNull(builder.name);
        this.website = blankToNull(builder.website);
        this.email = blankToNull(builder.email);
        this.billingAddress = builder.billingAddress != null ? builder.billingAddress : PostalAddress.empty();
        this.enrichmentCompanyName = blankToNull(builder.enrichmentCompanyName);
        this.enrichmentWebsite = blankToNull(builder.enrichmentWebsite);
        this.enrichmentAddress = builder.enrichmentAddress != null ? builder.enrichmentAddress : PostalAddress.empty();
        this.parentId = blankToNull(builder.parentId);
        this.parentName = blankToNull(builder.parentName);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getWebsite() {
        return website;
    }

    public String getEmail() {
        return email;
    }

    public PostalAddress getBillingAddress() {
        return billingAddress;
    }

    public String getEnrichmentCompanyName() {
        return enrichmentCompanyName;
    }

    public String getEnrichmentWebsite() {
        return enrichmentWebsite;
    }

    public PostalAddress getEnrichmentAddress() {
        return enrichmentAddress;
    }

    public String getParentId() {
        return parentId;
    }

    public String getParentName() {
        return parentName;
    }

    public boolean hasAnyWebsite() {
        return website != null || enrichmentWebsite != null;
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AccountRecord that = (AccountRecord) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "AccountRecord{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", website='" + website + '\'' +
                ", parentId='" + parentId + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(AccountRecord record) {
        return new Builder()
                .id(record.id)
                .name(record.name)
                .website(record.website)
                .email(record.email)
                .billingAddress(record.billingAddress)
                .enrichmentCompanyName(record.enrichmentCompanyName)
                .enrichmentWebsite(record.enrichmentWebsite)
                .enrichmentAddress(record.enrichmentAddress)
                .parentId(record.parentId)
                .parentName(record.parentName);
    }

    public static class Builder {
        private String id;
        private String name;
        private String website;
        private String email;
        private PostalAddress billingAddress;
        private String enrichmentCompanyName;
        private String enrichmentWebsite;
        private PostalAddress enrichmentAddress;
        private String parentId;
        private String parentName;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder website(String website) {
            this.website = website;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder billingAddress(PostalAddress billingAddress) {
            this.billingAddress = billingAddress;
            return this;
        }

        public Builder billingAddress(String state, String country, String postalCode) {
            this.billingAddress = PostalAddress.of(state, country, postalCode);
            return this;
        }

        public Builder enrichmentCompanyName(String enrichmentCompanyName) {
            this.enrichmentCompanyName = enrichmentCompanyName;
            return this;
        }

        public Builder enrichmentWebsite(String enrichmentWebsite) {
            this.enrichmentWebsite = enrichmentWebsite;
            return this;
        }

        public Builder enrichmentAddress(PostalAddress enrichmentAddress) {
            this.enrichmentAddress = enrichmentAddress;
            return this;
        }

        public Builder enrichmentAddress(String state, String country, String postalCode) {
            this.enrichmentAddress = PostalAddress.of(state, country, postalCode);
            return this;
        }

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder parentName(String parentName) {
            this.parentName = parentName;
            return this;
        }

        public AccountRecord build() {
            Objects.requireNonNull(id, "id is required");
            return new AccountRecord(this);
        }
    }
}

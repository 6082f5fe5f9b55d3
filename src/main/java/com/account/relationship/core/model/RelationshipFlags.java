package com.account.relationship.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * The flag bundle produced for one record.
 *
 * <p>Instances can only be created through the three factory methods, each matching
 * one terminal path of {@link EvaluationStage}:</p>
 * <ul>
 *   <li>{@link #badDomain(BadDomainFlag)}: gate triggered, nothing else is present</li>
 *   <li>{@link #withoutShell(BadDomainFlag, ScoredFlag)}: no parent link</li>
 *   <li>{@link #withShell(BadDomainFlag, ScoredFlag, ScoredFlag, AddressConsistencyFlag)}: parent linked</li>
 * </ul>
 */
public final class RelationshipFlags {
    private final BadDomainFlag badDomain;
    private final Boolean hasShell;
    private final ScoredFlag customerConsistency;
    private final ScoredFlag customerShellCoherence;
    private final AddressConsistencyFlag addressConsistency;
    private final EvaluationStage stage;

    private RelationshipFlags(BadDomainFlag badDomain, Boolean hasShell, ScoredFlag customerConsistency,
                              ScoredFlag customerShellCoherence, AddressConsistencyFlag addressConsistency,
                              EvaluationStage stage) {
        this.badDomain = badDomain;
        this.hasShell = hasShell;
        this.customerConsistency = customerConsistency;
        this.customerShellCoherence = customerShellCoherence;
        this.addressConsistency = addressConsistency;
        this.stage = stage;
    }

    public static RelationshipFlags badDomain(BadDomainFlag badDomain) {
        Objects.requireNonNull(badDomain, "badDomain is required");
        if (!badDomain.bad()) {
            throw new IllegalArgumentException("badDomain flag must be set to terminate evaluation");
        }
        return new RelationshipFlags(badDomain, null, null, null, null, EvaluationStage.TERMINATED);
    }

    public static RelationshipFlags withoutShell(BadDomainFlag badDomain, ScoredFlag customerConsistency) {
        requireClean(badDomain);
        Objects.requireNonNull(customerConsistency, "customerConsistency is required");
        return new RelationshipFlags(badDomain, false, customerConsistency, null, null,
                EvaluationStage.FLAGS_COMPLETE);
    }

    public static RelationshipFlags withShell(BadDomainFlag badDomain, ScoredFlag customerConsistency,
                                              ScoredFlag customerShellCoherence,
                                              AddressConsistencyFlag addressConsistency) {
        requireClean(badDomain);
        Objects.requireNonNull(customerConsistency, "customerConsistency is required");
        Objects.requireNonNull(customerShellCoherence, "customerShellCoherence is required");
        Objects.requireNonNull(addressConsistency, "addressConsistency is required");
        return new RelationshipFlags(badDomain, true, customerConsistency, customerShellCoherence,
                addressConsistency, EvaluationStage.FLAGS_COMPLETE);
    }

    private static void requireClean(BadDomainFlag badDomain) {
        Objects.requireNonNull(badDomain, "badDomain is required");
        if (badDomain.bad()) {
            throw new IllegalArgumentException("A bad domain terminates evaluation; use badDomain()");
        }
    }

    public BadDomainFlag getBadDomain() {
        return badDomain;
    }

    public Optional<Boolean> hasShell() {
        return Optional.ofNullable(hasShell);
    }

    public Optional<ScoredFlag> getCustomerConsistency() {
        return Optional.ofNullable(customerConsistency);
    }

    public Optional<ScoredFlag> getCustomerShellCoherence() {
        return Optional.ofNullable(customerShellCoherence);
    }

    public Optional<AddressConsistencyFlag> getAddressConsistency() {
        return Optional.ofNullable(addressConsistency);
    }

    public EvaluationStage getStage() {
        return stage;
    }

    public boolean isTerminatedByBadDomain() {
        return stage == EvaluationStage.TERMINATED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RelationshipFlags that = (RelationshipFlags) o;
        return Objects.equals(badDomain, that.badDomain)
                && Objects.equals(hasShell, that.hasShell)
                && Objects.equals(customerConsistency, that.customerConsistency)
                && Objects.equals(customerShellCoherence, that.customerShellCoherence)
                && Objects.equals(addressConsistency, that.addressConsistency)
                && stage == that.stage;
    }

    @Override
    public int hashCode() {
        return Objects.hash(badDomain, hasShell, customerConsistency, customerShellCoherence,
                addressConsistency, stage);
    }

    @Override
    public String toString() {
        return "RelationshipFlags{" +
                "badDomain=" + badDomain +
                ", hasShell=" + hasShell +
                ", customerConsistency=" + customerConsistency +
                ", customerShellCoherence=" + customerShellCoherence +
                ", addressConsistency=" + addressConsistency +
                ", stage=" + stage +
                '}';
    }
}

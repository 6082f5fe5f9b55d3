package com.account.relationship.source;

import com.account.relationship.api.EvaluationRequest;
import com.account.relationship.api.RelationshipFlagEvaluator;
import com.account.relationship.core.model.AccountRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves the parent of each record before evaluation, with a single batch lookup per call.
 * A linked parent that the source does not return is reported as unresolved: its request
 * carries no parent and the evaluator degrades the shell flags.
 */
public class ParentResolver {
    private static final Logger log = LoggerFactory.getLogger(ParentResolver.class);

    private final RecordSource recordSource;

    public ParentResolver(RecordSource recordSource) {
        this.recordSource = Objects.requireNonNull(recordSource, "recordSource is required");
    }

    public EvaluationRequest resolve(AccountRecord record) {
        return resolveAll(List.of(record)).get(0);
    }

    /**
     * Builds one evaluation request per record, in input order.
     */
    public List<EvaluationRequest> resolveAll(List<AccountRecord> records) {
        Set<String> parentIds = new LinkedHashSet<>();
        for (AccountRecord record : records) {
            if (RelationshipFlagEvaluator.hasShell(record)) {
                parentIds.add(record.getParentId());
            }
        }

        Map<String, AccountRecord> parents = fetchParents(parentIds);

        List<EvaluationRequest> requests = new ArrayList<>(records.size());
        int unresolved = 0;
        for (AccountRecord record : records) {
            if (!RelationshipFlagEvaluator.hasShell(record)) {
                requests.add(EvaluationRequest.of(record));
                continue;
            }
            AccountRecord parent = parents.get(record.getParentId());
            if (parent == null) {
                unresolved++;
                log.warn("parent.unresolved recordId={} parentId={}", record.getId(), record.getParentId());
            }
            requests.add(EvaluationRequest.of(record, parent));
        }

        log.debug("parents.resolved requested={} found={} unresolved={}", parentIds.size(), parents.size(), unresolved);
        return requests;
    }

    private Map<String, AccountRecord> fetchParents(Set<String> parentIds) {
        if (parentIds.isEmpty()) {
            return Map.of();
        }
        try {
            return recordSource.findAllById(parentIds);
        } catch (RuntimeException e) {
            log.warn("parents.lookup-failed count={} error={}", parentIds.size(), e.getMessage(), e);
            return Map.of();
        }
    }
}

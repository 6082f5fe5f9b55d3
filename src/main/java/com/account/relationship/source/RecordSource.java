package com.account.relationship.source;

import com.account.relationship.core.model.AccountRecord;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Supplies account records by identifier. Implementations own query execution and
 * connection handling; the flag engine only reads through this interface.
 */
public interface RecordSource {

    Optional<AccountRecord> findById(String id);

    /**
     * Batch lookup. The returned map is keyed by the requested id as passed in; ids that do not
     * exist are absent from the map.
     */
    Map<String, AccountRecord> findAllById(Collection<String> ids);
}

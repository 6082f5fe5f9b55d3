package com.account.relationship.source;

import com.account.relationship.core.model.AccountRecord;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link RecordSource}. Records can be looked up by either their 15- or
 * 18-character id.
 */
public class InMemoryRecordSource implements RecordSource {

    private final Map<String, AccountRecord> records = new ConcurrentHashMap<>();

    public InMemoryRecordSource() {
    }

    public InMemoryRecordSource(Collection<AccountRecord> initial) {
        initial.forEach(this::save);
    }

    public void save(AccountRecord record) {
        records.put(key(record.getId()), record);
    }

    public int size() {
        return records.size();
    }

    @Override
    public Optional<AccountRecord> findById(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.get(key(id)));
    }

    @Override
    public Map<String, AccountRecord> findAllById(Collection<String> ids) {
        Map<String, AccountRecord> found = new LinkedHashMap<>();
        for (String id : ids) {
            findById(id).ifPresent(record -> found.put(id, record));
        }
        return found;
    }

    private static String key(String id) {
        return RecordIds.to15(id);
    }
}

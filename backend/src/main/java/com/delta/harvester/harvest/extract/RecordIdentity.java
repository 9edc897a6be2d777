package com.delta.harvester.harvest.extract;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.harvest.model.ListingRecord;
import com.delta.harvester.harvest.util.HashUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Identity of a listing record: the natural business key when the record carries one,
 * otherwise a short content hash over a fixed field list. Both branches are deterministic,
 * and the prefixes keep a key from ever colliding with a hash.
 */
@Component
public class RecordIdentity {
    static final String KEY_PREFIX = "key:";
    static final String HASH_PREFIX = "hash:";
    private static final int HASH_LENGTH = 16;

    private final String naturalKeyField;
    private final List<String> hashFields;

    @Autowired
    public RecordIdentity(HarvesterProperties properties) {
        this(properties.getExtraction().getNaturalKeyField(), properties.getExtraction().getHashFields());
    }

    public RecordIdentity(String naturalKeyField, List<String> hashFields) {
        this.naturalKeyField = naturalKeyField;
        this.hashFields = List.copyOf(hashFields);
    }

    public String identify(Map<String, String> fields) {
        String naturalKey = naturalKeyField == null ? null : fields.get(naturalKeyField);
        if (naturalKey != null && !naturalKey.isBlank()) {
            return KEY_PREFIX + naturalKey.trim();
        }
        String joined = hashFields.stream()
            .map(field -> {
                String value = fields.get(field);
                return value == null ? "" : value.trim();
            })
            .collect(Collectors.joining("|"));
        return HASH_PREFIX + HashUtils.sha256Prefix(joined, HASH_LENGTH);
    }

    public ListingRecord toRecord(Map<String, String> fields, Instant extractedAt) {
        return new ListingRecord(identify(fields), fields, extractedAt);
    }
}

package com.delta.harvester.harvest.filter;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.harvest.model.ListingRecord;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Keeps records whose authority, phase and construction type are whitelisted. An empty
 * whitelist accepts any value. Engineering structures (usage code prefix "2") and records that
 * already reached the construction phase are dropped.
 */
@Component
public class WhitelistRecordFilter implements RecordFilter {
    private final HarvesterProperties.Filter filter;

    public WhitelistRecordFilter(HarvesterProperties properties) {
        this.filter = properties.getFilter();
    }

    @Override
    public boolean accepts(ListingRecord record) {
        if (!filter.isEnabled()) {
            return true;
        }
        String phase = record.field("phase").trim();
        if (filter.getExcludedPhases().contains(phase)) {
            return false;
        }
        return allowed(filter.getAuthorities(), record.field("authority").trim())
            && allowed(filter.getPhases(), phase)
            && allowed(filter.getConstructionTypes(), record.field("construction_type").trim())
            && usageCodeAllowed(record.field("usage_code"));
    }

    private boolean allowed(Set<String> whitelist, String value) {
        return whitelist.isEmpty() || whitelist.contains(value);
    }

    private boolean usageCodeAllowed(String usageCode) {
        String code = usageCode == null ? "" : usageCode.trim();
        if (code.isEmpty()) {
            return true;
        }
        List<String> excludedPrefixes = filter.getExcludedUsageCodePrefixes();
        for (String prefix : excludedPrefixes) {
            if (prefix != null && !prefix.isBlank() && code.startsWith(prefix.trim())) {
                return false;
            }
        }
        return true;
    }
}

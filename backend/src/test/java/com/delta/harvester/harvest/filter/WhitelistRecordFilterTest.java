package com.delta.harvester.harvest.filter;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.harvest.model.ListingRecord;
import com.delta.harvester.harvest.support.TestRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WhitelistRecordFilterTest {
    private HarvesterProperties properties;

    @BeforeEach
    void setUp() {
        properties = new HarvesterProperties();
        properties.getFilter().setAuthorities(Set.of("Jūrmalas Būvvalde"));
        properties.getFilter().setPhases(Set.of("Iecere", "Projektēšanas nosacījumu izpilde"));
        properties.getFilter().setConstructionTypes(Set.of("Pārbūve", "Jauna būvniecība"));
    }

    @Test
    void acceptsWhitelistedRecord() {
        assertTrue(filter().accepts(listing("Jūrmalas Būvvalde", "Iecere", "Pārbūve", "1110")));
    }

    @Test
    void rejectsAuthorityPhaseOrTypeOutsideWhitelist() {
        assertFalse(filter().accepts(listing("Siguldas novada būvvalde", "Iecere", "Pārbūve", "1110")));
        assertFalse(filter().accepts(listing("Jūrmalas Būvvalde", "Ekspluatācija", "Pārbūve", "1110")));
        assertFalse(filter().accepts(listing("Jūrmalas Būvvalde", "Iecere", "Nojaukšana", "1110")));
    }

    @Test
    void dropsRecordsThatReachedConstructionPhase() {
        properties.getFilter().setPhases(Set.of());
        assertFalse(filter().accepts(listing("Jūrmalas Būvvalde", "Būvdarbi", "Pārbūve", "1110")));
    }

    @Test
    void engineeringStructuresAreExcludedButMissingUsageCodeIsKept() {
        assertFalse(filter().accepts(listing("Jūrmalas Būvvalde", "Iecere", "Pārbūve", "2112")));
        assertTrue(filter().accepts(listing("Jūrmalas Būvvalde", "Iecere", "Pārbūve", "")));
    }

    @Test
    void emptyWhitelistsAndDisabledFilterAcceptEverything() {
        HarvesterProperties open = new HarvesterProperties();
        assertTrue(new WhitelistRecordFilter(open).accepts(listing("Any", "Iecere", "Any", "1110")));

        properties.getFilter().setEnabled(false);
        assertTrue(filter().accepts(listing("Any", "Būvdarbi", "Any", "2112")));
    }

    private WhitelistRecordFilter filter() {
        return new WhitelistRecordFilter(properties);
    }

    private ListingRecord listing(String authority, String phase, String type, String usageCode) {
        return TestRecords.record(
            "BIS-1",
            "authority", authority,
            "phase", phase,
            "construction_type", type,
            "usage_code", usageCode
        );
    }
}

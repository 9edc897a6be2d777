package com.delta.harvester.harvest.fetch;

import com.delta.harvester.harvest.extract.RecordExtractor;
import com.delta.harvester.harvest.model.FetchErrorKind;
import com.delta.harvester.harvest.model.FetchResult;
import com.delta.harvester.harvest.model.ListingRecord;
import com.delta.harvester.harvest.model.PageOutcome;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns a raw fetch into OK, EMPTY or ERROR. A well-formed page without records is EMPTY,
 * an error page served with a success status is ERROR.
 */
@Component
public class FetchClassifier {
    private final RecordExtractor extractor;
    private final ErrorPagePredicate errorPagePredicate;

    public FetchClassifier(RecordExtractor extractor, ErrorPagePredicate errorPagePredicate) {
        this.extractor = extractor;
        this.errorPagePredicate = errorPagePredicate;
    }

    public PageOutcome classify(int page, FetchResult result) {
        if (result == null || !result.transportOk()) {
            String detail = result == null ? "no_result" : result.describeFailure();
            return PageOutcome.error(page, FetchErrorKind.TRANSIENT, detail);
        }
        String content = result.rawContent() == null ? "" : result.rawContent();
        if (errorPagePredicate.isErrorPage(content)) {
            return PageOutcome.error(page, FetchErrorKind.BACKEND_UNAVAILABLE, "backend_error_page");
        }
        List<ListingRecord> rows;
        try {
            rows = extractor.extract(content);
        } catch (RuntimeException e) {
            return PageOutcome.error(
                page,
                FetchErrorKind.EXTRACTION_FAILED,
                "extraction_failed: " + e.getClass().getSimpleName()
            );
        }
        if (rows == null || rows.isEmpty()) {
            return PageOutcome.empty(page);
        }
        return PageOutcome.ok(page, rows);
    }
}

package com.delta.harvester.harvest.extract;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.harvest.model.ListingRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reads the planned-constructions listing. Tables are mapped by header text; pages without a
 * usable table fall back to label/value parsing of card-like blocks.
 */
@Component
public class JsoupListingExtractor implements RecordExtractor {
    public static final String DETAILS_URL = "details_url";

    private static final Map<String, List<String>> FIELD_LABELS = fieldLabels();
    private static final String CARD_SELECTOR = "article, li, div.card, div.row, div.item";
    private static final int MIN_CARD_TEXT_LENGTH = 40;
    private static final Map<String, String> FIELD_BY_LABEL = fieldByLabel();
    private static final Pattern LABEL_PATTERN = Pattern.compile(
        "(?<!\\p{L})(" + FIELD_BY_LABEL.keySet().stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .map(Pattern::quote)
            .collect(Collectors.joining("|")) + ")\\s*[:\\-]",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
    );

    private final RecordIdentity recordIdentity;
    private final HarvesterProperties properties;
    private final Clock clock;

    public JsoupListingExtractor(RecordIdentity recordIdentity, HarvesterProperties properties, Clock clock) {
        this.recordIdentity = recordIdentity;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public List<ListingRecord> extract(String rawContent) {
        if (rawContent == null || rawContent.isBlank()) {
            return List.of();
        }
        Document document = Jsoup.parse(rawContent, properties.getSource().getBaseUrl());
        Instant extractedAt = clock.instant();

        List<Map<String, String>> rows = fromTable(document);
        if (rows.isEmpty()) {
            rows = fromCards(document);
        }

        Map<String, ListingRecord> byIdentity = new LinkedHashMap<>();
        for (Map<String, String> fields : rows) {
            ListingRecord record = recordIdentity.toRecord(fields, extractedAt);
            byIdentity.put(record.identity(), record);
        }
        return new ArrayList<>(byIdentity.values());
    }

    private List<Map<String, String>> fromTable(Document document) {
        Element table = document.selectFirst("table");
        if (table == null) {
            return List.of();
        }
        List<String> headers = table.select("th").eachText();
        List<Map<String, String>> rows = new ArrayList<>();
        for (Element tr : table.select("tr")) {
            List<String> cells = tr.select("td").eachText();
            if (cells.isEmpty()) {
                continue;
            }
            Map<String, String> fields = new LinkedHashMap<>();
            for (Map.Entry<String, List<String>> entry : FIELD_LABELS.entrySet()) {
                String value = cellFor(headers, cells, entry.getValue());
                if (value != null && !value.isBlank()) {
                    fields.put(entry.getKey(), value.trim());
                }
            }
            if (fields.isEmpty()) {
                continue;
            }
            String link = detailsLink(tr);
            if (link != null) {
                fields.put(DETAILS_URL, link);
            }
            rows.add(fields);
        }
        return rows;
    }

    private List<Map<String, String>> fromCards(Document document) {
        List<Map<String, String>> rows = new ArrayList<>();
        for (Element card : document.select(CARD_SELECTOR)) {
            String text = card.text();
            if (text.length() < MIN_CARD_TEXT_LENGTH) {
                continue;
            }
            Map<String, String> fields = labelledValues(text);
            if (fields.isEmpty()) {
                continue;
            }
            Element anchor = card.selectFirst("a[href]");
            if (anchor != null) {
                fields.put(DETAILS_URL, anchor.absUrl("href"));
            }
            rows.add(fields);
        }
        return rows;
    }

    private String cellFor(List<String> headers, List<String> cells, List<String> labels) {
        for (String label : labels) {
            int index = headers.indexOf(label);
            if (index >= 0 && index < cells.size()) {
                return cells.get(index);
            }
        }
        return null;
    }

    private String detailsLink(Element row) {
        for (Element anchor : row.select("a[href]")) {
            String href = anchor.attr("href");
            if (href.contains("bisp")) {
                String absolute = anchor.absUrl("href");
                return absolute.isBlank() ? href : absolute;
            }
        }
        return null;
    }

    private Map<String, String> labelledValues(String text) {
        Map<String, String> fields = new LinkedHashMap<>();
        Matcher matcher = LABEL_PATTERN.matcher(text);
        String currentField = null;
        int valueStart = -1;
        while (matcher.find()) {
            putValue(fields, currentField, text, valueStart, matcher.start());
            currentField = FIELD_BY_LABEL.get(matcher.group(1).toLowerCase(Locale.ROOT));
            valueStart = matcher.end();
        }
        putValue(fields, currentField, text, valueStart, text.length());
        return fields;
    }

    private void putValue(Map<String, String> fields, String field, String text, int start, int end) {
        if (field == null || start < 0 || fields.containsKey(field)) {
            return;
        }
        String value = text.substring(start, end).replace("|", " ").trim();
        if (!value.isBlank()) {
            fields.put(field, value);
        }
    }

    private static Map<String, List<String>> fieldLabels() {
        Map<String, List<String>> labels = new LinkedHashMap<>();
        labels.put("bis_number", List.of("Lietas numurs", "BIS lietas numurs", "Lietas Nr."));
        labels.put("authority", List.of("Būvniecības kontroles institūcija", "Institūcija", "Būvvalde"));
        labels.put("address", List.of("Būvobjekta adrese", "Adrese"));
        labels.put("object", List.of("Būvobjekts", "Nosaukums", "Objekts"));
        labels.put("phase", List.of("Būvniecības lietas stadija", "Stadija", "Statuss"));
        labels.put("construction_type", List.of("Būvniecības veids", "Veids"));
        labels.put("intention_type", List.of("Ieceres veids", "Ieceres dokumentācija"));
        labels.put("usage_code", List.of("Būves lietošanas veids", "Lietošanas veids", "Lietošanas kods"));
        labels.put("published", List.of("Publicēts", "Datums"));
        return labels;
    }

    private static Map<String, String> fieldByLabel() {
        Map<String, String> byLabel = new LinkedHashMap<>();
        FIELD_LABELS.forEach((field, labels) -> labels.forEach(
            label -> byLabel.put(label.toLowerCase(Locale.ROOT), field)
        ));
        return byLabel;
    }
}

package com.delta.harvester.harvest.fetch;

import com.delta.harvester.config.HarvesterProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
public class PhraseErrorPagePredicate implements ErrorPagePredicate {
    private final List<String> phrases;

    @Autowired
    public PhraseErrorPagePredicate(HarvesterProperties properties) {
        this(properties.getSource().getErrorPagePhrases());
    }

    public PhraseErrorPagePredicate(List<String> phrases) {
        this.phrases = phrases.stream()
            .filter(phrase -> phrase != null && !phrase.isBlank())
            .map(phrase -> phrase.trim().toLowerCase(Locale.ROOT))
            .toList();
    }

    @Override
    public boolean isErrorPage(String content) {
        if (content == null || content.isBlank() || phrases.isEmpty()) {
            return false;
        }
        String lower = content.toLowerCase(Locale.ROOT);
        for (String phrase : phrases) {
            if (lower.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}

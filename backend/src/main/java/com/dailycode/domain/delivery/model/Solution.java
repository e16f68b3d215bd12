package com.dailycode.domain.delivery.model;

import com.dailycode.domain.subscriber.model.Language;

/**
 * Generated solution for one problem in one language.
 */
public record Solution(
        Language language,
        String code,
        String explanation,
        String timeComplexity,
        String spaceComplexity,
        String approach
) {
    public boolean hasCode() {
        return code != null && !code.isBlank();
    }
}

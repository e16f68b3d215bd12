package com.dailycode.domain.delivery.model;

import java.util.List;

/**
 * Light-hearted commentary attached to a solution by the embellish stage.
 */
public record Commentary(String intro, List<String> quips, String outro) {

    public boolean isEmpty() {
        return (intro == null || intro.isBlank())
                && (quips == null || quips.isEmpty())
                && (outro == null || outro.isBlank());
    }
}

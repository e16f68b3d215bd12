package com.dailycode.application.catalog;

import java.util.List;

/**
 * @param source   where the document was read from
 * @param read     entries found in the document
 * @param imported entries written to the catalog
 * @param skipped  identities already in the catalog
 * @param rejected entries that could not be imported, with the reason
 */
public record ImportResult(String source, int read, int imported, List<String> skipped, List<String> rejected) {

    public boolean isEmpty() {
        return read == 0;
    }
}

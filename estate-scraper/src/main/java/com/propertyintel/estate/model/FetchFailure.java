package com.propertyintel.estate.model;

/**
 * A page or probe that could not be turned into records.
 * Probe failures use page 0.
 */
public record FetchFailure(String category, int page, String url, String reason) {

    public boolean isProbe() {
        return page == 0;
    }
}

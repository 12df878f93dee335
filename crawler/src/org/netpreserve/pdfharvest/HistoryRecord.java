package org.netpreserve.pdfharvest;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * @param filename    name of the PDF inside the output directory
 * @param fingerprint SHA-1 of the URL the PDF was saved from
 * @param savedAt     when the PDF was written
 */
public record HistoryRecord(
        String filename,
        @JsonProperty("sha1") String fingerprint,
        @JsonProperty("saved_at") Instant savedAt) {
}

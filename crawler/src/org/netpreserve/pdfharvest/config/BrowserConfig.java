package org.netpreserve.pdfharvest.config;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.util.List;

/**
 * Configuration for the browser used to render pages.
 *
 * @param executable Chrome binary to invoke, null to let Selenium find one
 * @param options    command-line options passed to Chrome
 */
public record BrowserConfig(
        String executable,
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        List<String> options
) {
    public static BrowserConfig defaults() {
        return new BrowserConfig(null, List.of("--headless=new", "--disable-gpu"));
    }
}

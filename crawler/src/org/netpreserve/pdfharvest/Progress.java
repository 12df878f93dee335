package org.netpreserve.pdfharvest;

/**
 * Totals for one job.
 *
 * @param discovered     links admitted to the frontier
 * @param saved          PDFs written
 * @param failed         pages that ended in an error
 * @param robotsExcluded pages skipped because of robots.txt
 * @param rounds         portal extractions performed
 */
public record Progress(long discovered, long saved, long failed, long robotsExcluded, long rounds) {
}

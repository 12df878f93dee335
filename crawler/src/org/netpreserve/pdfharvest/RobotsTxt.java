package org.netpreserve.pdfharvest;

import crawlercommons.robots.BaseRobotRules;
import org.netpreserve.pdfharvest.util.Url;

/**
 * A fetched robots.txt policy. {@code status} is -1 when the fetch itself failed.
 */
public record RobotsTxt(String url, int status, BaseRobotRules rules) {
    public boolean allows(Url url) {
        return rules.isAllowed(url.toString());
    }
}

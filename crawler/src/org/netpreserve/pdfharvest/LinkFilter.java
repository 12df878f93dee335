package org.netpreserve.pdfharvest;

import org.netpreserve.pdfharvest.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides which discovered links become frontier members. A link passes at most once per run.
 */
public class LinkFilter {
    private static final Logger log = LoggerFactory.getLogger(LinkFilter.class);
    private final UrlMatcher.Multi scope;
    private final HistoryStore history;
    private final Set<Url> seen = ConcurrentHashMap.newKeySet();

    public LinkFilter(List<String> prefixes, HistoryStore history) {
        this.scope = new UrlMatcher.Multi(prefixes.stream().map(UrlMatcher.Prefix::new).toList());
        this.history = history;
    }

    public boolean inScope(Url url) {
        return scope.isEmpty() || scope.test(url);
    }

    /**
     * Marks a URL as already scheduled without emitting it.
     */
    public boolean markSeen(Url url) {
        return seen.add(url.withoutFragment());
    }

    /**
     * Returns the links not yet seen this run, not already in the history and within the prefix allow-list,
     * fragment-stripped and in the order given. Every returned link is marked seen.
     */
    public List<Url> filter(Collection<Url> links) {
        var result = new ArrayList<Url>();
        for (Url link : links) {
            if (link == null || !link.isHttp()) continue;
            Url url = link.withoutFragment();
            if (!inScope(url)) {
                log.trace("Out of scope: {}", url);
                continue;
            }
            if (history.contains(url)) continue;
            if (seen.add(url)) {
                result.add(url);
            }
        }
        return result;
    }

    public int seenCount() {
        return seen.size();
    }
}

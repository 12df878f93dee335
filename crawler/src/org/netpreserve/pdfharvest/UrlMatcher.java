package org.netpreserve.pdfharvest;

import org.netpreserve.pdfharvest.util.Url;

import java.util.Collection;
import java.util.NavigableSet;
import java.util.TreeSet;
import java.util.function.Predicate;

public sealed interface UrlMatcher extends Predicate<Url> {
    record Prefix(String prefix) implements UrlMatcher {
        @Override
        public boolean test(Url url) {
            return url.startsWith(prefix);
        }
    }

    /**
     * Matches a URL against any number of prefixes with a single sorted-set lookup walk.
     */
    final class Multi implements UrlMatcher {
        private final NavigableSet<String> prefixes = new TreeSet<>();

        public Multi() {
        }

        public Multi(Collection<? extends UrlMatcher> matchers) {
            for (var matcher : matchers) {
                add(matcher);
            }
        }

        public void add(UrlMatcher matcher) {
            if (matcher instanceof Prefix prefix) {
                prefixes.add(prefix.prefix());
            } else if (matcher instanceof Multi multi) {
                prefixes.addAll(multi.prefixes);
            }
        }

        public boolean isEmpty() {
            return prefixes.isEmpty();
        }

        @Override
        public boolean test(Url url) {
            return containsPrefixOf(prefixes, url.toString());
        }

        /**
         * Returns true if the set contains a string that is a prefix of the given string.
         */
        public static boolean containsPrefixOf(NavigableSet<String> set, String s) {
            String candidate = set.floor(s);
            while (candidate != null) {
                if (s.startsWith(candidate)) {
                    return true;
                }
                candidate = set.lower(candidate);
            }
            return false;
        }
    }
}

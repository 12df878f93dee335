package org.netpreserve.pdfharvest;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.netpreserve.pdfharvest.browser.Interaction;
import org.netpreserve.pdfharvest.util.Url;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Page controls to try, keyed by origin. The {@code "*"} entry applies to every site and is tried after any
 * origin-specific entries.
 *
 * @param dismiss  cookie banners and other overlays to close before saving a page
 * @param nextPage pagination controls
 * @param loadMore "load more" style controls
 */
public record InteractionTable(
        Map<String, List<Interaction>> dismiss,
        @JsonProperty("next_page") Map<String, List<Interaction>> nextPage,
        @JsonProperty("load_more") Map<String, List<Interaction>> loadMore) {
    public static final String DEFAULT_KEY = "*";

    public InteractionTable {
        dismiss = dismiss == null ? Map.of() : dismiss;
        nextPage = nextPage == null ? Map.of() : nextPage;
        loadMore = loadMore == null ? Map.of() : loadMore;
    }

    /**
     * Loads the table bundled with the crawler.
     */
    public static InteractionTable load() throws IOException {
        try (InputStream stream = Objects.requireNonNull(InteractionTable.class.getResourceAsStream("interactions.yaml"),
                "missing interactions.yaml")) {
            return load(stream);
        }
    }

    public static InteractionTable load(InputStream stream) throws IOException {
        return new ObjectMapper(new YAMLFactory()).readValue(stream, InteractionTable.class);
    }

    public List<Interaction> dismissFor(Url url) {
        return resolve(dismiss, url);
    }

    public List<Interaction> nextPageFor(Url url) {
        return resolve(nextPage, url);
    }

    public List<Interaction> loadMoreFor(Url url) {
        return resolve(loadMore, url);
    }

    static List<Interaction> resolve(Map<String, List<Interaction>> entries, Url url) {
        var result = new ArrayList<Interaction>();
        String origin = url.origin();
        if (origin != null) {
            result.addAll(entries.getOrDefault(origin, List.of()));
        }
        result.addAll(entries.getOrDefault(DEFAULT_KEY, List.of()));
        return result;
    }
}

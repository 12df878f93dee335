package org.netpreserve.pdfharvest.browser;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Describes something to do on a page: click the first element matched by a locator, or scroll to the bottom.
 *
 * @param action  what to do
 * @param locator how {@code value} selects an element, null for {@link Action#SCROLL_TO_BOTTOM}
 * @param value   visible text (matched case-insensitively as a substring), a CSS selector or an XPath expression
 */
public record Interaction(Action action, Locator locator, String value) {
    private static final String UPPER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String LOWER = "abcdefghijklmnopqrstuvwxyz";

    public enum Action {
        CLICK, SCROLL_TO_BOTTOM
    }

    public enum Locator {
        TEXT, CSS, XPATH
    }

    public Interaction {
        if (action == Action.CLICK && (locator == null || value == null)) {
            throw new IllegalArgumentException("click needs a locator and a value");
        }
        if (locator == Locator.TEXT) {
            value = value.toLowerCase(Locale.ROOT);
        }
    }

    @JsonCreator
    public static Interaction fromYaml(@JsonProperty("text") String text,
                                @JsonProperty("css") String css,
                                @JsonProperty("xpath") String xpath,
                                @JsonProperty("scroll") Boolean scroll) {
        if (Boolean.TRUE.equals(scroll)) return scrollToBottom();
        if (text != null) return clickText(text);
        if (css != null) return clickCss(css);
        if (xpath != null) return clickXPath(xpath);
        throw new IllegalArgumentException("interaction needs one of: text, css, xpath, scroll");
    }

    public static Interaction clickText(String text) {
        return new Interaction(Action.CLICK, Locator.TEXT, text);
    }

    public static Interaction clickCss(String selector) {
        return new Interaction(Action.CLICK, Locator.CSS, selector);
    }

    public static Interaction clickXPath(String expression) {
        return new Interaction(Action.CLICK, Locator.XPATH, expression);
    }

    public static Interaction scrollToBottom() {
        return new Interaction(Action.SCROLL_TO_BOTTOM, null, null);
    }

    /**
     * XPath matching buttons, links and input buttons whose normalized text contains the value.
     */
    public String textXPath() {
        if (locator != Locator.TEXT) throw new IllegalStateException("not a text locator: " + this);
        String literal = xpathLiteral(value);
        String text = "contains(translate(normalize-space(.), '" + UPPER + "', '" + LOWER + "'), " + literal + ")";
        String inputValue = "contains(translate(normalize-space(@value), '" + UPPER + "', '" + LOWER + "'), " + literal + ")";
        return "//button[" + text + "]" +
               " | //a[" + text + "]" +
               " | //input[(@type='button' or @type='submit') and " + inputValue + "]";
    }

    static String xpathLiteral(String s) {
        if (!s.contains("'")) return "'" + s + "'";
        if (!s.contains("\"")) return "\"" + s + "\"";
        var builder = new StringBuilder("concat(");
        String[] parts = s.split("'", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) builder.append(", \"'\", ");
            builder.append('\'').append(parts[i]).append('\'');
        }
        return builder.append(')').toString();
    }

    @Override
    public String toString() {
        if (action == Action.SCROLL_TO_BOTTOM) return "scroll";
        return "click " + locator.name().toLowerCase(Locale.ROOT) + "=" + value;
    }
}

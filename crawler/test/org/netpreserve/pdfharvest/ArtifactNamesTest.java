package org.netpreserve.pdfharvest;

import org.junit.jupiter.api.Test;
import org.netpreserve.pdfharvest.util.Url;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactNamesTest {
    @Test
    void sanitize() {
        assertEquals("Breaking_News__Markets_rally", ArtifactNames.sanitize("Breaking News: Markets rally"));
        assertEquals("a_b_c", ArtifactNames.sanitize("a/b\\c"));
        assertEquals("what__now", ArtifactNames.sanitize("  what?* now  "));
        assertEquals("page", ArtifactNames.sanitize(""));
        assertEquals("page", ArtifactNames.sanitize("???"));
        assertEquals("page", ArtifactNames.sanitize(null));
        assertEquals("line_one_line_two", ArtifactNames.sanitize("line one\r\nline two"));
    }

    @Test
    void sanitizeTruncatesBeforeTrimming() {
        String title = "x".repeat(49) + " tail";
        assertEquals("x".repeat(49), ArtifactNames.sanitize(title));
        assertEquals(ArtifactNames.MAX_PREFIX_LENGTH, ArtifactNames.sanitize("y".repeat(80)).length());
    }

    @Test
    void truncationKeepsSurrogatePairsWhole() {
        String title = "a".repeat(49) + "\uD83D\uDE00tail";
        String prefix = ArtifactNames.sanitize(title);
        assertEquals("a".repeat(49) + "\uD83D\uDE00", prefix);
        assertEquals(ArtifactNames.MAX_PREFIX_LENGTH, prefix.codePointCount(0, prefix.length()));
        String filename = ArtifactNames.filenameFor(title, "abc");
        assertTrue(filename.codePoints().noneMatch(cp -> Character.isSurrogate((char) cp)));
    }

    @Test
    void fingerprintIsSha1OfUrl() {
        assertEquals("a9993e364706816aba3e25717850c26c9cd0d89d", ArtifactNames.fingerprint(new Url("abc")));
        var url = new Url("https://x.test/a");
        assertEquals(ArtifactNames.fingerprint(url), ArtifactNames.fingerprint(new Url("https://x.test/a")));
        assertNotEquals(ArtifactNames.fingerprint(url), ArtifactNames.fingerprint(new Url("https://x.test/b")));
    }

    @Test
    void filename() {
        assertEquals("Hello__World_abc.pdf", ArtifactNames.filenameFor("Hello: World", "abc"));
        assertEquals("page_abc.pdf", ArtifactNames.filenameFor("", "abc"));
    }
}

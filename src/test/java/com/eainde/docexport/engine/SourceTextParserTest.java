package com.eainde.docexport.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceTextParserTest {

    private final SourceTextParser parser = new SourceTextParser(100);

    @Test
    void splitsTitleAndParagraphs() {
        ParsedText parsed = parser.parse("Report\n\nFirst para.\n\nSecond para.");

        assertThat(parsed.title()).isEqualTo("Report");
        assertThat(parsed.paragraphs()).containsExactly("First para.", "Second para.");
    }

    @Test
    void titleIsFirstNonEmptyLine() {
        ParsedText parsed = parser.parse("\n\n   \n  Heading  \nBody line one\nBody line two");

        assertThat(parsed.title()).isEqualTo("Heading");
        assertThat(parsed.paragraphs()).containsExactly("Body line one\nBody line two");
    }

    @Test
    void longTitleIsTruncated() {
        ParsedText parsed = new SourceTextParser(10).parse("A very long title line indeed\n\nBody");

        assertThat(parsed.title()).isEqualTo("A very lon");
    }

    @Test
    void truncationNeverSplitsASurrogatePair() {
        String title = "a".repeat(9) + "\uD83D\uDE00\uD83D\uDE00 done";

        ParsedText parsed = new SourceTextParser(10).parse(title + "\n\nBody");

        assertThat(parsed.title()).isEqualTo("a".repeat(9) + "\uD83D\uDE00");
        assertThat(parsed.title().codePoints()).noneMatch(cp -> Character.isSurrogate((char) (int) cp));
    }

    @Test
    void windowsLineEndingsAndWhitespaceOnlySeparators() {
        ParsedText parsed = parser.parse("Title\r\n\r\nOne\r\n \t \r\nTwo\r\n\r\n\r\n");

        assertThat(parsed.title()).isEqualTo("Title");
        assertThat(parsed.paragraphs()).containsExactly("One", "Two");
    }

    @Test
    void blankTextHasNoTitleAndNoParagraphs() {
        assertThat(parser.parse("  \n ").hasTitle()).isFalse();
        assertThat(parser.parse(null).paragraphs()).isEmpty();
    }

    @Test
    void titleOnly() {
        ParsedText parsed = parser.parse("Just a title");

        assertThat(parsed.title()).isEqualTo("Just a title");
        assertThat(parsed.paragraphs()).isEmpty();
    }

    @Test
    void rejectsNonPositiveTitleLength() {
        assertThatThrownBy(() -> new SourceTextParser(0)).isInstanceOf(IllegalArgumentException.class);
    }
}

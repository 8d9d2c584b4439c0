package org.ansimark.markup.backend.emit;

import org.ansimark.markup.frontend.parser.ast.Phrase;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Renderer}.
 * Phrases are built by hand with their styles already resolved.
 */
@Tag("unit")
class RendererTest {

    private final Renderer renderer = new Renderer();

    private static Phrase phrase(String text, int open, int close, String code) {
        Phrase phrase = new Phrase(open);
        phrase.close(close, text.substring(open + 1, close));
        phrase.setStyleCode(code);
        return phrase;
    }

    @Test
    void passesTextWithoutPhrasesThrough() {
        String text = "nothing to see";

        assertThat(renderer.render(text, List.of())).isSameAs(text);
    }

    @Test
    void wrapsPhraseAndKeepsSurroundingText() {
        String text = "x <a> y <b>";
        Phrase a = phrase(text, 2, 4, "32");
        Phrase b = phrase(text, 8, 10, "1;4");

        String rendered = renderer.render(text, List.of(a, b));

        assertThat(rendered).isEqualTo("x \u001B[32ma\u001B[0;m y \u001B[1;4mb\u001B[0;m");
    }

    @Test
    void nestedPhraseResetsToItsParentStyle() {
        // Arrange
        String text = "<outer<inner>>";
        Phrase outer = phrase(text, 0, 13, "1");
        outer.addChild(phrase(text, 6, 12, "31"));

        // Act
        String rendered = renderer.render(text, List.of(outer));

        // Assert
        assertThat(rendered).isEqualTo("\u001B[1mouter\u001B[31minner\u001B[0;1m\u001B[0;m");
    }

    @Test
    void rendersEmptyPhrase() {
        String text = "<>";

        assertThat(renderer.render(text, List.of(phrase(text, 0, 1, "7")))).isEqualTo("\u001B[7m\u001B[0;m");
    }

    @Test
    void buildsControlSequences() {
        assertThat(Renderer.start("1;31")).isEqualTo("\u001B[1;31m");
        assertThat(Renderer.reset("")).isEqualTo("\u001B[0;m");
        assertThat(Renderer.reset("32")).isEqualTo("\u001B[0;32m");
    }
}

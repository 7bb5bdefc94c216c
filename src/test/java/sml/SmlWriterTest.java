package sml;

import org.junit.jupiter.api.Test;
import sml.wsv.ColumnAlignment;

import java.nio.file.Files;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SmlWriterTest {

    private static final String EXAMPLE = "src/test/resources/sml/example.sml";
    private static final String EXAMPLE_CUSTOM_END = "src/test/resources/sml/example_custom_end.sml";
    private static final String MESSY = "src/test/resources/sml/messy.sml";
    private static final String MESSY_EXPECTED = "src/test/resources/sml/messy_expected.sml";

    private static final int[] WHITESPACE = {
            0x0009, 0x000A, 0x000B, 0x000C, 0x000D, 0x0020, 0x0085, 0x00A0, 0x1680,
            0x2000, 0x2001, 0x2002, 0x2003, 0x2004, 0x2005, 0x2006, 0x2007, 0x2008, 0x2009, 0x200A,
            0x2028, 0x2029, 0x202F, 0x205F, 0x3000
    };

    @Test
    void writesWithDefaults() throws Exception {
        var expected = Files.readString(Paths.get(EXAMPLE)).stripTrailing();

        assertEquals(expected, Sml.write(SmlParserTest.exampleTree()));
    }

    @Test
    void writesCustomEndKeywordIndentAndRightAlignment() throws Exception {
        var options = SmlWriterOptions.builder()
                .endKeyword("my_custom_end_keyword")
                .indent("        ")
                .alignment(ColumnAlignment.RIGHT)
                .build();
        var expected = Files.readString(Paths.get(EXAMPLE_CUSTOM_END)).stripTrailing();

        assertEquals(expected, new SmlWriter(options).write(SmlParserTest.exampleTree()));
    }

    @Test
    void writesLeftAlignment() {
        var options = SmlWriterOptions.builder().alignment(ColumnAlignment.LEFT).build();
        var video = TreeNode.of(new SmlElement("Video")
                .addAttribute("Resolution", "1280", "720")
                .addAttribute("RefreshRate", "60")
                .addAttribute("Fullscreen", "true"));

        var expected = String.join("\n",
                "Video",
                "    Resolution  1280 720",
                "    RefreshRate 60",
                "    Fullscreen  true",
                "End");
        assertEquals(expected, new SmlWriter(options).write(video));
    }

    @Test
    void writesJaggedAttributesInEveryAlignment() {
        var root = TreeNode.of(new SmlElement("Box")
                .addAttribute("Size", "10", "20")
                .addAttribute("Depth", "5"));

        for (ColumnAlignment alignment : ColumnAlignment.values()) {
            var options = SmlWriterOptions.builder().alignment(alignment).build();
            var text = assertDoesNotThrow(() -> new SmlWriter(options).write(root));
            var lines = text.split("\n");
            assertEquals(3, lines[1].trim().split(" +").length, alignment.name());
            assertEquals(2, lines[2].trim().split(" +").length, alignment.name());
            assertEquals(root, Sml.parse(text), alignment.name());
        }
    }

    @Test
    void writesNullAsDashAndEmptyAsQuotes() {
        var root = TreeNode.of(new SmlElement("Root").addAttribute("Attr", null, "", "-"));

        var text = Sml.write(root);

        assertEquals("Root\n    Attr - \"\" \"-\"\nEnd", text);
        assertEquals(root, Sml.parse(text));
    }

    @Test
    void writesEmptyElement() {
        assertEquals("Root\nEnd", Sml.write(new TreeNode<>(new SmlElement("Root"))));
    }

    @Test
    void normalizesMessyDocument() throws Exception {
        var root = Sml.parse(Files.readString(Paths.get(MESSY)));

        assertEquals(Files.readString(Paths.get(MESSY_EXPECTED)).stripTrailing(), Sml.write(root));
    }

    @Test
    void roundTripsTrickyValues() {
        var root = TreeNode.of(new SmlElement("My Root")
                        .addAttribute("plain", "a", "b", "c")
                        .addAttribute("quoted", "say \"hi\"", "#hash", "tab\there")
                        .addAttribute("lines", "first\nsecond", "\n")
                        .addAttribute("unicode", "a\u3000b", " ", "caf\u00E9")
                        .addAttribute("nulls", null, "", "-", "End"),
                TreeNode.of(new SmlElement(""),
                        TreeNode.of(new SmlElement("deep").addAttribute("x", "1"))),
                TreeNode.of(new SmlElement("-")));

        for (ColumnAlignment alignment : ColumnAlignment.values()) {
            var options = SmlWriterOptions.builder().alignment(alignment).build();
            assertEquals(root, Sml.parse(new SmlWriter(options).write(root)), alignment.name());
        }
    }

    @Test
    void roundTripsWithCustomEndKeyword() {
        var options = SmlWriterOptions.builder().endKeyword("End with spaces").build();
        var parser = new SmlParser(SmlParserOptions.builder().detectEndKeyword(true).build());
        var root = SmlParserTest.exampleTree();

        var text = new SmlWriter(options).write(root);

        assertTrue(text.endsWith("\n\"End with spaces\""));
        assertEquals(root, parser.parse(text));
    }

    @Test
    void writesMinifiedEndKeyword() {
        var options = SmlWriterOptions.builder().endKeyword(null).indent(" ").build();
        var root = TreeNode.of(new SmlElement("Root"), TreeNode.of(new SmlElement("-")));

        var text = new SmlWriter(options).write(root);

        assertEquals("Root\n \"-\"\n -\n-", text);
        assertEquals(root, new SmlParser(SmlParserOptions.builder().endKeyword(null).build()).parse(text));
        assertEquals(text, Sml.write(root, options.toBuilder().endKeyword("").build()));
    }

    @Test
    void acceptsEveryWhitespaceAsIndent() {
        var root = TreeNode.of(new SmlElement("Root"),
                TreeNode.of(new SmlElement("Child").addAttribute("a", "1")));

        for (int cp : WHITESPACE) {
            var indent = new String(Character.toChars(cp));
            var options = SmlWriterOptions.builder().indent(indent + indent).build();
            var text = assertDoesNotThrow(() -> new SmlWriter(options).write(root), String.format("U+%04X", cp));
            assertEquals(root, Sml.parse(text), String.format("U+%04X", cp));
        }
    }

    @Test
    void rejectsIndentWithLetter() {
        var options = SmlWriterOptions.builder().indent("  a").build();

        SmlConfigurationException e = assertThrows(SmlConfigurationException.class, () -> new SmlWriter(options));

        assertEquals(SmlErrorType.INVALID_INDENT, e.getErrorType());
        assertTrue(e.getMessage().contains("U+0061"));
    }

    @Test
    void rejectsEmptyIndent() {
        var options = SmlWriterOptions.builder().indent("").build();

        SmlConfigurationException e = assertThrows(SmlConfigurationException.class, () -> new SmlWriter(options));

        assertEquals(SmlErrorType.INVALID_INDENT, e.getErrorType());
    }

    @Test
    void rejectsNamesCollidingWithEndKeyword() {
        var element = TreeNode.of(new SmlElement("Root"), TreeNode.of(new SmlElement("end")));
        var attribute = TreeNode.of(new SmlElement("Root").addAttribute("END", "1"));

        SmlWriteException e1 = assertThrows(SmlWriteException.class, () -> Sml.write(element));
        SmlWriteException e2 = assertThrows(SmlWriteException.class, () -> Sml.write(attribute));

        assertEquals(SmlErrorType.ELEMENT_HAS_END_KEYWORD_NAME, e1.getErrorType());
        assertEquals(SmlErrorType.ATTRIBUTE_HAS_END_KEYWORD_NAME, e2.getErrorType());
    }

    @Test
    void rejectsAttributeWithoutValues() {
        var root = TreeNode.of(new SmlElement("Root").addAttribute("Lonely"));

        SmlWriteException e = assertThrows(SmlWriteException.class, () -> Sml.write(root));

        assertEquals(SmlErrorType.ATTRIBUTE_WITHOUT_VALUES, e.getErrorType());
    }

    @Test
    void leavesTreeUntouched() {
        var root = SmlParserTest.exampleTree();
        var options = SmlWriterOptions.builder().alignment(ColumnAlignment.RIGHT).build();

        new SmlWriter(options).write(root);

        assertEquals(SmlParserTest.exampleTree(), root);
    }

    @Test
    void writesDeepTreeWithoutRecursion() {
        int depth = 3_000;
        var root = new TreeNode<>(new SmlElement("E"));
        var node = root;
        for (int i = 1; i < depth; i++) {
            var child = new TreeNode<>(new SmlElement("E"));
            node.addChild(child);
            node = child;
        }
        var options = SmlWriterOptions.builder().indent(" ").build();

        var text = new SmlWriter(options).write(root);

        assertEquals(2 * depth, text.split("\n").length);
        assertTrue(text.endsWith("\n End\nEnd"));
    }
}

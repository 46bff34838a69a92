package com.metamodel.generator.codegen.override;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for OverrideParser.
 */
class OverrideParserTest {

    private final OverrideParser parser = new OverrideParser();

    @TempDir
    Path tempDir;

    @Test
    void testParseOverrideWithType() {
        List<String> lines = List.of(
                "override Element.owner: relation_one[Element]",
                "Element.owner = derived(\"owner\", Element)",
                "%%");

        OverrideTable table = parser.parse(lines);

        assertThat(table.hasErrors()).isFalse();
        assertThat(table.hasOverride("Element.owner")).isTrue();
        assertThat(table.getOverride("Element.owner")).isEqualTo("Element.owner = derived(\"owner\", Element)");
        assertThat(table.getType("Element.owner")).contains("relation_one[Element]");
    }

    @Test
    void testParseOverrideWithoutType() {
        List<String> lines = List.of(
                "override Diagram",
                "from modeling.diagram import Diagram",
                "%%");

        OverrideTable table = parser.parse(lines);

        assertThat(table.getOverride("Diagram")).isEqualTo("from modeling.diagram import Diagram");
        assertThat(table.getType("Diagram")).isEmpty();
    }

    @Test
    void testMultiLineBlockKeepsText() {
        List<String> lines = List.of(
                "override Element.note: str",
                "def _note(self):",
                "    # keep me",
                "    return self.body",
                "",
                "Element.note = _note",
                "  %%  ");

        OverrideTable table = parser.parse(lines);

        assertThat(table.getOverride("Element.note")).isEqualTo("""
                def _note(self):
                    # keep me
                    return self.body

                Element.note = _note""");
    }

    @Test
    void testParseHeaderAndComments() {
        List<String> lines = List.of(
                "# overrides for the core model",
                "",
                "header",
                "from modeling.core.element import Element",
                "%%",
                "# trailing comment");

        OverrideTable table = parser.parse(lines);

        assertThat(table.hasErrors()).isFalse();
        assertThat(table.getHeader()).contains("from modeling.core.element import Element");
        assertThat(table.getEntries()).isEmpty();
    }

    @Test
    void testUnknownDirectiveIsError() {
        OverrideTable table = parser.parse(List.of("replace Element.owner"));

        assertThat(table.hasErrors()).isTrue();
        assertThat(table.getErrors().get(0)).contains("Line 1").contains("replace Element.owner");
    }

    @Test
    void testUnterminatedBlockIsError() {
        OverrideTable table = parser.parse(List.of("override Element.owner", "text"));

        assertThat(table.hasErrors()).isTrue();
        assertThat(table.getErrors().get(0)).contains("Element.owner").contains("not terminated");
    }

    @Test
    void testDuplicateKeyLaterWins() {
        List<String> lines = List.of(
                "override A", "first", "%%",
                "override A", "second", "%%");

        OverrideTable table = parser.parse(lines);

        assertThat(table.hasErrors()).isFalse();
        assertThat(table.getOverride("A")).isEqualTo("second");
        assertThat(table.getWarnings()).hasSize(1);
        assertThat(table.getWarnings().get(0)).contains("Duplicate override for 'A'");
    }

    @Test
    void testParseFile() throws IOException {
        Path file = tempDir.resolve("core.override");
        Files.writeString(file, """
                override Element.id: str
                Element.id = _attribute("id", str)
                %%
                """);

        OverrideTable table = parser.parse(file);

        assertThat(table.getEntries()).hasSize(1);
        assertThat(table.getEntries().get(0).getSourceLine()).isEqualTo(1);
    }

    @Test
    void testMissingFileIsError() {
        OverrideTable table = parser.parse(tempDir.resolve("missing.override"));

        assertThat(table.hasErrors()).isTrue();
        assertThat(table.getErrors().get(0)).contains("Failed to read overrides file");
    }
}

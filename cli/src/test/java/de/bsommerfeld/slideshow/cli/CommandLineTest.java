package de.bsommerfeld.slideshow.cli;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineTest {

    @Test
    void parse_shouldSplitCommandOptionsAndFlags() {
        CommandLine cmd = CommandLine.parse(new String[] { "--db", "x.db", "ingest-assets", "--assets-root", "assets",
                "--with-ocr" });

        assertEquals("ingest-assets", cmd.command());
        assertEquals(Optional.of("x.db"), cmd.option("db"));
        assertEquals("assets", cmd.require("assets-root"));
        assertTrue(cmd.flag("with-ocr"));
        assertFalse(cmd.flag("headed"));
    }

    @Test
    void parse_shouldAcceptInlineValues() {
        CommandLine cmd = CommandLine.parse(new String[] { "match-posts", "--threshold=0.25" });

        assertEquals(Optional.of(0.25), cmd.doubleOption("threshold"));
    }

    @Test
    void parse_shouldRejectMissingCommand() {
        assertThrows(UsageException.class, () -> CommandLine.parse(new String[] { "--db", "x.db" }));
    }

    @Test
    void parse_shouldRejectDanglingOption() {
        assertThrows(UsageException.class, () -> CommandLine.parse(new String[] { "make-drafts", "--topic" }));
    }

    @Test
    void parse_shouldRejectSecondPositional() {
        assertThrows(UsageException.class, () -> CommandLine.parse(new String[] { "report", "extra" }));
    }

    @Test
    void require_shouldRejectAbsentOption() {
        CommandLine cmd = CommandLine.parse(new String[] { "export-draft" });

        UsageException e = assertThrows(UsageException.class, () -> cmd.require("draft-id"));
        assertEquals("export-draft requires --draft-id", e.getMessage());
    }

    @Test
    void intOption_shouldReportNonNumericValue() {
        CommandLine cmd = CommandLine.parse(new String[] { "make-drafts", "--count", "many" });

        assertThrows(UsageException.class, () -> cmd.intOption("count"));
    }

    @Test
    void listOption_shouldTrimAndDropBlanks() {
        CommandLine cmd = CommandLine.parse(new String[] { "make-drafts", "--account-scope", " a, ,b " });

        assertEquals(List.of("a", "b"), cmd.listOption("account-scope"));
        assertEquals(List.of(), cmd.listOption("missing"));
    }
}

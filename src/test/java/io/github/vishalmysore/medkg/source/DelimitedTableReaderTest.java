package io.github.vishalmysore.medkg.source;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DelimitedTableReaderTest {

    private static DelimitedTableReader csv(String text) throws IOException {
        return new DelimitedTableReader(new StringReader(text), ',', "test.csv");
    }

    @Test
    void readsHeaderAndRows() throws Exception {
        try (DelimitedTableReader reader = csv("node_index,node_name\n1,asthma\n2,TP53\n")) {
            assertEquals(List.of("node_index", "node_name"), reader.header().getColumns());

            TableRow first = reader.next();
            assertEquals("1", first.text(0));
            assertEquals("asthma", first.text(1));
            assertEquals(2, first.getLineNumber());

            TableRow second = reader.next();
            assertEquals("TP53", second.text(1));
            assertNull(reader.next());
        }
    }

    @Test
    void quotedCellsMayContainDelimitersQuotesAndLineBreaks() throws Exception {
        String text = "id,description\n"
                + "1,\"Aspirin, also \"\"ASA\"\", is\nan NSAID\"\n"
                + "2,plain\n";
        try (DelimitedTableReader reader = csv(text)) {
            TableRow first = reader.next();
            assertEquals("Aspirin, also \"ASA\", is\nan NSAID", first.text(1));
            first.checkWellFormed();

            TableRow second = reader.next();
            assertEquals("plain", second.text(1));
            assertEquals(4, second.getLineNumber());
        }
    }

    @Test
    void skipsBlankLinesAndHandlesCrlf() throws Exception {
        try (DelimitedTableReader reader = csv("a,b\r\n\r\n1,2\r\n\n3,4")) {
            assertEquals("b", reader.header().name(1));
            assertEquals("2", reader.next().text(1));
            assertEquals("4", reader.next().text(1));
            assertNull(reader.next());
        }
    }

    @Test
    void blankAndMissingCellsReadAsNull() throws Exception {
        try (DelimitedTableReader reader = csv("a,b,c\n1,  ,\n2\n")) {
            TableRow first = reader.next();
            assertNull(first.text(1));
            assertNull(first.text(2));

            TableRow shortRow = reader.next();
            shortRow.checkWellFormed();
            assertEquals("2", shortRow.text(0));
            assertNull(shortRow.text(2));
        }
    }

    @Test
    void overlongRowIsMalformed() throws Exception {
        try (DelimitedTableReader reader = csv("a,b\n1,2,3\n")) {
            TableRow row = reader.next();
            RowParseException ex = assertThrows(RowParseException.class, row::checkWellFormed);
            assertEquals(2, ex.getLineNumber());
        }
    }

    @Test
    void unterminatedQuoteIsMalformed() throws Exception {
        try (DelimitedTableReader reader = csv("a,b\n1,\"open")) {
            assertThrows(RowParseException.class, reader.next()::checkWellFormed);
        }
    }

    @Test
    void emptyInputHasNoHeader() {
        assertThrows(TableFormatException.class, () -> csv(""));
    }

    @Test
    void tsvFilesAreTabDelimited(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("nodes.tsv");
        Files.writeString(file, "id\tname\tkind\n7\tasthma, allergic\tDisease\n");

        try (DelimitedTableReader reader = DelimitedTableReader.open(file)) {
            assertEquals("nodes.tsv", reader.header().getTableName());
            TableRow row = reader.next();
            assertEquals("asthma, allergic", row.text(1));
            assertEquals("Disease", row.text(2));
        }
    }

    @Test
    void headerLookupIsCaseInsensitiveWithAliases() throws Exception {
        try (DelimitedTableReader reader = csv("ID,Node_Type\n")) {
            TableHeader header = reader.header();
            assertEquals(0, header.require("node_index", "id"));
            assertEquals(1, header.find("node_type"));
            assertEquals(-1, header.find("node_name"));

            TableFormatException ex = assertThrows(TableFormatException.class,
                    () -> header.require("node_name", "name"));
            assertTrue(ex.getMessage().contains("node_name or name"));
        }
    }
}

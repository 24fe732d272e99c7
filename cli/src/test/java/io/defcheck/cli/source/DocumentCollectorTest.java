package io.defcheck.cli.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.defcheck.core.model.SourceDocument;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("DocumentCollector")
class DocumentCollectorTest {

    @TempDir
    Path dir;

    @Nested
    @DisplayName("collect")
    class Collect {

        @Test
        @DisplayName("scans *.json files sorted by name")
        void scansDirectory() throws Exception {
            Files.writeString(dir.resolve("b.json"), "{}");
            Files.writeString(dir.resolve("a.json"), "{}");
            Files.writeString(dir.resolve("readme.txt"), "ignored");
            Files.createDirectory(dir.resolve("nested.json"));

            List<Path> files = DocumentCollector.collect(List.of(), dir);

            assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("a.json", "b.json");
        }

        @Test
        @DisplayName("explicit files bypass the directory")
        void explicitFiles() {
            List<Path> explicit = List.of(Path.of("x.json"), Path.of("y.json"));

            assertThat(DocumentCollector.collect(explicit, dir.resolve("missing"))).isEqualTo(explicit);
        }

        @Test
        @DisplayName("missing directory → DocumentSourceException")
        void missingDirectory() {
            Path missing = dir.resolve("missing");

            assertThatThrownBy(() -> DocumentCollector.collect(List.of(), missing))
                    .isInstanceOf(DocumentSourceException.class)
                    .hasMessageContaining("not found");
        }

        @Test
        @DisplayName("directory without documents → DocumentSourceException")
        void emptyDirectory() {
            assertThatThrownBy(() -> DocumentCollector.collect(List.of(), dir))
                    .isInstanceOf(DocumentSourceException.class)
                    .hasMessageContaining("No JSON files");
        }
    }

    @Nested
    @DisplayName("read")
    class Read {

        @Test
        @DisplayName("valid JSON is parsed, id is the file name")
        void validDocument() throws Exception {
            Path file = dir.resolve("item.json");
            Files.writeString(file, "{\"TradeItem\":{\"GTIN\":\"123\"}}");

            SourceDocument document = DocumentCollector.read(file);

            assertThat(document.id()).isEqualTo("item.json");
            assertThat(document.isParsed()).isTrue();
            assertThat(document.content().at("/TradeItem/GTIN").asText()).isEqualTo("123");
        }

        @Test
        @DisplayName("malformed JSON becomes an unparseable document")
        void malformedDocument() throws Exception {
            Path file = dir.resolve("broken.json");
            Files.writeString(file, "{\"TradeItem\": ");

            SourceDocument document = DocumentCollector.read(file);

            assertThat(document.isParsed()).isFalse();
            assertThat(document.parseError()).isNotBlank();
        }

        @Test
        @DisplayName("content after the first JSON value becomes an unparseable document")
        void trailingContent() throws Exception {
            Path file = dir.resolve("trailing.json");
            Files.writeString(file, "{\"TradeItem\": {}} }garbage");

            SourceDocument document = DocumentCollector.read(file);

            assertThat(document.isParsed()).isFalse();
            assertThat(document.content()).isNull();
            assertThat(document.parseError()).isNotBlank();
        }

        @Test
        @DisplayName("empty file becomes an unparseable document")
        void emptyDocument() throws Exception {
            Path file = dir.resolve("empty.json");
            Files.writeString(file, "");

            assertThat(DocumentCollector.read(file).isParsed()).isFalse();
        }

        @Test
        @DisplayName("readAll keeps the input order")
        void readAllKeepsOrder() throws Exception {
            Path first = dir.resolve("z.json");
            Path second = dir.resolve("a.json");
            Files.writeString(first, "{}");
            Files.writeString(second, "[]");

            assertThat(DocumentCollector.readAll(List.of(first, second)))
                    .extracting(SourceDocument::id)
                    .containsExactly("z.json", "a.json");
        }
    }
}

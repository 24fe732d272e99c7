package io.defcheck.core.engine;

import static io.defcheck.core.testkit.TestSchemas.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.defcheck.core.error.DefinitionNotFoundException;
import io.defcheck.core.model.DocumentLayout;
import io.defcheck.core.model.Issue;
import io.defcheck.core.model.IssueCategory;
import io.defcheck.core.model.Schema;
import io.defcheck.core.model.SourceDocument;
import io.defcheck.core.model.ValidationResult;
import io.defcheck.core.schema.SchemaIndex;
import io.defcheck.core.testkit.TestSchemas;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link ValidationRunner}: entry points, parse errors and run aggregation. */
@DisplayName("ValidationRunner")
class ValidationRunnerTest {

    private Schema schema;
    private ValidationRunner runner;

    @BeforeEach
    void setUp() {
        schema = TestSchemas.firstbase();
        runner = ValidationRunner.forSchema(
                schema, DocumentLayout.firstbase(), ValidationMode.LENIENT, SchemaIndex.DEFAULT_PREFERRED_MARKER);
    }

    @Nested
    @DisplayName("Entry points")
    class EntryPoints {

        @Test
        @DisplayName("root definition resolves to the Standard entity")
        void rootDefinitionResolved() {
            assertThat(runner.rootDefinition()).isEqualTo("GS1.Standard.TradeItem");
        }

        @Test
        @DisplayName("root entity, child links and nested entities are validated in order")
        void childLinksAndNestedEntities() {
            List<Issue> issues = runner.validateDocument(json("""
                    {
                      "TradeItem": {"GTIN": "1", "Colour": "red"},
                      "CatalogueItemChildItemLink": [
                        {"Quantity": "2", "CatalogueItem": {"TradeItem": {"Quantity": true}}},
                        {"Quantity": 1, "Extra": 1}
                      ]
                    }
                    """));

            assertThat(issues)
                    .extracting(Issue::category, Issue::path)
                    .containsExactly(
                            tuple(IssueCategory.UNKNOWN_FIELD, "TradeItem.Colour"),
                            tuple(IssueCategory.TYPE_MISMATCH, "CatalogueItemChildItemLink[0].Quantity"),
                            tuple(
                                    IssueCategory.TYPE_MISMATCH,
                                    "CatalogueItemChildItemLink[0].CatalogueItem.TradeItem.Quantity"),
                            tuple(IssueCategory.UNKNOWN_FIELD, "CatalogueItemChildItemLink[1].Extra"));
            assertThat(issues.get(3).message()).isEqualTo("not in 'CatalogueItemChildItemLink' (has 2 properties)");
        }

        @Test
        @DisplayName("document without the root key is validated as the entity itself")
        void missingRootKey_wholeDocument() {
            List<Issue> issues = runner.validateDocument(json("{\"GTIN\": 5}"));

            assertThat(issues)
                    .extracting(Issue::path, Issue::message)
                    .containsExactly(tuple("TradeItem.GTIN", "expected string, got integer"));
        }

        @Test
        @DisplayName("child links are skipped when their definition is not in the schema")
        void unknownChildDefinition_skipped() {
            DocumentLayout layout = new DocumentLayout(
                    "TradeItem", "TradeItem", "CatalogueItemChildItemLink", "NoSuchLink", List.of("CatalogueItem"));
            ValidationRunner custom = new ValidationRunner(StructuralValidator.forSchema(schema), layout);

            List<Issue> issues = custom.validateDocument(json("""
                    {"TradeItem": {}, "CatalogueItemChildItemLink": [{"Bogus": 1}]}
                    """));

            assertThat(issues).isEmpty();
        }

        @Test
        @DisplayName("missing root definition fails fast")
        void missingRootDefinition_throws() {
            assertThatThrownBy(() -> new ValidationRunner(
                            StructuralValidator.forSchema(schema), DocumentLayout.rootOnly("Order", "Order")))
                    .isInstanceOf(DefinitionNotFoundException.class)
                    .satisfies(e -> {
                        DefinitionNotFoundException dnf = (DefinitionNotFoundException) e;
                        assertThat(dnf.definitionName()).isEqualTo("Order");
                        assertThat(dnf.source()).isEqualTo(TestSchemas.FIRSTBASE);
                    });
        }
    }

    @Nested
    @DisplayName("Runs")
    class Runs {

        @Test
        @DisplayName("unparseable document yields exactly one PARSE_ERROR")
        void parseError() {
            ValidationResult result = runner.run(List.of(
                    SourceDocument.unparseable("broken.json", "Unexpected character ('}' (code 125))"),
                    SourceDocument.parsed("ok.json", json("{\"TradeItem\": {\"GTIN\": \"1\"}}"))));

            assertThat(result.issuesFor("broken.json"))
                    .extracting(Issue::category, Issue::path, Issue::message)
                    .containsExactly(
                            tuple(IssueCategory.PARSE_ERROR, "", "Unexpected character ('}' (code 125))"));
            assertThat(result.issuesFor("ok.json")).isEmpty();
            assertThat(result.isSuccess()).isFalse();
        }

        @Test
        @DisplayName("all valid documents → success")
        void allValid() {
            ValidationResult result = runner.run(List.of(
                    SourceDocument.parsed("a.json", json("{\"TradeItem\": {\"Status\": \"ACTIVE\"}}")),
                    SourceDocument.parsed("b.json", json("{\"TradeItem\": {\"Unit\": {\"Value\": \"EA\"}}}"))));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.validCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("parallel run keeps input order and matches the sequential result")
        void parallelRun_matchesSequential() {
            List<SourceDocument> documents = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                String body = i % 3 == 0 ? "{\"TradeItem\": {\"Quantity\": \"n" + i + "\"}}" : "{\"TradeItem\": {}}";
                documents.add(SourceDocument.parsed("doc-" + i + ".json", json(body)));
            }

            ExecutorService executor = Executors.newFixedThreadPool(4);
            try {
                ValidationResult parallel = runner.run(documents, executor);
                ValidationResult sequential = runner.run(documents);

                assertThat(parallel.issuesByDocument()).containsExactlyEntriesOf(sequential.issuesByDocument());
                assertThat(parallel.invalidCount()).isEqualTo(14);
            } finally {
                executor.shutdownNow();
            }
        }
    }
}

package io.defcheck.core.schema;

import static org.assertj.core.api.Assertions.assertThat;

import io.defcheck.core.model.Definition;
import io.defcheck.core.model.Schema;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link SchemaIndex}: short names and namespace preference. */
@DisplayName("SchemaIndex")
class SchemaIndexTest {

    private static Schema schemaOf(String... names) {
        Map<String, Definition> definitions = new LinkedHashMap<>();
        for (String name : names) {
            definitions.put(name, new Definition(name, Map.of(), List.of()));
        }
        return new Schema("test", definitions);
    }

    @Test
    @DisplayName("empty schema yields empty index")
    void emptySchema() {
        SchemaIndex index = SchemaIndex.build(Schema.empty());

        assertThat(index.isEmpty()).isTrue();
        assertThat(index.lookup("Anything")).isNull();
    }

    @Test
    @DisplayName("short name is the segment after the last dot")
    void shortNames() {
        SchemaIndex index = SchemaIndex.build(schemaOf("A.B.TradeItem", "Plain"));

        assertThat(index.lookup("TradeItem")).isEqualTo("A.B.TradeItem");
        assertThat(index.lookup("Plain")).isEqualTo("Plain");
        assertThat(index.lookup("B.TradeItem")).isNull();
        assertThat(index.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Standard definition wins regardless of insertion order")
    void standardPreferred_orderIndependent() {
        SchemaIndex standardLast = SchemaIndex.build(schemaOf("Ns.Local.TradeItem", "Ns.Standard.TradeItem"));
        SchemaIndex standardFirst = SchemaIndex.build(schemaOf("Ns.Standard.TradeItem", "Ns.Local.TradeItem"));

        assertThat(standardLast.lookup("TradeItem")).isEqualTo("Ns.Standard.TradeItem");
        assertThat(standardFirst.lookup("TradeItem")).isEqualTo("Ns.Standard.TradeItem");
    }

    @Test
    @DisplayName("without a marked candidate the first one seen is kept")
    void firstSeenWithoutMarker() {
        SchemaIndex index = SchemaIndex.build(schemaOf("One.Brand", "Two.Brand"));

        assertThat(index.lookup("Brand")).isEqualTo("One.Brand");
    }

    @Test
    @DisplayName("custom marker")
    void customMarker() {
        SchemaIndex index = SchemaIndex.build(schemaOf("Standard.Item", "Extended.Item"), "Extended");

        assertThat(index.lookup("Item")).isEqualTo("Extended.Item");
        assertThat(index.preferredMarker()).isEqualTo("Extended");
    }
}

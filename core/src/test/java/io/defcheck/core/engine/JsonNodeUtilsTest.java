package io.defcheck.core.engine;

import static io.defcheck.core.testkit.TestSchemas.json;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link JsonNodeUtils}. */
@DisplayName("JsonNodeUtils")
class JsonNodeUtilsTest {

    private static List<JsonNode> values(String arrayJson) {
        List<JsonNode> values = new ArrayList<>();
        json(arrayJson).forEach(values::add);
        return values;
    }

    @Test
    void isPresent_treatsNullAndMissingAsAbsent() {
        assertThat(JsonNodeUtils.isPresent(null)).isFalse();
        assertThat(JsonNodeUtils.isPresent(NullNode.getInstance())).isFalse();
        assertThat(JsonNodeUtils.isPresent(MissingNode.getInstance())).isFalse();
        assertThat(JsonNodeUtils.isPresent(json("\"\""))).isTrue();
        assertThat(JsonNodeUtils.isPresent(json("0"))).isTrue();
    }

    @Test
    void enumContains_comparesNumbersByValue() {
        List<JsonNode> allowed = values("[1, 2.5, \"3\"]");

        assertThat(JsonNodeUtils.enumContains(allowed, json("1.0"))).isTrue();
        assertThat(JsonNodeUtils.enumContains(allowed, json("2.50"))).isTrue();
        assertThat(JsonNodeUtils.enumContains(allowed, json("3"))).isFalse();
        assertThat(JsonNodeUtils.enumContains(allowed, json("\"3\""))).isTrue();
        assertThat(JsonNodeUtils.enumContains(allowed, json("\"1\""))).isFalse();
    }

    @Test
    void formatAllowed_truncatesAfterSix() {
        assertThat(JsonNodeUtils.formatAllowed(values("[\"A\", 2]"))).isEqualTo("['A', 2]");
        assertThat(JsonNodeUtils.formatAllowed(values("[1, 2, 3, 4, 5, 6]"))).isEqualTo("[1, 2, 3, 4, 5, 6]");
        assertThat(JsonNodeUtils.formatAllowed(values("[1, 2, 3, 4, 5, 6, 7]")))
                .isEqualTo("[1, 2, 3, 4, 5, 6]...");
    }

    @Test
    void display_showsTextRawAndOtherNodesAsJson() {
        assertThat(JsonNodeUtils.display(json("\"PENDING\""))).isEqualTo("PENDING");
        assertThat(JsonNodeUtils.display(json("{\"a\": 1}"))).isEqualTo("{\"a\":1}");
        assertThat(JsonNodeUtils.display(json("7"))).isEqualTo("7");
    }

    @Test
    void observedTypeName_distinguishesIntegersFromFractions() {
        assertThat(JsonNodeUtils.observedTypeName(json("1"))).isEqualTo("integer");
        assertThat(JsonNodeUtils.observedTypeName(json("1.0"))).isEqualTo("number");
        assertThat(JsonNodeUtils.observedTypeName(json("null"))).isEqualTo("null");
    }
}

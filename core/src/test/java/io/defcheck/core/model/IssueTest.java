package io.defcheck.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link Issue} and its normalized path. */
@DisplayName("Issue")
class IssueTest {

    @Test
    @DisplayName("array indices become wildcards")
    void normalizedPath_replacesIndices() {
        Issue issue = new Issue(IssueCategory.INVALID_ENUM, "TradeItem.Items[3].Codes[12].Value", "bad");

        assertThat(issue.normalizedPath()).isEqualTo("TradeItem.Items[*].Codes[*].Value");
    }

    @Test
    @DisplayName("different indices normalize to the same path")
    void normalizedPath_groupsIndices() {
        assertThat(Issue.normalize("Items[0].X")).isEqualTo(Issue.normalize("Items[17].X"));
    }

    @Test
    @DisplayName("normalization is idempotent")
    void normalizedPath_idempotent() {
        String once = Issue.normalize("A[1].B[22][3]");

        assertThat(once).isEqualTo("A[*].B[*][*]");
        assertThat(Issue.normalize(once)).isEqualTo(once);
    }

    @Test
    @DisplayName("non-numeric brackets are left alone")
    void normalizedPath_ignoresNonNumeric() {
        assertThat(Issue.normalize("A[x].B[]")).isEqualTo("A[x].B[]");
    }

    @Test
    void patternKeyAndToString() {
        Issue issue = new Issue(IssueCategory.UNKNOWN_FIELD, "L[2].Foo", "not in 'L' (has 3 properties)");

        assertThat(issue.patternKey()).isEqualTo("UNKNOWN_FIELD L[*].Foo: not in 'L' (has 3 properties)");
        assertThat(issue).hasToString("UNKNOWN_FIELD L[2].Foo: not in 'L' (has 3 properties)");
    }

    @Test
    void rejectsNulls() {
        assertThatThrownBy(() -> new Issue(null, "", "m")).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new Issue(IssueCategory.PARSE_ERROR, null, "m"))
                .isInstanceOf(NullPointerException.class);
    }
}

package com.argus.validation.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubmissionTest {

    @Test
    @DisplayName("Should keep null values and report them as present keys")
    void shouldKeepNullValues() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("nickname", null);
        fields.put("email", "a@b.com");

        Submission submission = Submission.of(fields);

        assertThat(submission.containsKey("nickname")).isTrue();
        assertThat(submission.get("nickname")).isNull();
        assertThat(submission.get("email")).isEqualTo("a@b.com");
        assertThat(submission.containsKey("missing")).isFalse();
    }

    @Test
    @DisplayName("Should not see later changes to the source map")
    void shouldCopyTopLevelMap() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("email", "a@b.com");
        Submission submission = Submission.of(fields);

        fields.put("email", "changed");
        fields.put("extra", "x");

        assertThat(submission.get("email")).isEqualTo("a@b.com");
        assertThat(submission.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should expose a read-only view")
    void shouldBeReadOnly() {
        Submission submission = Submission.of(Map.of("a", "1"));

        assertThatThrownBy(() -> submission.asMap().put("b", "2"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should treat null map as empty submission")
    void shouldTreatNullAsEmpty() {
        assertThat(Submission.of(null).isEmpty()).isTrue();
        assertThat(Submission.of(null)).isSameAs(Submission.empty());
    }

    @Test
    @DisplayName("Should parse nested JSON into maps and lists")
    void shouldParseNestedJson() {
        Submission submission = Submission.fromJson("""
                {
                  "user": {"name": "ada", "tags": ["x", "y"]},
                  "DBGroup": "reporting",
                  "age": 36
                }
                """);

        assertThat(submission.get("user")).isInstanceOf(Map.class);
        @SuppressWarnings("unchecked")
        Map<String, Object> user = (Map<String, Object>) submission.get("user");
        assertThat(user.get("tags")).isEqualTo(List.of("x", "y"));
        assertThat(submission.get("age")).isEqualTo(36);
    }

    @Test
    @DisplayName("Should reject JSON that is not an object")
    void shouldRejectNonObjectJson() {
        assertThatThrownBy(() -> Submission.fromJson("[1, 2]"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should read the connection group from the reserved key")
    void shouldReadConnectionGroup() {
        Submission submission = Submission.of(Map.of("DBGroup", " reporting ", "blank", "  "));

        assertThat(submission.connectionGroup("DBGroup")).isEqualTo("reporting");
        assertThat(submission.connectionGroup("blank")).isNull();
        assertThat(submission.connectionGroup("other")).isNull();
    }
}

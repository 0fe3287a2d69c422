package com.nevis.hybrid.model;

import com.nevis.hybrid.exception.FilterException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetadataFilterTest {

    private final Map<String, MetadataValue> metadata = MetadataValue.fromMap(Map.of(
        "type", "article",
        "year", 2024,
        "published", true,
        "tags", java.util.List.of("ai", "search"),
        "author", Map.of("name", "Ann", "team", Map.of("id", 7))
    ));

    @Test
    @DisplayName("An empty filter matches everything")
    void emptyFilter() {
        assertThat(MetadataFilter.none().isEmpty()).isTrue();
        assertThat(MetadataFilter.none().matches(metadata)).isTrue();
        assertThat(MetadataFilter.none().matches(Map.of())).isTrue();
    }

    @Nested
    @DisplayName("Equals")
    class Equals {

        @Test
        void matchesScalars() {
            MetadataFilter filter = MetadataFilter.builder()
                .equalTo("type", MetadataValue.of("article"))
                .equalTo("published", MetadataValue.of(true))
                .build();

            assertThat(filter.matches(metadata)).isTrue();
        }

        @Test
        @DisplayName("Numbers compare by value")
        void numbersCompareByValue() {
            MetadataFilter filter = MetadataFilter.builder().equalTo("year", MetadataValue.of(2024.0)).build();

            assertThat(filter.matches(metadata)).isTrue();
        }

        @Test
        @DisplayName("Dotted paths walk nested maps")
        void dottedPath() {
            assertThat(MetadataFilter.builder().equalTo("author.name", MetadataValue.of("Ann")).build()
                .matches(metadata)).isTrue();
            assertThat(MetadataFilter.builder().equalTo("author.team.id", MetadataValue.of(7)).build()
                .matches(metadata)).isTrue();
            assertThat(MetadataFilter.builder().equalTo("author.name", MetadataValue.of("Bob")).build()
                .matches(metadata)).isFalse();
        }

        @Test
        @DisplayName("All conditions must hold")
        void conjunction() {
            MetadataFilter filter = MetadataFilter.builder()
                .equalTo("type", MetadataValue.of("article"))
                .equalTo("year", MetadataValue.of(1999))
                .build();

            assertThat(filter.matches(metadata)).isFalse();
        }

        @Test
        @DisplayName("A missing path never matches, not even against null")
        void missingPath() {
            assertThat(MetadataFilter.builder().equalTo("missing", MetadataValue.nullValue()).build()
                .matches(metadata)).isFalse();
            assertThat(MetadataFilter.builder().equalTo("type.inner", MetadataValue.of("x")).build()
                .matches(metadata)).isFalse();
        }

        @Test
        @DisplayName("A stored JSON null matches a null value")
        void explicitNull() {
            Map<String, MetadataValue> withNull = Map.of("reviewer", MetadataValue.nullValue());

            assertThat(MetadataFilter.builder().equalTo("reviewer", null).build().matches(withNull)).isTrue();
        }
    }

    @Nested
    @DisplayName("Contains")
    class Contains {

        @Test
        @DisplayName("A list contains one of its elements")
        void listContainsScalar() {
            assertThat(MetadataFilter.builder().contains("tags", MetadataValue.of("ai")).build()
                .matches(metadata)).isTrue();
            assertThat(MetadataFilter.builder().contains("tags", MetadataValue.of("ml")).build()
                .matches(metadata)).isFalse();
        }

        @Test
        @DisplayName("A list contains a list of its elements in any order")
        void listContainsList() {
            MetadataValue wanted = MetadataValue.list(MetadataValue.of("search"), MetadataValue.of("ai"));

            assertThat(MetadataFilter.builder().contains("tags", wanted).build().matches(metadata)).isTrue();
        }

        @Test
        @DisplayName("A map contains a partial map")
        void mapContainsSubMap() {
            MetadataValue wanted = MetadataValue.from(Map.of("team", Map.of("id", 7)));

            assertThat(MetadataFilter.builder().contains("author", wanted).build().matches(metadata)).isTrue();
            assertThat(MetadataFilter.builder().contains("author", MetadataValue.from(Map.of("name", "Bob"))).build()
                .matches(metadata)).isFalse();
        }

        @Test
        @DisplayName("A scalar contains only an equal scalar")
        void scalarContainsScalar() {
            assertThat(MetadataFilter.builder().contains("type", MetadataValue.of("article")).build()
                .matches(metadata)).isTrue();
            assertThat(MetadataFilter.builder().contains("type", MetadataValue.of("art")).build()
                .matches(metadata)).isFalse();
        }
    }

    @Nested
    @DisplayName("Malformed filters")
    class Malformed {

        @ParameterizedTest
        @ValueSource(strings = {"", "  ", "author.", ".name", "a..b"})
        void rejectsBadPaths(String path) {
            assertThatThrownBy(() -> MetadataFilter.builder().equalTo(path, MetadataValue.of("x")))
                .isInstanceOf(FilterException.class);
        }

        @Test
        void rejectsMissingOperator() {
            assertThatThrownBy(() -> MetadataFilter.builder().add("type", null, MetadataValue.of("x")))
                .isInstanceOf(FilterException.class)
                .hasMessageContaining("operator");
        }

        @Test
        void rejectsDeepPaths() {
            String path = String.join(".", java.util.Collections.nCopies(17, "k"));

            assertThatThrownBy(() -> MetadataFilter.builder().equalTo(path, MetadataValue.of("x")))
                .isInstanceOf(FilterException.class)
                .hasMessageContaining("nested too deeply");
        }
    }

    @Test
    void equalsAllBuildsEqualityConditions() {
        MetadataFilter filter = MetadataFilter.equalsAll(Map.of("type", MetadataValue.of("article")));

        assertThat(filter.conditions()).singleElement()
            .satisfies(condition -> assertThat(condition.operator()).isEqualTo(MetadataFilter.Operator.EQUALS));
        assertThat(filter.matches(metadata)).isTrue();
    }
}

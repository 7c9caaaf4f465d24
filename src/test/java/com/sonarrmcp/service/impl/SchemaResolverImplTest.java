package com.sonarrmcp.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sonarrmcp.SonarrFixtures;
import com.sonarrmcp.exception.ToolNotFoundException;
import com.sonarrmcp.model.CatalogIndex;
import com.sonarrmcp.model.ToolDescriptor;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class SchemaResolverImplTest {

    private static CatalogIndex index;

    private final SchemaResolverImpl schemaResolver = new SchemaResolverImpl();

    @BeforeAll
    static void loadCatalog() {
        index = SonarrFixtures.sonarrCatalog();
    }

    @Test
    void resolve_shouldReturnTheIndexedDescriptor() {
        ToolDescriptor tool = schemaResolver.resolve(index, "get_series");

        assertThat(tool).isSameAs(index.find("get_series").orElseThrow());
        assertThat(tool.getParameters()).hasSize(1);
    }

    @Test
    void resolve_shouldFailForUnknownTools() {
        assertThatThrownBy(() -> schemaResolver.resolve(index, "get_movies"))
                .isInstanceOf(ToolNotFoundException.class)
                .hasMessageContaining("get_movies")
                .hasMessageContaining("discover_tools")
                .extracting(e -> ((ToolNotFoundException) e).getToolName())
                .isEqualTo("get_movies");
    }

    @Test
    @SuppressWarnings("unchecked")
    void inputSchema_shouldDescribeEveryParameter() {
        Map<String, Object> schema = schemaResolver.inputSchema(schemaResolver.resolve(index, "search_series"));

        assertThat(schema).containsEntry("type", "object");
        assertThat(schema.get("required")).isEqualTo(List.of("term"));
        Map<String, Object> term = (Map<String, Object>) ((Map<String, Object>) schema.get("properties")).get("term");
        assertThat(term)
                .containsEntry("type", "string")
                .containsEntry("description", "Title or tvdb:<id> to search for");
    }

    @Test
    void inputSchema_shouldHaveNoRequiredFieldsForParameterlessTools() {
        Map<String, Object> schema = schemaResolver.inputSchema(schemaResolver.resolve(index, "get_quality_profiles"));

        assertThat((Map<?, ?>) schema.get("properties")).isEmpty();
        assertThat((Iterable<?>) schema.get("required")).isEmpty();
    }
}

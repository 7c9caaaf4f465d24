package com.sonarrmcp.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.sonarrmcp.config.GatewayProperties;
import com.sonarrmcp.exception.ToolGatewayException;
import com.sonarrmcp.model.ToolDescriptor;
import java.util.List;
import java.util.TreeSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JsonPathResponseSimplifierTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private GatewayProperties properties;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getSimplification().getDefaults().setDropPaths(List.of("$..images", "$..links"));

        GatewayProperties.Policy series = new GatewayProperties.Policy();
        series.setDropPaths(List.of("$..alternateTitles"));
        series.setMaxStringLength(20);
        properties.getSimplification().getCategories().put("Series", series);

        GatewayProperties.Policy queue = new GatewayProperties.Policy();
        queue.setDropPaths(List.of("$.page", "$.pageSize"));
        properties.getSimplification().getCategories().put("queue", queue);
    }

    private static ToolDescriptor tool(String name, String... tags) {
        return ToolDescriptor.builder()
                .name(name)
                .method("GET")
                .path("/api/v3/" + name)
                .parameters(List.of())
                .tags(new TreeSet<>(List.of(tags)))
                .build();
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text.replace('\'', '"'));
    }

    @Test
    void simplify_shouldApplyDefaultsToEveryTool() throws Exception {
        JsonNode payload = json("[{'id':1,'images':[{'url':'a'}],'nested':{'links':['x'],'keep':true}}]");

        JsonNode result = new JsonPathResponseSimplifier(properties).simplify(tool("get_ping", "ping"), payload);

        assertThat(result).isEqualTo(json("[{'id':1,'nested':{'keep':true}}]"));
    }

    @Test
    void simplify_shouldMergeCategoryPolicies() throws Exception {
        JsonNode payload = json("{'title':'The Expanse','overview':'A thriller set two hundred years in the future',"
                + "'alternateTitles':[{'title':'Leviathan Wakes'}],'images':[],'seasons':[{'title':'Season 1'}]}");

        JsonNode result = new JsonPathResponseSimplifier(properties).simplify(tool("get_series", "series"), payload);

        assertThat(result.has("alternateTitles")).isFalse();
        assertThat(result.has("images")).isFalse();
        assertThat(result.get("title").asText()).isEqualTo("The Expanse");
        assertThat(result.get("overview").asText()).isEqualTo("A thriller set two h...");
        assertThat(result.at("/seasons/0/title").asText()).isEqualTo("Season 1");
    }

    @Test
    void simplify_shouldTruncateStringsInsideArrays() throws Exception {
        JsonNode payload = json("{'genres':['Science Fiction and Fantasy','Drama']}");

        JsonNode result = new JsonPathResponseSimplifier(properties).simplify(tool("get_series", "series"), payload);

        assertThat(result.at("/genres/0").asText()).isEqualTo("Science Fiction and ...");
        assertThat(result.at("/genres/1").asText()).isEqualTo("Drama");
    }

    @Test
    void simplify_shouldUseTheSmallestPositiveLength() throws Exception {
        properties.getSimplification().getDefaults().setMaxStringLength(10);
        JsonNode payload = json("{'title':'Battlestar Galactica'}");

        JsonNode series = new JsonPathResponseSimplifier(properties).simplify(tool("get_series", "series"), payload);
        JsonNode queue = new JsonPathResponseSimplifier(properties).simplify(tool("get_queue", "queue"), payload);

        assertThat(series.get("title").asText()).isEqualTo("Battlestar...");
        assertThat(queue.get("title").asText()).isEqualTo("Battlestar...");
    }

    @Test
    void simplify_shouldLeaveTheInputUntouched() throws Exception {
        JsonNode payload = json("{'page':1,'pageSize':10,'records':[{'id':3,'images':[]}]}");
        JsonNode original = payload.deepCopy();

        JsonNode result = new JsonPathResponseSimplifier(properties).simplify(tool("get_queue", "queue"), payload);

        assertThat(payload).isEqualTo(original);
        assertThat(result).isEqualTo(json("{'records':[{'id':3}]}"));
    }

    @Test
    void simplify_missingPaths_shouldBeIgnored() throws Exception {
        JsonNode payload = json("{'records':[]}");

        JsonNode result = new JsonPathResponseSimplifier(properties).simplify(tool("get_queue", "queue"), payload);

        assertThat(result).isEqualTo(payload);
    }

    @Test
    void simplify_withoutPolicies_shouldReturnThePayloadAsIs() throws Exception {
        JsonNode payload = json("{'images':['a']}");

        JsonNode result = new JsonPathResponseSimplifier(new GatewayProperties())
                .simplify(tool("get_series", "series"), payload);

        assertThat(result).isSameAs(payload);
    }

    @Test
    void simplify_scalarPayloads_shouldPassThrough() {
        JsonNode payload = IntNode.valueOf(42);

        assertThat(new JsonPathResponseSimplifier(properties).simplify(tool("get_series", "series"), payload))
                .isSameAs(payload);
        assertThat(new JsonPathResponseSimplifier(properties).simplify(tool("get_series", "series"), null)).isNull();
    }

    @Test
    void constructor_invalidDropPath_shouldFail() {
        properties.getSimplification().getDefaults().setDropPaths(List.of("$..[unclosed"));

        assertThatThrownBy(() -> new JsonPathResponseSimplifier(properties))
                .isInstanceOf(ToolGatewayException.class)
                .hasMessageContaining("$..[unclosed")
                .hasMessageContaining("defaults");
    }
}

package com.sonarrmcp.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.sonarrmcp.SonarrFixtures;
import com.sonarrmcp.config.GatewayProperties;
import com.sonarrmcp.exception.ArgumentValidationException;
import com.sonarrmcp.exception.ToolNotFoundException;
import com.sonarrmcp.exception.UpstreamException;
import com.sonarrmcp.model.CatalogIndex;
import com.sonarrmcp.model.Invocation;
import com.sonarrmcp.model.UpstreamRequest;
import com.sonarrmcp.model.UpstreamResponse;
import com.sonarrmcp.service.api.UpstreamClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ToolDispatcherImplTest {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static CatalogIndex index;

    @Mock
    private UpstreamClient upstreamClient;

    private GatewayProperties properties;
    private ToolDispatcherImpl dispatcher;

    @BeforeAll
    static void loadCatalog() {
        index = SonarrFixtures.sonarrCatalog();
    }

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        dispatcher = newDispatcher();
    }

    private ToolDispatcherImpl newDispatcher() {
        return new ToolDispatcherImpl(new SchemaResolverImpl(), upstreamClient,
                new JsonPathResponseSimplifier(properties));
    }

    private UpstreamRequest dispatchAndCapture(String tool, Map<String, Object> arguments, String responseBody)
            throws Exception {
        ArgumentCaptor<UpstreamRequest> captor = ArgumentCaptor.forClass(UpstreamRequest.class);
        when(upstreamClient.execute(captor.capture()))
                .thenReturn(new UpstreamResponse(200, objectMapper.readTree(responseBody)));
        dispatcher.dispatch(index, new Invocation(tool, arguments));
        return captor.getValue();
    }

    @Test
    void dispatch_shouldSubstitutePathParametersAndReturnThePayload() throws Exception {
        when(upstreamClient.execute(any())).thenReturn(
                new UpstreamResponse(200, objectMapper.readTree("{\"id\":42,\"title\":\"Breaking Bad\"}")));

        JsonNode result = dispatcher.dispatch(index, new Invocation("get_series", Map.of("id", "42")));

        ArgumentCaptor<UpstreamRequest> captor = ArgumentCaptor.forClass(UpstreamRequest.class);
        verify(upstreamClient).execute(captor.capture());
        UpstreamRequest request = captor.getValue();
        assertThat(request.toolName()).isEqualTo("get_series");
        assertThat(request.method()).isEqualTo("GET");
        assertThat(request.path()).isEqualTo("/api/v3/series/42");
        assertThat(request.query()).isEmpty();
        assertThat(request.body()).isNull();
        assertThat(result.get("title").asText()).isEqualTo("Breaking Bad");
    }

    @Test
    void dispatch_shouldSendQueryParametersAsStrings() throws Exception {
        UpstreamRequest request = dispatchAndCapture("get_all_series",
                Map.of("tvdbId", 81189, "includeSeasonImages", "TRUE"), "[]");

        assertThat(request.query())
                .containsEntry("tvdbId", List.of("81189"))
                .containsEntry("includeSeasonImages", List.of("true"));
    }

    @Test
    void dispatch_shouldAssembleFlattenedBodiesInParameterOrder() throws Exception {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("monitored", "false");
        arguments.put("rootFolderPath", "/tv");
        arguments.put("title", "Breaking Bad");
        arguments.put("qualityProfileId", 1);
        arguments.put("tvdbId", "81189");

        UpstreamRequest request = dispatchAndCapture("add_series", arguments, "{\"id\":1}");

        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.path()).isEqualTo("/api/v3/series");
        @SuppressWarnings("unchecked")
        Map<String, Object> body = (Map<String, Object>) request.body();
        assertThat(body).containsExactly(
                Map.entry("title", "Breaking Bad"),
                Map.entry("tvdbId", 81189L),
                Map.entry("qualityProfileId", 1),
                Map.entry("rootFolderPath", "/tv"),
                Map.entry("monitored", false));
    }

    @Test
    void dispatch_shouldSplitCommaSeparatedArrays() throws Exception {
        UpstreamRequest request = dispatchAndCapture("monitor_episodes",
                Map.of("episodeIds", "1, 2,3", "monitored", true), "{}");

        assertThat(request.method()).isEqualTo("PUT");
        assertThat(request.body())
                .asInstanceOf(InstanceOfAssertFactories.map(String.class, Object.class))
                .containsEntry("episodeIds", List.of(1L, 2L, 3L))
                .containsEntry("monitored", true);
    }

    @Test
    void dispatch_shouldPassWholeBodiesThrough() throws Exception {
        UpstreamRequest request = dispatchAndCapture("remove_queue_items", Map.of("body", List.of(4, 5)), "{}");

        assertThat(request.method()).isEqualTo("DELETE");
        assertThat(request.body()).isEqualTo(List.of(4, 5));
    }

    @Test
    void dispatch_shouldKeepPathParametersOutOfTheBody() throws Exception {
        UpstreamRequest request = dispatchAndCapture("update_tag", Map.of("id", 7, "label", "hd"), "{}");

        assertThat(request.path()).isEqualTo("/api/v3/tag/7");
        assertThat(request.body())
                .asInstanceOf(InstanceOfAssertFactories.map(String.class, Object.class))
                .containsExactly(Map.entry("label", "hd"));
    }

    @Test
    void dispatch_shouldPercentEncodePathValues() throws Exception {
        CatalogIndex custom = SonarrFixtures.schemaIndexService(properties).parse("""
                openapi: 3.0.1
                info: {title: t, version: '1'}
                paths:
                  /api/v3/filesystem/{name}:
                    get:
                      operationId: GetFolder
                      parameters:
                        - {name: name, in: path, required: true, schema: {type: string}}
                      responses: {'200': {description: OK}}
                """);
        when(upstreamClient.execute(any())).thenReturn(new UpstreamResponse(200, TextNode.valueOf("ok")));

        dispatcher.dispatch(custom, new Invocation("get_folder", Map.of("name", "TV Shows/Drama")));

        ArgumentCaptor<UpstreamRequest> captor = ArgumentCaptor.forClass(UpstreamRequest.class);
        verify(upstreamClient).execute(captor.capture());
        assertThat(captor.getValue().path()).isEqualTo("/api/v3/filesystem/TV%20Shows%2FDrama");
    }

    @Test
    void dispatch_shouldReportEveryArgumentProblemAtOnce() {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("title", "Breaking Bad");
        arguments.put("tvdbId", "abc");
        arguments.put("zzz", 2);
        arguments.put("bogus", 1);
        arguments.put("monitored", "yes");

        assertThatThrownBy(() -> dispatcher.dispatch(index, new Invocation("add_series", arguments)))
                .isInstanceOfSatisfying(ArgumentValidationException.class, e -> {
                    assertThat(e.getToolName()).isEqualTo("add_series");
                    assertThat(e.getMissing()).containsExactly("qualityProfileId", "rootFolderPath");
                    assertThat(e.getUnknown()).containsExactly("bogus", "zzz");
                    assertThat(e.getInvalid()).containsOnlyKeys("monitored", "tvdbId");
                    assertThat(e.getMessage()).contains("missing required parameters [qualityProfileId, rootFolderPath]");
                });
        verify(upstreamClient, never()).execute(any());
    }

    @Test
    void dispatch_shouldTreatNullAsMissing() {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("id", null);

        assertThatThrownBy(() -> dispatcher.dispatch(index, new Invocation("get_series", arguments)))
                .isInstanceOfSatisfying(ArgumentValidationException.class,
                        e -> assertThat(e.getMissing()).containsExactly("id"));
        assertThatThrownBy(() -> dispatcher.dispatch(index, new Invocation("get_series", null)))
                .isInstanceOf(ArgumentValidationException.class);
    }

    @Test
    void dispatch_shouldRejectStructuredOrBlankPathValues() {
        assertThatThrownBy(() -> dispatcher.dispatch(index, new Invocation("get_series", Map.of("id", List.of(1, 2)))))
                .isInstanceOfSatisfying(ArgumentValidationException.class,
                        e -> assertThat(e.getInvalid()).containsEntry("id", "expected a single value"));
        assertThatThrownBy(() -> dispatcher.dispatch(index, new Invocation("get_series", Map.of("id", " "))))
                .isInstanceOfSatisfying(ArgumentValidationException.class,
                        e -> assertThat(e.getInvalid()).containsEntry("id", "must not be blank"));
        verify(upstreamClient, never()).execute(any());
    }

    @Test
    void dispatch_shouldRejectFractionalIntegers() throws Exception {
        assertThatThrownBy(() -> dispatcher.dispatch(index, new Invocation("get_series", Map.of("id", 1.5))))
                .isInstanceOf(ArgumentValidationException.class);

        UpstreamRequest request = dispatchAndCapture("get_series", Map.of("id", 2.0), "{}");
        assertThat(request.path()).isEqualTo("/api/v3/series/2");
    }

    @Test
    void dispatch_unknownTool_shouldFailWithoutCallingUpstream() {
        assertThatThrownBy(() -> dispatcher.dispatch(index, new Invocation("get_movies", Map.of())))
                .isInstanceOf(ToolNotFoundException.class);
        verify(upstreamClient, never()).execute(any());
    }

    @Test
    void dispatch_nonSuccessStatus_shouldRaiseUpstreamException() throws Exception {
        when(upstreamClient.execute(any())).thenReturn(
                new UpstreamResponse(404, objectMapper.readTree("{\"message\":\"Series not found\"}")));

        assertThatThrownBy(() -> dispatcher.dispatch(index, new Invocation("get_series", Map.of("id", 999))))
                .isInstanceOfSatisfying(UpstreamException.class, e -> {
                    assertThat(e.getStatus()).contains(404);
                    assertThat(e.isTimeout()).isFalse();
                    assertThat(e.getResponseBody()).contains("Series not found");
                    assertThat(e.getMessage()).contains("get_series").contains("404");
                });
    }

    @Test
    void dispatch_longErrorBodies_shouldBeTruncated() {
        String longBody = "x".repeat(2000);
        when(upstreamClient.execute(any())).thenReturn(new UpstreamResponse(500, TextNode.valueOf(longBody)));

        assertThatThrownBy(() -> dispatcher.dispatch(index, new Invocation("get_series", Map.of("id", 1))))
                .isInstanceOfSatisfying(UpstreamException.class, e ->
                        assertThat(e.getResponseBody()).hasSize(UpstreamException.MAX_BODY_LENGTH + 3).endsWith("..."));
    }

    @Test
    void dispatch_timeout_shouldPropagateUnchanged() {
        UpstreamException timeout = UpstreamException.timeout("get_series", Duration.ofSeconds(30), null);
        when(upstreamClient.execute(any())).thenThrow(timeout);

        assertThatThrownBy(() -> dispatcher.dispatch(index, new Invocation("get_series", Map.of("id", 1))))
                .isSameAs(timeout);
    }

    @Test
    void dispatch_unexpectedClientFailure_shouldBecomeUpstreamException() {
        when(upstreamClient.execute(any())).thenThrow(new IllegalStateException("connection reset"));

        assertThatThrownBy(() -> dispatcher.dispatch(index, new Invocation("get_series", Map.of("id", 1))))
                .isInstanceOf(UpstreamException.class)
                .hasMessageContaining("connection reset")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void dispatch_shouldSimplifyThePayloadByCategory() throws Exception {
        properties.getSimplification().getDefaults().setDropPaths(List.of("$..images"));
        dispatcher = newDispatcher();
        when(upstreamClient.execute(any())).thenReturn(new UpstreamResponse(200,
                objectMapper.readTree("{\"id\":1,\"images\":[{\"url\":\"a\"}],\"title\":\"Dexter\"}")));

        JsonNode result = dispatcher.dispatch(index, new Invocation("get_series", Map.of("id", 1)));

        assertThat(result.has("images")).isFalse();
        assertThat(result.get("title").asText()).isEqualTo("Dexter");
    }
}

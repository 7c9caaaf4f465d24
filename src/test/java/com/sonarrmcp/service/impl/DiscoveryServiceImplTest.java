package com.sonarrmcp.service.impl;

import static org.assertj.core.api.Assertions.assertThat;

import com.sonarrmcp.SonarrFixtures;
import com.sonarrmcp.config.GatewayProperties;
import com.sonarrmcp.model.CatalogIndex;
import com.sonarrmcp.model.DiscoveryMatch;
import com.sonarrmcp.model.DiscoveryQuery;
import com.sonarrmcp.model.DiscoveryResult;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DiscoveryServiceImplTest {

    private static CatalogIndex index;

    private GatewayProperties properties;
    private DiscoveryServiceImpl discoveryService;

    @BeforeAll
    static void loadCatalog() {
        index = SonarrFixtures.sonarrCatalog();
    }

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getCoreTools().setNames(List.of("get_series", "missing_tool", "search_series"));
        discoveryService = newService(properties);
    }

    private static DiscoveryServiceImpl newService(GatewayProperties properties) {
        return new DiscoveryServiceImpl(new PathToolCategorizer(properties), new CoreToolCatalogImpl(properties),
                properties);
    }

    @Test
    void discover_withoutFiltersOrLimit_shouldReturnOnlyTheCoreSet() {
        DiscoveryResult result = discoveryService.discover(index, DiscoveryQuery.unfiltered());

        assertThat(result.matches()).extracting(DiscoveryMatch::name)
                .containsExactly("discover_tools", "get_tool_schema", "get_series", "search_series");
        assertThat(result.matches()).extracting(DiscoveryMatch::matchScore).containsOnly(0);
        assertThat(result.matches().get(0).tags()).containsExactly("meta");
        assertThat(result.totalMatches()).isEqualTo(4);
    }

    @Test
    void discover_byCategory_shouldBeCaseInsensitiveAndExact() {
        DiscoveryResult result = discoveryService.discover(index, DiscoveryQuery.byCategory("Quality"));

        assertThat(result.matches()).singleElement().satisfies(match -> {
            assertThat(match.name()).isEqualTo("get_quality_profiles");
            assertThat(match.tags()).contains("quality");
            assertThat(match.matchScore()).isZero();
        });
    }

    @Test
    void discover_byCategory_shouldOrderByNameAndApplyTheLimit() {
        DiscoveryResult result = discoveryService.discover(index, new DiscoveryQuery("series", null, 2));

        assertThat(result.matches()).extracting(DiscoveryMatch::name)
                .containsExactly("add_series", "delete_series_by_id");
        assertThat(result.totalMatches()).isEqualTo(5);
        assertThat(result.isTruncated()).isTrue();
    }

    @Test
    void discover_byKeyword_shouldRankSummaryMatchesAboveNonMatches() {
        DiscoveryResult result = discoveryService.discover(index, DiscoveryQuery.byKeyword("breaking"));

        assertThat(result.matches()).singleElement().satisfies(match -> {
            assertThat(match.name()).isEqualTo("search_series");
            assertThat(match.matchScore()).isEqualTo(DiscoveryServiceImpl.SUMMARY_SCORE);
        });
    }

    @Test
    void discover_byKeyword_shouldRankByTierThenName() {
        DiscoveryResult result = discoveryService.discover(index, new DiscoveryQuery(null, "Series", 50));

        // get_root_folders mentions series in its summary, run_command has a seriesId parameter
        assertThat(result.matches()).extracting(DiscoveryMatch::name).containsExactly(
                "add_series", "delete_series_by_id", "get_all_series", "get_series", "search_series",
                "get_root_folders", "run_command");
        assertThat(result.matches()).extracting(DiscoveryMatch::matchScore).containsExactly(60, 60, 60, 60, 60,
                DiscoveryServiceImpl.SUMMARY_SCORE, DiscoveryServiceImpl.PARAMETER_SCORE);
    }

    @Test
    void discover_byKeyword_shouldPreferExactNames() {
        DiscoveryResult result = discoveryService.discover(index, DiscoveryQuery.byKeyword("get series"));

        DiscoveryMatch best = result.matches().get(0);
        assertThat(best.name()).isEqualTo("get_series");
        // exact name, plus both tokens in the name (3 + 3), "series" in a tag (2), both in the summary (1 + 1)
        assertThat(best.matchScore()).isEqualTo(110);
        assertThat(result.matches().get(1).matchScore()).isLessThan(best.matchScore());
    }

    @Test
    void discover_byKeyword_shouldSearchParameterDescriptions() {
        DiscoveryResult result = discoveryService.discover(index, DiscoveryQuery.byKeyword("starting"));

        assertThat(result.matches()).singleElement().satisfies(match -> {
            assertThat(match.name()).isEqualTo("get_queue");
            assertThat(match.matchScore()).isEqualTo(DiscoveryServiceImpl.SUMMARY_SCORE);
        });
    }

    @Test
    void discover_byKeyword_shouldRankDescriptionsLikeSummaries() {
        DiscoveryResult result = discoveryService.discover(index, DiscoveryQuery.byKeyword("stored"));

        // add_series only through the rootFolderPath description, get_root_folders through its summary
        assertThat(result.matches()).extracting(DiscoveryMatch::name)
                .containsExactly("add_series", "get_root_folders");
        assertThat(result.matches()).extracting(DiscoveryMatch::matchScore)
                .containsOnly(DiscoveryServiceImpl.SUMMARY_SCORE);
    }

    @Test
    void discover_byKeyword_shouldSearchOperationDescriptions() {
        CatalogIndex custom = SonarrFixtures.schemaIndexService(properties).parse("""
                openapi: 3.0.1
                info: {title: t, version: '1'}
                paths:
                  /api/v3/series/{id}/refresh:
                    post:
                      operationId: RefreshSeries
                      summary: Refresh a series
                      description: Downloads fresh metadata from TheTVDB
                      responses: {'200': {description: OK}}
                """);

        DiscoveryResult result = discoveryService.discover(custom, DiscoveryQuery.byKeyword("metadata"));

        assertThat(result.matches()).extracting(DiscoveryMatch::name).containsExactly("refresh_series");
        assertThat(result.matches().get(0).matchScore()).isEqualTo(DiscoveryServiceImpl.SUMMARY_SCORE);
    }

    @Test
    void discover_byCategoryAndKeyword_shouldIntersect() {
        DiscoveryResult result = discoveryService.discover(index, new DiscoveryQuery("queue", "remove", null));

        assertThat(result.matches()).extracting(DiscoveryMatch::name).containsExactly("remove_queue_items");
    }

    @Test
    void discover_withoutMatches_shouldReturnAnEmptyResult() {
        assertThat(discoveryService.discover(index, DiscoveryQuery.byKeyword("zzz")).isEmpty()).isTrue();
        assertThat(discoveryService.discover(index, DiscoveryQuery.byCategory("nonexistent")).isEmpty()).isTrue();
        assertThat(discoveryService.discover(index, DiscoveryQuery.byKeyword("---")).isEmpty()).isTrue();
    }

    @Test
    void discover_withLimitOnly_shouldListTheWholeCatalogUpToTheCeiling() {
        properties.getDiscovery().setMaxResultsCeiling(3);
        DiscoveryServiceImpl bounded = newService(properties);

        DiscoveryResult result = bounded.discover(index, new DiscoveryQuery(null, null, 100));

        assertThat(result.matches()).extracting(DiscoveryMatch::name)
                .containsExactly("add_series", "delete_series_by_id", "get_all_series");
        assertThat(result.totalMatches()).isEqualTo(index.size());
    }

    @Test
    void limit_shouldClampAndFallBackToTheDefault() {
        assertThat(discoveryService.limit(null)).isEqualTo(10);
        assertThat(discoveryService.limit(0)).isEqualTo(10);
        assertThat(discoveryService.limit(-3)).isEqualTo(10);
        assertThat(discoveryService.limit(1)).isEqualTo(1);
        assertThat(discoveryService.limit(500)).isEqualTo(50);
    }

    @Test
    void discover_shouldBeDeterministic() {
        DiscoveryQuery query = DiscoveryQuery.byKeyword("queue");

        assertThat(discoveryService.discover(index, query)).isEqualTo(discoveryService.discover(index, query));
    }
}

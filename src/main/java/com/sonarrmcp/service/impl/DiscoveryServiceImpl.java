package com.sonarrmcp.service.impl;

import com.sonarrmcp.config.GatewayProperties;
import com.sonarrmcp.model.CatalogIndex;
import com.sonarrmcp.model.DiscoveryMatch;
import com.sonarrmcp.model.DiscoveryQuery;
import com.sonarrmcp.model.DiscoveryResult;
import com.sonarrmcp.model.ToolDescriptor;
import com.sonarrmcp.model.ToolParameter;
import com.sonarrmcp.service.api.CoreToolCatalog;
import com.sonarrmcp.service.api.DiscoveryService;
import com.sonarrmcp.service.api.ToolCategorizer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.StringJoiner;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class DiscoveryServiceImpl implements DiscoveryService {

    static final int EXACT_NAME_SCORE = 100;
    static final int NAME_SCORE = 60;
    static final int TAG_SCORE = 40;
    static final int SUMMARY_SCORE = 20;
    static final int PARAMETER_SCORE = 10;

    static final int TOKEN_NAME_BONUS = 3;
    static final int TOKEN_TAG_BONUS = 2;
    static final int TOKEN_SUMMARY_BONUS = 1;

    private static final Comparator<DiscoveryMatch> RANKING = Comparator
            .comparingInt(DiscoveryMatch::matchScore).reversed()
            .thenComparing(DiscoveryMatch::name);

    private final ToolCategorizer categorizer;
    private final CoreToolCatalog coreToolCatalog;
    private final GatewayProperties.Discovery settings;

    public DiscoveryServiceImpl(ToolCategorizer categorizer, CoreToolCatalog coreToolCatalog,
                                GatewayProperties properties) {
        this.categorizer = categorizer;
        this.coreToolCatalog = coreToolCatalog;
        this.settings = properties.getDiscovery();
    }

    @Override
    public DiscoveryResult discover(CatalogIndex index, DiscoveryQuery query) {
        DiscoveryQuery effective = query == null ? DiscoveryQuery.unfiltered() : query;
        if (effective.isUnfiltered()) {
            return coreSet(index);
        }

        Collection<String> candidates = effective.hasCategory()
                ? index.namesForTag(categorizer.normalize(effective.category()))
                : allNames(index);

        List<DiscoveryMatch> matches = new ArrayList<>();
        if (effective.hasKeyword()) {
            String keyword = effective.keyword().trim().toLowerCase(Locale.ROOT);
            Set<String> tokens = CatalogIndex.tokenize(keyword);
            SortedSet<String> narrowed = new TreeSet<>();
            tokens.forEach(token -> narrowed.addAll(index.namesForKeywordFragment(token)));
            narrowed.retainAll(candidates);

            for (String name : narrowed) {
                index.find(name).ifPresent(tool -> {
                    int score = score(tool, keyword, tokens);
                    if (score > 0) {
                        matches.add(DiscoveryMatch.of(tool, score));
                    }
                });
            }
        } else {
            candidates.forEach(name -> index.find(name).ifPresent(tool -> matches.add(DiscoveryMatch.of(tool, 0))));
        }
        matches.sort(RANKING);

        int limit = limit(effective.maxResults());
        log.debug("Discovery {} matched {} tools, returning at most {}", effective, matches.size(), limit);
        return new DiscoveryResult(matches.subList(0, Math.min(limit, matches.size())), matches.size());
    }

    private DiscoveryResult coreSet(CatalogIndex index) {
        List<DiscoveryMatch> matches = new ArrayList<>();
        for (String name : coreToolCatalog.coreTools(index)) {
            Optional<ToolDescriptor> tool = coreToolCatalog.metaTool(name).or(() -> index.find(name));
            tool.ifPresent(descriptor -> matches.add(DiscoveryMatch.of(descriptor, 0)));
        }
        return new DiscoveryResult(matches, matches.size());
    }

    private static Collection<String> allNames(CatalogIndex index) {
        return index.tools().stream().map(ToolDescriptor::getName).collect(Collectors.toList());
    }

    /**
     * Clamps the requested number of results to {@code [1, ceiling]}. A missing or non-positive request falls back
     * to the configured default.
     */
    int limit(Integer requested) {
        int ceiling = Math.max(1, settings.getMaxResultsCeiling());
        int value = requested == null || requested <= 0 ? settings.getDefaultMaxResults() : requested;
        return Math.max(1, Math.min(value, ceiling));
    }

    /**
     * Scores one tool against a lower-case keyword. The whole keyword earns the best single tier it reaches; when the
     * keyword has several tokens, each token adds a small bonus per field it appears in.
     */
    static int score(ToolDescriptor tool, String keyword, Set<String> tokens) {
        String name = tool.getName().toLowerCase(Locale.ROOT);
        String snakeKeyword = SchemaIndexServiceImpl.toSnakeCase(keyword);
        String prose = proseOf(tool);

        int score;
        if (name.equals(snakeKeyword)) {
            score = EXACT_NAME_SCORE;
        } else if (name.contains(keyword) || name.contains(snakeKeyword)) {
            score = NAME_SCORE;
        } else if (tool.getTags().stream().anyMatch(tag -> tag.contains(keyword))) {
            score = TAG_SCORE;
        } else if (prose.contains(keyword)) {
            score = SUMMARY_SCORE;
        } else if (tool.getParameters().stream()
                .map(ToolParameter::getName)
                .anyMatch(parameter -> parameter.toLowerCase(Locale.ROOT).contains(keyword))) {
            score = PARAMETER_SCORE;
        } else {
            score = 0;
        }

        if (tokens.size() > 1) {
            for (String token : tokens) {
                if (name.contains(token)) {
                    score += TOKEN_NAME_BONUS;
                }
                if (tool.getTags().stream().anyMatch(tag -> tag.contains(token))) {
                    score += TOKEN_TAG_BONUS;
                }
                if (prose.contains(token)) {
                    score += TOKEN_SUMMARY_BONUS;
                }
            }
        }
        return score;
    }

    /**
     * The lower-case free text of a tool: its summary, its description and the descriptions of its parameters.
     */
    private static String proseOf(ToolDescriptor tool) {
        StringJoiner prose = new StringJoiner("\n");
        Stream.concat(Stream.of(tool.getSummary(), tool.getDescription()),
                        tool.getParameters().stream().map(ToolParameter::getDescription))
                .filter(Objects::nonNull)
                .forEach(prose::add);
        return prose.toString().toLowerCase(Locale.ROOT);
    }
}

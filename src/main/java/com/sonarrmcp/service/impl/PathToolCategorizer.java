package com.sonarrmcp.service.impl;

import com.sonarrmcp.config.GatewayProperties;
import com.sonarrmcp.service.api.ToolCategorizer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Tags a tool with the first meaningful segment of its path plus the tags the document declares for it.
 * <p>
 * "/api/v3/series/{id}" is tagged "series"; "/api/v3/qualityprofile" is tagged "qualityprofile". An operation that
 * yields no tag at all (e.g. "/") falls into {@value #FALLBACK_TAG}.
 */
@Component
public class PathToolCategorizer implements ToolCategorizer {

    static final String FALLBACK_TAG = "general";

    private static final Pattern VERSION_SEGMENT = Pattern.compile("v\\d+(\\.\\d+)*", Pattern.CASE_INSENSITIVE);

    private final Set<String> ignoredPrefixes;

    public PathToolCategorizer(GatewayProperties properties) {
        this.ignoredPrefixes = properties.getCatalog().getIgnoredPathPrefixes().stream()
                .map(prefix -> prefix.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    @Override
    public SortedSet<String> tag(String method, String path, Collection<String> declaredTags) {
        SortedSet<String> tags = new TreeSet<>();
        meaningfulSegments(path).stream()
                .filter(segment -> !isPlaceholder(segment))
                .findFirst()
                .map(this::normalize)
                .ifPresent(tags::add);

        if (declaredTags != null) {
            declaredTags.stream()
                    .map(this::normalize)
                    .filter(tag -> !tag.isEmpty())
                    .forEach(tags::add);
        }

        if (tags.isEmpty()) {
            tags.add(FALLBACK_TAG);
        }
        return tags;
    }

    @Override
    public String normalize(String label) {
        if (label == null) {
            return "";
        }
        return label.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_]+", "-");
    }

    @Override
    public List<String> meaningfulSegments(String path) {
        List<String> segments = new ArrayList<>();
        if (path == null) {
            return segments;
        }
        boolean leading = true;
        for (String segment : path.split("/")) {
            if (segment.isBlank()) {
                continue;
            }
            if (leading && (ignoredPrefixes.contains(segment.toLowerCase(Locale.ROOT))
                    || VERSION_SEGMENT.matcher(segment).matches())) {
                continue;
            }
            leading = false;
            segments.add(segment);
        }
        return segments;
    }

    static boolean isPlaceholder(String segment) {
        return segment.startsWith("{") && segment.endsWith("}");
    }
}

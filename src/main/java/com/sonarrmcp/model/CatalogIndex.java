package com.sonarrmcp.model;

import com.sonarrmcp.exception.SchemaException;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * An immutable snapshot of every tool built from one OpenAPI document.
 * <p>
 * Besides the descriptors keyed by name, the index owns two secondary indexes: category tag to tool names,
 * and normalized keyword token to tool names. Nothing is ever added to or removed from an instance; a new
 * document produces a new index.
 */
public final class CatalogIndex {

    private final String title;
    private final String version;
    private final Instant builtAt;
    private final SortedMap<String, ToolDescriptor> toolsByName;
    private final SortedMap<String, SortedSet<String>> namesByTag;
    private final SortedMap<String, SortedSet<String>> namesByKeyword;

    private CatalogIndex(String title, String version, Instant builtAt, SortedMap<String, ToolDescriptor> toolsByName,
                         SortedMap<String, SortedSet<String>> namesByTag,
                         SortedMap<String, SortedSet<String>> namesByKeyword) {
        this.title = title;
        this.version = version;
        this.builtAt = builtAt;
        this.toolsByName = toolsByName;
        this.namesByTag = namesByTag;
        this.namesByKeyword = namesByKeyword;
    }

    /**
     * Builds an index over the given descriptors.
     *
     * @param title   The title of the source document.
     * @param version The version of the source document.
     * @param tools   The descriptors; names must be unique.
     * @return The new index.
     * @throws SchemaException if two descriptors share a name.
     */
    public static CatalogIndex of(String title, String version, Collection<ToolDescriptor> tools) {
        SortedMap<String, ToolDescriptor> byName = new TreeMap<>();
        SortedMap<String, SortedSet<String>> byTag = new TreeMap<>();
        SortedMap<String, SortedSet<String>> byKeyword = new TreeMap<>();

        for (ToolDescriptor tool : tools) {
            if (byName.putIfAbsent(tool.getName(), tool) != null) {
                throw new SchemaException("Duplicate tool name in catalog: " + tool.getName());
            }
            for (String tag : tool.getTags()) {
                byTag.computeIfAbsent(tag, k -> new TreeSet<>()).add(tool.getName());
            }
            for (String token : keywordsOf(tool)) {
                byKeyword.computeIfAbsent(token, k -> new TreeSet<>()).add(tool.getName());
            }
        }
        byTag.replaceAll((tag, names) -> Collections.unmodifiableSortedSet(names));
        byKeyword.replaceAll((token, names) -> Collections.unmodifiableSortedSet(names));

        return new CatalogIndex(title, version, Instant.now(),
                Collections.unmodifiableSortedMap(byName),
                Collections.unmodifiableSortedMap(byTag),
                Collections.unmodifiableSortedMap(byKeyword));
    }

    /**
     * Splits free text into lower-case alphanumeric tokens. camelCase words also contribute their parts,
     * so "qualityProfileId" yields "qualityprofileid", "quality", "profile" and "id".
     *
     * @param text The text to split; may be {@code null}.
     * @return The tokens in order of first appearance.
     */
    public static Set<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null) {
            return tokens;
        }
        for (String word : text.split("[^A-Za-z0-9]+")) {
            if (word.isEmpty()) {
                continue;
            }
            tokens.add(word.toLowerCase(Locale.ROOT));
            for (String part : word.split("(?<=[a-z0-9])(?=[A-Z])")) {
                tokens.add(part.toLowerCase(Locale.ROOT));
            }
        }
        return tokens;
    }

    private static Set<String> keywordsOf(ToolDescriptor tool) {
        Set<String> tokens = new LinkedHashSet<>(tokenize(tool.getName()));
        tokens.addAll(tokenize(tool.getSummary()));
        tokens.addAll(tokenize(tool.getDescription()));
        tool.getTags().forEach(tag -> tokens.addAll(tokenize(tag)));
        tool.getParameters().forEach(parameter -> {
            tokens.addAll(tokenize(parameter.getName()));
            tokens.addAll(tokenize(parameter.getDescription()));
        });
        return tokens;
    }

    public Optional<ToolDescriptor> find(String name) {
        return Optional.ofNullable(name).map(toolsByName::get);
    }

    public boolean contains(String name) {
        return name != null && toolsByName.containsKey(name);
    }

    /**
     * @return All descriptors, ordered by name.
     */
    public Collection<ToolDescriptor> tools() {
        return toolsByName.values();
    }

    public int size() {
        return toolsByName.size();
    }

    /**
     * @param tag A normalized tag.
     * @return The names of the tools carrying the tag, or an empty set.
     */
    public SortedSet<String> namesForTag(String tag) {
        return namesByTag.getOrDefault(tag, Collections.emptySortedSet());
    }

    /**
     * @return Every tag in the catalog with the number of tools carrying it.
     */
    public SortedMap<String, Integer> tagCounts() {
        SortedMap<String, Integer> counts = new TreeMap<>();
        namesByTag.forEach((tag, names) -> counts.put(tag, names.size()));
        return counts;
    }

    /**
     * Looks up the tools having at least one keyword token that contains the given fragment.
     *
     * @param fragment A lower-case keyword fragment.
     * @return The matching tool names.
     */
    public SortedSet<String> namesForKeywordFragment(String fragment) {
        SortedSet<String> names = new TreeSet<>();
        for (Map.Entry<String, SortedSet<String>> entry : namesByKeyword.entrySet()) {
            if (entry.getKey().contains(fragment)) {
                names.addAll(entry.getValue());
            }
        }
        return names;
    }

    public String getTitle() {
        return title;
    }

    public String getVersion() {
        return version;
    }

    public Instant getBuiltAt() {
        return builtAt;
    }
}

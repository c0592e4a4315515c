package org.pragmatica.structmerge.lang;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Set of languages available to a merge. The registry is an ordinary object owned by the
 * caller; it is populated before merging starts and only read afterwards.
 */
public final class LanguageRegistry {
    private final Map<String, LanguageProfile> languages = new LinkedHashMap<>();

    private LanguageRegistry() {}

    public static LanguageRegistry empty() {
        return new LanguageRegistry();
    }

    /**
     * Registry preloaded with the languages shipped with the library.
     */
    public static LanguageRegistry builtin() {
        return empty().register(Languages.json())
                      .register(Languages.starlark());
    }

    public LanguageRegistry register(LanguageProfile profile) {
        languages.put(profile.name().toLowerCase(), profile);
        return this;
    }

    /**
     * Look a language up by name (case-insensitive) or by one of its file criteria, such as
     * {@code json} or {@code BUILD}.
     */
    public Optional<LanguageProfile> byName(String name) {
        var direct = languages.get(name.toLowerCase());
        if (direct != null) {
            return Optional.of(direct);
        }
        return languages.values()
                        .stream()
                        .filter(profile -> profile.criteria()
                                                  .stream()
                                                  .anyMatch(criterion -> alternateName(criterion).equalsIgnoreCase(name)))
                        .findFirst();
    }

    public Optional<LanguageProfile> forPath(Path path) {
        return languages.values()
                        .stream()
                        .filter(profile -> profile.matches(path))
                        .findFirst();
    }

    public List<LanguageProfile> languages() {
        return List.copyOf(languages.values());
    }

    /**
     * Lines suitable for a gitattributes file, registering {@code driver} for every supported file.
     */
    public List<String> gitAttributes(String driver) {
        var lines = new ArrayList<String>();
        for (var profile : languages.values()) {
            for (var criterion : profile.criteria()) {
                lines.add(criterion.pattern() + " merge=" + driver);
            }
        }
        return lines;
    }

    private static String alternateName(FileCriterion criterion) {
        if (criterion instanceof FileCriterion.ByExtension byExtension) {
            return byExtension.extension();
        }
        return ((FileCriterion.ByName) criterion).name();
    }
}

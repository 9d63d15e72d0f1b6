package com.example.nexusmods.model;

import java.util.*;

/**
 * Tracked mods grouped by game domain.
 * Within a domain the mods keep the order the API listed them in.
 */
public final class TrackedMods {

    private final Map<String, List<ModId>> modsByDomain;

    private TrackedMods(Map<String, List<ModId>> modsByDomain) {
        this.modsByDomain = modsByDomain;
    }

    public static TrackedMods from(List<ModEntry> entries) {
        Map<String, List<ModId>> grouped = new LinkedHashMap<>();
        for (ModEntry entry : entries) {
            grouped.computeIfAbsent(entry.domainName(), domain -> new ArrayList<>()).add(entry.modId());
        }

        Map<String, List<ModId>> frozen = new LinkedHashMap<>();
        grouped.forEach((domain, ids) -> frozen.put(domain, List.copyOf(ids)));
        return new TrackedMods(Collections.unmodifiableMap(frozen));
    }

    /**
     * Tracked mods of one game, empty if nothing is tracked there.
     */
    public List<ModId> modsFor(String domainName) {
        return modsByDomain.getOrDefault(domainName, List.of());
    }

    public Set<String> domains() {
        return modsByDomain.keySet();
    }

    public boolean isTracking(String domainName, ModId modId) {
        return modsFor(domainName).contains(modId);
    }

    public Map<String, List<ModId>> asMap() {
        return modsByDomain;
    }

    public int size() {
        return modsByDomain.values().stream().mapToInt(List::size).sum();
    }

    @Override
    public String toString() {
        return "TrackedMods" + modsByDomain;
    }
}

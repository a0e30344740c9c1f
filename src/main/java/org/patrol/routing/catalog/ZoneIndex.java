package org.patrol.routing.catalog;

import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectMaps;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only partition of the site catalog by zone.
 *
 * <p>Built once; zone order and per-zone site order follow catalog insertion order.
 * Safe for concurrent readers.</p>
 */
public final class ZoneIndex {
    private final Object2ObjectMap<ZoneId, List<Site>> sitesByZone;

    private ZoneIndex(Object2ObjectMap<ZoneId, List<Site>> sitesByZone) {
        this.sitesByZone = Object2ObjectMaps.unmodifiable(sitesByZone);
    }

    /**
     * Groups sites by zone, preserving insertion order.
     *
     * @param sites catalog sites, ids assumed unique.
     * @return immutable index.
     */
    public static ZoneIndex build(Collection<Site> sites) {
        Objects.requireNonNull(sites, "sites");
        Object2ObjectLinkedOpenHashMap<ZoneId, List<Site>> grouped = new Object2ObjectLinkedOpenHashMap<>();
        for (Site site : sites) {
            List<Site> zoneSites = grouped.get(site.zone());
            if (zoneSites == null) {
                zoneSites = new ArrayList<>();
                grouped.put(site.zone(), zoneSites);
            }
            zoneSites.add(site);
        }
        Object2ObjectLinkedOpenHashMap<ZoneId, List<Site>> frozen = new Object2ObjectLinkedOpenHashMap<>(grouped.size());
        for (Object2ObjectMap.Entry<ZoneId, List<Site>> entry : grouped.object2ObjectEntrySet()) {
            frozen.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        return new ZoneIndex(frozen);
    }

    /**
     * Returns the zone to sites mapping.
     */
    public Object2ObjectMap<ZoneId, List<Site>> groupByZone() {
        return sitesByZone;
    }

    /**
     * Returns all sites of {@code zone} except the one with {@code excludingId}.
     *
     * @return new mutable list; empty for unknown zones.
     */
    public List<Site> candidatesFor(ZoneId zone, int excludingId) {
        List<Site> sites = sitesByZone.get(zone);
        if (sites == null) {
            return new ArrayList<>();
        }
        List<Site> candidates = new ArrayList<>(sites.size());
        for (Site site : sites) {
            if (site.id() != excludingId) {
                candidates.add(site);
            }
        }
        return candidates;
    }

    /**
     * Returns sites in one zone, empty for unknown zones.
     */
    public List<Site> sitesIn(ZoneId zone) {
        List<Site> sites = sitesByZone.get(zone);
        return sites == null ? List.of() : sites;
    }

    public Set<ZoneId> zoneIds() {
        return sitesByZone.keySet();
    }

    public int zoneCount() {
        return sitesByZone.size();
    }
}

package com.sop.network.observation;

import com.sop.network.core.model.Entity;
import com.sop.network.core.model.EntityType;
import com.sop.network.core.model.LookupEntry;
import com.sop.network.core.model.LookupTable;
import com.sop.network.core.model.WorldNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Cross-document directory of the entities seen in any number of
 * {@link WorldNetwork}s.
 *
 * <p>Entities are copied on absorption, so merging mentions here never
 * mutates the source networks. Provider ids are indexed by the TIN they were
 * listed with in a lookup table.</p>
 */
public class ObservationNetwork {
    private static final Logger log = LoggerFactory.getLogger(ObservationNetwork.class);

    private final Map<String, Entity> entities = new LinkedHashMap<>();
    private final Map<EntityType, Set<String>> byType = new EnumMap<>(EntityType.class);
    private final Map<String, Set<String>> providersByTin = new LinkedHashMap<>();
    private final Map<String, LookupEntry> clinicDirectory = new LinkedHashMap<>();
    private final List<String> documents = new ArrayList<>();

    /**
     * Absorbs every entity and lookup entry of a network.
     */
    public void absorb(WorldNetwork network) {
        Objects.requireNonNull(network, "network is required");
        int before = entities.size();
        for (Entity entity : network.getEntities()) {
            addEntity(entity);
        }
        for (LookupTable table : network.getLookupTables().values()) {
            for (LookupEntry entry : table.entries()) {
                clinicDirectory.put(clinicKey(entry), entry);
                if (entry.tin() != null && entry.providerId() != null) {
                    indexProvider(entry.tin(),
                            EntityType.PROVIDER_ID.entityId(entry.providerId().toUpperCase(Locale.ROOT)));
                }
            }
        }
        documents.add(network.getDocumentId());
        log.debug("observation.absorbed document={} newEntities={} totalEntities={}",
                network.getDocumentId(), entities.size() - before, entities.size());
    }

    /**
     * Adds an entity or merges its mentions into the one already known.
     */
    public Entity addEntity(Entity entity) {
        Entity known = entities.get(entity.getId());
        if (known == null) {
            known = Entity.builder()
                    .type(entity.getType())
                    .value(entity.getValue())
                    .normalizedValue(entity.getNormalizedValue())
                    .attributes(entity.getAttributes())
                    .mentions(entity.getMentions())
                    .build();
            entities.put(known.getId(), known);
        } else {
            known.addMentions(entity.getMentions());
            entity.getAttributes().forEach(known::putAttributeIfAbsent);
        }
        byType.computeIfAbsent(known.getType(), k -> new LinkedHashSet<>()).add(known.getId());
        if (known.getType() == EntityType.PROVIDER_ID && known.getAttributes().get("tin") instanceof String tin) {
            indexProvider(tin, known.getId());
        }
        return known;
    }

    private void indexProvider(String tin, String providerEntityId) {
        providersByTin.computeIfAbsent(tin, k -> new LinkedHashSet<>()).add(providerEntityId);
    }

    public Optional<Entity> getEntity(String entityId) {
        return Optional.ofNullable(entities.get(entityId));
    }

    public List<Entity> getEntities() {
        return List.copyOf(entities.values());
    }

    public List<Entity> getEntitiesByType(EntityType type) {
        return byType.getOrDefault(type, Set.of()).stream()
                .map(entities::get)
                .toList();
    }

    /**
     * Provider entities listed under a TIN, in first-seen order.
     */
    public List<Entity> getProvidersByTin(String tin) {
        return providersByTin.getOrDefault(tin, Set.of()).stream()
                .map(entities::get)
                .filter(Objects::nonNull)
                .toList();
    }

    public Map<String, List<String>> getProviderLookup() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        providersByTin.forEach((tin, ids) -> copy.put(tin, List.copyOf(ids)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Clinic entries keyed {@code name_tin}; the TIN part is empty when unknown.
     */
    public Map<String, LookupEntry> getClinicDirectory() {
        return Collections.unmodifiableMap(clinicDirectory);
    }

    public List<String> getAbsorbedDocuments() {
        return List.copyOf(documents);
    }

    public ObservationSummary summary() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        byType.forEach((type, ids) -> counts.put(type.getTag(), ids.size()));
        return new ObservationSummary(documents.size(), entities.size(), counts,
                providersByTin.size(), clinicDirectory.size());
    }

    static String clinicKey(LookupEntry entry) {
        return entry.name() + "_" + (entry.tin() != null ? entry.tin() : "");
    }
}

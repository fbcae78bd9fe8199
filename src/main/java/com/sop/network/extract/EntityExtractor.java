package com.sop.network.extract;

import com.sop.network.core.model.Entity;
import com.sop.network.core.model.EntityMention;
import com.sop.network.core.model.WorldNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies {@link EntityPattern}s to text and deduplicates the hits by entity id.
 * Patterns run in priority order (lower number first); within a pattern hits keep text order.
 */
public class EntityExtractor {
    private static final Logger log = LoggerFactory.getLogger(EntityExtractor.class);

    private final List<EntityPattern> patterns;

    public EntityExtractor(List<EntityPattern> patterns) {
        this.patterns = new ArrayList<>(patterns);
        this.patterns.sort(Comparator.comparingInt(EntityPattern::getPriority));
    }

    public List<EntityPattern> getPatterns() {
        return List.copyOf(patterns);
    }

    /**
     * Returns the distinct entities found in the text, first hit per id.
     */
    public List<ExtractedEntity> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Map<String, ExtractedEntity> unique = new LinkedHashMap<>();
        for (EntityPattern pattern : patterns) {
            for (ExtractedEntity hit : pattern.findAll(text)) {
                unique.putIfAbsent(hit.entityId(), hit);
            }
        }
        return List.copyOf(unique.values());
    }

    /**
     * Extracts entities from the text and records them in the network, one mention per distinct entity.
     *
     * @return ids of the entities found, in extraction order
     */
    public List<String> extractInto(WorldNetwork network, String text, EntityMention mention) {
        List<String> ids = new ArrayList<>();
        for (ExtractedEntity hit : extract(text)) {
            Entity entity = network.recordEntity(hit.type(), hit.value(), hit.normalizedValue(), mention);
            ids.add(entity.getId());
        }
        if (!ids.isEmpty()) {
            log.debug("entities.extracted section={} step={} count={}",
                    mention != null ? mention.section() : null,
                    mention != null ? mention.stepNumber() : null,
                    ids.size());
        }
        return ids;
    }
}

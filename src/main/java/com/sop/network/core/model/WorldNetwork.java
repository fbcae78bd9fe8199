package com.sop.network.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Deterministic decision graph of one procedure document, plus everything
 * stitched in from the documents it references.
 *
 * <p>The network owns its nodes, edges, entities and procedure references, and
 * allocates node and edge ids from its own counters, so the same input always
 * yields the same ids. It is append-only: nodes and edges are removed only by
 * rolling back to a {@link Checkpoint}.
 * Instances are not thread-safe; callers keep a single writer at a time.</p>
 */
public class WorldNetwork {

    public static final String SOURCE_TYPE = "SOP";
    public static final String BUILDER_VERSION = "2.0";

    private final String documentId;
    private final String documentName;
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, Edge> edges = new LinkedHashMap<>();
    private final Map<String, List<Edge>> outgoing = new LinkedHashMap<>();
    private final Map<String, List<Edge>> incoming = new LinkedHashMap<>();
    private final Map<CategoryKey, String> categoryRoots = new LinkedHashMap<>();
    private final Map<String, String> linkedProcedures = new LinkedHashMap<>();
    private final Map<String, ProcedureReference> procedureRefs = new LinkedHashMap<>();
    private final Map<String, Entity> entities = new LinkedHashMap<>();
    private final Map<String, LookupTable> lookupTables = new LinkedHashMap<>();
    private final List<Version> versions = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private String rootId;
    private String currentVersion;
    private int nodeCounter;
    private int edgeCounter;

    public WorldNetwork(String documentId, String documentName) {
        this.documentId = Objects.requireNonNull(documentId, "documentId is required");
        this.documentName = documentName != null ? documentName : documentId;
        metadata.put("source_type", SOURCE_TYPE);
        metadata.put("builder_version", BUILDER_VERSION);
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getDocumentName() {
        return documentName;
    }

    public String getRootId() {
        return rootId;
    }

    // --- nodes and edges ---

    /**
     * Creates a node with the next id. The first {@link NodeKind#ROOT} node becomes the network root.
     */
    public Node addNode(Node.Builder builder) {
        Node node = builder.build(String.format("node_%04d", nodeCounter + 1));
        if (node.getKind() == NodeKind.ROOT) {
            if (rootId != null) {
                throw new IllegalStateException("Network " + documentId + " already has a root: " + rootId);
            }
            rootId = node.getId();
        }
        nodeCounter++;
        nodes.put(node.getId(), node);
        return node;
    }

    /**
     * Creates an edge with the next id. Both endpoints must already exist.
     */
    public Edge addEdge(String sourceId, String targetId, EdgeKind kind, String condition) {
        if (!nodes.containsKey(sourceId)) {
            throw new IllegalArgumentException("Unknown source node: " + sourceId);
        }
        if (!nodes.containsKey(targetId)) {
            throw new IllegalArgumentException("Unknown target node: " + targetId);
        }
        Edge edge = new Edge(String.format("edge_%04d", ++edgeCounter), sourceId, targetId, kind, condition);
        edges.put(edge.id(), edge);
        outgoing.computeIfAbsent(sourceId, k -> new ArrayList<>()).add(edge);
        incoming.computeIfAbsent(targetId, k -> new ArrayList<>()).add(edge);
        return edge;
    }

    public Edge addEdge(String sourceId, String targetId, EdgeKind kind) {
        return addEdge(sourceId, targetId, kind, null);
    }

    public Optional<Node> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public Collection<Node> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public Collection<Edge> getEdges() {
        return Collections.unmodifiableCollection(edges.values());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * Outgoing edges of a node in creation order.
     */
    public List<Edge> getOutgoingEdges(String nodeId) {
        return Collections.unmodifiableList(outgoing.getOrDefault(nodeId, List.of()));
    }

    public List<Edge> getIncomingEdges(String nodeId) {
        return Collections.unmodifiableList(incoming.getOrDefault(nodeId, List.of()));
    }

    /**
     * Reference-pointer nodes that point at the given code.
     */
    public List<Node> findReferenceNodes(String code) {
        List<Node> result = new ArrayList<>();
        for (Node node : nodes.values()) {
            if (node.getKind() == NodeKind.REFERENCE && code.equals(node.getMetadata(Node.META_REFERENCE_CODE))) {
                result.add(node);
            }
        }
        return result;
    }

    // --- categories and linked procedures ---

    public void registerCategory(CategoryKey key, String nodeId) {
        if (!nodes.containsKey(nodeId)) {
            throw new IllegalArgumentException("Unknown category node: " + nodeId);
        }
        if (categoryRoots.putIfAbsent(key, nodeId) != null) {
            throw new IllegalStateException("Category already registered: " + key.toKey());
        }
    }

    public Map<CategoryKey, String> getCategoryRoots() {
        return Collections.unmodifiableMap(categoryRoots);
    }

    /**
     * Category roots keyed by their serialized key ({@code name} or {@code code/name}).
     */
    public Map<String, String> getClaimTypeRoots() {
        Map<String, String> result = new LinkedHashMap<>();
        categoryRoots.forEach((key, nodeId) -> result.put(key.toKey(), nodeId));
        return result;
    }

    public Optional<String> findCategoryRoot(String key) {
        return categoryRoots.entrySet().stream()
                .filter(e -> e.getKey().toKey().equals(key))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    public void linkProcedure(String code, String linkedRootId) {
        if (!nodes.containsKey(linkedRootId)) {
            throw new IllegalArgumentException("Unknown linked root node: " + linkedRootId);
        }
        linkedProcedures.put(code, linkedRootId);
    }

    public Map<String, String> getLinkedProcedures() {
        return Collections.unmodifiableMap(linkedProcedures);
    }

    // --- procedure references ---

    /**
     * Returns the reference for the code, creating a pending one if the code is new.
     * A later sighting only contributes its title if none is known yet.
     */
    public ProcedureReference registerReference(String code, String title, String sourceContext, int depth) {
        ProcedureReference existing = procedureRefs.get(code);
        if (existing != null) {
            existing.offerTitle(title);
            return existing;
        }
        ProcedureReference reference = new ProcedureReference(code, title, sourceContext, depth);
        procedureRefs.put(code, reference);
        return reference;
    }

    public boolean hasReference(String code) {
        return procedureRefs.containsKey(code);
    }

    public Optional<ProcedureReference> getReference(String code) {
        return Optional.ofNullable(procedureRefs.get(code));
    }

    public Collection<ProcedureReference> getReferences() {
        return Collections.unmodifiableCollection(procedureRefs.values());
    }

    public List<ProcedureReference> getReferences(ReferenceStatus status) {
        return procedureRefs.values().stream()
                .filter(ref -> ref.getStatus() == status)
                .toList();
    }

    // --- entities ---

    /**
     * Records a sighting of an entity, creating it on first sight.
     */
    public Entity recordEntity(EntityType type, String value, String normalizedValue, EntityMention mention) {
        String id = type.entityId(normalizedValue);
        Entity entity = entities.computeIfAbsent(id, k -> Entity.builder()
                .type(type)
                .value(value)
                .normalizedValue(normalizedValue)
                .build());
        if (mention != null) {
            entity.addMention(mention);
        }
        return entity;
    }

    /**
     * Adds an entity from another network, merging its mentions into an existing one.
     */
    public Entity absorbEntity(Entity other) {
        Entity entity = recordEntity(other.getType(), other.getValue(), other.getNormalizedValue(), null);
        entity.addMentions(other.getMentions());
        other.getAttributes().forEach(entity::putAttributeIfAbsent);
        return entity;
    }

    /**
     * Appends an entity id to a node's entity list.
     */
    public void attachEntity(String nodeId, String entityId) {
        Node node = nodes.get(nodeId);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        }
        node.addEntityId(entityId);
    }

    public Optional<Entity> getEntity(String entityId) {
        return Optional.ofNullable(entities.get(entityId));
    }

    public Collection<Entity> getEntities() {
        return Collections.unmodifiableCollection(entities.values());
    }

    // --- versions, tables, metadata ---

    public void addVersion(Version version) {
        versions.add(Objects.requireNonNull(version, "version is required"));
        if (currentVersion == null) {
            currentVersion = version.revision();
        }
    }

    public List<Version> getVersions() {
        return Collections.unmodifiableList(versions);
    }

    public String getCurrentVersion() {
        return currentVersion;
    }

    public void addLookupTable(LookupTable table) {
        lookupTables.put(table.name(), table);
    }

    public Map<String, LookupTable> getLookupTables() {
        return Collections.unmodifiableMap(lookupTables);
    }

    public void putMetadata(String key, Object value) {
        if (value != null) {
            metadata.put(key, value);
        }
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    // --- checkpoints ---

    /**
     * Marks the current contents so that later additions can be undone with
     * {@link #rollbackTo(Checkpoint)}. Tracks nodes, edges, categories, linked
     * procedures, references, entities with their mentions, and lookup tables.
     */
    public Checkpoint checkpoint() {
        Map<String, Integer> mentionCounts = new HashMap<>();
        entities.forEach((id, entity) -> mentionCounts.put(id, entity.getMentions().size()));
        return new Checkpoint(nodeCounter, edgeCounter, nodes.size(), edges.size(), categoryRoots.size(),
                linkedProcedures.size(), procedureRefs.size(), entities.size(), lookupTables.size(), mentionCounts);
    }

    /**
     * Removes everything added since the checkpoint and restores the id counters.
     */
    public void rollbackTo(Checkpoint checkpoint) {
        Objects.requireNonNull(checkpoint, "checkpoint is required");
        truncate(nodes, checkpoint.nodes());
        truncate(edges, checkpoint.edges());
        truncate(categoryRoots, checkpoint.categories());
        truncate(linkedProcedures, checkpoint.linkedProcedures());
        truncate(procedureRefs, checkpoint.references());
        truncate(entities, checkpoint.entities());
        truncate(lookupTables, checkpoint.lookupTables());
        checkpoint.mentionCounts().forEach((id, count) -> entities.get(id).truncateMentions(count));
        for (Map<String, List<Edge>> index : List.of(outgoing, incoming)) {
            index.keySet().retainAll(nodes.keySet());
            index.values().forEach(list -> list.removeIf(edge -> !edges.containsKey(edge.id())));
        }
        nodeCounter = checkpoint.nodeCounter();
        edgeCounter = checkpoint.edgeCounter();
    }

    private static void truncate(Map<?, ?> map, int size) {
        Iterator<?> keys = map.keySet().iterator();
        for (int i = 0; keys.hasNext(); i++) {
            keys.next();
            if (i >= size) {
                keys.remove();
            }
        }
    }

    /**
     * Sizes of a network at one point in time.
     */
    public record Checkpoint(int nodeCounter, int edgeCounter, int nodes, int edges, int categories,
                             int linkedProcedures, int references, int entities, int lookupTables,
                             Map<String, Integer> mentionCounts) {
        public Checkpoint {
            mentionCounts = Map.copyOf(mentionCounts);
        }
    }

    @Override
    public String toString() {
        return "WorldNetwork{" +
                "documentId='" + documentId + '\'' +
                ", nodes=" + nodes.size() +
                ", edges=" + edges.size() +
                ", categories=" + categoryRoots.size() +
                ", references=" + procedureRefs.size() +
                '}';
    }
}

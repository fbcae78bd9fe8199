package com.sop.network.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sop.network.SopFixtures;
import com.sop.network.core.model.WorldNetwork;
import com.sop.network.observation.ObservationNetwork;
import com.sop.network.query.NetworkQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NetworkJsonExporter Tests")
class NetworkJsonExporterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private NetworkJsonExporter exporter;
    private WorldNetwork network;

    @BeforeEach
    void setUp() {
        exporter = new NetworkJsonExporter();
        network = SopFixtures.build(SopFixtures.DUPLICATE_CLAIMS, "sop-1000");
    }

    @Nested
    @DisplayName("Whole network")
    class WholeNetwork {

        @Test
        @DisplayName("Should write every top-level section")
        void sections() throws Exception {
            JsonNode json = mapper.readTree(exporter.toJson(network));

            List<String> keys = List.of("document_id", "document_name", "root_id", "current_version",
                    "metadata", "claim_type_roots", "linked_procedures", "nodes", "edges", "versions",
                    "procedure_refs", "entities", "lookup_tables");
            keys.forEach(key -> assertTrue(json.has(key), key));
            assertEquals("sop-1000", json.get("document_id").asText());
            assertEquals(18, json.get("nodes").size());
            assertEquals(18, json.get("edges").size());
            assertEquals("node_0002", json.get("claim_type_roots").get("Amazon Claims").asText());
        }

        @Test
        @DisplayName("Should serialize kinds and statuses by tag")
        void tags() throws Exception {
            JsonNode json = mapper.readTree(exporter.toJson(network));

            assertEquals("root", json.get("nodes").get("node_0001").get("node_type").asText());
            assertEquals("claim_type", json.get("nodes").get("node_0002").get("node_type").asText());
            assertEquals("contains", json.get("edges").get("edge_0001").get("edge_type").asText());
            JsonNode letters = json.get("procedure_refs").get("PR.OP.CL.2862");
            assertEquals("pending", letters.get("status").asText());
            assertEquals("Letters", letters.get("title").asText());
            assertTrue(letters.get("linked_root_id").isNull());
        }

        @Test
        @DisplayName("Should keep entity mentions and table cells")
        void entitiesAndTables() throws Exception {
            JsonNode json = mapper.readTree(exporter.toJson(network));

            JsonNode provider = json.get("entities").get("provider_id_CMI0001AB");
            assertEquals("provider_id", provider.get("entity_type").asText());
            assertEquals("Idaho", provider.get("attributes").get("location").asText());
            assertTrue(provider.get("mentions").size() > 0);

            JsonNode table = json.get("lookup_tables").get("care_medical_clinics");
            assertEquals(4, table.get("columns").size());
            JsonNode first = table.get("entries").get(0);
            assertEquals("123456789", first.get("tin").asText());
            assertEquals("123-45-6789", first.get("cells").get("TIN").asText());
            assertEquals(8, json.get("versions").get(0).get("content_hash").asText().length());
        }

        @Test
        @DisplayName("Should write to a file")
        void write(@TempDir Path dir) throws Exception {
            Path target = dir.resolve("network.json");

            exporter.write(network, target);

            assertEquals(exporter.toJson(network), Files.readString(target));
        }

        @Test
        @DisplayName("Should wrap write failures")
        void writeFailure(@TempDir Path dir) {
            Path target = dir.resolve("missing").resolve("network.json");

            NetworkExportException e = assertThrows(NetworkExportException.class,
                    () -> exporter.write(network, target));
            assertNotNull(e.getCause());
        }
    }

    @Nested
    @DisplayName("Views")
    class Views {

        @Test
        @DisplayName("Should export a subgraph")
        void subgraph() throws Exception {
            NetworkQueryService query = new NetworkQueryService(network);

            JsonNode json = mapper.readTree(exporter.toJson(query.subgraphFor("Amazon Claims").orElseThrow()));

            assertEquals("Amazon Claims", json.get("key").asText());
            assertEquals("node_0002", json.get("root_id").asText());
            assertEquals(6, json.get("nodes").size());
            assertEquals(5, json.get("edges").size());
        }

        @Test
        @DisplayName("Should export statistics")
        void statistics() throws Exception {
            JsonNode json = mapper.readTree(exporter.toJson(new NetworkQueryService(network).statistics()));

            assertEquals(18, json.get("total_nodes").asInt());
            assertEquals(2, json.get("decision_points").asInt());
            assertEquals(3, json.get("reference_status").get("pending").asInt());
            assertEquals(0, json.get("reference_status").get("error").asInt());
            assertEquals("2.0", json.get("current_version").asText());
        }

        @Test
        @DisplayName("Should export observations")
        void observations() throws Exception {
            ObservationNetwork observations = new ObservationNetwork();
            observations.absorb(network);

            JsonNode json = mapper.readTree(exporter.toJson(observations));

            assertEquals("provider_id_CMI0001AB", json.get("provider_lookup").get("123456789").get(0).asText());
            assertTrue(json.get("clinic_directory").has("Care Medical Oregon_987654321"));
            assertEquals(1, json.get("summary").get("documents").asInt());
            assertEquals(2, json.get("summary").get("clinic_entries").asInt());
        }
    }
}

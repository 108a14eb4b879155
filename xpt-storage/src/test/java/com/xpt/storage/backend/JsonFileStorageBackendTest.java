package com.xpt.storage.backend;

import com.xpt.storage.LoadOptions;
import com.xpt.storage.StorageCoordinator;
import com.xpt.storage.StoreOptions;
import com.xpt.storage.record.NodeMetadata;
import com.xpt.storage.record.NodeRecord;
import com.xpt.tree.Branch;
import com.xpt.tree.LeafNode;
import com.xpt.tree.NodeKind;
import com.xpt.tree.NodeTree;
import com.xpt.tree.item.Parameter;
import com.xpt.tree.item.Result;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileStorageBackendTest {

    @TempDir
    Path tempDir;

    private JsonFileStorageBackend backend;

    @BeforeEach
    void setUp() {
        backend = new JsonFileStorageBackend();
        backend.open(tempDir.resolve("store").toString());
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    private static NodeMetadata leaf(String name, String fullName) {
        return new NodeMetadata(name, fullName, NodeKind.LEAF, Branch.RESULTS, "Result", "", null, null);
    }

    @Test
    void writeNode_nullPayloadKeepsStoredPayload() {
        backend.writeNode("results", NodeMetadata.group("results", "results", Branch.RESULTS), null);
        backend.writeNode("results.r", leaf("r", "results.r"), Map.of("data", 1));

        backend.writeNode("results.r", new NodeMetadata("r", "results.r", NodeKind.LEAF, Branch.RESULTS, "Result",
                "changed", null, null), null);

        NodeRecord record = backend.readNode("results.r").orElseThrow();
        assertEquals("changed", record.metadata().comment());
        assertEquals(1, record.payload().get("data"));
        assertTrue(Files.exists(tempDir.resolve("store/tree/results/r/node.json")));
    }

    @Test
    void listChildren_keepsFirstWriteOrder() {
        backend.writeNode("results", NodeMetadata.group("results", "results", Branch.RESULTS), null);
        backend.writeNode("results.b", leaf("b", "results.b"), Map.of("data", 1));
        backend.writeNode("results.a", leaf("a", "results.a"), Map.of("data", 2));
        backend.writeNode("results.b", leaf("b", "results.b"), Map.of("data", 3));

        assertEquals(List.of("b", "a"), backend.listChildren("results"));
        assertEquals(List.of("results"), backend.listChildren(""));
    }

    @Test
    void deleteNode_removesSubtreeAndParentEntry() {
        backend.writeNode("results", NodeMetadata.group("results", "results", Branch.RESULTS), null);
        backend.writeNode("results.g", NodeMetadata.group("g", "results.g", Branch.RESULTS), null);
        backend.writeNode("results.g.r", leaf("r", "results.g.r"), Map.of("data", 1));

        backend.deleteNode("results.g");

        assertFalse(backend.readNode("results.g.r").isPresent());
        assertTrue(backend.listChildren("results").isEmpty());
    }

    @Test
    void deletePayloadFields_andOverviewRows() {
        backend.writeNode("results.r", leaf("r", "results.r"), Map.of("a", 1, "b", 2));
        backend.deletePayloadFields("results.r", List.of("a"));
        backend.appendOverviewRow("results", Map.of("full_name", "results.r"));
        backend.appendOverviewRow("results", Map.of("full_name", "results.s"));

        assertNull(backend.readNode("results.r").orElseThrow().payload().get("a"));
        assertEquals(2, backend.readOverview("results").size());
        assertTrue(backend.readOverview("parameters").isEmpty());
    }

    @Test
    void coordinator_roundTripsThroughFiles() {
        StorageCoordinator coordinator = new StorageCoordinator(backend, "traj", "1.0", 1000);
        NodeTree tree = new NodeTree();
        Parameter x = new Parameter(0.5);
        x.explore(List.of(0.5, 1.5));
        tree.addLeaf("parameters.x", x);
        tree.addLeaf("results.r", new Result("done"));
        coordinator.store(tree.getRoot(), StoreOptions.defaults());

        JsonFileStorageBackend reopened = new JsonFileStorageBackend();
        reopened.open(tempDir.resolve("store").toString());
        NodeTree loaded = new NodeTree();
        new StorageCoordinator(reopened, "traj", "1.0", 1000).loadPath(loaded, "", LoadOptions.defaults());

        assertEquals(List.of(0.5, 1.5), ((LeafNode) loaded.get("x")).getItem(Parameter.class).getRange());
        assertEquals("done", ((LeafNode) loaded.get("r")).getItem(Result.class).get());
    }
}

package com.xpt.storage;

import com.xpt.storage.backend.InMemoryStorageBackend;
import com.xpt.storage.record.NodeRecord;
import com.xpt.storage.record.RunRecord;
import com.xpt.storage.record.TrajectoryDescriptor;
import com.xpt.tree.Branch;
import com.xpt.tree.GroupNode;
import com.xpt.tree.LeafNode;
import com.xpt.tree.Node;
import com.xpt.tree.NodeTree;
import com.xpt.tree.item.Parameter;
import com.xpt.tree.item.Result;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StorageCoordinatorTest {

    private Map<String, InMemoryStorageBackend.Store> shared;
    private InMemoryStorageBackend backend;
    private StorageCoordinator coordinator;
    private NodeTree tree;

    @BeforeEach
    void setUp() {
        shared = new ConcurrentHashMap<>();
        backend = new InMemoryStorageBackend(shared);
        coordinator = new StorageCoordinator(backend, "traj", "1.0", 1000);
        coordinator.open("traj");
        tree = new NodeTree();
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
    }

    private void populate() {
        Parameter x = new Parameter(1);
        x.explore(List.of(1, 2, 3));
        LeafNode leaf = tree.addLeaf("parameters.x", x);
        leaf.setComment("explored");
        LeafNode r = tree.addLeaf("results.r", new Result(2.5));
        r.setAnnotation("unit", "s");
        GroupNode holder = tree.addGroup("results.holder");
        tree.addLink(holder, "x", leaf);
    }

    private Object storedField(String path, String field) {
        return backend.readNode(path).map(NodeRecord::payload).map(p -> p.get(field)).orElse(null);
    }

    @Test
    void storeThenLoad_roundTripsStructureItemsAndLinks() {
        populate();
        coordinator.store(tree.getRoot(), StoreOptions.defaults());

        NodeTree loaded = new NodeTree();
        coordinator.loadPath(loaded, "", LoadOptions.defaults());

        LeafNode x = (LeafNode) loaded.get("parameters.x");
        assertEquals(List.of(1, 2, 3), x.getItem(Parameter.class).getRange());
        assertEquals("explored", x.getComment());
        LeafNode r = (LeafNode) loaded.get("results.r");
        assertEquals(2.5, r.getItem(Result.class).get());
        assertEquals("s", r.getAnnotation("unit"));
        assertSame(x, loaded.get("results.holder.x"));
        assertTrue(x.isStored());
        assertTrue(tree.get("results.r").isStored());
    }

    @Test
    void skeletonStore_isIdempotent() {
        populate();
        LeafNode seeded = tree.addLeaf("results.seeded", new Result(List.of(1L, 2L)));
        seeded.setAnnotation("seed", 42L);
        seeded.setAnnotation("scale", 0.5f);
        coordinator.store(tree.getRoot(), StoreOptions.defaults().withDataLevel(StoreDataLevel.SKELETON));
        long writes = backend.getWriteCount();
        int records = backend.getStore().size();

        int written = coordinator.store(tree.getRoot(), StoreOptions.defaults().withDataLevel(StoreDataLevel.SKELETON));

        assertEquals(0, written);
        assertEquals(writes, backend.getWriteCount());
        assertEquals(records, backend.getStore().size());
        assertFalse(backend.readNode("results.r").orElseThrow().hasPayload());
    }

    @Test
    void overwriteStore_unchangedNumericPayloadIsNotRewritten() {
        LeafNode seeded = tree.addLeaf("results.seeded", new Result(List.of(1L, 2L)));
        seeded.setAnnotation("seed", 42L);
        seeded.setAnnotation("scale", 0.5f);
        coordinator.store(tree.getRoot(), StoreOptions.defaults().withDataLevel(StoreDataLevel.OVERWRITE));
        long writes = backend.getWriteCount();

        int written = coordinator.store(tree.getRoot(), StoreOptions.defaults().withDataLevel(StoreDataLevel.OVERWRITE));

        assertEquals(0, written);
        assertEquals(writes, backend.getWriteCount());
    }

    @Test
    void payloadLevel_keepsStoredPayloadUnlessForced() {
        LeafNode leaf = tree.addLeaf("results.r", new Result(1));
        coordinator.store(tree.getRoot(), StoreOptions.defaults());
        Result r = leaf.getItem(Result.class);
        r.set(5);

        coordinator.store(leaf, StoreOptions.defaults());
        assertEquals(1, storedField("results.r", "data"));

        coordinator.store(leaf, StoreOptions.defaults().withOverwriteFields(List.of("data", "missing")));
        assertEquals(5, storedField("results.r", "data"));

        r.set("extra", 7);
        coordinator.store(leaf, StoreOptions.defaults().withDataLevel(StoreDataLevel.OVERWRITE));
        assertEquals(7, storedField("results.r", "extra"));
    }

    @Test
    void incrementalLevel_addsOnlyNewFields() {
        Result r = new Result();
        r.set("a", 1);
        LeafNode leaf = tree.addLeaf("results.r", r);
        coordinator.store(leaf, StoreOptions.defaults());

        r.set("a", 2);
        r.set("b", 3);
        coordinator.store(leaf, StoreOptions.defaults().withDataLevel(StoreDataLevel.INCREMENTAL));

        assertEquals(1, storedField("results.r", "a"));
        assertEquals(3, storedField("results.r", "b"));
    }

    @Test
    void store_writesMissingAncestorsAsSkeletons() {
        LeafNode leaf = tree.addLeaf("results.sim.deep.r", new Result(1));

        coordinator.store(leaf, StoreOptions.defaults());

        assertTrue(backend.readNode("").isPresent());
        assertEquals(Branch.RESULTS, backend.readNode("results.sim").orElseThrow().metadata().branch());
        assertEquals(List.of("deep"), backend.listChildren("results.sim"));
        assertTrue(leaf.isStored());
        assertFalse(tree.get("results.sim").isStored());
    }

    @Test
    void depthLimitedStoreAndLoad() {
        tree.addLeaf("results.g1.g2.g3.leaf", new Result(1));
        coordinator.store(tree.getRoot(), StoreOptions.defaults().withMaxDepth(3));

        assertTrue(backend.readNode("results.g1.g2").isPresent());
        assertFalse(backend.readNode("results.g1.g2.g3").isPresent());

        NodeTree loaded = new NodeTree();
        coordinator.loadPath(loaded, "", LoadOptions.defaults().withMaxDepth(2));

        assertTrue(loaded.contains("results.g1"));
        assertFalse(loaded.contains("results.g1.g2"));
    }

    @Test
    void nonRecursiveLoad_loadsOnlyTheNode() {
        populate();
        coordinator.store(tree.getRoot(), StoreOptions.defaults());

        NodeTree loaded = new NodeTree();
        Node results = coordinator.loadPath(loaded, "results", LoadOptions.defaults().withRecursive(false));

        assertEquals("results", results.getFullName());
        assertFalse(((GroupNode) results).hasChildren());
    }

    @Test
    void load_followsLinksWithoutUsingDepth() {
        populate();
        coordinator.store(tree.getRoot(), StoreOptions.defaults());

        NodeTree loaded = new NodeTree();
        coordinator.loadPath(loaded, "results.holder", LoadOptions.defaults().withMaxDepth(0));

        assertTrue(loaded.contains("parameters.x"));
        assertSame(loaded.get("parameters.x"), loaded.get("results.holder.x"));
        assertFalse(loaded.contains("results.r"));

        NodeTree noLinks = new NodeTree();
        coordinator.loadPath(noLinks, "results.holder", LoadOptions.defaults().withLinks(false));
        assertFalse(noLinks.contains("parameters.x"));
    }

    @Test
    void load_linkCycleTerminates() {
        GroupNode a = tree.addGroup("results.a");
        tree.addLink(a, "back", tree.get("results"));
        coordinator.store(tree.getRoot(), StoreOptions.defaults());

        NodeTree loaded = new NodeTree();
        coordinator.loadPath(loaded, "", LoadOptions.defaults());

        assertSame(loaded.get("results"), loaded.get("results.a.back"));
    }

    @Test
    void load_dataLevelsAndFieldFilters() {
        populate();
        coordinator.store(tree.getRoot(), StoreOptions.defaults());

        NodeTree skeleton = new NodeTree();
        coordinator.loadPath(skeleton, "", LoadOptions.defaults().withDataLevel(LoadDataLevel.SKELETON));
        LeafNode x = (LeafNode) skeleton.get("parameters.x");
        assertTrue(x.getItem().isEmpty());

        coordinator.loadPath(skeleton, "parameters.x",
                LoadOptions.defaults().withLoadExcept(Set.of(Parameter.FIELD_EXPLORED)));
        assertEquals(1, x.getItem(Parameter.class).get());
        assertFalse(x.getItem(Parameter.class).isArray());

        coordinator.loadPath(skeleton, "parameters.x", LoadOptions.defaults().withDataLevel(LoadDataLevel.OVERWRITE));
        assertSame(x, skeleton.get("parameters.x"));
        assertEquals(3, x.getItem(Parameter.class).length());
    }

    @Test
    void loadOptions_rejectOnlyAndExceptTogether() {
        assertThrows(IllegalArgumentException.class,
                () -> LoadOptions.defaults().withLoadOnly(Set.of("a")).withLoadExcept(Set.of("b")));
    }

    @Test
    void load_missingPathFails() {
        assertThrows(DataNotInStorageException.class,
                () -> coordinator.loadPath(new NodeTree(), "results.none", LoadOptions.defaults()));
    }

    @Test
    void load_versionMismatchUnlessForced() {
        populate();
        coordinator.store(tree.getRoot(), StoreOptions.defaults());
        coordinator.storeDescriptor(new TrajectoryDescriptor("traj", "0.9", null, List.of(), List.of()));

        VersionMismatchException e = assertThrows(VersionMismatchException.class,
                () -> coordinator.loadPath(new NodeTree(), "", LoadOptions.defaults()));
        assertEquals("0.9", e.getStoredVersion());

        NodeTree forced = new NodeTree();
        coordinator.loadPath(forced, "", LoadOptions.defaults().withForce(true));
        assertTrue(forced.contains("results.r"));
    }

    @Test
    void descriptor_roundTripsAndSurvivesRootStores() {
        TrajectoryDescriptor descriptor = new TrajectoryDescriptor("traj", "1.0", 42L,
                List.of(new RunRecord(0, "run_00000000", true, 1L, 2L, "x: 1")), List.of("parameters.x"));
        coordinator.storeDescriptor(descriptor);
        populate();
        coordinator.store(tree.getRoot(), StoreOptions.defaults());

        TrajectoryDescriptor read = coordinator.readDescriptor().orElseThrow();

        assertEquals(descriptor, read);
    }

    @Test
    void deleteItem_groupsNeedRecursive() {
        populate();
        coordinator.store(tree.getRoot(), StoreOptions.defaults());
        Node results = tree.get("results");

        assertThrows(IllegalStateException.class, () -> coordinator.deleteItem(results, DeleteOptions.defaults()));

        coordinator.deleteItem(results, DeleteOptions.defaults().withRecursive(true).withRemoveFromTrajectory(true));

        assertFalse(backend.readNode("results.r").isPresent());
        assertFalse(tree.contains("results"));
        assertEquals(List.of("parameters"), backend.listChildren(""));
    }

    @Test
    void deleteItem_keepsInMemoryNodeByDefault() {
        populate();
        coordinator.store(tree.getRoot(), StoreOptions.defaults());
        Node r = tree.get("results.r");

        coordinator.deleteItem(r, DeleteOptions.defaults());

        assertFalse(backend.readNode("results.r").isPresent());
        assertTrue(tree.contains("results.r"));
        assertFalse(r.isStored());
        assertThrows(DataNotInStorageException.class, () -> coordinator.deleteItem(r, DeleteOptions.defaults()));
    }

    @Test
    void deleteItem_onlySelectedFields() {
        Result r = new Result();
        r.set("a", 1);
        r.set("b", 2);
        LeafNode leaf = tree.addLeaf("results.r", r);
        coordinator.store(leaf, StoreOptions.defaults());

        coordinator.deleteItem(leaf, DeleteOptions.defaults().withDeleteOnly(List.of("a"), true));

        assertEquals(Set.of("b"), backend.readNode("results.r").orElseThrow().payload().keySet());
        assertFalse(r.contains("a"));
    }

    @Test
    void deleteLink_removesStoredAndInMemoryLink() {
        populate();
        coordinator.store(tree.getRoot(), StoreOptions.defaults());
        GroupNode holder = (GroupNode) tree.get("results.holder");

        coordinator.deleteLink(holder, "x", true);

        assertTrue(backend.readNode("results.holder").orElseThrow().metadata().links().isEmpty());
        assertFalse(tree.getLinkIndex().hasLink(holder, "x"));
        assertThrows(DataNotInStorageException.class, () -> coordinator.deleteLink(holder, "x", false));
    }

    @Test
    void overview_isCappedPerBranch() {
        StorageCoordinator capped = new StorageCoordinator(new InMemoryStorageBackend(shared), "traj", "1.0", 2);
        capped.open("capped");
        tree.addLeaf("results.a", new Result(1));
        tree.addLeaf("results.b", new Result(2));
        tree.addLeaf("results.c", new Result(3));
        tree.addLeaf("parameters.p", new Parameter(1));

        capped.store(tree.getRoot(), StoreOptions.defaults());

        List<Map<String, Object>> rows = capped.overview(Branch.RESULTS);
        assertEquals(2, rows.size());
        assertEquals("results.a", rows.get(0).get("full_name"));
        assertEquals(1, capped.overview(Branch.PARAMETERS).size());
        assertTrue(capped.getBackend().readNode("results.c").orElseThrow().hasPayload());
    }

    @Test
    void migrate_copiesRecordsToNewLocation() {
        populate();
        coordinator.store(tree.getRoot(), StoreOptions.defaults());

        int copied = coordinator.migrate("moved");

        assertEquals("moved", coordinator.location());
        assertEquals(6, copied);
        NodeTree loaded = new NodeTree();
        coordinator.loadPath(loaded, "", LoadOptions.defaults());
        assertEquals(2.5, ((LeafNode) loaded.get("results.r")).getItem(Result.class).get());
        assertEquals(2, coordinator.overview(Branch.RESULTS).size() + coordinator.overview(Branch.PARAMETERS).size());
        assertTrue(shared.containsKey("traj"));
    }
}

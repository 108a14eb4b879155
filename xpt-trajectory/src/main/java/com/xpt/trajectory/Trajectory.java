package com.xpt.trajectory;

import com.xpt.config.XptConfig;
import com.xpt.exploration.ExplorationEngine;
import com.xpt.exploration.RunInfo;
import com.xpt.storage.DataNotInStorageException;
import com.xpt.storage.DeleteOptions;
import com.xpt.storage.LoadDataLevel;
import com.xpt.storage.LoadOptions;
import com.xpt.storage.StorageBackend;
import com.xpt.storage.StorageCoordinator;
import com.xpt.storage.StoreOptions;
import com.xpt.storage.backend.StorageServiceRegistry;
import com.xpt.storage.record.RunRecord;
import com.xpt.storage.record.TrajectoryDescriptor;
import com.xpt.tree.Branch;
import com.xpt.tree.GroupNode;
import com.xpt.tree.LeafNode;
import com.xpt.tree.Node;
import com.xpt.tree.NodeTree;
import com.xpt.tree.item.ItemContract;
import com.xpt.tree.item.Parameter;
import com.xpt.tree.item.Result;
import com.xpt.tree.naming.NoSuchNodeException;
import com.xpt.tree.naming.PathNames;
import com.xpt.tree.naming.RunNames;
import com.xpt.tree.snapshot.NodeSnapshot;
import com.xpt.tree.snapshot.NodeSnapshots;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A named, versioned experiment namespace: the node tree, its exploration into runs and, when bound,
 * its storage.
 * <p>
 * Lookups go through the tree; with auto-load enabled a path missing in memory is loaded from storage
 * before giving up. A trajectory is used from one thread; workers get their own copy via
 * {@link #forRun(int)}.
 */
public final class Trajectory {

    private static final Logger log = LoggerFactory.getLogger(Trajectory.class);

    private final String name;
    private final String formatVersion;
    private final long createdAt;
    private final NodeTree tree = new NodeTree();
    private final ExplorationEngine exploration = new ExplorationEngine(tree);
    private final StorageCoordinator storage;
    private boolean autoLoad;
    private TrajectoryState state = TrajectoryState.BUILT;

    /** In-memory trajectory without storage. */
    public Trajectory(String name) {
        this(name, XptConfig.DEFAULT_FORMAT_VERSION, null);
    }

    /** Trajectory bound to an opened coordinator; the format version is the coordinator's. */
    public Trajectory(String name, StorageCoordinator storage) {
        this(name, storage.getFormatVersion(), storage);
    }

    private Trajectory(String name, String formatVersion, StorageCoordinator storage) {
        PathNames.validateName(Objects.requireNonNull(name, "name"));
        this.name = name;
        this.formatVersion = formatVersion;
        this.storage = storage;
        this.createdAt = System.currentTimeMillis();
    }

    /**
     * Creates a trajectory whose storage comes from {@code config}: the configured service, opened at
     * {@code <storageLocation>/<name>}. Auto-load and link defaults are taken from the config as well.
     *
     * @throws com.xpt.storage.NoSuchServiceException if the configured service is not registered
     */
    public static Trajectory create(String name, XptConfig config, StorageServiceRegistry registry) {
        StorageBackend backend = registry.create(config.getStorageService());
        StorageCoordinator coordinator = new StorageCoordinator(backend, name, config.getFormatVersion(),
                config.getMaxOverviewRows());
        coordinator.open(Paths.get(config.getStorageLocation(), name).toString());
        Trajectory trajectory = new Trajectory(name, coordinator);
        trajectory.setAutoLoad(config.isAutoLoad());
        trajectory.setWithLinks(config.isWithLinks());
        log.info("Trajectory created | name={} | service={} | location={}", name, config.getStorageService(),
                coordinator.location());
        return trajectory;
    }

    public String getName() {
        return name;
    }

    public String getFormatVersion() {
        return formatVersion;
    }

    public NodeTree getTree() {
        return tree;
    }

    public GroupNode getRoot() {
        return tree.getRoot();
    }

    public ExplorationEngine getExploration() {
        return exploration;
    }

    /** Bound storage, if any. */
    public Optional<StorageCoordinator> getStorage() {
        return Optional.ofNullable(storage);
    }

    public TrajectoryState state() {
        return state;
    }

    public boolean isAutoLoad() {
        return autoLoad;
    }

    public void setAutoLoad(boolean autoLoad) {
        this.autoLoad = autoLoad;
    }

    public boolean isWithLinks() {
        return tree.isWithLinks();
    }

    public void setWithLinks(boolean withLinks) {
        tree.setWithLinks(withLinks);
    }

    // ---- building ----

    public LeafNode addParameter(String path, Object value) {
        return addLeaf(branchPath(Branch.PARAMETERS, path), new Parameter(value));
    }

    public LeafNode addParameter(String path, Object value, String comment) {
        LeafNode leaf = addParameter(path, value);
        leaf.setComment(comment);
        return leaf;
    }

    public LeafNode addDerivedParameter(String path, Object value) {
        return addLeaf(branchPath(Branch.DERIVED_PARAMETERS, path), new Parameter(value));
    }

    public LeafNode addConfig(String path, Object value) {
        return addLeaf(branchPath(Branch.CONFIG, path), new Parameter(value));
    }

    public LeafNode addResult(String path, Object value) {
        return addResult(path, value instanceof Result r ? r : new Result(value));
    }

    public LeafNode addResult(String path, Result result) {
        return addLeaf(branchPath(Branch.RESULTS, path), result);
    }

    public GroupNode addGroup(String path) {
        return tree.addGroup(path);
    }

    public LeafNode addLeaf(String path, ItemContract item) {
        return tree.addLeaf(path, item);
    }

    /** Adds link {@code path → target}; intermediate groups of {@code path} are created. */
    public void addLink(String path, String targetPath) {
        tree.addLink(path, get(targetPath));
    }

    public void addLink(String path, Node target) {
        tree.addLink(path, target);
    }

    /** Prefixes {@code path} with the branch group unless it already starts with it (or its alias). */
    static String branchPath(Branch branch, String path) {
        List<String> segments = PathNames.split(path);
        if (!segments.isEmpty() && branch.getGroupName().equals(PathNames.translate(segments.get(0), null))) {
            return path;
        }
        return branch.getGroupName() + PathNames.SEPARATOR + path;
    }

    // ---- lookup ----

    /**
     * Resolves {@code path}; with auto-load a miss is loaded from storage.
     *
     * @throws NoSuchNodeException       if nothing matches and auto-load is off
     * @throws DataNotInStorageException if auto-load is on and storage has nothing either
     */
    public Node get(String path) {
        try {
            return tree.get(path);
        } catch (NoSuchNodeException e) {
            if (!autoLoad || storage == null) throw e;
            String fullName = fullNameOf(path);
            if (fullName == null) throw e;
            log.info("Auto-load | path={} | fullName={}", path, fullName);
            try {
                return storage.loadPath(tree, fullName, LoadOptions.defaults());
            } catch (DataNotInStorageException notStored) {
                notStored.addSuppressed(e);
                throw notStored;
            }
        }
    }

    /** Like {@link #get(String)} but returns {@code fallback} when nothing is found. */
    public Node getDefault(String path, Node fallback) {
        try {
            return get(path);
        } catch (NoSuchNodeException | DataNotInStorageException e) {
            return fallback;
        }
    }

    /** Value of a leaf: a parameter's value for the bound run (its default without one), a result's data field. */
    public Object value(String path) {
        Node node = get(path);
        if (!(node instanceof LeafNode leaf)) {
            throw new IllegalArgumentException("`" + node.getFullName() + "` is a group, not a leaf");
        }
        ItemContract item = leaf.getItem();
        if (item instanceof Parameter p) {
            Integer run = tree.getCurrentRun();
            return run != null && p.isArray() ? p.valueAt(run) : p.get();
        }
        if (item instanceof Result r) return r.get();
        return item.toDict();
    }

    /** Same as {@link #value(String)}, returning {@code fallback} when the path does not exist. */
    public Object valueOrDefault(String path, Object fallback) {
        Node node = getDefault(path, null);
        return node == null ? fallback : value(node.getFullName());
    }

    public boolean contains(String path) {
        return tree.contains(path);
    }

    /**
     * Node {@code name} below {@code results.runs.<run>} for every run that has it, keyed by run name.
     */
    public Map<String, Node> getFromRuns(String name, boolean withLinks) {
        Map<String, Node> out = new LinkedHashMap<>();
        for (int i = 0; i < Math.max(exploration.runs().size(), 1); i++) {
            String runName = RunNames.name(i);
            Optional<Node> runGroup = tree.find(tree.getRoot(), "results.runs." + runName,
                    tree.defaultOptions().withShortcuts(false).withRun(i));
            if (runGroup.isEmpty() || !(runGroup.get() instanceof GroupNode group)) continue;
            tree.find(group, name, tree.defaultOptions().withLinks(withLinks).withRun(i))
                    .ifPresent(n -> out.put(runName, n));
        }
        return out;
    }

    // ---- exploration and runs ----

    public void explore(Map<String, ? extends List<?>> bindings) {
        exploration.explore(bindings);
    }

    public void expand(Map<String, ? extends List<?>> bindings) {
        exploration.expand(bindings);
    }

    public int length() {
        return exploration.length();
    }

    public List<RunInfo> runs() {
        return exploration.runs();
    }

    /** Binds run {@code index}: wildcards resolve to it and parameter values are taken from it. */
    public void setCurrentRun(int index) {
        if (index < 0 || index >= length()) {
            throw new IndexOutOfBoundsException("Run " + index + " out of range, length " + length());
        }
        tree.setCurrentRun(index);
    }

    public void clearCurrentRun() {
        tree.setCurrentRun(null);
    }

    public Integer getCurrentRun() {
        return tree.getCurrentRun();
    }

    /**
     * Drops explored ranges and runs.
     *
     * @throws IllegalStateException once the trajectory has been stored or loaded
     */
    public void shrink() {
        if (state != TrajectoryState.BUILT) {
            throw new IllegalStateException("Cannot shrink trajectory `" + name + "` in state " + state);
        }
        exploration.shrink();
    }

    // ---- storage ----

    /** Stores the whole trajectory and its descriptor. */
    public void store() {
        store(StoreOptions.defaults());
    }

    public void store(StoreOptions options) {
        StorageCoordinator s = requireStorage();
        s.storeDescriptor(descriptor());
        s.store(tree.getRoot(), options);
        if (options.recursive() && options.maxDepth() == StoreOptions.UNLIMITED) {
            state = TrajectoryState.FULLY_STORED;
        } else if (state == TrajectoryState.BUILT) {
            state = TrajectoryState.PARTIALLY_STORED;
        }
    }

    /** Stores the node at {@code path} (and its subtree, per the options). */
    public void storeItem(String path, StoreOptions options) {
        StorageCoordinator s = requireStorage();
        s.store(get(path), options);
        if (state == TrajectoryState.BUILT) state = TrajectoryState.PARTIALLY_STORED;
    }

    /** Writes the descriptor (runs, explored parameters, version) only. */
    public void storeDescriptor() {
        requireStorage().storeDescriptor(descriptor());
    }

    /** Loads the whole trajectory and its run bookkeeping. */
    public void load() {
        load(LoadOptions.defaults());
    }

    public void load(LoadOptions options) {
        StorageCoordinator s = requireStorage();
        s.checkVersion(options.force());
        TrajectoryDescriptor descriptor = s.readDescriptor()
                .orElseThrow(() -> new DataNotInStorageException("", "trajectory `" + name + "` has no descriptor"));
        s.loadPath(tree, "", options);
        List<RunInfo> restored = new ArrayList<>();
        for (RunRecord r : descriptor.runs()) {
            restored.add(new RunInfo(r.index(), r.completed(), r.startedAt(), r.finishedAt(), r.summary()));
        }
        exploration.restore(restored, descriptor.exploredParameters());
        state = TrajectoryState.LOADED;
        log.info("Trajectory loaded | name={} | runs={} | level={}", name, restored.size(), options.dataLevel());
    }

    /** Loads structure only. */
    public void loadSkeleton() {
        load(LoadOptions.defaults().withDataLevel(LoadDataLevel.SKELETON));
    }

    /** Loads the stored subtree at {@code path} (full path, aliases allowed). */
    public Node loadChild(String path, LoadOptions options) {
        String fullName = fullNameOf(path);
        if (fullName == null) {
            throw new IllegalStateException("Path `" + path + "` uses the run wildcard but no run is bound");
        }
        return requireStorage().loadPath(tree, fullName, options);
    }

    public void deleteItem(String path, DeleteOptions options) {
        requireStorage().deleteItem(get(path), options);
    }

    public void deleteLink(String ownerPath, String linkName, boolean removeFromTrajectory) {
        Node owner = get(ownerPath);
        if (!(owner instanceof GroupNode group)) {
            throw new IllegalArgumentException("`" + owner.getFullName() + "` is not a group");
        }
        requireStorage().deleteLink(group, linkName, removeFromTrajectory);
    }

    /** Removes the node at {@code path} from memory only. */
    public void removeChild(String path, boolean recursive) {
        Node node = get(path);
        if (node.getParent() == null) throw new IllegalArgumentException("The root cannot be removed");
        tree.removeChild(node.getParent(), node.getName(), recursive);
    }

    /** Copies the stored trajectory to {@code newLocation} and continues there. */
    public int migrate(String newLocation) {
        return requireStorage().migrate(newLocation);
    }

    /** Trajectory-level record: name, version, runs and explored parameters. */
    public TrajectoryDescriptor descriptor() {
        List<RunRecord> records = new ArrayList<>();
        for (RunInfo r : exploration.runs()) {
            records.add(new RunRecord(r.getIndex(), r.getName(), r.isCompleted(), r.getStartedAt(), r.getFinishedAt(),
                    r.getSummary()));
        }
        return new TrajectoryDescriptor(name, formatVersion, createdAt, records, exploration.exploredParameters());
    }

    // ---- copies ----

    /** Immutable copy of the whole tree. */
    public NodeSnapshot snapshot() {
        return NodeSnapshots.capture(tree, tree.getRoot(), NodeSnapshots.UNLIMITED);
    }

    /** Rebuilds an in-memory trajectory (no storage) from a snapshot. */
    public static Trajectory fromSnapshot(String name, String formatVersion, NodeSnapshot snapshot) {
        Trajectory t = new Trajectory(name, formatVersion, null);
        NodeSnapshots.restore(t.tree, snapshot);
        return t;
    }

    /**
     * Independent in-memory copy bound to run {@code index}. Shorthand for
     * {@code runTemplate().instantiate(index)}.
     */
    public Trajectory forRun(int index) {
        return runTemplate().instantiate(index);
    }

    /**
     * Serialized, immutable image of this trajectory from which per-run copies are built. Capture it
     * once on the owning thread and hand it to workers.
     */
    public RunTemplate runTemplate() {
        return new RunTemplate(name, formatVersion, NodeSnapshots.toJson(snapshot()), descriptor().runs(),
                exploration.exploredParameters(), tree.isWithLinks());
    }

    static Trajectory instantiate(RunTemplate template, int index) {
        Trajectory copy = fromSnapshot(template.name(), template.formatVersion(),
                NodeSnapshots.fromJson(template.snapshotJson()));
        List<RunInfo> runs = new ArrayList<>();
        for (RunRecord r : template.runs()) {
            runs.add(new RunInfo(r.index(), r.completed(), r.startedAt(), r.finishedAt(), r.summary()));
        }
        copy.exploration.restore(runs, template.exploredParameters());
        copy.tree.setWithLinks(template.withLinks());
        copy.tree.setCurrentRun(index);
        return copy;
    }

    private StorageCoordinator requireStorage() {
        if (storage == null) {
            throw new IllegalStateException("Trajectory `" + name + "` has no storage");
        }
        return storage;
    }

    /** Full name for a path without shortcuts; null when a wildcard cannot be resolved. */
    private String fullNameOf(String path) {
        List<String> names = new ArrayList<>();
        for (String segment : PathNames.split(path)) {
            String translated = PathNames.translate(segment, tree.getCurrentRun());
            if (translated == null) return null;
            names.add(translated);
        }
        return String.join(PathNames.SEPARATOR, names);
    }

    @Override
    public String toString() {
        return "Trajectory{" + name + ", runs=" + exploration.runs().size() + ", state=" + state + "}";
    }
}

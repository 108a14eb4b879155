package com.xpt.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xpt.storage.backend.NodeRecordCodec;
import com.xpt.storage.record.NodeMetadata;
import com.xpt.storage.record.NodeRecord;
import com.xpt.storage.record.TrajectoryDescriptor;
import com.xpt.tree.Branch;
import com.xpt.tree.GroupNode;
import com.xpt.tree.LeafNode;
import com.xpt.tree.Node;
import com.xpt.tree.NodeKind;
import com.xpt.tree.NodeTree;
import com.xpt.tree.item.ItemContract;
import com.xpt.tree.item.ItemTypes;
import com.xpt.tree.naming.PathNames;
import com.xpt.tree.naming.ResolveOptions;
import com.xpt.tree.snapshot.NodeSnapshot;
import com.xpt.tree.snapshot.NodeSnapshots;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Store/load protocol between a {@link NodeTree} and a {@link StorageBackend}.
 * <p>
 * Stores write missing ancestors as skeletons, never rewrite unchanged metadata and decide per leaf
 * which payload fields to write from the {@link StoreDataLevel}. Loads check the stored format version,
 * rebuild nodes up to a depth and optionally follow links. The stored root carries the
 * {@link TrajectoryDescriptor}. Not thread-safe: one writer owns a coordinator at a time.
 */
public final class StorageCoordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StorageCoordinator.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ResolveOptions EXACT = new ResolveOptions(false, false, null);

    private final StorageBackend backend;
    private final String trajectoryName;
    private final String formatVersion;
    private final int maxOverviewRows;
    private final Map<String, Integer> overviewCounts = new HashMap<>();

    public StorageCoordinator(StorageBackend backend, String trajectoryName, String formatVersion, int maxOverviewRows) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.trajectoryName = Objects.requireNonNull(trajectoryName, "trajectoryName");
        this.formatVersion = Objects.requireNonNull(formatVersion, "formatVersion");
        if (maxOverviewRows <= 0) {
            throw new IllegalArgumentException("maxOverviewRows must be positive, got: " + maxOverviewRows);
        }
        this.maxOverviewRows = maxOverviewRows;
    }

    public StorageBackend getBackend() {
        return backend;
    }

    public String getFormatVersion() {
        return formatVersion;
    }

    public void open(String location) {
        backend.open(location);
        overviewCounts.clear();
    }

    public String location() {
        return backend.location();
    }

    @Override
    public void close() {
        backend.close();
        overviewCounts.clear();
    }

    // ---- store ----

    /**
     * Stores {@code node} and, depending on the options, its descendants. Nodes written are marked stored.
     *
     * @return number of records written
     */
    public int store(Node node, StoreOptions options) {
        NodeTree tree = node.getTree();
        if (tree == null) throw new IllegalArgumentException("Node `" + node.getName() + "` is not attached to a tree");
        int depth = options.effectiveDepth();
        int written = storeSnapshot(NodeSnapshots.capture(tree, node, depth), options);
        markStored(node, depth);
        return written;
    }

    /**
     * Stores a captured snapshot. Used directly by the write queue, which only ever sees snapshots.
     *
     * @return number of records written
     */
    public int storeSnapshot(NodeSnapshot snapshot, StoreOptions options) {
        int written = ensureAncestors(snapshot.getFullName());
        written += writeSnapshot(snapshot, options);
        if (log.isInfoEnabled()) {
            log.info("Store | node={} | level={} | depth={} | written={}",
                    displayName(snapshot.getFullName()), options.dataLevel(), depthLabel(options.effectiveDepth()), written);
        }
        return written;
    }

    private int ensureAncestors(String fullName) {
        int written = 0;
        List<String> segments = PathNames.split(fullName);
        String path = "";
        Branch branch = Branch.GENERIC;
        if (backend.readNode("").isEmpty()) {
            backend.writeNode("", rootMetadata(), null);
            written++;
        }
        for (int i = 0; i < segments.size() - 1; i++) {
            String name = segments.get(i);
            branch = i == 0 ? Branch.ofGroupName(name).orElse(Branch.GENERIC) : branch;
            path = PathNames.join(path, name);
            if (backend.readNode(path).isEmpty()) {
                backend.writeNode(path, NodeMetadata.group(name, path, branch), null);
                written++;
            }
        }
        return written;
    }

    private int writeSnapshot(NodeSnapshot snapshot, StoreOptions options) {
        int written = 0;
        Deque<NodeSnapshot> stack = new ArrayDeque<>();
        stack.push(snapshot);
        while (!stack.isEmpty()) {
            NodeSnapshot s = stack.pop();
            if (writeOne(s, options)) written++;
            List<NodeSnapshot> children = s.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) stack.push(children.get(i));
        }
        return written;
    }

    private boolean writeOne(NodeSnapshot s, StoreOptions options) {
        String path = s.getFullName();
        Optional<NodeRecord> existing = backend.readNode(path);
        NodeMetadata metadata = path.isEmpty() ? rootMetadata().withLinks(s.getLinks()) : NodeMetadata.of(s);
        Map<String, Object> payload = s.isLeaf() ? payloadToWrite(s, existing, options) : null;
        boolean metadataChanged = existing.isEmpty()
                || !existing.get().metadata().equals(NodeRecordCodec.normalize(metadata));
        if (!metadataChanged && payload == null) return false;
        backend.writeNode(path, metadata, payload);
        boolean firstPayload = payload != null && !payload.isEmpty()
                && (existing.isEmpty() || !existing.get().hasPayload() || existing.get().payload().isEmpty());
        if (firstPayload) addOverviewRow(s, payload);
        if (log.isDebugEnabled()) {
            log.debug("Store node | path={} | metadataChanged={} | payloadFields={}", path, metadataChanged,
                    payload == null ? 0 : payload.size());
        }
        return true;
    }

    /** Payload to write for a leaf, or null to keep what the backend has. */
    private Map<String, Object> payloadToWrite(NodeSnapshot s, Optional<NodeRecord> existing, StoreOptions options) {
        if (options.dataLevel() == StoreDataLevel.SKELETON) return null;
        Map<String, Object> current = s.getPayload();
        Map<String, Object> stored = existing.filter(NodeRecord::hasPayload).map(NodeRecord::payload).orElse(null);
        List<String> forced = new ArrayList<>();
        for (String field : options.overwriteFields()) {
            if (current.containsKey(field)) forced.add(field);
            else log.warn("Store | overwrite field not in item, skipped | node={} | field={}", s.getFullName(), field);
        }
        Map<String, Object> result;
        switch (options.dataLevel()) {
            case OVERWRITE:
                result = new LinkedHashMap<>(current);
                break;
            case PAYLOAD:
                if (stored == null) {
                    result = new LinkedHashMap<>(current);
                } else {
                    result = new LinkedHashMap<>(stored);
                    for (String f : forced) result.put(f, current.get(f));
                }
                break;
            case INCREMENTAL:
                result = stored == null ? new LinkedHashMap<>() : new LinkedHashMap<>(stored);
                if (!forced.isEmpty()) {
                    for (String f : forced) result.put(f, current.get(f));
                } else {
                    for (Map.Entry<String, Object> e : current.entrySet()) result.putIfAbsent(e.getKey(), e.getValue());
                }
                break;
            default:
                throw new IllegalStateException("Unknown data level " + options.dataLevel());
        }
        return NodeRecordCodec.normalize(result).equals(stored) ? null : result;
    }

    private void addOverviewRow(NodeSnapshot s, Map<String, Object> payload) {
        String table = tableName(s.getBranch());
        int count = overviewCounts.computeIfAbsent(table, t -> backend.readOverview(t).size());
        if (count >= maxOverviewRows) {
            if (count == maxOverviewRows) {
                log.warn("Overview | table full, further rows dropped | table={} | max={}", table, maxOverviewRows);
                overviewCounts.put(table, count + 1);
            }
            return;
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("full_name", s.getFullName());
        row.put("type", s.getItemType());
        row.put("comment", s.getComment());
        row.put("summary", summarize(payload));
        backend.appendOverviewRow(table, row);
        overviewCounts.put(table, count + 1);
    }

    private static String summarize(Map<String, Object> payload) {
        String text = payload.toString();
        return text.length() > 64 ? text.substring(0, 61) + "..." : text;
    }

    private static String tableName(Branch branch) {
        return branch.getGroupName() != null ? branch.getGroupName() : "generic";
    }

    private static void markStored(Node node, int depth) {
        node.setStored(true);
        if (depth > 0 && node instanceof GroupNode g) {
            for (Node child : g.getChildren()) markStored(child, depth - 1);
        }
    }

    // ---- descriptor ----

    public void storeDescriptor(TrajectoryDescriptor descriptor) {
        NodeMetadata metadata = backend.readNode("").map(NodeRecord::metadata).orElse(rootMetadata());
        @SuppressWarnings("unchecked")
        Map<String, Object> payload = MAPPER.convertValue(descriptor, Map.class);
        backend.writeNode("", metadata, payload);
        log.info("Store descriptor | trajectory={} | version={} | runs={}",
                descriptor.name(), descriptor.version(), descriptor.runs().size());
    }

    public Optional<TrajectoryDescriptor> readDescriptor() {
        return backend.readNode("")
                .filter(NodeRecord::hasPayload)
                .filter(r -> !r.payload().isEmpty())
                .map(r -> MAPPER.convertValue(r.payload(), TrajectoryDescriptor.class));
    }

    private NodeMetadata rootMetadata() {
        return new NodeMetadata("", "", NodeKind.GROUP, Branch.GENERIC, null, trajectoryName, null, null);
    }

    /**
     * @throws VersionMismatchException if the stored format version differs and {@code force} is off
     */
    public void checkVersion(boolean force) {
        Optional<TrajectoryDescriptor> descriptor = readDescriptor();
        if (descriptor.isEmpty()) return;
        String stored = descriptor.get().version();
        if (!formatVersion.equals(stored)) {
            if (!force) throw new VersionMismatchException(formatVersion, stored);
            log.warn("Load | version mismatch ignored | expected={} | stored={}", formatVersion, stored);
        }
    }

    // ---- load ----

    public Node load(NodeTree tree, Node node, LoadOptions options) {
        return loadPath(tree, node.getFullName(), options);
    }

    public Node loadChild(NodeTree tree, GroupNode parent, String name, LoadOptions options) {
        return loadPath(tree, PathNames.join(parent.getFullName(), name), options);
    }

    /**
     * Loads the stored node at {@code fullName} into {@code tree}, creating missing ancestors from
     * their stored records.
     *
     * @throws DataNotInStorageException if the backend has no such record
     * @throws VersionMismatchException  if the stored format version differs and loading is not forced
     */
    public Node loadPath(NodeTree tree, String fullName, LoadOptions options) {
        checkVersion(options.force());
        if (backend.readNode(fullName).isEmpty()) throw new DataNotInStorageException(fullName);
        LoadContext ctx = new LoadContext(tree, options);
        ensureAncestorsLoaded(ctx, fullName);
        Node node = loadRecursive(ctx, fullName, options.effectiveDepth());
        ctx.applyPendingLinks();
        if (log.isInfoEnabled()) {
            log.info("Load | node={} | level={} | depth={} | loaded={}",
                    displayName(fullName), options.dataLevel(), depthLabel(options.effectiveDepth()), ctx.loaded.size());
        }
        return node;
    }

    private void ensureAncestorsLoaded(LoadContext ctx, String fullName) {
        List<String> segments = PathNames.split(fullName);
        String path = "";
        for (int i = 0; i < segments.size() - 1; i++) {
            path = PathNames.join(path, segments.get(i));
            if (ctx.tree.find(ctx.tree.getRoot(), path, EXACT).isEmpty()) {
                String ancestor = path;
                NodeRecord record = backend.readNode(ancestor).orElseThrow(() -> new DataNotInStorageException(ancestor));
                ctx.loaded.put(ancestor, materialize(ctx, ancestor, record));
            }
        }
    }

    private Node loadRecursive(LoadContext ctx, String path, int remaining) {
        NodeRecord record = backend.readNode(path).orElseThrow(() -> new DataNotInStorageException(path));
        Node node = ctx.loaded.get(path);
        if (node == null) {
            node = materialize(ctx, path, record);
            ctx.loaded.put(path, node);
        }
        Integer done = ctx.expandedDepth.get(path);
        if (node instanceof GroupNode && (done == null || remaining > done)) {
            ctx.expandedDepth.put(path, remaining);
            if (ctx.options.withLinks()) {
                record.metadata().links().forEach((name, target) -> ctx.pendingLinks.add(new PendingLink(path, name, target, remaining)));
            }
            if (remaining > 0) {
                for (String child : backend.listChildren(path)) {
                    loadRecursive(ctx, PathNames.join(path, child), remaining - 1);
                }
            }
        }
        return node;
    }

    private Node materialize(LoadContext ctx, String path, NodeRecord record) {
        NodeTree tree = ctx.tree;
        NodeMetadata meta = record.metadata();
        LoadDataLevel level = ctx.options.dataLevel();
        Node node;
        if (path.isEmpty()) {
            node = tree.getRoot();
        } else if (meta.kind() == NodeKind.GROUP) {
            node = tree.addGroup(tree.getRoot(), path, null);
        } else {
            Optional<Node> existing = tree.find(tree.getRoot(), path, EXACT);
            if (existing.isPresent() && existing.get() instanceof LeafNode leaf) {
                ItemContract item = leaf.getItem();
                if (level == LoadDataLevel.OVERWRITE) {
                    ItemContract fresh = ItemTypes.create(meta.itemType());
                    fresh.load(filter(record.payload(), ctx.options));
                    if (item.isLocked()) fresh.lock();
                    tree.addLeaf(tree.getRoot(), path, fresh, true);
                } else if (level == LoadDataLevel.PAYLOAD && item.isEmpty()) {
                    item.load(filter(record.payload(), ctx.options));
                }
                node = leaf;
            } else {
                ItemContract item = ItemTypes.create(meta.itemType());
                if (level != LoadDataLevel.SKELETON) item.load(filter(record.payload(), ctx.options));
                node = tree.addLeaf(tree.getRoot(), path, item, false);
            }
        }
        if (!path.isEmpty()) {
            node.setComment(meta.comment());
        }
        node.setAnnotations(meta.annotations());
        node.setStored(true);
        return node;
    }

    private static Map<String, Object> filter(Map<String, Object> payload, LoadOptions options) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (payload == null) return out;
        payload.forEach((k, v) -> {
            if (options.accepts(k)) out.put(k, v);
        });
        return out;
    }

    private record PendingLink(String ownerPath, String name, String targetPath, int remaining) {
    }

    private final class LoadContext {
        final NodeTree tree;
        final LoadOptions options;
        final Map<String, Node> loaded = new LinkedHashMap<>();
        final Map<String, Integer> expandedDepth = new HashMap<>();
        final Deque<PendingLink> pendingLinks = new ArrayDeque<>();

        LoadContext(NodeTree tree, LoadOptions options) {
            this.tree = tree;
            this.options = options;
        }

        /**
         * Loads link targets with the same remaining depth as their owner and adds the links. A group is
         * expanded again only when reached with more remaining depth than before, so link cycles terminate.
         */
        void applyPendingLinks() {
            while (!pendingLinks.isEmpty()) {
                PendingLink link = pendingLinks.poll();
                Node target;
                if (backend.readNode(link.targetPath()).isPresent()) {
                    ensureAncestorsLoaded(this, link.targetPath());
                    target = loadRecursive(this, link.targetPath(), link.remaining());
                } else {
                    target = tree.find(tree.getRoot(), link.targetPath(), EXACT).orElse(null);
                }
                if (target == null) {
                    log.warn("Load | link target not found, skipped | owner={} | link={} | target={}",
                            displayName(link.ownerPath()), link.name(), link.targetPath());
                    continue;
                }
                Node ownerNode = link.ownerPath().isEmpty() ? tree.getRoot() : loaded.get(link.ownerPath());
                if (ownerNode instanceof GroupNode owner && !tree.getLinkIndex().hasLink(owner, link.name())
                        && !owner.hasChild(link.name())) {
                    tree.addLink(owner, link.name(), target);
                }
            }
        }
    }

    // ---- delete ----

    /**
     * Deletes the stored record of {@code node}, or only some of its payload fields.
     *
     * @throws DataNotInStorageException if the node was never stored
     * @throws IllegalStateException     if the node is a group with stored children and the delete is not recursive
     */
    public void deleteItem(Node node, DeleteOptions options) {
        String path = node.getFullName();
        if (path.isEmpty()) throw new IllegalArgumentException("The root cannot be deleted");
        if (backend.readNode(path).isEmpty()) throw new DataNotInStorageException(path);
        if (!options.deleteOnly().isEmpty()) {
            backend.deletePayloadFields(path, options.deleteOnly());
            if (options.removeFromItem() && node instanceof LeafNode leaf) {
                leaf.getItem().removeFields(options.deleteOnly());
            }
            log.info("Delete fields | node={} | fields={}", path, options.deleteOnly());
            return;
        }
        boolean hasChildren = !backend.listChildren(path).isEmpty()
                || (node instanceof GroupNode g && g.hasChildren());
        if (hasChildren && !options.recursive()) {
            throw new IllegalStateException("`" + path + "` has children; delete recursively");
        }
        backend.deleteNode(path);
        if (options.removeFromTrajectory()) {
            GroupNode parent = node.getParent();
            if (parent != null && node.getTree() != null) {
                node.getTree().removeChild(parent, node.getName(), true);
            }
        } else {
            markUnstored(node);
        }
        log.info("Delete | node={} | recursive={} | removeFromTrajectory={}", path, options.recursive(),
                options.removeFromTrajectory());
    }

    /**
     * Removes a stored link of {@code owner}; with {@code removeFromTrajectory} the in-memory link goes too.
     *
     * @throws DataNotInStorageException if the owner or its stored link is missing
     */
    public void deleteLink(GroupNode owner, String name, boolean removeFromTrajectory) {
        String path = owner.getFullName();
        NodeRecord record = backend.readNode(path).orElseThrow(() -> new DataNotInStorageException(path));
        if (!record.metadata().links().containsKey(name)) {
            throw new DataNotInStorageException(PathNames.join(path, name), "no stored link");
        }
        Map<String, String> links = new LinkedHashMap<>(record.metadata().links());
        links.remove(name);
        backend.writeNode(path, record.metadata().withLinks(links), null);
        if (removeFromTrajectory && owner.getTree() != null && owner.getTree().getLinkIndex().hasLink(owner, name)) {
            owner.getTree().removeLink(owner, name);
        }
        log.info("Delete link | owner={} | link={}", displayName(path), name);
    }

    private static void markUnstored(Node node) {
        node.setStored(false);
        if (node instanceof GroupNode g) {
            for (Node child : g.getChildren()) markUnstored(child);
        }
    }

    // ---- overview and migration ----

    /** Rows of the overview table of {@code branch}, in insertion order. */
    public List<Map<String, Object>> overview(Branch branch) {
        return backend.readOverview(tableName(branch));
    }

    /**
     * Copies every record and overview row to {@code newLocation} and rebinds the backend there.
     *
     * @return number of records copied
     */
    public int migrate(String newLocation) {
        String oldLocation = backend.location();
        List<Map.Entry<String, NodeRecord>> records = new ArrayList<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add("");
        while (!queue.isEmpty()) {
            String path = queue.poll();
            Optional<NodeRecord> record = backend.readNode(path);
            if (record.isEmpty()) continue;
            records.add(Map.entry(path, record.get()));
            for (String child : backend.listChildren(path)) queue.add(PathNames.join(path, child));
        }
        Map<String, List<Map<String, Object>>> tables = new LinkedHashMap<>();
        for (Branch b : Branch.values()) {
            List<Map<String, Object>> rows = backend.readOverview(tableName(b));
            if (!rows.isEmpty()) tables.put(tableName(b), rows);
        }
        backend.close();
        open(newLocation);
        for (Map.Entry<String, NodeRecord> e : records) {
            NodeRecord r = e.getValue();
            backend.writeNode(e.getKey(), r.metadata(), r.payload());
        }
        tables.forEach((table, rows) -> rows.forEach(row -> backend.appendOverviewRow(table, row)));
        log.info("Migrate | from={} | to={} | records={}", oldLocation, newLocation, records.size());
        return records.size();
    }

    private static String displayName(String fullName) {
        return fullName.isEmpty() ? "<root>" : fullName;
    }

    private static String depthLabel(int depth) {
        return depth == Integer.MAX_VALUE ? "all" : String.valueOf(depth);
    }
}

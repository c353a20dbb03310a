package com.abcft.pdfedit.core.zorder;

import com.abcft.pdfedit.core.gson.GsonUtil;
import com.abcft.pdfedit.core.model.Rectangle;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.geom.Rectangle2D;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Keeps the stacking order of the layers drawn on each page.
 *
 * <p>Layers stack by ascending z-order; equal z-orders are broken by registration order, so every
 * page has one total, deterministic order. Layers belong to a {@link LayerLevel} and, while level
 * boundaries are maintained, reorders only move a layer among the siblings of its own level.</p>
 *
 * <p>Not thread safe; callers sharing a manager must synchronize externally.</p>
 */
public class ZOrderManager {

    private static final Logger LOGGER = LogManager.getLogger();

    static final Comparator<LayerInfo> STACK_ORDER = Comparator.comparingInt(LayerInfo::getZOrder)
            .thenComparingLong(LayerInfo::getRank);

    private final ZOrderParameters params;
    private final Map<String, LayerInfo> layers = new LinkedHashMap<>();
    private final Map<Integer, List<LayerInfo>> pageLayers = new TreeMap<>();
    private final Map<String, LayerGroup> groups = new LinkedHashMap<>();
    private final Map<PageLevelKey, Integer> counters = new HashMap<>();
    private final ReorderHistory history;
    private long nextSequence;

    public ZOrderManager() {
        this(ZOrderParameters.DEFAULT);
    }

    public ZOrderManager(ZOrderParameters params) {
        this.params = params != null ? params : ZOrderParameters.DEFAULT;
        this.history = new ReorderHistory(this.params.maxHistory);
    }

    public ZOrderParameters getParams() {
        return params;
    }

    // ---- registration ----

    public LayerInfo addLayer(int page, Rectangle2D bbox, LayerLevel level) {
        return addLayer(page, bbox, level, null, null, null);
    }

    /**
     * Registers a layer on top of the other layers of its level.
     *
     * @throws IllegalStateException if the page already holds {@code maxLayersPerPage} layers.
     */
    public LayerInfo addLayer(int page, Rectangle2D bbox, LayerLevel level, String name,
                              String sourceType, String sourceId) {
        Preconditions.checkNotNull(bbox, "bbox");
        Preconditions.checkNotNull(level, "level");
        List<LayerInfo> stack = pageLayers.computeIfAbsent(page, p -> new ArrayList<>());
        if (stack.size() >= params.maxLayersPerPage) {
            throw new IllegalStateException(String.format("Page #%d: layer limit %d reached",
                    page + 1, params.maxLayersPerPage));
        }
        LayerInfo layer = new LayerInfo(newId(), name, page, nextZOrder(page, level, new ChangeSet()), level,
                new Rectangle(bbox), sourceType, sourceId, nextSequence++);
        layers.put(layer.getId(), layer);
        stack.add(layer);
        stack.sort(STACK_ORDER);
        LOGGER.debug("Page #{}: added {}", page + 1, layer);
        return layer;
    }

    private int nextZOrder(int page, LayerLevel level, ChangeSet changes) {
        PageLevelKey key = new PageLevelKey(page, level);
        int count = counters.getOrDefault(key, 0);
        counters.put(key, count + 1);
        int zOrder = level.getBase() + count * params.zOrderStep;
        if (!params.maintainLevelBoundaries || zOrder < level.getLimit()) {
            return zOrder;
        }
        return pack(page, level, null, false, changes);
    }

    /**
     * Renumbers the layers of a level from its base so that they fit below the next level, keeping
     * one free slot at the bottom or at the top of the band.
     *
     * @param excluded a layer left out of the renumbering, or {@code null}.
     * @return the z-order of the free slot.
     * @throws IllegalStateException if the band has no room left.
     */
    private int pack(int page, LayerLevel level, LayerInfo excluded, boolean freeAtBottom, ChangeSet changes) {
        List<LayerInfo> members = pageStack(page).stream()
                .filter(other -> other.getLevel() == level && other != excluded)
                .collect(Collectors.toList());
        int room = level.getLimit() - level.getBase();
        if (members.size() >= room) {
            throw new IllegalStateException(String.format("Page #%d: level %s is full", page + 1, level));
        }
        int spacing = Math.max(1, Math.min(params.zOrderStep, room / (members.size() + 1)));
        int zOrder = freeAtBottom ? level.getBase() + spacing : level.getBase();
        for (LayerInfo member : members) {
            if (member.getZOrder() != zOrder) {
                changes.move(member, zOrder);
            }
            zOrder += spacing;
        }
        LOGGER.debug("Page #{}: renumbered {} layers of {}", page + 1, members.size(), level);
        sortPage(page);
        return freeAtBottom ? level.getBase() : zOrder;
    }

    private String newId() {
        String id;
        do {
            id = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        } while (layers.containsKey(id) || groups.containsKey(id));
        return id;
    }

    /**
     * Unregisters a layer. Locked layers are kept.
     */
    public boolean removeLayer(String layerId) {
        LayerInfo layer = layers.get(layerId);
        if (null == layer) {
            return false;
        }
        if (layer.isLocked()) {
            LOGGER.warn("Layer {} is locked, not removed", layerId);
            return false;
        }
        layers.remove(layerId);
        List<LayerInfo> stack = pageLayers.get(layer.getPage());
        stack.remove(layer);
        if (stack.isEmpty()) {
            pageLayers.remove(layer.getPage());
        }
        leaveGroup(layer);
        history.forgetLayer(layerId);
        return true;
    }

    // ---- queries ----

    public Optional<LayerInfo> getLayer(String layerId) {
        return Optional.ofNullable(layers.get(layerId));
    }

    /**
     * Layers of a page from bottom to top.
     */
    public List<LayerInfo> getPageLayers(int page) {
        return getPageLayers(page, null, false);
    }

    /**
     * Layers of a page from bottom to top.
     *
     * @param level only layers of this level, or {@code null} for all.
     */
    public List<LayerInfo> getPageLayers(int page, LayerLevel level, boolean visibleOnly) {
        return pageStack(page).stream()
                .filter(layer -> level == null || layer.getLevel() == level)
                .filter(layer -> !visibleOnly || layer.isVisible())
                .collect(Collectors.toList());
    }

    /**
     * Layers under a point, topmost first.
     */
    public List<LayerInfo> getLayersAtPoint(int page, double x, double y, boolean visibleOnly) {
        return Lists.reverse(pageStack(page)).stream()
                .filter(layer -> !visibleOnly || layer.isVisible())
                .filter(layer -> layer.containsPoint(x, y))
                .collect(Collectors.toList());
    }

    public List<LayerInfo> getAllLayers() {
        return new ArrayList<>(layers.values());
    }

    public Set<Integer> getPages() {
        return new HashSet<>(pageLayers.keySet());
    }

    public List<LayerStackEntry> getLayerStack(int page) {
        List<LayerInfo> stack = pageStack(page);
        List<LayerStackEntry> entries = new ArrayList<>(stack.size());
        for (int i = 0; i < stack.size(); ++i) {
            entries.add(new LayerStackEntry(i, stack.get(i)));
        }
        return entries;
    }

    private List<LayerInfo> pageStack(int page) {
        List<LayerInfo> stack = pageLayers.get(page);
        return stack != null ? stack : new ArrayList<>();
    }

    private List<LayerInfo> siblings(LayerInfo layer) {
        List<LayerInfo> stack = pageStack(layer.getPage());
        if (!params.maintainLevelBoundaries) {
            return stack;
        }
        return stack.stream().filter(other -> other.getLevel() == layer.getLevel()).collect(Collectors.toList());
    }

    // ---- reordering ----

    public boolean bringToFront(String layerId) {
        return reorder(ReorderOperation.TO_FRONT, layerId);
    }

    public boolean sendToBack(String layerId) {
        return reorder(ReorderOperation.TO_BACK, layerId);
    }

    public boolean bringForward(String layerId) {
        return reorder(ReorderOperation.FORWARD, layerId);
    }

    public boolean sendBackward(String layerId) {
        return reorder(ReorderOperation.BACKWARD, layerId);
    }

    private boolean reorder(ReorderOperation operation, String layerId) {
        LayerInfo layer = movableLayer(layerId, operation);
        if (null == layer) {
            return false;
        }
        ChangeSet changes = new ChangeSet();
        apply(operation, layer, changes);
        return commit(operation, layerId, changes);
    }

    private void apply(ReorderOperation operation, LayerInfo layer, ChangeSet changes) {
        List<LayerInfo> siblings = siblings(layer);
        int index = siblings.indexOf(layer);
        switch (operation) {
            case TO_FRONT: {
                LayerInfo top = siblings.get(siblings.size() - 1);
                if (top == layer) {
                    break;
                }
                int z = top.getZOrder() + params.zOrderStep;
                if (params.maintainLevelBoundaries && z >= layer.getLevel().getLimit()) {
                    z = pack(layer.getPage(), layer.getLevel(), layer, false, changes);
                }
                changes.move(layer, z);
                break;
            }
            case TO_BACK: {
                LayerInfo bottom = siblings.get(0);
                if (bottom == layer) {
                    break;
                }
                int z = bottom.getZOrder() - params.zOrderStep;
                if (params.maintainLevelBoundaries && z < layer.getLevel().getBase()) {
                    z = pack(layer.getPage(), layer.getLevel(), layer, true, changes);
                }
                changes.move(layer, z);
                break;
            }
            case FORWARD:
                if (index < siblings.size() - 1) {
                    exchange(layer, siblings.get(index + 1), false, changes);
                }
                break;
            case BACKWARD:
                if (index > 0) {
                    exchange(layer, siblings.get(index - 1), false, changes);
                }
                break;
            default:
                throw new IllegalArgumentException("Not a single layer reorder: " + operation);
        }
        sortPage(layer.getPage());
    }

    /**
     * Exchanges the stacking positions of two layers, tie-break rank included.
     */
    private static void exchange(LayerInfo x, LayerInfo y, boolean withLevels, ChangeSet changes) {
        int zx = x.getZOrder();
        int zy = y.getZOrder();
        long rx = x.getRank();
        long ry = y.getRank();
        LayerLevel lx = x.getLevel();
        LayerLevel ly = y.getLevel();
        boolean tied = zx == zy;
        changes.move(x, zy, withLevels ? ly : lx, tied ? ry : rx);
        changes.move(y, zx, withLevels ? lx : ly, tied ? rx : ry);
    }

    /**
     * Moves a layer to another level, on top of that level's layers.
     * Only allowed when cross level movement is enabled.
     */
    public boolean moveToLevel(String layerId, LayerLevel level) {
        Preconditions.checkNotNull(level, "level");
        if (!params.allowCrossLevelMovement) {
            LOGGER.warn("Cross level movement disabled, {} stays in place", layerId);
            return false;
        }
        LayerInfo layer = movableLayer(layerId, ReorderOperation.TO_LEVEL);
        if (null == layer || layer.getLevel() == level) {
            return false;
        }
        ChangeSet changes = new ChangeSet();
        changes.move(layer, nextZOrder(layer.getPage(), level, changes), level, layer.getRank());
        sortPage(layer.getPage());
        return commit(ReorderOperation.TO_LEVEL, layerId, changes);
    }

    /**
     * Exchanges the z-order (and level) of two unlocked layers on the same page.
     */
    public boolean swapLayers(String layerIdA, String layerIdB) {
        LayerInfo a = movableLayer(layerIdA, ReorderOperation.SWAP);
        LayerInfo b = movableLayer(layerIdB, ReorderOperation.SWAP);
        if (null == a || null == b || a == b) {
            return false;
        }
        if (a.getPage() != b.getPage()) {
            LOGGER.warn("Cannot swap {} and {}: different pages", layerIdA, layerIdB);
            return false;
        }
        ChangeSet changes = new ChangeSet();
        exchange(a, b, true, changes);
        sortPage(a.getPage());
        return commit(ReorderOperation.SWAP, layerIdA, changes);
    }

    private LayerInfo movableLayer(String layerId, ReorderOperation operation) {
        LayerInfo layer = layers.get(layerId);
        if (null == layer) {
            return null;
        }
        if (layer.isLocked()) {
            LOGGER.warn("Layer {} is locked, {} refused", layerId, operation);
            return null;
        }
        return layer;
    }

    private boolean commit(ReorderOperation operation, String id, ChangeSet changes) {
        if (changes.isEmpty()) {
            return false;
        }
        if (params.enableHistory) {
            history.record(new ReorderHistoryEntry(operation, id, changes.changes));
        }
        LOGGER.debug("{} {}: {}", operation, id, changes.changes);
        return true;
    }

    private void sortPage(int page) {
        List<LayerInfo> stack = pageLayers.get(page);
        if (stack != null) {
            stack.sort(STACK_ORDER);
        }
    }

    // ---- history ----

    public boolean undo() {
        if (!params.enableHistory) {
            return false;
        }
        ReorderHistoryEntry entry = history.undo();
        if (null == entry) {
            return false;
        }
        List<ZChange> changes = Lists.reverse(entry.getChanges());
        for (ZChange change : changes) {
            restore(change.getLayerId(), change.getOldZ(), change.getOldLevel(), change.getOldRank());
        }
        resort(entry);
        return true;
    }

    public boolean redo() {
        if (!params.enableHistory) {
            return false;
        }
        ReorderHistoryEntry entry = history.redo();
        if (null == entry) {
            return false;
        }
        for (ZChange change : entry.getChanges()) {
            restore(change.getLayerId(), change.getNewZ(), change.getNewLevel(), change.getNewRank());
        }
        resort(entry);
        return true;
    }

    private void restore(String layerId, int z, LayerLevel level, long rank) {
        LayerInfo layer = layers.get(layerId);
        if (null == layer) {
            return;
        }
        layer.setZOrder(z);
        layer.setLevel(level);
        layer.setRank(rank);
        layer.touch();
    }

    private void resort(ReorderHistoryEntry entry) {
        entry.getChanges().stream()
                .map(change -> layers.get(change.getLayerId()))
                .filter(Objects::nonNull)
                .map(LayerInfo::getPage)
                .distinct()
                .forEach(this::sortPage);
    }

    public boolean canUndo() {
        return params.enableHistory && history.canUndo();
    }

    public boolean canRedo() {
        return params.enableHistory && history.canRedo();
    }

    public void clearHistory() {
        history.clear();
    }

    public ReorderHistory getHistory() {
        return history;
    }

    // ---- collisions ----

    /**
     * Classifies the overlap of two layers; symmetric in its arguments.
     * Unknown layers and layers on different pages never collide.
     */
    public CollisionInfo detectCollision(String layerIdA, String layerIdB) {
        LayerInfo a = layers.get(layerIdA);
        LayerInfo b = layers.get(layerIdB);
        if (null == a || null == b || a.getPage() != b.getPage()) {
            return CollisionInfo.none(layerIdA, layerIdB);
        }
        double tolerance = params.collisionTolerance;
        double[] edges = Rectangle.intersectionEdges(a.bbox(), b.bbox());
        if (edges[0] - tolerance >= edges[2] || edges[1] - tolerance >= edges[3]) {
            return CollisionInfo.none(layerIdA, layerIdB);
        }
        Rectangle overlap = Rectangle.fromLTRB(edges[0], edges[1],
                Math.max(edges[0], edges[2]), Math.max(edges[1], edges[3]));
        double overlapArea = overlap.getWidth() * overlap.getHeight();
        double minArea = Math.min(a.area(), b.area());
        if (minArea <= 0) {
            minArea = 1;
        }
        double percent = overlapArea / minArea * 100;

        CollisionType type;
        if (Rectangle.nearlyEquals(a.bbox(), b.bbox(), tolerance)) {
            type = CollisionType.IDENTICAL;
        } else if (percent >= 95) {
            type = CollisionType.CONTAINS;
        } else if (percent >= 50) {
            type = CollisionType.FULL;
        } else {
            type = CollisionType.PARTIAL;
        }
        return new CollisionInfo(layerIdA, layerIdB, type, overlap, overlapArea, percent);
    }

    public List<CollisionInfo> detectCollisions(int page) {
        List<LayerInfo> stack = pageStack(page);
        List<CollisionInfo> collisions = new ArrayList<>();
        for (int i = 0; i < stack.size(); ++i) {
            for (int j = i + 1; j < stack.size(); ++j) {
                CollisionInfo collision = detectCollision(stack.get(i).getId(), stack.get(j).getId());
                if (collision.isCollision()) {
                    collisions.add(collision);
                }
            }
        }
        return collisions;
    }

    public boolean hasCollision(String layerId) {
        LayerInfo layer = layers.get(layerId);
        if (null == layer) {
            return false;
        }
        return pageStack(layer.getPage()).stream()
                .anyMatch(other -> other != layer && detectCollision(layerId, other.getId()).isCollision());
    }

    // ---- groups ----

    /**
     * Groups the given layers; unknown ids are ignored and layers leave their previous group.
     *
     * @return the group, or empty if none of the ids is known.
     */
    public Optional<LayerGroup> createGroup(Collection<String> layerIds, String name) {
        List<LayerInfo> members = layerIds.stream()
                .map(layers::get)
                .filter(Objects::nonNull)
                .distinct()
                .collect(Collectors.toList());
        if (members.isEmpty()) {
            return Optional.empty();
        }
        LayerGroup group = new LayerGroup(newId(), name);
        for (LayerInfo member : members) {
            leaveGroup(member);
            group.add(member.getId());
            member.setGroupId(group.getId());
        }
        groups.put(group.getId(), group);
        return Optional.of(group);
    }

    public boolean dissolveGroup(String groupId) {
        LayerGroup group = groups.remove(groupId);
        if (null == group) {
            return false;
        }
        for (String layerId : group.getLayerIds()) {
            LayerInfo layer = layers.get(layerId);
            if (layer != null) {
                layer.setGroupId(null);
            }
        }
        return true;
    }

    public Optional<LayerGroup> getGroup(String groupId) {
        return Optional.ofNullable(groups.get(groupId));
    }

    public Optional<LayerGroup> getLayerGroup(String layerId) {
        LayerInfo layer = layers.get(layerId);
        if (null == layer || null == layer.getGroupId()) {
            return Optional.empty();
        }
        return getGroup(layer.getGroupId());
    }

    public List<LayerGroup> getGroups() {
        return new ArrayList<>(groups.values());
    }

    private void leaveGroup(LayerInfo layer) {
        String groupId = layer.getGroupId();
        if (null == groupId) {
            return;
        }
        LayerGroup group = groups.get(groupId);
        if (group != null) {
            group.remove(layer.getId());
            if (group.isEmpty()) {
                groups.remove(groupId);
            }
        }
        layer.setGroupId(null);
    }

    /**
     * Applies a single layer reorder to every unlocked member of a group, recorded as one history entry.
     * Members are visited front to back for {@code TO_BACK} and {@code FORWARD}, back to front otherwise,
     * so the group keeps its internal order.
     */
    public boolean moveGroup(String groupId, ReorderOperation operation) {
        Preconditions.checkArgument(operation == ReorderOperation.TO_FRONT || operation == ReorderOperation.TO_BACK
                || operation == ReorderOperation.FORWARD || operation == ReorderOperation.BACKWARD,
                "Unsupported group operation %s", operation);
        LayerGroup group = groups.get(groupId);
        if (null == group) {
            return false;
        }
        List<LayerInfo> members = group.getLayerIds().stream()
                .map(layers::get)
                .filter(Objects::nonNull)
                .sorted(STACK_ORDER)
                .collect(Collectors.toList());
        if (operation == ReorderOperation.TO_BACK || operation == ReorderOperation.FORWARD) {
            members = Lists.reverse(members);
        }
        ChangeSet changes = new ChangeSet();
        for (LayerInfo member : members) {
            if (member.isLocked()) {
                LOGGER.warn("Layer {} is locked, skipped in group {}", member.getId(), groupId);
                continue;
            }
            apply(operation, member, changes);
        }
        return commit(ReorderOperation.GROUP, groupId, changes);
    }

    // ---- maintenance ----

    /**
     * Puts one of two layers above the other.
     *
     * @param preferNewer let the more recently created layer win; otherwise {@code layerIdA} wins.
     * @return the id of the layer that ends on top, or {@code null} if either id is unknown.
     */
    public String resolveConflict(String layerIdA, String layerIdB, boolean preferNewer) {
        LayerInfo a = layers.get(layerIdA);
        LayerInfo b = layers.get(layerIdB);
        if (null == a || null == b) {
            return null;
        }
        LayerInfo winner = a;
        LayerInfo loser = b;
        if (preferNewer && isNewer(b, a)) {
            winner = b;
            loser = a;
        }
        if (STACK_ORDER.compare(winner, loser) < 0) {
            if (winner.isLocked()) {
                LOGGER.warn("Layer {} is locked, conflict with {} left as is", winner.getId(), loser.getId());
            } else {
                ChangeSet changes = new ChangeSet();
                changes.move(winner, loser.getZOrder() + 1);
                sortPage(winner.getPage());
                commit(ReorderOperation.TO_FRONT, winner.getId(), changes);
            }
        }
        return winner.getId();
    }

    private static boolean isNewer(LayerInfo x, LayerInfo y) {
        if (x.getCreatedAt() != y.getCreatedAt()) {
            return x.getCreatedAt() > y.getCreatedAt();
        }
        return x.getSequence() > y.getSequence();
    }

    public ZOrderStatistics getStatistics() {
        Map<LayerLevel, Integer> byLevel = new EnumMap<>(LayerLevel.class);
        for (LayerInfo layer : layers.values()) {
            byLevel.merge(layer.getLevel(), 1, Integer::sum);
        }
        return new ZOrderStatistics(layers.size(), pageLayers.size(), groups.size(), byLevel,
                history.size(), history.getPosition());
    }

    /**
     * Forgets every layer, group and history entry, and restarts the z-order counters.
     */
    public void clear() {
        layers.clear();
        pageLayers.clear();
        groups.clear();
        counters.clear();
        history.clear();
    }

    public String toJson(int page) {
        return GsonUtil.DEFAULT.toJson(getLayerStack(page));
    }

    /**
     * Changes made by one action, in the order they were made.
     */
    private static final class ChangeSet {

        final List<ZChange> changes = new ArrayList<>();

        void move(LayerInfo layer, int z) {
            move(layer, z, layer.getLevel(), layer.getRank());
        }

        void move(LayerInfo layer, int z, LayerLevel level, long rank) {
            changes.add(new ZChange(layer.getId(), layer.getZOrder(), z, layer.getLevel(), level,
                    layer.getRank(), rank));
            layer.setZOrder(z);
            layer.setLevel(level);
            layer.setRank(rank);
            layer.touch();
        }

        boolean isEmpty() {
            return changes.isEmpty();
        }
    }
}

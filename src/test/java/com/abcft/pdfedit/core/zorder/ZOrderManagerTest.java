package com.abcft.pdfedit.core.zorder;

import com.abcft.pdfedit.core.model.Rectangle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ZOrderManagerTest {

    private static final Rectangle BOX = new Rectangle(0, 0, 100, 100);

    private ZOrderManager manager;

    @BeforeEach
    public void setUp() {
        manager = new ZOrderManager();
    }

    private List<String> stack(int page) {
        return manager.getPageLayers(page).stream().map(LayerInfo::getId).collect(Collectors.toList());
    }

    private String text() {
        return manager.addLayer(0, BOX, LayerLevel.TEXT).getId();
    }

    @Nested
    public class Registration {

        @Test
        public void assignsZOrderPerLevel() {
            LayerInfo t1 = manager.addLayer(0, BOX, LayerLevel.TEXT);
            LayerInfo t2 = manager.addLayer(0, BOX, LayerLevel.TEXT);
            LayerInfo r1 = manager.addLayer(0, BOX, LayerLevel.REDACTION);
            LayerInfo other = manager.addLayer(1, BOX, LayerLevel.TEXT);
            assertEquals(400, t1.getZOrder());
            assertEquals(410, t2.getZOrder());
            assertEquals(100, r1.getZOrder());
            assertEquals(400, other.getZOrder());
            assertEquals(Arrays.asList(r1.getId(), t1.getId(), t2.getId()), stack(0));
            assertEquals("Layer_" + t1.getId(), t1.getName());
            assertEquals(8, t1.getId().length());
        }

        @Test
        public void levelStaysBelowTheNextOne() {
            List<String> backgrounds = new ArrayList<>();
            List<String> texts = new ArrayList<>();
            for (int i = 0; i < 6; ++i) {
                backgrounds.add(manager.addLayer(0, BOX, LayerLevel.TEXT_BACKGROUND).getId());
                texts.add(text());
            }
            for (String id : backgrounds) {
                int z = manager.getLayer(id).get().getZOrder();
                assertTrue(z >= LayerLevel.TEXT_BACKGROUND.getBase() && z < LayerLevel.TEXT.getBase(), "z " + z);
            }
            List<String> expected = new ArrayList<>(backgrounds);
            expected.addAll(texts);
            assertEquals(expected, stack(0));
        }

        @Test
        public void refusesLayersOnceLevelIsFull() {
            int room = LayerLevel.TEXT.getBase() - LayerLevel.TEXT_BACKGROUND.getBase();
            for (int i = 0; i < room; ++i) {
                manager.addLayer(0, BOX, LayerLevel.TEXT_BACKGROUND);
            }
            assertThrows(IllegalStateException.class, () -> manager.addLayer(0, BOX, LayerLevel.TEXT_BACKGROUND));
        }

        @Test
        public void enforcesLayerLimit() {
            ZOrderManager small = new ZOrderManager(new ZOrderParameters.Builder().setMaxLayersPerPage(2).build());
            small.addLayer(0, BOX, LayerLevel.TEXT);
            small.addLayer(0, BOX, LayerLevel.TEXT);
            assertThrows(IllegalStateException.class, () -> small.addLayer(0, BOX, LayerLevel.TEXT));
            small.addLayer(1, BOX, LayerLevel.TEXT);
        }

        @Test
        public void removesLayer() {
            String a = text();
            String b = text();
            assertTrue(manager.removeLayer(a));
            assertFalse(manager.removeLayer(a));
            assertEquals(Collections.singletonList(b), stack(0));
            assertFalse(manager.getLayer(a).isPresent());
        }

        @Test
        public void lockedLayerIsKept() {
            String a = text();
            manager.getLayer(a).get().setLocked(true);
            assertFalse(manager.removeLayer(a));
            assertFalse(manager.bringToFront(a));
        }

        @Test
        public void findsLayersAtPoint() {
            LayerInfo big = manager.addLayer(0, BOX, LayerLevel.FILL);
            LayerInfo small = manager.addLayer(0, new Rectangle(10, 10, 10, 10), LayerLevel.TEXT);
            LayerInfo hidden = manager.addLayer(0, BOX, LayerLevel.HIGHLIGHT);
            hidden.setVisible(false);
            List<LayerInfo> hits = manager.getLayersAtPoint(0, 15, 15, true);
            assertEquals(Arrays.asList(small, big), hits);
            assertEquals(3, manager.getLayersAtPoint(0, 15, 15, false).size());
            assertEquals(1, manager.getLayersAtPoint(0, 50, 50, true).size());
        }

        @Test
        public void filtersByLevel() {
            text();
            manager.addLayer(0, BOX, LayerLevel.REDACTION);
            assertEquals(1, manager.getPageLayers(0, LayerLevel.REDACTION, false).size());
            assertTrue(manager.getPageLayers(5).isEmpty());
        }
    }

    @Nested
    public class Reordering {

        @Test
        public void bringsToFront() {
            String a = text();
            String b = text();
            String c = text();
            assertTrue(manager.bringToFront(a));
            assertEquals(Arrays.asList(b, c, a), stack(0));
            assertEquals(430, manager.getLayer(a).get().getZOrder());
            assertFalse(manager.bringToFront(a));
        }

        @Test
        public void frontMoveStaysInsideLevel() {
            List<String> texts = new ArrayList<>();
            for (int i = 0; i < 5; ++i) {
                texts.add(text());
            }
            String decoration = manager.addLayer(0, BOX, LayerLevel.TEXT_DECORATION).getId();
            assertTrue(manager.bringToFront(texts.get(0)));
            int z = manager.getLayer(texts.get(0)).get().getZOrder();
            assertTrue(z < LayerLevel.TEXT.getLimit(), "z " + z);
            List<String> expected = new ArrayList<>(texts.subList(1, 5));
            expected.add(texts.get(0));
            expected.add(decoration);
            assertEquals(expected, stack(0));
            assertTrue(manager.undo());
            texts.add(decoration);
            assertEquals(texts, stack(0));
        }

        @Test
        public void alternatingFrontMovesKeepLastOnTop() {
            String a = text();
            String b = text();
            for (int i = 0; i < 6; ++i) {
                String moved = i % 2 == 0 ? a : b;
                assertTrue(manager.bringToFront(moved));
                List<String> order = stack(0);
                assertEquals(moved, order.get(order.size() - 1));
            }
        }

        @Test
        public void sendToBackStaysInsideLevel() {
            String a = text();
            String b = text();
            assertTrue(manager.sendToBack(b));
            assertEquals(Arrays.asList(b, a), stack(0));
            assertEquals(400, manager.getLayer(b).get().getZOrder());
            assertTrue(manager.getLayer(a).get().getZOrder() > 400);
            assertFalse(manager.sendToBack(b));
        }

        @Test
        public void sendToBackWithRoomBelow() {
            String a = text();
            String b = text();
            manager.bringToFront(a);
            String c = text();
            // a=420, b=410, c=420 (newer): order b, a, c
            assertEquals(Arrays.asList(b, a, c), stack(0));
            assertTrue(manager.sendToBack(c));
            assertEquals(Arrays.asList(c, b, a), stack(0));
        }

        @Test
        public void levelsStaySeparate() {
            String redaction = manager.addLayer(0, BOX, LayerLevel.REDACTION).getId();
            String a = text();
            manager.sendToBack(a);
            manager.bringToFront(redaction);
            assertEquals(Arrays.asList(redaction, a), stack(0));
        }

        @Test
        public void stepsForwardAndBackward() {
            String a = text();
            String b = text();
            String c = text();
            assertTrue(manager.bringForward(a));
            assertEquals(Arrays.asList(b, a, c), stack(0));
            assertTrue(manager.sendBackward(c));
            assertEquals(Arrays.asList(b, c, a), stack(0));
            assertFalse(manager.bringForward(a));
            assertFalse(manager.sendBackward(b));
        }

        @Test
        public void forwardSwapsTiedLayers() {
            String a = text();
            String b = text();
            manager.bringToFront(a);
            String c = text();
            // a and c share z 420
            assertTrue(manager.bringForward(a));
            assertEquals(Arrays.asList(b, c, a), stack(0));
            assertTrue(manager.undo());
            assertEquals(Arrays.asList(b, a, c), stack(0));
        }

        @Test
        public void crossLevelMoveNeedsPermission() {
            String a = text();
            assertFalse(manager.moveToLevel(a, LayerLevel.HIGHLIGHT));

            ZOrderManager free = new ZOrderManager(new ZOrderParameters.Builder()
                    .setAllowCrossLevelMovement(true).build());
            LayerInfo layer = free.addLayer(0, BOX, LayerLevel.TEXT);
            assertTrue(free.moveToLevel(layer.getId(), LayerLevel.HIGHLIGHT));
            assertEquals(LayerLevel.HIGHLIGHT, layer.getLevel());
            assertEquals(500, layer.getZOrder());
            assertFalse(free.moveToLevel(layer.getId(), LayerLevel.HIGHLIGHT));
        }

        @Test
        public void swapsLayers() {
            String redaction = manager.addLayer(0, BOX, LayerLevel.REDACTION).getId();
            String a = text();
            assertTrue(manager.swapLayers(redaction, a));
            assertEquals(Arrays.asList(a, redaction), stack(0));
            assertEquals(LayerLevel.TEXT, manager.getLayer(redaction).get().getLevel());

            String other = manager.addLayer(1, BOX, LayerLevel.TEXT).getId();
            assertFalse(manager.swapLayers(a, other));
            assertFalse(manager.swapLayers(a, a));
        }

        @Test
        public void ignoresLevelsWhenNotMaintained() {
            ZOrderManager loose = new ZOrderManager(new ZOrderParameters.Builder()
                    .setMaintainLevelBoundaries(false).build());
            String redaction = loose.addLayer(0, BOX, LayerLevel.REDACTION).getId();
            String a = loose.addLayer(0, BOX, LayerLevel.TEXT).getId();
            assertTrue(loose.bringToFront(redaction));
            assertEquals(410, loose.getLayer(redaction).get().getZOrder());
            assertEquals(Arrays.asList(a, redaction), loose.getPageLayers(0).stream()
                    .map(LayerInfo::getId).collect(Collectors.toList()));
        }
    }

    @Nested
    public class History {

        @Test
        public void undoesAndRedoesEveryStep() {
            String a = text();
            String b = text();
            String c = text();
            List<List<String>> snapshots = new ArrayList<>();
            snapshots.add(stack(0));
            manager.bringToFront(a);
            snapshots.add(stack(0));
            manager.sendToBack(c);
            snapshots.add(stack(0));
            manager.bringForward(b);
            snapshots.add(stack(0));
            manager.swapLayers(a, c);
            snapshots.add(stack(0));

            for (int i = snapshots.size() - 2; i >= 0; --i) {
                assertTrue(manager.undo());
                assertEquals(snapshots.get(i), stack(0));
            }
            assertFalse(manager.undo());
            for (int i = 1; i < snapshots.size(); ++i) {
                assertTrue(manager.redo());
                assertEquals(snapshots.get(i), stack(0));
            }
            assertFalse(manager.redo());
        }

        @Test
        public void undoRestoresShiftedSiblings() {
            String a = text();
            String b = text();
            manager.sendToBack(b);
            manager.undo();
            assertEquals(400, manager.getLayer(a).get().getZOrder());
            assertEquals(410, manager.getLayer(b).get().getZOrder());
        }

        @Test
        public void newActionDropsRedoBranch() {
            String a = text();
            String b = text();
            manager.bringToFront(a);
            manager.bringToFront(b);
            manager.undo();
            assertTrue(manager.canRedo());
            assertTrue(manager.sendToBack(a));
            assertFalse(manager.canRedo());
            assertEquals(2, manager.getHistory().size());
        }

        @Test
        public void historyIsBounded() {
            ZOrderManager bounded = new ZOrderManager(new ZOrderParameters.Builder().setMaxHistory(2).build());
            String a = bounded.addLayer(0, BOX, LayerLevel.TEXT).getId();
            String b = bounded.addLayer(0, BOX, LayerLevel.TEXT).getId();
            bounded.bringToFront(a);
            bounded.bringToFront(b);
            bounded.bringToFront(a);
            assertEquals(2, bounded.getHistory().size());
            assertTrue(bounded.undo());
            assertTrue(bounded.undo());
            assertFalse(bounded.undo());
        }

        @Test
        public void disabledHistory() {
            ZOrderManager plain = new ZOrderManager(new ZOrderParameters.Builder().setEnableHistory(false).build());
            String a = plain.addLayer(0, BOX, LayerLevel.TEXT).getId();
            plain.addLayer(0, BOX, LayerLevel.TEXT);
            assertTrue(plain.bringToFront(a));
            assertFalse(plain.canUndo());
            assertFalse(plain.undo());
        }

        @Test
        public void removingLayerDropsItsEntries() {
            String a = text();
            String b = text();
            text();
            manager.bringToFront(a);
            manager.bringToFront(b);
            assertEquals(2, manager.getHistory().size());
            manager.removeLayer(b);
            assertEquals(1, manager.getHistory().size());
            assertEquals(1, manager.getHistory().getPosition());
            assertEquals(a, manager.getHistory().getEntries().get(0).getLayerId());
        }

        @Test
        public void removingLayerKeepsChangesOfOthers() {
            String a = text();
            String b = text();
            String c = text();
            manager.bringToFront(a);
            manager.bringForward(b);
            assertEquals(Arrays.asList(c, b, a), stack(0));
            manager.removeLayer(b);
            assertEquals(2, manager.getHistory().size());
            ReorderHistoryEntry forward = manager.getHistory().getEntries().get(1);
            assertEquals(1, forward.getChanges().size());
            assertEquals(c, forward.getChanges().get(0).getLayerId());

            assertTrue(manager.undo());
            assertEquals(Arrays.asList(c, a), stack(0));
            assertEquals(420, manager.getLayer(c).get().getZOrder());
            assertTrue(manager.undo());
            assertEquals(Arrays.asList(a, c), stack(0));
        }

        @Test
        public void entryDescribesPrimaryLayer() {
            String a = text();
            text();
            manager.bringToFront(a);
            ReorderHistoryEntry entry = manager.getHistory().getEntries().get(0);
            assertEquals(ReorderOperation.TO_FRONT, entry.getOperation());
            assertEquals(a, entry.getLayerId());
            assertEquals(400, entry.getOldZ());
            assertEquals(420, entry.getNewZ());
            assertEquals(LayerLevel.TEXT, entry.getNewLevel());
        }
    }

    @Nested
    public class Collisions {

        private String add(double x, double y, double w, double h) {
            return manager.addLayer(0, new Rectangle(x, y, w, h), LayerLevel.TEXT).getId();
        }

        @Test
        public void classifiesOverlap() {
            String a = add(0, 0, 100, 100);
            assertEquals(CollisionType.IDENTICAL, manager.detectCollision(a, add(0, 0, 100, 100)).getType());
            assertEquals(CollisionType.CONTAINS, manager.detectCollision(a, add(10, 10, 20, 20)).getType());
            assertEquals(CollisionType.FULL, manager.detectCollision(a, add(50, 0, 100, 100)).getType());
            assertEquals(CollisionType.PARTIAL, manager.detectCollision(a, add(80, 0, 100, 100)).getType());
            assertEquals(CollisionType.NONE, manager.detectCollision(a, add(200, 200, 10, 10)).getType());
        }

        @Test
        public void isSymmetric() {
            String a = add(0, 0, 100, 100);
            String b = add(60, 30, 100, 100);
            CollisionInfo ab = manager.detectCollision(a, b);
            CollisionInfo ba = manager.detectCollision(b, a);
            assertEquals(ab.getType(), ba.getType());
            assertEquals(ab.getOverlapPercent(), ba.getOverlapPercent(), 1e-9);
            assertEquals(2800, ab.getOverlapArea(), 1e-6);
            assertEquals(28, ab.getOverlapPercent(), 1e-6);
        }

        @Test
        public void unknownOrOtherPageNeverCollides() {
            String a = add(0, 0, 100, 100);
            String other = manager.addLayer(1, BOX, LayerLevel.TEXT).getId();
            assertFalse(manager.detectCollision(a, "missing").isCollision());
            assertFalse(manager.detectCollision(a, other).isCollision());
        }

        @Test
        public void listsCollidingPairs() {
            String a = add(0, 0, 100, 100);
            String b = add(50, 50, 100, 100);
            String c = add(500, 500, 10, 10);
            assertEquals(1, manager.detectCollisions(0).size());
            assertTrue(manager.hasCollision(a));
            assertTrue(manager.hasCollision(b));
            assertFalse(manager.hasCollision(c));
        }
    }

    @Nested
    public class Groups {

        @Test
        public void ignoresUnknownIds() {
            assertFalse(manager.createGroup(Arrays.asList("x", "y"), "none").isPresent());
            String a = text();
            Optional<LayerGroup> group = manager.createGroup(Arrays.asList(a, "y"), "one");
            assertTrue(group.isPresent());
            assertEquals(1, group.get().size());
            assertEquals(group, manager.getLayerGroup(a));
        }

        @Test
        public void layerMovesBetweenGroups() {
            String a = text();
            String b = text();
            LayerGroup first = manager.createGroup(Arrays.asList(a, b), "first").get();
            LayerGroup second = manager.createGroup(Collections.singletonList(a), "second").get();
            assertFalse(first.contains(a));
            assertTrue(first.contains(b));
            assertEquals(second.getId(), manager.getLayer(a).get().getGroupId());
        }

        @Test
        public void removedLayerLeavesGroup() {
            String a = text();
            String b = text();
            LayerGroup group = manager.createGroup(Arrays.asList(a, b), "g").get();
            manager.removeLayer(a);
            assertEquals(Collections.singleton(b), group.getLayerIds());
            manager.removeLayer(b);
            assertFalse(manager.getGroup(group.getId()).isPresent());
        }

        @Test
        public void dissolvesGroup() {
            String a = text();
            LayerGroup group = manager.createGroup(Collections.singletonList(a), "g").get();
            assertTrue(manager.dissolveGroup(group.getId()));
            assertNull(manager.getLayer(a).get().getGroupId());
            assertFalse(manager.dissolveGroup(group.getId()));
        }

        @Test
        public void movesGroupAsOneStep() {
            String a = text();
            String b = text();
            String c = text();
            String d = text();
            List<String> before = stack(0);
            LayerGroup group = manager.createGroup(Arrays.asList(a, b), "g").get();
            assertTrue(manager.moveGroup(group.getId(), ReorderOperation.TO_FRONT));
            assertEquals(Arrays.asList(c, d, a, b), stack(0));
            assertEquals(1, manager.getHistory().size());
            assertEquals(ReorderOperation.GROUP, manager.getHistory().getEntries().get(0).getOperation());
            assertTrue(manager.undo());
            assertEquals(before, stack(0));
        }

        @Test
        public void movesGroupToBack() {
            String a = text();
            String b = text();
            String c = text();
            LayerGroup group = manager.createGroup(Arrays.asList(b, c), "g").get();
            assertTrue(manager.moveGroup(group.getId(), ReorderOperation.TO_BACK));
            assertEquals(a, stack(0).get(2));
        }

        @Test
        public void groupKeepsItsOrderAtTheFront() {
            String a = text();
            String b = text();
            String c = text();
            String d = text();
            LayerGroup group = manager.createGroup(Arrays.asList(a, b, c), "g").get();
            assertTrue(manager.moveGroup(group.getId(), ReorderOperation.TO_FRONT));
            assertEquals(Arrays.asList(d, a, b, c), stack(0));
        }

        @Test
        public void groupKeepsItsOrderAtTheBack() {
            String a = text();
            String b = text();
            String c = text();
            String d = text();
            LayerGroup group = manager.createGroup(Arrays.asList(b, c, d), "g").get();
            assertTrue(manager.moveGroup(group.getId(), ReorderOperation.TO_BACK));
            assertEquals(Arrays.asList(b, c, d, a), stack(0));
        }

        @Test
        public void groupStepsKeepItsOrder() {
            String a = text();
            String b = text();
            String c = text();
            String d = text();
            LayerGroup low = manager.createGroup(Arrays.asList(a, b), "low").get();
            assertTrue(manager.moveGroup(low.getId(), ReorderOperation.FORWARD));
            assertEquals(Arrays.asList(c, a, b, d), stack(0));

            LayerGroup high = manager.createGroup(Arrays.asList(b, d), "high").get();
            assertTrue(manager.moveGroup(high.getId(), ReorderOperation.BACKWARD));
            assertEquals(Arrays.asList(c, b, d, a), stack(0));
        }

        @Test
        public void rejectsUnsupportedGroupOperation() {
            String a = text();
            LayerGroup group = manager.createGroup(Collections.singletonList(a), "g").get();
            assertThrows(IllegalArgumentException.class, () -> manager.moveGroup(group.getId(), ReorderOperation.SWAP));
        }
    }

    @Nested
    public class Maintenance {

        @Test
        public void resolvesConflict() {
            String a = text();
            String b = text();
            assertEquals(a, manager.resolveConflict(a, b, false));
            assertEquals(Arrays.asList(b, a), stack(0));
            assertNull(manager.resolveConflict(a, "missing", true));
        }

        @Test
        public void newerLayerWinsWhenPreferred() {
            String a = text();
            String b = text();
            manager.bringToFront(a);
            assertEquals(b, manager.resolveConflict(a, b, true));
            assertEquals(b, stack(0).get(1));
        }

        @Test
        public void reportsStatistics() {
            text();
            text();
            manager.addLayer(1, BOX, LayerLevel.REDACTION);
            ZOrderStatistics stats = manager.getStatistics();
            assertEquals(3, stats.getTotalLayers());
            assertEquals(2, stats.getPages());
            assertEquals(Integer.valueOf(2), stats.getLayersByLevel().get(LayerLevel.TEXT));
        }

        @Test
        public void clearRestartsCounters() {
            text();
            text();
            manager.clear();
            assertTrue(manager.getAllLayers().isEmpty());
            assertEquals(400, manager.addLayer(0, BOX, LayerLevel.TEXT).getZOrder());
        }

        @Test
        public void serializesStack() {
            String a = text();
            String json = manager.toJson(0);
            assertTrue(json.contains("\"id\":\"" + a + "\""));
            assertTrue(json.contains("\"zOrder\":400"));
        }

        @Test
        public void readsParametersFromMap() {
            Map<String, String> map = new HashMap<>();
            map.put("zorder.step", "5");
            map.put("zorder.allowCrossLevelMovement", "true");
            ZOrderParameters params = new ZOrderParameters.Builder(map).build();
            assertEquals(5, params.zOrderStep);
            assertTrue(params.allowCrossLevelMovement);
            assertEquals(5, params.buildUpon().build().zOrderStep);
        }
    }

    @Test
    public void levelLookup() {
        assertEquals(LayerLevel.TEXT_BACKGROUND, LayerLevel.fromZOrder(399));
        assertEquals(LayerLevel.TEXT, LayerLevel.fromZOrder(400));
        assertEquals(LayerLevel.BACKGROUND, LayerLevel.fromZOrder(-5));
        assertEquals(LayerLevel.UI, LayerLevel.fromZOrder(5000));
        assertEquals(LayerLevel.REDACTION, LayerLevel.forSourceType("erase"));
        assertEquals(LayerLevel.UI, LayerLevel.forSourceType("Cursor"));
        assertEquals(LayerLevel.TEXT_DECORATION, LayerLevel.forSourceType("strikethrough"));
        assertEquals(LayerLevel.TEXT, LayerLevel.forSourceType("whatever"));
        assertEquals(LayerLevel.TEXT, LayerLevel.forSourceType(null));
    }
}

package com.deca.snapshot;

import com.deca.engine.DecisionFrame;
import com.deca.tree.error.DecaException;
import com.deca.tree.error.ErrorKind;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FrameSnapshotsTest {

    private static DecisionFrame populatedTree() {
        DecisionFrame frame = DecisionFrame.createTree(new int[]{4, 2},
                new int[][]{{0, 4, 3, 0, 0}, {0, 2, 0}},
                new int[][]{{0, 2, 0, 0, 0}, {0, 0, 0}});
        frame.setName("vendor selection");
        frame.probabilities().add(1, 1, 0.3, 0.6);
        frame.probabilities().add(1, 2, 0.1, 0.5);
        frame.probabilities().addMidpoint(2, 1, 0.4, 0.4);
        frame.values().add(1, 3, 0.2, 0.7);
        frame.values().setBox(new double[]{-1, 0.0, 0.1, 0.0, 0.0, 0.0}, new double[]{-1, 1.0, 0.9, 1.0, 1.0, 1.0});
        frame.attach();
        return frame;
    }

    @Test
    void capture_treeFrame_recordsShapeAndInput() {
        FrameSnapshot snapshot = FrameSnapshots.capture(populatedTree());
        assertTrue(snapshot.isTree());
        assertEquals("vendor selection", snapshot.getName());
        assertArrayEquals(new int[]{4, 2}, snapshot.getNodeCounts());
        assertEquals(2, snapshot.getProbabilities().getStatements().size());
        assertNull(snapshot.getProbabilities().getBoxLower());
        assertEquals(0.4, snapshot.getProbabilities().getMidpointLower()[4]);
        assertEquals(-1.0, snapshot.getProbabilities().getMidpointLower()[0]);
        assertEquals(0.1, snapshot.getValues().getBoxLower()[2]);
        assertEquals(List.of(new StatementRecord(1, 3, 0.2, 0.7)), snapshot.getValues().getStatements());
    }

    @Test
    void restore_fromJson_reproducesDerivedState() {
        DecisionFrame original = populatedTree();
        String json = FrameSnapshots.toJson(FrameSnapshots.capture(original));
        FrameSnapshot parsed = FrameSnapshots.fromJson(json);
        assertEquals(FrameSnapshots.capture(original), parsed);

        DecisionFrame restored = FrameSnapshots.restore(parsed);
        assertFalse(restored.isAttached());
        restored.attach();
        assertEquals("vendor selection", restored.getName());
        assertArrayEquals(original.probabilities().getMassPoints(), restored.probabilities().getMassPoints(), 0.0);
        assertArrayEquals(original.values().getMassPoints(), restored.values().getMassPoints(), 0.0);
        assertEquals(original.evaluateOmega(1), restored.evaluateOmega(1), 0.0);
    }

    @Test
    void restore_flatFrame_usesConsequenceCounts() {
        DecisionFrame frame = DecisionFrame.createFlat(3, 2);
        frame.probabilities().add(1, 1, 0.7, 0.7);
        FrameSnapshot snapshot = FrameSnapshots.capture(frame);
        assertFalse(snapshot.isTree());
        assertFalse(FrameSnapshots.toJson(snapshot).contains("\"next\""));

        DecisionFrame restored = FrameSnapshots.restore(FrameSnapshots.fromJson(FrameSnapshots.toJson(snapshot)));
        restored.attach();
        assertEquals(5, restored.topology().totalNodeCount());
        assertEquals(0.7, restored.probabilities().getMassPoint(1, 1), 1e-9);
    }

    @Test
    void restore_unknownVersion_rejected() {
        FrameSnapshot snapshot = new FrameSnapshot("9", "x", new int[]{1, 1}, null, null, null, null);
        DecaException e = assertThrows(DecaException.class, () -> FrameSnapshots.restore(snapshot));
        assertEquals(ErrorKind.INPUT_ERROR, e.getKind());
    }

    @Test
    void restore_badStatement_rejected() {
        LayerSnapshot values = new LayerSnapshot(List.of(new StatementRecord(1, 5, 0.1, 0.2)), null, null, null, null);
        FrameSnapshot snapshot = new FrameSnapshot(null, null, new int[]{2, 2}, null, null, null, values);
        DecaException e = assertThrows(DecaException.class, () -> FrameSnapshots.restore(snapshot));
        assertEquals(ErrorKind.INPUT_ERROR, e.getKind());
    }

    @Test
    void fromJson_malformed_throwsUnchecked() {
        assertThrows(UncheckedIOException.class, () -> FrameSnapshots.fromJson("{not json"));
    }

    @Test
    void snapshot_arrays_isolatedFromCallers() {
        double[] boxLower = {0.1, 0.0};
        double[] boxUpper = {0.9, 1.0};
        LayerSnapshot layer = new LayerSnapshot(List.of(), boxLower, boxUpper, null, null);
        boxLower[0] = 0.5;
        layer.getBoxUpper()[0] = 0.2;
        assertEquals(0.1, layer.getBoxLower()[0]);
        assertEquals(0.9, layer.getBoxUpper()[0]);
        assertNull(layer.getMidpointLower());

        FrameSnapshot snapshot = FrameSnapshots.capture(populatedTree());
        snapshot.getNodeCounts()[0] = 9;
        snapshot.getNext()[0][1] = 0;
        assertArrayEquals(new int[]{4, 2}, snapshot.getNodeCounts());
        assertEquals(4, snapshot.getNext()[0][1]);
    }
}

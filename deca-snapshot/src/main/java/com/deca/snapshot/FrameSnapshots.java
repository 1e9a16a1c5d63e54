package com.deca.snapshot;

import com.deca.config.EngineConfig;
import com.deca.engine.ConstraintLayer;
import com.deca.engine.DecisionFrame;
import com.deca.engine.base.IntervalVector;
import com.deca.engine.base.Statement;
import com.deca.tree.AlternativeTree;
import com.deca.tree.FrameTopology;
import com.deca.tree.error.DecaException;
import com.deca.tree.error.ErrorKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Captures decision frames into {@link FrameSnapshot}s, restores them, and converts snapshots
 * to and from JSON. JSON excludes null values when serializing.
 */
public final class FrameSnapshots {

    private static final Logger log = LoggerFactory.getLogger(FrameSnapshots.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private FrameSnapshots() {
    }

    /** Snapshot of a frame's shape, name and layer input. The frame may be attached or detached. */
    public static FrameSnapshot capture(DecisionFrame frame) {
        Objects.requireNonNull(frame, "frame");
        FrameTopology topology = frame.topology();
        int alts = topology.alternativeCount();
        int[] nodeCounts = new int[alts];
        int[][] next = null;
        int[][] down = null;
        if (topology.isTreeShaped()) {
            next = new int[alts][];
            down = new int[alts][];
        }
        for (int a = 1; a <= alts; a++) {
            nodeCounts[a - 1] = topology.nodeCount(a);
            if (next != null) {
                AlternativeTree tree = topology.tree(a);
                next[a - 1] = tree.nextLinks();
                down[a - 1] = tree.downLinks();
            }
        }
        return new FrameSnapshot(FrameSnapshot.CURRENT_VERSION, frame.getName(), nodeCounts, next, down,
                layer(frame.probabilities()), layer(frame.values()));
    }

    /**
     * Builds a detached frame from a snapshot. Statements are not checked against each other
     * until the frame is attached.
     *
     * @throws DecaException INPUT_ERROR for an unknown version or malformed input, or the shape
     *                       errors of frame creation
     */
    public static DecisionFrame restore(FrameSnapshot snapshot, EngineConfig config) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(config, "config");
        if (!FrameSnapshot.CURRENT_VERSION.equals(snapshot.getVersion())) {
            throw new DecaException(ErrorKind.INPUT_ERROR, "unsupported snapshot version " + snapshot.getVersion());
        }
        DecisionFrame frame = snapshot.isTree()
                ? DecisionFrame.createTree(config, snapshot.getNodeCounts(), snapshot.getNext(), snapshot.getDown())
                : DecisionFrame.createFlat(config, snapshot.getNodeCounts());
        try {
            frame.setName(snapshot.getName());
            apply(frame.probabilities(), snapshot.getProbabilities());
            apply(frame.values(), snapshot.getValues());
        } catch (DecaException e) {
            frame.dispose();
            throw e;
        }
        log.info("Snapshot restored | name={} | alts={} | pStatements={} | vStatements={}", snapshot.getName(),
                snapshot.getNodeCounts().length, frame.probabilities().statementCount(),
                frame.values().statementCount());
        return frame;
    }

    public static DecisionFrame restore(FrameSnapshot snapshot) {
        return restore(snapshot, EngineConfig.DEFAULT);
    }

    /**
     * Serializes a snapshot to an indented JSON string.
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(FrameSnapshot snapshot) {
        try {
            return MAPPER.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /**
     * Deserializes a snapshot from JSON.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static FrameSnapshot fromJson(String json) {
        try {
            return MAPPER.readValue(json, FrameSnapshot.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static LayerSnapshot layer(ConstraintLayer layer) {
        List<StatementRecord> statements = new ArrayList<>();
        for (Statement s : layer.statements()) {
            statements.add(new StatementRecord(s.getAlternative(), s.getNode(), s.getLower(), s.getUpper()));
        }
        IntervalVector box = layer.isBoxSet() ? layer.getBox() : null;
        IntervalVector mid = layer.getMidpointBox();
        return new LayerSnapshot(statements,
                box != null ? box.lowerBounds() : null,
                box != null ? box.upperBounds() : null,
                mid.lowerBounds(), mid.upperBounds());
    }

    private static void apply(ConstraintLayer layer, LayerSnapshot snapshot) {
        if (snapshot == null) {
            return;
        }
        for (StatementRecord s : snapshot.getStatements()) {
            layer.add(s.getAlternative(), s.getNode(), s.getLower(), s.getUpper());
        }
        if (snapshot.getBoxLower() != null || snapshot.getBoxUpper() != null) {
            if (snapshot.getBoxLower() == null || snapshot.getBoxUpper() == null) {
                throw new DecaException(ErrorKind.INPUT_ERROR, "box needs both lower and upper bounds");
            }
            layer.setBox(snapshot.getBoxLower(), snapshot.getBoxUpper());
        }
        if (snapshot.getMidpointLower() != null && snapshot.getMidpointUpper() != null) {
            layer.setMidpointBox(snapshot.getMidpointLower(), snapshot.getMidpointUpper());
        }
    }
}

package org.cliffsynth.converter.synthesis;

import org.cliffsynth.circuit.Circuit;
import org.cliffsynth.circuit.OpType;
import org.cliffsynth.tableau.Tableau;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Mutable state shared by the synthesis steps: the residual tableau that still has to be
 * realised and the circuit emitted so far.
 * <p>
 * Every emitted gate {@code g} is appended to the circuit and {@code g^dagger} is applied at
 * the front of the residual, so that at all times
 * {@code input = residual . circuit} (circuit first). Synthesis is complete once the
 * residual is the identity.
 */
public final class SynthesisContext {

    private final Tableau residual;
    private final Circuit circuit;
    private final Map<SynthesisLayer, Integer> layerCounts = new EnumMap<>(SynthesisLayer.class);
    private SynthesisLayer currentLayer;

    /**
     * @param residual An exclusive working copy; it is consumed.
     */
    public SynthesisContext(Tableau residual) {
        this.residual = residual;
        this.circuit = new Circuit(residual.size());
    }

    /**
     * Starts counting emitted gates towards the given layer.
     * @param layer The layer that subsequent emissions belong to.
     */
    public void beginLayer(SynthesisLayer layer) {
        this.currentLayer = layer;
        layerCounts.putIfAbsent(layer, 0);
    }

    /**
     * Appends a gate to the circuit and applies its inverse at the front of the residual.
     *
     * @param type A generating-set gate allowed in the current layer.
     * @param indices The qubit indices, in gate order.
     */
    public void emit(OpType type, int... indices) {
        if (currentLayer == null || !currentLayer.gateTypes().contains(type)) {
            throw new IllegalStateException("Gate " + type + " cannot be emitted in layer " + currentLayer);
        }
        circuit.addOp(type, indices);
        switch (type) {
            case V -> {
                residual.applyVAtFront(indices[0]);
                residual.applyVAtFront(indices[0]);
                residual.applyVAtFront(indices[0]);
            }
            case S -> {
                residual.applySAtFront(indices[0]);
                residual.applySAtFront(indices[0]);
                residual.applySAtFront(indices[0]);
            }
            case H -> {
                residual.applySAtFront(indices[0]);
                residual.applyVAtFront(indices[0]);
                residual.applySAtFront(indices[0]);
            }
            case Z -> {
                residual.applySAtFront(indices[0]);
                residual.applySAtFront(indices[0]);
            }
            case X -> {
                residual.applyVAtFront(indices[0]);
                residual.applyVAtFront(indices[0]);
            }
            case CX -> residual.applyCXAtFront(indices[0], indices[1]);
            default -> throw new IllegalStateException("Gate " + type + " is not a Clifford generator");
        }
        layerCounts.merge(currentLayer, 1, Integer::sum);
    }

    public Tableau residual() {
        return residual;
    }

    public Circuit circuit() {
        return circuit;
    }

    public int size() {
        return residual.size();
    }

    /**
     * @return Gates emitted per layer, for every layer that has begun.
     */
    public Map<SynthesisLayer, Integer> layerCounts() {
        return Collections.unmodifiableMap(layerCounts);
    }
}

package org.cliffsynth.converter.synthesis;

import org.cliffsynth.circuit.Circuit;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Output of {@link TableauSynthesizer}.
 *
 * @param circuit The synthesized circuit, over the input tableau's qubit identifiers.
 * @param layerCounts Number of gates each canonical-form layer contributed, iterated in layer order.
 */
public record SynthesisResult(Circuit circuit, Map<SynthesisLayer, Integer> layerCounts) {

    public SynthesisResult {
        Map<SynthesisLayer, Integer> ordered = new EnumMap<>(SynthesisLayer.class);
        ordered.putAll(layerCounts);
        layerCounts = Collections.unmodifiableMap(ordered);
    }
}

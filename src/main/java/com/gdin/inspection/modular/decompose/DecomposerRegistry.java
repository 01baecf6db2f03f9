package com.gdin.inspection.modular.decompose;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

public class DecomposerRegistry {

    private final Map<DecompositionAlgorithm, ModularDecomposer> decomposers = new EnumMap<>(DecompositionAlgorithm.class);

    public DecomposerRegistry register(ModularDecomposer decomposer) {
        decomposers.put(decomposer.algorithm(), decomposer);
        return this;
    }

    public ModularDecomposer get(DecompositionAlgorithm algorithm) {
        if (algorithm == null) throw new IllegalArgumentException("algorithm 不能为空");
        ModularDecomposer decomposer = decomposers.get(algorithm);
        if (decomposer == null) {
            throw new IllegalStateException("Decomposer not registered: " + algorithm);
        }
        return decomposer;
    }

    public Set<DecompositionAlgorithm> registered() {
        return decomposers.keySet();
    }
}

package com.gdin.inspection.modular.decompose;

import com.gdin.inspection.modular.decompose.habib.HabibMaurerDecomposer;
import com.gdin.inspection.modular.decompose.tedder.TedderDecomposer;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class DecomposerRegistryTest {

    @Test
    public void testRegisterAndLookup() {
        DecomposerRegistry registry = new DecomposerRegistry()
                .register(new HabibMaurerDecomposer())
                .register(new TedderDecomposer());
        assertEquals(Set.of(DecompositionAlgorithm.REFERENCE, DecompositionAlgorithm.LINEAR), registry.registered());
        assertInstanceOf(TedderDecomposer.class, registry.get(DecompositionAlgorithm.LINEAR));
        assertInstanceOf(HabibMaurerDecomposer.class, registry.get(DecompositionAlgorithm.REFERENCE));
    }

    @Test
    public void testMissingAlgorithm() {
        DecomposerRegistry registry = new DecomposerRegistry().register(new HabibMaurerDecomposer());
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> registry.get(DecompositionAlgorithm.LINEAR));
        assertEquals("Decomposer not registered: LINEAR", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> registry.get(null));
    }
}

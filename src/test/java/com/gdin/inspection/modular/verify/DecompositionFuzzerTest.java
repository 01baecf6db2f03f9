package com.gdin.inspection.modular.verify;

import com.gdin.inspection.modular.decompose.DecompositionAlgorithm;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
@SpringBootTest
@ActiveProfiles("test")
public class DecompositionFuzzerTest {
    @Resource
    private DecompositionFuzzer decompositionFuzzer;

    @Test
    public void testGammaModules() {
        ValidationResult result = decompositionFuzzer.testGammaModules();
        assertTrue(result.isValid(), result::getReason);
        assertTrue(decompositionFuzzer.testGammaModules(20, 15, 0.2).isValid());
    }

    @Test
    public void testPermuteDecomposition() {
        for (DecompositionAlgorithm algorithm : DecompositionAlgorithm.values()) {
            ValidationResult result = decompositionFuzzer.permuteDecomposition(algorithm);
            log.info("permuteDecomposition {}: {}", algorithm, result);
            assertTrue(result.isValid(), result::getReason);
        }
    }

    @Test
    public void testRecreateDecomposition() {
        for (DecompositionAlgorithm algorithm : DecompositionAlgorithm.values()) {
            ValidationResult result = decompositionFuzzer.recreateDecomposition(algorithm);
            log.info("recreateDecomposition {}: {}", algorithm, result);
            assertTrue(result.isValid(), result::getReason);
        }
        assertTrue(decompositionFuzzer.recreateDecomposition(DecompositionAlgorithm.LINEAR, 20, 5, 6, 0.3).isValid());
    }
}

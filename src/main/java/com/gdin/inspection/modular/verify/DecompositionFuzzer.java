package com.gdin.inspection.modular.verify;

import com.gdin.inspection.modular.config.properties.DecompositionProperties;
import com.gdin.inspection.modular.decompose.DecomposerRegistry;
import com.gdin.inspection.modular.decompose.DecompositionAlgorithm;
import com.gdin.inspection.modular.decompose.ModularDecomposer;
import com.gdin.inspection.modular.decompose.habib.GammaClasses;
import com.gdin.inspection.modular.graph.Edge;
import com.gdin.inspection.modular.graph.SimpleGraph;
import com.gdin.inspection.modular.models.MdTree;
import com.gdin.inspection.modular.util.MdTreeUtils;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 随机化的一致性测试：gamma 类是模、分解与重标号可交换、随机 MD 树可被还原。
 * 每个方法在第一次失败时停止，打 WARN 并返回失败原因；随机种子取自配置，结果可复现。
 */
@Slf4j
@Component
public class DecompositionFuzzer {
    @Resource
    private DecomposerRegistry decomposerRegistry;
    @Resource
    private DecompositionProperties decompositionProperties;

    /**
     * 随机 G(n, p) 图的每个 gamma 类覆盖的顶点集都是模
     */
    public ValidationResult testGammaModules(int trials, int vertices, double edgeProbability) {
        Random random = newRandom();
        for (int trial = 0; trial < trials; trial++) {
            SimpleGraph<Integer> graph = SimpleGraph.randomGnp(vertices, edgeProbability, random);
            Map<Set<Integer>, List<Edge<Integer>>> gClasses = GammaClasses.compute(graph);
            for (Set<Integer> module : gClasses.keySet()) {
                if (!ModuleVerifier.isModule(module, graph)) {
                    return failed("testGammaModules", trial, "gamma 类顶点集不是模: " + module + ", edges=" + graph.edges());
                }
            }
        }
        return ValidationResult.ok();
    }

    /**
     * 随机图与其随机重标号后的同构图分别分解，两棵树都要通过校验，且重标号后等价
     */
    public ValidationResult permuteDecomposition(DecompositionAlgorithm algorithm, int trials, int vertices, double edgeProbability) {
        ModularDecomposer decomposer = decomposerRegistry.get(algorithm);
        Random random = newRandom();
        for (int trial = 0; trial < trials; trial++) {
            SimpleGraph<Integer> g1 = SimpleGraph.randomGnp(vertices, edgeProbability, random);
            List<Integer> shuffled = g1.vertices();
            Collections.shuffle(shuffled, random);
            Map<Integer, Integer> permutation = new HashMap<>();
            for (int i = 0; i < shuffled.size(); i++) permutation.put(i, shuffled.get(i));
            SimpleGraph<Integer> g2 = g1.relabel(permutation::get);

            MdTree<Integer> t1 = decomposer.decompose(g1);
            MdTree<Integer> t2 = decomposer.decompose(g2);

            ValidationResult r1 = ModuleVerifier.testModularDecomposition(t1, g1);
            if (!r1.isValid()) return failed("permuteDecomposition", trial, r1.getReason());
            ValidationResult r2 = ModuleVerifier.testModularDecomposition(t2, g2);
            if (!r2.isValid()) return failed("permuteDecomposition", trial, r2.getReason());

            MdTree<Integer> t1p = MdTreeUtils.relabel(t1, permutation);
            if (!MdTreeUtils.equivalentTrees(t1p, t2)) {
                return failed("permuteDecomposition", trial, "重标号后不等价: " + t1p + " vs " + t2);
            }
        }
        return ValidationResult.ok();
    }

    /**
     * 随机 MD 树 → 构图 → 分解，结果应与原树等价
     */
    public ValidationResult recreateDecomposition(DecompositionAlgorithm algorithm, int trials, int maxDepth,
                                                  int maxFanOut, double leafProbability) {
        ModularDecomposer decomposer = decomposerRegistry.get(algorithm);
        Random random = newRandom();
        for (int trial = 0; trial < trials; trial++) {
            MdTree<Integer> expected = RandomMdTrees.randomMdTree(maxDepth, maxFanOut, leafProbability, random);
            SimpleGraph<Integer> graph = RandomMdTrees.mdTreeToGraph(expected);
            MdTree<Integer> actual = decomposer.decompose(graph);
            if (!MdTreeUtils.equivalentTrees(expected, actual)) {
                return failed("recreateDecomposition", trial, "还原失败:\n" + MdTreeUtils.render(expected)
                        + "实际:\n" + MdTreeUtils.render(actual));
            }
        }
        return ValidationResult.ok();
    }

    public ValidationResult testGammaModules() {
        DecompositionProperties.Fuzz fuzz = decompositionProperties.getFuzz();
        return testGammaModules(fuzz.getTrials(), fuzz.getVertices(), fuzz.getEdgeProbability());
    }

    public ValidationResult permuteDecomposition(DecompositionAlgorithm algorithm) {
        DecompositionProperties.Fuzz fuzz = decompositionProperties.getFuzz();
        return permuteDecomposition(algorithm, fuzz.getTrials(), fuzz.getVertices(), fuzz.getEdgeProbability());
    }

    public ValidationResult recreateDecomposition(DecompositionAlgorithm algorithm) {
        DecompositionProperties.Fuzz fuzz = decompositionProperties.getFuzz();
        return recreateDecomposition(algorithm, fuzz.getTrials(), fuzz.getMaxDepth(), fuzz.getMaxFanOut(),
                fuzz.getLeafProbability());
    }

    private Random newRandom() {
        Long seed = decompositionProperties.getFuzz().getSeed();
        return seed == null ? new Random() : new Random(seed);
    }

    private ValidationResult failed(String runner, int trial, String reason) {
        log.warn("{} 第 {} 轮失败: {}", runner, trial, reason);
        return ValidationResult.fail(reason);
    }
}

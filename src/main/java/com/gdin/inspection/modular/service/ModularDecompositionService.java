package com.gdin.inspection.modular.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.gdin.inspection.modular.config.properties.DecompositionProperties;
import com.gdin.inspection.modular.decompose.DecomposerRegistry;
import com.gdin.inspection.modular.decompose.DecompositionAlgorithm;
import com.gdin.inspection.modular.graph.Graph;
import com.gdin.inspection.modular.models.MdTree;
import com.gdin.inspection.modular.util.MdTreeUtils;
import com.gdin.inspection.modular.util.NestedTupleCodec;
import com.gdin.inspection.modular.verify.ModuleVerifier;
import com.gdin.inspection.modular.verify.ValidationResult;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 模分解的统一入口：按配置选算法、记录耗时、可选地校验结果
 */
@Service
@Slf4j
public class ModularDecompositionService {
    @Resource
    private DecomposerRegistry decomposerRegistry;
    @Resource
    private DecompositionProperties decompositionProperties;

    public <V> MdTree<V> decompose(Graph<V> graph) {
        return decompose(graph, decompositionProperties.getAlgorithm());
    }

    /**
     * @throws com.gdin.inspection.modular.graph.InvalidGraphException 有向图或带自环
     */
    public <V> MdTree<V> decompose(Graph<V> graph, DecompositionAlgorithm algorithm) {
        if (graph == null) throw new IllegalArgumentException("graph 不能为空");
        long startTime = System.currentTimeMillis();
        MdTree<V> tree = decomposerRegistry.get(algorithm).decompose(graph);
        log.info("模分解完成: algorithm={}, order={}, size={}, root={}, 耗时: {}ms",
                algorithm, graph.order(), graph.size(), tree.getType(), System.currentTimeMillis() - startTime);

        if (Boolean.TRUE.equals(decompositionProperties.getDebugDump()) && log.isDebugEnabled()) {
            log.debug("分解树:\n{}", MdTreeUtils.render(tree));
        }
        if (Boolean.TRUE.equals(decompositionProperties.getValidateResult())) {
            ValidationResult result = ModuleVerifier.testModularDecomposition(tree, graph);
            if (!result.isValid()) {
                log.warn("分解结果校验未通过: algorithm={}, reason={}", algorithm, result.getReason());
            }
        }
        return tree;
    }

    public <V> ValidationResult verify(MdTree<V> tree, Graph<V> graph) {
        return ModuleVerifier.testModularDecomposition(tree, graph);
    }

    /**
     * 两个算法各算一次，比较是否等价（只允许孩子顺序不同）
     */
    public <V> boolean crossCheck(Graph<V> graph) {
        MdTree<V> reference = decompose(graph, DecompositionAlgorithm.REFERENCE);
        MdTree<V> linear = decompose(graph, DecompositionAlgorithm.LINEAR);
        boolean equivalent = MdTreeUtils.equivalentTrees(reference, linear);
        if (!equivalent) {
            log.warn("两种算法结果不一致:\nREFERENCE\n{}LINEAR\n{}", MdTreeUtils.render(reference), MdTreeUtils.render(linear));
        }
        return equivalent;
    }

    public String toJson(MdTree<?> tree) throws JsonProcessingException {
        return NestedTupleCodec.encode(tree);
    }

    public <V> MdTree<V> fromJson(String json) throws JsonProcessingException {
        return NestedTupleCodec.decodeTree(json);
    }
}

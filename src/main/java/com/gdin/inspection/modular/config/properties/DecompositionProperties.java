package com.gdin.inspection.modular.config.properties;

import com.gdin.inspection.modular.decompose.DecompositionAlgorithm;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;

@Data
@ConfigurationProperties(prefix = "gdin.modular")
@Component
public class DecompositionProperties implements Serializable {
    // 默认使用的分解算法
    private DecompositionAlgorithm algorithm = DecompositionAlgorithm.LINEAR;
    // 每次分解后按定义校验结果，失败只打 WARN
    private Boolean validateResult = false;
    // 线性算法求解后校验侵入式树的链接记账
    private Boolean consistencyChecks = false;
    // DEBUG 级别输出缩进的分解树
    private Boolean debugDump = false;

    private Fuzz fuzz = new Fuzz();

    @Data
    public static class Fuzz implements Serializable {
        // =============== 随机图 ================
        private Integer trials = 20;
        private Integer vertices = 12;
        private Double edgeProbability = 0.5;

        // =============== 随机 MD 树 ================
        private Integer maxDepth = 4;
        // 不能小于 4
        private Integer maxFanOut = 5;
        private Double leafProbability = 0.5;

        // 固定种子，保证可复现
        private Long seed = 20240601L;
    }
}

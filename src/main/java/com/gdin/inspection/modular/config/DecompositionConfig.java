package com.gdin.inspection.modular.config;

import com.gdin.inspection.modular.config.properties.DecompositionProperties;
import com.gdin.inspection.modular.decompose.DecomposerRegistry;
import com.gdin.inspection.modular.decompose.habib.HabibMaurerDecomposer;
import com.gdin.inspection.modular.decompose.tedder.TedderDecomposer;
import jakarta.annotation.Resource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DecompositionConfig {
    @Resource
    private DecompositionProperties decompositionProperties;

    @Bean
    public HabibMaurerDecomposer habibMaurerDecomposer() {
        return new HabibMaurerDecomposer();
    }

    @Bean
    public TedderDecomposer tedderDecomposer() {
        return new TedderDecomposer(Boolean.TRUE.equals(decompositionProperties.getConsistencyChecks()));
    }

    @Bean
    public DecomposerRegistry decomposerRegistry(HabibMaurerDecomposer habibMaurerDecomposer,
                                                 TedderDecomposer tedderDecomposer) {
        return new DecomposerRegistry()
                .register(habibMaurerDecomposer)
                .register(tedderDecomposer);
    }
}

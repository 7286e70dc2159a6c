package com.yhy.extrusion.config;

import cn.hutool.core.thread.ThreadFactoryBuilder;
import com.yhy.extrusion.service.OptimizationOrchestrator;
import com.yhy.extrusion.service.strategy.CuttingStrategy;
import com.yhy.extrusion.service.strategy.StrategyRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class EngineConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService optimizerExecutor(OptimizerProperties properties) {
        return Executors.newFixedThreadPool(properties.getWorkerThreads(),
                ThreadFactoryBuilder.create().setNamePrefix("optimizer-").setDaemon(true).build());
    }

    @Bean
    public StrategyRegistry strategyRegistry(List<CuttingStrategy> strategies) {
        return new StrategyRegistry(strategies);
    }

    @Bean
    public OptimizationOrchestrator optimizationOrchestrator(StrategyRegistry strategyRegistry,
                                                             ExecutorService optimizerExecutor) {
        return new OptimizationOrchestrator(strategyRegistry, optimizerExecutor);
    }
}

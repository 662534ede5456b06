package org.example.parallel.config;

import org.example.parallel.service.IsolatedEnvironmentManager;
import org.example.parallel.service.ParallelReportingManager;
import org.example.parallel.service.ParallelTestManager;
import org.example.parallel.service.ResourceLockManager;
import org.example.parallel.service.ResourcePoolManager;
import org.example.parallel.service.TestDependencyManager;
import org.example.parallel.service.TestDistributionManager;
import org.example.parallel.service.TestQuarantineManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires one coordinator per process. Settings come from {@link ParallelSettings#fromConfig()}.
 */
@Configuration
public class ParallelCoordinatorConfig {

    @Bean
    public ParallelSettings parallelSettings() {
        return ParallelSettings.fromConfig();
    }

    @Bean
    public ResourceLockManager resourceLockManager() {
        return new ResourceLockManager();
    }

    @Bean
    public TestDependencyManager testDependencyManager() {
        return new TestDependencyManager();
    }

    @Bean
    public IsolatedEnvironmentManager isolatedEnvironmentManager(ParallelSettings settings) {
        return new IsolatedEnvironmentManager(settings.getTempDir());
    }

    @Bean
    public TestQuarantineManager testQuarantineManager(ParallelSettings settings) {
        return new TestQuarantineManager(settings.getQuarantineFile(), settings.getFailureThreshold(),
                settings.getSuccessThreshold(), settings.getQuarantineDuration());
    }

    @Bean
    public ResourcePoolManager resourcePoolManager(ParallelSettings settings) {
        return new ResourcePoolManager(settings.getPoolHealthInterval());
    }

    @Bean
    public TestDistributionManager testDistributionManager(ParallelSettings settings) {
        return new TestDistributionManager(settings.getDurationHistorySize(), settings.getDefaultTestDuration(),
                settings.getHeartbeatStaleAfter());
    }

    @Bean
    public ParallelReportingManager parallelReportingManager(ParallelSettings settings) {
        return new ParallelReportingManager(settings.getMaxRealTimeResults());
    }

    @Bean(initMethod = "start")
    public ParallelTestManager parallelTestManager(ResourceLockManager lockManager,
                                                   TestDependencyManager dependencyManager,
                                                   IsolatedEnvironmentManager environmentManager,
                                                   TestQuarantineManager quarantineManager,
                                                   ResourcePoolManager poolManager,
                                                   TestDistributionManager distributionManager,
                                                   ParallelReportingManager reportingManager,
                                                   ParallelSettings settings) {
        return new ParallelTestManager(lockManager, dependencyManager, environmentManager, quarantineManager,
                poolManager, distributionManager, reportingManager, settings);
    }
}

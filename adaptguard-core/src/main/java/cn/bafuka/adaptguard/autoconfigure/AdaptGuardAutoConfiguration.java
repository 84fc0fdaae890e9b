package cn.bafuka.adaptguard.autoconfigure;

import cn.bafuka.adaptguard.config.AdaptGuardProperties;
import cn.bafuka.adaptguard.control.RuleIndexBuilder;
import cn.bafuka.adaptguard.control.RulePublisher;
import cn.bafuka.adaptguard.control.RuleUpdateHandler;
import cn.bafuka.adaptguard.control.SystemRuleManager;
import cn.bafuka.adaptguard.control.impl.DefaultSystemRuleManager;
import cn.bafuka.adaptguard.control.impl.FanOutRuleUpdateHandler;
import cn.bafuka.adaptguard.sentinel.SentinelSystemRulePublisher;
import cn.bafuka.adaptguard.spi.ChainRegistrar;
import cn.bafuka.adaptguard.spi.ConfigSource;
import cn.bafuka.adaptguard.spi.impl.DefaultChainRegistrar;
import cn.bafuka.adaptguard.spi.impl.JsonConfigSource;
import cn.bafuka.adaptguard.spi.impl.LocalYamlConfigSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AdaptGuard 自动配置类
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(AdaptGuardProperties.class)
@ConditionalOnProperty(prefix = "adaptguard", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AdaptGuardAutoConfiguration {

    public AdaptGuardAutoConfiguration() {
        log.info("AdaptGuard auto-configuration initializing...");
    }

    /**
     * 调用链注册器
     */
    @Bean
    @ConditionalOnMissingBean
    public ChainRegistrar chainRegistrar() {
        return new DefaultChainRegistrar();
    }

    /**
     * 规则索引构建器
     */
    @Bean
    @ConditionalOnMissingBean
    public RuleIndexBuilder ruleIndexBuilder(ChainRegistrar chainRegistrar) {
        return new RuleIndexBuilder(chainRegistrar);
    }

    /**
     * Sentinel 系统规则同步
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "adaptguard", name = "sentinel-sync", havingValue = "true", matchIfMissing = true)
    public SentinelSystemRulePublisher sentinelSystemRulePublisher() {
        return new SentinelSystemRulePublisher();
    }

    /**
     * 规则更新处理器，把容器中的下游发布器串联在本地安装之前
     */
    @Bean
    @ConditionalOnMissingBean
    public RuleUpdateHandler ruleUpdateHandler(ObjectProvider<RulePublisher> publishers) {
        List<RulePublisher> downstream = publishers.orderedStream().collect(Collectors.toList());
        if (downstream.isEmpty()) {
            return RuleUpdateHandler.direct();
        }
        log.info("Rule update fan-out: {}", downstream.stream()
                .map(p -> p.getClass().getSimpleName())
                .collect(Collectors.toList()));
        return new FanOutRuleUpdateHandler(downstream);
    }

    /**
     * 系统规则管理器
     */
    @Bean
    @ConditionalOnMissingBean
    public SystemRuleManager systemRuleManager(RuleIndexBuilder ruleIndexBuilder,
                                               RuleUpdateHandler ruleUpdateHandler) {
        DefaultSystemRuleManager manager = new DefaultSystemRuleManager(ruleIndexBuilder);
        manager.registerUpdateHandler(ruleUpdateHandler);
        return manager;
    }

    /**
     * 规则配置源，配置了 rule-file 时读取 JSON 文件，否则读取本地 YAML
     */
    @Bean
    @ConditionalOnMissingBean
    public ConfigSource configSource(AdaptGuardProperties properties) {
        if (properties.getRuleFile() != null && !properties.getRuleFile().isEmpty()) {
            return new JsonConfigSource(properties.getRuleFile());
        }
        return new LocalYamlConfigSource(properties);
    }

    /**
     * 配置源初始化器
     */
    @Bean(destroyMethod = "shutdown")
    public AdaptGuardConfigInitializer adaptGuardConfigInitializer(
            ConfigSource configSource,
            SystemRuleManager systemRuleManager) {
        AdaptGuardConfigInitializer initializer = new AdaptGuardConfigInitializer(configSource, systemRuleManager);
        initializer.initialize();
        return initializer;
    }

    /**
     * 配置源初始化器（内部类）
     */
    @Slf4j
    public static class AdaptGuardConfigInitializer {

        private final ConfigSource configSource;
        private final SystemRuleManager systemRuleManager;

        public AdaptGuardConfigInitializer(ConfigSource configSource, SystemRuleManager systemRuleManager) {
            this.configSource = configSource;
            this.systemRuleManager = systemRuleManager;
        }

        public void initialize() {
            log.info("初始化 AdaptGuard system rules from source: {}", configSource.getType());

            // 订阅配置变更
            configSource.subscribe(rules -> {
                log.info("Received system rule update, {} candidates", rules.size());
                try {
                    systemRuleManager.loadRules(rules);
                } catch (Exception e) {
                    log.error("失败: apply system rules from source {}", configSource.getType(), e);
                }
            });

            log.info("AdaptGuard initialized successfully");
        }

        public void shutdown() {
            configSource.shutdown();
        }
    }
}

package cn.bafuka.adaptguard.spi.impl;

import cn.bafuka.adaptguard.config.AdaptGuardProperties;
import cn.bafuka.adaptguard.model.MetricType;
import cn.bafuka.adaptguard.model.SystemRule;
import cn.bafuka.adaptguard.spi.ConfigSource;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * 本地 YAML 配置源实现
 * 从 Spring Boot 配置文件的 adaptguard.rules 读取系统规则，启动时整体加载一次
 */
@Slf4j
public class LocalYamlConfigSource implements ConfigSource {

    private final AdaptGuardProperties properties;

    private Consumer<List<SystemRule>> listener;

    public LocalYamlConfigSource(AdaptGuardProperties properties) {
        this.properties = properties;
    }

    @Override
    public void subscribe(Consumer<List<SystemRule>> listener) {
        this.listener = listener;

        // 本地配置源只在启动时加载一次
        List<SystemRule> rules = getCurrentConfig();
        if (rules.isEmpty()) {
            log.info("adaptguard.rules 未配置系统规则，跳过加载");
            return;
        }

        Map<MetricType, Long> countByType = rules.stream()
                .filter(rule -> rule != null && rule.getMetricType() != null)
                .collect(Collectors.groupingBy(SystemRule::getMetricType,
                        () -> new EnumMap<>(MetricType.class), Collectors.counting()));
        log.info("从 adaptguard.rules 读取 {} 条系统规则: {}", rules.size(), countByType);

        if (listener != null) {
            listener.accept(rules);
        }
    }

    @Override
    public List<SystemRule> getCurrentConfig() {
        if (properties == null || properties.getRules() == null) {
            return new ArrayList<>();
        }

        return new ArrayList<>(properties.getRules());
    }

    @Override
    public void shutdown() {
        log.info("关闭 LocalYamlConfigSource, 不再向规则管理器推送 adaptguard.rules");
        listener = null;
    }

    @Override
    public String getType() {
        return "local";
    }
}

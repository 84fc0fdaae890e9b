package cn.bafuka.adaptguard.control;

import cn.bafuka.adaptguard.exception.InvalidRuleException;
import cn.bafuka.adaptguard.model.MetricType;
import cn.bafuka.adaptguard.model.SystemRule;
import cn.bafuka.adaptguard.spi.ChainRegistrar;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 规则索引构建器
 * 校验候选规则，按指标类型分组，并为每条通过校验的规则注册调用链检查槽
 */
@Slf4j
public class RuleIndexBuilder {

    /**
     * 系统自适应检查槽
     */
    public static final String ADAPTIVE_SLOT = "system-adaptive-slot";

    private final ChainRegistrar chainRegistrar;

    public RuleIndexBuilder(ChainRegistrar chainRegistrar) {
        this.chainRegistrar = chainRegistrar;
    }

    /**
     * 构建规则索引
     * 非法规则会被跳过，不会中断整个构建过程
     *
     * @param candidates 候选规则，可以为 null 或空
     * @return 新的规则索引
     */
    public RuleIndex build(List<SystemRule> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return RuleIndex.empty();
        }

        Map<MetricType, List<SystemRule>> buckets = new EnumMap<>(MetricType.class);
        for (SystemRule rule : candidates) {
            try {
                SystemRuleValidator.validate(rule);
            } catch (InvalidRuleException e) {
                log.warn("[RuleIndexBuilder] Ignoring invalid system rule: rule={}, error={}", rule, e.getMessage());
                continue;
            }

            buckets.computeIfAbsent(rule.getMetricType(), k -> new ArrayList<>()).add(rule);
            registerSlot(rule);
        }
        return new RuleIndex(buckets);
    }

    /**
     * 注册检查槽，失败只记录日志，不影响规则生效
     */
    private void registerSlot(SystemRule rule) {
        try {
            chainRegistrar.registerCheckSlot(rule.getResourceName(), ADAPTIVE_SLOT);
        } catch (Exception e) {
            log.error("注册检查槽失败: resource={}, slot={}", rule.getResourceName(), ADAPTIVE_SLOT, e);
        }
    }
}

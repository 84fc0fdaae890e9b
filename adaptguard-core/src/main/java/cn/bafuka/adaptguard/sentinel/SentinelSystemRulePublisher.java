package cn.bafuka.adaptguard.sentinel;

import cn.bafuka.adaptguard.control.RuleIndex;
import cn.bafuka.adaptguard.control.RulePublisher;
import cn.bafuka.adaptguard.model.SystemRule;
import com.alibaba.csp.sentinel.slots.system.SystemRuleManager;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Sentinel 系统规则同步发布器
 * 将规则索引转换为 Sentinel 系统自适应保护规则并整体加载，空索引会清空 Sentinel 的系统规则
 */
@Slf4j
public class SentinelSystemRulePublisher implements RulePublisher {

    @Override
    public void publish(RuleIndex index) {
        List<com.alibaba.csp.sentinel.slots.system.SystemRule> rules = new ArrayList<>(index.size());
        for (SystemRule rule : index.allRules()) {
            rules.add(toSentinelRule(rule));
        }

        SystemRuleManager.loadRules(rules);
        log.info("已同步 {} 条 Sentinel 系统规则", rules.size());
    }

    /**
     * 转换为 Sentinel 系统规则，只设置对应指标的阈值，其余保持 -1（不生效）
     *
     * @param rule 系统规则
     * @return Sentinel 系统规则
     */
    static com.alibaba.csp.sentinel.slots.system.SystemRule toSentinelRule(SystemRule rule) {
        com.alibaba.csp.sentinel.slots.system.SystemRule target = new com.alibaba.csp.sentinel.slots.system.SystemRule();
        double count = rule.getTriggerCount();
        switch (rule.getMetricType()) {
            case LOAD:
                target.setHighestSystemLoad(count);
                break;
            case AVG_RT:
                target.setAvgRt(roundUp(rule, count));
                break;
            case CONCURRENCY:
                target.setMaxThread(roundUp(rule, count));
                break;
            case INBOUND_QPS:
                target.setQps(count);
                break;
            case CPU_USAGE:
                target.setHighestCpuUsage(count);
                break;
            default:
                throw new IllegalStateException("Unsupported metric type: " + rule.getMetricType());
        }
        return target;
    }

    /**
     * Sentinel 的响应时间和并发阈值是整数，小数向上取整，避免阈值被截断为 0
     */
    private static long roundUp(SystemRule rule, double count) {
        long rounded = (long) Math.ceil(count);
        if (rounded != count) {
            log.warn("Sentinel 只支持整数阈值，已向上取整: metricType={}, triggerCount={}, applied={}",
                    rule.getMetricType(), count, rounded);
        }
        return rounded;
    }
}

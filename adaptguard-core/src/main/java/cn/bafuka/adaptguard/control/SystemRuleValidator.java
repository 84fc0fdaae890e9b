package cn.bafuka.adaptguard.control;

import cn.bafuka.adaptguard.exception.InvalidRuleException;
import cn.bafuka.adaptguard.model.MetricType;
import cn.bafuka.adaptguard.model.SystemRule;

/**
 * 系统规则校验器
 * 纯函数，无副作用，可脱离规则管理器单独使用
 */
public final class SystemRuleValidator {

    /**
     * CPU 使用率上限
     */
    public static final double MAX_CPU_USAGE = 1.0;

    private SystemRuleValidator() {
    }

    /**
     * 校验规则
     *
     * @param rule 规则
     * @throws InvalidRuleException 如果规则无效
     */
    public static void validate(SystemRule rule) {
        if (rule == null) {
            throw new InvalidRuleException("nil rule", null);
        }
        if (rule.getTriggerCount() < 0) {
            throw new InvalidRuleException("negative threshold", rule);
        }
        if (rule.getMetricType() == null) {
            throw new InvalidRuleException("invalid metric type", rule);
        }
        if (rule.getMetricType() == MetricType.CPU_USAGE && rule.getTriggerCount() > MAX_CPU_USAGE) {
            throw new InvalidRuleException("invalid CPU usage, valid range is [0.0, 1.0]", rule);
        }
    }

    /**
     * 判断规则是否合法
     *
     * @param rule 规则
     * @return true 表示合法
     */
    public static boolean isValid(SystemRule rule) {
        try {
            validate(rule);
            return true;
        } catch (InvalidRuleException e) {
            return false;
        }
    }
}

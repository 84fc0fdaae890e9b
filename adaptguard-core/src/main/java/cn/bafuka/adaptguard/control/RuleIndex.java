package cn.bafuka.adaptguard.control;

import cn.bafuka.adaptguard.model.MetricType;
import cn.bafuka.adaptguard.model.SystemRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 规则索引
 * 按指标类型分组的规则快照，构建完成后不可修改，每次加载都会重新构建
 */
public final class RuleIndex {

    private static final RuleIndex EMPTY = new RuleIndex(new EnumMap<>(MetricType.class));

    /**
     * Key: 指标类型
     * Value: 该类型下的规则，保持加载顺序
     */
    private final Map<MetricType, List<SystemRule>> rulesByType;

    private final int size;

    RuleIndex(Map<MetricType, List<SystemRule>> buckets) {
        EnumMap<MetricType, List<SystemRule>> copy = new EnumMap<>(MetricType.class);
        int count = 0;
        for (Map.Entry<MetricType, List<SystemRule>> entry : buckets.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
            count += entry.getValue().size();
        }
        this.rulesByType = Collections.unmodifiableMap(copy);
        this.size = count;
    }

    /**
     * 空索引
     */
    public static RuleIndex empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * 规则总数
     */
    public int size() {
        return size;
    }

    /**
     * 至少包含一条规则的指标类型
     */
    public Set<MetricType> metricTypes() {
        return rulesByType.keySet();
    }

    /**
     * 获取某一指标类型下的规则
     *
     * @param metricType 指标类型
     * @return 不可修改的规则列表，不存在时返回空列表
     */
    public List<SystemRule> getRules(MetricType metricType) {
        if (metricType == null) {
            return Collections.emptyList();
        }
        return rulesByType.getOrDefault(metricType, Collections.emptyList());
    }

    /**
     * 所有规则（按指标类型顺序展开）
     */
    public List<SystemRule> allRules() {
        List<SystemRule> rules = new ArrayList<>(size);
        for (List<SystemRule> bucket : rulesByType.values()) {
            rules.addAll(bucket);
        }
        return rules;
    }

    /**
     * 分组视图
     */
    public Map<MetricType, List<SystemRule>> asMap() {
        return rulesByType;
    }

    @Override
    public String toString() {
        return "RuleIndex" + rulesByType;
    }
}

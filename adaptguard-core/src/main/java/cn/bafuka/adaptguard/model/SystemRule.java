package cn.bafuka.adaptguard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 系统保护规则
 * 描述某一种系统指标的触发阈值。规则一旦被加载即视为不可变，
 * 更新只能通过整体替换规则集完成。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SystemRule {

    /**
     * 未知指标对应的资源名
     */
    public static final String UNKNOWN_RESOURCE = "unknown";

    /**
     * 规则 ID（可选，仅用于展示）
     */
    private String id;

    /**
     * 指标类型
     */
    private MetricType metricType;

    /**
     * 触发阈值，含义取决于指标类型
     */
    private double triggerCount;

    /**
     * 自适应策略
     */
    @Builder.Default
    private AdaptiveStrategy strategy = AdaptiveStrategy.NO_ADAPTIVE;

    /**
     * 规则对应的资源名，用于向调用链注册检查槽
     *
     * @return 资源名
     */
    public String getResourceName() {
        return metricType != null ? metricType.getResourceName() : UNKNOWN_RESOURCE;
    }

    /**
     * 值拷贝
     *
     * @return 与当前规则相等的新实例
     */
    public SystemRule copy() {
        return toBuilder().build();
    }
}

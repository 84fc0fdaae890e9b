package cn.bafuka.adaptguard.model;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * 系统指标类型
 * 每条系统规则只约束一种指标
 */
public enum MetricType {

    /**
     * 系统负载（load average）
     */
    LOAD(0, "load"),

    /**
     * 平均响应时间（排队时延）
     */
    AVG_RT(1, "avgRT"),

    /**
     * 并发数（正在处理的请求数）
     */
    CONCURRENCY(2, "concurrency"),

    /**
     * 入口 QPS
     */
    INBOUND_QPS(3, "inboundQPS"),

    /**
     * CPU 使用率，取值范围 [0.0, 1.0]
     */
    CPU_USAGE(4, "cpuUsage");

    private final int code;

    private final String resourceName;

    MetricType(int code, String resourceName) {
        this.code = code;
        this.resourceName = resourceName;
    }

    public int getCode() {
        return code;
    }

    public String getResourceName() {
        return resourceName;
    }

    /**
     * 根据编码查找指标类型
     *
     * @param code 指标编码
     * @return 指标类型，编码越界时返回 null
     */
    public static MetricType of(int code) {
        for (MetricType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        return null;
    }

    /**
     * 从配置值解析指标类型，支持编码、枚举名和资源名
     * 无法识别的值返回 null，由规则校验器拒绝该条规则
     *
     * @param value 编码（数字或数字字符串）、枚举名（如 CPU_USAGE）或资源名（如 cpuUsage）
     * @return 指标类型，无法识别时返回 null
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static MetricType from(Object value) {
        if (value instanceof MetricType) {
            return (MetricType) value;
        }
        if (value instanceof Number) {
            Number number = (Number) value;
            if (number.doubleValue() != Math.rint(number.doubleValue())) {
                return null;
            }
            return of(number.intValue());
        }
        if (!(value instanceof String)) {
            return null;
        }

        String text = ((String) value).trim();
        if (text.isEmpty()) {
            return null;
        }
        if (text.chars().allMatch(Character::isDigit)) {
            try {
                return of(Integer.parseInt(text));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        for (MetricType type : values()) {
            if (type.name().equalsIgnoreCase(text) || type.resourceName.equalsIgnoreCase(text)) {
                return type;
            }
        }
        return null;
    }
}

package cn.bafuka.adaptguard.model;

/**
 * 自适应策略
 * 规则管理器只负责透传，由评估引擎解释
 */
public enum AdaptiveStrategy {

    /**
     * 固定阈值，不做自适应
     */
    NO_ADAPTIVE,

    /**
     * 基于 BBR 思想的自适应限流
     */
    BBR
}

package cn.bafuka.adaptguard.control;

import cn.bafuka.adaptguard.model.MetricType;
import cn.bafuka.adaptguard.model.SystemRule;

import java.util.List;

/**
 * 系统规则管理器接口
 * 持有当前生效的系统规则集，是评估引擎读取规则的唯一来源
 */
public interface SystemRuleManager {

    /**
     * 加载规则，之前的规则会被整体替换
     * 非法规则会被跳过，不会导致加载失败
     *
     * @param rules 候选规则列表，null 或空列表表示清空
     * @return true 表示新规则已生效；false 表示更新处理器未安装新规则
     * @throws cn.bafuka.adaptguard.exception.RuleUpdateRejectedException 更新处理器拒绝更新，原规则保持不变
     */
    boolean loadRules(List<SystemRule> rules);

    /**
     * 清空所有规则
     *
     * @throws cn.bafuka.adaptguard.exception.RuleUpdateRejectedException 更新处理器拒绝更新
     */
    void clearRules();

    /**
     * 获取所有规则（值拷贝）
     * 修改返回结果不会影响规则管理器。需要竞争读锁并拷贝，热点路径上应避免调用。
     *
     * @return 规则拷贝列表
     */
    List<SystemRule> getRules();

    /**
     * 获取所有规则（共享引用）
     * 仅供内部评估引擎使用，对返回规则的修改会直接影响生效中的规则
     *
     * @return 生效中的规则引用
     */
    List<SystemRule> currentRules();

    /**
     * 获取某一指标类型下生效的规则（共享引用）
     *
     * @param metricType 指标类型
     * @return 不可修改的规则列表
     */
    List<SystemRule> getRules(MetricType metricType);

    /**
     * 当前生效的规则索引
     */
    RuleIndex currentIndex();

    /**
     * 注册规则更新处理器，覆盖之前的处理器
     *
     * @param handler 处理器，null 表示恢复默认处理器
     */
    void registerUpdateHandler(RuleUpdateHandler handler);
}

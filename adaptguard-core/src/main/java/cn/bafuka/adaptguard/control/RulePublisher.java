package cn.bafuka.adaptguard.control;

/**
 * 规则发布器
 * 接收一份完整的规则索引并使其生效（本地替换、同步到其他子系统等）
 */
@FunctionalInterface
public interface RulePublisher {

    /**
     * 发布规则索引
     *
     * @param index 新的规则索引
     * @throws cn.bafuka.adaptguard.exception.RuleUpdateRejectedException 发布失败
     */
    void publish(RuleIndex index);
}

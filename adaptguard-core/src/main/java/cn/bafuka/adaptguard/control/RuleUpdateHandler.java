package cn.bafuka.adaptguard.control;

/**
 * 规则更新处理器
 * 每次加载规则时被调用，负责决定何时（以及是否）调用安装器真正替换规则。
 * 可用于在替换前后做持久化、同步到其他子系统等扩展。
 * <p>
 * 处理器抛出异常时加载失败。如果异常发生在调用安装器之后，规则管理器会恢复旧索引，
 * 但在安装与恢复之间，并发读取方可能短暂读到被拒绝的索引，恢复并不是原子的。
 * 需要严格保证的处理器应在所有可能失败的步骤完成之后再调用安装器。
 */
@FunctionalInterface
public interface RuleUpdateHandler {

    /**
     * 处理规则更新
     *
     * @param installer 规则管理器提供的安装器，调用后原子替换当前规则索引
     * @param index     新构建的规则索引
     */
    void onUpdate(RulePublisher installer, RuleIndex index);

    /**
     * 默认处理器：直接安装
     */
    static RuleUpdateHandler direct() {
        return RulePublisher::publish;
    }
}

package cn.bafuka.adaptguard.exception;

import cn.bafuka.adaptguard.model.SystemRule;

/**
 * 规则校验异常
 * 规则结构或语义非法时抛出，加载过程中只记录日志并跳过该规则
 *
 * @author AdaptGuard Team
 * @since 1.0
 */
public class InvalidRuleException extends RuntimeException {

    /**
     * 非法的规则（可能为 null）
     */
    private final SystemRule rule;

    public InvalidRuleException(String message, SystemRule rule) {
        super(message);
        this.rule = rule;
    }

    public SystemRule getRule() {
        return rule;
    }

    @Override
    public String toString() {
        return "InvalidRuleException{" +
                "rule=" + rule +
                ", message=" + getMessage() +
                '}';
    }
}

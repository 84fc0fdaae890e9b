package cn.bafuka.adaptguard.exception;

/**
 * 规则更新被拒绝异常
 * 更新处理器或发布步骤失败时抛出，此时生效中的规则集保持不变
 *
 * @author AdaptGuard Team
 * @since 1.0
 */
public class RuleUpdateRejectedException extends RuntimeException {

    public RuleUpdateRejectedException(String message) {
        super(message);
    }

    public RuleUpdateRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}

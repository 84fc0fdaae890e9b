package cn.bafuka.adaptguard.control.impl;

import cn.bafuka.adaptguard.control.RuleIndex;
import cn.bafuka.adaptguard.control.RulePublisher;
import cn.bafuka.adaptguard.control.RuleUpdateHandler;
import cn.bafuka.adaptguard.exception.RuleUpdateRejectedException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 扇出更新处理器
 * 先按顺序把规则发布到下游（其他子系统、持久化等），全部成功后才在本地安装。
 * 任一下游失败则本地规则保持不变。
 */
@Slf4j
public class FanOutRuleUpdateHandler implements RuleUpdateHandler {

    /**
     * 下游发布器，按注册顺序调用
     */
    private final List<RulePublisher> downstream;

    public FanOutRuleUpdateHandler(List<RulePublisher> downstream) {
        this.downstream = downstream == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(downstream));
    }

    @Override
    public void onUpdate(RulePublisher installer, RuleIndex index) {
        for (RulePublisher publisher : downstream) {
            try {
                publisher.publish(index);
            } catch (RuleUpdateRejectedException e) {
                throw e;
            } catch (Exception e) {
                throw new RuleUpdateRejectedException(
                        "Downstream publisher failed: " + publisher.getClass().getSimpleName(), e);
            }
            log.debug("规则已发布到下游: publisher={}, count={}", publisher.getClass().getSimpleName(), index.size());
        }
        installer.publish(index);
    }

    public List<RulePublisher> getDownstream() {
        return downstream;
    }
}

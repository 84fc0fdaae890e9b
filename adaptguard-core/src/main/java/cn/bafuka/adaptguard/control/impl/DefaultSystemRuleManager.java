package cn.bafuka.adaptguard.control.impl;

import cn.bafuka.adaptguard.control.RuleIndex;
import cn.bafuka.adaptguard.control.RuleIndexBuilder;
import cn.bafuka.adaptguard.control.RulePublisher;
import cn.bafuka.adaptguard.control.RuleUpdateHandler;
import cn.bafuka.adaptguard.control.SystemRuleManager;
import cn.bafuka.adaptguard.exception.RuleUpdateRejectedException;
import cn.bafuka.adaptguard.model.MetricType;
import cn.bafuka.adaptguard.model.SystemRule;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 系统规则管理器默认实现
 * 规则索引在锁外构建，写锁内只做引用替换
 */
@Slf4j
public class DefaultSystemRuleManager implements SystemRuleManager {

    /**
     * 当前生效的规则索引，受 lock 保护
     */
    private RuleIndex ruleIndex = RuleIndex.empty();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final RuleIndexBuilder indexBuilder;

    private volatile RuleUpdateHandler updateHandler = RuleUpdateHandler.direct();

    public DefaultSystemRuleManager(RuleIndexBuilder indexBuilder) {
        this.indexBuilder = indexBuilder;
    }

    @Override
    public boolean loadRules(List<SystemRule> rules) {
        RuleIndex index = indexBuilder.build(rules);
        InstallTracker installer = new InstallTracker();
        RuleUpdateHandler handler = updateHandler;

        try {
            handler.onUpdate(installer, index);
        } catch (Exception e) {
            log.error("Fail to load rules in SystemRuleManager.loadRules(): rules={}", rules, e);
            if (installer.installed) {
                rollback(installer.installedIndex, installer.previousIndex);
            }
            if (e instanceof RuleUpdateRejectedException) {
                throw (RuleUpdateRejectedException) e;
            }
            throw new RuleUpdateRejectedException("System rule update rejected: " + e.getMessage(), e);
        }

        if (!installer.installed) {
            log.warn("Update handler did not install the new rules, keeping previous rules: candidates={}",
                    rules == null ? 0 : rules.size());
        }
        return installer.installed;
    }

    @Override
    public void clearRules() {
        loadRules(Collections.emptyList());
    }

    @Override
    public List<SystemRule> getRules() {
        List<SystemRule> live = currentRules();
        List<SystemRule> copies = new ArrayList<>(live.size());
        for (SystemRule rule : live) {
            copies.add(rule.copy());
        }
        return copies;
    }

    @Override
    public List<SystemRule> currentRules() {
        lock.readLock().lock();
        try {
            return ruleIndex.allRules();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<SystemRule> getRules(MetricType metricType) {
        return currentIndex().getRules(metricType);
    }

    @Override
    public RuleIndex currentIndex() {
        lock.readLock().lock();
        try {
            return ruleIndex;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void registerUpdateHandler(RuleUpdateHandler handler) {
        this.updateHandler = handler != null ? handler : RuleUpdateHandler.direct();
        log.info("已注册规则更新处理器: {}", this.updateHandler.getClass().getName());
    }

    /**
     * 原子替换当前规则索引
     *
     * @param index 新的规则索引
     */
    private RuleIndex install(RuleIndex index) {
        long start = System.nanoTime();
        RuleIndex previous;
        lock.writeLock().lock();
        try {
            previous = ruleIndex;
            ruleIndex = index;
        } finally {
            lock.writeLock().unlock();
            log.debug("[SystemRuleManager] Time statistic(ns) for updating system rule: timeCost={}",
                    System.nanoTime() - start);
            if (!index.isEmpty()) {
                log.info("[SystemRuleManager] System rules loaded: count={}, rules={}", index.size(), index);
            } else {
                log.info("[SystemRuleManager] System rules were cleared");
            }
        }
        return previous;
    }

    /**
     * 处理器在安装之后失败时恢复旧索引，期间已被其他加载覆盖则不处理
     */
    private void rollback(RuleIndex installed, RuleIndex previous) {
        lock.writeLock().lock();
        try {
            if (ruleIndex != installed) {
                log.warn("[SystemRuleManager] Rules replaced by a concurrent load, skip rollback");
                return;
            }
            ruleIndex = previous;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[SystemRuleManager] Rolled back to previous rules: count={}", previous.size());
    }

    /**
     * 交给更新处理器的安装器，记录是否被调用
     */
    private class InstallTracker implements RulePublisher {

        private volatile boolean installed;

        private RuleIndex installedIndex;

        private RuleIndex previousIndex;

        @Override
        public void publish(RuleIndex index) {
            if (index == null) {
                throw new RuleUpdateRejectedException("Rule index cannot be null");
            }
            RuleIndex previous = install(index);
            if (!installed) {
                previousIndex = previous;
            }
            installedIndex = index;
            installed = true;
        }
    }
}

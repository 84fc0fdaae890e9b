package cn.bafuka.adaptguard.control.impl;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import cn.bafuka.adaptguard.control.RuleIndex;
import cn.bafuka.adaptguard.control.RuleIndexBuilder;
import cn.bafuka.adaptguard.control.RuleUpdateHandler;
import cn.bafuka.adaptguard.exception.RuleUpdateRejectedException;
import cn.bafuka.adaptguard.model.MetricType;
import cn.bafuka.adaptguard.model.SystemRule;
import cn.bafuka.adaptguard.spi.impl.DefaultChainRegistrar;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.junit.Assert.*;

/**
 * DefaultSystemRuleManager 单元测试
 * 覆盖加载、清空、拷贝语义、更新处理器以及并发读写
 */
public class DefaultSystemRuleManagerTest {

    private DefaultSystemRuleManager manager;

    private DefaultChainRegistrar chainRegistrar;

    private Logger logger;

    private Level originalLevel;

    private ListAppender<ILoggingEvent> appender;

    @Before
    public void setUp() {
        chainRegistrar = new DefaultChainRegistrar();
        manager = new DefaultSystemRuleManager(new RuleIndexBuilder(chainRegistrar));

        logger = (Logger) LoggerFactory.getLogger(DefaultSystemRuleManager.class);
        originalLevel = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @After
    public void tearDown() {
        logger.detachAppender(appender);
        appender.stop();
        logger.setLevel(originalLevel);
    }

    private List<String> messages(Level level) {
        return appender.list.stream()
                .filter(e -> e.getLevel() == level)
                .map(ILoggingEvent::getFormattedMessage)
                .collect(Collectors.toList());
    }

    private static SystemRule rule(String id, MetricType type, double count) {
        return SystemRule.builder().id(id).metricType(type).triggerCount(count).build();
    }

    private static List<SystemRule> validRules() {
        return Arrays.asList(
                rule("cpu", MetricType.CPU_USAGE, 0.8),
                rule("load", MetricType.LOAD, 6),
                rule("qps", MetricType.INBOUND_QPS, 1200),
                rule("rt", MetricType.AVG_RT, 150),
                rule("thread", MetricType.CONCURRENCY, 80));
    }

    @Test
    public void testInitiallyEmpty() {
        assertTrue(manager.getRules().isEmpty());
        assertTrue(manager.currentIndex().isEmpty());
    }

    @Test
    public void testLoadThenGetRulesReturnsSameSet() {
        List<SystemRule> rules = validRules();

        assertTrue(manager.loadRules(rules));

        assertEquals(new HashSet<>(rules), new HashSet<>(manager.getRules()));
        for (MetricType type : MetricType.values()) {
            for (SystemRule loaded : manager.getRules(type)) {
                assertEquals(type, loaded.getMetricType());
            }
        }
        assertTrue(chainRegistrar.isRegistered("cpuUsage", RuleIndexBuilder.ADAPTIVE_SLOT));
        assertTrue(chainRegistrar.isRegistered("load", RuleIndexBuilder.ADAPTIVE_SLOT));
    }

    /**
     * 新加载整体替换旧规则
     */
    @Test
    public void testLoadReplacesPreviousRules() {
        manager.loadRules(validRules());
        SystemRule only = rule("cpu2", MetricType.CPU_USAGE, 0.6);

        manager.loadRules(Collections.singletonList(only));

        assertEquals(Collections.singletonList(only), manager.getRules());
        assertTrue(manager.getRules(MetricType.LOAD).isEmpty());
    }

    /**
     * 场景：一条合法一条非法的 CPU 规则
     */
    @Test
    public void testMixedValidAndInvalidRules() {
        boolean success = manager.loadRules(Arrays.asList(
                rule("ok", MetricType.CPU_USAGE, 0.8),
                rule("bad", MetricType.CPU_USAGE, 5.0)));

        assertTrue(success);
        List<SystemRule> rules = manager.getRules();
        assertEquals(1, rules.size());
        assertEquals(0.8, rules.get(0).getTriggerCount(), 0.0);
    }

    @Test
    public void testInvalidEntriesAtAnyPositionDoNotAffectValidOnes() {
        SystemRule a = rule("a", MetricType.LOAD, 3);
        SystemRule b = rule("b", MetricType.AVG_RT, 100);

        manager.loadRules(Arrays.asList(rule("x", MetricType.LOAD, -1), a, null, b, rule("y", null, 2)));

        assertEquals(new HashSet<>(Arrays.asList(a, b)), new HashSet<>(manager.getRules()));
    }

    @Test
    public void testClearRules() {
        manager.loadRules(validRules());

        manager.clearRules();

        assertTrue(manager.getRules().isEmpty());
        // 清空不会注销检查槽
        assertTrue(chainRegistrar.isRegistered("cpuUsage", RuleIndexBuilder.ADAPTIVE_SLOT));
    }

    @Test
    public void testLoadNullClearsRules() {
        manager.loadRules(validRules());

        assertTrue(manager.loadRules(null));

        assertTrue(manager.getRules().isEmpty());
    }

    @Test
    public void testLoadingSameSetTwiceIsIdempotent() {
        manager.loadRules(validRules());
        List<SystemRule> once = manager.getRules();

        manager.loadRules(validRules());

        assertEquals(once, manager.getRules());
    }

    /**
     * 修改 getRules 的结果不影响规则管理器
     */
    @Test
    public void testGetRulesReturnsCopies() {
        manager.loadRules(Collections.singletonList(rule("load", MetricType.LOAD, 4)));

        List<SystemRule> snapshot = manager.getRules();
        snapshot.get(0).setTriggerCount(100);
        snapshot.clear();

        List<SystemRule> again = manager.getRules();
        assertEquals(1, again.size());
        assertEquals(4.0, again.get(0).getTriggerCount(), 0.0);
    }

    /**
     * currentRules 返回共享引用
     */
    @Test
    public void testCurrentRulesSharesReferences() {
        SystemRule load = rule("load", MetricType.LOAD, 4);
        manager.loadRules(Collections.singletonList(load));

        assertSame(load, manager.currentRules().get(0));
        assertSame(load, manager.getRules(MetricType.LOAD).get(0));
    }

    /**
     * 处理器失败时原规则保持不变
     */
    @Test
    public void testRejectingHandlerKeepsPreviousRules() {
        manager.loadRules(validRules());
        List<SystemRule> before = manager.getRules();

        manager.registerUpdateHandler((installer, index) -> {
            throw new IllegalStateException("persist failed");
        });

        RuleUpdateRejectedException e = assertThrows(RuleUpdateRejectedException.class,
                () -> manager.loadRules(Collections.singletonList(rule("cpu", MetricType.CPU_USAGE, 0.1))));
        assertTrue(e.getCause() instanceof IllegalStateException);
        assertEquals(before, manager.getRules());

        assertThrows(RuleUpdateRejectedException.class, () -> manager.clearRules());
        assertEquals(before, manager.getRules());
    }

    /**
     * 处理器在安装之后失败，回滚到旧规则
     */
    @Test
    public void testHandlerFailingAfterInstallRollsBack() {
        manager.loadRules(validRules());
        List<SystemRule> before = manager.getRules();

        manager.registerUpdateHandler((installer, index) -> {
            installer.publish(index);
            throw new RuleUpdateRejectedException("replication failed");
        });

        RuleUpdateRejectedException e = assertThrows(RuleUpdateRejectedException.class,
                () -> manager.loadRules(Collections.singletonList(rule("cpu", MetricType.CPU_USAGE, 0.1))));
        assertEquals("replication failed", e.getMessage());
        assertEquals(before, manager.getRules());
    }

    /**
     * 处理器不调用安装器时返回 false
     */
    @Test
    public void testHandlerSkippingInstallReturnsFalse() {
        manager.loadRules(validRules());
        List<SystemRule> before = manager.getRules();
        manager.registerUpdateHandler((installer, index) -> {
        });

        assertFalse(manager.loadRules(Collections.emptyList()));
        assertEquals(before, manager.getRules());
    }

    @Test
    public void testCustomHandlerReceivesBuiltIndex() {
        AtomicReference<RuleIndex> seen = new AtomicReference<>();
        manager.registerUpdateHandler((installer, index) -> {
            seen.set(index);
            installer.publish(index);
        });

        manager.loadRules(Arrays.asList(rule("cpu", MetricType.CPU_USAGE, 0.8), rule("bad", MetricType.CPU_USAGE, 3)));

        assertEquals(1, seen.get().size());
        assertSame(seen.get(), manager.currentIndex());
    }

    @Test
    public void testRegisterNullHandlerRestoresDirect() {
        manager.registerUpdateHandler((installer, index) -> {
        });
        manager.registerUpdateHandler(null);

        assertTrue(manager.loadRules(validRules()));
        assertEquals(5, manager.getRules().size());
    }

    /**
     * 最后注册的处理器生效
     */
    @Test
    public void testLastRegisteredHandlerWins() {
        AtomicInteger first = new AtomicInteger();
        AtomicInteger second = new AtomicInteger();
        manager.registerUpdateHandler((installer, index) -> {
            first.incrementAndGet();
            installer.publish(index);
        });
        RuleUpdateHandler handler = (installer, index) -> {
            second.incrementAndGet();
            installer.publish(index);
        };
        manager.registerUpdateHandler(handler);

        manager.loadRules(validRules());

        assertEquals(0, first.get());
        assertEquals(1, second.get());
    }

    /**
     * 并发读：每次读到的规则要么全部来自旧加载，要么全部来自新加载
     */
    @Test
    public void testConcurrentReadersNeverSeeMixedRules() throws InterruptedException {
        List<SystemRule> generationA = new ArrayList<>();
        List<SystemRule> generationB = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            generationA.add(rule("A-" + i, MetricType.values()[i % MetricType.values().length], 0.1));
            generationB.add(rule("B-" + i, MetricType.values()[i % MetricType.values().length], 0.2));
        }
        manager.loadRules(generationA);

        int readerCount = 8;
        AtomicBoolean running = new AtomicBoolean(true);
        AtomicBoolean mixed = new AtomicBoolean(false);
        CountDownLatch started = new CountDownLatch(readerCount);
        Thread[] readers = new Thread[readerCount];

        for (int i = 0; i < readerCount; i++) {
            readers[i] = new Thread(() -> {
                started.countDown();
                while (running.get()) {
                    Set<String> generations = new HashSet<>();
                    for (SystemRule r : manager.getRules()) {
                        generations.add(r.getId().substring(0, 1));
                    }
                    if (generations.size() > 1) {
                        mixed.set(true);
                    }
                }
            });
            readers[i].start();
        }

        started.await();
        for (int i = 0; i < 200; i++) {
            manager.loadRules(i % 2 == 0 ? generationB : generationA);
        }
        running.set(false);
        for (Thread reader : readers) {
            reader.join();
        }

        assertFalse("Readers should never observe rules from two loads", mixed.get());
        assertEquals(50, manager.getRules().size());
    }

    /**
     * 加载成功输出规则数量和临界区耗时
     */
    @Test
    public void testLoadLogsRuleCountAndTiming() {
        manager.loadRules(validRules());

        List<String> infos = messages(Level.INFO);
        assertTrue(infos.toString(), infos.stream()
                .anyMatch(m -> m.startsWith("[SystemRuleManager] System rules loaded: count=5")));
        assertTrue(messages(Level.DEBUG).stream()
                .anyMatch(m -> m.contains("Time statistic(ns) for updating system rule")));
    }

    @Test
    public void testClearLogsRulesCleared() {
        manager.loadRules(validRules());
        appender.list.clear();

        manager.clearRules();

        assertTrue(messages(Level.INFO).contains("[SystemRuleManager] System rules were cleared"));
    }

    /**
     * 处理器拒绝时输出一条 ERROR，包含被拒绝的候选规则和异常
     */
    @Test
    public void testRejectedLoadLogsError() {
        manager.registerUpdateHandler((installer, index) -> {
            throw new IllegalStateException("persist failed");
        });

        assertThrows(RuleUpdateRejectedException.class,
                () -> manager.loadRules(Collections.singletonList(rule("cpu", MetricType.CPU_USAGE, 0.1))));

        List<ILoggingEvent> errors = appender.list.stream()
                .filter(e -> e.getLevel() == Level.ERROR)
                .collect(Collectors.toList());
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).getFormattedMessage().contains("id=cpu"));
        assertEquals("persist failed", errors.get(0).getThrowableProxy().getMessage());
        assertFalse(messages(Level.INFO).stream().anyMatch(m -> m.contains("System rules loaded")));
    }
}

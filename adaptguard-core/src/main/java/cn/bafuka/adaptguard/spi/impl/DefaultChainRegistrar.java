package cn.bafuka.adaptguard.spi.impl;

import cn.bafuka.adaptguard.spi.ChainRegistrar;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 调用链注册器默认实现
 * 在内存中记录每个资源需要执行的检查槽，注册后不会移除
 */
@Slf4j
public class DefaultChainRegistrar implements ChainRegistrar {

    /**
     * Key: 资源名称
     * Value: 检查槽集合
     */
    private final Map<String, Set<String>> slotsByResource = new ConcurrentHashMap<>();

    @Override
    public void registerCheckSlot(String resourceName, String slotName) {
        if (resourceName == null || slotName == null) {
            log.warn("Ignoring check slot registration with null argument: resource={}, slot={}",
                    resourceName, slotName);
            return;
        }

        boolean added = slotsByResource
                .computeIfAbsent(resourceName, k -> ConcurrentHashMap.newKeySet())
                .add(slotName);
        if (added) {
            log.info("已注册检查槽: resource={}, slot={}", resourceName, slotName);
        }
    }

    /**
     * 资源是否已注册指定检查槽
     */
    public boolean isRegistered(String resourceName, String slotName) {
        Set<String> slots = slotsByResource.get(resourceName);
        return slots != null && slots.contains(slotName);
    }

    /**
     * 获取资源已注册的检查槽
     */
    public Set<String> getSlots(String resourceName) {
        Set<String> slots = slotsByResource.get(resourceName);
        return slots == null ? Collections.emptySet() : Collections.unmodifiableSet(slots);
    }

    /**
     * 获取所有已注册的资源
     */
    public Set<String> getResources() {
        return Collections.unmodifiableSet(slotsByResource.keySet());
    }
}

package cn.bafuka.adaptguard.spi;

/**
 * 调用链注册器 SPI
 * 规则被接受后通知评估链路：该资源需要执行对应的检查槽。
 * 实现必须是幂等的，重复注册同一资源不产生副作用。
 */
public interface ChainRegistrar {

    /**
     * 为资源注册检查槽
     *
     * @param resourceName 资源名称
     * @param slotName     检查槽标识
     */
    void registerCheckSlot(String resourceName, String slotName);
}

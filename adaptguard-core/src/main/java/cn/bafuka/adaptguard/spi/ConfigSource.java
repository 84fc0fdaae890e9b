package cn.bafuka.adaptguard.spi;

import cn.bafuka.adaptguard.model.SystemRule;

import java.util.List;
import java.util.function.Consumer;

/**
 * 配置源 SPI 接口
 * 用于对接不同的规则来源（本地配置、JSON 文件、配置中心等）
 */
public interface ConfigSource {

    /**
     * 订阅配置变更
     *
     * @param listener 配置变更监听器，接收新的规则列表
     */
    void subscribe(Consumer<List<SystemRule>> listener);

    /**
     * 获取当前配置（同步方式）
     *
     * @return 当前的规则列表
     */
    List<SystemRule> getCurrentConfig();

    /**
     * 停止订阅
     */
    void shutdown();

    /**
     * 配置源类型标识
     *
     * @return 类型名称（如 "local", "json"）
     */
    String getType();
}

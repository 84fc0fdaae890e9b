package cn.bafuka.adaptguard.config;

import cn.bafuka.adaptguard.model.SystemRule;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * AdaptGuard 配置属性
 * 从 application.yml 读取配置
 */
@Data
@ConfigurationProperties(prefix = "adaptguard")
public class AdaptGuardProperties {

    /**
     * 是否启用 AdaptGuard
     */
    private boolean enabled = true;

    /**
     * 系统规则列表
     */
    private List<SystemRule> rules = new ArrayList<>();

    /**
     * 是否把规则同步到 Sentinel 系统保护
     */
    private boolean sentinelSync = true;

    /**
     * JSON 规则文件位置（如 classpath:system-rules.json），为空时使用本地 YAML 中的规则
     */
    private String ruleFile;
}

package cn.bafuka.adaptguard.example.controller;

import cn.bafuka.adaptguard.exception.RuleUpdateRejectedException;
import cn.bafuka.adaptguard.model.SystemRule;
import com.alibaba.csp.sentinel.slots.system.SystemRuleManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 系统规则控制器
 * 用于查看和替换生效中的系统规则
 */
@Slf4j
@RestController
@RequestMapping("/api/system-rules")
public class SystemRuleController {

    @Autowired
    private cn.bafuka.adaptguard.control.SystemRuleManager systemRuleManager;

    /**
     * 查看所有系统规则
     */
    @GetMapping
    public Map<String, Object> getRules() {
        List<SystemRule> rules = systemRuleManager.getRules();

        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("total", rules.size());
        result.put("rules", rules);
        return result;
    }

    /**
     * 整体替换系统规则，非法规则会被跳过
     */
    @PostMapping
    public Map<String, Object> loadRules(@RequestBody List<SystemRule> rules) {
        Map<String, Object> result = new HashMap<>();
        try {
            boolean applied = systemRuleManager.loadRules(rules);
            result.put("success", applied);
            result.put("submitted", rules.size());
            result.put("active", systemRuleManager.currentIndex().size());
        } catch (RuleUpdateRejectedException e) {
            log.error("加载系统规则失败", e);
            result.put("success", false);
            result.put("error", e.getMessage());
        }
        return result;
    }

    /**
     * 清空系统规则
     */
    @DeleteMapping
    public Map<String, Object> clearRules() {
        Map<String, Object> result = new HashMap<>();
        try {
            systemRuleManager.clearRules();
            result.put("success", true);
        } catch (RuleUpdateRejectedException e) {
            log.error("清空系统规则失败", e);
            result.put("success", false);
            result.put("error", e.getMessage());
        }
        return result;
    }

    /**
     * 查看已同步到 Sentinel 的系统规则
     */
    @GetMapping("/sentinel")
    public Map<String, Object> getSentinelRules() {
        List<Map<String, Object>> details = SystemRuleManager.getRules().stream().map(rule -> {
            Map<String, Object> detail = new HashMap<>();
            detail.put("highestSystemLoad", rule.getHighestSystemLoad());
            detail.put("avgRt", rule.getAvgRt());
            detail.put("maxThread", rule.getMaxThread());
            detail.put("qps", rule.getQps());
            detail.put("highestCpuUsage", rule.getHighestCpuUsage());
            return detail;
        }).collect(Collectors.toList());

        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("total", details.size());
        result.put("rules", details);
        return result;
    }
}

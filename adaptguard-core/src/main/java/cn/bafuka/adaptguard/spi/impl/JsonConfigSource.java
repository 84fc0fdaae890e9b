package cn.bafuka.adaptguard.spi.impl;

import cn.bafuka.adaptguard.model.MetricType;
import cn.bafuka.adaptguard.model.SystemRule;
import cn.bafuka.adaptguard.spi.ConfigSource;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.function.Consumer;

/**
 * JSON 配置源实现
 * 规则以 JSON 数组形式保存在 classpath 资源或本地文件中，
 * 位置以 "classpath:" 开头时从 classpath 读取，否则视为文件路径
 */
@Slf4j
public class JsonConfigSource implements ConfigSource {

    private static final String CLASSPATH_PREFIX = "classpath:";

    /**
     * 规则文件位置
     */
    private final String location;

    private Consumer<List<SystemRule>> listener;

    public JsonConfigSource(String location) {
        this.location = location;
    }

    @Override
    public void subscribe(Consumer<List<SystemRule>> listener) {
        this.listener = listener;

        List<SystemRule> rules = getCurrentConfig();
        log.info("Parsed {} system rules from {}", rules.size(), location);
        if (listener != null) {
            listener.accept(rules);
        }
    }

    @Override
    public List<SystemRule> getCurrentConfig() {
        String content;
        try {
            content = read();
        } catch (IOException e) {
            log.error("失败: read system rules from {}", location, e);
            return new ArrayList<>();
        }
        return parseConfig(content);
    }

    @Override
    public void shutdown() {
        log.info("关闭 JsonConfigSource: {}", location);
        listener = null;
    }

    @Override
    public String getType() {
        return "json";
    }

    /**
     * 解析配置
     * 逐条转换，单条规则格式错误只跳过该条；无法识别的指标类型保留为 null，交给校验器拒绝
     *
     * @param config JSON 配置字符串
     * @return 规则列表，整体解析失败返回空列表
     */
    static List<SystemRule> parseConfig(String config) {
        List<SystemRule> rules = new ArrayList<>();
        if (config == null || config.trim().isEmpty()) {
            return rules;
        }

        JSONArray array;
        try {
            array = JSON.parseArray(config);
        } catch (Exception e) {
            log.error("失败: parse system rule config: {}", config, e);
            return rules;
        }
        if (array == null) {
            return rules;
        }

        for (int i = 0; i < array.size(); i++) {
            Object element = array.get(i);
            if (!(element instanceof JSONObject)) {
                log.warn("Ignoring non-object system rule entry: index={}, value={}", i, element);
                continue;
            }
            try {
                rules.add(toRule((JSONObject) element));
            } catch (Exception e) {
                log.warn("Ignoring malformed system rule entry: index={}, value={}, error={}",
                        i, element, e.getMessage());
            }
        }
        return rules;
    }

    private static SystemRule toRule(JSONObject json) {
        JSONObject fields = new JSONObject(new LinkedHashMap<>(json));
        Object metricType = fields.remove("metricType");
        SystemRule rule = fields.toJavaObject(SystemRule.class);
        rule.setMetricType(MetricType.from(metricType));
        return rule;
    }

    private String read() throws IOException {
        if (location == null) {
            throw new IOException("Rule location is not configured");
        }
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            if (resource.startsWith("/")) {
                resource = resource.substring(1);
            }
            ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
            try (InputStream in = classLoader.getResourceAsStream(resource)) {
                if (in == null) {
                    throw new IOException("Classpath resource not found: " + resource);
                }
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        }

        Path path = Paths.get(location);
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }
}

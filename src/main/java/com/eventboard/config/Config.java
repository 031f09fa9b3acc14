package com.eventboard.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * 模块说明：Config（class）。
 * 主要职责：承载 config 模块 的关键逻辑，对外提供可复用的调用入口。
 * 使用建议：修改该类型时应同步关注上下游调用，避免影响整体流程稳定性。
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

/**
 * 方法说明：load，负责加载配置或数据。
 * 处理流程：依次叠加 classpath 配置、工作目录配置，后者覆盖前者。
 * 维护提示：调整此方法时建议同步检查调用方、异常分支与日志输出。
 */
    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException ignored) {
            // Ignore broken classpath config and continue with defaults/local file.
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                System.err.println("WARN: failed to read config.properties: " + e.getMessage());
            }
        }

        return config;
    }

    /**
     * Config backed by defaults plus the given values, without touching the classpath or disk.
     */
    public static Config of(Path workingDir, Map<String, String> values) {
        Config config = new Config(workingDir);
        config.applyOverrides(values);
        return config;
    }

    /**
     * Applies {@code key=value} overrides (command line {@code -D} options) on top of every other layer.
     */
    public Config withOverrides(Map<String, String> values) {
        applyOverrides(values);
        return this;
    }

    private void applyOverrides(Map<String, String> values) {
        if (values == null) {
            return;
        }
        for (Map.Entry<String, String> entry : values.entrySet()) {
            String key = entry.getKey() == null ? "" : entry.getKey().trim();
            if (key.isEmpty()) {
                continue;
            }
            String value = entry.getValue() == null ? "" : entry.getValue();
            overrideProps.setProperty(key, value);
            props.setProperty(key, value);
        }
    }

    public Path workingDir() {
        return workingDir;
    }

/**
 * 方法说明：getString，负责获取数据并返回结果。
 * 处理流程：优先读取已加载的配置，空值时回退到内置默认值。
 * 维护提示：调整此方法时建议同步检查调用方、异常分支与日志输出。
 */
    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

/**
 * 方法说明：getBoolean，负责获取数据并返回结果。
 * 处理流程：接受 true/1/yes/y 作为真值。
 * 维护提示：调整此方法时建议同步检查调用方、异常分支与日志输出。
 */
    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key, int fallback) {
        String value = getString(key);
        return parseInt(value, fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

/**
 * 方法说明：getPath，负责获取数据并返回结果。
 * 处理流程：相对路径以工作目录为基准解析。
 * 维护提示：调整此方法时建议同步检查调用方、异常分支与日志输出。
 */
    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        String[] tokens = value.split("[,;]");
        for (String token : tokens) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    public Map<String, String> defaults() {
        return DEFAULTS;
    }

/**
 * 方法说明：resolve，负责解析规则并确定最终结果。
 * 处理流程：返回键的最终取值以及提供该值的配置层。
 * 维护提示：调整此方法时建议同步检查调用方、异常分支与日志输出。
 */
    public ResolvedValue resolve(String key) {
        return new ResolvedValue(
                key == null ? "" : key,
                getString(key),
                sourceOf(key)
        );
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        String local = nonBlank(overrideProps.getProperty(key));
        if (!local.isEmpty()) {
            return "override";
        }
        String resource = nonBlank(resourceProps.getProperty(key));
        if (!resource.isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        String t = raw.trim();
        return t.isEmpty() ? "" : t;
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new LinkedHashMap<>();

        defaults.put("api.base_url", "https://nseeventboard-production.up.railway.app");
        defaults.put("api.timeout_sec", "30");
        defaults.put("api.health_timeout_sec", "10");
        defaults.put("api.per_page", "1000");
        defaults.put("api.request_delay_ms", "500");
        defaults.put("api.user_agent", "EventBoard/1.0");

        defaults.put("outputs.dir", "fetched_data");

        defaults.put("fetch.proceed_without_ready_monitors", "false");
        defaults.put("fetch.proceed_when_probe_unavailable", "false");
        defaults.put("fetch.persist_partial", "true");
        defaults.put("fetch.endpoints", "event_calendar,announcements,crd,credit_rating");

        defaults.put("view.max_column_width", "40");
        defaults.put("view.preview_rows", "10");
        defaults.put("view.page_rows", "20");
        defaults.put("view.top_n", "15");

        defaults.put("export.dir", ".");

        return Collections.unmodifiableMap(defaults);
    }

    public static final class ResolvedValue {
        public final String key;
        public final String value;
        public final String source;

        public ResolvedValue(String key, String value, String source) {
            this.key = key == null ? "" : key;
            this.value = value == null ? "" : value;
            this.source = source == null ? "default" : source;
        }
    }
}

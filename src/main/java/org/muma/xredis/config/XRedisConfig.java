package org.muma.xredis.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

/**
 * 全局配置中心
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (xredis.properties) > 默认值
 */
@Getter
@Setter
public class XRedisConfig {

    private static final Logger log = LoggerFactory.getLogger(XRedisConfig.class);
    private static final XRedisConfig INSTANCE = new XRedisConfig(System.getenv());

    // --- Core Settings ---
    private int port = 6379;
    private int workerThreads = 0; // 0 = Netty default

    // --- Persistence (Snapshot) ---
    private String dir = ".";
    private String dbFilename = "xredis_dump.db";

    // 毫秒，超过即打 WARN
    private long slowlogThresholdMillis = 10;

    private String configFilePath = "xredis.properties";

    // 测试里可以换成假的环境变量
    private final Map<String, String> env;

    public XRedisConfig(Map<String, String> env) {
        this.env = env;
    }

    public static XRedisConfig getInstance() {
        return INSTANCE;
    }

    public Path snapshotFile() {
        return Path.of(dir).resolve(dbFilename);
    }

    // --- Loading Logic ---

    /**
     * 按优先级完整加载：先找 --config，再读文件和环境变量，最后用命令行参数覆盖
     */
    public void load(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                this.configFilePath = args[i + 1];
            }
        }
        loadConfig(configFilePath);
        parseArgs(args);
        log.info("XRedisConfig initialized: {}", this);
    }

    /**
     * @throws IllegalArgumentException 参数缺值或者端口不是数字
     */
    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            }
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for " + arg);
            }
            String value = args[++i];
            switch (arg) {
                case "--config" -> this.configFilePath = value;
                case "--port" -> this.port = parsePort(value, arg);
                case "--dir" -> this.dir = value;
                case "--dbfilename" -> this.dbFilename = value;
                default -> throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        // 1. Core
        this.port = getInt(props, "server.port", this.port);
        this.workerThreads = getInt(props, "server.worker_threads", this.workerThreads);

        // 2. Persistence
        this.dir = getString(props, "dir", this.dir);
        this.dbFilename = getString(props, "dbfilename", this.dbFilename);

        String slowlog = getString(props, "slowlog-log-slower-than", null);
        if (slowlog != null) {
            try {
                this.slowlogThresholdMillis = Long.parseLong(slowlog.trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid slowlog-log-slower-than value '{}', using default {}.", slowlog, slowlogThresholdMillis);
            }
        }

        // 3. Env Vars Override
        applyEnvOverrides();
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            // 如果是 classpath 资源
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
            } else {
                // 尝试作为文件系统路径加载
                try (InputStream fis = new FileInputStream(path)) {
                    props.load(fis);
                    log.info("Loaded config from file: {}", path);
                } catch (IOException e) {
                    log.warn("Config file not found: {}, using defaults.", path);
                }
            }
        } catch (IOException e) {
            log.error("Error loading config", e);
        }
        return props;
    }

    private void applyEnvOverrides() {
        String envPort = env.get("XREDIS_PORT");
        if (envPort != null) {
            this.port = parsePort(envPort, "XREDIS_PORT");
            log.info("Port overridden by ENV: {}", this.port);
        }

        String envDir = env.get("XREDIS_DIR");
        if (envDir != null) {
            this.dir = envDir;
            log.info("Snapshot dir overridden by ENV: {}", this.dir);
        }
    }

    private static int parsePort(String value, String source) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 0 || parsed > 65535) {
                throw new IllegalArgumentException("Port out of range in " + source + ": " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in " + source + ": " + value, e);
        }
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} value '{}', using default {}.", key, val, defaultValue);
            return defaultValue;
        }
    }

    private String getString(Properties props, String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    @Override
    public String toString() {
        return "Config{port=" + port + ", workers=" + workerThreads + ", snapshot=" + snapshotFile()
                + ", slowlog=" + slowlogThresholdMillis + "ms}";
    }
}

package org.mark.httprange.download;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * 分片下载的配置，可以从JSON文件加载。没有写的字段使用默认值。
 * <pre>
 * {
 *   "concurrency": 48,
 *   "chunkSize": 65536,
 *   "chunkTimeoutSeconds": 60,
 *   "userAgent": "httprange RangeDownloader"
 * }
 * </pre>
 */
public class DownloadConfig {

    private static final Logger logger = LoggerFactory.getLogger(DownloadConfig.class);

    public static final int DEFAULT_CONCURRENCY = 48;
    public static final long DEFAULT_CHUNK_TIMEOUT_SECONDS = 60;
    public static final String DEFAULT_USER_AGENT = "httprange RangeDownloader";

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    // 同时下载的分片数
    private int concurrency = DEFAULT_CONCURRENCY;
    private int chunkSize = ChunkPlanner.DEFAULT_CHUNK_SIZE;
    private long chunkTimeoutSeconds = DEFAULT_CHUNK_TIMEOUT_SECONDS;
    private String userAgent = DEFAULT_USER_AGENT;

    public DownloadConfig() {

    }

    public static DownloadConfig defaults() {
        return new DownloadConfig();
    }

    /**
     * 从JSON字符串解析配置
     * @param json
     * @return
     */
    public static DownloadConfig fromJson(String json) {
        DownloadConfig config;
        try {
            config = gson.fromJson(json, DownloadConfig.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("下载配置格式错误: " + e.getMessage(), e);
        }
        if (config == null) {
            config = new DownloadConfig();
        }
        config.validate();
        return config;
    }

    /**
     * 从文件加载配置，文件不存在时使用默认配置
     * @param file
     * @return
     * @throws IOException
     */
    public static DownloadConfig load(Path file) throws IOException {
        if (!Files.exists(file)) {
            logger.info("下载配置文件不存在，使用默认配置: {}", file);
            return defaults();
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            DownloadConfig config;
            try {
                config = gson.fromJson(reader, DownloadConfig.class);
            } catch (JsonParseException e) {
                throw new IOException("下载配置格式错误: " + file, e);
            }
            if (config == null) {
                config = new DownloadConfig();
            }
            config.validate();
            logger.info("成功加载下载配置: {} {}", file, config);
            return config;
        }
    }

    public String toJson() {
        return gson.toJson(this);
    }

    private void validate() {
        if (this.concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        if (this.chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be >= 1");
        }
        if (this.chunkTimeoutSeconds < 1) {
            throw new IllegalArgumentException("chunkTimeoutSeconds must be >= 1");
        }
        if (this.userAgent == null || this.userAgent.isBlank()) {
            this.userAgent = DEFAULT_USER_AGENT;
        }
    }

    public int getConcurrency() {
        return concurrency;
    }

    public DownloadConfig setConcurrency(int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        this.concurrency = concurrency;
        return this;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public DownloadConfig setChunkSize(int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be >= 1");
        }
        this.chunkSize = chunkSize;
        return this;
    }

    public Duration getChunkTimeout() {
        return Duration.ofSeconds(chunkTimeoutSeconds);
    }

    public long getChunkTimeoutSeconds() {
        return chunkTimeoutSeconds;
    }

    public DownloadConfig setChunkTimeoutSeconds(long chunkTimeoutSeconds) {
        if (chunkTimeoutSeconds < 1) {
            throw new IllegalArgumentException("chunkTimeoutSeconds must be >= 1");
        }
        this.chunkTimeoutSeconds = chunkTimeoutSeconds;
        return this;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public DownloadConfig setUserAgent(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            throw new IllegalArgumentException("userAgent must not be blank");
        }
        this.userAgent = userAgent;
        return this;
    }

    @Override
    public String toString() {
        return "DownloadConfig{" +
                "concurrency=" + concurrency +
                ", chunkSize=" + chunkSize +
                ", chunkTimeoutSeconds=" + chunkTimeoutSeconds +
                ", userAgent='" + userAgent + '\'' +
                '}';
    }
}

package com.corpussearch.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 引擎运行时配置
 *
 * 支持从CLI参数或JSON配置文件注入，覆盖Constants默认值
 */
public class EngineConfig {
    private List<String> fields = new ArrayList<>(Constants.DEFAULT_FIELDS);
    private boolean compressed;
    private int shingleWidth = Constants.DEFAULT_SHINGLE_WIDTH;
    private double matchThreshold = Constants.DEFAULT_MATCH_THRESHOLD;
    private int hitCount = Constants.DEFAULT_HIT_COUNT;
    private String staticQualityField = Constants.STATIC_QUALITY_FIELD;
    private double dynamicScoreWeight = Constants.DYNAMIC_SCORE_WEIGHT;
    private double staticScoreWeight = Constants.STATIC_SCORE_WEIGHT;

    public List<String> getFields() {
        return fields;
    }

    public void setFields(List<String> fields) {
        this.fields = fields == null ? new ArrayList<>() : new ArrayList<>(fields);
    }

    public boolean isCompressed() {
        return compressed;
    }

    public void setCompressed(boolean compressed) {
        this.compressed = compressed;
    }

    /**
     * shingle宽度，0表示按字母数字切分
     */
    public int getShingleWidth() {
        return shingleWidth;
    }

    public void setShingleWidth(int shingleWidth) {
        this.shingleWidth = shingleWidth;
    }

    public double getMatchThreshold() {
        return matchThreshold;
    }

    public void setMatchThreshold(double matchThreshold) {
        this.matchThreshold = matchThreshold;
    }

    public int getHitCount() {
        return hitCount;
    }

    public void setHitCount(int hitCount) {
        this.hitCount = hitCount;
    }

    public String getStaticQualityField() {
        return staticQualityField;
    }

    public void setStaticQualityField(String staticQualityField) {
        this.staticQualityField = staticQualityField;
    }

    public double getDynamicScoreWeight() {
        return dynamicScoreWeight;
    }

    public void setDynamicScoreWeight(double dynamicScoreWeight) {
        this.dynamicScoreWeight = dynamicScoreWeight;
    }

    public double getStaticScoreWeight() {
        return staticScoreWeight;
    }

    public void setStaticScoreWeight(double staticScoreWeight) {
        this.staticScoreWeight = staticScoreWeight;
    }

    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * 从JSON文件加载配置，未出现的键保持默认值，未知键视为错误。
     *
     * @param path 配置文件路径
     * @return 配置实例
     * @throws IOException 文件不可读或格式错误
     */
    public static EngineConfig load(Path path) throws IOException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IOException("配置文件不存在: " + path);
        }
        ObjectMapper mapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        try {
            return mapper.readValue(path.toFile(), EngineConfig.class);
        } catch (IOException exception) {
            throw new IOException("解析配置文件失败: " + path.getFileName() + " - " + exception.getMessage(), exception);
        }
    }
}

package com.ngramengine.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 引擎运行时配置
 * 
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class EngineConfig {
    private Path indexDir = Paths.get("./ngram-index");
    private int gramLength = Constants.DEFAULT_GRAM_LENGTH;
    private int queryLimit = Constants.DEFAULT_QUERY_LIMIT;
    private double weight = Constants.BALANCED_WEIGHT;
    
    public Path getIndexDir() {
        return indexDir;
    }
    
    public void setIndexDir(Path indexDir) {
        this.indexDir = indexDir;
    }
    
    public int getGramLength() {
        return gramLength;
    }
    
    public void setGramLength(int gramLength) {
        this.gramLength = gramLength;
    }
    
    public int getQueryLimit() {
        return queryLimit;
    }
    
    public void setQueryLimit(int queryLimit) {
        this.queryLimit = queryLimit;
    }
    
    public double getWeight() {
        return weight;
    }
    
    public void setWeight(double weight) {
        this.weight = weight;
    }
    
    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }
}

package com.gemflow.synth;

/**
 * 合成引擎配置
 */
public class SynthesisConfig {
    private boolean cacheEnabled = true;
    private long cacheMaximumSize = 50_000;
    private boolean failOnConflict = false;

    public SynthesisConfig() {
    }

    /** 默认配置：启用缓存，冲突时按规则顺序取第一个并记录警告 */
    public static SynthesisConfig defaults() {
        return new SynthesisConfig();
    }

    /** 严格配置：任何冲突都抛出 {@link SynthesisException} */
    public static SynthesisConfig strict() {
        SynthesisConfig config = new SynthesisConfig();
        config.setFailOnConflict(true);
        return config;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public void setCacheEnabled(boolean cacheEnabled) {
        this.cacheEnabled = cacheEnabled;
    }

    public long getCacheMaximumSize() {
        return cacheMaximumSize;
    }

    public void setCacheMaximumSize(long cacheMaximumSize) {
        if (cacheMaximumSize <= 0) {
            throw new IllegalArgumentException("cacheMaximumSize must be positive");
        }
        this.cacheMaximumSize = cacheMaximumSize;
    }

    public boolean isFailOnConflict() {
        return failOnConflict;
    }

    public void setFailOnConflict(boolean failOnConflict) {
        this.failOnConflict = failOnConflict;
    }
}

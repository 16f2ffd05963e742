package com.segmentengine.config;

/**
 * 配置非法时抛出：并行度、内存预算、目标段数等取值越界。
 *
 * <p>在作业启动前抛出，作业不会开始。
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * 校验非负整数配置项。
     *
     * @param name 配置名
     * @param value 配置值
     * @return 原值
     */
    public static int requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new ConfigurationException(name + " 必须为非负整数: " + value);
        }
        return value;
    }

    /**
     * 校验正整数配置项。
     *
     * @param name 配置名
     * @param value 配置值
     * @return 原值
     */
    public static int requirePositive(String name, int value) {
        if (value <= 0) {
            throw new ConfigurationException(name + " 必须为正整数: " + value);
        }
        return value;
    }
}

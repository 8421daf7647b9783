package com.metasearch.engine.selector;

/**
 * 一次成功提取：结果值与产生它的策略名。
 */
public record Extraction<T>(String extractorName, T value) {
}

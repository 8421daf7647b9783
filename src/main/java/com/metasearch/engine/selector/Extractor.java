package com.metasearch.engine.selector;

import java.util.Optional;

/**
 * 从半结构化 HTML 片段中提取单个字段的具名策略。
 * 
 * 当前实现基于正则；替换为 DOM/分词器实现时解析器的对外契约不变。
 */
public interface Extractor<T> {

    /**
     * 策略名，用于日志与回退链的诊断。
     */
    String name();

    /**
     * 提取字段；片段中不存在时返回空。
     */
    Optional<T> extract(String fragment);
}

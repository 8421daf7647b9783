package com.metasearch.filter;

/** 广告特征分类 */
public enum AdCategory {
    /** 广告平台域名 */
    AD_NETWORK,
    /** 特定搜索引擎的广告标记（跟踪点击路径、推广参数） */
    ENGINE_MARKER,
    /** 通用广告路径片段 */
    PATH_FRAGMENT
}

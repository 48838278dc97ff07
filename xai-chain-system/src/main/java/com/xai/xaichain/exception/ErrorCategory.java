package com.xai.xaichain.exception;

/**
 * 错误分类，决定处理方式：
 * VALIDATION 直接拒绝无副作用；CONSENSUS 拒绝并可对来源节点扣分；
 * RESOURCE 资源耗尽，拒绝最低优先级条目；REORG 拒绝重组保持当前链；STORAGE 持久化失败，进程级致命
 */
public enum ErrorCategory {
    VALIDATION,
    CONSENSUS,
    RESOURCE,
    REORG,
    STORAGE
}

package com.antigravity.gateway.pool;

import java.util.List;

/**
 * 账号选择策略接口
 * <p>
 * 实现只在账号池锁内被调用
 */
public interface SelectionStrategy {

    /**
     * 从可用账号列表中选择一个
     *
     * @param eligible  已按基础条件过滤的账号（启用、有效、未限流、未排除）
     * @param modelId   目标模型
     * @param sessionId 会话 ID，可能为 null
     * @param now       当前时间（毫秒）
     * @return 选中的账号，没有合适账号时返回 null
     */
    Account select(List<Account> eligible, String modelId, String sessionId, long now);
}

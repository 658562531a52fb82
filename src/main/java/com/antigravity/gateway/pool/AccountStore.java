package com.antigravity.gateway.pool;

import java.util.List;

/**
 * 账号持久化接口
 * <p>
 * 启动时读取，配额/订阅刷新与状态变更后异步写回
 */
public interface AccountStore {

    List<Account> loadAll();

    void save(Account account);

    void delete(String email);
}

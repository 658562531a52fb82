package com.antigravity.gateway.pool;

/**
 * 账号选择结果：选中的账号，或者需要等待的最短时间
 */
public record SelectionResult(Account account, long waitMs) {

    /**
     * 没有任何账号会在有限时间内恢复
     */
    public static final long NO_WAIT_POSSIBLE = Long.MAX_VALUE;

    public static SelectionResult of(Account account) {
        return new SelectionResult(account, 0);
    }

    public static SelectionResult waitFor(long waitMs) {
        return new SelectionResult(null, waitMs);
    }

    public static SelectionResult unavailable() {
        return new SelectionResult(null, NO_WAIT_POSSIBLE);
    }

    public boolean hasAccount() {
        return account != null;
    }

    public boolean canWait() {
        return account == null && waitMs > 0 && waitMs != NO_WAIT_POSSIBLE;
    }
}

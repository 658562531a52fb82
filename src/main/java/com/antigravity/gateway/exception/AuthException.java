package com.antigravity.gateway.exception;

import lombok.Getter;

/**
 * 认证异常
 * <p>
 * credentialRejected 表示凭证本身被拒绝（如 refresh token 失效），账号需标记为无效
 */
@Getter
public class AuthException extends GatewayException {

    private final boolean credentialRejected;
    private final boolean accountLevel;

    public AuthException(String message) {
        this(message, false, false, null);
    }

    public AuthException(String message, boolean credentialRejected) {
        this(message, credentialRejected, credentialRejected, null);
    }

    public AuthException(String message, boolean credentialRejected, Throwable cause) {
        this(message, credentialRejected, credentialRejected, cause);
    }

    private AuthException(String message, boolean credentialRejected, boolean accountLevel, Throwable cause) {
        super(ErrorKind.AUTH, message, 401, cause);
        this.credentialRejected = credentialRejected;
        this.accountLevel = accountLevel;
    }

    public AuthException escalate() {
        return new AuthException(getMessage(), credentialRejected, true, getCause());
    }
}

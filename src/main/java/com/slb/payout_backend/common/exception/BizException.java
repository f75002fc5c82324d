package com.slb.payout_backend.common.exception;

/**
 * 面向调用方的业务异常：code 与 HTTP 状态码保持一致。
 * <ul>
 *     <li>400 - 请求参数为空或格式错误</li>
 *     <li>404 - 目标记录不存在</li>
 *     <li>409 - 记录存在，但不满足当前操作的前置条件（不可分配 / 状态冲突）</li>
 * </ul>
 */
public class BizException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public static final int INVALID_INPUT = 400;
    public static final int NOT_FOUND = 404;
    public static final int CONFLICT = 409;

    private final int code;

    public BizException(String message) {
        super(message);
        this.code = INVALID_INPUT;
    }

    public BizException(int code, String message) {
        super(message);
        this.code = code;
    }

    public static BizException notFound(String message) {
        return new BizException(NOT_FOUND, message);
    }

    public static BizException conflict(String message) {
        return new BizException(CONFLICT, message);
    }

    public int getCode() {
        return code;
    }
}

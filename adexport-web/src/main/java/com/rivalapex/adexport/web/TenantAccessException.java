package com.rivalapex.adexport.web;

/**
 * 请求方发布者与资源所属发布者不一致。
 */
public class TenantAccessException extends RuntimeException {

    public TenantAccessException(String message) {
        super(message);
    }
}

package com.hhplus.storefront.domain.operator;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 운영자 전용 작업을 일반 사용자가 요청할 때 발생하는 예외
 */
public class UnauthorizedException extends DomainException {

    public UnauthorizedException(Long userId) {
        super(ErrorCode.UNAUTHORIZED, "User ID: " + userId);
    }
}

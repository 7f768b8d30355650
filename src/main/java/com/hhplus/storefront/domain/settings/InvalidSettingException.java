package com.hhplus.storefront.domain.settings;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

public class InvalidSettingException extends DomainException {

    public InvalidSettingException(String key, String detail) {
        super(ErrorCode.INVALID_SETTING, "key=" + key + ", " + detail);
    }
}

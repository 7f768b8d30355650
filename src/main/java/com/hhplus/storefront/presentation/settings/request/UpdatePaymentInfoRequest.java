package com.hhplus.storefront.presentation.settings.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 결제 안내 변경 요청 DTO
 * methods: 콤마 구분 문자열, text: 생략 시 기존 문구 유지
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdatePaymentInfoRequest {
    private String methods;
    private String text;
}

package com.hhplus.storefront.application.settings.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 결제 안내 정보 변경 커맨드
 * methods는 콤마 구분 문자열 (예: "KBZPay,WavePay,COD")
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdatePaymentInfoCommand {
    private String methods;
    private String text;
}

package com.hhplus.storefront.application.payment.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 결제 수단/거래 참조 제출 커맨드
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitPaymentCommand {
    private String method;
    private String reference;
}

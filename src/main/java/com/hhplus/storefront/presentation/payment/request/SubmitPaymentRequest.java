package com.hhplus.storefront.presentation.payment.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 결제 수단/거래 참조 제출 요청 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitPaymentRequest {
    private String method;
    private String reference;
}

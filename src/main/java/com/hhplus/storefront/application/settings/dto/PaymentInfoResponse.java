package com.hhplus.storefront.application.settings.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 결제 안내 정보
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentInfoResponse {
    private List<String> methods;
    private String text;
}

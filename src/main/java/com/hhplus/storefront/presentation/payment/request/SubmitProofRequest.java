package com.hhplus.storefront.presentation.payment.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 결제 사진 증빙 제출 요청 DTO (전송 계층의 파일 참조 ID)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitProofRequest {
    @JsonProperty("proof_reference")
    private String proofReference;
}

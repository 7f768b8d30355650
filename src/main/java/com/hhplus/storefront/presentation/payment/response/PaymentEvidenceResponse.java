package com.hhplus.storefront.presentation.payment.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentEvidenceResponse {
    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("payment_method")
    private String paymentMethod;

    @JsonProperty("payment_reference")
    private String paymentReference;

    @JsonProperty("payment_proof_reference")
    private String paymentProofReference;

    @JsonProperty("order_status")
    private String orderStatus;
}

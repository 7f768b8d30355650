package com.hhplus.storefront.presentation.payment.mapper;

import com.hhplus.storefront.application.payment.dto.SubmitPaymentCommand;
import com.hhplus.storefront.presentation.payment.request.SubmitPaymentRequest;
import com.hhplus.storefront.presentation.payment.response.PaymentEvidenceResponse;
import org.springframework.stereotype.Component;

@Component
public class PaymentMapper {

    public SubmitPaymentCommand toSubmitPaymentCommand(SubmitPaymentRequest request) {
        return SubmitPaymentCommand.builder()
                .method(request.getMethod())
                .reference(request.getReference())
                .build();
    }

    public PaymentEvidenceResponse toPaymentEvidenceResponse(
            com.hhplus.storefront.application.payment.dto.PaymentEvidenceResponse appResponse) {
        return PaymentEvidenceResponse.builder()
                .orderId(appResponse.getOrderId())
                .paymentMethod(appResponse.getPaymentMethod())
                .paymentReference(appResponse.getPaymentReference())
                .paymentProofReference(appResponse.getPaymentProofReference())
                .orderStatus(appResponse.getOrderStatus())
                .build();
    }
}

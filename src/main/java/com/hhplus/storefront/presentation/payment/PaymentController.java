package com.hhplus.storefront.presentation.payment;

import com.hhplus.storefront.application.payment.PaymentService;
import com.hhplus.storefront.presentation.payment.mapper.PaymentMapper;
import com.hhplus.storefront.presentation.payment.request.SubmitPaymentRequest;
import com.hhplus.storefront.presentation.payment.request.SubmitProofRequest;
import com.hhplus.storefront.presentation.payment.response.PaymentEvidenceResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * PaymentController - 결제 증빙 제출 API
 * 증빙 제출은 주문 상태를 바꾸지 않는다 (운영자 확인 대기).
 */
@RestController
@RequestMapping("/orders/{order_id}")
public class PaymentController {

    private final PaymentService paymentService;
    private final PaymentMapper paymentMapper;

    public PaymentController(PaymentService paymentService, PaymentMapper paymentMapper) {
        this.paymentService = paymentService;
        this.paymentMapper = paymentMapper;
    }

    /**
     * 결제 수단/거래 참조 제출 (POST /api/orders/{order_id}/payment)
     */
    @PostMapping("/payment")
    public ResponseEntity<PaymentEvidenceResponse> submitPayment(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("order_id") Long orderId,
            @RequestBody SubmitPaymentRequest request) {
        var appResponse = paymentService.submitPayment(orderId, userId, paymentMapper.toSubmitPaymentCommand(request));
        return ResponseEntity.ok(paymentMapper.toPaymentEvidenceResponse(appResponse));
    }

    /**
     * 결제 사진 증빙 제출 (POST /api/orders/{order_id}/payment-proof)
     */
    @PostMapping("/payment-proof")
    public ResponseEntity<PaymentEvidenceResponse> submitProof(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("order_id") Long orderId,
            @RequestBody SubmitProofRequest request) {
        var appResponse = paymentService.submitProof(orderId, userId, request.getProofReference());
        return ResponseEntity.ok(paymentMapper.toPaymentEvidenceResponse(appResponse));
    }
}

package com.hhplus.storefront.domain.order.event;

/**
 * 제출된 결제 증빙 종류
 */
public enum EvidenceType {
    /** 결제 수단 + 거래 참조 텍스트 */
    REFERENCE,
    /** 사진 증빙 */
    PROOF
}

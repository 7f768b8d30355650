package com.hhplus.storefront.domain.settings;

/**
 * 설정 키와 기본값
 */
public class SettingKeys {

    public static final String PAYMENT_METHODS = "payment_methods";
    public static final String PAYMENT_TEXT = "payment_text";

    public static final String DEFAULT_PAYMENT_METHODS = "KBZPay,WavePay,COD";
    public static final String DEFAULT_PAYMENT_TEXT =
            "결제 후 거래 번호 또는 결제 화면 사진을 주문 번호와 함께 보내주세요.";

    private SettingKeys() {
        throw new AssertionError("SettingKeys는 인스턴스화할 수 없습니다");
    }
}

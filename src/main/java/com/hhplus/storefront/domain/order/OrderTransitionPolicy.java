package com.hhplus.storefront.domain.order;

/**
 * 운영자 상태 변경 허용 규칙
 *
 * - PERMISSIVE: 종료 상태가 아니면 어떤 상태로도 변경 가능 (PACKING을 PAID 없이 바로 지정하거나
 *   SHIPPED에서 WAIT_PAYMENT로 되돌리는 것도 허용).
 * - FORWARD_ONLY: 진행 순서상 앞으로만 이동 가능하며, CANCELED는 어느 비종료 상태에서나 허용.
 *
 * 두 정책 모두 종료 상태(DONE, CANCELED)에서의 변경은 Order가 먼저 거부한다.
 */
public enum OrderTransitionPolicy {

    PERMISSIVE {
        @Override
        public boolean allows(OrderStatus from, OrderStatus to) {
            return true;
        }
    },

    FORWARD_ONLY {
        @Override
        public boolean allows(OrderStatus from, OrderStatus to) {
            if (to == OrderStatus.CANCELED) {
                return true;
            }
            return to.getStep() > from.getStep();
        }
    };

    public abstract boolean allows(OrderStatus from, OrderStatus to);
}

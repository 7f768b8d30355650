package com.hhplus.storefront.presentation.order;

import com.hhplus.storefront.application.order.OrderService;
import com.hhplus.storefront.application.order.dto.CheckoutCommand;
import com.hhplus.storefront.application.order.dto.CheckoutResponse;
import com.hhplus.storefront.common.exception.ErrorCode;
import com.hhplus.storefront.common.exception.SystemException;
import com.hhplus.storefront.domain.order.InvalidCheckoutDetailsException;
import com.hhplus.storefront.domain.order.NotOrderOwnerException;
import com.hhplus.storefront.presentation.common.GlobalExceptionHandler;
import com.hhplus.storefront.presentation.order.mapper.OrderMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OrderController 테스트")
class OrderControllerTest {

    private static final String CHECKOUT_BODY =
            "{\"customer_name\":\"Aung\",\"phone\":\"0912345678\",\"address\":\"Yangon\",\"note\":\"-\"}";

    @Mock
    private OrderService orderService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new OrderController(orderService, new OrderMapper()))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    // ========== 체크아웃 (POST /orders) ==========

    @Test
    @DisplayName("체크아웃 - 주문 생성 시 201, note \"-\"는 빈 메모")
    void testCheckout_Created() throws Exception {
        when(orderService.checkout(eq(100L), any(CheckoutCommand.class))).thenReturn(CheckoutResponse.builder()
                .orderId(7L).placed(true).totalAmount(2500L).itemCount(2).orderStatus("WAIT_PAYMENT").build());

        mockMvc.perform(post("/orders")
                        .header("X-USER-ID", "100")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHECKOUT_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.order_id").value(7))
                .andExpect(jsonPath("$.total_amount").value(2500));

        ArgumentCaptor<CheckoutCommand> captor = ArgumentCaptor.forClass(CheckoutCommand.class);
        verify(orderService).checkout(eq(100L), captor.capture());
        assertEquals("Aung", captor.getValue().getCustomerName());
        assertEquals("", captor.getValue().getNote());
    }

    @Test
    @DisplayName("체크아웃 - 빈 장바구니는 200, order_id 0")
    void testCheckout_EmptyCart() throws Exception {
        when(orderService.checkout(eq(100L), any(CheckoutCommand.class))).thenReturn(CheckoutResponse.emptyCart());

        mockMvc.perform(post("/orders")
                        .header("X-USER-ID", "100")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHECKOUT_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.order_id").value(0))
                .andExpect(jsonPath("$.placed").value(false));
    }

    @Test
    @DisplayName("체크아웃 - 주문자 정보 오류는 400")
    void testCheckout_InvalidDetails() throws Exception {
        when(orderService.checkout(eq(100L), any(CheckoutCommand.class)))
                .thenThrow(new InvalidCheckoutDetailsException("phone"));

        mockMvc.perform(post("/orders")
                        .header("X-USER-ID", "100")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHECKOUT_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_ORDER_INVALID_CHECKOUT_DETAILS"));
    }

    @Test
    @DisplayName("체크아웃 - 저장소 장애는 503")
    void testCheckout_StoreUnavailable() throws Exception {
        when(orderService.checkout(eq(100L), any(CheckoutCommand.class)))
                .thenThrow(new SystemException(ErrorCode.STORE_UNAVAILABLE));

        mockMvc.perform(post("/orders")
                        .header("X-USER-ID", "100")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHECKOUT_BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error_code").value("SYSTEM_STORE_UNAVAILABLE"));
    }

    @Test
    @DisplayName("잘못된 JSON 본문은 400")
    void testCheckout_MalformedBody() throws Exception {
        mockMvc.perform(post("/orders")
                        .header("X-USER-ID", "100")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not-json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_REQUEST"));
        verifyNoInteractions(orderService);
    }

    // ========== 주문 상세 (GET /orders/{order_id}) ==========

    @Test
    @DisplayName("주문 상세 - 타인의 주문은 403")
    void testGetMyOrderDetail_NotOwner() throws Exception {
        when(orderService.getMyOrderDetail(100L, 1L)).thenThrow(new NotOrderOwnerException(1L, 100L));

        mockMvc.perform(get("/orders/1").header("X-USER-ID", "100"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_ORDER_NOT_OWNER"));
    }

    @Test
    @DisplayName("주문 상세 - 숫자가 아닌 주문 ID는 400")
    void testGetMyOrderDetail_InvalidPath() throws Exception {
        mockMvc.perform(get("/orders/abc").header("X-USER-ID", "100"))
                .andExpect(status().isBadRequest());
    }
}

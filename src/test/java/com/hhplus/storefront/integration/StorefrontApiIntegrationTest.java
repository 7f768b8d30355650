package com.hhplus.storefront.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Duration;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * /api 전체 흐름 통합 테스트
 * 상품 등록 → 장바구니 → 체크아웃 → 결제 증빙 → 운영자 상태 변경
 */
@AutoConfigureMockMvc
@DisplayName("Storefront API 통합 테스트")
class StorefrontApiIntegrationTest extends BaseIntegrationTest {

    private static final String CUSTOMER_ID = "100";
    private static final String OPERATOR = String.valueOf(OPERATOR_ID);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private JsonNode body(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    @DisplayName("전체 흐름 - 상품 등록부터 포장 중 알림까지")
    void testFullFlow() throws Exception {
        // 상품 등록 (운영자)
        MvcResult created = mockMvc.perform(post("/api/admin/products")
                        .header("X-USER-ID", OPERATOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Longyi\",\"price\":15000,\"description\":\"cotton\"}"))
                .andExpect(status().isCreated())
                .andReturn();
        long productId = body(created).get("product_id").asLong();

        // 장바구니 담기
        mockMvc.perform(post("/api/carts/items")
                        .header("X-USER-ID", CUSTOMER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"product_id\":" + productId + ",\"quantity\":2}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.subtotal").value(30000));

        // 체크아웃
        MvcResult checkout = mockMvc.perform(post("/api/orders")
                        .header("X-USER-ID", CUSTOMER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customer_name\":\"Aung\",\"phone\":\"09 1234 5678\",\"address\":\"Yangon\",\"note\":\"-\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.placed").value(true))
                .andExpect(jsonPath("$.total_amount").value(30000))
                .andReturn();
        long orderId = body(checkout).get("order_id").asLong();

        mockMvc.perform(get("/api/carts").header("X-USER-ID", CUSTOMER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items").isEmpty());

        // 결제 정보 제출
        mockMvc.perform(post("/api/orders/" + orderId + "/payment")
                        .header("X-USER-ID", CUSTOMER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"method\":\"KBZPay\",\"reference\":\"TX-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.order_status").value("WAIT_PAYMENT"));

        // 운영자 상태 변경
        mockMvc.perform(patch("/api/admin/orders/" + orderId + "/status")
                        .header("X-USER-ID", OPERATOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"packing\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.old_status").value("WAIT_PAYMENT"))
                .andExpect(jsonPath("$.new_status").value("PACKING"));

        mockMvc.perform(get("/api/orders/" + orderId).header("X-USER-ID", CUSTOMER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.order_status").value("PACKING"))
                .andExpect(jsonPath("$.note").value(""))
                .andExpect(jsonPath("$.payment_method").value("KBZPay"));

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                verify(notifier).notify(eq(100L), contains("#" + orderId)));
    }

    @Test
    @DisplayName("빈 장바구니 체크아웃 - 200, order_id 0")
    void testCheckout_EmptyCart() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .header("X-USER-ID", CUSTOMER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customer_name\":\"Aung\",\"phone\":\"0912345678\",\"address\":\"Yangon\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.order_id").value(0))
                .andExpect(jsonPath("$.placed").value(false));
    }

    @Test
    @DisplayName("결제 안내 - 기본값 조회 후 운영자 변경")
    void testPaymentInfo() throws Exception {
        mockMvc.perform(get("/api/payment-info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.methods.length()").value(3));

        mockMvc.perform(put("/api/admin/payment-info")
                        .header("X-USER-ID", CUSTOMER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"methods\":\"COD\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_OPERATOR_UNAUTHORIZED"));

        mockMvc.perform(put("/api/admin/payment-info")
                        .header("X-USER-ID", OPERATOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"methods\":\"KBZPay, COD\",\"text\":\"송금 후 영수증을 보내주세요\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/payment-info"))
                .andExpect(jsonPath("$.methods[1]").value("COD"))
                .andExpect(jsonPath("$.text").value("송금 후 영수증을 보내주세요"));
    }

    @Test
    @DisplayName("판매 중지 상품 - 목록에서 제외, 담기 400")
    void testDeactivatedProduct() throws Exception {
        Long productId = createProduct("Sandal", 5000L);

        mockMvc.perform(delete("/api/admin/products/" + productId).header("X-USER-ID", OPERATOR))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/products"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
        mockMvc.perform(post("/api/carts/items")
                        .header("X-USER-ID", CUSTOMER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"product_id\":" + productId + "}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_PRODUCT_UNAVAILABLE"));
    }
}

package com.freshcart.storefront.presentation.delivery;

import com.freshcart.storefront.application.delivery.DeliveryAvailabilityService;
import com.freshcart.storefront.common.exception.ValidationException;
import com.freshcart.storefront.presentation.common.GlobalExceptionHandler;
import com.freshcart.storefront.presentation.delivery.response.DeliveryAvailabilityResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DeliveryController 단위 테스트")
class DeliveryControllerTest {

    private MockMvc mockMvc;

    @Mock
    private DeliveryAvailabilityService deliveryAvailabilityService;

    @InjectMocks
    private DeliveryController deliveryController;

    @BeforeEach
    void setup() {
        this.mockMvc = MockMvcBuilders.standaloneSetup(deliveryController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("우편번호 확인 - 배송 가능")
    void testCheckPincode_Available() throws Exception {
        when(deliveryAvailabilityService.check("560001")).thenReturn(DeliveryAvailabilityResponse.builder()
                .available(true)
                .pincode("560001")
                .message("560001 지역으로 배송 가능합니다")
                .build());

        mockMvc.perform(get("/check-pincode/").param("pincode", "560001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.available").value(true))
                .andExpect(jsonPath("$.pincode").value("560001"));
    }

    @Test
    @DisplayName("우편번호 확인 - 형식 오류 400")
    void testCheckPincode_Invalid() throws Exception {
        when(deliveryAvailabilityService.check("12ab"))
                .thenThrow(new ValidationException("pincode", "6자리 숫자 우편번호를 입력해 주세요"));

        mockMvc.perform(get("/check-pincode/").param("pincode", "12ab"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.pincode").value("6자리 숫자 우편번호를 입력해 주세요"));
    }

    @Test
    @DisplayName("우편번호 저장 - 세션에 정규화된 값 보관")
    void testSetDeliveryPincode_StoresInSession() throws Exception {
        // Given
        MockHttpSession session = new MockHttpSession();
        when(deliveryAvailabilityService.check(" 560034 ")).thenReturn(DeliveryAvailabilityResponse.builder()
                .available(false)
                .pincode("560034")
                .message("560034 지역은 아직 배송하지 않습니다")
                .build());

        // When
        mockMvc.perform(post("/set-delivery-pincode/")
                        .session(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pincode\":\" 560034 \"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.available").value(false));

        // Then
        assertEquals("560034", session.getAttribute(DeliveryAvailabilityService.SESSION_PINCODE_KEY));
    }

    @Test
    @DisplayName("우편번호 저장 - 형식 오류면 세션 변경 없음")
    void testSetDeliveryPincode_Invalid() throws Exception {
        MockHttpSession session = new MockHttpSession();
        when(deliveryAvailabilityService.check("5600"))
                .thenThrow(new ValidationException("pincode", "6자리 숫자 우편번호를 입력해 주세요"));

        mockMvc.perform(post("/set-delivery-pincode/")
                        .session(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pincode\":\"5600\"}"))
                .andExpect(status().isBadRequest());

        assertNull(session.getAttribute(DeliveryAvailabilityService.SESSION_PINCODE_KEY));
    }
}

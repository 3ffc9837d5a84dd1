package com.tradecontrol.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tradecontrol.api.controller.RiskController;
import com.tradecontrol.config.ApiResponseAdvice;
import com.tradecontrol.domain.model.ExposureSnapshot;
import com.tradecontrol.exception.GlobalExceptionHandler;
import com.tradecontrol.ledger.PositionLedger;
import com.tradecontrol.risk.EquityWatermark;
import com.tradecontrol.risk.RiskProfileHolder;
import com.tradecontrol.support.TestFixtures;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the RiskController against a real profile holder, so merge
 * validation runs exactly as in production.
 */
@ExtendWith(MockitoExtension.class)
class RiskControllerTest {

    private MockMvc mockMvc;

    @Mock
    private PositionLedger positionLedger;

    private RiskProfileHolder riskProfileHolder;
    private EquityWatermark equityWatermark;

    @BeforeEach
    void setUp() {
        riskProfileHolder = new RiskProfileHolder(TestFixtures.defaultProfile());
        equityWatermark = new EquityWatermark();

        RiskController controller = new RiskController(riskProfileHolder, positionLedger, equityWatermark);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("GET /api/risk/profile returns the active profile")
    void getProfile() throws Exception {
        mockMvc.perform(get("/api/risk/profile"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.riskFractionPerTrade").value(0.01))
                .andExpect(jsonPath("$.data.maxPositions").value(3))
                .andExpect(jsonPath("$.data.maxTradeAmount").value(1000));
    }

    @Test
    @DisplayName("PUT /api/risk/profile applies only the supplied fields")
    void partialUpdate() throws Exception {
        mockMvc.perform(put("/api/risk/profile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "maxPositions": 5 }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.maxPositions").value(5))
                .andExpect(jsonPath("$.data.riskFractionPerTrade").value(0.01));

        assertThat(riskProfileHolder.current().getMaxPositions()).isEqualTo(5);
    }

    @Test
    @DisplayName("PUT /api/risk/profile rejects a field-level constraint violation")
    void fieldConstraintViolation() throws Exception {
        mockMvc.perform(put("/api/risk/profile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "maxPositions": 0 }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.maxPositions").value("Max positions must be at least 1"));

        assertThat(riskProfileHolder.current().getMaxPositions()).isEqualTo(3);
    }

    @Test
    @DisplayName("PUT /api/risk/profile rejects a merge that is inconsistent as a whole")
    void inconsistentMerge() throws Exception {
        mockMvc.perform(put("/api/risk/profile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "minTradeAmount": 2000 }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.minTradeAmount").value("must not exceed maxTradeAmount"));

        assertThat(riskProfileHolder.current().getMinTradeAmount()).isEqualByComparingTo("50");
    }

    @Test
    @DisplayName("GET /api/risk/exposure combines ledger exposure with the profile and watermark")
    void exposure() throws Exception {
        equityWatermark.observe(new BigDecimal("12500"));
        when(positionLedger.exposure()).thenReturn(new ExposureSnapshot(2, new BigDecimal("1800")));
        when(positionLedger.unrealizedPnl()).thenReturn(new BigDecimal("-35.5"));

        mockMvc.perform(get("/api/risk/exposure"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.openPositionCount").value(2))
                .andExpect(jsonPath("$.data.maxPositions").value(3))
                .andExpect(jsonPath("$.data.openNotional").value(1800))
                .andExpect(jsonPath("$.data.unrealizedPnl").value(-35.5))
                .andExpect(jsonPath("$.data.peakEquity").value(12500));
    }
}

package com.tradecontrol.api.controller;

import com.tradecontrol.api.dto.request.RiskProfileUpdateRequest;
import com.tradecontrol.domain.model.ExposureSnapshot;
import com.tradecontrol.domain.model.RiskProfile;
import com.tradecontrol.ledger.PositionLedger;
import com.tradecontrol.risk.EquityWatermark;
import com.tradecontrol.risk.RiskProfileHolder;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the risk profile and current exposure.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/risk/profile -- active risk profile</li>
 *   <li>PUT /api/risk/profile -- partial update; the merged profile replaces the active one</li>
 *   <li>GET /api/risk/exposure -- open positions, open notional and peak equity</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/risk")
public class RiskController {

    private static final Logger log = LoggerFactory.getLogger(RiskController.class);

    private final RiskProfileHolder riskProfileHolder;
    private final PositionLedger positionLedger;
    private final EquityWatermark equityWatermark;

    public RiskController(
            RiskProfileHolder riskProfileHolder, PositionLedger positionLedger, EquityWatermark equityWatermark) {
        this.riskProfileHolder = riskProfileHolder;
        this.positionLedger = positionLedger;
        this.equityWatermark = equityWatermark;
    }

    @GetMapping("/profile")
    public ResponseEntity<RiskProfile> getProfile() {
        return ResponseEntity.ok(riskProfileHolder.current());
    }

    /** Only non-null fields in the request body are applied. */
    @PutMapping("/profile")
    public ResponseEntity<RiskProfile> updateProfile(@Valid @RequestBody RiskProfileUpdateRequest request) {
        RiskProfile updated = riskProfileHolder.update(current -> merge(current, request));
        log.info("Risk profile updated via API: {}", updated);
        return ResponseEntity.ok(updated);
    }

    @GetMapping("/exposure")
    public ResponseEntity<Map<String, Object>> getExposure() {
        ExposureSnapshot exposure = positionLedger.exposure();
        RiskProfile profile = riskProfileHolder.current();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("openPositionCount", exposure.getOpenPositionCount());
        body.put("maxPositions", profile.getMaxPositions());
        body.put("openNotional", exposure.getOpenNotional());
        body.put("unrealizedPnl", positionLedger.unrealizedPnl());
        body.put("peakEquity", equityWatermark.getPeak());
        return ResponseEntity.ok(body);
    }

    private static RiskProfile merge(RiskProfile current, RiskProfileUpdateRequest request) {
        RiskProfile.RiskProfileBuilder builder = current.toBuilder();
        if (request.getRiskFractionPerTrade() != null) {
            builder.riskFractionPerTrade(request.getRiskFractionPerTrade());
        }
        if (request.getMaxDailyLoss() != null) {
            builder.maxDailyLoss(request.getMaxDailyLoss());
        }
        if (request.getMaxTotalRisk() != null) {
            builder.maxTotalRisk(request.getMaxTotalRisk());
        }
        if (request.getEmergencyStopLoss() != null) {
            builder.emergencyStopLoss(request.getEmergencyStopLoss());
        }
        if (request.getMaxPositions() != null) {
            builder.maxPositions(request.getMaxPositions());
        }
        if (request.getMinTradeAmount() != null) {
            builder.minTradeAmount(request.getMinTradeAmount());
        }
        if (request.getMaxTradeAmount() != null) {
            builder.maxTradeAmount(request.getMaxTradeAmount());
        }
        if (request.getMinAccountBalance() != null) {
            builder.minAccountBalance(request.getMinAccountBalance());
        }
        return builder.build();
    }
}

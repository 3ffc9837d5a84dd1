package com.tradecontrol.api.controller;

import com.tradecontrol.api.dto.response.PositionResponse;
import com.tradecontrol.api.mapper.PositionResponseMapper;
import com.tradecontrol.exception.ResourceNotFoundException;
import com.tradecontrol.ledger.PositionLedger;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Read-only view of the ledger's active (OPEN or CLOSING) positions. */
@RestController
@RequestMapping("/api/positions")
public class PositionController {

    private static final PositionResponseMapper MAPPER = Mappers.getMapper(PositionResponseMapper.class);

    private final PositionLedger positionLedger;

    public PositionController(PositionLedger positionLedger) {
        this.positionLedger = positionLedger;
    }

    @GetMapping
    public ResponseEntity<List<PositionResponse>> getPositions() {
        return ResponseEntity.ok(MAPPER.toResponseList(positionLedger.activePositions()));
    }

    @GetMapping("/{symbol}")
    public ResponseEntity<PositionResponse> getPosition(@PathVariable String symbol) {
        return positionLedger
                .activePosition(symbol)
                .map(MAPPER::toResponse)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Position", symbol));
    }
}

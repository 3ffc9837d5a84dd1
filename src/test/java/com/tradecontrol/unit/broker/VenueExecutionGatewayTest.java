package com.tradecontrol.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.when;

import com.tradecontrol.broker.ExecutionResult;
import com.tradecontrol.broker.OrderRequest;
import com.tradecontrol.broker.VenueClient;
import com.tradecontrol.broker.VenueExecutionGateway;
import com.tradecontrol.broker.VenueResponseNormalizer;
import com.tradecontrol.config.EngineProperties;
import com.tradecontrol.domain.enums.ExecutionStatus;
import com.tradecontrol.domain.enums.OrderSide;
import com.tradecontrol.exception.ConnectivityException;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for VenueExecutionGateway outcome mapping.
 */
@ExtendWith(MockitoExtension.class)
class VenueExecutionGatewayTest {

    private static final Executor DIRECT = Runnable::run;

    /** Accepts work and never runs it, so every call times out. */
    private static final Executor BLACK_HOLE = command -> { };

    @Mock
    private VenueClient venueClient;

    private EngineProperties properties;

    private final OrderRequest request = OrderRequest.builder()
            .clientOrderId("C-1")
            .symbol("BTCUSD")
            .side(OrderSide.SELL)
            .quantity(new BigDecimal("2"))
            .referencePrice(new BigDecimal("100"))
            .build();

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        properties.setGatewayTimeout(Duration.ofMillis(50));
    }

    private VenueExecutionGateway gateway(Executor executor) {
        return new VenueExecutionGateway(venueClient, new VenueResponseNormalizer(), executor, properties);
    }

    @Nested
    @DisplayName("submit")
    class Submit {

        @Test
        @DisplayName("Sends the venue payload and normalizes the fill")
        @SuppressWarnings("unchecked")
        void fill() {
            when(venueClient.placeOrder(anyMap()))
                    .thenReturn(Map.of("txid", List.of("T-1"), "status", "closed", "vol_exec", "2", "price", "99"));

            ExecutionResult result = gateway(DIRECT).submit(request);

            assertThat(result.getStatus()).isEqualTo(ExecutionStatus.FILLED);
            assertThat(result.getOrderId()).isEqualTo("T-1");

            ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
            Mockito.verify(venueClient).placeOrder(payload.capture());
            assertThat(payload.getValue())
                    .containsEntry("client_order_id", "C-1")
                    .containsEntry("side", "SELL")
                    .containsEntry("order_type", "MARKET")
                    .doesNotContainKey("limit_price");
        }

        @Test
        @DisplayName("Timeout is INDETERMINATE, never REJECTED")
        void timeout() {
            ExecutionResult result = gateway(BLACK_HOLE).submit(request);

            assertThat(result.getStatus()).isEqualTo(ExecutionStatus.INDETERMINATE);
            assertThat(result.getError()).isEqualTo("Submission timed out");
            assertThat(result.getClientOrderId()).isEqualTo("C-1");
        }

        @Test
        @DisplayName("Connectivity failure is REJECTED because the order never left")
        void connectivity() {
            when(venueClient.placeOrder(anyMap())).thenThrow(new ConnectivityException("connection refused"));

            ExecutionResult result = gateway(DIRECT).submit(request);

            assertThat(result.getStatus()).isEqualTo(ExecutionStatus.REJECTED);
            assertThat(result.getError()).isEqualTo("Venue unreachable: connection refused");
        }

        @Test
        @DisplayName("Any other exception leaves the outcome INDETERMINATE")
        void unknownFailure() {
            when(venueClient.placeOrder(anyMap())).thenThrow(new IllegalStateException("socket reset mid-response"));

            ExecutionResult result = gateway(DIRECT).submit(request);

            assertThat(result.getStatus()).isEqualTo(ExecutionStatus.INDETERMINATE);
            assertThat(result.getError()).isEqualTo("socket reset mid-response");
        }
    }

    @Nested
    @DisplayName("queryStatus")
    class QueryStatus {

        @Test
        @DisplayName("Keeps the known order id when the response has none")
        void keepsOrderId() {
            when(venueClient.orderStatus("C-1", "O-7")).thenReturn(Map.of("status", "open"));

            ExecutionResult result = gateway(DIRECT).queryStatus(request, "O-7");

            assertThat(result.getStatus()).isEqualTo(ExecutionStatus.PENDING);
            assertThat(result.getOrderId()).isEqualTo("O-7");
        }

        @Test
        @DisplayName("Transport failure during a status query is INDETERMINATE")
        void transportFailure() {
            when(venueClient.orderStatus(any(), any())).thenThrow(new ConnectivityException("down"));

            ExecutionResult result = gateway(DIRECT).queryStatus(request, null);

            assertThat(result.getStatus()).isEqualTo(ExecutionStatus.INDETERMINATE);
        }

        @Test
        @DisplayName("Status query timeout is INDETERMINATE")
        void timeout() {
            ExecutionResult result = gateway(BLACK_HOLE).queryStatus(request, "O-7");

            assertThat(result.getStatus()).isEqualTo(ExecutionStatus.INDETERMINATE);
            assertThat(result.getError()).isEqualTo("Status query timed out");
            assertThat(result.getOrderId()).isEqualTo("O-7");
        }
    }
}

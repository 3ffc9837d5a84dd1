package com.tradecontrol.unit.signal;

import static com.tradecontrol.support.TestFixtures.buy;
import static org.assertj.core.api.Assertions.assertThat;

import com.tradecontrol.config.EngineProperties;
import com.tradecontrol.domain.model.Signal;
import com.tradecontrol.signal.SignalInbox;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SignalInboxTest {

    private SignalInbox inbox;

    @BeforeEach
    void setUp() {
        EngineProperties properties = new EngineProperties();
        properties.setSignalInboxCapacity(2);
        inbox = new SignalInbox(properties);
    }

    @Test
    @DisplayName("Closed inbox refuses signals")
    void closedRefuses() {
        assertThat(inbox.offer(buy("BTCUSD", "100"))).isFalse();
        assertThat(inbox.size()).isZero();
    }

    @Test
    @DisplayName("Full inbox refuses new signals and keeps the queued ones")
    void fullRefusesNewest() {
        inbox.open();
        Signal first = buy("BTCUSD", "100");
        Signal second = buy("ETHUSD", "50");

        assertThat(inbox.offer(first)).isTrue();
        assertThat(inbox.offer(second)).isTrue();
        assertThat(inbox.offer(buy("SOLUSD", "20"))).isFalse();

        assertThat(inbox.drain()).containsExactly(first, second);
        assertThat(inbox.size()).isZero();
    }

    @Test
    @DisplayName("Closing keeps queued signals; clear removes them")
    void closeKeepsClearRemoves() {
        inbox.open();
        inbox.offer(buy("BTCUSD", "100"));

        inbox.close();
        assertThat(inbox.isAccepting()).isFalse();
        assertThat(inbox.size()).isEqualTo(1);

        inbox.clear();
        assertThat(inbox.drain()).isEmpty();
    }
}

package io.github.drompincen.clawtrigger.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TriggerTypeTest {

    @Test
    void fromWireAcceptsWireNamesAndEnumNames() {
        assertThat(TriggerType.fromWire("cron")).isEqualTo(TriggerType.CRON);
        assertThat(TriggerType.fromWire("one_time")).isEqualTo(TriggerType.ONE_TIME);
        assertThat(TriggerType.fromWire("INTERVAL")).isEqualTo(TriggerType.INTERVAL);
        assertThat(TriggerType.fromWire(" event ")).isEqualTo(TriggerType.EVENT);
    }

    @Test
    void dateIsAliasForOneTime() {
        assertThat(TriggerType.fromWire("date")).isEqualTo(TriggerType.ONE_TIME);
    }

    @Test
    void unknownTypeIsRejected() {
        assertThatThrownBy(() -> TriggerType.fromWire("hourly"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("hourly");
    }
}

package com.dealerscout.core.strategy;

import com.dealerscout.core.api.StrategyDescriptor;
import com.dealerscout.core.model.Tier;
import com.dealerscout.core.rules.RuleStore;
import com.dealerscout.core.strategy.fallback.LlmExtractionStrategy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StrategyCatalogTest {

    @Test
    void default_order_without_llm() {
        StrategyRegistry reg = StrategyCatalog.defaults(RuleStore.EMPTY);

        assertThat(reg.strategies()).extracting(StrategyDescriptor::name).containsExactly(
                "Lithia Motors", "Dealer.com Locations", "AutoCanada",
                "Learned Rule", "JSON-LD", "Script Variables", "Microformat Cards",
                "Heading Address Blocks");
        assertThat(reg.find(LlmExtractionStrategy.NAME)).isEmpty();
    }

    @Test
    void llm_is_registered_last_when_client_exists() {
        StrategyRegistry reg = StrategyCatalog.defaults(null, (system, user) -> "[]");

        assertThat(reg.strategies(Tier.FALLBACK)).extracting(StrategyDescriptor::name)
                .containsExactly("Heading Address Blocks", LlmExtractionStrategy.NAME);
    }
}

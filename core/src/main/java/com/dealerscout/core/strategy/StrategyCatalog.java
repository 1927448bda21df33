package com.dealerscout.core.strategy;

import com.dealerscout.core.llm.LlmClient;
import com.dealerscout.core.rules.RuleStore;
import com.dealerscout.core.strategy.fallback.HeadingAddressStrategy;
import com.dealerscout.core.strategy.fallback.LlmExtractionStrategy;
import com.dealerscout.core.strategy.generic.JsonLdStrategy;
import com.dealerscout.core.strategy.generic.LearnedRuleStrategy;
import com.dealerscout.core.strategy.generic.MicroformatCardStrategy;
import com.dealerscout.core.strategy.generic.ScriptVariableStrategy;
import com.dealerscout.core.strategy.specific.AutoCanadaStrategy;
import com.dealerscout.core.strategy.specific.DealerDotComLocationsStrategy;
import com.dealerscout.core.strategy.specific.LithiaStrategy;

/**
 * 기본 전략 구성. 등록 순서 = 같은 등급 안의 우선순위.
 * 프로세스 시작 시 한 번 만들어 파이프라인에 주입한다.
 */
public final class StrategyCatalog {
    private StrategyCatalog() {}

    public static final int DEFAULT_LLM_MAX_HTML_CHARS = 60_000;

    /** LLM 없이 */
    public static StrategyRegistry defaults(RuleStore ruleStore) {
        return defaults(ruleStore, null, DEFAULT_LLM_MAX_HTML_CHARS);
    }

    public static StrategyRegistry defaults(RuleStore ruleStore, LlmClient llmClient) {
        return defaults(ruleStore, llmClient, DEFAULT_LLM_MAX_HTML_CHARS);
    }

    /**
     * @param ruleStore null이면 {@link RuleStore#EMPTY}
     * @param llmClient null이면 LLM 전략을 등록하지 않는다
     */
    public static StrategyRegistry defaults(RuleStore ruleStore, LlmClient llmClient, int llmMaxHtmlChars) {
        StrategyRegistry.Builder b = StrategyRegistry.builder()
                // SPECIFIC
                .register(new LithiaStrategy())
                .register(new DealerDotComLocationsStrategy())
                .register(new AutoCanadaStrategy())
                // GENERIC
                .register(new LearnedRuleStrategy(ruleStore != null ? ruleStore : RuleStore.EMPTY))
                .register(new JsonLdStrategy())
                .register(new ScriptVariableStrategy())
                .register(new MicroformatCardStrategy())
                // FALLBACK
                .register(new HeadingAddressStrategy());
        if (llmClient != null) {
            b.register(new LlmExtractionStrategy(llmClient, llmMaxHtmlChars));
        }
        return b.build();
    }
}

package com.dealerscout.core.rules;

import java.util.List;

/** 학습 규칙 읽기 전용 저장소 */
public interface RuleStore {

    /** 규칙이 하나도 없는 저장소 */
    RuleStore EMPTY = host -> List.of();

    /** 호스트(소문자, www 포함 그대로)에 등록된 규칙. 없으면 빈 리스트 */
    List<DomainRule> rulesFor(String host);

    /** 레이아웃 시그니처로 매칭되는 규칙 */
    default List<DomainRule> patternRules() {
        return rulesFor(DomainRule.PATTERN_HOST);
    }
}

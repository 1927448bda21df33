package com.dealerscout.core.llm;

/** 단일 턴 채팅 완성 클라이언트 */
@FunctionalInterface
public interface LlmClient {

    /**
     * @param systemPrompt 지시문
     * @param userContent  입력(압축된 HTML 등)
     * @return 모델 응답 본문 텍스트
     */
    String complete(String systemPrompt, String userContent) throws LlmException;
}

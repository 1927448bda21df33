package com.dealerscout.core.llm;

/** LLM 호출 실패(네트워크, 비-2xx, 응답 형식 오류) */
public class LlmException extends Exception {
    public LlmException(String message) { super(message); }
    public LlmException(String message, Throwable cause) { super(message, cause); }
}

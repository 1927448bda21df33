package com.dealerscout.core.pipeline;

/** URL 하나를 처리하는 파이프라인의 상태. FAILED는 어느 단계에서든 진입 가능 */
public enum PipelineState {
    INIT,
    FETCH_LIGHT,
    FETCH_BROWSER,
    SELECT_STRATEGY,
    EXTRACT,
    NORMALIZE,
    DEDUPE,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
}

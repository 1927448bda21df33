package com.dealerscout.core.http;

import java.util.List;

/** fetch 실패. reason으로 원인을 분류하고, diagnostics에 전송 단계별 이력을 담는다 */
public class FetchException extends Exception {

    public enum Reason {
        TIMEOUT,
        BLOCKED,
        DNS,
        HTTP_ERROR,
        RENDER_FAILURE
    }

    private final Reason reason;
    private final List<String> diagnostics;

    public FetchException(Reason reason, String message) {
        this(reason, message, null, List.of());
    }

    public FetchException(Reason reason, String message, Throwable cause) {
        this(reason, message, cause, List.of());
    }

    public FetchException(Reason reason, String message, Throwable cause, List<String> diagnostics) {
        super(message, cause);
        this.reason = (reason == null) ? Reason.HTTP_ERROR : reason;
        this.diagnostics = (diagnostics == null) ? List.of() : List.copyOf(diagnostics);
    }

    public Reason getReason() { return reason; }

    public List<String> getDiagnostics() { return diagnostics; }

    /** 기존 사유/원인은 유지하고 이력만 덧붙인 사본 */
    public FetchException withDiagnostics(List<String> trail) {
        return new FetchException(reason, getMessage(), getCause(), trail);
    }
}

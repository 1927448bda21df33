package com.dealerscout.core.normalize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 한 번의 추출(한 URL)에 대한 정규화 문맥.
 * diagnostics에는 버려진 레코드의 사유와 주소 경고가 쌓인다.
 */
public final class NormalizationContext {
    private final String dealerGroup;
    private final List<String> diagnostics = Collections.synchronizedList(new ArrayList<>());

    public NormalizationContext(String dealerGroup) {
        this.dealerGroup = (dealerGroup == null || dealerGroup.isBlank()) ? null : dealerGroup.trim();
    }

    public static NormalizationContext none() { return new NormalizationContext(null); }

    public String getDealerGroup() { return dealerGroup; }

    public void note(String message) { diagnostics.add(message); }

    public List<String> getDiagnostics() {
        synchronized (diagnostics) {
            return List.copyOf(diagnostics);
        }
    }
}

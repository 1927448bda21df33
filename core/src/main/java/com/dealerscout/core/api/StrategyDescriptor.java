package com.dealerscout.core.api;

import com.dealerscout.core.model.RawRecord;
import com.dealerscout.core.model.Tier;

import java.util.List;

/**
 * 추출 전략 계약. canHandle/extract는 (html, url)의 순수 함수여야 한다(부수효과 없음).
 * 구현체는 상태를 갖지 않으며 프로세스 시작 시 한 번 등록된다.
 */
public interface StrategyDescriptor {

    /** 로그/진단/출처 표기에 쓰는 고유 이름 */
    String name();

    Tier tier();

    /** 이 페이지를 처리할 수 있으면 true. 예외는 레지스트리가 "불일치"로 취급한다 */
    boolean canHandle(String html, String url);

    /** 레코드 추출. 예외나 빈 리스트는 "매칭됐지만 비어있음"으로 처리된다 */
    List<RawRecord> extract(String html, String url) throws Exception;
}

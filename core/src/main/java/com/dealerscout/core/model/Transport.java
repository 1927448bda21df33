package com.dealerscout.core.model;

/** HTML을 가져온 전송 수단: 단순 HTTP(LIGHT) 또는 헤드리스 브라우저 렌더링(BROWSER) */
public enum Transport {
    LIGHT,
    BROWSER
}

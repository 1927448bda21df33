package com.dealerscout.core.api;

import com.dealerscout.core.http.FetchException;
import com.dealerscout.core.http.FetchOptions;
import com.dealerscout.core.model.FetchResult;

/** URL의 HTML을 가져오는 최소 계약. 실패는 사유가 담긴 FetchException */
public interface IFetcher extends AutoCloseable {

    FetchResult fetch(String url, FetchOptions options) throws FetchException;

    default FetchResult fetch(String url) throws FetchException {
        return fetch(url, FetchOptions.defaults());
    }

    @Override default void close() throws Exception {}
}

// IHttpProber.java
package com.sitewatch.core.api;

import com.sitewatch.core.http.TransportException;
import com.sitewatch.core.model.HttpResponseData;
import com.sitewatch.core.model.RunConfig;

/**
 * HTTP 수집 최소 계약: GET 한 번. 상태 코드를 받았으면(2xx 여부 무관) 응답을,
 * 해석 가능한 응답이 없으면 TransportException 을 던진다.
 */
@FunctionalInterface
public interface IHttpProber {
    HttpResponseData fetch(String target, RunConfig cfg) throws TransportException;
}

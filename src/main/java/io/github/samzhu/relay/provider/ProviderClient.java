package io.github.samzhu.relay.provider;

import io.github.samzhu.relay.routing.Protocol;
import io.github.samzhu.relay.routing.ProviderProfile;
import io.github.samzhu.relay.transform.NativeRequest;

/**
 * Provider 呼叫
 *
 * <p>unary 請求在回傳前已讀完整個回應；串流請求在收到回應標頭後即回傳，
 * 內容由呼叫端逐片拉取。
 */
public interface ProviderClient {

    Protocol protocol();

    /**
     * @throws ProviderHttpException    非 2xx 或連線失敗（重試用盡後）
     * @throws ProviderTimeoutException 逾時（重試用盡後）
     */
    ProviderStream open(ProviderProfile provider, NativeRequest request);
}

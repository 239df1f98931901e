package io.github.samzhu.relay.transform;

import io.github.samzhu.relay.model.CanonicalRequest;
import io.github.samzhu.relay.routing.Protocol;
import io.github.samzhu.relay.routing.ProviderProfile;

/**
 * Canonical 請求轉 provider 原生請求
 *
 * <p>每個協定一個實作，由 {@link RequestTransformers} 依協定分派。
 */
public interface RequestTransformer {

    Protocol protocol();

    /**
     * @param request  canonical 請求
     * @param provider 目標 provider（clamp 上限、profile ARN）
     * @param model    路由決策選出的 provider 端模型名稱
     * @throws TransformValidationException 請求內容無法以該協定表達
     */
    NativeRequest transform(CanonicalRequest request, ProviderProfile provider, String model);
}

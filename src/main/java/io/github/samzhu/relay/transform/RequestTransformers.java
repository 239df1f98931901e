package io.github.samzhu.relay.transform;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import io.github.samzhu.relay.model.CanonicalRequest;
import io.github.samzhu.relay.routing.Protocol;
import io.github.samzhu.relay.routing.ProviderProfile;

/**
 * 依 provider 協定選擇 {@link RequestTransformer}
 */
@Component
public class RequestTransformers {

    private final Map<Protocol, RequestTransformer> byProtocol = new EnumMap<>(Protocol.class);

    public RequestTransformers(List<RequestTransformer> transformers) {
        for (RequestTransformer transformer : transformers) {
            byProtocol.put(transformer.protocol(), transformer);
        }
    }

    public NativeRequest transform(CanonicalRequest request, ProviderProfile provider, String model) {
        RequestTransformer transformer = byProtocol.get(provider.protocol());
        if (transformer == null) {
            throw new IllegalStateException("No request transformer for protocol " + provider.protocol());
        }
        return transformer.transform(request, provider, model);
    }
}

package io.github.samzhu.relay.provider;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import io.github.samzhu.relay.routing.Protocol;
import io.github.samzhu.relay.routing.ProviderProfile;
import io.github.samzhu.relay.transform.NativeRequest;

/**
 * 依 provider 協定選擇 {@link ProviderClient}
 */
@Component
public class ProviderClients {

    private final Map<Protocol, ProviderClient> byProtocol = new EnumMap<>(Protocol.class);

    public ProviderClients(List<ProviderClient> clients) {
        for (ProviderClient client : clients) {
            byProtocol.put(client.protocol(), client);
        }
    }

    public ProviderStream open(ProviderProfile provider, NativeRequest request) {
        ProviderClient client = byProtocol.get(provider.protocol());
        if (client == null) {
            throw new IllegalStateException("No provider client for protocol " + provider.protocol());
        }
        return client.open(provider, request);
    }
}

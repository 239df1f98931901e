package io.github.samzhu.relay.transform;

import com.fasterxml.jackson.databind.node.ObjectNode;

import io.github.samzhu.relay.routing.Protocol;

/**
 * Provider 原生請求
 *
 * @param protocol 目標協定
 * @param model    provider 端的模型名稱（Gemini 放在 URL 路徑中）
 * @param body     JSON 請求本體
 * @param stream   是否要求串流回應
 */
public record NativeRequest(Protocol protocol, String model, ObjectNode body, boolean stream) {
}

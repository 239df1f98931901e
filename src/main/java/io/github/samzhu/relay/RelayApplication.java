package io.github.samzhu.relay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * LLM Relay 應用程式入口
 *
 * <p>對外提供 Anthropic Messages 相容 API，後端可接多種 provider：
 * <ul>
 *   <li>OpenAI 相容的 chat completions</li>
 *   <li>Gemini generateContent</li>
 *   <li>CodeWhisperer generateAssistantResponse（二進位 event stream）</li>
 * </ul>
 * 依請求類別與權重選擇 provider，失敗時自動 failover，並修復模型以純文字輸出的 tool call。
 *
 * @see <a href="https://docs.anthropic.com/en/api/messages">Claude Messages API</a>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RelayApplication {

	public static void main(String[] args) {
		SpringApplication.run(RelayApplication.class, args);
	}

}

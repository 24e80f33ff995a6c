package com.questhub.engineservice.infrastructure.client.ai;

import com.questhub.web.common.ApiResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * 调用 AI 叙事 / 插画服务的 Feign Client。
 * 服务地址由 questhub.ai.url 指定；超时在 spring.cloud.openfeign.client.config.ai-service 中配置。
 */
@FeignClient(
        name = "ai-service",
        url = "${questhub.ai.url}",
        path = "/api"
)
public interface NarrativeClient {

    /**
     * 生成一段剧情文本。
     */
    @PostMapping("/narrative")
    ApiResponse<NarrativeResponse> generateNarrative(@RequestBody NarrativeRequest request);

    /**
     * 生成场景插画，返回图片地址。
     */
    @PostMapping("/images")
    ApiResponse<ImageResponse> generateImage(@RequestBody ImageRequest request);
}

package com.questhub.engineservice.application.ai;

import com.questhub.engineservice.infrastructure.client.ai.ImageRequest;
import com.questhub.engineservice.infrastructure.client.ai.ImageResponse;
import com.questhub.engineservice.infrastructure.client.ai.NarrativeClient;
import com.questhub.engineservice.infrastructure.client.ai.NarrativeRequest;
import com.questhub.engineservice.infrastructure.client.ai.NarrativeResponse;
import com.questhub.web.common.ApiResponse;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * AI 叙事服务（引擎调用 AI 服务的统一入口）。
 * 通过 Feign Client 调用 ai-service，并在此处统一做熔断。
 * 不做兜底：失败一律抛出，由命令管线包装为 CommandExecutionException，保证不提交部分结果。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NarrativeService {

    private final NarrativeClient narrativeClient;

    /**
     * 生成剧情文本。
     *
     * @throws IllegalStateException 服务返回失败或内容为空
     */
    @CircuitBreaker(name = "aiService")
    public String generateNarrative(NarrativeRequest request) {
        ApiResponse<NarrativeResponse> resp = narrativeClient.generateNarrative(request);
        if (resp == null || !resp.isSuccess() || resp.data() == null || resp.data().getText() == null) {
            log.warn("剧情生成失败: sessionId={}, response={}", request.getSessionId(), resp);
            throw new IllegalStateException("AI_NARRATIVE_FAILED: " + (resp == null ? "no response" : resp.message()));
        }
        return resp.data().getText();
    }

    /**
     * 生成场景插画。
     *
     * @return 图片地址
     * @throws IllegalStateException 服务返回失败或地址为空
     */
    @CircuitBreaker(name = "aiService")
    public String generateImage(ImageRequest request) {
        ApiResponse<ImageResponse> resp = narrativeClient.generateImage(request);
        if (resp == null || !resp.isSuccess() || resp.data() == null || resp.data().getUrl() == null) {
            log.warn("插画生成失败: sessionId={}, response={}", request.getSessionId(), resp);
            throw new IllegalStateException("AI_IMAGE_FAILED: " + (resp == null ? "no response" : resp.message()));
        }
        return resp.data().getUrl();
    }
}

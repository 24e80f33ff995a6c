package com.questhub.engineservice.infrastructure.client.ai;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImageRequest {
    private String sessionId;
    private String prompt;
    private String style;
}

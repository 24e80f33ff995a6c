package com.questhub.engineservice.infrastructure.client.ai;

import lombok.Data;

@Data
public class ImageResponse {
    private String url;
}

package com.questhub.engineservice.infrastructure.client.ai;

import lombok.Data;

@Data
public class NarrativeResponse {
    private String text;
}
